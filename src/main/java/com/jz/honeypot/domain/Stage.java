package com.jz.honeypot.domain;

/**
 * 受害者人设的阶段，严格有序，只能前进。
 */
public enum Stage {
    CONFUSED,
    VERIFYING,
    SUSPICIOUS,
    COOPERATIVE,
    EXTRACTING;

    public boolean isEarly() {
        return this == CONFUSED || this == VERIFYING;
    }

    public boolean isMiddle() {
        return this == SUSPICIOUS || this == COOPERATIVE;
    }

    public boolean isLate() {
        return this == EXTRACTING;
    }

    public boolean isTerminal() {
        return this == EXTRACTING;
    }

    /** 下一个阶段；终态返回自身 */
    public Stage next() {
        return isTerminal() ? this : values()[ordinal() + 1];
    }

    public boolean isAfter(Stage other) {
        return ordinal() > other.ordinal();
    }
}
