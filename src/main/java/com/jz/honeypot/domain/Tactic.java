package com.jz.honeypot.domain;

/**
 * 骗子当前消息的主导手法（由主导信号类别映射而来）。
 */
public enum Tactic {
    OTP,
    ACCOUNT,
    PAYMENT,
    THREAT,
    TECH,
    COURIER,
    IDENTITY,
    URGENCY;

    public String tag() {
        return name().toLowerCase();
    }
}
