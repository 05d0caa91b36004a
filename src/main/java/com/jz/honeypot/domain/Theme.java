package com.jz.honeypot.domain;

/**
 * 回复模板的主题标签：决定阶段加分，也决定命中哪个质量计数器。
 */
public enum Theme {
    CONFUSION,
    PROBING,
    RED_FLAG,
    STALLING,
    FEAR,
    COMPLIANCE,
    EXTRACTION,
    QUALITY_PROBE
}
