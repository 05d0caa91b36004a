package com.jz.honeypot.domain;

/**
 * 排序结果中的一项。
 */
public record RankedChoice(String responseId, double rawScore, double probability, boolean demoted) {
}
