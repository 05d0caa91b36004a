package com.jz.honeypot.domain;

/**
 * 某一信号层在本轮命中的最高权重规则。
 *
 * @param layerId  信号层 id
 * @param weight   规则权重
 * @param category 类别标签（与层 id 一致，对外作为情报上下文）
 * @param rule     命中的规则标签
 */
public record SignalMatch(String layerId, int weight, String category, String rule) {
}
