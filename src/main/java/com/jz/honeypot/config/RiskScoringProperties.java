package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 风险打分参数（honeypot.risk.*）
 */
@Data
@ConfigurationProperties(prefix = "honeypot.risk")
public class RiskScoringProperties {

    /** 累计分达到该值即确认诈骗，之后不再回退 */
    private int confirmationThreshold = 40;

    /** 单轮命中不同类别数达到 escalationMinCategories 时的固定加分 */
    private int escalationBonus = 10;

    private int escalationMinCategories = 2;

    /** 首轮纯问候按中性处理 */
    private boolean suppressFirstTurnGreeting = true;

    /** 置信度上限（百分比） */
    private int maxConfidencePercent = 99;

    /** 关闭的信号层 id（按部署裁剪层数） */
    private Set<String> disabledLayers = new LinkedHashSet<>();
}
