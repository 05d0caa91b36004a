package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 质量门槛（honeypot.quality.*）
 */
@Data
@ConfigurationProperties(prefix = "honeypot.quality")
public class QualityProperties {
    private int minTurns = 8;
    private int minQuestions = 5;
    private int minInvestigative = 3;
    private int minRedFlags = 5;
    private int minElicitation = 5;

    /** 从第几轮开始允许插入探针 */
    private int probeStartTurn = 4;

    /** 结案前的最少轮数 */
    private int reportMinTurns = 8;

    /** 结案前的最短会话时长（秒） */
    private long reportMinDurationSeconds = 60;
}
