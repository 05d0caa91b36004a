package com.jz.honeypot.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 结案回调的报文。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalReportDTO {
    private String sessionId;
    private boolean scamDetected;
    private String scamType;
    /** 0~1 */
    private double confidenceLevel;
    private int totalMessagesExchanged;
    private Map<String, List<String>> extractedIntelligence;
    private Map<String, Integer> engagementMetrics;
    private String agentNotes;
}
