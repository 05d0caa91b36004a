package com.jz.honeypot.domain.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SessionSummaryDTO {
    private String sessionId;
    private String stage;
    private int turnIndex;
    private int cumulativeRiskScore;
    private int confidencePercent;
    private boolean scamConfirmed;
    private String scamType;
    private boolean reported;
    private List<String> triggeredCategories;
    private Map<String, Integer> engagementMetrics;
    private Map<String, List<String>> extractedIntelligence;
}
