package com.jz.honeypot.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * processTurn 的输出：回复、更新后的会话，以及诊断信息。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TurnResult {
    private String replyText;
    private SessionState session;
    private boolean scamConfirmed;
    private boolean readyToReport;

    // ---- 诊断 ----
    private int scoreDelta;
    private List<String> matchedCategories;
    private Stage stage;
    private Tactic tactic;
    private int confidencePercent;
    private String replyId;
    private Map<String, Double> intentDistribution;
    private boolean rankerDegraded;
    private boolean probeUsed;
}
