package com.jz.honeypot.domain;

import lombok.Data;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 会话质量计数器，以及探针模板轮转用的游标。
 */
@Data
public class QualityMetrics {
    private int turns;
    /** 去重后的提问回复数 */
    private int questionsAsked;
    private int investigativeProbes;
    private int redFlagAcks;
    private int elicitationAttempts;

    /** 已计入 questionsAsked 的回复文本指纹 */
    private Set<String> askedQuestions = new LinkedHashSet<>();

    private int redFlagCursor;
    private int investigativeCursor;
    private int elicitationCursor;
    private int connectorCursor;

    public void recordQuestion(String replyText) {
        if (replyText == null || !replyText.contains("?")) return;
        String key = replyText.trim().toLowerCase();
        if (askedQuestions.add(key)) {
            questionsAsked++;
        }
    }

    public int nextRedFlagCursor() {
        return redFlagCursor++;
    }

    public int nextInvestigativeCursor() {
        return investigativeCursor++;
    }

    public int nextElicitationCursor() {
        return elicitationCursor++;
    }

    public int nextConnectorCursor() {
        return connectorCursor++;
    }
}
