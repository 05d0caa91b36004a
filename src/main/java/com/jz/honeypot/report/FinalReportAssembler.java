package com.jz.honeypot.report;

import com.jz.honeypot.detect.RiskScorer;
import com.jz.honeypot.domain.IntelKind;
import com.jz.honeypot.domain.QualityMetrics;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.dto.FinalReportDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 从会话快照组装结案报文。必须在会话锁内调用，拿到的是当时的一致视图。
 */
@Component
@RequiredArgsConstructor
public class FinalReportAssembler {

    private final RiskScorer riskScorer;
    private final AgentNotesBuilder notesBuilder;

    public FinalReportDTO assemble(SessionState s, long nowMillis) {
        return FinalReportDTO.builder()
                .sessionId(s.getSessionId())
                .scamDetected(s.isScamConfirmed())
                .scamType(s.getScamType())
                .confidenceLevel(riskScorer.confidencePercent(s.getCumulativeRiskScore()) / 100.0)
                .totalMessagesExchanged(s.getMessagesExchanged())
                .extractedIntelligence(intelligence(s))
                .engagementMetrics(engagementMetrics(s, nowMillis))
                .agentNotes(notesBuilder.build(s, nowMillis))
                .build();
    }

    /** 每种情报都输出，没有的给空列表 */
    public static Map<String, List<String>> intelligence(SessionState s) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (IntelKind kind : IntelKind.values()) {
            Set<String> values = s.getIntelligence().get(kind);
            out.put(kind.field(), values == null ? List.of() : new ArrayList<>(values));
        }
        return out;
    }

    public static Map<String, Integer> engagementMetrics(SessionState s, long nowMillis) {
        QualityMetrics q = s.getQualityMetrics();
        Map<String, Integer> m = new LinkedHashMap<>();
        m.put("turns", q.getTurns());
        m.put("questionsAsked", q.getQuestionsAsked());
        m.put("investigativeProbes", q.getInvestigativeProbes());
        m.put("redFlagAcks", q.getRedFlagAcks());
        m.put("elicitationAttempts", q.getElicitationAttempts());
        m.put("totalMessagesExchanged", s.getMessagesExchanged());
        m.put("engagementDurationSeconds", (int) (s.elapsedMillis(nowMillis) / 1000));
        return m;
    }
}
