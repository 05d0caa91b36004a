package com.jz.honeypot.report;

import com.jz.honeypot.config.RiskScoringProperties;
import com.jz.honeypot.detect.RiskScorer;
import com.jz.honeypot.detect.ScamTypeClassifier;
import com.jz.honeypot.domain.IntelKind;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.dto.FinalReportDTO;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class FinalReportAssemblerTest {

    private final FinalReportAssembler assembler = new FinalReportAssembler(
            new RiskScorer(new RiskScoringProperties(), new ScamTypeClassifier()), new AgentNotesBuilder());

    @Test
    void reportCarriesSessionSnapshot() {
        SessionState s = SessionState.create("r1", 10_000L);
        s.setCumulativeRiskScore(40);
        s.setScamConfirmed(true);
        s.setScamType("impersonation");
        s.setMessagesExchanged(18);
        s.getQualityMetrics().setTurns(9);
        s.getQualityMetrics().setQuestionsAsked(6);
        s.getQualityMetrics().setInvestigativeProbes(3);
        s.getQualityMetrics().setRedFlagAcks(5);
        s.getQualityMetrics().setElicitationAttempts(5);
        s.mergeIntelligence(Map.of(IntelKind.UPI_ID, List.of("x@ybl")));

        FinalReportDTO report = assembler.assemble(s, 100_000L);

        assertThat(report.getSessionId()).isEqualTo("r1");
        assertThat(report.isScamDetected()).isTrue();
        assertThat(report.getScamType()).isEqualTo("impersonation");
        assertThat(report.getConfidenceLevel()).isEqualTo(0.66);
        assertThat(report.getTotalMessagesExchanged()).isEqualTo(18);
        assertThat(report.getAgentNotes()).startsWith("Classification: Impersonation");
        assertThat(report.getEngagementMetrics())
                .containsEntry("turns", 9)
                .containsEntry("questionsAsked", 6)
                .containsEntry("investigativeProbes", 3)
                .containsEntry("redFlagAcks", 5)
                .containsEntry("elicitationAttempts", 5)
                .containsEntry("totalMessagesExchanged", 18)
                .containsEntry("engagementDurationSeconds", 90);
    }

    @Test
    void everyIntelFieldIsPresent() {
        SessionState s = SessionState.create("r2", 0L);
        s.mergeIntelligence(Map.of(IntelKind.PHONE_NUMBER, List.of("+919876543210")));

        Map<String, List<String>> intel = FinalReportAssembler.intelligence(s);

        assertThat(intel).containsOnlyKeys("phoneNumbers", "upiIds", "bankAccounts", "phishingLinks",
                "emailAddresses", "ifscCodes", "caseIds", "suspiciousKeywords");
        assertThat(intel.get("phoneNumbers")).containsExactly("+919876543210");
        assertThat(intel.get("upiIds")).isEmpty();
    }
}
