package com.jz.honeypot.report;

import com.jz.honeypot.domain.IntelKind;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AgentNotesBuilderTest {

    private final AgentNotesBuilder builder = new AgentNotesBuilder();

    @Test
    void summarisesAnEngagedSession() {
        SessionState s = SessionState.create("n1", 0L);
        s.setScamType("upi_fraud");
        s.getTriggeredCategories().addAll(List.of("payment_request", "bank_detail"));
        s.setMessagesExchanged(6);
        s.mergeIntelligence(Map.of(
                IntelKind.UPI_ID, List.of("refund.desk@paytm"),
                IntelKind.PHONE_NUMBER, List.of("+919876543210"),
                IntelKind.IFSC_CODE, List.of("SBIN0001234")));
        s.getObservedTactics().addAll(List.of("urgency", "payment"));
        s.setStage(Stage.COOPERATIVE);

        String notes = builder.build(s, 75_400L);

        assertThat(notes).isEqualTo("Classification: Upi Fraud"
                + " | Detected signals: bank detail, payment request"
                + " | Messages exchanged: 6"
                + " | Engagement duration: 75s"
                + " | Extracted intelligence: 1 phoneNumbers, 1 upiIds"
                + " | Scammer tactics observed: payment, urgency"
                + " | Engagement reached stage 4/5 (cooperative)");
    }

    @Test
    void freshSessionStillGetsNotes() {
        String notes = builder.build(SessionState.create("n2", 1_000L), 1_000L);

        assertThat(notes).isEqualTo("Classification: Unknown"
                + " | Messages exchanged: 0"
                + " | Engagement duration: 0s"
                + " | No concrete identifiers extracted"
                + " | Engagement reached stage 1/5 (confused)");
    }
}
