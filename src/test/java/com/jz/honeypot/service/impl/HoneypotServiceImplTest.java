package com.jz.honeypot.service.impl;

import com.jz.honeypot.config.EngagementProperties;
import com.jz.honeypot.config.QualityProperties;
import com.jz.honeypot.config.RiskScoringProperties;
import com.jz.honeypot.config.SessionProperties;
import com.jz.honeypot.detect.RiskScorer;
import com.jz.honeypot.detect.ScamTypeClassifier;
import com.jz.honeypot.domain.dto.FinalReportDTO;
import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import com.jz.honeypot.domain.dto.HoneypotRequest;
import com.jz.honeypot.domain.dto.SessionSummaryDTO;
import com.jz.honeypot.engage.QualityTracker;
import com.jz.honeypot.engage.ResponseCatalog;
import com.jz.honeypot.engage.ResponseRanker;
import com.jz.honeypot.engage.StageController;
import com.jz.honeypot.engage.model.EngagementModel;
import com.jz.honeypot.engine.EngagementEngine;
import com.jz.honeypot.extract.IntelligenceExtractor;
import com.jz.honeypot.report.AgentNotesBuilder;
import com.jz.honeypot.report.FinalReportAssembler;
import com.jz.honeypot.report.ReportDispatcher;
import com.jz.honeypot.session.InMemorySessionStore;
import com.jz.honeypot.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class HoneypotServiceImplTest {

    private static final String PAY_AND_CALL = "Send money to refund.desk@paytm or call 9876543210";

    private MutableClock clock;
    private ReportDispatcher dispatcher;
    private HoneypotServiceImpl service;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        EngagementModel model = new EngagementModel(42L);
        ResponseCatalog catalog = new ResponseCatalog(model);
        EngagementProperties engagement = new EngagementProperties();
        RiskScorer scorer = new RiskScorer(new RiskScoringProperties(), new ScamTypeClassifier());
        EngagementEngine engine = new EngagementEngine(scorer,
                new StageController(engagement, catalog),
                new QualityTracker(new QualityProperties()),
                new ResponseRanker(model, engagement, registry),
                catalog, clock, registry);
        dispatcher = mock(ReportDispatcher.class);
        service = new HoneypotServiceImpl(
                new InMemorySessionStore(new SessionProperties(), clock, registry),
                engine,
                new IntelligenceExtractor(),
                new FinalReportAssembler(scorer, new AgentNotesBuilder()),
                dispatcher,
                scorer,
                clock);
    }

    private static HoneypotRequest request(String sessionId, String text, HoneypotRequest.Message... history) {
        HoneypotRequest req = new HoneypotRequest();
        req.setSessionId(sessionId);
        req.setMessage(message("scammer", text));
        req.setConversationHistory(new ArrayList<>(List.of(history)));
        return req;
    }

    private static HoneypotRequest.Message message(String sender, String text) {
        HoneypotRequest.Message m = new HoneypotRequest.Message();
        m.setSender(sender);
        m.setText(text);
        return m;
    }

    @Test
    void firstTurnRepliesAndRecordsIntel() {
        HoneypotReplyDTO reply = service.handle(request("svc-1", PAY_AND_CALL));

        assertThat(reply.getStatus()).isEqualTo("success");
        assertThat(reply.getReply()).isNotBlank();
        SessionSummaryDTO summary = service.summary("svc-1").orElseThrow();
        assertThat(summary.getTurnIndex()).isEqualTo(1);
        assertThat(summary.isScamConfirmed()).isTrue();
        assertThat(summary.getExtractedIntelligence().get("upiIds")).containsExactly("refund.desk@paytm");
        assertThat(summary.getExtractedIntelligence().get("phoneNumbers")).containsExactly("+919876543210");
        assertThat(summary.getExtractedIntelligence().get("suspiciousKeywords"))
                .containsExactlyInAnyOrderElementsOf(summary.getTriggeredCategories());
        verify(dispatcher, never()).dispatch(any());
    }

    @Test
    void historyIsReplayedOnlyForFreshSession() {
        service.handle(request("svc-2", "Why are you not answering?",
                message("scammer", "This is RBI. Your account will be blocked. Share OTP immediately."),
                message("user", "who is this?"),
                message("scammer", "Pay to fraud.cell@ybl now")));

        SessionSummaryDTO first = service.summary("svc-2").orElseThrow();
        assertThat(first.getTurnIndex()).isEqualTo(3);
        assertThat(first.getEngagementMetrics()).containsEntry("totalMessagesExchanged", 5);
        assertThat(first.getExtractedIntelligence().get("upiIds")).contains("fraud.cell@ybl");

        service.handle(request("svc-2", "hello?",
                message("scammer", "This is RBI. Your account will be blocked. Share OTP immediately.")));

        assertThat(service.summary("svc-2").orElseThrow().getTurnIndex()).isEqualTo(4);
    }

    @Test
    void reportIsDispatchedExactlyOnce() {
        for (int turn = 0; turn < 14; turn++) {
            clock.advance(Duration.ofSeconds(10));
            service.handle(request("svc-3", PAY_AND_CALL));
        }

        ArgumentCaptor<FinalReportDTO> sent = ArgumentCaptor.forClass(FinalReportDTO.class);
        verify(dispatcher, times(1)).dispatch(sent.capture());
        FinalReportDTO report = sent.getValue();
        assertThat(report.getSessionId()).isEqualTo("svc-3");
        assertThat(report.isScamDetected()).isTrue();
        assertThat(report.getScamType()).isEqualTo("upi_fraud");
        assertThat(report.getEngagementMetrics().get("turns")).isGreaterThanOrEqualTo(8);
        assertThat(report.getEngagementMetrics().get("engagementDurationSeconds")).isGreaterThanOrEqualTo(60);
        assertThat(report.getExtractedIntelligence().get("upiIds")).containsExactly("refund.desk@paytm");
        assertThat(service.summary("svc-3").orElseThrow().isReported()).isTrue();
    }

    @Test
    void summaryIsConsistentWhileTurnsAreProcessed() throws Exception {
        int turns = 150;
        List<Throwable> failures = new CopyOnWriteArrayList<>();
        AtomicBoolean writing = new AtomicBoolean(true);
        service.handle(request("svc-4", "Send money to agent0@paytm now"));
        Thread writer = new Thread(() -> {
            try {
                for (int i = 1; i < turns; i++) {
                    service.handle(request("svc-4", "Send money to agent" + i + "@paytm now"));
                }
            } catch (Throwable t) {
                failures.add(t);
            } finally {
                writing.set(false);
            }
        });
        writer.start();

        int reads = 0;
        while (writing.get()) {
            try {
                SessionSummaryDTO s = service.summary("svc-4").orElseThrow();
                assertThat(s.getExtractedIntelligence().get("upiIds")).hasSize(s.getTurnIndex());
                reads++;
            } catch (Throwable t) {
                failures.add(t);
                break;
            }
        }
        writer.join(10_000);

        assertThat(failures).isEmpty();
        assertThat(reads).isPositive();
        assertThat(service.summary("svc-4").orElseThrow().getTurnIndex()).isEqualTo(turns);
    }

    @Test
    void unknownSessionHasNoSummary() {
        assertThat(service.summary("ghost")).isEmpty();
    }
}
