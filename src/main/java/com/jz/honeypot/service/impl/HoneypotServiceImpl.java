package com.jz.honeypot.service.impl;

import com.jz.honeypot.detect.RiskScorer;
import com.jz.honeypot.domain.IntelKind;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.TurnResult;
import com.jz.honeypot.domain.dto.FinalReportDTO;
import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import com.jz.honeypot.domain.dto.HoneypotRequest;
import com.jz.honeypot.domain.dto.SessionSummaryDTO;
import com.jz.honeypot.engine.EngagementEngine;
import com.jz.honeypot.extract.IntelligenceExtractor;
import com.jz.honeypot.report.FinalReportAssembler;
import com.jz.honeypot.report.ReportDispatcher;
import com.jz.honeypot.service.HoneypotService;
import com.jz.honeypot.session.SessionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

@Slf4j
@Service
@RequiredArgsConstructor
public class HoneypotServiceImpl implements HoneypotService {

    private final SessionStore sessionStore;
    private final EngagementEngine engine;
    private final IntelligenceExtractor extractor;
    private final FinalReportAssembler reportAssembler;
    private final ReportDispatcher reportDispatcher;
    private final RiskScorer riskScorer;
    private final Clock clock;

    private record Outcome(TurnResult result, FinalReportDTO report) {
    }

    @Override
    public HoneypotReplyDTO handle(HoneypotRequest request) {
        String sessionId = request.getSessionId();
        String text = request.getMessage().getText();
        Map<IntelKind, Set<String>> intel = extractor.extract(text);

        Outcome outcome = sessionStore.withSession(sessionId, s -> {
            if (s.isFresh() && request.getConversationHistory() != null && !request.getConversationHistory().isEmpty()) {
                replayHistory(s, request.getConversationHistory());
            }
            s.mergeIntelligence(intel);
            TurnResult result = engine.processTurn(s, text);
            if (!s.getTriggeredCategories().isEmpty()) {
                s.mergeIntelligence(Map.of(IntelKind.SUSPICIOUS_KEYWORD, s.getTriggeredCategories()));
            }
            FinalReportDTO report = null;
            // 报文在锁内组装，保证是同一时刻的快照
            if (result.isReadyToReport() && s.tryFinalize()) {
                report = reportAssembler.assemble(s, clock.millis());
                log.info("Session finalized, sessionId={} turn={} type={}", sessionId, s.getTurnIndex(), s.getScamType());
            }
            return new Outcome(result, report);
        });

        if (outcome.report() != null) {
            reportDispatcher.dispatch(outcome.report());
        }
        return HoneypotReplyDTO.success(outcome.result().getReplyText());
    }

    @Override
    public Optional<SessionSummaryDTO> summary(String sessionId) {
        long now = clock.millis();
        // 在会话锁内拷贝出快照，避免与正在处理的轮次并发读写
        return sessionStore.read(sessionId, s -> SessionSummaryDTO.builder()
                .sessionId(s.getSessionId())
                .stage(s.getStage().name())
                .turnIndex(s.getTurnIndex())
                .cumulativeRiskScore(s.getCumulativeRiskScore())
                .confidencePercent(riskScorer.confidencePercent(s.getCumulativeRiskScore()))
                .scamConfirmed(s.isScamConfirmed())
                .scamType(s.getScamType())
                .reported(s.isReported())
                .triggeredCategories(new ArrayList<>(s.getTriggeredCategories()))
                .engagementMetrics(FinalReportAssembler.engagementMetrics(s, now))
                .extractedIntelligence(FinalReportAssembler.intelligence(s))
                .build());
    }

    private void replayHistory(SessionState s, List<HoneypotRequest.Message> history) {
        List<String> scammerTexts = new ArrayList<>();
        int others = 0;
        for (HoneypotRequest.Message m : history) {
            if (m == null) continue;
            if (m.fromScammer()) {
                String t = m.getText() == null ? "" : m.getText();
                scammerTexts.add(t);
                s.mergeIntelligence(extractor.extract(t));
            } else {
                others++;
            }
        }
        engine.primeFromHistory(s, scammerTexts, others);
    }
}
