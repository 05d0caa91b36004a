package com.jz.honeypot.engine;

import com.jz.honeypot.detect.RiskAssessment;
import com.jz.honeypot.detect.RiskScorer;
import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.Stage;
import com.jz.honeypot.domain.Tactic;
import com.jz.honeypot.domain.TurnResult;
import com.jz.honeypot.engage.QualityTracker;
import com.jz.honeypot.engage.RankingOutcome;
import com.jz.honeypot.engage.ResponseCatalog;
import com.jz.honeypot.engage.ResponseRanker;
import com.jz.honeypot.engage.StageController;
import com.jz.honeypot.engage.TacticResolver;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * 单轮决策入口。调用方必须已持有该会话的独占锁；这里只做同步计算，不做 I/O。
 */
@Slf4j
@Service
public class EngagementEngine {

    private final RiskScorer riskScorer;
    private final StageController stageController;
    private final QualityTracker qualityTracker;
    private final ResponseRanker ranker;
    private final ResponseCatalog catalog;
    private final Clock clock;

    private final Timer turnTimer;
    private final Counter errorCounter;
    private final Counter confirmedCounter;

    public EngagementEngine(RiskScorer riskScorer,
                            StageController stageController,
                            QualityTracker qualityTracker,
                            ResponseRanker ranker,
                            ResponseCatalog catalog,
                            Clock clock,
                            MeterRegistry registry) {
        this.riskScorer = riskScorer;
        this.stageController = stageController;
        this.qualityTracker = qualityTracker;
        this.ranker = ranker;
        this.catalog = catalog;
        this.clock = clock;
        this.turnTimer = Timer.builder("honeypot.turn.latency")
                .description("processTurn latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        this.errorCounter = Counter.builder("honeypot.turn.error.count").register(registry);
        this.confirmedCounter = Counter.builder("honeypot.scam.confirmed.count").register(registry);
    }

    public TurnResult processTurn(SessionState s, String text) {
        return processTurn(s, text, ThreadLocalRandom.current());
    }

    /**
     * @param random 只用于最后一次采样；传固定种子即可复现
     */
    public TurnResult processTurn(SessionState s, String text, Random random) {
        long t0 = System.nanoTime();
        try {
            return doProcess(s, text, random);
        } catch (RuntimeException e) {
            errorCounter.increment();
            log.error("processTurn failed, sessionId={} turn={}", s.getSessionId(), s.getTurnIndex(), e);
            return fallbackResult(s);
        } finally {
            turnTimer.record(System.nanoTime() - t0, TimeUnit.NANOSECONDS);
        }
    }

    /**
     * 新会话带着历史记录进来时，先把历史里骗子的消息计分（不回复），让阶段和分数追上进度。
     */
    public void primeFromHistory(SessionState s, List<String> scammerMessages, int otherMessages) {
        for (String text : scammerMessages) {
            s.setTurnIndex(s.getTurnIndex() + 1);
            s.setMessagesExchanged(s.getMessagesExchanged() + 1);
            RiskAssessment a = riskScorer.assess(text, s.getTurnIndex());
            if (riskScorer.accumulate(s, a)) confirmedCounter.increment();
            stageController.advance(s);
            qualityTracker.recordTurn(s);
            Tactic tactic = TacticResolver.dominant(a.getMatches());
            if (tactic != null) s.getObservedTactics().add(tactic.tag());
        }
        s.setMessagesExchanged(s.getMessagesExchanged() + Math.max(0, otherMessages));
        s.setLastActivityAt(clock.millis());
        log.info("History replayed, sessionId={} scammerMessages={} score={} stage={}",
                s.getSessionId(), scammerMessages.size(), s.getCumulativeRiskScore(), s.getStage());
    }

    private TurnResult doProcess(SessionState s, String text, Random random) {
        s.setTurnIndex(s.getTurnIndex() + 1);
        s.setMessagesExchanged(s.getMessagesExchanged() + 1);

        if (text == null || text.isBlank()) {
            qualityTracker.recordTurn(s);
            return neutralResult(s);
        }

        RiskAssessment a = riskScorer.assess(text, s.getTurnIndex());
        if (riskScorer.accumulate(s, a)) confirmedCounter.increment();

        Stage stage = stageController.advance(s);
        Tactic tactic = TacticResolver.dominant(a.getMatches());
        if (tactic != null) s.getObservedTactics().add(tactic.tag());
        qualityTracker.recordTurn(s);

        CandidateResponse probe = qualityTracker.maybeProbe(s);
        List<CandidateResponse> pool = stageController.buildPool(s, tactic, probe);
        RankingOutcome outcome = ranker.rank(s, text, stage, tactic, pool, stageController.streakLimit(), random);
        CandidateResponse chosen = outcome.chosen();

        stageController.recordSelection(s, chosen);
        qualityTracker.recordReply(s, chosen);
        if (outcome.hiddenState() != null) {
            s.setHiddenState(outcome.hiddenState());
        }
        s.setMessagesExchanged(s.getMessagesExchanged() + 1);
        long now = clock.millis();
        s.setLastActivityAt(now);

        boolean ready = qualityTracker.isReady(s, now);
        log.debug("Turn done, sessionId={} turn={} delta={} score={} stage={} tactic={} reply={} probe={} ready={}",
                s.getSessionId(), s.getTurnIndex(), a.getDelta(), s.getCumulativeRiskScore(), stage,
                tactic, chosen.getId(), chosen.isProbe(), ready);

        return TurnResult.builder()
                .replyText(chosen.getText())
                .session(s)
                .scamConfirmed(s.isScamConfirmed())
                .readyToReport(ready)
                .scoreDelta(a.getDelta())
                .matchedCategories(a.getCategories())
                .stage(stage)
                .tactic(tactic)
                .confidencePercent(riskScorer.confidencePercent(s.getCumulativeRiskScore()))
                .replyId(chosen.getId())
                .intentDistribution(ResponseRanker.intentMap(outcome.intents()))
                .rankerDegraded(outcome.degraded())
                .probeUsed(chosen.isProbe())
                .build();
    }

    private TurnResult neutralResult(SessionState s) {
        s.setMessagesExchanged(s.getMessagesExchanged() + 1);
        long now = clock.millis();
        s.setLastActivityAt(now);
        return TurnResult.builder()
                .replyText(catalog.genericConfused(s.getTurnIndex()))
                .session(s)
                .scamConfirmed(s.isScamConfirmed())
                .readyToReport(qualityTracker.isReady(s, now))
                .scoreDelta(0)
                .matchedCategories(List.of())
                .stage(s.getStage())
                .confidencePercent(riskScorer.confidencePercent(s.getCumulativeRiskScore()))
                .intentDistribution(Map.of())
                .build();
    }

    private TurnResult fallbackResult(SessionState s) {
        return TurnResult.builder()
                .replyText(catalog.genericConfused(s.getTurnIndex()))
                .session(s)
                .scamConfirmed(s.isScamConfirmed())
                .readyToReport(false)
                .matchedCategories(List.of())
                .stage(s.getStage())
                .confidencePercent(riskScorer.confidencePercent(s.getCumulativeRiskScore()))
                .intentDistribution(Map.of())
                .rankerDegraded(true)
                .build();
    }
}
