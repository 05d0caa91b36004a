package com.jz.honeypot.engage;

import com.jz.honeypot.config.EngagementProperties;
import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.RankedChoice;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.Stage;
import com.jz.honeypot.domain.Tactic;
import com.jz.honeypot.domain.TacticStreak;
import com.jz.honeypot.domain.Theme;
import com.jz.honeypot.engage.model.EngagementModel;
import com.jz.honeypot.engage.model.HandFeatures;
import com.jz.honeypot.engage.model.Intent;
import com.jz.honeypot.engage.model.IntentClassifier;
import com.jz.honeypot.engage.model.VectorMath;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * 编码 → 注意力 → 状态更新 → 意图 → 打分 → 温度采样。
 * 数值流程任何异常都降级为均匀随机，绝不向上抛。
 */
@Slf4j
@Component
public class ResponseRanker {

    private final EngagementModel model;
    private final EngagementProperties props;
    private final Counter fallbackCounter;

    public ResponseRanker(EngagementModel model, EngagementProperties props, MeterRegistry registry) {
        this.model = model;
        this.props = props;
        this.fallbackCounter = Counter.builder("honeypot.ranker.fallback.count")
                .description("ranker degraded to uniform random")
                .register(registry);
    }

    /**
     * @param pool 非空候选池（已去掉用过的）
     */
    public RankingOutcome rank(SessionState s, String message, Stage stage, Tactic tactic,
                               List<CandidateResponse> pool, int streakLimit, Random random) {
        if (pool == null || pool.isEmpty()) {
            throw new IllegalArgumentException("candidate pool is empty");
        }
        boolean[] excluded = streakExclusions(pool, s.getTacticStreak(), streakLimit);

        if (!props.getRanker().isEnabled()) {
            return fallback(s, pool, excluded, random, "disabled");
        }
        try {
            return score(s, message, stage, tactic, pool, excluded, random);
        } catch (RuntimeException e) {
            log.warn("Ranker degraded, sessionId={} err={}", s.getSessionId(), e.toString());
            return fallback(s, pool, excluded, random, "error");
        }
    }

    private RankingOutcome score(SessionState s, String message, Stage stage, Tactic tactic,
                                 List<CandidateResponse> pool, boolean[] excluded, Random random) {
        EngagementProperties.Ranker cfg = props.getRanker();

        double[] encoded = model.getEncoder().encode(message);
        double[] contextual = model.getAttention().forward(encoded);
        double[] hidden = model.getStateCell().step(contextual, s.getHiddenState());
        double[] intents = model.getIntentClassifier().classify(contextual, message);
        Tactic intentTactic = IntentClassifier.top(intents).tactic();

        int n = pool.size();
        double[] scores = new double[n];
        for (int i = 0; i < n; i++) {
            CandidateResponse c = pool.get(i);
            double[] emb = c.getEmbedding() != null ? c.getEmbedding() : model.getEncoder().encode(c.getText());
            double[] hand = HandFeatures.compute(c, stage, tactic, s.getLastTheme());
            double raw = model.getScorer().score(contextual, emb, hidden, intents, hand);
            if (stageAligned(c.getTheme(), stage)) raw += cfg.getStageBonus();
            if (intentTactic != null && c.getTacticAffinity() == intentTactic) raw += cfg.getIntentBonus();
            if (c.isProbe()) raw += cfg.getProbeBonus();
            scores[i] = raw;
        }
        if (!VectorMath.isFinite(scores) || !VectorMath.isFinite(hidden)) {
            throw new IllegalStateException("non-finite score");
        }

        // 被降权的候选排到所有正常候选之后
        double floor = Double.POSITIVE_INFINITY;
        for (int i = 0; i < n; i++) {
            if (!excluded[i]) floor = Math.min(floor, scores[i]);
        }
        for (int i = 0; i < n; i++) {
            if (excluded[i]) scores[i] = Math.min(scores[i], floor - 1.0);
        }

        double[] probs = sampling(scores, excluded, cfg.getTemperature());
        int pick = indexOfProbe(pool);
        if (pick < 0) pick = draw(probs, random);

        List<RankedChoice> ranking = ranking(pool, scores, probs, excluded);
        log.debug("Ranked sessionId={} pool={} chosen={} top={}",
                s.getSessionId(), n, pool.get(pick).getId(), ranking.get(0).responseId());
        return new RankingOutcome(pool.get(pick), ranking, hidden, intents, false);
    }

    private RankingOutcome fallback(SessionState s, List<CandidateResponse> pool, boolean[] excluded,
                                    Random random, String reason) {
        fallbackCounter.increment();
        log.warn("Ranker fallback to uniform random, sessionId={} reason={}", s.getSessionId(), reason);
        int n = pool.size();
        int allowed = 0;
        for (boolean x : excluded) if (!x) allowed++;
        double[] probs = new double[n];
        for (int i = 0; i < n; i++) probs[i] = excluded[i] ? 0.0 : 1.0 / allowed;

        int pick = indexOfProbe(pool);
        if (pick < 0) pick = draw(probs, random);
        return new RankingOutcome(pool.get(pick), ranking(pool, new double[n], probs, excluded), null, null, true);
    }

    /**
     * 连击达到上限时，同标签候选全部不参与采样；前提是池里还有别的选择。
     */
    static boolean[] streakExclusions(List<CandidateResponse> pool, TacticStreak streak, int limit) {
        boolean[] excluded = new boolean[pool.size()];
        if (streak == null || streak.getTag() == null || streak.getCount() < limit) {
            return excluded;
        }
        boolean alternative = false;
        for (CandidateResponse c : pool) {
            if (!streak.getTag().equals(c.tacticTag())) {
                alternative = true;
                break;
            }
        }
        if (!alternative) return excluded;
        for (int i = 0; i < pool.size(); i++) {
            excluded[i] = streak.reached(pool.get(i).tacticTag(), limit);
        }
        return excluded;
    }

    static boolean stageAligned(Theme theme, Stage stage) {
        if (theme == null) return false;
        return switch (theme) {
            case CONFUSION -> stage.isEarly();
            case PROBING, STALLING -> stage.isMiddle();
            case EXTRACTION -> stage.isLate();
            default -> false;
        };
    }

    static double[] sampling(double[] scores, boolean[] excluded, double temperature) {
        double t = temperature > 0 ? temperature : 1.0;
        double max = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < scores.length; i++) {
            if (!excluded[i]) max = Math.max(max, scores[i] / t);
        }
        double[] p = new double[scores.length];
        double sum = 0.0;
        for (int i = 0; i < scores.length; i++) {
            if (excluded[i]) continue;
            p[i] = Math.exp(scores[i] / t - max);
            sum += p[i];
        }
        for (int i = 0; i < p.length; i++) p[i] /= sum;
        return p;
    }

    static int draw(double[] probs, Random random) {
        double r = random.nextDouble();
        double acc = 0.0;
        int last = -1;
        for (int i = 0; i < probs.length; i++) {
            if (probs[i] <= 0) continue;
            last = i;
            acc += probs[i];
            if (r < acc) return i;
        }
        return last;
    }

    private static int indexOfProbe(List<CandidateResponse> pool) {
        for (int i = 0; i < pool.size(); i++) {
            if (pool.get(i).isProbe()) return i;
        }
        return -1;
    }

    private static List<RankedChoice> ranking(List<CandidateResponse> pool, double[] scores,
                                              double[] probs, boolean[] excluded) {
        List<RankedChoice> out = new ArrayList<>(pool.size());
        for (int i = 0; i < pool.size(); i++) {
            out.add(new RankedChoice(pool.get(i).getId(), scores[i], probs[i], excluded[i]));
        }
        out.sort(Comparator.comparingDouble(RankedChoice::rawScore).reversed());
        return out;
    }

    /** 诊断用：意图分布转成 key → 概率 */
    public static Map<String, Double> intentMap(double[] intents) {
        if (intents == null) return Map.of();
        Map<String, Double> m = new LinkedHashMap<>();
        for (Intent i : Intent.values()) m.put(i.key(), intents[i.ordinal()]);
        return m;
    }
}
