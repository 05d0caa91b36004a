package com.jz.honeypot.detect;

import com.jz.honeypot.config.RiskScoringProperties;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.SignalMatch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 多层加权打分：同层取最高，跨层相加，单轮命中多个类别再加一次升级奖励。
 */
@Slf4j
@Component
public class RiskScorer {

    private final RiskScoringProperties props;
    private final ScamTypeClassifier scamTypeClassifier;
    private final List<SignalLayer> layers;

    public RiskScorer(RiskScoringProperties props, ScamTypeClassifier scamTypeClassifier) {
        this.props = props;
        this.scamTypeClassifier = scamTypeClassifier;
        this.layers = SignalLayers.defaults().stream()
                .filter(l -> !props.getDisabledLayers().contains(l.id()))
                .toList();
        log.info("RiskScorer ready, layers={} threshold={}", layers.size(), props.getConfirmationThreshold());
    }

    public List<SignalLayer> layers() {
        return layers;
    }

    /**
     * 只对文本打分，不碰会话。
     *
     * @param turnIndex 本条消息是第几轮（从 1 开始），用于首轮问候判断
     */
    public RiskAssessment assess(String text, int turnIndex) {
        if (text == null || text.isBlank()) {
            return RiskAssessment.neutral("empty");
        }
        String lowered = text.toLowerCase().trim();
        if (turnIndex == 1 && props.isSuppressFirstTurnGreeting() && isPureGreeting(lowered)) {
            return RiskAssessment.neutral("greeting");
        }

        List<SignalMatch> matches = new ArrayList<>();
        for (SignalLayer layer : layers) {
            layer.match(lowered).ifPresent(matches::add);
        }
        if (matches.isEmpty()) {
            return RiskAssessment.builder()
                    .delta(0)
                    .matches(List.of())
                    .categories(List.of())
                    .reason("no hit")
                    .build();
        }

        int base = matches.stream().mapToInt(SignalMatch::weight).sum();
        List<String> categories = matches.stream().map(SignalMatch::category).distinct().toList();
        int bonus = categories.size() >= props.getEscalationMinCategories() ? props.getEscalationBonus() : 0;
        // 并列时取层序靠前者
        SignalMatch dominant = matches.get(0);
        for (SignalMatch m : matches) {
            if (m.weight() > dominant.weight()) dominant = m;
        }

        return RiskAssessment.builder()
                .delta(base + bonus)
                .matches(List.copyOf(matches))
                .categories(categories)
                .dominantCategory(dominant.category())
                .escalationBonus(bonus)
                .reason(matches.size() + " layer(s)")
                .build();
    }

    /**
     * 把本轮结果累加进会话，更新类别集合、确认锁存和诈骗类型。
     *
     * @return 是否在本轮首次确认
     */
    public boolean accumulate(SessionState s, RiskAssessment a) {
        s.raiseScore(a.getDelta());
        if (a.hasMatches()) {
            s.getTriggeredCategories().addAll(a.getCategories());
            s.setScamType(scamTypeClassifier.classify(s.getTriggeredCategories()));
        }
        if (!s.isScamConfirmed() && s.getCumulativeRiskScore() >= props.getConfirmationThreshold()) {
            s.confirmScam();
            log.info("Scam confirmed, sessionId={} score={} type={}",
                    s.getSessionId(), s.getCumulativeRiskScore(), s.getScamType());
            return true;
        }
        return false;
    }

    /** min(cap, round(99·s / (s + threshold/2)))，随分数单调不减 */
    public int confidencePercent(int score) {
        if (score <= 0) return 0;
        double half = props.getConfirmationThreshold() / 2.0;
        long pct = Math.round(99.0 * score / (score + half));
        return (int) Math.min(props.getMaxConfidencePercent(), pct);
    }

    static boolean isPureGreeting(String lowered) {
        for (Pattern p : SignalLayers.GREETINGS) {
            if (p.matcher(lowered).matches()) return true;
        }
        return false;
    }
}
