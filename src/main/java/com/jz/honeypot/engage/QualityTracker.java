package com.jz.honeypot.engage;

import com.jz.honeypot.config.QualityProperties;
import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.IntelKind;
import com.jz.honeypot.domain.QualityMetrics;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.Theme;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 质量计数、探针注入、结案就绪判断。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QualityTracker {

    public static final String PROBE_ID_PREFIX = "qp-";

    private final QualityProperties props;

    public void recordTurn(SessionState s) {
        s.getQualityMetrics().setTurns(s.getQualityMetrics().getTurns() + 1);
    }

    /** 还差多少；已达标的不出现 */
    public Map<String, Integer> missing(SessionState s) {
        QualityMetrics m = s.getQualityMetrics();
        Map<String, Integer> out = new LinkedHashMap<>();
        gap(out, "turns", props.getMinTurns(), m.getTurns());
        gap(out, "questions", props.getMinQuestions(), m.getQuestionsAsked());
        gap(out, "investigative", props.getMinInvestigative(), m.getInvestigativeProbes());
        gap(out, "redFlags", props.getMinRedFlags(), m.getRedFlagAcks());
        gap(out, "elicitation", props.getMinElicitation(), m.getElicitationAttempts());
        return out;
    }

    /**
     * 需要时生成一条探针回复。两个及以上计数器未达标时拼接复合探针，只差一个时给单项探针。
     * 会推进模板游标。
     */
    public CandidateResponse maybeProbe(SessionState s) {
        if (!s.isScamConfirmed() || s.getTurnIndex() < props.getProbeStartTurn()) {
            return null;
        }
        QualityMetrics m = s.getQualityMetrics();
        boolean needRed = m.getRedFlagAcks() < props.getMinRedFlags();
        boolean needInv = m.getInvestigativeProbes() < props.getMinInvestigative();
        boolean needElic = m.getElicitationAttempts() < props.getMinElicitation();
        boolean needQ = m.getQuestionsAsked() < props.getMinQuestions();
        int below = (needRed ? 1 : 0) + (needInv ? 1 : 0) + (needElic ? 1 : 0) + (needQ ? 1 : 0);
        if (below == 0) {
            return null;
        }

        boolean red = needRed;
        boolean inv = needInv || (needQ && !needElic);
        boolean elic = needElic;

        List<String> parts = new ArrayList<>(3);
        if (red) parts.add(pickRedFlag(s));
        if (inv) parts.add(pick(ProbeTemplates.INVESTIGATIVE, s, m.nextInvestigativeCursor()));
        if (elic) parts.add(pick(ProbeTemplates.ELICITATION, s, m.nextElicitationCursor()));

        StringBuilder text = new StringBuilder(parts.get(0));
        for (int i = 1; i < parts.size(); i++) {
            String connector = ProbeTemplates.CONNECTORS.get(
                    Math.floorMod(m.nextConnectorCursor(), ProbeTemplates.CONNECTORS.size()));
            String next = parts.get(i);
            text.append(connector).append(Character.toLowerCase(next.charAt(0))).append(next.substring(1));
        }

        log.debug("Quality probe, sessionId={} turn={} parts={} missing={}",
                s.getSessionId(), s.getTurnIndex(), parts.size(), missing(s));
        return CandidateResponse.builder()
                .id(PROBE_ID_PREFIX + s.getTurnIndex())
                .text(text.toString())
                .stageAffinity(s.getStage())
                .theme(Theme.QUALITY_PROBE)
                .probeParts(new CandidateResponse.ProbeParts(red, inv, elic))
                .build();
    }

    /** 按最终选中的回复更新计数器 */
    public void recordReply(SessionState s, CandidateResponse chosen) {
        QualityMetrics m = s.getQualityMetrics();
        if (chosen.isProbe() && chosen.getProbeParts() != null) {
            CandidateResponse.ProbeParts p = chosen.getProbeParts();
            if (p.redFlag()) m.setRedFlagAcks(m.getRedFlagAcks() + 1);
            if (p.investigative()) m.setInvestigativeProbes(m.getInvestigativeProbes() + 1);
            if (p.elicitation()) m.setElicitationAttempts(m.getElicitationAttempts() + 1);
        } else if (chosen.getTheme() != null) {
            switch (chosen.getTheme()) {
                case PROBING -> m.setInvestigativeProbes(m.getInvestigativeProbes() + 1);
                case RED_FLAG -> m.setRedFlagAcks(m.getRedFlagAcks() + 1);
                case EXTRACTION -> m.setElicitationAttempts(m.getElicitationAttempts() + 1);
                default -> {
                }
            }
        }
        m.recordQuestion(chosen.getText());
    }

    public boolean countersMet(SessionState s) {
        QualityMetrics m = s.getQualityMetrics();
        return m.getTurns() >= props.getMinTurns()
                && m.getQuestionsAsked() >= props.getMinQuestions()
                && m.getInvestigativeProbes() >= props.getMinInvestigative()
                && m.getRedFlagAcks() >= props.getMinRedFlags()
                && m.getElicitationAttempts() >= props.getMinElicitation();
    }

    public boolean isReady(SessionState s, long nowMillis) {
        return countersMet(s)
                && s.isScamConfirmed()
                && s.getTurnIndex() >= props.getReportMinTurns()
                && s.elapsedMillis(nowMillis) >= props.getReportMinDurationSeconds() * 1000L;
    }

    private String pickRedFlag(SessionState s) {
        int cursor = s.getQualityMetrics().nextRedFlagCursor();
        List<String> keyed = new ArrayList<>();
        for (String category : s.getTriggeredCategories()) {
            if (ProbeTemplates.RED_FLAGS.containsKey(category)) keyed.add(category);
        }
        if (keyed.isEmpty()) {
            return ProbeTemplates.GENERIC_RED_FLAGS.get(Math.floorMod(cursor, ProbeTemplates.GENERIC_RED_FLAGS.size()));
        }
        String category = keyed.get(Math.floorMod(cursor, keyed.size()));
        List<String> list = ProbeTemplates.RED_FLAGS.get(category);
        return list.get(Math.floorMod(cursor / keyed.size(), list.size()));
    }

    private static String pick(List<String> templates, SessionState s, int cursor) {
        List<String> usable = filterByIntel(templates, s);
        return usable.get(Math.floorMod(cursor, usable.size()));
    }

    /** 去掉索要已拿到情报的模板；全部被去掉时退回原列表 */
    static List<String> filterByIntel(List<String> templates, SessionState s) {
        List<IntelKind> held = ProbeTemplates.INTEL_KEYWORDS.keySet().stream()
                .filter(s::hasIntel)
                .toList();
        if (held.isEmpty()) return templates;
        List<String> kept = templates.stream()
                .filter(t -> held.stream().noneMatch(kind -> asksFor(t, kind)))
                .toList();
        return kept.isEmpty() ? templates : kept;
    }

    private static void gap(Map<String, Integer> out, String key, int target, int actual) {
        if (actual < target) out.put(key, target - actual);
    }

    static boolean asksFor(String template, IntelKind kind) {
        String lower = template.toLowerCase();
        return ProbeTemplates.INTEL_KEYWORDS.getOrDefault(kind, List.of()).stream().anyMatch(lower::contains);
    }
}
