package com.jz.honeypot.engage;

import com.jz.honeypot.domain.SignalMatch;
import com.jz.honeypot.domain.Tactic;

import java.util.List;
import java.util.Map;

import static com.jz.honeypot.detect.SignalLayers.*;

/**
 * 信号类别到回复手法的映射。地区语言层没有独立手法。
 */
public final class TacticResolver {

    private static final Map<String, Tactic> BY_CATEGORY = Map.ofEntries(
            Map.entry(OTP, Tactic.OTP),
            Map.entry(SUSPENSION, Tactic.ACCOUNT),
            Map.entry(PAYMENT, Tactic.PAYMENT),
            Map.entry(BANK_DETAIL, Tactic.PAYMENT),
            Map.entry(PRIZE, Tactic.PAYMENT),
            Map.entry(INVESTMENT, Tactic.PAYMENT),
            Map.entry(JOB_LOAN, Tactic.PAYMENT),
            Map.entry(LEGAL, Tactic.THREAT),
            Map.entry(DIGITAL_ARREST, Tactic.THREAT),
            Map.entry(AUTHORITY, Tactic.THREAT),
            Map.entry(EMOTIONAL, Tactic.THREAT),
            Map.entry(TECH_SUPPORT, Tactic.TECH),
            Map.entry(PHISHING, Tactic.TECH),
            Map.entry(COURIER, Tactic.COURIER),
            Map.entry(IDENTITY, Tactic.IDENTITY),
            Map.entry(URGENCY, Tactic.URGENCY),
            Map.entry(ESCALATION, Tactic.URGENCY),
            Map.entry(COMPOUND, Tactic.URGENCY)
    );

    private TacticResolver() {
    }

    public static Tactic forCategory(String category) {
        return category == null ? null : BY_CATEGORY.get(category);
    }

    /** 权重最高且有对应手法的命中；并列取先出现者 */
    public static Tactic dominant(List<SignalMatch> matches) {
        SignalMatch best = null;
        for (SignalMatch m : matches) {
            if (forCategory(m.category()) == null) continue;
            if (best == null || m.weight() > best.weight()) best = m;
        }
        return best == null ? null : forCategory(best.category());
    }
}
