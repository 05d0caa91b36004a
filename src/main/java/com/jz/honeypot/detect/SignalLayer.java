package com.jz.honeypot.detect;

import com.jz.honeypot.domain.SignalMatch;

import java.util.List;
import java.util.Optional;

/**
 * 一个信号层。同层多条规则命中时只取权重最高的一条。
 */
public record SignalLayer(String id, boolean core, List<SignalRule> rules) {

    public Optional<SignalMatch> match(String lowered) {
        SignalRule best = null;
        for (SignalRule r : rules) {
            if ((best == null || r.weight() > best.weight()) && r.matches(lowered)) {
                best = r;
            }
        }
        return best == null
                ? Optional.empty()
                : Optional.of(new SignalMatch(id, best.weight(), id, best.label()));
    }
}
