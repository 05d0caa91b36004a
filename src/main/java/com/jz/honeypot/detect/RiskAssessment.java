package com.jz.honeypot.detect;

import com.jz.honeypot.domain.SignalMatch;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 单条消息的打分结果（尚未累加进会话）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {
    /** 本轮增量 = 各层最高权重之和 + 升级奖励 */
    private int delta;
    private List<SignalMatch> matches;
    private List<String> categories;
    /** 权重最高的命中类别；无命中为 null */
    private String dominantCategory;
    private int escalationBonus;
    /** 空消息或首轮问候 */
    private boolean neutral;
    private String reason;

    public static RiskAssessment neutral(String reason) {
        return RiskAssessment.builder()
                .delta(0)
                .matches(List.of())
                .categories(List.of())
                .neutral(true)
                .reason(reason)
                .build();
    }

    public boolean hasMatches() {
        return matches != null && !matches.isEmpty();
    }
}
