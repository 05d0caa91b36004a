package com.jz.honeypot.engage;

import com.jz.honeypot.config.EngagementProperties;
import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.Stage;
import com.jz.honeypot.domain.Tactic;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 阶段状态机 + 候选池组装 + 防重复记账。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StageController {

    private final EngagementProperties props;
    private final ResponseCatalog catalog;

    /**
     * 每轮最多前进一个阶段：分数门槛和轮次门槛都满足才前进。
     *
     * @return 本轮结束后的阶段
     */
    public Stage advance(SessionState s) {
        Stage current = s.getStage();
        Stage eligible = eligibleStage(s.getCumulativeRiskScore(), s.getTurnIndex());
        if (eligible.isAfter(current)) {
            return transition(s, current.next());
        }
        // 门槛配置调高后，老会话可能低于当前阶段的门槛，交给 transition 钳住
        return transition(s, eligible);
    }

    /** 目标阶段早于当前阶段时不回退，只记告警 */
    public Stage transition(SessionState s, Stage target) {
        Stage current = s.getStage();
        if (current.isAfter(target)) {
            log.warn("Stage regression clamped, sessionId={} current={} attempted={}",
                    s.getSessionId(), current, target);
            return current;
        }
        if (target != current) {
            s.setStage(target);
            log.info("Stage advanced, sessionId={} {} -> {} score={} turn={}",
                    s.getSessionId(), current, target, s.getCumulativeRiskScore(), s.getTurnIndex());
        }
        return target;
    }

    public Stage eligibleStage(int score, int turn) {
        Stage eligible = Stage.CONFUSED;
        for (Stage st : Stage.values()) {
            if (st == Stage.CONFUSED) continue;
            EngagementProperties.Gate g = gate(st);
            if (score >= g.getScore() && turn >= g.getTurn()) {
                eligible = st;
            } else {
                break;
            }
        }
        return eligible;
    }

    /**
     * 阶段池 ∪ 已解锁的手法池 ∪ 探针，减去已用过的。
     * 过滤后为空时，把本池的 id 从已用集合里移除再重建。
     */
    public List<CandidateResponse> buildPool(SessionState s, Tactic tactic, CandidateResponse probe) {
        Map<String, CandidateResponse> all = new LinkedHashMap<>();
        for (CandidateResponse c : catalog.stagePool(s.getStage())) all.put(c.getId(), c);
        for (CandidateResponse c : catalog.tacticPool(tactic, s.getStage())) all.putIfAbsent(c.getId(), c);

        List<CandidateResponse> pool = new ArrayList<>();
        for (CandidateResponse c : all.values()) {
            if (!s.getUsedResponseIds().contains(c.getId())) pool.add(c);
        }
        if (pool.isEmpty() && !all.isEmpty()) {
            s.getUsedResponseIds().removeAll(all.keySet());
            pool.addAll(all.values());
            log.info("Candidate pool exhausted, reset. sessionId={} stage={} tactic={} size={}",
                    s.getSessionId(), s.getStage(), tactic, all.size());
        }
        if (probe != null) pool.add(probe);
        return pool;
    }

    /** 选中后记账：已用集合、手法连击、上一轮主题 */
    public void recordSelection(SessionState s, CandidateResponse chosen) {
        if (!chosen.isProbe()) {
            s.getUsedResponseIds().add(chosen.getId());
        }
        s.getTacticStreak().record(chosen.isProbe() ? null : chosen.tacticTag());
        s.setLastTheme(chosen.getTheme());
    }

    public int streakLimit() {
        return Math.max(1, props.getTacticStreakLimit());
    }

    private EngagementProperties.Gate gate(Stage st) {
        return switch (st) {
            case VERIFYING -> props.getVerifying();
            case SUSPICIOUS -> props.getSuspicious();
            case COOPERATIVE -> props.getCooperative();
            case EXTRACTING -> props.getExtracting();
            case CONFUSED -> new EngagementProperties.Gate(0, 0);
        };
    }
}
