package com.jz.honeypot.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个会话的全部可变状态。由 SessionStore 创建和回收，引擎每轮在独占锁内修改。
 */
@Data
public class SessionState {

    public static final int HIDDEN_DIM = 64;

    private String sessionId;

    /** 累计风险分，只增不减 */
    private int cumulativeRiskScore;

    /** 一旦确认即保持 */
    private boolean scamConfirmed;

    private Stage stage = Stage.CONFUSED;

    /** 已处理的骗子消息数，第一轮为 1 */
    private int turnIndex;

    private long createdAt;
    private long lastActivityAt;

    private double[] hiddenState = new double[HIDDEN_DIM];

    private Set<String> usedResponseIds = new LinkedHashSet<>();

    private TacticStreak tacticStreak = new TacticStreak();

    private QualityMetrics qualityMetrics = new QualityMetrics();

    private AtomicBoolean finalized = new AtomicBoolean(false);

    /** 会话内出现过的全部信号类别 */
    private Set<String> triggeredCategories = new LinkedHashSet<>();

    private Set<String> observedTactics = new LinkedHashSet<>();

    private String scamType = "unknown";

    private Theme lastTheme;

    /** 双方消息总数（含历史回放） */
    private int messagesExchanged;

    private Map<IntelKind, Set<String>> intelligence = new LinkedHashMap<>();

    public static SessionState create(String sessionId, long nowMillis) {
        SessionState s = new SessionState();
        s.setSessionId(sessionId);
        s.setCreatedAt(nowMillis);
        s.setLastActivityAt(nowMillis);
        return s;
    }

    /** 负数增量直接忽略 */
    public void raiseScore(int delta) {
        if (delta > 0) {
            cumulativeRiskScore += delta;
        }
    }

    /** @return 本次调用是否完成了从未确认到确认的切换 */
    public boolean confirmScam() {
        if (scamConfirmed) return false;
        scamConfirmed = true;
        return true;
    }

    /** 原子地置位结案标志，只有第一个调用者拿到 true */
    public boolean tryFinalize() {
        return finalized.compareAndSet(false, true);
    }

    @JsonIgnore
    public boolean isReported() {
        return finalized.get();
    }

    public void mergeIntelligence(Map<IntelKind, ? extends Collection<String>> found) {
        if (found == null) return;
        found.forEach((kind, values) -> {
            if (values == null || values.isEmpty()) return;
            intelligence.computeIfAbsent(kind, k -> new LinkedHashSet<>()).addAll(values);
        });
    }

    public boolean hasIntel(IntelKind kind) {
        Set<String> values = intelligence.get(kind);
        return values != null && !values.isEmpty();
    }

    @JsonIgnore
    public boolean isFresh() {
        return turnIndex == 0 && messagesExchanged == 0;
    }

    public long elapsedMillis(long nowMillis) {
        return Math.max(0L, nowMillis - createdAt);
    }
}
