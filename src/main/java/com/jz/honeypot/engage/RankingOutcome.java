package com.jz.honeypot.engage;

import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.RankedChoice;

import java.util.List;

/**
 * 一次排序的结果。
 *
 * @param chosen       选中的回复
 * @param ranking      按分数降序的全部候选；降级时分数为 0、概率均匀
 * @param hiddenState  更新后的隐状态；降级时为 null，调用方保留旧值
 * @param intents      意图分布；降级时为 null
 * @param degraded     是否走了均匀随机
 */
public record RankingOutcome(CandidateResponse chosen,
                             List<RankedChoice> ranking,
                             double[] hiddenState,
                             double[] intents,
                             boolean degraded) {
}
