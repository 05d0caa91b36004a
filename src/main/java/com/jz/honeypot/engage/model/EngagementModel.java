package com.jz.honeypot.engage.model;

import lombok.Getter;

/**
 * 整套固定权重模型。各组件按固定顺序从同一个种子取权重，顺序改变等于换模型。
 */
@Getter
public class EngagementModel {

    private final long seed;
    private final TextEncoder encoder;
    private final SelfAttention attention;
    private final ConversationStateCell stateCell;
    private final IntentClassifier intentClassifier;
    private final EngagementScorer scorer;

    public EngagementModel(long seed) {
        FixedWeights weights = new FixedWeights(seed);
        this.seed = seed;
        this.encoder = new TextEncoder(weights);
        this.attention = new SelfAttention(weights);
        this.stateCell = new ConversationStateCell(weights, TextEncoder.DIM);
        this.intentClassifier = new IntentClassifier(weights, encoder);
        this.scorer = new EngagementScorer(weights);
    }
}
