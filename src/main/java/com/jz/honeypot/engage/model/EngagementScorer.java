package com.jz.honeypot.engage.model;

/**
 * 候选回复打分网络 345 → 128 → 64 → 1（GELU，输出 sigmoid）。
 */
public final class EngagementScorer {

    public static final int INPUT = TextEncoder.DIM + TextEncoder.DIM
            + ConversationStateCell.DIM + Intent.COUNT + HandFeatures.SIZE;

    private final double[][] w1;
    private final double[] b1;
    private final double[][] w2;
    private final double[] b2;
    private final double[][] w3;
    private final double[] b3;

    public EngagementScorer(FixedWeights weights) {
        this.w1 = weights.he(128, INPUT);
        this.b1 = FixedWeights.zeros(128);
        this.w2 = weights.he(64, 128);
        this.b2 = FixedWeights.zeros(64);
        this.w3 = weights.he(1, 64);
        this.b3 = FixedWeights.zeros(1);
    }

    public double score(double[] message, double[] candidate, double[] hidden, double[] intents, double[] hand) {
        double[] x = VectorMath.concat(message, candidate, hidden, intents, hand);
        if (x.length != INPUT) {
            throw new IllegalArgumentException("scorer input must be " + INPUT + " dims, got " + x.length);
        }
        double[] h1 = VectorMath.gelu(VectorMath.affine(w1, x, b1));
        double[] h2 = VectorMath.gelu(VectorMath.affine(w2, h1, b2));
        return VectorMath.sigmoid(VectorMath.affine(w3, h2, b3)[0]);
    }
}
