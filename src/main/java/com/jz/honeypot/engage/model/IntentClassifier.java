package com.jz.honeypot.engage.model;

/**
 * 三路混合的意图分布：
 * 0.35 × 小型前馈网络 + 0.30 × 原型余弦（温度 0.25） + 0.35 × 关键词重叠，最后重新归一化。
 */
public final class IntentClassifier {

    static final double FC_WEIGHT = 0.35;
    static final double PROTOTYPE_WEIGHT = 0.30;
    static final double KEYWORD_WEIGHT = 0.35;
    static final double PROTOTYPE_TEMPERATURE = 0.25;
    static final int HIDDEN = 48;

    private final double[][] w1;
    private final double[] b1;
    private final double[][] w2;
    private final double[] b2;
    private final double[][] prototypes;

    public IntentClassifier(FixedWeights weights, TextEncoder encoder) {
        this.w1 = weights.he(HIDDEN, TextEncoder.DIM);
        this.b1 = FixedWeights.zeros(HIDDEN);
        this.w2 = weights.he(Intent.COUNT, HIDDEN);
        this.b2 = FixedWeights.zeros(Intent.COUNT);

        this.prototypes = new double[Intent.COUNT][];
        for (Intent intent : Intent.values()) {
            double[] mean = new double[TextEncoder.DIM];
            for (String kw : intent.keywords()) {
                double[] e = encoder.encode(kw);
                for (int i = 0; i < mean.length; i++) mean[i] += e[i];
            }
            VectorMath.normalizeInPlace(mean);
            prototypes[intent.ordinal()] = mean;
        }
    }

    /**
     * @param contextual 注意力之后的 128 维向量
     * @param rawText    原始消息，用于关键词重叠
     */
    public double[] classify(double[] contextual, String rawText) {
        double[] fc = VectorMath.softmax(
                VectorMath.affine(w2, VectorMath.gelu(VectorMath.affine(w1, contextual, b1)), b2));

        double[] sims = new double[Intent.COUNT];
        for (int i = 0; i < Intent.COUNT; i++) {
            sims[i] = VectorMath.cosine(prototypes[i], contextual) / PROTOTYPE_TEMPERATURE;
        }
        double[] proto = VectorMath.softmax(sims);

        double[] kw = keywordOverlap(rawText);

        double[] out = new double[Intent.COUNT];
        double sum = 0.0;
        for (int i = 0; i < Intent.COUNT; i++) {
            out[i] = FC_WEIGHT * fc[i] + PROTOTYPE_WEIGHT * proto[i] + KEYWORD_WEIGHT * kw[i];
            sum += out[i];
        }
        for (int i = 0; i < Intent.COUNT; i++) out[i] /= sum;
        return out;
    }

    /** 命中数归一化；一个都不命中时全部给 NEUTRAL */
    static double[] keywordOverlap(String text) {
        double[] scores = new double[Intent.COUNT];
        if (text == null || text.isBlank()) {
            scores[Intent.NEUTRAL.ordinal()] = 1.0;
            return scores;
        }
        String lowered = text.toLowerCase();
        double total = 0.0;
        for (Intent intent : Intent.values()) {
            int hits = 0;
            for (String kw : intent.keywords()) {
                if (lowered.contains(kw)) hits++;
            }
            scores[intent.ordinal()] = hits;
            total += hits;
        }
        if (total > 0) {
            for (int i = 0; i < scores.length; i++) scores[i] /= total;
        } else {
            scores[Intent.NEUTRAL.ordinal()] = 1.0;
        }
        return scores;
    }

    public static Intent top(double[] distribution) {
        int best = 0;
        for (int i = 1; i < distribution.length; i++) {
            if (distribution[i] > distribution[best]) best = i;
        }
        return Intent.values()[best];
    }
}
