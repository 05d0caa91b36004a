package com.jz.honeypot.engage.model;

/**
 * 把 128 维向量切成 4 个 32 维"位置"，做一次缩放点积自注意力，残差后层归一化。
 */
public final class SelfAttention {

    public static final int HEADS = 4;
    public static final int HEAD_DIM = TextEncoder.DIM / HEADS;

    private final double[][] wq;
    private final double[][] wk;
    private final double[][] wv;
    private final double[][] wo;
    private final double[] bo;

    public SelfAttention(FixedWeights weights) {
        this.wq = weights.he(HEAD_DIM, HEAD_DIM);
        this.wk = weights.he(HEAD_DIM, HEAD_DIM);
        this.wv = weights.he(HEAD_DIM, HEAD_DIM);
        this.wo = weights.he(TextEncoder.DIM, TextEncoder.DIM);
        this.bo = FixedWeights.zeros(TextEncoder.DIM);
    }

    public double[] forward(double[] x) {
        double[][] q = new double[HEADS][];
        double[][] k = new double[HEADS][];
        double[][] v = new double[HEADS][];
        for (int h = 0; h < HEADS; h++) {
            double[] slice = new double[HEAD_DIM];
            System.arraycopy(x, h * HEAD_DIM, slice, 0, HEAD_DIM);
            q[h] = VectorMath.rowTimes(slice, wq);
            k[h] = VectorMath.rowTimes(slice, wk);
            v[h] = VectorMath.rowTimes(slice, wv);
        }

        double scale = Math.sqrt(HEAD_DIM);
        double[] context = new double[TextEncoder.DIM];
        for (int i = 0; i < HEADS; i++) {
            double[] scores = new double[HEADS];
            for (int j = 0; j < HEADS; j++) {
                scores[j] = VectorMath.dot(q[i], k[j]) / scale;
            }
            double[] attn = VectorMath.softmax(scores);
            for (int j = 0; j < HEADS; j++) {
                for (int d = 0; d < HEAD_DIM; d++) {
                    context[i * HEAD_DIM + d] += attn[j] * v[j][d];
                }
            }
        }

        double[] out = VectorMath.affine(wo, context, bo);
        return VectorMath.layerNorm(VectorMath.add(x, out));
    }
}
