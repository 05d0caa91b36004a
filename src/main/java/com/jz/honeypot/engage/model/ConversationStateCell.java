package com.jz.honeypot.engage.model;

import com.jz.honeypot.domain.SessionState;

/**
 * GRU 式门控单元：更新门 z、重置门 r，在 [h ‖ x] 上计算，隐状态固定 64 维。
 */
public final class ConversationStateCell {

    public static final int DIM = SessionState.HIDDEN_DIM;

    private final double[][] wz;
    private final double[][] wr;
    private final double[][] wh;
    private final double[] bz;
    private final double[] br;
    private final double[] bh;

    public ConversationStateCell(FixedWeights weights, int inputDim) {
        int combined = DIM + inputDim;
        this.wz = weights.he(DIM, combined);
        this.wr = weights.he(DIM, combined);
        this.wh = weights.he(DIM, combined);
        this.bz = FixedWeights.zeros(DIM);
        this.br = FixedWeights.zeros(DIM);
        this.bh = FixedWeights.zeros(DIM);
    }

    /** 返回新隐状态，不修改入参 */
    public double[] step(double[] x, double[] h) {
        if (h == null || h.length != DIM) {
            throw new IllegalArgumentException("hidden state must have " + DIM + " dims");
        }
        double[] hx = VectorMath.concat(h, x);
        double[] z = VectorMath.sigmoid(VectorMath.affine(wz, hx, bz));
        double[] r = VectorMath.sigmoid(VectorMath.affine(wr, hx, br));

        double[] rh = new double[DIM];
        for (int i = 0; i < DIM; i++) rh[i] = r[i] * h[i];
        double[] cand = VectorMath.tanh(VectorMath.affine(wh, VectorMath.concat(rh, x), bh));

        double[] next = new double[DIM];
        for (int i = 0; i < DIM; i++) {
            next[i] = (1.0 - z[i]) * h[i] + z[i] * cand[i];
        }
        return next;
    }
}
