package com.jz.honeypot.engage.model;

import java.util.Random;

/**
 * 固定权重生成器：同一种子、同一调用顺序，得到逐位相同的矩阵。
 * 没有训练过程，权重就是编译进来的常量。
 */
public final class FixedWeights {

    private final Random rng;

    public FixedWeights(long seed) {
        this.rng = new Random(seed);
    }

    /** He 初始化：N(0, 2/fanIn)，fanIn 取列数 */
    public double[][] he(int rows, int cols) {
        double scale = Math.sqrt(2.0 / cols);
        double[][] w = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < cols; j++) {
                w[i][j] = rng.nextGaussian() * scale;
            }
        }
        return w;
    }

    public static double[] zeros(int n) {
        return new double[n];
    }
}
