package com.jz.honeypot.engage.model;

/**
 * 小型稠密向量运算。矩阵按行存储：w[out][in]。
 */
public final class VectorMath {

    private static final double EPS = 1e-9;
    private static final double GELU_C = Math.sqrt(2.0 / Math.PI);

    private VectorMath() {
    }

    /** y = W·x + b */
    public static double[] affine(double[][] w, double[] x, double[] b) {
        int out = w.length;
        double[] y = new double[out];
        for (int i = 0; i < out; i++) {
            double[] row = w[i];
            if (row.length != x.length) {
                throw new IllegalArgumentException("shape mismatch: row=" + row.length + " x=" + x.length);
            }
            double acc = b == null ? 0.0 : b[i];
            for (int j = 0; j < row.length; j++) {
                acc += row[j] * x[j];
            }
            y[i] = acc;
        }
        return y;
    }

    /** 行向量乘矩阵：y[j] = Σ x[i]·w[i][j] */
    public static double[] rowTimes(double[] x, double[][] w) {
        int cols = w[0].length;
        double[] y = new double[cols];
        for (int i = 0; i < x.length; i++) {
            double xi = x[i];
            double[] row = w[i];
            for (int j = 0; j < cols; j++) {
                y[j] += xi * row[j];
            }
        }
        return y;
    }

    public static double dot(double[] a, double[] b) {
        double s = 0.0;
        for (int i = 0; i < a.length; i++) s += a[i] * b[i];
        return s;
    }

    public static double norm(double[] a) {
        return Math.sqrt(dot(a, a));
    }

    /** 原地 L2 归一化，零向量保持不变 */
    public static void normalizeInPlace(double[] a) {
        double n = norm(a);
        if (n > EPS) {
            for (int i = 0; i < a.length; i++) a[i] /= n;
        }
    }

    public static double cosine(double[] a, double[] b) {
        double na = norm(a), nb = norm(b);
        if (na < EPS || nb < EPS) return 0.0;
        return dot(a, b) / (na * nb);
    }

    public static double[] softmax(double[] x) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : x) max = Math.max(max, v);
        double[] e = new double[x.length];
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            e[i] = Math.exp(x[i] - max);
            sum += e[i];
        }
        for (int i = 0; i < e.length; i++) e[i] /= (sum + EPS);
        return e;
    }

    public static double sigmoid(double x) {
        double c = Math.max(-15.0, Math.min(15.0, x));
        return 1.0 / (1.0 + Math.exp(-c));
    }

    public static double[] sigmoid(double[] x) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) y[i] = sigmoid(x[i]);
        return y;
    }

    public static double[] tanh(double[] x) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) y[i] = Math.tanh(x[i]);
        return y;
    }

    public static double[] relu(double[] x) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) y[i] = Math.max(0.0, x[i]);
        return y;
    }

    /** tanh 近似的 GELU */
    public static double[] gelu(double[] x) {
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            double v = x[i];
            y[i] = 0.5 * v * (1.0 + Math.tanh(GELU_C * (v + 0.044715 * v * v * v)));
        }
        return y;
    }

    public static double[] layerNorm(double[] x) {
        double mean = 0.0;
        for (double v : x) mean += v;
        mean /= x.length;
        double var = 0.0;
        for (double v : x) var += (v - mean) * (v - mean);
        var /= x.length;
        double denom = Math.sqrt(var + 1e-5);
        double[] y = new double[x.length];
        for (int i = 0; i < x.length; i++) y[i] = (x[i] - mean) / denom;
        return y;
    }

    public static double[] add(double[] a, double[] b) {
        double[] y = new double[a.length];
        for (int i = 0; i < a.length; i++) y[i] = a[i] + b[i];
        return y;
    }

    public static double[] concat(double[]... parts) {
        int n = 0;
        for (double[] p : parts) n += p.length;
        double[] y = new double[n];
        int off = 0;
        for (double[] p : parts) {
            System.arraycopy(p, 0, y, off, p.length);
            off += p.length;
        }
        return y;
    }

    public static boolean isFinite(double[] x) {
        for (double v : x) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }
}
