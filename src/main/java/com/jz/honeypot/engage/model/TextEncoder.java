package com.jz.honeypot.engage.model;

/**
 * 字符三元组 + 词一元/二元组的特征哈希编码，投影到 128 维。
 * 同样的文本永远得到同样的向量，不依赖词表。
 */
public final class TextEncoder {

    public static final int DIM = 128;
    public static final int HALF = DIM / 2;

    static final int CHAR_BUCKET_SEED = 0xC3A5;
    static final int CHAR_SIGN_SEED = 0xB7E1;
    static final int WORD_BUCKET_SEED = 0xA1B2;
    static final int WORD_SIGN_SEED = 0xD4F5;

    private static final int FNV_PRIME = 16777619;

    private final double[][] w;
    private final double[] b;

    public TextEncoder(FixedWeights weights) {
        this.w = weights.he(DIM, DIM);
        this.b = FixedWeights.zeros(DIM);
    }

    public double[] encode(String text) {
        return VectorMath.relu(VectorMath.affine(w, hashFeatures(text), b));
    }

    /** 前 64 维是字符三元组，后 64 维是词特征，两半各自 L2 归一化 */
    static double[] hashFeatures(String text) {
        double[] chars = new double[HALF];
        double[] words = new double[HALF];
        String lowered = text == null ? "" : text.toLowerCase().trim();

        String padded = " " + lowered + " ";
        int[] cps = padded.codePoints().toArray();
        for (int i = 0; i + 2 < cps.length; i++) {
            String tri = new String(cps, i, 3);
            bump(chars, tri, CHAR_BUCKET_SEED, CHAR_SIGN_SEED);
        }

        String[] tokens = lowered.isEmpty() ? new String[0] : lowered.split("\\s+");
        for (String t : tokens) {
            bump(words, t, WORD_BUCKET_SEED, WORD_SIGN_SEED);
        }
        for (int i = 0; i + 1 < tokens.length; i++) {
            bump(words, tokens[i] + "_" + tokens[i + 1], WORD_BUCKET_SEED, WORD_SIGN_SEED);
        }

        VectorMath.normalizeInPlace(chars);
        VectorMath.normalizeInPlace(words);
        return VectorMath.concat(chars, words);
    }

    private static void bump(double[] vec, String feature, int bucketSeed, int signSeed) {
        int idx = Integer.remainderUnsigned(fnv1a(feature, bucketSeed), vec.length);
        double sign = (fnv1a(feature, signSeed) & 1) == 0 ? 1.0 : -1.0;
        vec[idx] += sign;
    }

    /** 32 位 FNV-1a，按 code point 迭代 */
    static int fnv1a(String s, int seed) {
        int h = seed;
        for (int i = 0; i < s.length(); ) {
            int cp = s.codePointAt(i);
            h ^= cp;
            h *= FNV_PRIME;
            i += Character.charCount(cp);
        }
        return h;
    }
}
