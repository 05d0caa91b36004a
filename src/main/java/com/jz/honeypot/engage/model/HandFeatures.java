package com.jz.honeypot.engage.model;

import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.Stage;
import com.jz.honeypot.domain.Tactic;
import com.jz.honeypot.domain.Theme;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * 10 个手工特征，全部落在 [0,1]。
 */
public final class HandFeatures {

    public static final int SIZE = 10;

    private static final Set<String> PROBE_WORDS = Set.of(
            "phone", "number", "contact", "employee", "email", "name",
            "department", "reference", "callback", "details", "supervisor");
    private static final List<String> PERSONA_WORDS = List.of(
            "confused", "scared", "worried", "nervous", "senior", "health",
            "medicine", "glasses", "don't understand", "blood pressure", "son", "grandson");
    private static final List<String> STALL_TOKENS = List.of(
            "hold on", "wait", "one minute", "let me", "checking",
            "battery", "restart", "network", "can you repeat", "one moment");
    private static final Set<String> COMPLY_WORDS = Set.of(
            "okay", "alright", "cooperate", "believe", "trust", "ready",
            "proceed", "fine", "understand", "convinced");
    private static final Set<String> HINDI_WORDS = Set.of(
            "ji", "haan", "namaste", "aap", "kya", "nahi", "sahab", "beta", "arre", "accha");

    private HandFeatures() {
    }

    public static double[] compute(CandidateResponse c, Stage stage, Tactic tactic, Theme lastTheme) {
        double[] f = new double[SIZE];
        String text = c.getText();
        String lowered = text.toLowerCase();
        String[] words = lowered.replaceAll("[^\\p{L}\\p{N}'\\s]", " ").trim().split("\\s+");
        Set<String> wordSet = new HashSet<>(Arrays.asList(words));
        int wc = lowered.isBlank() ? 0 : words.length;

        // 0 阶段匹配：阶段模板同阶段为 1，手法模板已解锁为 0.5
        if (c.getStageAffinity() == stage && c.getTacticAffinity() == null) {
            f[0] = 1.0;
        } else if (c.getTacticAffinity() != null && c.getStageAffinity() != null
                && !c.getStageAffinity().isAfter(stage)) {
            f[0] = 0.5;
        }
        // 1 手法匹配
        f[1] = tactic != null && c.getTacticAffinity() == tactic ? 1.0 : 0.0;
        // 2 新鲜度：主题与上一轮不同
        f[2] = lastTheme == null || c.getTheme() != lastTheme ? 1.0 : 0.0;
        // 3 长度适中
        f[3] = wc >= 12 && wc <= 30 ? 1.0 : (wc >= 8 && wc <= 35 ? 0.7 : 0.3);
        // 4 提问
        f[4] = text.contains("?") ? 1.0 : 0.0;
        // 5 套取信息的词
        f[5] = Math.min(intersect(wordSet, PROBE_WORDS) / 3.0, 1.0);
        // 6 人设
        f[6] = Math.min(containsCount(lowered, PERSONA_WORDS) / 2.0, 1.0);
        // 7 拖延
        f[7] = Math.min(containsCount(lowered, STALL_TOKENS) / 2.0, 1.0);
        // 8 顺从
        f[8] = Math.min(intersect(wordSet, COMPLY_WORDS) / 2.0, 1.0);
        // 9 印地语/印式英语
        f[9] = Math.min(intersect(wordSet, HINDI_WORDS) / 2.0, 1.0);
        return f;
    }

    private static int intersect(Set<String> words, Set<String> vocab) {
        int n = 0;
        for (String w : words) {
            if (vocab.contains(w)) n++;
        }
        return n;
    }

    private static int containsCount(String lowered, List<String> tokens) {
        int n = 0;
        for (String t : tokens) {
            if (lowered.contains(t)) n++;
        }
        return n;
    }
}
