package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 阶段推进、防重复与排序参数（honeypot.engagement.*）
 */
@Data
@ConfigurationProperties(prefix = "honeypot.engagement")
public class EngagementProperties {

    private Gate verifying = new Gate(20, 2);
    private Gate suspicious = new Gate(50, 4);
    private Gate cooperative = new Gate(80, 6);
    private Gate extracting = new Gate(110, 8);

    /** 同一手法标签连续被选中多少轮后开始降权，1 表示不允许相邻两轮相同 */
    private int tacticStreakLimit = 1;

    private Ranker ranker = new Ranker();

    @Data
    public static class Gate {
        private int score;
        private int turn;

        public Gate() {
        }

        public Gate(int score, int turn) {
            this.score = score;
            this.turn = turn;
        }
    }

    @Data
    public static class Ranker {
        /** false 时直接走均匀随机 */
        private boolean enabled = true;
        /** 采样温度 */
        private double temperature = 0.6;
        private double stageBonus = 0.15;
        private double intentBonus = 0.10;
        private double probeBonus = 5.0;
        /** 权重生成种子，换种子等于换一套固定模型 */
        private long weightSeed = 42L;
    }
}
