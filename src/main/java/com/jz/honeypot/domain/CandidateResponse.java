package com.jz.honeypot.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 候选回复模板。stageAffinity 对阶段池是所属阶段，对手法池是最早可用的阶段。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandidateResponse {
    private String id;
    private String text;
    private Stage stageAffinity;
    /** 手法标签；阶段通用模板为 null */
    private Tactic tacticAffinity;
    private Theme theme;
    private double[] embedding;
    /** 探针专用：本条回复包含的质量部件 */
    private ProbeParts probeParts;

    public String tacticTag() {
        return tacticAffinity == null ? null : tacticAffinity.tag();
    }

    public boolean isProbe() {
        return theme == Theme.QUALITY_PROBE;
    }

    /**
     * 探针由哪些部件拼接而成。
     */
    public record ProbeParts(boolean redFlag, boolean investigative, boolean elicitation) {
    }
}
