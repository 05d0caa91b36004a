package com.jz.honeypot.domain;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 连续选中同一手法标签的回复次数。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TacticStreak {
    private String tag;
    private int count;

    /** 记录本轮选中的标签；null 表示无标签回复或探针，直接清零 */
    public void record(String selectedTag) {
        if (selectedTag == null) {
            reset();
            return;
        }
        if (selectedTag.equals(tag)) {
            count++;
        } else {
            tag = selectedTag;
            count = 1;
        }
    }

    public void reset() {
        tag = null;
        count = 0;
    }

    public boolean reached(String candidateTag, int limit) {
        return candidateTag != null && candidateTag.equals(tag) && count >= limit;
    }
}
