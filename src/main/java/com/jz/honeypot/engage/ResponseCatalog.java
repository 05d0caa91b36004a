package com.jz.honeypot.engage;

import com.jz.honeypot.domain.CandidateResponse;
import com.jz.honeypot.domain.Stage;
import com.jz.honeypot.domain.Tactic;
import com.jz.honeypot.engage.model.EngagementModel;
import com.jz.honeypot.engage.model.TextEncoder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 回复模板目录。启动时一次性算好所有模板的向量，之后只读。
 */
@Slf4j
@Component
public class ResponseCatalog {

    private final Map<Stage, List<CandidateResponse>> byStage = new EnumMap<>(Stage.class);
    private final Map<Tactic, List<CandidateResponse>> byTactic = new EnumMap<>(Tactic.class);
    private final Map<String, CandidateResponse> byId = new LinkedHashMap<>();

    public ResponseCatalog(EngagementModel model) {
        TextEncoder encoder = model.getEncoder();
        for (CandidateResponse c : ResponseTemplates.STAGE) {
            CandidateResponse e = withEmbedding(c, encoder);
            byStage.computeIfAbsent(e.getStageAffinity(), k -> new ArrayList<>()).add(e);
            index(e);
        }
        for (CandidateResponse c : ResponseTemplates.TACTIC) {
            CandidateResponse e = withEmbedding(c, encoder);
            byTactic.computeIfAbsent(e.getTacticAffinity(), k -> new ArrayList<>()).add(e);
            index(e);
        }
        byStage.replaceAll((k, v) -> Collections.unmodifiableList(v));
        byTactic.replaceAll((k, v) -> Collections.unmodifiableList(v));
        log.info("ResponseCatalog loaded, templates={}", byId.size());
    }

    public List<CandidateResponse> stagePool(Stage stage) {
        return byStage.getOrDefault(stage, List.of());
    }

    /** 手法池中已在当前阶段解锁的模板 */
    public List<CandidateResponse> tacticPool(Tactic tactic, Stage stage) {
        if (tactic == null) return List.of();
        return byTactic.getOrDefault(tactic, List.of()).stream()
                .filter(c -> !c.getStageAffinity().isAfter(stage))
                .toList();
    }

    public CandidateResponse get(String id) {
        return byId.get(id);
    }

    public int size() {
        return byId.size();
    }

    /** 按轮次轮换的通用困惑回复 */
    public String genericConfused(int turnIndex) {
        List<String> list = ResponseTemplates.GENERIC_CONFUSED;
        return list.get(Math.floorMod(turnIndex, list.size()));
    }

    private void index(CandidateResponse c) {
        if (byId.putIfAbsent(c.getId(), c) != null) {
            throw new IllegalStateException("duplicate template id: " + c.getId());
        }
    }

    private static CandidateResponse withEmbedding(CandidateResponse c, TextEncoder encoder) {
        return CandidateResponse.builder()
                .id(c.getId())
                .text(c.getText())
                .stageAffinity(c.getStageAffinity())
                .tacticAffinity(c.getTacticAffinity())
                .theme(c.getTheme())
                .embedding(encoder.encode(c.getText()))
                .build();
    }
}
