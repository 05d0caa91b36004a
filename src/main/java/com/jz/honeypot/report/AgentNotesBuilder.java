package com.jz.honeypot.report;

import com.jz.honeypot.domain.IntelKind;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.domain.Stage;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 一行行为摘要，各段用 " | " 分隔，永远不为空。
 */
@Component
public class AgentNotesBuilder {

    private static final List<IntelKind> SUMMARISED = List.of(
            IntelKind.PHONE_NUMBER, IntelKind.BANK_ACCOUNT, IntelKind.UPI_ID,
            IntelKind.PHISHING_LINK, IntelKind.EMAIL, IntelKind.CASE_ID);

    public String build(SessionState s, long nowMillis) {
        List<String> parts = new ArrayList<>();
        parts.add("Classification: " + humanize(s.getScamType()));

        if (!s.getTriggeredCategories().isEmpty()) {
            List<String> labels = s.getTriggeredCategories().stream()
                    .map(c -> c.replace('_', ' '))
                    .sorted()
                    .toList();
            parts.add("Detected signals: " + String.join(", ", labels));
        }

        parts.add("Messages exchanged: " + s.getMessagesExchanged());
        parts.add("Engagement duration: " + s.elapsedMillis(nowMillis) / 1000 + "s");

        List<String> intel = new ArrayList<>();
        for (IntelKind kind : SUMMARISED) {
            Set<String> values = s.getIntelligence().get(kind);
            if (values != null && !values.isEmpty()) {
                intel.add(values.size() + " " + kind.field());
            }
        }
        parts.add(intel.isEmpty()
                ? "No concrete identifiers extracted"
                : "Extracted intelligence: " + String.join(", ", intel));

        if (!s.getObservedTactics().isEmpty()) {
            parts.add("Scammer tactics observed: " + String.join(", ", s.getObservedTactics().stream().sorted().toList()));
        }
        Stage stage = s.getStage();
        parts.add("Engagement reached stage " + (stage.ordinal() + 1) + "/" + Stage.values().length
                + " (" + stage.name().toLowerCase(Locale.ROOT) + ")");
        return String.join(" | ", parts);
    }

    private static String humanize(String type) {
        if (type == null || type.isBlank()) return "Unknown";
        String[] words = type.split("_");
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (w.isEmpty()) continue;
            if (sb.length() > 0) sb.append(' ');
            sb.append(Character.toUpperCase(w.charAt(0))).append(w.substring(1));
        }
        return sb.toString();
    }
}
