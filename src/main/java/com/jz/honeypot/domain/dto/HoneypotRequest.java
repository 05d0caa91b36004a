package com.jz.honeypot.domain.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 入站请求：当前消息 + 可选的历史记录。
 */
@Data
public class HoneypotRequest {

    private String sessionId;

    private Message message;

    private List<Message> conversationHistory = new ArrayList<>();

    private Map<String, Object> metadata;

    @Data
    public static class Message {
        /** scammer / user */
        private String sender;
        private String text;
        private Object timestamp;

        public boolean fromScammer() {
            return sender == null || "scammer".equalsIgnoreCase(sender);
        }
    }
}
