package com.jz.honeypot.controller;

import com.jz.honeypot.common.Result;
import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import com.jz.honeypot.domain.dto.HoneypotRequest;
import com.jz.honeypot.domain.dto.SessionSummaryDTO;
import com.jz.honeypot.service.HoneypotService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
public class HoneypotController {

    private final HoneypotService honeypotService;

    @PostMapping("/api/honeypot")
    public ResponseEntity<?> receive(@RequestBody(required = false) HoneypotRequest request) {
        if (request == null || request.getSessionId() == null || request.getSessionId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("status", "error", "message", "sessionId is required"));
        }
        if (request.getMessage() == null) {
            return ResponseEntity.badRequest().body(Map.of("status", "error", "message", "message is required"));
        }
        HoneypotReplyDTO reply = honeypotService.handle(request);
        return ResponseEntity.ok(reply);
    }

    @GetMapping("/api/honeypot/sessions/{sessionId}")
    public ResponseEntity<Result<SessionSummaryDTO>> session(@PathVariable String sessionId) {
        return honeypotService.summary(sessionId)
                .map(s -> ResponseEntity.ok(Result.success(s)))
                .orElseGet(() -> ResponseEntity.status(404).body(Result.notFound("session not found: " + sessionId)));
    }

    @GetMapping("/")
    public Map<String, String> health() {
        return Map.of("status", "ok", "service", "honeypot-engine");
    }
}
