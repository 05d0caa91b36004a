package com.jz.honeypot.controller;

import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 对骗子一侧永远不暴露错误：内部异常一律回一句拖延的话。
 * 只有请求体本身不可解析时才回 400。
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    static final List<String> STALLING_REPLIES = List.of(
            "Sorry, my phone is hanging. Can you say that again?",
            "One minute please, someone is at the door.",
            "I am not understanding, my network is very slow today.",
            "Wait, I am finding my reading glasses. What did you say?");

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadable(HttpMessageNotReadableException e) {
        log.warn("Malformed request body: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(Map.of("status", "error", "message", "malformed request body"));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<HoneypotReplyDTO> unexpected(RuntimeException e) {
        log.error("Unhandled error, replying with a stall", e);
        String reply = STALLING_REPLIES.get(ThreadLocalRandom.current().nextInt(STALLING_REPLIES.size()));
        return ResponseEntity.ok(HoneypotReplyDTO.success(reply));
    }
}
