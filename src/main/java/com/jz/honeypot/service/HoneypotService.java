package com.jz.honeypot.service;

import com.jz.honeypot.domain.dto.HoneypotReplyDTO;
import com.jz.honeypot.domain.dto.HoneypotRequest;
import com.jz.honeypot.domain.dto.SessionSummaryDTO;

import java.util.Optional;

public interface HoneypotService {

    /** 处理一条入站消息，返回诱饵回复；会话满足条件时顺带触发结案上报 */
    HoneypotReplyDTO handle(HoneypotRequest request);

    Optional<SessionSummaryDTO> summary(String sessionId);
}
