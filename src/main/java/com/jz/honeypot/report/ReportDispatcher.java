package com.jz.honeypot.report;

import com.jz.honeypot.config.CallbackProperties;
import com.jz.honeypot.domain.dto.FinalReportDTO;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * 异步投递结案报文，请求线程不等待回调结果。
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReportDispatcher {

    private final FinalReportClient client;
    private final CallbackProperties props;

    @Async("callbackExecutor")
    public void dispatch(FinalReportDTO report) {
        if (!props.isEnabled() || props.getUrl() == null || props.getUrl().isBlank()) {
            log.info("Callback disabled, report kept local. sessionId={} type={} messages={}",
                    report.getSessionId(), report.getScamType(), report.getTotalMessagesExchanged());
            return;
        }
        log.info("Dispatching final report, sessionId={} type={} confidence={}",
                report.getSessionId(), report.getScamType(), report.getConfidenceLevel());
        client.send(report);
    }
}
