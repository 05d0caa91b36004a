package com.jz.honeypot.report;

import com.jz.honeypot.config.CallbackProperties;
import com.jz.honeypot.domain.dto.FinalReportDTO;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 把结案报文 POST 到回调地址，重试交给 resilience4j Retry。
 */
@Slf4j
@Component
public class FinalReportClient {

    private final RestTemplate callbackRestTemplate;
    private final CallbackProperties props;
    private final Counter sentCounter;
    private final Counter failedCounter;
    private final RetryConfig retryConfig;

    public FinalReportClient(RestTemplate callbackRestTemplate, CallbackProperties props, MeterRegistry registry) {
        this.callbackRestTemplate = callbackRestTemplate;
        this.props = props;
        this.sentCounter = Counter.builder("honeypot.report.sent.count").register(registry);
        this.failedCounter = Counter.builder("honeypot.report.failed.count").register(registry);
        this.retryConfig = retryConfig(props);
    }

    /** 第 n 次重试前等待 n * backoff；非 2xx 和 RestClientException 都重试 */
    static RetryConfig retryConfig(CallbackProperties props) {
        return RetryConfig.<ResponseEntity<String>>custom()
                .maxAttempts(Math.max(1, props.getMaxAttempts()))
                .intervalFunction(linearBackoff(props.getBackoff()))
                .retryOnResult(resp -> resp == null || !resp.getStatusCode().is2xxSuccessful())
                .retryExceptions(RestClientException.class)
                .build();
    }

    /** IntervalFunction 不接受小于 1ms 的间隔 */
    static IntervalFunction linearBackoff(Duration step) {
        long stepMs = Math.max(1L, step.toMillis());
        return IntervalFunction.of(Duration.ofMillis(stepMs), prev -> prev + stepMs);
    }

    /**
     * @return 回调方返回 2xx 即为 true；重试耗尽返回 false，不抛异常
     */
    public boolean send(FinalReportDTO report) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            headers.set("x-api-key", props.getApiKey());
        }
        HttpEntity<FinalReportDTO> entity = new HttpEntity<>(report, headers);

        Retry retry = Retry.of("final-report-" + report.getSessionId(), retryConfig);
        retry.getEventPublisher().onRetry(e -> log.warn("Final report retry, sessionId={} attempt={} err={}",
                report.getSessionId(), e.getNumberOfRetryAttempts(),
                e.getLastThrowable() == null ? "non-2xx" : e.getLastThrowable().toString()));
        Supplier<ResponseEntity<String>> post = Retry.decorateSupplier(retry,
                () -> callbackRestTemplate.postForEntity(props.getUrl(), entity, String.class));

        try {
            ResponseEntity<String> resp = post.get();
            if (resp != null && resp.getStatusCode().is2xxSuccessful()) {
                sentCounter.increment();
                log.info("Final report accepted, sessionId={} status={}",
                        report.getSessionId(), resp.getStatusCode().value());
                return true;
            }
            log.warn("Final report rejected, sessionId={} status={}",
                    report.getSessionId(), resp == null ? null : resp.getStatusCode().value());
        } catch (RuntimeException e) {
            log.warn("Final report failed, sessionId={} err={}", report.getSessionId(), e.toString());
        }
        failedCounter.increment();
        log.error("Final report gave up, sessionId={} attempts={}", report.getSessionId(), retryConfig.getMaxAttempts());
        return false;
    }
}
