package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 结案回调（honeypot.callback.*）
 */
@Data
@ConfigurationProperties(prefix = "honeypot.callback")
public class CallbackProperties {
    private boolean enabled = false;
    private String url;
    /** 额外携带的 x-api-key，可为空 */
    private String apiKey;
    /** 总尝试次数（含第一次） */
    private int maxAttempts = 3;
    /** 线性退避：第 n 次重试前等待 n * backoff */
    private Duration backoff = Duration.ofSeconds(1);
    private Duration connectTimeout = Duration.ofSeconds(3);
    private Duration readTimeout = Duration.ofSeconds(5);
}
