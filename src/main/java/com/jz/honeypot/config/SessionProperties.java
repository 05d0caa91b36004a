package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 会话存储（honeypot.session.*）
 */
@Data
@ConfigurationProperties(prefix = "honeypot.session")
public class SessionProperties {

    /** memory | redis */
    private String store = "memory";

    /** 闲置多久回收 */
    private Duration idleTtl = Duration.ofMinutes(30);

    /** 内存存储的清理周期（毫秒），供 @Scheduled 使用 */
    private long evictionIntervalMs = 60_000L;

    private String keyPrefix = "honeypot:session:";

    /** Redis 锁 TTL，看门狗每 ttl/3 续期 */
    private long lockTtlMs = 10_000L;

    /** 抢锁最长等待 */
    private long lockWaitMs = 5_000L;

    /** 抢锁重试间隔 */
    private long lockRetryMs = 50L;
}
