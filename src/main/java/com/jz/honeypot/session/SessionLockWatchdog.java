package com.jz.honeypot.session;

import com.jz.honeypot.config.SessionProperties;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.DefaultRedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 会话级 Redis 锁：SET NX PX 加锁，token 比对解锁，看门狗每 ttl/3 续期一次。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "honeypot.session", name = "store", havingValue = "redis")
public class SessionLockWatchdog {

    private final StringRedisTemplate redis;
    private final DefaultRedisScript<Long> unlockScript;
    private final DefaultRedisScript<Long> renewScript;
    private final ScheduledExecutorService scheduler;
    private final SessionProperties props;
    private final Retry acquireRetry;

    public SessionLockWatchdog(StringRedisTemplate redis,
                               DefaultRedisScript<Long> unlockScript,
                               DefaultRedisScript<Long> renewScript,
                               ScheduledExecutorService lockRenewScheduler,
                               SessionProperties props) {
        this.redis = redis;
        this.unlockScript = unlockScript;
        this.renewScript = renewScript;
        this.scheduler = lockRenewScheduler;
        this.props = props;
        this.acquireRetry = Retry.of("session-lock", acquireRetryConfig(props));
    }

    /** 单次尝试，失败返回 null */
    public LockSession tryAcquire(String key, long ttlMs) {
        String token = UUID.randomUUID().toString();
        Boolean ok = redis.opsForValue().setIfAbsent(key, token, ttlMs, TimeUnit.MILLISECONDS);
        if (!Boolean.TRUE.equals(ok)) return null;
        return new LockSession(key, token, ttlMs);
    }

    /**
     * 在 lockWaitMs 内按 lockRetryMs 间隔反复尝试加锁，成功后自动启动看门狗。
     *
     * @throws SessionBusyException 超时仍未拿到锁
     */
    public LockSession acquire(String key) {
        Supplier<LockSession> attempt = Retry.decorateSupplier(acquireRetry,
                () -> tryAcquire(key, props.getLockTtlMs()));
        LockSession s = attempt.get();
        if (s == null) {
            throw new SessionBusyException(key);
        }
        s.startWatchdog();
        return s;
    }

    /** lockWaitMs 为 0 时只尝试一次 */
    static RetryConfig acquireRetryConfig(SessionProperties props) {
        long intervalMs = Math.max(1L, props.getLockRetryMs());
        int attempts = (int) Math.min(Integer.MAX_VALUE - 1L, Math.max(0L, props.getLockWaitMs()) / intervalMs) + 1;
        return RetryConfig.<LockSession>custom()
                .maxAttempts(attempts)
                .waitDuration(Duration.ofMillis(intervalMs))
                .retryOnResult(Objects::isNull)
                .build();
    }

    @Getter
    public class LockSession implements AutoCloseable {
        private final String key;
        private final String token;
        private final long ttlMs;
        private volatile ScheduledFuture<?> renewTask;
        private volatile boolean closed = false;

        private LockSession(String key, String token, long ttlMs) {
            this.key = key;
            this.token = token;
            this.ttlMs = ttlMs;
        }

        public void startWatchdog() {
            long period = Math.max(1000L, ttlMs / 3);
            this.renewTask = scheduler.scheduleAtFixedRate(() -> {
                try {
                    if (!renewNow()) {
                        // 锁已不属于自己或已过期
                        cancelRenewal();
                        log.warn("Session lock lost, key={}", key);
                    }
                } catch (RuntimeException e) {
                    log.debug("Session lock renew error, key={} err={}", key, e.toString());
                }
            }, period, period, TimeUnit.MILLISECONDS);
        }

        public boolean renewNow() {
            Long res = redis.execute(renewScript, Collections.singletonList(key), token, String.valueOf(ttlMs));
            return res != null && res > 0;
        }

        public void cancelRenewal() {
            ScheduledFuture<?> t = this.renewTask;
            if (t != null) t.cancel(false);
            this.renewTask = null;
        }

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            cancelRenewal();
            try {
                Long res = redis.execute(unlockScript, Collections.singletonList(key), token);
                if (res == null || res == 0L) {
                    log.debug("Session lock already released or expired, key={}", key);
                }
            } catch (RuntimeException e) {
                log.warn("Session unlock failed, key={} err={}", key, e.toString());
            }
        }
    }
}
