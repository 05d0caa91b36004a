package com.jz.honeypot.session;

import com.jz.honeypot.config.SessionProperties;
import com.jz.honeypot.domain.SessionState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.function.Function;

/**
 * Redis 存储：状态以 JSON 保存并带闲置 TTL，修改前先拿分布式锁。
 * 过期回收交给 Redis 自己。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "honeypot.session", name = "store", havingValue = "redis")
public class RedisSessionStore implements SessionStore {

    private static final String LOCK_SUFFIX = ":lock";

    private final RedisTemplate<String, SessionState> sessionRedisTemplate;
    private final SessionLockWatchdog watchdog;
    private final SessionProperties props;
    private final Clock clock;

    public RedisSessionStore(RedisTemplate<String, SessionState> sessionRedisTemplate,
                             SessionLockWatchdog watchdog,
                             SessionProperties props,
                             Clock clock) {
        this.sessionRedisTemplate = sessionRedisTemplate;
        this.watchdog = watchdog;
        this.props = props;
        this.clock = clock;
    }

    @Override
    public <T> T withSession(String sessionId, Function<SessionState, T> action) {
        String key = key(sessionId);
        try (SessionLockWatchdog.LockSession ignored = watchdog.acquire(key + LOCK_SUFFIX)) {
            SessionState state = sessionRedisTemplate.opsForValue().get(key);
            if (state == null) {
                state = SessionState.create(sessionId, clock.millis());
                log.debug("New session, sessionId={}", sessionId);
            }
            T result = action.apply(state);
            sessionRedisTemplate.opsForValue().set(key, state, props.getIdleTtl());
            return result;
        }
    }

    /** GET 拿到的是反序列化出来的副本，不需要加锁 */
    @Override
    public <T> Optional<T> read(String sessionId, Function<SessionState, T> view) {
        return Optional.ofNullable(sessionRedisTemplate.opsForValue().get(key(sessionId))).map(view);
    }

    @Override
    public int evictIdle() {
        return 0;
    }

    private String key(String sessionId) {
        return props.getKeyPrefix() + sessionId;
    }
}
