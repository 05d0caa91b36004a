package com.jz.honeypot.session;

import com.jz.honeypot.config.SessionProperties;
import com.jz.honeypot.domain.SessionState;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * 进程内存储：每个会话一把 ReentrantLock，定时清理闲置会话。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "honeypot.session", name = "store", havingValue = "memory", matchIfMissing = true)
public class InMemorySessionStore implements SessionStore {

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final SessionProperties props;
    private final Clock clock;

    public InMemorySessionStore(SessionProperties props, Clock clock, MeterRegistry registry) {
        this.props = props;
        this.clock = clock;
        Gauge.builder("honeypot.session.active", sessions, Map::size)
                .description("sessions held in memory")
                .register(registry);
    }

    @Override
    public <T> T withSession(String sessionId, Function<SessionState, T> action) {
        while (true) {
            Entry e = sessions.computeIfAbsent(sessionId,
                    id -> new Entry(SessionState.create(id, clock.millis())));
            e.lock.lock();
            try {
                // 拿锁期间被清理掉了，重新取一个
                if (e.removed) continue;
                return action.apply(e.state);
            } finally {
                e.lock.unlock();
            }
        }
    }

    @Override
    public <T> Optional<T> read(String sessionId, Function<SessionState, T> view) {
        Entry e = sessions.get(sessionId);
        if (e == null) return Optional.empty();
        e.lock.lock();
        try {
            if (e.removed) return Optional.empty();
            return Optional.ofNullable(view.apply(e.state));
        } finally {
            e.lock.unlock();
        }
    }

    @Scheduled(fixedDelayString = "${honeypot.session.eviction-interval-ms:60000}")
    public void scheduledEviction() {
        evictIdle();
    }

    @Override
    public int evictIdle() {
        long now = clock.millis();
        long ttl = props.getIdleTtl().toMillis();
        int evicted = 0;
        Iterator<Map.Entry<String, Entry>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> me = it.next();
            Entry e = me.getValue();
            if (now - e.state.getLastActivityAt() < ttl) continue;
            // 正在处理的会话跳过，下一轮再说
            if (!e.lock.tryLock()) continue;
            try {
                if (now - e.state.getLastActivityAt() >= ttl) {
                    e.removed = true;
                    it.remove();
                    evicted++;
                }
            } finally {
                e.lock.unlock();
            }
        }
        if (evicted > 0) {
            log.info("Evicted idle sessions, count={} remaining={}", evicted, sessions.size());
        }
        return evicted;
    }

    private static final class Entry {
        final ReentrantLock lock = new ReentrantLock();
        final SessionState state;
        volatile boolean removed;

        Entry(SessionState state) {
            this.state = state;
        }
    }
}
