package com.jz.honeypot.session;

import com.jz.honeypot.config.SessionProperties;
import com.jz.honeypot.domain.SessionState;
import com.jz.honeypot.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySessionStoreTest {

    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private InMemorySessionStore store;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt(1_700_000_000_000L);
        registry = new SimpleMeterRegistry();
        SessionProperties props = new SessionProperties();
        props.setIdleTtl(Duration.ofMinutes(30));
        store = new InMemorySessionStore(props, clock, registry);
    }

    @Test
    void createsDefaultStateOnFirstAccess() {
        SessionState s = store.withSession("abc", state -> state);

        assertThat(s.getSessionId()).isEqualTo("abc");
        assertThat(s.getTurnIndex()).isZero();
        assertThat(s.getCreatedAt()).isEqualTo(clock.millis());
        assertThat(store.read("abc", SessionState::getSessionId)).contains("abc");
        assertThat(store.read("missing", SessionState::getSessionId)).isEmpty();
        assertThat(registry.get("honeypot.session.active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void mutationsUnderSameIdAreSerialized() throws Exception {
        int threads = 8;
        int perThread = 200;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger overlap = new AtomicInteger();
        try {
            for (int i = 0; i < threads; i++) {
                pool.execute(() -> {
                    for (int j = 0; j < perThread; j++) {
                        store.withSession("shared", s -> {
                            if (inside.incrementAndGet() > 1) overlap.incrementAndGet();
                            s.setTurnIndex(s.getTurnIndex() + 1);
                            inside.decrementAndGet();
                            return null;
                        });
                    }
                    done.countDown();
                });
            }
            assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(overlap.get()).isZero();
        assertThat(store.read("shared", SessionState::getTurnIndex).orElseThrow()).isEqualTo(threads * perThread);
    }

    @Test
    void evictsOnlyIdleSessions() {
        store.withSession("old", s -> null);
        clock.advance(Duration.ofMinutes(20));
        store.withSession("fresh", s -> {
            s.setLastActivityAt(clock.millis());
            return null;
        });
        clock.advance(Duration.ofMinutes(10));

        int evicted = store.evictIdle();

        assertThat(evicted).isEqualTo(1);
        assertThat(store.read("old", SessionState::getTurnIndex)).isEmpty();
        assertThat(store.read("fresh", SessionState::getTurnIndex)).isPresent();
        assertThat(registry.get("honeypot.session.active").gauge().value()).isEqualTo(1.0);
    }

    @Test
    void readWaitsForInFlightMutation() throws Exception {
        store.withSession("busy", s -> null);
        CountDownLatch inside = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            pool.execute(() -> store.withSession("busy", s -> {
                s.setTurnIndex(1);
                inside.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                s.setTurnIndex(2);
                return null;
            }));
            assertThat(inside.await(5, TimeUnit.SECONDS)).isTrue();
            Future<Integer> seen = pool.submit(() -> store.read("busy", SessionState::getTurnIndex).orElseThrow());
            Thread.sleep(50);
            assertThat(seen.isDone()).isFalse();

            release.countDown();

            assertThat(seen.get(5, TimeUnit.SECONDS)).isEqualTo(2);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void readDoesNotCreateSession() {
        assertThat(store.read("nobody", s -> s)).isEmpty();

        assertThat(registry.get("honeypot.session.active").gauge().value()).isZero();
    }

    @Test
    void evictedSessionStartsOverOnNextAccess() {
        store.withSession("gone", s -> {
            s.setTurnIndex(7);
            return null;
        });
        clock.advance(Duration.ofHours(1));
        store.evictIdle();

        SessionState again = store.withSession("gone", s -> s);

        assertThat(again.getTurnIndex()).isZero();
    }
}
