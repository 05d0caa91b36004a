package com.jz.honeypot.session;

import com.jz.honeypot.domain.SessionState;

import java.util.Optional;
import java.util.function.Function;

/**
 * 会话存储。withSession 保证同一 sessionId 同一时刻只有一个修改在进行；
 * 不存在时自动创建一个默认状态。
 */
public interface SessionStore {

    <T> T withSession(String sessionId, Function<SessionState, T> action);

    /**
     * 只读投影，不存在时返回空且不创建。view 在会话锁内执行，
     * 返回值不应再引用 SessionState 里的可变对象。
     */
    <T> Optional<T> read(String sessionId, Function<SessionState, T> view);

    /** 回收闲置超时的会话，返回回收数量 */
    int evictIdle();
}
