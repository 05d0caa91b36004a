package com.jz.honeypot.session;

/**
 * 在等待时间内没有拿到会话锁。
 */
public class SessionBusyException extends RuntimeException {
    public SessionBusyException(String key) {
        super("session is busy: " + key);
    }
}
