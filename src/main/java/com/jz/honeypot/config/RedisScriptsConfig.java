package com.jz.honeypot.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.script.DefaultRedisScript;

@Configuration
@ConditionalOnProperty(prefix = "honeypot.session", name = "store", havingValue = "redis")
public class RedisScriptsConfig {

    /** token 一致才删除 */
    @Bean
    public DefaultRedisScript<Long> unlockScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText(
                "if redis.call('get', KEYS[1]) == ARGV[1] then " +
                        "  return redis.call('del', KEYS[1]) " +
                        "else return 0 end"
        );
        return s;
    }

    /** token 一致才 PEXPIRE，ARGV[2] 为毫秒 */
    @Bean
    public DefaultRedisScript<Long> renewScript() {
        var s = new DefaultRedisScript<Long>();
        s.setResultType(Long.class);
        s.setScriptText(
                "if redis.call('get', KEYS[1]) == ARGV[1] then " +
                        "  return redis.call('pexpire', KEYS[1], ARGV[2]) " +
                        "else return 0 end"
        );
        return s;
    }
}
