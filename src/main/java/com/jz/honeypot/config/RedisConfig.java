package com.jz.honeypot.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jz.honeypot.domain.SessionState;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.StringRedisSerializer;

@Configuration
@ConditionalOnProperty(prefix = "honeypot.session", name = "store", havingValue = "redis")
public class RedisConfig {

    /** 会话状态按具体类型做 JSON 序列化，不写类型信息 */
    @Bean
    public RedisTemplate<String, SessionState> sessionRedisTemplate(RedisConnectionFactory cf, ObjectMapper mapper) {
        RedisTemplate<String, SessionState> t = new RedisTemplate<>();
        t.setConnectionFactory(cf);

        StringRedisSerializer keySer = new StringRedisSerializer();
        Jackson2JsonRedisSerializer<SessionState> valSer = new Jackson2JsonRedisSerializer<>(mapper, SessionState.class);

        t.setKeySerializer(keySer);
        t.setHashKeySerializer(keySer);
        t.setValueSerializer(valSer);
        t.setHashValueSerializer(valSer);
        t.afterPropertiesSet();
        return t;
    }
}
