package com.jz.honeypot.config;

import com.jz.honeypot.engage.model.EngagementModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** 固定种子生成的整套权重，进程内只建一次 */
    @Bean
    public EngagementModel engagementModel(EngagementProperties props) {
        long seed = props.getRanker().getWeightSeed();
        log.info("Building engagement model, seed={}", seed);
        return new EngagementModel(seed);
    }
}
