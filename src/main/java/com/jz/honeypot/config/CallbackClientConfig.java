package com.jz.honeypot.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

@Configuration
public class CallbackClientConfig {

    /** 结案回调专用，超时走 honeypot.callback.* */
    @Bean
    public RestTemplate callbackRestTemplate(RestTemplateBuilder builder, CallbackProperties props) {
        return builder
                .setConnectTimeout(props.getConnectTimeout())
                .setReadTimeout(props.getReadTimeout())
                .build();
    }
}
