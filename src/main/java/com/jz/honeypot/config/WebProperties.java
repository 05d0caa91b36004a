package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 跨域（honeypot.web.*）
 */
@Data
@ConfigurationProperties(prefix = "honeypot.web")
public class WebProperties {
    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("http://localhost:*"));
}
