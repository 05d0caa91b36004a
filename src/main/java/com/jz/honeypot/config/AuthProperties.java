package com.jz.honeypot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 接口鉴权（honeypot.auth.*）。apiKey 为空时不校验。
 */
@Data
@ConfigurationProperties(prefix = "honeypot.auth")
public class AuthProperties {
    private String apiKey;
    private String header = "x-api-key";
    private String protectedPath = "/api/";
}
