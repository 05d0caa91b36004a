package com.jz.honeypot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.jz.honeypot")
public class HoneypotApplication {
    public static void main(String[] args) {
        SpringApplication.run(HoneypotApplication.class);
    }
}
