package com.jz.honeypot.detect;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import static com.jz.honeypot.detect.SignalLayers.*;

/**
 * 按会话累计出现的类别给出诈骗类型标签，越具体的类别优先。
 */
@Component
public class ScamTypeClassifier {

    public static final String UNKNOWN = "unknown";

    private static final Map<String, String> PRIORITY = new LinkedHashMap<>();

    static {
        PRIORITY.put(COURIER, "courier");
        PRIORITY.put(DIGITAL_ARREST, "digital_arrest");
        PRIORITY.put(INVESTMENT, "investment");
        PRIORITY.put(TECH_SUPPORT, "tech_support");
        PRIORITY.put(JOB_LOAN, "job_fraud");
        PRIORITY.put(PRIZE, "lottery");
        PRIORITY.put(BANK_DETAIL, "upi_fraud");
        PRIORITY.put(AUTHORITY, "impersonation");
        PRIORITY.put(OTP, "phishing");
        PRIORITY.put(PHISHING, "phishing");
        PRIORITY.put(SUSPENSION, "bank_fraud");
        PRIORITY.put(PAYMENT, "bank_fraud");
        PRIORITY.put(LEGAL, "impersonation");
        PRIORITY.put(IDENTITY, "identity_theft");
    }

    public String classify(Set<String> categories) {
        if (categories == null || categories.isEmpty()) return UNKNOWN;
        for (Map.Entry<String, String> e : PRIORITY.entrySet()) {
            if (categories.contains(e.getKey())) return e.getValue();
        }
        return UNKNOWN;
    }
}
