package com.jz.honeypot.domain;

public enum IntelKind {
    PHONE_NUMBER("phoneNumbers"),
    UPI_ID("upiIds"),
    BANK_ACCOUNT("bankAccounts"),
    PHISHING_LINK("phishingLinks"),
    EMAIL("emailAddresses"),
    IFSC_CODE("ifscCodes"),
    CASE_ID("caseIds"),
    SUSPICIOUS_KEYWORD("suspiciousKeywords");

    private final String field;

    IntelKind(String field) {
        this.field = field;
    }

    /** 对外报告里的字段名 */
    public String field() {
        return field;
    }
}
