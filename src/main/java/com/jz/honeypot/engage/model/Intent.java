package com.jz.honeypot.engage.model;

import com.jz.honeypot.domain.Tactic;

import java.util.List;

/**
 * 15 个意图类别及其关键词（关键词同时用于原型向量和关键词重叠打分）。
 */
public enum Intent {
    URGENCY(Tactic.URGENCY, List.of(
            "urgent", "immediately", "hurry", "right now", "last chance",
            "final notice", "expiring", "deadline", "limited time", "act now")),
    AUTHORITY(Tactic.THREAT, List.of(
            "rbi", "police", "cbi", "income tax", "government", "officer",
            "commissioner", "cyber cell", "court order", "ministry")),
    OTP_REQUEST(Tactic.OTP, List.of(
            "otp", "one time password", "verification code", "share the code",
            "cvv", "atm pin", "mpin", "upi pin", "read the otp")),
    PAYMENT_REQUEST(Tactic.PAYMENT, List.of(
            "send money", "transfer", "pay now", "processing fee",
            "upi", "paytm", "neft", "bank transfer", "security deposit")),
    SUSPENSION(Tactic.ACCOUNT, List.of(
            "account blocked", "suspended", "deactivated", "frozen",
            "kyc update", "compromised", "unauthorized access", "locked")),
    PRIZE_LURE(Tactic.PAYMENT, List.of(
            "congratulations", "won", "prize", "lottery", "cashback",
            "reward", "lucky draw", "jackpot", "selected for", "free gift")),
    SUSPICIOUS_URL(Tactic.TECH, List.of(
            "click here", "bit.ly", "download app", "install", "link",
            "anydesk", "teamviewer", "screen share", "remote access")),
    EMOTIONAL_PRESSURE(Tactic.THREAT, List.of(
            "scared", "afraid", "danger", "shame", "your family",
            "trust me", "confidential", "no choice", "save yourself")),
    LEGAL_THREAT(Tactic.THREAT, List.of(
            "arrest", "warrant", "fir", "jail", "legal action",
            "money laundering", "digital arrest", "criminal case")),
    COURIER(Tactic.COURIER, List.of(
            "parcel", "courier", "customs", "drugs found", "contraband",
            "fedex", "shipment", "tracking number", "seized")),
    TECH_SUPPORT(Tactic.TECH, List.of(
            "virus detected", "computer hacked", "anydesk", "remote access",
            "screen sharing", "tech support", "malware", "microsoft")),
    JOB_FRAUD(Tactic.PAYMENT, List.of(
            "work from home", "online job", "earn daily", "part time job",
            "telegram group", "training fee", "product review")),
    INVESTMENT(Tactic.PAYMENT, List.of(
            "guaranteed returns", "double your money", "crypto", "bitcoin",
            "stock tip", "trading", "mutual fund", "demat account")),
    IDENTITY_THEFT(Tactic.IDENTITY, List.of(
            "aadhaar number", "pan card", "voter id", "passport number",
            "selfie with id", "share your aadhaar", "date of birth")),
    NEUTRAL(null, List.of(
            "hello", "hi", "good morning", "how are you", "thank you",
            "namaste", "okay", "yes", "no", "please"));

    public static final int COUNT = values().length;

    private final Tactic tactic;
    private final List<String> keywords;

    Intent(Tactic tactic, List<String> keywords) {
        this.tactic = tactic;
        this.keywords = keywords;
    }

    /** 与该意图对齐的回复手法；NEUTRAL 为 null */
    public Tactic tactic() {
        return tactic;
    }

    public List<String> keywords() {
        return keywords;
    }

    public String key() {
        return name().toLowerCase();
    }
}
