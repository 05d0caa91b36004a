package com.jz.honeypot.extract;

import com.jz.honeypot.domain.IntelKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 从骗子消息里抽取可上报的标识：电话、UPI、银行账号、链接、邮箱、IFSC、案件号。
 * 无状态，结果由调用方并入会话。
 */
@Slf4j
@Component
public class IntelligenceExtractor {

    private static final int CI = Pattern.CASE_INSENSITIVE;

    // 前后不能紧贴数字，避免从长账号里截出手机号
    private static final List<Pattern> PHONE = List.of(
            Pattern.compile("(?<![\\d\\w])\\+?91[\\s-]?[6-9]\\d{9}(?!\\d)"),
            Pattern.compile("(?<![\\d\\w])\\+?91[\\s-]?[6-9]\\d{4}[\\s-]\\d{5}(?!\\d)"),
            Pattern.compile("(?<![\\d\\w])0[6-9]\\d{9}(?!\\d)"),
            Pattern.compile("(?<![\\d\\w])[6-9]\\d{9}(?!\\d)"),
            Pattern.compile("(?<![\\d\\w])[6-9]\\d{4}[\\s-]\\d{5}(?!\\d)"),
            Pattern.compile("(?<![\\d\\w])[6-9]\\d{2}[\\s-]\\d{3}[\\s-]\\d{4}(?!\\d)"),
            Pattern.compile("\\bwa\\.me/(?:\\+?91)?([6-9]\\d{9})(?!\\d)", CI)
    );

    private static final List<Pattern> BANK_ACCOUNT = List.of(
            Pattern.compile("(?:account|a/c|acct|acc)\\s*(?:no|number|num|#)?[\\s:.#-]*(\\d[\\d\\s-]{7,22}\\d)", CI),
            Pattern.compile("(?:transfer|deposit|send|credit)\\s*to\\s*(?:account\\s*)?(\\d{9,18})(?!\\d)", CI),
            Pattern.compile("(?:beneficiary|payee|receiver)\\s*(?:account|a/c)?\\s*(?:no|number)?[\\s:.#-]*(\\d{9,18})(?!\\d)", CI)
    );

    private static final Pattern UPI =
            Pattern.compile("(?<![\\w.-])([\\w.-]{2,}@[a-zA-Z][a-zA-Z0-9]{1,30})\\b(?![.-][a-zA-Z0-9])");

    private static final Pattern EMAIL =
            Pattern.compile("\\b[a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,}\\b");

    private static final List<Pattern> URL = List.of(
            Pattern.compile("https?://[^\\s<>\"{}|\\\\^`\\[\\]]+", CI),
            Pattern.compile("(?<![@\\w./-])(?:bit\\.ly|tinyurl\\.com|goo\\.gl|t\\.co|rb\\.gy|is\\.gd|cutt\\.ly|shorturl\\.at|ow\\.ly|tiny\\.cc|rebrand\\.ly)/[a-zA-Z0-9_-]+", CI),
            Pattern.compile("(?<![@\\w./-])(?:wa\\.me/[0-9]+|t\\.me/[a-zA-Z0-9_]+)", CI),
            Pattern.compile("(?<![@\\w./-])[a-z0-9-]{4,}\\.(?:xyz|top|online|site|click|live|club|icu|buzz|loan|win)(?:/[^\\s]*)?(?![\\w.])", CI)
    );

    private static final Pattern IFSC = Pattern.compile("\\b[A-Z]{4}0[A-Z0-9]{6}\\b");
    private static final Pattern IFSC_KEYED = Pattern.compile("ifsc\\s*(?:code)?[\\s:.#-]*([a-z]{4}0[a-z0-9]{6})\\b", CI);

    private static final List<Pattern> CASE_ID = List.of(
            Pattern.compile("\\b(?:case|complaint|reference|ref|ticket|fir)\\b\\s*(?:number|no|id|#)?\\s*(?:is)?[\\s:#.-]*(?=[A-Z0-9/-]*\\d)([A-Z0-9][A-Z0-9/-]{2,20})\\b", CI),
            Pattern.compile("\\b[A-Z]{2,10}-[A-Z0-9]{2,12}-[A-Z0-9-]{3,25}\\b")
    );

    /** 这些后缀是常见邮箱，不当 UPI */
    private static final Set<String> EMAIL_HANDLES = Set.of(
            "gmail", "yahoo", "hotmail", "outlook", "live", "rediffmail", "protonmail", "icloud", "zoho", "mail");

    /** 常见 UPI 后缀，出现在 xx@ybl.com 这种写法时也不算邮箱 */
    private static final Set<String> UPI_PROVIDERS = Set.of(
            "paytm", "ybl", "okaxis", "oksbi", "okhdfcbank", "okicici", "axl", "ibl", "upi", "apl",
            "freecharge", "airtel", "jio", "slice", "amazonpay", "axisbank", "sbi", "hdfcbank",
            "icici", "kotak", "pnb", "bob", "canara", "fakebank", "phonepe", "gpay");

    public Map<IntelKind, Set<String>> extract(String text) {
        Map<IntelKind, Set<String>> found = new EnumMap<>(IntelKind.class);
        if (text == null || text.isBlank()) return found;

        phones(text, bucket(found, IntelKind.PHONE_NUMBER));
        bankAccounts(text, bucket(found, IntelKind.BANK_ACCOUNT));
        upiIds(text, bucket(found, IntelKind.UPI_ID));
        emails(text, bucket(found, IntelKind.EMAIL));
        urls(text, bucket(found, IntelKind.PHISHING_LINK));
        ifsc(text, bucket(found, IntelKind.IFSC_CODE));
        caseIds(text, bucket(found, IntelKind.CASE_ID));

        found.values().removeIf(Set::isEmpty);
        if (!found.isEmpty()) {
            log.debug("Intel extracted, kinds={}", found.keySet());
        }
        return found;
    }

    /** 统一成 +91XXXXXXXXXX；不是手机号返回 null */
    static String normalizePhone(String raw) {
        String digits = raw.replaceAll("\\D", "");
        if (digits.length() == 12 && digits.startsWith("91")) {
            digits = digits.substring(2);
        } else if (digits.length() == 11 && digits.startsWith("0")) {
            digits = digits.substring(1);
        }
        if (digits.length() == 10 && "6789".indexOf(digits.charAt(0)) >= 0) {
            return "+91" + digits;
        }
        return null;
    }

    private static void phones(String text, Set<String> out) {
        for (Pattern p : PHONE) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String raw = m.groupCount() > 0 && m.group(1) != null ? m.group(1) : m.group();
                String phone = normalizePhone(raw);
                if (phone != null) out.add(phone);
            }
        }
    }

    private static void bankAccounts(String text, Set<String> out) {
        for (Pattern p : BANK_ACCOUNT) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String digits = m.group(1).replaceAll("[\\s-]", "");
                if (digits.length() < 9 || digits.length() > 18) continue;
                // 账号关键词后面跟的是手机号
                if (digits.length() == 10 && "6789".indexOf(digits.charAt(0)) >= 0) continue;
                out.add(digits);
            }
        }
    }

    private static void upiIds(String text, Set<String> out) {
        Matcher m = UPI.matcher(text);
        while (m.find()) {
            String id = m.group(1);
            String handle = id.substring(id.lastIndexOf('@') + 1).toLowerCase(Locale.ROOT);
            if (EMAIL_HANDLES.contains(handle)) continue;
            out.add(id.toLowerCase(Locale.ROOT));
        }
    }

    private static void emails(String text, Set<String> out) {
        Matcher m = EMAIL.matcher(text);
        while (m.find()) {
            String email = m.group().toLowerCase(Locale.ROOT);
            String domain = email.substring(email.indexOf('@') + 1);
            String base = domain.contains(".") ? domain.substring(0, domain.indexOf('.')) : domain;
            if (UPI_PROVIDERS.contains(base)) continue;
            out.add(email);
        }
    }

    private static void urls(String text, Set<String> out) {
        for (Pattern p : URL) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String cleaned = m.group().replaceAll("[.,;:!?)\\]>]+$", "");
                if (cleaned.length() > 5) out.add(cleaned);
            }
        }
    }

    private static void ifsc(String text, Set<String> out) {
        Matcher m = IFSC.matcher(text);
        while (m.find()) out.add(m.group());
        Matcher k = IFSC_KEYED.matcher(text);
        while (k.find()) out.add(k.group(1).toUpperCase(Locale.ROOT));
    }

    private static void caseIds(String text, Set<String> out) {
        for (Pattern p : CASE_ID) {
            Matcher m = p.matcher(text);
            while (m.find()) {
                String raw = m.groupCount() > 0 ? m.group(1) : m.group();
                // 至少带一位数字，过滤 "case is" 这类普通词
                if (raw.chars().noneMatch(Character::isDigit)) continue;
                String id = raw.toUpperCase(Locale.ROOT);
                // IFSC 单独归类
                if (IFSC.matcher(id).matches()) continue;
                out.add(id);
            }
        }
    }

    private static Set<String> bucket(Map<IntelKind, Set<String>> found, IntelKind kind) {
        return found.computeIfAbsent(kind, k -> new LinkedHashSet<>());
    }
}
