package com.jz.honeypot.detect;

import java.util.regex.Pattern;

/**
 * 一条加权正则规则。文本在匹配前已转为小写。
 */
public record SignalRule(String label, Pattern pattern, int weight) {

    public static SignalRule of(String label, String regex, int weight) {
        return new SignalRule(label, Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE), weight);
    }

    public boolean matches(String lowered) {
        return pattern.matcher(lowered).find();
    }
}
