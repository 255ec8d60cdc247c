package com.crypto.connector.common.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final Pattern SECRET_PATTERN = Pattern.compile(
            "(?i)(apiKey|apiSecret|api_key|api_secret|passphrase|apiPassphrase|privateKey|signature|sign|secret|accessToken|nonce)=[^\\s&]+");
    private static final Pattern JSON_SECRET_PATTERN = Pattern.compile(
            "(?i)\"(apiKey|apiSecret|api_key|api_secret|passphrase|apiPassphrase|privateKey|secret|accessToken)\"\\s*:\\s*\"[^\"]*\"");
    private static final Pattern HEADER_PATTERN = Pattern.compile(
            "(?i)(API-Key|API-Sign|X-MBX-APIKEY|CB-ACCESS-KEY|CB-ACCESS-SIGN|CB-ACCESS-PASSPHRASE)(\\s*[:=]\\s*)[^\\s,;\\]]+");
    private static final Pattern BEARER_PATTERN = Pattern.compile("(?i)Bearer\\s+[A-Za-z0-9._~+/=-]+");
    private static final Pattern PEM_PATTERN = Pattern.compile(
            "-----BEGIN [A-Z ]*PRIVATE KEY-----[\\s\\S]*?(-----END [A-Z ]*PRIVATE KEY-----|$)");

    private LogSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        String out = PEM_PATTERN.matcher(value).replaceAll("[PRIVATE KEY]");
        out = JSON_SECRET_PATTERN.matcher(out).replaceAll("\"$1\":\"***\"");
        out = HEADER_PATTERN.matcher(out).replaceAll("$1$2***");
        out = BEARER_PATTERN.matcher(out).replaceAll("Bearer ***");
        return SECRET_PATTERN.matcher(out).replaceAll("$1=***");
    }
}
