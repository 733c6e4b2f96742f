package com.panelgate.common.logging;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keeps credentials out of log output.
 * <p>
 * Credentials are opaque bearer tokens; they are never written to a log line, not even
 * partially. {@link #fingerprint(String)} gives a stable short id so log lines for the
 * same caller can still be correlated.
 */
public final class LogRedact {

    private LogRedact() {
    }

    private static final String REPLACEMENT = "***";
    private static final int FINGERPRINT_HEX_CHARS = 8;

    private static final List<Pattern> PATTERNS = List.of(
            // query parameters carrying the browser credential
            Pattern.compile("([?&](?:token|session_token)=)[^&\\s]+", Pattern.CASE_INSENSITIVE),
            // authorization headers
            Pattern.compile("(Authorization\\s*[:=]\\s*Bearer\\s+)[A-Za-z0-9._\\-+/=]+",
                    Pattern.CASE_INSENSITIVE),
            Pattern.compile("(KEYME-TOKEN(?:\\s+value)?\\s*[:=]\\s*)\\S+", Pattern.CASE_INSENSITIVE),
            // JSON fields
            Pattern.compile("(\"(?:token|session_token|keyme_token|api_key|password)\"\\s*:\\s*\")[^\"]*",
                    Pattern.CASE_INSENSITIVE),
            // PEM private keys
            Pattern.compile("(-----BEGIN [A-Z ]*PRIVATE KEY-----)[\\s\\S]+?(?=-----END)"));

    /**
     * Replace credential-shaped substrings in free text (URIs, exception messages).
     */
    public static String redactSensitiveText(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }
        String result = text;
        for (Pattern pattern : PATTERNS) {
            Matcher matcher = pattern.matcher(result);
            StringBuilder sb = new StringBuilder();
            while (matcher.find()) {
                matcher.appendReplacement(sb, Matcher.quoteReplacement(matcher.group(1) + REPLACEMENT));
            }
            matcher.appendTail(sb);
            result = sb.toString();
        }
        return result;
    }

    /**
     * Short, irreversible id for a credential. Empty input yields {@code "none"}.
     */
    public static String fingerprint(String credential) {
        if (credential == null || credential.isEmpty()) {
            return "none";
        }
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256")
                    .digest(credential.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, FINGERPRINT_HEX_CHARS);
        } catch (NoSuchAlgorithmException e) {
            // SHA-256 is mandatory on every JRE
            throw new IllegalStateException(e);
        }
    }
}
