package io.surfworks.entitlement.client;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Formatting helpers for log lines: masking of tokens and secrets, and
 * compact, bounded JSON rendering of payloads.
 */
public final class LogFormat {

    private static final int KEEP = 6;
    private static final int COMPACT_LIMIT = 1200;
    private static final Set<String> SENSITIVE_PARAMS = Set.of("password", "secret", "token", "authorization");
    private static final Gson GSON = new GsonBuilder().disableHtmlEscaping().serializeNulls().create();

    private LogFormat() {}

    /**
     * Mask a token or secret, keeping only its first six characters.
     *
     * @return {@code <none>} for null/empty input
     */
    public static String mask(String value) {
        if (value == null || value.isEmpty()) {
            return "<none>";
        }
        if (value.length() <= KEEP) {
            return "*".repeat(value.length());
        }
        return value.substring(0, KEEP) + "…" + "*".repeat(Math.max(0, value.length() - KEEP - 1));
    }

    /**
     * Render an object as single-line JSON, truncated for log output.
     */
    public static String compact(Object value) {
        String s;
        try {
            s = GSON.toJson(value);
        } catch (RuntimeException e) {
            s = String.valueOf(value);
        }
        if (s.length() <= COMPACT_LIMIT) {
            return s;
        }
        return s.substring(0, COMPACT_LIMIT) + "…(truncated)";
    }

    /**
     * Copy of the query parameters with sensitive values masked.
     */
    public static Map<String, String> safeParams(Map<String, String> params) {
        Map<String, String> safe = new LinkedHashMap<>();
        if (params == null) {
            return safe;
        }
        for (Map.Entry<String, String> entry : params.entrySet()) {
            String value = SENSITIVE_PARAMS.contains(entry.getKey().toLowerCase(Locale.ROOT))
                    ? mask(entry.getValue())
                    : entry.getValue();
            safe.put(entry.getKey(), value);
        }
        return safe;
    }
}
