package com.bastion.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credential-bearing entries of header or log-field maps before they are logged.
 * <p>
 * Default sensitive patterns: authorization, cookie, token, secret, password, apikey,
 * api-key, credential. Matching is a case-insensitive substring match on the key, so
 * {@code Proxy-Authorization}, {@code Set-Cookie} and {@code X-Api-Key} are all masked.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "authorization", "cookie", "token", "secret",
            "password", "apikey", "api-key", "credential"
    );

    private final Set<String> sensitivePatterns;
    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive key patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive key patterns (case-insensitive).
     *
     * @param patterns key patterns to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        this.sensitivePatterns = Set.copyOf(patterns);
        String regex = String.join("|", sensitivePatterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns a new map, in the input's iteration order, with sensitive values replaced by
     * {@value #REDACTED}. Null input returns an empty map.
     *
     * @param data header or log-field map
     * @param <V>  value type
     * @return a new map safe to log
     */
    public <V> Map<String, Object> redact(Map<String, V> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, V> entry : data.entrySet()) {
            String key = entry.getKey();
            result.put(key, isSensitive(key) ? REDACTED : entry.getValue());
        }
        return result;
    }

    /**
     * Checks whether a key matches any sensitive pattern (case-insensitive).
     *
     * @param key the header or field name
     * @return true if the key contains a sensitive pattern
     */
    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        return compiledPattern.matcher(key).find();
    }

    /**
     * Returns the set of sensitive patterns this redactor uses.
     */
    public Set<String> sensitivePatterns() {
        return sensitivePatterns;
    }
}
