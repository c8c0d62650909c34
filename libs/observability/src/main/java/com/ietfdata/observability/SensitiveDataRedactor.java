package com.ietfdata.observability;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts credentials from URLs and key/value log data before they are logged.
 * <p>
 * Default sensitive patterns: apikey, api_key, token, secret, password, authorization, credential.
 * Matching is case-insensitive and by substring, so {@code X-Api-Key} and {@code access_token}
 * are covered too.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "apikey", "api_key", "api-key", "token", "secret", "password", "authorization", "credential"
    );

    private static final Pattern QUERY_PARAMETER = Pattern.compile("([?&])([^=&#]+)=([^&#]*)");

    private final Pattern compiledPattern;

    /**
     * Creates a redactor with the default sensitive field patterns.
     */
    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * Creates a redactor with custom sensitive field patterns (case-insensitive).
     *
     * @param patterns field name patterns to treat as sensitive
     */
    public SensitiveDataRedactor(Set<String> patterns) {
        if (patterns == null || patterns.isEmpty()) {
            throw new IllegalArgumentException("patterns must not be null or empty");
        }
        String regex = String.join("|", patterns.stream()
                .map(Pattern::quote)
                .toList());
        this.compiledPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    /**
     * Returns the URL with the value of every sensitive query parameter replaced by
     * {@value #REDACTED}. Everything else, including parameter order, is kept.
     *
     * @param url a URL or path with an optional query string (null returns null)
     */
    public String redactUrl(String url) {
        if (url == null || url.indexOf('?') < 0) {
            return url;
        }
        Matcher matcher = QUERY_PARAMETER.matcher(url);
        StringBuilder result = new StringBuilder(url.length());
        while (matcher.find()) {
            String replacement = isSensitive(matcher.group(2))
                    ? matcher.group(1) + matcher.group(2) + "=" + REDACTED
                    : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Returns a new map with sensitive values replaced by {@value #REDACTED}.
     * Null input returns an empty map.
     *
     * @param data the log data map (keys are field names, values are arbitrary)
     * @return a new map with sensitive values redacted
     */
    public Map<String, Object> redact(Map<String, ?> data) {
        if (data == null || data.isEmpty()) {
            return Map.of();
        }

        Map<String, Object> result = new LinkedHashMap<>(data.size());
        for (Map.Entry<String, ?> entry : data.entrySet()) {
            String key = entry.getKey();
            if (isSensitive(key) && entry.getValue() != null) {
                result.put(key, REDACTED);
            } else {
                result.put(key, entry.getValue());
            }
        }
        return result;
    }

    /**
     * Checks whether a field or parameter name matches any sensitive pattern (case-insensitive).
     *
     * @param fieldName the name to check
     * @return true if the name contains a sensitive pattern
     */
    public boolean isSensitive(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        return compiledPattern.matcher(fieldName).find();
    }
}
