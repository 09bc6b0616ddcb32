package com.tasktrace.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;

import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Converts log fields into OpenTelemetry {@link Attributes}, masking values whose key looks
 * sensitive.
 * <p>
 * A key is sensitive when it contains one of the patterns (case-insensitive), so
 * {@code db.password} and {@code X-Api-Key} both match. Strings, integral numbers, floating point
 * numbers and booleans keep their type; any other value is rendered with {@code toString()}.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Set<String> DEFAULT_SENSITIVE_PATTERNS = Set.of(
            "password", "token", "secret", "authorization", "api-key", "apikey", "api_key",
            "credential", "cookie"
    );

    private final Pattern compiledPattern;

    public SensitiveDataRedactor() {
        this(DEFAULT_SENSITIVE_PATTERNS);
    }

    /**
     * @param patterns key fragments to treat as sensitive
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
     * Builds attributes from the given fields. Null keys and null values are skipped.
     *
     * @param fields log fields, may be {@code null}
     * @return typed attributes with sensitive values replaced by {@value #REDACTED}
     */
    public Attributes redact(Map<String, ?> fields) {
        if (fields == null || fields.isEmpty()) {
            return Attributes.empty();
        }
        AttributesBuilder builder = Attributes.builder();
        fields.forEach((key, value) -> {
            if (key == null || value == null) {
                return;
            }
            if (isSensitive(key)) {
                builder.put(AttributeKey.stringKey(key), REDACTED);
            } else if (value instanceof Boolean b) {
                builder.put(AttributeKey.booleanKey(key), b);
            } else if (value instanceof Long || value instanceof Integer
                    || value instanceof Short || value instanceof Byte) {
                builder.put(AttributeKey.longKey(key), ((Number) value).longValue());
            } else if (value instanceof Number n) {
                builder.put(AttributeKey.doubleKey(key), n.doubleValue());
            } else {
                builder.put(AttributeKey.stringKey(key), value.toString());
            }
        });
        return builder.build();
    }

    /**
     * Checks whether a key contains any sensitive pattern (case-insensitive).
     */
    public boolean isSensitive(String key) {
        if (key == null) {
            return false;
        }
        return compiledPattern.matcher(key).find();
    }
}
