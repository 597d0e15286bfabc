package com.p14n.shadowsync.topic;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * A dot-delimited subscription pattern evaluated against concrete topics.
 *
 * <p>
 * Two wildcards are recognised, each only as a whole segment:
 * </p>
 * <ul>
 * <li>{@code *} matches exactly one non-empty segment</li>
 * <li>{@code #} matches zero or more segments and may only appear as the
 * final segment (or as the whole pattern)</li>
 * </ul>
 *
 * <p>
 * Patterns without wildcards are compared by string equality and never
 * compiled. Wildcard patterns are compiled on first use; compiled forms are
 * shared across instances with the same raw pattern.
 * </p>
 */
public final class TopicPattern {

    public static final String SEPARATOR = ".";
    public static final String SINGLE_WILDCARD = "*";
    public static final String MULTI_WILDCARD = "#";

    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    private final String raw;
    private final boolean exact;
    private volatile Pattern compiled;

    private TopicPattern(String raw) {
        this.raw = raw;
        this.exact = validate(raw);
    }

    /**
     * Parses a pattern.
     *
     * @param raw the dot-delimited pattern
     * @return the pattern
     * @throws IllegalArgumentException if the pattern is null or {@code #} is
     *                                  not the final segment
     */
    public static TopicPattern of(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Pattern cannot be null");
        }
        return new TopicPattern(raw);
    }

    public static boolean matches(String pattern, String topic) {
        return of(pattern).matches(topic);
    }

    public boolean matches(String topic) {
        if (topic == null) {
            return false;
        }
        if (exact) {
            return raw.equals(topic);
        }
        return compiled().matcher(topic).matches();
    }

    public boolean isExact() {
        return exact;
    }

    public String raw() {
        return raw;
    }

    private Pattern compiled() {
        Pattern p = compiled;
        if (p == null) {
            p = COMPILED.computeIfAbsent(raw, TopicPattern::compile);
            compiled = p;
        }
        return p;
    }

    private static boolean validate(String raw) {
        String[] segments = split(raw);
        boolean wildcard = false;
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (MULTI_WILDCARD.equals(segment)) {
                if (i != segments.length - 1) {
                    throw new IllegalArgumentException(
                            "'#' is only valid as the final segment: " + raw);
                }
                wildcard = true;
            } else if (SINGLE_WILDCARD.equals(segment)) {
                wildcard = true;
            }
        }
        return !wildcard;
    }

    static Pattern compile(String raw) {
        String[] segments = split(raw);
        if (segments.length == 1 && MULTI_WILDCARD.equals(segments[0])) {
            return Pattern.compile(".*", Pattern.DOTALL);
        }
        StringBuilder regex = new StringBuilder();
        for (int i = 0; i < segments.length; i++) {
            String segment = segments[i];
            if (MULTI_WILDCARD.equals(segment)) {
                // the separator is part of the optional group so "a.#" matches "a"
                regex.append("(?:\\..*)?");
                continue;
            }
            if (i > 0) {
                regex.append("\\.");
            }
            if (SINGLE_WILDCARD.equals(segment)) {
                regex.append("[^.]+");
            } else {
                regex.append(Pattern.quote(segment));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static String[] split(String raw) {
        return raw.split(Pattern.quote(SEPARATOR), -1);
    }

    static int compiledCacheSize() {
        return COMPILED.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof TopicPattern other && raw.equals(other.raw);
    }

    @Override
    public int hashCode() {
        return raw.hashCode();
    }

    @Override
    public String toString() {
        return raw;
    }
}
