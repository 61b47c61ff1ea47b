package com.pulsewatch.core.logs;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Replaces well-known variable content with typed placeholders before
 * tokenization, e.g. {@code 10.0.0.1} with {@code <IP>}.
 *
 * <p>
 * Patterns are applied in order, most specific first, so a timestamp is not
 * partially masked as numbers.
 * </p>
 *
 * @since 1.0.0
 */
public final class VariableMasker {

    private record Rule(Pattern pattern, String placeholder) {
    }

    private static final List<Rule> RULES = List.of(
            new Rule(Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:?\\d{2})?"),
                    "<TIMESTAMP>"),
            new Rule(Pattern.compile("https?://\\S+"), "<URL>"),
            new Rule(Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"), "<EMAIL>"),
            new Rule(Pattern.compile("\\b[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}\\b"),
                    "<UUID>"),
            new Rule(Pattern.compile("\\b\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\.\\d{1,3}\\b"), "<IP>"),
            new Rule(Pattern.compile("\\b0x[0-9a-fA-F]+\\b"), "<ADDR>"),
            new Rule(Pattern.compile("\\b[0-9a-fA-F]{32,}\\b"), "<HEX>"),
            new Rule(Pattern.compile("(?<![\\w<])(?:/[A-Za-z0-9_.\\-]+)+"), "<PATH>"),
            new Rule(Pattern.compile("\\b\\d+(?:\\.\\d+)?\\b"), "<NUM>"));

    private VariableMasker() {
    }

    public static String mask(String body) {
        if (body == null || body.isEmpty()) {
            return body;
        }
        String masked = body;
        for (Rule rule : RULES) {
            masked = rule.pattern().matcher(masked).replaceAll(rule.placeholder());
        }
        return masked;
    }
}
