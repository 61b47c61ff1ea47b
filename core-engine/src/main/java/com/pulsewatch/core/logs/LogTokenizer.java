package com.pulsewatch.core.logs;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits a log body into an ordered token sequence.
 *
 * <p>
 * Tokens are separated by whitespace and the punctuation characters
 * {@code = : , ; [ ] ( ) { } " '}. An empty or blank body yields the single
 * token {@value #EMPTY_TOKEN}.
 * </p>
 *
 * @since 1.0.0
 */
public final class LogTokenizer {

    public static final String EMPTY_TOKEN = "<EMPTY>";

    private static final Pattern SEPARATORS = Pattern.compile("[\\s=:,;\\[\\](){}\"']+");

    private LogTokenizer() {
    }

    public static List<String> tokenize(String body) {
        List<String> tokens = new ArrayList<>();
        if (body != null) {
            for (String t : SEPARATORS.split(body)) {
                if (!t.isEmpty()) {
                    tokens.add(t);
                }
            }
        }
        if (tokens.isEmpty()) {
            tokens.add(EMPTY_TOKEN);
        }
        return tokens;
    }
}
