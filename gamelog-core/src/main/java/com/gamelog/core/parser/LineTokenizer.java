package com.gamelog.core.parser;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Strips the leading {@code m:ss} / {@code mm:ss} clock from a log line.
 * Lines without one (banners, separators, blank lines) are not events.
 */
public class LineTokenizer {

    // DOTALL: NEL, LS, PS and stray CRs inside a line are content, not line breaks
    private static final Pattern LINE = Pattern.compile("^\\s*(\\d{1,2}:\\d{2})\\s+(.+)$", Pattern.DOTALL);

    public Optional<TokenizedLine> tokenize(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String trimmed = line.strip();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        Matcher m = LINE.matcher(trimmed);
        if (!m.matches()) {
            return Optional.empty();
        }
        return Optional.of(new TokenizedLine(m.group(1), m.group(2)));
    }
}
