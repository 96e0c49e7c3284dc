package com.gamelog.core.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads fields out of a client userinfo blob such as
 * {@code n\Isgalamido\t\0\model\xian/default}.
 */
public final class UserInfo {

    // "n\" followed by at least one non-backslash character
    private static final Pattern NAME = Pattern.compile("n\\\\([^\\\\]+)");

    private UserInfo() {
    }

    /**
     * Display name following the {@code n\} marker, up to the next backslash.
     * Empty when the blob carries no name.
     */
    public static Optional<String> playerName(String info) {
        if (info == null) {
            return Optional.empty();
        }
        Matcher m = NAME.matcher(info);
        return m.find() ? Optional.of(m.group(1)) : Optional.empty();
    }
}
