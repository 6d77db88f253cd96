package de.bsommerfeld.wsbg.archive.core.domain;

import java.util.regex.Pattern;

/**
 * Subreddit names end up in file names and query strings, so only the
 * characters Reddit itself allows are accepted.
 */
public final class SubredditNames {

    private static final Pattern VALID = Pattern.compile("^[a-zA-Z0-9_]+$");

    private SubredditNames() {
    }

    public static boolean isValid(String name) {
        return name != null && VALID.matcher(name).matches();
    }

    /** Strips a leading {@code r/} or {@code /r/} as pasted from a browser. */
    public static String normalize(String name) {
        if (name == null) {
            return null;
        }
        String trimmed = name.trim();
        if (trimmed.startsWith("/r/")) {
            return trimmed.substring(3);
        }
        if (trimmed.startsWith("r/")) {
            return trimmed.substring(2);
        }
        return trimmed;
    }
}
