package io.clype.reactorpubsub.util;

import java.util.regex.Pattern;

/**
 * Strips control characters from caller-controlled strings before they are logged.
 */
public final class LogSanitizer {

    /** Removes all control characters, ANSI escape sequences included. */
    private static final Pattern CONTROL_CHARACTERS = Pattern.compile("[\\p{Cntrl}\\p{Cc}]");

    private LogSanitizer() {
    }

    public static String sanitize(String input) {
        if (input == null) {
            return "null";
        }
        return CONTROL_CHARACTERS.matcher(input).replaceAll("_");
    }
}
