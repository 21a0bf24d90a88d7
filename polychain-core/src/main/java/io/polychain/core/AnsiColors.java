package io.polychain.core;

/**
 * ANSI color palette for terminal output with automatic TTY detection.
 *
 * <p>
 * Colors are disabled when not running in a TTY environment unless
 * {@code FORCE_COLOR=true} is set, in which case every constant is the empty
 * string and can be concatenated safely.
 *
 * @see LogFormatter
 */
public final class AnsiColors {

    private static final boolean IS_TTY = System.console() != null
            || "true".equals(System.getenv("FORCE_COLOR"));

    /** ANSI reset code - clears all formatting */
    public static final String RESET = ansi("0");

    /** Success indicators. */
    public static final String TEAL = ansi("38;5;44");

    /** Error indicators. */
    public static final String CORAL = ansi("38;5;204");

    /** Informational messages. */
    public static final String INDIGO = ansi("38;5;99");

    /** Warnings and client resolution. */
    public static final String AMBER = ansi("38;5;214");

    /** Metadata and secondary information. */
    public static final String SLATE = ansi("38;5;247");

    private AnsiColors() {
    }

    private static String ansi(final String code) {
        return IS_TTY ? "\u001B[" + code + "m" : "";
    }
}
