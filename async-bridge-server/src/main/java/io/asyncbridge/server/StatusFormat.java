package io.asyncbridge.server;

/**
 * How a numeric status code is rendered into the status line handed to {@link StartResponse}.
 */
public enum StatusFormat {

    /** {@code "404"} */
    NUMERIC {
        @Override
        public String format(int status) {
            return Integer.toString(status);
        }
    },

    /** {@code "404 Not Found"}; codes without a standard phrase render as {@link #NUMERIC}. */
    WITH_PHRASE {
        @Override
        public String format(int status) {
            return ReasonPhrases.lookup(status)
                    .map(phrase -> status + " " + phrase)
                    .orElseGet(() -> Integer.toString(status));
        }
    };

    public abstract String format(int status);

    /**
     * Parses {@code numeric} or {@code with-phrase} (case-insensitive, {@code _} and {@code -}
     * interchangeable).
     */
    public static StatusFormat parse(String value) {
        String v = value.trim().replace('-', '_');
        for (StatusFormat f : values()) {
            if (f.name().equalsIgnoreCase(v)) return f;
        }
        throw new IllegalArgumentException("Unknown status format: " + value);
    }
}
