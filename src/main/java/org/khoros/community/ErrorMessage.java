package org.khoros.community;

/**
 * The error text of a normalized result: one string, or the platform message and
 * developer message kept apart.
 */
public sealed interface ErrorMessage {

    /** Single-string form. A split pair is joined as {@code "message - developer message"}. */
    String text();

    record Combined(String text) implements ErrorMessage {
        @Override
        public String toString() {
            return text;
        }
    }

    record Split(String message, String developerMessage) implements ErrorMessage {
        @Override
        public String text() {
            return combine(message, developerMessage);
        }

        @Override
        public String toString() {
            return "(" + message + ", " + developerMessage + ")";
        }
    }

    /**
     * Consolidate a message pair. Identical or one-sided pairs collapse to the non-empty
     * text; differing pairs become {@code "message - developer message"}. With
     * {@code split}, the pair is kept as given.
     */
    static ErrorMessage of(String message, String developerMessage, boolean split) {
        var msg = message == null ? "" : message;
        var dev = developerMessage == null ? "" : developerMessage;
        if (split) {
            return new Split(msg, dev);
        }
        return new Combined(combine(msg, dev));
    }

    private static String combine(String message, String developerMessage) {
        if (developerMessage == null || developerMessage.isEmpty() || developerMessage.equals(message)) {
            return message;
        }
        if (message == null || message.isEmpty()) {
            return developerMessage;
        }
        return message + " - " + developerMessage;
    }
}
