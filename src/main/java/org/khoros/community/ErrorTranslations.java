package org.khoros.community;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Replaces terse platform error messages with clearer text.
 *
 * <p>A message is looked up by its signature: its first line, trimmed. Messages with
 * no entry are returned unchanged.
 */
public final class ErrorTranslations {

    private static final Map<String, String> BUILT_IN = Map.of(
            "page.post.error.attachment_bad_extension",
            "The attachment does not have an extension permitted in Community Admin > System > File Attachments");

    private static final ErrorTranslations DEFAULTS = new ErrorTranslations(BUILT_IN);

    private final Map<String, String> table;

    private ErrorTranslations(Map<String, String> table) {
        this.table = Map.copyOf(table);
    }

    /** The built-in table. */
    public static ErrorTranslations defaults() {
        return DEFAULTS;
    }

    /** A table with no entries. */
    public static ErrorTranslations none() {
        return new ErrorTranslations(Map.of());
    }

    /** A copy of this table with one more entry. */
    public ErrorTranslations with(String signature, String translation) {
        Objects.requireNonNull(signature, "signature must not be null");
        Objects.requireNonNull(translation, "translation must not be null");
        var copy = new LinkedHashMap<>(table);
        copy.put(signature, translation);
        return new ErrorTranslations(copy);
    }

    public Map<String, String> entries() {
        return table;
    }

    /** Translate a message, or return it unchanged. */
    public String translate(String message) {
        if (message == null || message.isEmpty()) {
            return message;
        }
        var translated = table.get(signature(message));
        return translated != null ? translated : message;
    }

    static String signature(String message) {
        var newline = message.indexOf('\n');
        return (newline >= 0 ? message.substring(0, newline) : message).strip();
    }
}
