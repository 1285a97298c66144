package org.khoros.community;

import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.RequestBody;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Message tags.
 */
public final class Tags {

    private static final System.Logger logger = System.getLogger(Tags.class.getName());

    private final RequestDispatcher dispatcher;

    public Tags(RequestDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /** {@code {"data": {"type": "tag", "text": ...}}}. */
    public static Map<String, Object> structureSingleTagPayload(String tagText) {
        if (tagText == null || tagText.isBlank()) {
            throw KhorosError.validation(KhorosError.CODE_INVALID_PAYLOAD_VALUE, "The tag text must be a non-empty string");
        }
        return Map.of("data", tagItem(tagText));
    }

    /**
     * Tag items for a message payload.
     *
     * @param ignoreNonStrings skip values that are not strings instead of converting them
     */
    public static List<Map<String, Object>> structureTagsForMessage(Collection<?> tags, boolean ignoreNonStrings) {
        var items = new ArrayList<Map<String, Object>>();
        for (var tag : tags) {
            if (tag == null || (ignoreNonStrings && !(tag instanceof String))) continue;
            items.add(tagItem(tag.toString()));
        }
        return items;
    }

    /**
     * Add one tag to a message.
     *
     * @param allowExceptions raise a POST {@link KhorosError.RequestError} on failure instead of logging it
     */
    public void addTagToMessage(String tag, String messageId, boolean allowExceptions) {
        if (messageId == null || messageId.isBlank()) {
            throw KhorosError.missingData("A message ID is required to add a tag");
        }
        var payload = structureSingleTagPayload(tag);
        var result = dispatcher.sendForResult(HttpMethod.POST, "messages/" + messageId + "/tags",
                RequestBody.json(payload));
        if (result.isSuccess()) return;

        var error = result.error().orElseThrow();
        if (allowExceptions) {
            throw new KhorosException(error);
        }
        logger.log(System.Logger.Level.WARNING, "The tag ''{0}'' could not be added to message {1}: {2}",
                tag, messageId, error.message());
    }

    public void addTagsToMessage(Collection<String> tags, String messageId, boolean allowExceptions) {
        for (var tag : tags) {
            addTagToMessage(tag, messageId, allowExceptions);
        }
    }

    private static Map<String, Object> tagItem(String text) {
        var item = new LinkedHashMap<String, Object>();
        item.put("type", "tag");
        item.put("text", text);
        return item;
    }
}
