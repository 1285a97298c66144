package org.khoros.community;

import org.khoros.community.transport.MultipartBody;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the attachment sections of message payloads.
 *
 * <p>Each attachment is listed in the JSON payload under a field name, and its file is
 * sent as a multipart part of the same name.
 */
public final class Attachments {

    private Attachments() {}

    /** A file to attach, sent in the multipart part named {@code field}. */
    public record Attachment(String field, Path path) {
        public Attachment {
            Objects.requireNonNull(field, "field must not be null");
            Objects.requireNonNull(path, "path must not be null");
        }

        public String filename() {
            return path.getFileName().toString();
        }
    }

    /**
     * Pair attachment titles with file paths.
     *
     * @throws KhorosError.KhorosException with code {@code data_mismatch} when the lists differ in size
     */
    public static List<Attachment> of(List<String> titles, List<Path> filePaths) {
        if ((titles == null || titles.isEmpty()) && (filePaths == null || filePaths.isEmpty())) {
            throw KhorosError.missingData("Missing required attachment data");
        }
        if (titles == null || filePaths == null || titles.size() != filePaths.size()) {
            throw KhorosError.validation(KhorosError.CODE_DATA_MISMATCH,
                    "The attachment_titles and file_paths values do not match in length");
        }
        var attachments = new ArrayList<Attachment>(titles.size());
        for (int i = 0; i < titles.size(); i++) {
            attachments.add(new Attachment(titles.get(i), filePaths.get(i)));
        }
        return attachments;
    }

    /** {@code {"list_item_type": "attachment", "items": [{type, field, filename}, ...]}}. */
    public static Map<String, Object> formatAttachmentPayload(List<Attachment> attachments) {
        if (attachments == null || attachments.isEmpty()) {
            throw KhorosError.missingData("Missing required attachment data");
        }
        var items = new ArrayList<Map<String, Object>>(attachments.size());
        for (var attachment : attachments) {
            var item = new LinkedHashMap<String, Object>();
            item.put("type", "attachment");
            item.put("field", attachment.field());
            item.put("filename", attachment.filename());
            items.add(item);
        }
        var payload = new LinkedHashMap<String, Object>();
        payload.put("list_item_type", "attachment");
        payload.put("items", items);
        return payload;
    }

    /**
     * The multipart body for a message with attachments: an {@code api.request} part holding
     * {@code {"data": message}} with the attachment list added, then one file part per attachment.
     *
     * @throws java.io.UncheckedIOException if a file cannot be read
     */
    public static MultipartBody constructMultipartPayload(Map<String, Object> message, List<Attachment> attachments) {
        var data = new LinkedHashMap<String, Object>(message);
        data.put("attachments", formatAttachmentPayload(attachments));
        var builder = MultipartBody.builder().jsonField("api.request", Map.of("data", data));
        for (var attachment : attachments) {
            builder.file(attachment.field(), attachment.path());
        }
        return builder.build();
    }
}
