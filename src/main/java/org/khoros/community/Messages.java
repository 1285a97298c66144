package org.khoros.community;

import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.RequestBody;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Creating and updating messages through the v2 API.
 *
 * <pre>{@code
 * var spec = Messages.MessageSpec.builder()
 *     .subject("Release notes")
 *     .body("<p>Version 2 is out.</p>")
 *     .node(NodeIdentifier.url("https://community.example.com/t5/news/bd-p/news"))
 *     .tags(List.of("release"))
 *     .build();
 * client.messages().create(spec, ReturnFields.builder().returnId().build());
 * }</pre>
 */
public final class Messages {

    static final String COLLECTION = "messages";

    private final RequestDispatcher dispatcher;

    public Messages(RequestDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /**
     * A message to create, or the fields to change on an existing one. Unset fields are omitted.
     */
    public record MessageSpec(
            String subject,
            String body,
            NodeIdentifier node,
            List<String> tags,
            List<Attachments.Attachment> attachments
    ) {
        public MessageSpec {
            tags = tags != null ? List.copyOf(tags) : List.of();
            attachments = attachments != null ? List.copyOf(attachments) : List.of();
        }

        public static Builder builder() {
            return new Builder();
        }

        public boolean hasAttachments() {
            return !attachments.isEmpty();
        }

        /** The message object, without the {@code data} wrapper. */
        public Map<String, Object> toMessage() {
            var data = new LinkedHashMap<String, Object>();
            data.put("type", "message");
            if (subject != null) data.put("subject", subject);
            if (body != null) data.put("body", body);
            if (node != null) data.put("board", Map.of("id", node.nodeId()));
            if (!tags.isEmpty()) {
                data.put("tags", Map.of("items", Tags.structureTagsForMessage(tags, false)));
            }
            return data;
        }

        public static final class Builder {
            private String subject;
            private String body;
            private NodeIdentifier node;
            private final List<String> tags = new ArrayList<>();
            private final List<Attachments.Attachment> attachments = new ArrayList<>();

            private Builder() {}

            public Builder subject(String subject) {
                this.subject = subject;
                return this;
            }

            public Builder body(String body) {
                this.body = body;
                return this;
            }

            /** The board the message is posted in. */
            public Builder node(NodeIdentifier node) {
                this.node = node;
                return this;
            }

            public Builder tags(List<String> tags) {
                this.tags.addAll(tags);
                return this;
            }

            public Builder attachment(Attachments.Attachment attachment) {
                this.attachments.add(attachment);
                return this;
            }

            public Builder attachments(List<Attachments.Attachment> attachments) {
                this.attachments.addAll(attachments);
                return this;
            }

            public MessageSpec build() {
                return new MessageSpec(subject, body, node, tags, attachments);
            }
        }
    }

    public boolean create(MessageSpec spec) {
        return create(spec, ReturnFields.none()).isSuccess();
    }

    /**
     * Post a new message. Messages with attachments are sent as multipart.
     *
     * @throws KhorosError.KhorosException with code {@code missing_required_data} without a subject and node
     */
    public Delivery create(MessageSpec spec, ReturnFields fields) {
        if (spec.subject() == null || spec.subject().isBlank() || spec.node() == null) {
            throw KhorosError.missingData("A subject and a node are required to create a message.");
        }
        return dispatcher.send(HttpMethod.POST, COLLECTION, requestBody(spec), fields);
    }

    /** Change the fields set in {@code spec} on an existing message. */
    public Delivery update(String messageId, MessageSpec spec, ReturnFields fields) {
        if (messageId == null || messageId.isBlank()) {
            throw KhorosError.missingData("A message ID is required to update a message.");
        }
        return dispatcher.send(HttpMethod.PUT, COLLECTION + "/" + messageId, requestBody(spec), fields);
    }

    static RequestBody requestBody(MessageSpec spec) {
        if (spec.hasAttachments()) {
            return RequestBody.multipart(Attachments.constructMultipartPayload(spec.toMessage(), spec.attachments()));
        }
        return RequestBody.json(Map.of("data", spec.toMessage()));
    }
}
