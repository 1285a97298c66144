package org.khoros.community.transport;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A {@code multipart/form-data} payload made of structured field parts and file parts.
 *
 * <pre>{@code
 * var body = MultipartBody.builder()
 *     .jsonField("api.request", Map.of("data", message))
 *     .file("attachment1", Path.of("/tmp/diagram.png"))
 *     .build();
 * }</pre>
 */
public final class MultipartBody {

    private static final String CRLF = "\r\n";
    private static final String DEFAULT_FILE_TYPE = "application/octet-stream";

    private final String boundary;
    private final List<Part> parts;

    private MultipartBody(Builder builder) {
        this.boundary = builder.boundary != null ? builder.boundary
                : "----KhorosBoundary" + UUID.randomUUID().toString().replace("-", "");
        this.parts = List.copyOf(builder.parts);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** One part of the body. */
    public sealed interface Part {
        String name();
    }

    /** A structured (non-file) field. */
    public record FieldPart(String name, String value, String contentType) implements Part {
        public FieldPart {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }
    }

    /** A file attachment. */
    public record FilePart(String name, String filename, byte[] content, String contentType) implements Part {
        public FilePart {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(filename, "filename must not be null");
            Objects.requireNonNull(content, "content must not be null");
            if (contentType == null) contentType = DEFAULT_FILE_TYPE;
        }
    }

    public String boundary() {
        return boundary;
    }

    public List<Part> parts() {
        return parts;
    }

    /** The full {@code content-type} header value including the boundary. */
    public String contentType() {
        return "multipart/form-data; boundary=" + boundary;
    }

    public long fileCount() {
        return parts.stream().filter(FilePart.class::isInstance).count();
    }

    /** Serializes the parts into the wire form. */
    public byte[] toByteArray() {
        var out = new ByteArrayOutputStream();
        for (var part : parts) {
            write(out, "--" + boundary + CRLF);
            if (part instanceof FilePart file) {
                write(out, "Content-Disposition: form-data; name=\"" + escape(file.name())
                        + "\"; filename=\"" + escape(file.filename()) + "\"" + CRLF);
                write(out, "Content-Type: " + file.contentType() + CRLF + CRLF);
                out.writeBytes(file.content());
            } else if (part instanceof FieldPart field) {
                write(out, "Content-Disposition: form-data; name=\"" + escape(field.name()) + "\"" + CRLF);
                if (field.contentType() != null) {
                    write(out, "Content-Type: " + field.contentType() + CRLF);
                }
                write(out, CRLF);
                write(out, field.value());
            }
            write(out, CRLF);
        }
        write(out, "--" + boundary + "--" + CRLF);
        return out.toByteArray();
    }

    private static void write(ByteArrayOutputStream out, String s) {
        out.writeBytes(s.getBytes(StandardCharsets.UTF_8));
    }

    private static String escape(String s) {
        return s.replace("\"", "%22").replace("\r", "%0D").replace("\n", "%0A");
    }

    public static final class Builder {
        private String boundary;
        private final List<Part> parts = new ArrayList<>();

        private Builder() {}

        /** Overrides the generated boundary. */
        public Builder boundary(String boundary) {
            this.boundary = boundary;
            return this;
        }

        public Builder field(String name, String value) {
            parts.add(new FieldPart(name, value, null));
            return this;
        }

        /** Adds a field whose value is the JSON encoding of {@code payload}. */
        public Builder jsonField(String name, Object payload) {
            parts.add(new FieldPart(name, Json.encode(payload), "application/json"));
            return this;
        }

        public Builder file(String name, String filename, byte[] content, String contentType) {
            parts.add(new FilePart(name, filename, content, contentType));
            return this;
        }

        /**
         * Adds a file part read from disk.
         *
         * @throws UncheckedIOException if the file cannot be read
         */
        public Builder file(String name, Path path) {
            try {
                var contentType = Files.probeContentType(path);
                return file(name, path.getFileName().toString(), Files.readAllBytes(path), contentType);
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read file for multipart upload: " + path, e);
            }
        }

        public MultipartBody build() {
            if (boundary != null && boundary.isBlank()) {
                throw new IllegalArgumentException("boundary must not be blank");
            }
            return new MultipartBody(this);
        }
    }
}
