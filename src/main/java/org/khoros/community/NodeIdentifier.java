package org.khoros.community;

import java.util.Map;
import java.util.Objects;

/**
 * The ways a caller can point at a node, resolved once into a canonical node ID.
 */
public sealed interface NodeIdentifier {

    /** The canonical node ID, e.g. {@code my-board}. */
    String nodeId();

    static NodeIdentifier id(String id) {
        return new ById(id);
    }

    static NodeIdentifier url(String url) {
        return new ByUrl(url, null);
    }

    static NodeIdentifier url(String url, NodeType type) {
        return new ByUrl(url, type);
    }

    static NodeIdentifier details(Map<String, ?> details) {
        return new ByCollection(details);
    }

    /** A bare node ID. */
    record ById(String id) implements NodeIdentifier {
        public ById {
            if (id == null || id.isBlank()) {
                throw KhorosError.missingData("A node ID must not be empty");
            }
        }

        @Override
        public String nodeId() {
            return id;
        }
    }

    /**
     * A node URL. The ID is the path segment after the type segment; without a type
     * hint the type is detected from the URL.
     */
    record ByUrl(String url, NodeType type) implements NodeIdentifier {
        public ByUrl {
            if (url == null || url.isBlank()) {
                throw KhorosError.missingData("A node URL must not be empty");
            }
        }

        @Override
        public String nodeId() {
            var nodeType = type != null ? type : NodeType.fromUrl(url);
            var marker = nodeType.urlSegment() + "/";
            var index = url.indexOf(marker);
            if (index < 0) {
                throw KhorosError.validation(KhorosError.CODE_INVALID_NODE_TYPE,
                        "The URL is not for a node of type " + nodeType.properName() + ": " + url);
            }
            var rest = url.substring(index + marker.length());
            var slash = rest.indexOf('/');
            var id = slash >= 0 ? rest.substring(0, slash) : rest;
            var query = id.indexOf('?');
            if (query >= 0) id = id.substring(0, query);
            if (id.isEmpty()) {
                throw KhorosError.validation(KhorosError.CODE_NODE_ID_NOT_FOUND,
                        "Unable to identify the node ID from the URL: " + url);
            }
            return id;
        }
    }

    /**
     * Node details as returned by the API, whose {@code id} has the form
     * {@code board:my-board}.
     */
    record ByCollection(Map<String, ?> details) implements NodeIdentifier {
        public ByCollection {
            Objects.requireNonNull(details, "details must not be null");
        }

        @Override
        public String nodeId() {
            var raw = details.get("id");
            if (raw == null || raw.toString().isBlank()) {
                throw KhorosError.validation(KhorosError.CODE_NODE_ID_NOT_FOUND,
                        "The node details do not contain an ID");
            }
            var id = raw.toString();
            var colon = id.indexOf(':');
            return colon >= 0 ? id.substring(colon + 1) : id;
        }
    }
}
