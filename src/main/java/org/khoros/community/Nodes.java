package org.khoros.community;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Lookups on community nodes (boards, blogs, categories, group hubs and so on) through LiQL.
 */
public final class Nodes {

    static final String COLLECTION = "nodes";

    private static final List<String> STRUCTURE_SEGMENTS = List.of(
            "bg-p/", "con-p/", "bd-p/", "gp-p/", "idb-p/", "qa-p/", "tkb-p/", "gh-p/", "ct-p/");

    private final Liql liql;

    public Nodes(Liql liql) {
        this.liql = Objects.requireNonNull(liql, "liql must not be null");
    }

    public static String getNodeId(NodeIdentifier identifier) {
        return identifier.nodeId();
    }

    /** The node ID in a URL, detecting the type from the URL. */
    public static String getNodeId(String url) {
        return NodeIdentifier.url(url).nodeId();
    }

    public static NodeType getNodeTypeFromUrl(String url) {
        return NodeType.fromUrl(url);
    }

    public int getTotalCount() {
        return liql.getTotalCount(COLLECTION, null);
    }

    public boolean exists(NodeIdentifier identifier) {
        return exists(liql, COLLECTION, identifier.nodeId());
    }

    /**
     * The details of a node.
     *
     * @throws KhorosError.KhorosException with code {@code node_id_not_found} when no node matches
     */
    public Map<String, Object> getDetails(NodeIdentifier identifier) {
        return details(liql, COLLECTION, identifier.nodeId());
    }

    /**
     * One field of a node's details, addressed by a dotted path such as {@code parent.id}.
     *
     * @return the value, or {@code null} when the path is absent
     */
    public Object getField(NodeIdentifier identifier, String path) {
        return field(getDetails(identifier), path);
    }

    /**
     * The ID of a board, category or group hub in its URL.
     *
     * @throws KhorosError.KhorosException with code {@code invalid_url}
     */
    public static String getStructureId(String url) {
        if (url != null) {
            for (var segment : STRUCTURE_SEGMENTS) {
                var index = url.indexOf(segment);
                if (index >= 0) {
                    var rest = url.substring(index + segment.length());
                    var end = rest.indexOf('/');
                    var id = end >= 0 ? rest.substring(0, end) : rest;
                    if (!id.isEmpty()) return id;
                }
            }
        }
        throw KhorosError.validation(KhorosError.CODE_INVALID_URL,
                "Unable to identify the Node ID from the following URL: " + url);
    }

    // --- Shared structure lookups ---

    static boolean exists(Liql liql, String collection, String id) {
        if (id == null || id.isBlank()) {
            throw KhorosError.missingData("Must provide at least one lookup value.");
        }
        return liql.getTotalCount(collection, "id = " + LiqlQuery.wrapValue(id)) > 0;
    }

    static Map<String, Object> details(Liql liql, String collection, String id) {
        var query = LiqlQuery.builder().from(collection).where("id", id).build();
        var response = liql.performQuery(query, true);
        var first = Liql.getFirstItem(response);
        if (first == null) {
            throw KhorosError.validation(KhorosError.CODE_NODE_ID_NOT_FOUND,
                    "No " + collection + " entry was found with the ID '" + id + "'");
        }
        return first;
    }

    static Object field(Map<String, ?> details, String path) {
        Object current = details;
        for (var key : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) {
                return null;
            }
            current = map.get(key);
        }
        return current;
    }
}
