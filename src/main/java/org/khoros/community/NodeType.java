package org.khoros.community;

import java.util.Locale;

/**
 * Node types and the URL segment each one uses, e.g. {@code /t5/my-board/bd-p/my-board}.
 */
public enum NodeType {
    CATEGORY("ct-p", "Category"),
    BLOG("bg-p", "Blog"),
    CONTEST("con-p", "Contest"),
    BOARD("bd-p", "Board"),
    GROUP("gp-p", "Group"),
    IDEA("idb-p", "Idea Exchange"),
    MESSAGE("m-p", "Message"),
    QA("qa-p", "Q&A"),
    TKB("tkb-p", "TKB");

    private final String urlSegment;
    private final String properName;

    NodeType(String urlSegment, String properName) {
        this.urlSegment = urlSegment;
        this.properName = properName;
    }

    public String urlSegment() {
        return urlSegment;
    }

    public String properName() {
        return properName;
    }

    /**
     * Look up a type by its key ({@code board}), proper name ({@code Idea Exchange}) or enum name.
     * Forums are boards.
     *
     * @throws KhorosError.KhorosException with code {@code invalid_node_type}
     */
    public static NodeType from(String name) {
        if (name != null) {
            var trimmed = name.strip();
            for (var type : values()) {
                if (type.name().equalsIgnoreCase(trimmed) || type.properName.equalsIgnoreCase(trimmed)) {
                    return type;
                }
            }
            if (trimmed.toLowerCase(Locale.ROOT).equals("forum")) {
                return BOARD;
            }
        }
        throw KhorosError.validation(KhorosError.CODE_INVALID_NODE_TYPE, "Invalid node type: '" + name + "'");
    }

    /**
     * The type whose segment appears in a URL.
     *
     * @throws KhorosError.KhorosException with code {@code node_type_not_found}
     */
    public static NodeType fromUrl(String url) {
        if (url != null) {
            for (var type : values()) {
                if (url.contains("/" + type.urlSegment + "/")) {
                    return type;
                }
            }
        }
        throw KhorosError.validation(KhorosError.CODE_NODE_TYPE_NOT_FOUND,
                "Unable to identify the node type from the URL: " + url);
    }
}
