package org.khoros.community;

import org.khoros.community.transport.HttpMethod;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Category creation (Community API v1) and lookups (LiQL).
 */
public final class Categories {

    static final String COLLECTION = "categories";

    private final RequestDispatcher dispatcher;
    private final Liql liql;

    public Categories(RequestDispatcher dispatcher, Liql liql) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.liql = Objects.requireNonNull(liql, "liql must not be null");
    }

    /**
     * Create a category, nested under {@code parentId} when one is given.
     *
     * @param parentId the parent category ID, or {@code null} for a top-level category
     * @throws KhorosError.KhorosException with a POST {@link KhorosError.RequestError} for a non-2xx response
     */
    public NormalizedResult create(String categoryId, String title, String parentId) {
        if (categoryId == null || categoryId.isBlank() || title == null || title.isBlank()) {
            throw KhorosError.missingData("The category ID and title are required to create a category.");
        }
        var endpoint = (parentId == null || parentId.isBlank() ? "" : "categories/id/" + parentId + "/")
                + "categories/add";
        var params = new LinkedHashMap<String, String>();
        params.put("category.id", categoryId);
        params.put("category.title", title);
        var response = dispatcher.makeV1Request(endpoint, params, HttpMethod.POST);
        return dispatcher.normalizer().normalizeV1(HttpMethod.POST, response);
    }

    public int getTotalCount() {
        return liql.getTotalCount(COLLECTION, null);
    }

    public boolean exists(String categoryId) {
        return Nodes.exists(liql, COLLECTION, categoryId);
    }

    public boolean existsByUrl(String categoryUrl) {
        return exists(getCategoryId(categoryUrl));
    }

    public static String getCategoryId(String url) {
        return Nodes.getStructureId(url);
    }

    /** The category settings returned by LiQL. */
    public Map<String, Object> getDetails(String categoryId) {
        return Nodes.details(liql, COLLECTION, categoryId);
    }

    /**
     * One field of the category details, such as {@code title} or {@code parent.id}.
     *
     * @throws KhorosError.KhorosException with code {@code invalid_field} when the field is absent
     */
    public Object getField(String categoryId, String field) {
        var value = Nodes.field(getDetails(categoryId), field);
        if (value == null) {
            throw KhorosError.validation(KhorosError.CODE_INVALID_FIELD,
                    "The field '" + field + "' was not found in the category details.");
        }
        return value;
    }

    public String getTitle(String categoryId) {
        return String.valueOf(getField(categoryId, "title"));
    }

    public String getUrl(String categoryId) {
        return String.valueOf(getField(categoryId, "view_href"));
    }

    public String getParentId(String categoryId) {
        return String.valueOf(getField(categoryId, "parent.id"));
    }
}
