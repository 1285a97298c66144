package org.khoros.community;

import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.MultipartBody;
import org.khoros.community.transport.RequestBody;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Group hub creation, updates and lookups.
 */
public final class GroupHubs {

    static final String COLLECTION = "grouphubs";

    public static final List<String> ALL_DISCUSSION_STYLES =
            List.of("blog", "contest", "forum", "idea", "qanda", "tkb");
    public static final Set<String> MEMBERSHIP_TYPES = Set.of("open", "closed", "closed_hidden");

    static final String REQUEST_PART = "api.request";
    static final String AVATAR_PART = "avatar";

    private final RequestDispatcher dispatcher;
    private final Liql liql;

    public GroupHubs(RequestDispatcher dispatcher, Liql liql) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.liql = Objects.requireNonNull(liql, "liql must not be null");
    }

    /**
     * The settings of a new group hub.
     *
     * @param avatar an image file uploaded as the hub avatar, or {@code null}
     */
    public record GroupHubSpec(
            String id,
            String title,
            String description,
            String membershipType,
            List<String> discussionStyles,
            String parentCategoryId,
            Path avatar
    ) {
        public GroupHubSpec {
            if (id == null || id.isBlank() || title == null || title.isBlank()) {
                throw KhorosError.missingData("The group hub ID and title are required to create a group hub.");
            }
            if (membershipType == null || !MEMBERSHIP_TYPES.contains(membershipType)) {
                throw KhorosError.missingData("The membership type must be defined when creating a new group hub.");
            }
            discussionStyles = discussionStyles == null || discussionStyles.isEmpty()
                    ? ALL_DISCUSSION_STYLES : List.copyOf(discussionStyles);
            for (var style : discussionStyles) {
                if (!ALL_DISCUSSION_STYLES.contains(style)) {
                    throw KhorosError.validation(KhorosError.CODE_INVALID_PAYLOAD_VALUE,
                            "The value '" + style + "' is not valid for the 'conversation_styles' field.");
                }
            }
        }

        public static Builder builder() {
            return new Builder();
        }

        public static final class Builder {
            private String id;
            private String title;
            private String description;
            private String membershipType;
            private final List<String> discussionStyles = new ArrayList<>();
            private String parentCategoryId;
            private Path avatar;

            private Builder() {}

            public Builder id(String id) {
                this.id = id;
                return this;
            }

            public Builder title(String title) {
                this.title = title;
                return this;
            }

            public Builder description(String description) {
                this.description = description;
                return this;
            }

            /** {@code open}, {@code closed} or {@code closed_hidden}. */
            public Builder membershipType(String membershipType) {
                this.membershipType = membershipType;
                return this;
            }

            public Builder openGroup() {
                return membershipType("open");
            }

            public Builder closedGroup() {
                return membershipType("closed");
            }

            public Builder hiddenGroup() {
                return membershipType("closed_hidden");
            }

            /** Enables a discussion style; with none enabled, all styles are enabled. */
            public Builder enable(String discussionStyle) {
                this.discussionStyles.add(discussionStyle);
                return this;
            }

            public Builder parentCategoryId(String parentCategoryId) {
                this.parentCategoryId = parentCategoryId;
                return this;
            }

            public Builder avatar(Path avatar) {
                this.avatar = avatar;
                return this;
            }

            public GroupHubSpec build() {
                return new GroupHubSpec(id, title, description, membershipType, discussionStyles,
                        parentCategoryId, avatar);
            }
        }

        /** {@code {"grouphub": {...}}}. */
        public Map<String, Object> toPayload() {
            var hub = new LinkedHashMap<String, Object>();
            hub.put("id", id);
            hub.put("title", title);
            if (description != null && !description.isBlank()) hub.put("description", description);
            hub.put("membership_type", membershipType);
            hub.put("conversation_styles", discussionStyles);
            if (parentCategoryId != null && !parentCategoryId.isBlank()) {
                hub.put("parent_category", Map.of("id", parentCategoryId));
            }
            return Map.of("grouphub", hub);
        }
    }

    public boolean create(GroupHubSpec spec) {
        return create(spec, ReturnFields.none()).isSuccess();
    }

    /** Create a group hub; with an avatar the request is sent as multipart. */
    public Delivery create(GroupHubSpec spec, ReturnFields fields) {
        return dispatcher.send(HttpMethod.POST, COLLECTION, requestBody(spec), fields);
    }

    static RequestBody requestBody(GroupHubSpec spec) {
        if (spec.avatar() == null) {
            return RequestBody.json(spec.toPayload());
        }
        return RequestBody.multipart(MultipartBody.builder()
                .jsonField(REQUEST_PART, spec.toPayload())
                .file(AVATAR_PART, spec.avatar())
                .build());
    }

    public Delivery updateTitle(String groupHubId, String newTitle, ReturnFields fields) {
        if (groupHubId == null || groupHubId.isBlank()) {
            throw KhorosError.missingData("An ID or URL for the group hub must be provided.");
        }
        var payload = Map.of("grouphub", Map.of("title", newTitle));
        return dispatcher.send(HttpMethod.PUT, COLLECTION + "/" + groupHubId, RequestBody.json(payload), fields);
    }

    public Delivery updateTitleByUrl(String groupHubUrl, String newTitle, ReturnFields fields) {
        return updateTitle(getGroupHubId(groupHubUrl), newTitle, fields);
    }

    public int getTotalCount() {
        return liql.getTotalCount(COLLECTION, null);
    }

    public boolean exists(String groupHubId) {
        return Nodes.exists(liql, COLLECTION, groupHubId);
    }

    public static String getGroupHubId(String url) {
        return Nodes.getStructureId(url);
    }
}
