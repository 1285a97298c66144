package org.khoros.community;

import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.RequestBody;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Board creation and lookups. A board is a blog, contest, forum, idea exchange, Q&A or TKB.
 *
 * <pre>{@code
 * var spec = Boards.BoardSpec.builder()
 *     .id("product-news")
 *     .title("Product News")
 *     .discussionStyle("blog")
 *     .parentCategoryId("products")
 *     .blogAuthorLogins(List.of("jdoe"))
 *     .build();
 * client.boards().create(spec, ReturnFields.builder().returnUrl().build());
 * }</pre>
 */
public final class Boards {

    private static final System.Logger logger = System.getLogger(Boards.class.getName());

    static final String COLLECTION = "boards";

    public static final Set<String> DISCUSSION_STYLES = Set.of("blog", "contest", "forum", "idea", "qanda", "tkb");

    public static final String LABELS_FREEFORM = "freeform-only";
    public static final String LABELS_PREDEFINED = "predefined-only";
    public static final String LABELS_BOTH = "freeform and pre-defined";
    private static final Set<String> ALLOWED_LABELS = Set.of(LABELS_FREEFORM, LABELS_PREDEFINED, LABELS_BOTH);

    private final RequestDispatcher dispatcher;
    private final Liql liql;
    private final Users users;

    public Boards(RequestDispatcher dispatcher, Liql liql, Users users) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.liql = Objects.requireNonNull(liql, "liql must not be null");
        this.users = Objects.requireNonNull(users, "users must not be null");
    }

    // --- Board definition ---

    /**
     * The settings of a new board. Blog settings apply to {@code blog} boards only and contest
     * settings to {@code contest} boards only; on other styles they are ignored with a warning.
     */
    public static final class BoardSpec {
        private final String id;
        private final String title;
        private final String discussionStyle;
        private final String description;
        private final String parentCategoryId;
        private final Boolean hidden;
        private final String mediaType;
        private final String allowedLabels;
        private final Boolean useFreeformLabels;
        private final Boolean usePredefinedLabels;
        private final List<Object> predefinedLabels;
        private final Boolean commentsEnabled;
        private final List<String> authorIds;
        private final List<String> authorLogins;
        private final List<String> moderatorIds;
        private final List<String> moderatorLogins;
        private final Map<String, Object> contestSettings;

        private BoardSpec(Builder b) {
            this.id = b.id;
            this.title = b.title;
            this.discussionStyle = b.discussionStyle;
            this.description = b.description;
            this.parentCategoryId = b.parentCategoryId;
            this.hidden = b.hidden;
            this.mediaType = b.mediaType;
            this.allowedLabels = b.allowedLabels;
            this.useFreeformLabels = b.useFreeformLabels;
            this.usePredefinedLabels = b.usePredefinedLabels;
            this.predefinedLabels = List.copyOf(b.predefinedLabels);
            this.commentsEnabled = b.commentsEnabled;
            this.authorIds = List.copyOf(b.authorIds);
            this.authorLogins = List.copyOf(b.authorLogins);
            this.moderatorIds = List.copyOf(b.moderatorIds);
            this.moderatorLogins = List.copyOf(b.moderatorLogins);
            this.contestSettings = new LinkedHashMap<>(b.contestSettings);
        }

        public static Builder builder() {
            return new Builder();
        }

        public String id() {
            return id;
        }

        public String title() {
            return title;
        }

        public String discussionStyle() {
            return discussionStyle;
        }

        boolean hasBlogSettings() {
            return commentsEnabled != null || !authorIds.isEmpty() || !authorLogins.isEmpty()
                    || !moderatorIds.isEmpty() || !moderatorLogins.isEmpty();
        }

        boolean hasContestSettings() {
            return !contestSettings.isEmpty();
        }

        public static final class Builder {
            private String id;
            private String title;
            private String discussionStyle;
            private String description;
            private String parentCategoryId;
            private Boolean hidden;
            private String mediaType;
            private String allowedLabels;
            private Boolean useFreeformLabels;
            private Boolean usePredefinedLabels;
            private final List<Object> predefinedLabels = new ArrayList<>();
            private Boolean commentsEnabled;
            private final List<String> authorIds = new ArrayList<>();
            private final List<String> authorLogins = new ArrayList<>();
            private final List<String> moderatorIds = new ArrayList<>();
            private final List<String> moderatorLogins = new ArrayList<>();
            private final Map<String, Object> contestSettings = new LinkedHashMap<>();

            private Builder() {}

            public Builder id(String id) {
                this.id = id;
                return this;
            }

            public Builder title(String title) {
                this.title = title;
                return this;
            }

            /** One of {@code blog}, {@code contest}, {@code forum}, {@code idea}, {@code qanda}, {@code tkb}. */
            public Builder discussionStyle(String discussionStyle) {
                this.discussionStyle = discussionStyle;
                return this;
            }

            public Builder description(String description) {
                this.description = description;
                return this;
            }

            public Builder parentCategoryId(String parentCategoryId) {
                this.parentCategoryId = parentCategoryId;
                return this;
            }

            public Builder hidden(boolean hidden) {
                this.hidden = hidden;
                return this;
            }

            /** The contest media type: {@code image}, {@code video} or {@code story}. */
            public Builder mediaType(String mediaType) {
                this.mediaType = mediaType;
                return this;
            }

            public Builder allowedLabels(String allowedLabels) {
                this.allowedLabels = allowedLabels;
                return this;
            }

            /** Overrides {@link #allowedLabels(String)} together with {@link #usePredefinedLabels(boolean)}. */
            public Builder useFreeformLabels(boolean use) {
                this.useFreeformLabels = use;
                return this;
            }

            public Builder usePredefinedLabels(boolean use) {
                this.usePredefinedLabels = use;
                return this;
            }

            public Builder predefinedLabels(List<?> labels) {
                this.predefinedLabels.addAll(labels);
                return this;
            }

            public Builder blogCommentsEnabled(boolean enabled) {
                this.commentsEnabled = enabled;
                return this;
            }

            public Builder blogAuthorIds(List<String> ids) {
                this.authorIds.addAll(ids);
                return this;
            }

            public Builder blogAuthorLogins(List<String> logins) {
                this.authorLogins.addAll(logins);
                return this;
            }

            public Builder blogModeratorIds(List<String> ids) {
                this.moderatorIds.addAll(ids);
                return this;
            }

            public Builder blogModeratorLogins(List<String> logins) {
                this.moderatorLogins.addAll(logins);
                return this;
            }

            public Builder oneEntryPerContest(boolean value) {
                contestSettings.put("one_entry_per_contest", value);
                return this;
            }

            public Builder oneKudoPerContest(boolean value) {
                contestSettings.put("one_kudo_per_contest", value);
                return this;
            }

            /** Contest dates are sent as given, normally ISO-8601 timestamps. */
            public Builder postingDateStart(String date) {
                contestSettings.put("posting_date_start", date);
                return this;
            }

            public Builder postingDateEnd(String date) {
                contestSettings.put("posting_date_end", date);
                return this;
            }

            public Builder votingDateStart(String date) {
                contestSettings.put("voting_date_start", date);
                return this;
            }

            public Builder votingDateEnd(String date) {
                contestSettings.put("voting_date_end", date);
                return this;
            }

            public Builder winnerAnnouncedDate(String date) {
                contestSettings.put("winner_announced_date", date);
                return this;
            }

            /**
             * @throws KhorosError.KhorosException with code {@code missing_required_data} without an
             *                                     ID, title and style, or {@code invalid_node_type}
             *                                     for an unknown style
             */
            public BoardSpec build() {
                if (isBlank(id) || isBlank(title) || isBlank(discussionStyle)) {
                    throw KhorosError.missingData(
                            "The board ID, title and discussion style are required to create a board.");
                }
                if (!DISCUSSION_STYLES.contains(discussionStyle)) {
                    throw KhorosError.validation(KhorosError.CODE_INVALID_NODE_TYPE,
                            "'" + discussionStyle + "' is not a valid discussion style.");
                }
                return new BoardSpec(this);
            }
        }
    }

    // --- Operations ---

    /**
     * The v2 payload for a board. Blog author and moderator logins are resolved to user IDs.
     */
    public Map<String, Object> structurePayload(BoardSpec spec) {
        var data = new LinkedHashMap<String, Object>();
        data.put("type", "board");
        data.put("id", spec.id);
        data.put("title", spec.title);
        data.put("conversation_style", spec.discussionStyle);
        if (!isBlank(spec.parentCategoryId)) {
            data.put("parent_category", Map.of("id", spec.parentCategoryId));
        }
        if (!isBlank(spec.description)) data.put("description", spec.description);
        if (Boolean.TRUE.equals(spec.hidden)) data.put("hidden", true);
        if (!isBlank(spec.mediaType)) data.put("media_type", spec.mediaType);

        structureLabelSettings(spec, data);
        structureBlogSettings(spec, data);
        structureContestSettings(spec, data);
        return Map.of("data", data);
    }

    public boolean create(BoardSpec spec) {
        return create(spec, ReturnFields.none()).isSuccess();
    }

    /** Create a board through the v2 API. */
    public Delivery create(BoardSpec spec, ReturnFields fields) {
        var payload = structurePayload(spec);
        logger.log(System.Logger.Level.DEBUG, "Creating the {0} board {1}", spec.discussionStyle, spec.id);
        return dispatcher.send(HttpMethod.POST, COLLECTION, RequestBody.json(payload), fields);
    }

    public boolean exists(String boardId) {
        return Nodes.exists(liql, COLLECTION, boardId);
    }

    public boolean existsByUrl(String boardUrl) {
        return exists(getBoardId(boardUrl));
    }

    public Map<String, Object> getDetails(String boardId) {
        return Nodes.details(liql, COLLECTION, boardId);
    }

    public static String getBoardId(String url) {
        return Nodes.getStructureId(url);
    }

    // --- Payload sections ---

    private static void structureLabelSettings(BoardSpec spec, Map<String, Object> data) {
        if (!isBlank(spec.allowedLabels)) {
            if (ALLOWED_LABELS.contains(spec.allowedLabels)) {
                data.put("allowed_labels", spec.allowedLabels);
            } else {
                logger.log(System.Logger.Level.WARNING,
                        "The value ''{0}'' for the allowed_labels field is not valid and will be ignored",
                        spec.allowedLabels);
            }
        }

        var freeform = Boolean.TRUE.equals(spec.useFreeformLabels);
        var predefined = Boolean.TRUE.equals(spec.usePredefinedLabels);
        if (freeform || predefined) {
            if (data.containsKey("allowed_labels")) {
                logger.log(System.Logger.Level.WARNING,
                        "The allowed_labels value is overridden by the freeform and predefined label flags");
            }
            data.put("allowed_labels", freeform && predefined ? LABELS_BOTH
                    : freeform ? LABELS_FREEFORM : LABELS_PREDEFINED);
        }

        if (!spec.predefinedLabels.isEmpty()) {
            data.put("predefined_labels", spec.predefinedLabels);
        }
    }

    private void structureBlogSettings(BoardSpec spec, Map<String, Object> data) {
        if (!spec.hasBlogSettings()) return;
        if (!"blog".equals(spec.discussionStyle)) {
            warnIgnored("blog", spec.discussionStyle);
            return;
        }
        if (Boolean.TRUE.equals(spec.commentsEnabled)) {
            data.put("comments_enabled", true);
        }
        if (!spec.authorIds.isEmpty() || !spec.authorLogins.isEmpty()) {
            data.put("authors", users.structureUserList(spec.authorIds, spec.authorLogins));
        }
        if (!spec.moderatorIds.isEmpty() || !spec.moderatorLogins.isEmpty()) {
            data.put("moderators", users.structureUserList(spec.moderatorIds, spec.moderatorLogins));
        }
    }

    private static void structureContestSettings(BoardSpec spec, Map<String, Object> data) {
        if (!spec.hasContestSettings()) return;
        if (!"contest".equals(spec.discussionStyle)) {
            warnIgnored("contest", spec.discussionStyle);
            return;
        }
        data.putAll(spec.contestSettings);
    }

    private static void warnIgnored(String settingsType, String discussionStyle) {
        logger.log(System.Logger.Level.WARNING,
                "The discussion style is ''{0}'' so all {1}-specific fields will be ignored",
                discussionStyle, settingsType);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
