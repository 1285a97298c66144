package org.khoros.community;

import org.khoros.community.transport.HttpMethod;
import org.khoros.community.transport.RequestBody;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * User operations: creation and deletion through the v2 API, lookups through LiQL.
 */
public final class Users {

    private static final System.Logger logger = System.getLogger(Users.class.getName());

    private final RequestDispatcher dispatcher;
    private final Liql liql;

    public Users(RequestDispatcher dispatcher, Liql liql) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.liql = Objects.requireNonNull(liql, "liql must not be null");
    }

    /** The attributes of a new user. Only non-null attributes are sent. */
    public record UserSpec(
            String login,
            String email,
            String password,
            String firstName,
            String lastName,
            String biography,
            String ssoId,
            String webPageUrl,
            String coverImage,
            Map<String, Object> extraSettings
    ) {
        public UserSpec {
            extraSettings = extraSettings != null ? Map.copyOf(extraSettings) : Map.of();
        }

        public static Builder builder() {
            return new Builder();
        }

        /** The v2 payload, {@code {"data": {"type": "user", ...}}}. */
        public Map<String, Object> toPayload() {
            var data = new LinkedHashMap<String, Object>(extraSettings);
            data.put("type", "user");
            putIfPresent(data, "biography", biography);
            putIfPresent(data, "cover_image", coverImage);
            putIfPresent(data, "email", email);
            putIfPresent(data, "first_name", firstName);
            putIfPresent(data, "last_name", lastName);
            putIfPresent(data, "login", login);
            putIfPresent(data, "password", password);
            putIfPresent(data, "sso_id", ssoId);
            putIfPresent(data, "web_page_url", webPageUrl);
            return Map.of("data", data);
        }

        public static final class Builder {
            private String login;
            private String email;
            private String password;
            private String firstName;
            private String lastName;
            private String biography;
            private String ssoId;
            private String webPageUrl;
            private String coverImage;
            private final Map<String, Object> extraSettings = new LinkedHashMap<>();

            private Builder() {}

            public Builder login(String login) {
                this.login = login;
                return this;
            }

            public Builder email(String email) {
                this.email = email;
                return this;
            }

            public Builder password(String password) {
                this.password = password;
                return this;
            }

            public Builder firstName(String firstName) {
                this.firstName = firstName;
                return this;
            }

            public Builder lastName(String lastName) {
                this.lastName = lastName;
                return this;
            }

            public Builder biography(String biography) {
                this.biography = biography;
                return this;
            }

            public Builder ssoId(String ssoId) {
                this.ssoId = ssoId;
                return this;
            }

            public Builder webPageUrl(String webPageUrl) {
                this.webPageUrl = webPageUrl;
                return this;
            }

            public Builder coverImage(String coverImage) {
                this.coverImage = coverImage;
                return this;
            }

            /** Any other v2 user field, sent as given. */
            public Builder setting(String field, Object value) {
                this.extraSettings.put(field, value);
                return this;
            }

            public UserSpec build() {
                if (login == null && email == null) {
                    throw KhorosError.missingData("A login or an email address is required to create a user");
                }
                return new UserSpec(login, email, password, firstName, lastName, biography, ssoId,
                        webPageUrl, coverImage, extraSettings);
            }
        }
    }

    // --- v2 operations ---

    public boolean create(UserSpec spec) {
        return create(spec, ReturnFields.none()).isSuccess();
    }

    public Delivery create(UserSpec spec, ReturnFields fields) {
        return dispatcher.send(HttpMethod.POST, "users", RequestBody.json(spec.toPayload()), fields);
    }

    /** Delete a user; a single attempt. */
    public boolean delete(String userId) {
        return delete(userId, ReturnFields.none()).isSuccess();
    }

    public Delivery delete(String userId, ReturnFields fields) {
        requireValue(userId, "A user ID is required to delete a user");
        return dispatcher.send(HttpMethod.DELETE, "users/" + userId, RequestBody.empty(), fields);
    }

    // --- v1 operations ---

    /** The number of users currently online. */
    public int getOnlineUserCount() {
        var result = dispatcher.v1Result("users/online/count", null, HttpMethod.GET).orThrow();
        return ResponseNormalizer.intOr(result.value(), 0);
    }

    // --- LiQL lookups ---

    public Optional<String> getUserId(String login) {
        requireValue(login, "A login is required to look up a user ID");
        return lookup("id", "login", login);
    }

    public Optional<String> getUserIdByEmail(String email) {
        requireValue(email, "An email address is required to look up a user ID");
        return lookup("id", "email", email);
    }

    public Optional<String> getLogin(String userId) {
        requireValue(userId, "A user ID is required to look up a login");
        return lookup("login", "id", userId);
    }

    /** All user data for a user ID. */
    public Map<String, Object> getUserData(String userId) {
        requireValue(userId, "A user ID is required to retrieve user data");
        var query = LiqlQuery.builder().from("users").where("id", userId).build();
        var first = Liql.getFirstItem(liql.performQuery(query, true));
        if (first == null) {
            throw KhorosError.missingData("No user was found with the ID '" + userId + "'");
        }
        return first;
    }

    /**
     * The user IDs for a list of logins, keyed by login.
     *
     * @throws KhorosError.KhorosException with code {@code missing_required_data} for an unknown login
     */
    public Map<String, String> getIdsFromLogins(List<String> logins) {
        var ids = new LinkedHashMap<String, String>();
        for (var login : logins) {
            var id = getUserId(login).orElseThrow(() ->
                    KhorosError.missingData("No user was found with the login '" + login + "'"));
            ids.put(login, id);
        }
        return ids;
    }

    /** {@code [{"id": "..."}]} entries for user IDs and logins, as used in board and message payloads. */
    public List<Map<String, String>> structureUserList(List<String> ids, List<String> logins) {
        var hasIds = ids != null && !ids.isEmpty();
        var hasLogins = logins != null && !logins.isEmpty();
        if (!hasIds && !hasLogins) {
            throw KhorosError.missingData("At least one user ID or login must be provided");
        }
        var all = new ArrayList<String>();
        if (hasIds) all.addAll(ids);
        if (hasLogins) all.addAll(getIdsFromLogins(logins).values());
        var users = new ArrayList<Map<String, String>>(all.size());
        for (var id : all) {
            users.add(Map.of("id", id));
        }
        return users;
    }

    private Optional<String> lookup(String field, String filterField, String filterValue) {
        var query = LiqlQuery.builder().select(field).from("users").where(filterField, filterValue).build();
        var items = Liql.getReturnedItems(liql.performQuery(query, true));
        if (items.isEmpty()) {
            return Optional.empty();
        }
        if (items.size() > 1) {
            logger.log(System.Logger.Level.WARNING,
                    "Multiple users matched {0} = {1}; using the first", filterField, filterValue);
        }
        var value = items.get(0).get(field);
        return value == null ? Optional.empty() : Optional.of(value.toString());
    }

    private static void requireValue(String value, String message) {
        if (value == null || value.isBlank()) {
            throw KhorosError.missingData(message);
        }
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) map.put(key, value);
    }
}
