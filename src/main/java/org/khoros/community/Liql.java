package org.khoros.community;

import org.khoros.community.KhorosError.KhorosException;
import org.khoros.community.transport.ApiResponse;
import org.khoros.community.transport.HttpMethod;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs LiQL queries against the v2 {@code search} endpoint.
 */
public final class Liql {

    private static final System.Logger logger = System.getLogger(Liql.class.getName());

    private static final Pattern KEYWORDS = Pattern.compile(
            "(?i)\\b(select|from|where|order\\s+by|desc|asc|limit|offset)\\b");
    private static final Pattern QUOTED = Pattern.compile("'(?:\\\\.|[^'\\\\])*'|\"(?:\\\\.|[^\"\\\\])*\"");

    private final RequestDispatcher dispatcher;

    public Liql(RequestDispatcher dispatcher) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
    }

    /** Query string options appended after the encoded statement. */
    public record QueryOptions(
            boolean prettyPrint,
            boolean trackInLsi,
            boolean alwaysOk,
            String errorCode,
            boolean formatStatements
    ) {
        private static final QueryOptions DEFAULTS = new QueryOptions(false, false, false, null, true);

        public static QueryOptions defaults() {
            return DEFAULTS;
        }

        public QueryOptions withPrettyPrint(boolean enabled) {
            return new QueryOptions(enabled, trackInLsi, alwaysOk, errorCode, formatStatements);
        }

        public QueryOptions withTrackInLsi(boolean enabled) {
            return new QueryOptions(prettyPrint, enabled, alwaysOk, errorCode, formatStatements);
        }

        public QueryOptions withAlwaysOk(boolean enabled) {
            return new QueryOptions(prettyPrint, trackInLsi, enabled, errorCode, formatStatements);
        }

        public QueryOptions withErrorCode(String code) {
            return new QueryOptions(prettyPrint, trackInLsi, alwaysOk, code, formatStatements);
        }

        public QueryOptions withFormatStatements(boolean enabled) {
            return new QueryOptions(prettyPrint, trackInLsi, alwaysOk, errorCode, enabled);
        }
    }

    // --- Formatting ---

    public static String formatQuery(String query) {
        return formatQuery(query, QueryOptions.defaults());
    }

    /**
     * Encode a LiQL statement for use in the {@code q} query parameter.
     *
     * <p>A trailing {@code ;} is dropped, statement keywords outside quoted literals are
     * upper-cased (unless disabled), and the statement is form-encoded, so a space
     * becomes {@code +} and every reserved character is percent-encoded.
     */
    public static String formatQuery(String query, QueryOptions options) {
        Objects.requireNonNull(query, "query must not be null");
        var statement = query.strip();
        while (statement.endsWith(";")) {
            statement = statement.substring(0, statement.length() - 1).stripTrailing();
        }
        if (options.formatStatements()) {
            statement = upperCaseKeywords(statement);
        }

        var sb = new StringBuilder(URLEncoder.encode(statement, StandardCharsets.UTF_8));

        if (options.prettyPrint()) sb.append("&api.pretty_print=true");
        if (options.trackInLsi()) sb.append("&api.for_ui_search=true");
        if (options.alwaysOk()) sb.append("&api.always_ok");
        if (options.errorCode() != null && !options.errorCode().isEmpty()) {
            sb.append("&api.error_code=").append(options.errorCode());
        }
        return sb.toString();
    }

    private static String upperCaseKeywords(String statement) {
        var out = new StringBuilder(statement.length());
        var quoted = QUOTED.matcher(statement);
        int last = 0;
        while (quoted.find()) {
            out.append(upperCaseSegment(statement.substring(last, quoted.start())));
            out.append(quoted.group());
            last = quoted.end();
        }
        out.append(upperCaseSegment(statement.substring(last)));
        return out.toString();
    }

    private static String upperCaseSegment(String segment) {
        var matcher = KEYWORDS.matcher(segment);
        var sb = new StringBuilder();
        while (matcher.find()) {
            var keyword = matcher.group(1).toUpperCase(Locale.ROOT).replaceAll("\\s+", " ");
            matcher.appendReplacement(sb, Matcher.quoteReplacement(keyword));
        }
        matcher.appendTail(sb);
        return sb.toString();
    }

    /** The full search URL for a statement. */
    public String queryUrl(String query) {
        return queryUrl(query, QueryOptions.defaults());
    }

    public String queryUrl(String query, QueryOptions options) {
        return dispatcher.session().v2Base() + "/search?q=" + formatQuery(query, options);
    }

    // --- Queries ---

    /**
     * Run a statement and return the decoded response.
     *
     * @param verifySuccess raise when the response status is not {@code success}
     * @throws KhorosException with a GET {@link KhorosError.RequestError} for HTTP errors
     *                         or, with {@code verifySuccess}, unsuccessful queries
     */
    public Map<String, Object> performQuery(String query, boolean verifySuccess) {
        if (query == null || query.isBlank()) {
            throw KhorosError.missingData("A LiQL query must be provided");
        }
        var response = dispatcher.get(queryUrl(query));
        var body = decode(response);
        if (verifySuccess) {
            var result = dispatcher.normalizer().normalizeV2(HttpMethod.GET, response);
            if (!result.isSuccess()) {
                throw new KhorosException(result.error().orElseThrow());
            }
        }
        return body;
    }

    /** Run a statement and return only the returned items, empty when there are none. */
    public List<Map<String, Object>> performQueryForItems(String query) {
        var body = performQuery(query, false);
        if (!isSuccess(body)) {
            logger.log(System.Logger.Level.WARNING, "The LiQL query failed: {0}", body.get("message"));
            return List.of();
        }
        return items(body);
    }

    /**
     * Count the assets in a collection.
     *
     * @param whereFilter a WHERE clause without the keyword, may be empty
     */
    public int getTotalCount(String collection, String whereFilter) {
        var query = LiqlQuery.builder().select("count(*)").from(collection);
        if (whereFilter != null && !whereFilter.isBlank()) {
            query.whereRaw(whereFilter);
        }
        var body = performQuery(query.build(), true);
        var data = body.get("data") instanceof Map<?, ?> m ? m : Map.of();
        return ResponseNormalizer.intOr(data.get("count"), 0);
    }

    // --- Response helpers ---

    /**
     * The items of a LiQL response.
     *
     * @throws KhorosException with code {@code liql_parse_error} when the response has no
     *                         status or did not succeed
     */
    public static List<Map<String, Object>> getReturnedItems(Map<String, Object> response) {
        requireSuccess(response);
        return items(response);
    }

    /** The first item of a LiQL response, or {@code null} when there are none. */
    public static Map<String, Object> getFirstItem(Map<String, Object> response) {
        var items = getReturnedItems(response);
        if (items.isEmpty()) {
            logger.log(System.Logger.Level.WARNING, "No items were found in the LiQL response");
            return null;
        }
        return items.get(0);
    }

    /**
     * A CURSOR clause for a cursor value. Values already starting with {@code CURSOR}
     * are returned unchanged.
     */
    public static String structureCursorClause(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            throw KhorosError.missingData("A cursor value must be provided");
        }
        return cursor.toLowerCase(Locale.ROOT).startsWith("cursor") ? cursor : "CURSOR '" + cursor + "'";
    }

    /** The CURSOR clause for the next page of a response, or empty when it is the last. */
    public static String structureCursorClause(Map<String, Object> response) {
        Objects.requireNonNull(response, "response must not be null");
        var data = response.get("data") instanceof Map<?, ?> m ? m : Map.of();
        var next = data.get("next_cursor");
        return next == null || next.toString().isBlank() ? "" : "CURSOR '" + next + "'";
    }

    private static void requireSuccess(Map<String, Object> response) {
        if (response == null || !response.containsKey("status")) {
            throw new KhorosException(new KhorosError.ResponseError(KhorosError.CODE_LIQL_PARSE,
                    "The LiQL response could not be parsed"));
        }
        if (!isSuccess(response)) {
            throw new KhorosException(new KhorosError.ResponseError(KhorosError.CODE_LIQL_PARSE,
                    "The LiQL query failed: " + response.get("message")));
        }
    }

    private static boolean isSuccess(Map<String, Object> response) {
        var status = response.get("status");
        return "success".equals(status) || "successful".equals(status);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> items(Map<String, Object> response) {
        var data = response.get("data") instanceof Map<?, ?> m ? m : Map.of();
        if (!(data.get("items") instanceof List<?> list)) {
            return List.of();
        }
        var items = new ArrayList<Map<String, Object>>(list.size());
        for (var item : list) {
            if (item instanceof Map<?, ?> map) items.add((Map<String, Object>) map);
        }
        return items;
    }

    private static Map<String, Object> decode(ApiResponse response) {
        return response.jsonObject().orElseThrow(() -> new KhorosException(new KhorosError.ResponseError(
                KhorosError.CODE_LIQL_PARSE, "The LiQL response is not a JSON object")));
    }
}
