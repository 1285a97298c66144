package org.khoros.community;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds LiQL statements.
 *
 * <pre>{@code
 * String query = LiqlQuery.builder()
 *     .select("id", "subject")
 *     .from("messages")
 *     .where("board.id", "my-board")
 *     .and()
 *     .where("kudos.sum(weight)", ">", 5)
 *     .orderBy("post_time", true)
 *     .limit(10)
 *     .build();
 * // SELECT id,subject FROM messages WHERE board.id = 'my-board' AND kudos.sum(weight) > 5 ORDER BY post_time DESC LIMIT 10
 * }</pre>
 */
public final class LiqlQuery {

    public static final Set<String> COMPARISON_OPERATORS = Set.of("=", "!=", ">", "<", ">=", "<=");
    public static final Set<String> LOGIC_OPERATORS = Set.of("AND", "OR", "IN", "MATCHES");

    private LiqlQuery() {}

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Render a WHERE value: integers are written bare, anything else in single quotes
     * with backslashes and single quotes escaped.
     */
    public static String wrapValue(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return value.toString();
        }
        var text = String.valueOf(value);
        try {
            return Long.toString(Long.parseLong(text.strip()));
        } catch (NumberFormatException e) {
            return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
        }
    }

    /**
     * Render a SELECT field list. Strings may separate fields with {@code ,} or {@code ;}.
     */
    public static String selectFields(String... fields) {
        if (fields == null || fields.length == 0) {
            return "*";
        }
        return Arrays.stream(fields)
                .map(f -> f.replace(';', ',').replace(", ", ","))
                .collect(Collectors.joining(","));
    }

    public static final class Builder {
        private String select = "*";
        private String from;
        private final List<String> clauses = new ArrayList<>();
        private final List<String> joins = new ArrayList<>();
        private String pendingJoin;
        private String orderBy;
        private boolean descending = true;
        private int limit;
        private String cursor;

        private Builder() {}

        public Builder select(String... fields) {
            this.select = selectFields(fields);
            return this;
        }

        public Builder from(String collection) {
            this.from = collection;
            return this;
        }

        /** {@code field = value}. */
        public Builder where(String field, Object value) {
            return where(field, "=", value);
        }

        /**
         * {@code field operator value}.
         *
         * @throws KhorosError.KhorosException with code {@code invalid_operator}
         */
        public Builder where(String field, String operator, Object value) {
            Objects.requireNonNull(field, "field must not be null");
            if (!COMPARISON_OPERATORS.contains(operator)) {
                throw KhorosError.validation(KhorosError.CODE_INVALID_OPERATOR,
                        "Invalid comparison operator: '" + operator + "'");
            }
            return clause(field + " " + operator + " " + wrapValue(value));
        }

        /** A clause passed through as written. */
        public Builder whereRaw(String clause) {
            return clause(Objects.requireNonNull(clause, "clause must not be null"));
        }

        public Builder and() {
            return join("AND");
        }

        public Builder or() {
            return join("OR");
        }

        /**
         * Join the previous and next clause with a logic operator.
         *
         * @throws KhorosError.KhorosException with code {@code invalid_operator}
         */
        public Builder join(String logic) {
            var upper = logic == null ? "" : logic.strip().toUpperCase(Locale.ROOT);
            if (!LOGIC_OPERATORS.contains(upper)) {
                throw KhorosError.validation(KhorosError.CODE_INVALID_OPERATOR,
                        "Invalid logic operator: '" + logic + "'");
            }
            if (clauses.isEmpty()) {
                throw KhorosError.validation(KhorosError.CODE_OPERATOR_MISMATCH,
                        "A logic operator must follow a WHERE clause");
            }
            this.pendingJoin = upper;
            return this;
        }

        public Builder orderBy(String field, boolean descending) {
            this.orderBy = field;
            this.descending = descending;
            return this;
        }

        public Builder limit(int limit) {
            if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
            this.limit = limit;
            return this;
        }

        /** Continue from a previous result page. */
        public Builder cursor(String cursor) {
            this.cursor = cursor;
            return this;
        }

        private Builder clause(String clause) {
            if (!clauses.isEmpty()) {
                joins.add(pendingJoin != null ? pendingJoin : "AND");
            }
            pendingJoin = null;
            clauses.add(clause);
            return this;
        }

        /**
         * Render the statement.
         *
         * @throws KhorosError.KhorosException with code {@code missing_required_data} without a collection,
         *                                     or {@code operator_mismatch} for a dangling logic operator
         */
        public String build() {
            if (from == null || from.isBlank()) {
                throw KhorosError.missingData("A LiQL query requires a collection in its FROM clause");
            }
            if (pendingJoin != null) {
                throw KhorosError.validation(KhorosError.CODE_OPERATOR_MISMATCH,
                        "The logic operator " + pendingJoin + " is not followed by a clause");
            }
            var sb = new StringBuilder("SELECT ").append(select).append(" FROM ").append(from);
            if (!clauses.isEmpty()) {
                sb.append(" WHERE ").append(clauses.get(0));
                for (int i = 1; i < clauses.size(); i++) {
                    sb.append(' ').append(joins.get(i - 1)).append(' ').append(clauses.get(i));
                }
            }
            if (orderBy != null && !orderBy.isBlank()) {
                sb.append(" ORDER BY ").append(orderBy).append(descending ? " DESC" : " ASC");
            }
            if (limit > 0) {
                sb.append(" LIMIT ").append(limit);
            }
            if (cursor != null && !cursor.isBlank()) {
                sb.append(' ').append(Liql.structureCursorClause(cursor));
            }
            return sb.toString();
        }
    }
}
