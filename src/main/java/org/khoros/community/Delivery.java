package org.khoros.community;

import org.khoros.community.transport.ApiResponse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * What an operation returns after field projection.
 *
 * <ul>
 *   <li>{@link Outcome}: nothing was selected; whether the call succeeded.</li>
 *   <li>{@link Value}: exactly one field was selected; its bare value.</li>
 *   <li>{@link Values}: several fields; their values in delivery order.</li>
 *   <li>{@link Full}: the unprocessed response.</li>
 * </ul>
 */
public sealed interface Delivery {

    record Outcome(boolean success) implements Delivery {}

    record Value(Object value) implements Delivery {}

    record Values(List<Object> values) implements Delivery {
        public Values {
            // values may contain nulls for absent fields
            values = Collections.unmodifiableList(new ArrayList<>(values));
        }

        public Object get(int index) {
            return values.get(index);
        }

        public int size() {
            return values.size();
        }
    }

    record Full(ApiResponse response) implements Delivery {}

    /** Project a normalized result according to the selected fields. */
    static Delivery project(NormalizedResult result, ReturnFields fields) {
        if (fields.fullResponse()) {
            return new Full(result.response());
        }
        var selected = fields.selected();
        if (selected.isEmpty()) {
            return new Outcome(result.isSuccess());
        }
        var values = new ArrayList<Object>(selected.size());
        for (var field : selected) {
            values.add(result.field(field, fields.splitErrors()));
        }
        return values.size() == 1 ? new Value(values.get(0)) : new Values(values);
    }

    /** The success flag of an {@link Outcome}. */
    default boolean isSuccess() {
        if (this instanceof Outcome outcome) return outcome.success();
        throw new IllegalStateException("Not an outcome: " + this);
    }

    /** The value of a {@link Value}. */
    default Object value() {
        if (this instanceof Value v) return v.value();
        throw new IllegalStateException("Not a single value: " + this);
    }

    /** The values of a {@link Values}. */
    default List<Object> values() {
        if (this instanceof Values v) return v.values();
        throw new IllegalStateException("Not a value list: " + this);
    }

    /** The response of a {@link Full}. */
    default ApiResponse response() {
        if (this instanceof Full f) return f.response();
        throw new IllegalStateException("Not a full response: " + this);
    }
}
