/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.firemongo.core.query;

import java.io.IOException;
import java.util.Map;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.InvalidQueryException;
import org.firemongo.core.path.PathResolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

/**
 * The ordering, filter and limit parameters of a read. Instances are
 * immutable and valid: they are created by a {@link Builder}, which rejects
 * invalid combinations.
 */
public final class Query {

    public static final String ORDER_BY = "orderBy";
    public static final String START_AT = "startAt";
    public static final String END_AT = "endAt";
    public static final String EQUAL_TO = "equalTo";
    public static final String LIMIT_TO_FIRST = "limitToFirst";
    public static final String LIMIT_TO_LAST = "limitToLast";

    /**
     * Order by the keys of the children.
     */
    public static final String KEY = "$key";

    /**
     * Order by the values of the children.
     */
    public static final String VALUE = "$value";

    /**
     * A query without parameters.
     */
    public static final Query NONE = new Query(new Builder());

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final String orderBy;
    private final JsonNode startAt;
    private final JsonNode endAt;
    private final boolean equalTo;
    private final Integer limitToFirst;
    private final Integer limitToLast;

    private Query(Builder builder) {
        this.orderBy = builder.orderBy;
        if (builder.equalTo != null) {
            this.startAt = builder.equalTo;
            this.endAt = builder.equalTo;
            this.equalTo = true;
        } else {
            this.startAt = builder.startAt;
            this.endAt = builder.endAt;
            this.equalTo = false;
        }
        this.limitToFirst = builder.limitToFirst;
        this.limitToLast = builder.limitToLast;
    }

    /**
     * Create a query from request parameters. Values are parsed as JSON when
     * possible and taken as plain strings otherwise, so both
     * {@code orderBy="height"} and {@code orderBy=height} work. Unknown
     * parameters are ignored.
     *
     * @param parameters the parameters
     * @return the query
     * @throws InvalidQueryException if the parameters are invalid
     */
    @Nonnull
    public static Query fromParameters(@Nonnull Map<String, String> parameters) throws InvalidQueryException {
        Builder builder = new Builder();
        String orderBy = parameters.get(ORDER_BY);
        if (orderBy != null) {
            JsonNode n = parseLiteral(orderBy);
            builder.orderBy(n.isTextual() ? n.textValue() : orderBy);
        }
        if (parameters.containsKey(START_AT)) {
            builder.startAt(parseLiteral(parameters.get(START_AT)));
        }
        if (parameters.containsKey(END_AT)) {
            builder.endAt(parseLiteral(parameters.get(END_AT)));
        }
        if (parameters.containsKey(EQUAL_TO)) {
            builder.equalTo(parseLiteral(parameters.get(EQUAL_TO)));
        }
        if (parameters.containsKey(LIMIT_TO_FIRST)) {
            builder.limitToFirst(parseLimit(LIMIT_TO_FIRST, parameters.get(LIMIT_TO_FIRST)));
        }
        if (parameters.containsKey(LIMIT_TO_LAST)) {
            builder.limitToLast(parseLimit(LIMIT_TO_LAST, parameters.get(LIMIT_TO_LAST)));
        }
        return builder.build();
    }

    /**
     * Parse a parameter value as a JSON literal, or take it as a string.
     */
    @Nonnull
    static JsonNode parseLiteral(@CheckForNull String value) {
        if (value == null) {
            return JsonNodeFactory.instance.nullNode();
        }
        try {
            JsonNode n = MAPPER.readTree(value);
            if (n != null && !n.isMissingNode()) {
                return n;
            }
        } catch (IOException e) {
            // not JSON
        }
        return JsonNodeFactory.instance.textNode(value);
    }

    private static int parseLimit(String name, String value) throws InvalidQueryException {
        JsonNode n = parseLiteral(value);
        if (!n.isIntegralNumber() || !n.canConvertToInt() || n.intValue() < 0) {
            throw new InvalidQueryException(5, name + " must be a non-negative integer: " + value);
        }
        return n.intValue();
    }

    @CheckForNull
    public String getOrderBy() {
        return orderBy;
    }

    /**
     * @return the inclusive lower bound, or null
     */
    @CheckForNull
    public JsonNode getStartAt() {
        return startAt;
    }

    /**
     * @return the inclusive upper bound, or null
     */
    @CheckForNull
    public JsonNode getEndAt() {
        return endAt;
    }

    @CheckForNull
    public Integer getLimitToFirst() {
        return limitToFirst;
    }

    @CheckForNull
    public Integer getLimitToLast() {
        return limitToLast;
    }

    public boolean isOrderByKey() {
        return KEY.equals(orderBy);
    }

    public boolean isOrderByValue() {
        return VALUE.equals(orderBy);
    }

    /**
     * @return whether there are no parameters at all
     */
    public boolean isEmpty() {
        return orderBy == null && !hasFilters();
    }

    /**
     * @return whether there is a bound or a limit
     */
    public boolean hasFilters() {
        return startAt != null || endAt != null || limitToFirst != null || limitToLast != null;
    }

    @Override
    public String toString() {
        StringBuilder buff = new StringBuilder();
        append(buff, ORDER_BY, orderBy);
        if (equalTo) {
            append(buff, EQUAL_TO, startAt);
        } else {
            append(buff, START_AT, startAt);
            append(buff, END_AT, endAt);
        }
        append(buff, LIMIT_TO_FIRST, limitToFirst);
        append(buff, LIMIT_TO_LAST, limitToLast);
        return buff.toString();
    }

    private static void append(StringBuilder buff, String name, Object value) {
        if (value != null) {
            if (buff.length() > 0) {
                buff.append('&');
            }
            buff.append(name).append('=').append(value);
        }
    }

    /**
     * Builds a {@link Query}.
     */
    public static class Builder {

        private String orderBy;
        private JsonNode startAt;
        private JsonNode endAt;
        private JsonNode equalTo;
        private Integer limitToFirst;
        private Integer limitToLast;

        public Builder orderBy(String orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder startAt(JsonNode startAt) {
            this.startAt = startAt;
            return this;
        }

        public Builder endAt(JsonNode endAt) {
            this.endAt = endAt;
            return this;
        }

        public Builder equalTo(JsonNode equalTo) {
            this.equalTo = equalTo;
            return this;
        }

        public Builder limitToFirst(int limit) {
            this.limitToFirst = limit;
            return this;
        }

        public Builder limitToLast(int limit) {
            this.limitToLast = limit;
            return this;
        }

        /**
         * @return the query
         * @throws InvalidQueryException if the parameters can not be combined
         */
        public Query build() throws InvalidQueryException {
            boolean filtered = startAt != null || endAt != null || equalTo != null
                    || limitToFirst != null || limitToLast != null;
            if (orderBy == null) {
                if (filtered) {
                    throw new InvalidQueryException(1,
                            "orderBy must be defined when other query parameters are defined");
                }
                return new Query(this);
            }
            if (!KEY.equals(orderBy) && !VALUE.equals(orderBy) && !isValidField(orderBy)) {
                throw new InvalidQueryException(2, "Invalid orderBy: " + orderBy);
            }
            if (equalTo != null && (startAt != null || endAt != null)) {
                throw new InvalidQueryException(3, "equalTo can not be combined with startAt or endAt");
            }
            if (limitToFirst != null && limitToLast != null) {
                throw new InvalidQueryException(4, "limitToFirst and limitToLast can not both be set");
            }
            if ((limitToFirst != null && limitToFirst < 0) || (limitToLast != null && limitToLast < 0)) {
                throw new InvalidQueryException(5, "Limits must not be negative");
            }
            if (KEY.equals(orderBy)) {
                for (JsonNode bound : new JsonNode[] {startAt, endAt, equalTo}) {
                    if (bound != null && !bound.isTextual()) {
                        throw new InvalidQueryException(6,
                                "startAt, endAt and equalTo must be strings when ordering by " + KEY);
                    }
                }
            }
            return new Query(this);
        }

        private static boolean isValidField(String field) {
            for (String s : field.split("/", -1)) {
                if (!PathResolver.isValidKey(s)) {
                    return false;
                }
            }
            return true;
        }
    }
}
