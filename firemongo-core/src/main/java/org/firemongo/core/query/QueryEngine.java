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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;
import java.util.Map;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.InvalidQueryException;
import org.firemongo.core.mapper.JsonConversion;
import org.firemongo.core.mapper.StoredDocument;
import org.firemongo.core.rules.IndexSpec;
import org.firemongo.core.rules.RulesManager;
import org.firemongo.store.DocumentStore;
import org.firemongo.store.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Supplier;

/**
 * Orders and filters the children of a value.
 * <p>
 * Ordering by a child field or by value should be covered by an index
 * declared for the rule key of the queried path. Without one, the query
 * still runs, by sorting all children in memory, unless strict index mode
 * is enabled. Ordering by key never needs an index.
 * <p>
 * The children of a collection are documents. A query on a collection that
 * is covered by an index is passed to the store as a range query on the
 * ordered field, see {@link #readIndexed(String, Query)}; the result is
 * then ordered, filtered and limited in memory like any other.
 */
public class QueryEngine {

    private static final Logger LOG = LoggerFactory.getLogger(QueryEngine.class);

    private static final String FIELD_PREFIX = StoredDocument.FM_VAL + ".";

    private final DocumentStore store;

    private final RulesManager rules;

    private final boolean strictIndexes;

    public QueryEngine(@Nonnull DocumentStore store, @Nonnull RulesManager rules,
                       boolean strictIndexes) {
        this.store = checkNotNull(store);
        this.rules = checkNotNull(rules);
        this.strictIndexes = strictIndexes;
    }

    /**
     * Create a lazy query result.
     *
     * @param ruleKey the rule key of the queried path
     * @param source reads the queried value, called on every iteration
     * @param query the query
     * @return the result
     * @throws InvalidQueryException if no index covers the query and strict
     *             index mode is enabled
     */
    @Nonnull
    public QueryResult query(@Nonnull String ruleKey, @Nonnull Supplier<JsonNode> source,
                             @Nonnull Query query) throws InvalidQueryException {
        checkIndex(ruleKey, query);
        return new QueryResult(source, query);
    }

    /**
     * Apply a query to a value that was already read.
     *
     * @param ruleKey the rule key of the queried path
     * @param value the value, or null
     * @param query the query
     * @return the value itself for an empty query; for a value that is not
     *         a container, the value itself or, with bounds or limits, an
     *         empty object; otherwise the matching children
     * @throws InvalidQueryException if no index covers the query and strict
     *             index mode is enabled
     */
    @CheckForNull
    public JsonNode apply(@Nonnull String ruleKey, @CheckForNull final JsonNode value,
                          @Nonnull Query query) throws InvalidQueryException {
        if (query.isEmpty() || value == null) {
            return value;
        }
        checkIndex(ruleKey, query);
        if (!value.isContainerNode()) {
            return query.hasFilters() ? JsonNodeFactory.instance.objectNode() : value;
        }
        return new QueryResult(() -> value, query).toJson();
    }

    /**
     * Whether a query orders by a child field or by value, and the index
     * declared for the rule key covers it.
     *
     * @param ruleKey the rule key of the queried path
     * @param query the query
     * @return true if the query is covered by an index
     */
    public boolean isIndexed(@Nonnull String ruleKey, @Nonnull Query query) {
        String orderBy = query.getOrderBy();
        if (orderBy == null || query.isOrderByKey()) {
            return false;
        }
        IndexSpec spec = rules.getIndexFor(ruleKey);
        return spec != null && spec.covers(orderBy);
    }

    /**
     * Read the documents of a collection that may match a query ordered by
     * a child field or by value. Documents without the ordered field are
     * never returned. A range is only passed to the store when both bounds
     * are set and of the same kind, because the store matches a bound only
     * against values of its own kind; the limit is only passed along with
     * the range. All documents that share the value at the limit are read,
     * as the store breaks ties by id and not by key order.
     *
     * @param collection the collection, holding documents
     * @param query the query
     * @return the candidate documents as an object, keyed by document id
     */
    @Nonnull
    public ObjectNode readIndexed(@Nonnull String collection, @Nonnull Query query) {
        ObjectNode result = JsonNodeFactory.instance.objectNode();
        String property = query.isOrderByValue()
                ? StoredDocument.FM_VAL : FIELD_PREFIX + query.getOrderBy().replace('/', '.');
        Object from = null;
        Object to = null;
        int limit = Integer.MAX_VALUE;
        boolean descending = false;
        JsonNode start = query.getStartAt();
        JsonNode end = query.getEndAt();
        if (start != null && end != null && isSameKind(start, end)) {
            from = JsonConversion.toStore(start);
            to = JsonConversion.toStore(end);
            if (query.getLimitToFirst() != null) {
                limit = query.getLimitToFirst();
            } else if (query.getLimitToLast() != null) {
                limit = query.getLimitToLast();
                descending = true;
            }
        }
        if (limit == 0) {
            return result;
        }
        List<Map<String, Object>> docs = store.query(collection, property, from, to, descending, limit);
        if (limit < Integer.MAX_VALUE) {
            if (!allOfKind(docs, property, from)) {
                LOG.debug("Values of another kind in {}.{}, reading the whole range", collection, property);
                docs = store.query(collection, property, from, to, descending, Integer.MAX_VALUE);
            } else if (docs.size() == limit) {
                Object boundary = Utils.getProperty(docs.get(docs.size() - 1), property);
                addAll(result, store.query(collection, property, boundary, boundary,
                        descending, Integer.MAX_VALUE));
            }
        }
        addAll(result, docs);
        return result;
    }

    private static void addAll(ObjectNode result, List<Map<String, Object>> docs) {
        for (Map<String, Object> doc : docs) {
            String key = StoredDocument.getKey(doc);
            if (!StoredDocument.ROOT_KEY.equals(key)) {
                result.set(key, JsonConversion.toJson(StoredDocument.getValue(doc)));
            }
        }
    }

    private static boolean allOfKind(List<Map<String, Object>> docs, String property, Object bound) {
        for (Map<String, Object> doc : docs) {
            Object v = Utils.getProperty(doc, property);
            if (v == null || !Utils.isSameType(v, bound)) {
                return false;
            }
        }
        return true;
    }

    private static boolean isSameKind(JsonNode a, JsonNode b) {
        return (a.isNumber() && b.isNumber())
                || (a.isTextual() && b.isTextual())
                || (a.isBoolean() && b.isBoolean());
    }

    private void checkIndex(String ruleKey, Query query) throws InvalidQueryException {
        String orderBy = query.getOrderBy();
        if (orderBy == null || query.isOrderByKey()) {
            return;
        }
        IndexSpec spec = rules.getIndexFor(ruleKey);
        if (spec != null && spec.covers(orderBy)) {
            return;
        }
        String declaration = query.isOrderByValue() ? IndexSpec.VALUE_SENTINEL : orderBy;
        if (strictIndexes) {
            throw new InvalidQueryException(7, "Index not defined, add \"" + IndexSpec.INDEX_ON
                    + "\": \"" + declaration + "\", for path \"/" + ruleKey + "\", to the rules");
        }
        LOG.debug("No index on {} for {}, ordering all children in memory", declaration, ruleKey);
    }
}
