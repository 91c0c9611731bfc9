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

import java.util.AbstractMap.SimpleImmutableEntry;
import java.util.Collections;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map.Entry;

import javax.annotation.Nonnull;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Supplier;
import com.google.common.collect.Lists;

/**
 * The children of a value that match a query, in query order. Nothing is
 * computed until {@link #iterator()} is called, and every call reads the
 * source again.
 */
public class QueryResult implements Iterable<Entry<String, JsonNode>> {

    private final Supplier<JsonNode> source;

    private final Query query;

    QueryResult(@Nonnull Supplier<JsonNode> source, @Nonnull Query query) {
        this.source = checkNotNull(source);
        this.query = checkNotNull(query);
    }

    @Nonnull
    public Query getQuery() {
        return query;
    }

    @Override
    public Iterator<Entry<String, JsonNode>> iterator() {
        return execute(source.get()).iterator();
    }

    /**
     * @return the matching children as an object, in query order
     */
    @Nonnull
    public ObjectNode toJson() {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        for (Entry<String, JsonNode> e : this) {
            obj.set(e.getKey(), e.getValue());
        }
        return obj;
    }

    private List<Entry<String, JsonNode>> execute(JsonNode value) {
        List<Entry<String, JsonNode>> children = children(value);
        Collections.sort(children, comparator());

        List<Entry<String, JsonNode>> result = Lists.newArrayList();
        for (Entry<String, JsonNode> e : children) {
            if (matches(e)) {
                result.add(e);
            }
        }
        Integer first = query.getLimitToFirst();
        Integer last = query.getLimitToLast();
        if (first != null && result.size() > first) {
            result = result.subList(0, first);
        } else if (last != null && result.size() > last) {
            result = result.subList(result.size() - last, result.size());
        }
        return result;
    }

    private static List<Entry<String, JsonNode>> children(JsonNode value) {
        List<Entry<String, JsonNode>> list = Lists.newArrayList();
        if (value == null) {
            return list;
        }
        if (value.isObject()) {
            Iterator<Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Entry<String, JsonNode> e = it.next();
                list.add(new SimpleImmutableEntry<String, JsonNode>(e.getKey(), e.getValue()));
            }
        } else if (value.isArray()) {
            for (int i = 0; i < value.size(); i++) {
                if (!value.get(i).isNull()) {
                    list.add(new SimpleImmutableEntry<String, JsonNode>(String.valueOf(i), value.get(i)));
                }
            }
        }
        return list;
    }

    private Comparator<Entry<String, JsonNode>> comparator() {
        if (query.isOrderByKey() || query.getOrderBy() == null) {
            return (a, b) -> KeyOrdering.INSTANCE.compare(a.getKey(), b.getKey());
        }
        return (a, b) -> {
            int comp = ValueOrdering.INSTANCE.compare(sortValue(a), sortValue(b));
            return comp != 0 ? comp : KeyOrdering.INSTANCE.compare(a.getKey(), b.getKey());
        };
    }

    private boolean matches(Entry<String, JsonNode> e) {
        if (query.getOrderBy() == null) {
            return true;
        }
        JsonNode start = query.getStartAt();
        JsonNode end = query.getEndAt();
        if (query.isOrderByKey()) {
            String key = e.getKey();
            return (start == null || KeyOrdering.INSTANCE.compare(key, start.textValue()) >= 0)
                    && (end == null || KeyOrdering.INSTANCE.compare(key, end.textValue()) <= 0);
        }
        JsonNode v = sortValue(e);
        if (v == null) {
            // children without the ordered field are not part of the result
            return false;
        }
        return (start == null || ValueOrdering.INSTANCE.compare(v, start) >= 0)
                && (end == null || ValueOrdering.INSTANCE.compare(v, end) <= 0);
    }

    /**
     * @return the value a child is ordered by, null if the field is missing
     *         or null
     */
    private JsonNode sortValue(Entry<String, JsonNode> e) {
        if (query.isOrderByValue()) {
            return e.getValue();
        }
        JsonNode n = e.getValue();
        for (String name : query.getOrderBy().split("/")) {
            if (n == null || !n.isObject()) {
                return null;
            }
            n = n.get(name);
        }
        return n == null || n.isNull() ? null : n;
    }

    @Override
    public String toString() {
        return query.toString();
    }
}
