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
package org.firemongo.core.rules;

import static com.google.common.base.Preconditions.checkArgument;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.InvalidIndexException;
import org.firemongo.core.path.PathResolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

/**
 * An index declaration: either an ordered set of child fields, or ordering
 * by the value of the children.
 */
public final class IndexSpec {

    /**
     * The member name of the Firebase rules form.
     */
    public static final String INDEX_ON = ".indexOn";

    /**
     * The value of {@link #INDEX_ON} that declares ordering by value.
     */
    public static final String VALUE_SENTINEL = ".value";

    static final String FIELD_NAMES = "fieldNames";

    static final String BY_VALUE = "byValue";

    private static final IndexSpec BY_VALUE_SPEC = new IndexSpec(ImmutableSet.<String>of(), true);

    private final ImmutableSet<String> fieldNames;

    private final boolean byValue;

    private IndexSpec(ImmutableSet<String> fieldNames, boolean byValue) {
        this.fieldNames = fieldNames;
        this.byValue = byValue;
    }

    @Nonnull
    public static IndexSpec byValue() {
        return BY_VALUE_SPEC;
    }

    @Nonnull
    public static IndexSpec onFields(@Nonnull Collection<String> fieldNames) {
        checkArgument(!fieldNames.isEmpty(), "No field names");
        return new IndexSpec(ImmutableSet.copyOf(fieldNames), false);
    }

    public boolean isByValue() {
        return byValue;
    }

    /**
     * @return the field names, empty when ordering by value
     */
    @Nonnull
    public Set<String> getFieldNames() {
        return fieldNames;
    }

    /**
     * Whether a query ordered by the given child field is covered. Use
     * {@code $value} for ordering by value.
     *
     * @param orderBy the orderBy target
     * @return true if covered
     */
    public boolean covers(@Nonnull String orderBy) {
        if (byValue) {
            return "$value".equals(orderBy);
        }
        return fieldNames.contains(orderBy);
    }

    /**
     * Parse an index declaration. The accepted forms are
     * {@code {"fieldNames": [...]}}, {@code {"byValue": true}} and
     * {@code {".indexOn": "field" | [...] | ".value"}}.
     *
     * @param body the declaration
     * @return the index spec
     * @throws InvalidIndexException if the declaration is malformed
     */
    @Nonnull
    public static IndexSpec fromJson(@CheckForNull JsonNode body) throws InvalidIndexException {
        if (body == null || !body.isObject() || body.size() != 1) {
            throw new InvalidIndexException(1, "Index rules must be an object with exactly one of '"
                    + FIELD_NAMES + "', '" + BY_VALUE + "' or '" + INDEX_ON + "'");
        }
        Entry<String, JsonNode> e = body.fields().next();
        String name = e.getKey();
        JsonNode v = e.getValue();
        if (FIELD_NAMES.equals(name)) {
            if (!v.isArray()) {
                throw new InvalidIndexException(2, FIELD_NAMES + " must be a list of field names");
            }
            return onFields(parseFieldNames(v));
        } else if (BY_VALUE.equals(name)) {
            if (!v.isBoolean() || !v.booleanValue()) {
                throw new InvalidIndexException(3, BY_VALUE + " must be true");
            }
            return BY_VALUE_SPEC;
        } else if (INDEX_ON.equals(name)) {
            if (v.isTextual()) {
                if (VALUE_SENTINEL.equals(v.textValue())) {
                    return BY_VALUE_SPEC;
                }
                return onFields(parseFieldNames(JsonNodeFactory.instance.arrayNode().add(v)));
            } else if (v.isArray()) {
                return onFields(parseFieldNames(v));
            }
            throw new InvalidIndexException(2, INDEX_ON + " must be a field name, a list of field names or '"
                    + VALUE_SENTINEL + "'");
        }
        throw new InvalidIndexException(1, "Unknown index rule: " + name);
    }

    private static List<String> parseFieldNames(JsonNode array) throws InvalidIndexException {
        if (array.size() == 0) {
            throw new InvalidIndexException(4, "The list of field names is empty");
        }
        ImmutableList.Builder<String> names = ImmutableList.builder();
        for (JsonNode n : array) {
            if (!n.isTextual()) {
                throw new InvalidIndexException(5, "Field names must be strings: " + n);
            }
            String field = n.textValue();
            if (VALUE_SENTINEL.equals(field)) {
                throw new InvalidIndexException(6, "'" + VALUE_SENTINEL + "' can not be combined with field names");
            }
            if (!isValidField(field)) {
                throw new InvalidIndexException(7, "Invalid field name: " + field);
            }
            names.add(field);
        }
        return names.build();
    }

    /**
     * A field is a child name or a slash-separated path of child names.
     */
    static boolean isValidField(String field) {
        if (field.isEmpty()) {
            return false;
        }
        for (String s : field.split("/", -1)) {
            if (!PathResolver.isValidKey(s)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return the rules in Firebase form, {@code {".indexOn": ...}}
     */
    @Nonnull
    public JsonNode toJson() {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        if (byValue) {
            obj.put(INDEX_ON, VALUE_SENTINEL);
        } else {
            ArrayNode array = obj.putArray(INDEX_ON);
            for (String f : fieldNames) {
                array.add(f);
            }
        }
        return obj;
    }

    /**
     * @return the form kept in the store (member names must not contain dots)
     */
    @Nonnull
    Map<String, Object> toStore() {
        Map<String, Object> map = Maps.newLinkedHashMap();
        if (byValue) {
            map.put(BY_VALUE, Boolean.TRUE);
        } else {
            map.put(FIELD_NAMES, ImmutableList.copyOf(fieldNames));
        }
        return map;
    }

    @CheckForNull
    @SuppressWarnings("unchecked")
    static IndexSpec fromStore(@CheckForNull Object value) {
        if (!(value instanceof Map)) {
            return null;
        }
        Map<String, Object> map = (Map<String, Object>) value;
        if (Boolean.TRUE.equals(map.get(BY_VALUE))) {
            return BY_VALUE_SPEC;
        }
        Object names = map.get(FIELD_NAMES);
        if (names instanceof List && !((List<?>) names).isEmpty()) {
            ImmutableSet.Builder<String> builder = ImmutableSet.builder();
            Iterator<?> it = ((List<?>) names).iterator();
            while (it.hasNext()) {
                builder.add(String.valueOf(it.next()));
            }
            return new IndexSpec(builder.build(), false);
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o instanceof IndexSpec) {
            IndexSpec other = (IndexSpec) o;
            return byValue == other.byValue && fieldNames.equals(other.fieldNames);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return fieldNames.hashCode() * 31 + (byValue ? 1 : 0);
    }

    @Override
    public String toString() {
        return byValue ? VALUE_SENTINEL : fieldNames.toString();
    }
}
