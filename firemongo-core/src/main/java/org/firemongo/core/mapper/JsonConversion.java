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
package org.firemongo.core.mapper;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.InvalidDataException;
import org.firemongo.core.path.PathResolver;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Converts between Jackson trees and the values kept in the document store:
 * objects become ordered maps, arrays lists, integral numbers that fit
 * become longs and all other numbers doubles.
 * <p>
 * In a JSON tree an absent child and a {@code null} or empty child are the
 * same, so object members that are {@code null} or empty objects are not
 * stored.
 */
public final class JsonConversion {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private JsonConversion() {
    }

    /**
     * Convert a value to store form.
     *
     * @param node the value
     * @return the store form, null for a JSON null
     */
    @CheckForNull
    public static Object toStore(@CheckForNull JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        } else if (node.isObject()) {
            Map<String, Object> map = new LinkedHashMap<String, Object>();
            Iterator<Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Entry<String, JsonNode> e = it.next();
                Object v = toStore(e.getValue());
                if (!isEmpty(v)) {
                    map.put(e.getKey(), v);
                }
            }
            return map;
        } else if (node.isArray()) {
            List<Object> list = new ArrayList<Object>(node.size());
            for (JsonNode n : node) {
                list.add(toStore(n));
            }
            return list;
        } else if (node.isIntegralNumber() && node.canConvertToLong()) {
            return node.longValue();
        } else if (node.isNumber()) {
            return node.doubleValue();
        } else if (node.isBoolean()) {
            return node.booleanValue();
        }
        return node.asText();
    }

    /**
     * Convert a value from store form.
     *
     * @param value the store form, or null
     * @return the value, {@code NullNode} for null
     */
    @Nonnull
    @SuppressWarnings("unchecked")
    public static JsonNode toJson(@CheckForNull Object value) {
        if (value == null) {
            return FACTORY.nullNode();
        } else if (value instanceof Map) {
            ObjectNode obj = FACTORY.objectNode();
            for (Entry<String, Object> e : ((Map<String, Object>) value).entrySet()) {
                obj.set(e.getKey(), toJson(e.getValue()));
            }
            return obj;
        } else if (value instanceof List) {
            ArrayNode array = FACTORY.arrayNode();
            for (Object o : (List<Object>) value) {
                array.add(toJson(o));
            }
            return array;
        } else if (value instanceof Long || value instanceof Integer) {
            long l = ((Number) value).longValue();
            if (l >= Integer.MIN_VALUE && l <= Integer.MAX_VALUE) {
                return FACTORY.numberNode((int) l);
            }
            return FACTORY.numberNode(l);
        } else if (value instanceof Number) {
            return FACTORY.numberNode(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            return FACTORY.booleanNode((Boolean) value);
        }
        return FACTORY.textNode(value.toString());
    }

    /**
     * @return whether the store value is absent in a JSON tree: null or an
     *         empty map
     */
    public static boolean isEmpty(@CheckForNull Object storeValue) {
        return storeValue == null
                || (storeValue instanceof Map && ((Map<?, ?>) storeValue).isEmpty());
    }

    /**
     * Check that all member names of all objects inside the value are valid
     * keys.
     *
     * @param node the value
     * @throws InvalidDataException for the first invalid name
     */
    public static void validateKeys(@CheckForNull JsonNode node) throws InvalidDataException {
        if (node == null) {
            return;
        }
        if (node.isObject()) {
            Iterator<Entry<String, JsonNode>> it = node.fields();
            while (it.hasNext()) {
                Entry<String, JsonNode> e = it.next();
                if (!PathResolver.isValidKey(e.getKey())) {
                    throw new InvalidDataException(2, "Invalid key '" + e.getKey()
                            + "': keys must not be empty or contain '/', '.', '$', '#', '[' or ']'");
                }
                validateKeys(e.getValue());
            }
        } else if (node.isArray()) {
            for (JsonNode n : node) {
                validateKeys(n);
            }
        }
    }
}
