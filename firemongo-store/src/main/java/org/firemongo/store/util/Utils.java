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
package org.firemongo.store.util;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeMap;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.store.UpdateOp;

/**
 * Utility methods.
 */
public class Utils {

    private Utils() {
    }

    /**
     * @return a new map for top-level document fields (ordered by field name)
     */
    public static <K, V> Map<K, V> newMap() {
        return new TreeMap<K, V>();
    }

    /**
     * Deep copy a stored value. Maps keep their iteration order, lists are
     * copied element by element, everything else is treated as immutable.
     */
    @SuppressWarnings("unchecked")
    public static Object deepCopy(Object value) {
        if (value instanceof Map) {
            Map<String, Object> copy = new LinkedHashMap<String, Object>();
            deepCopyMap((Map<String, Object>) value, copy);
            return copy;
        } else if (value instanceof List) {
            List<Object> source = (List<Object>) value;
            List<Object> copy = new ArrayList<Object>(source.size());
            for (Object o : source) {
                copy.add(deepCopy(o));
            }
            return copy;
        }
        return value;
    }

    public static void deepCopyMap(Map<String, Object> source, Map<String, Object> target) {
        for (Entry<String, Object> e : source.entrySet()) {
            target.put(e.getKey(), deepCopy(e.getValue()));
        }
    }

    /**
     * Copy a document (the top-level fields sorted by name).
     */
    public static Map<String, Object> copyDocument(Map<String, Object> source) {
        Map<String, Object> copy = newMap();
        deepCopyMap(source, copy);
        return copy;
    }

    /**
     * Check whether a document matches the conditions of an update.
     *
     * @param doc the document, or null if it does not exist
     * @param update the update
     * @return whether all conditions match
     */
    public static boolean checkConditions(@CheckForNull Map<String, Object> doc,
                                          @Nonnull UpdateOp update) {
        for (Entry<String, Object> c : update.getConditions().entrySet()) {
            Object actual = doc == null ? null : doc.get(c.getKey());
            Object expected = c.getValue();
            if (actual instanceof Number && expected instanceof Number) {
                if (compareValues(actual, expected) != 0) {
                    return false;
                }
            } else if (actual == null ? expected != null : !actual.equals(expected)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Get the value of a dotted property, descending through maps only.
     *
     * @param doc the document
     * @param property the property, for example {@code _fm_val.height}
     * @return the value, or null
     */
    @CheckForNull
    @SuppressWarnings("unchecked")
    public static Object getProperty(@Nonnull Map<String, Object> doc, @Nonnull String property) {
        Object v = doc;
        for (String name : property.split("\\.")) {
            if (!(v instanceof Map)) {
                return null;
            }
            v = ((Map<String, Object>) v).get(name);
        }
        return v;
    }

    /**
     * Compare two stored values the way MongoDB sorts them: null, numbers,
     * strings, maps, lists, booleans. Numbers compare by value, strings by
     * code point.
     */
    public static int compareValues(@CheckForNull Object a, @CheckForNull Object b) {
        int ra = typeOrder(a);
        int rb = typeOrder(b);
        if (ra != rb) {
            return ra < rb ? -1 : 1;
        }
        if (a instanceof Number) {
            if ((a instanceof Long || a instanceof Integer) && (b instanceof Long || b instanceof Integer)) {
                return Long.compare(((Number) a).longValue(), ((Number) b).longValue());
            }
            return Double.compare(((Number) a).doubleValue(), ((Number) b).doubleValue());
        } else if (a instanceof String) {
            return compareCodePoints((String) a, (String) b);
        } else if (a instanceof Boolean) {
            return Boolean.compare((Boolean) a, (Boolean) b);
        }
        return 0;
    }

    /**
     * @return whether both values are of the same kind, so that a range
     *         filter on one matches the other
     */
    public static boolean isSameType(@CheckForNull Object a, @CheckForNull Object b) {
        return typeOrder(a) == typeOrder(b);
    }

    private static int typeOrder(Object o) {
        if (o == null) {
            return 0;
        } else if (o instanceof Number) {
            return 1;
        } else if (o instanceof String) {
            return 2;
        } else if (o instanceof Map) {
            return 3;
        } else if (o instanceof List) {
            return 4;
        } else if (o instanceof Boolean) {
            return 5;
        }
        return 6;
    }

    private static int compareCodePoints(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return ca < cb ? -1 : 1;
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }

}
