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

import java.util.Comparator;

/**
 * Orders keys the way Firebase does: keys that parse as a 32-bit integer
 * come first, in numeric order, followed by all other keys in Unicode code
 * point order.
 */
public final class KeyOrdering implements Comparator<String> {

    public static final KeyOrdering INSTANCE = new KeyOrdering();

    private KeyOrdering() {
    }

    @Override
    public int compare(String a, String b) {
        Integer ia = asInteger(a);
        Integer ib = asInteger(b);
        if (ia != null && ib != null) {
            return ia.compareTo(ib);
        } else if (ia != null) {
            return -1;
        } else if (ib != null) {
            return 1;
        }
        return compareCodePoints(a, b);
    }

    /**
     * Compare two strings by Unicode code point (unlike
     * {@link String#compareTo(String)}, which compares UTF-16 units).
     */
    public static int compareCodePoints(String a, String b) {
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
        if (i < a.length()) {
            return 1;
        } else if (j < b.length()) {
            return -1;
        }
        return 0;
    }

    /**
     * @return the value of a key in canonical 32-bit integer form, or null
     */
    static Integer asInteger(String key) {
        int len = key.length();
        if (len == 0 || len > 11) {
            return null;
        }
        int start = key.charAt(0) == '-' ? 1 : 0;
        if (start == len) {
            return null;
        }
        for (int i = start; i < len; i++) {
            char c = key.charAt(i);
            if (c < '0' || c > '9') {
                return null;
            }
        }
        if (key.charAt(start) == '0' && (len - start > 1 || start == 1)) {
            // leading zeros and "-0" are not canonical
            return null;
        }
        long v = Long.parseLong(key);
        if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
            return null;
        }
        return (int) v;
    }
}
