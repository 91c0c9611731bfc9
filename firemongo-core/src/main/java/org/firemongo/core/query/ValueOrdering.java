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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A total order over JSON values of mixed kinds: null (or missing) comes
 * first, then false, true, numbers in numeric order, strings in code point
 * order, and finally objects and arrays, which are all equal to each other.
 * A Java {@code null} is treated as a missing value.
 */
public final class ValueOrdering implements Comparator<JsonNode> {

    public static final ValueOrdering INSTANCE = new ValueOrdering();

    private ValueOrdering() {
    }

    @Override
    public int compare(JsonNode a, JsonNode b) {
        int ra = rank(a);
        int rb = rank(b);
        if (ra != rb) {
            return ra < rb ? -1 : 1;
        }
        switch (ra) {
            case 3:
                return compareNumbers(a, b);
            case 4:
                return KeyOrdering.compareCodePoints(a.textValue(), b.textValue());
            default:
                return 0;
        }
    }

    /**
     * Integers and finite doubles are compared exactly; infinity and NaN
     * have no decimal form.
     */
    private static int compareNumbers(JsonNode a, JsonNode b) {
        if (a.isIntegralNumber() && b.isIntegralNumber()) {
            return a.bigIntegerValue().compareTo(b.bigIntegerValue());
        }
        if (!isFinite(a) || !isFinite(b)) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        return a.decimalValue().compareTo(b.decimalValue());
    }

    private static boolean isFinite(JsonNode n) {
        if (!n.isFloatingPointNumber() || n.isBigDecimal()) {
            return true;
        }
        double d = n.doubleValue();
        return !Double.isInfinite(d) && !Double.isNaN(d);
    }

    static int rank(JsonNode n) {
        if (n == null || n.isNull() || n.isMissingNode()) {
            return 0;
        } else if (n.isBoolean()) {
            return n.booleanValue() ? 2 : 1;
        } else if (n.isNumber()) {
            return 3;
        } else if (n.isTextual()) {
            return 4;
        }
        return 5;
    }
}
