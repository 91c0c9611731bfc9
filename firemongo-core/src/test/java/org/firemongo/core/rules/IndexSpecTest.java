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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;

import org.firemongo.api.InvalidIndexException;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class IndexSpecTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    public void accepted() throws Exception {
        IndexSpec spec = parse("{\"fieldNames\": [\"height\", \"dimensions/length\"]}");
        assertFalse(spec.isByValue());
        assertEquals(Arrays.asList("height", "dimensions/length"),
                Arrays.asList(spec.getFieldNames().toArray()));
        assertTrue(spec.covers("dimensions/length"));
        assertFalse(spec.covers("weight"));
        assertFalse(spec.covers("$value"));

        assertEquals(IndexSpec.byValue(), parse("{\"byValue\": true}"));
        assertEquals(IndexSpec.byValue(), parse("{\".indexOn\": \".value\"}"));
        assertTrue(IndexSpec.byValue().covers("$value"));
        assertEquals(IndexSpec.onFields(Arrays.asList("height")), parse("{\".indexOn\": \"height\"}"));
        assertEquals(IndexSpec.onFields(Arrays.asList("a", "b")), parse("{\".indexOn\": [\"a\", \"b\"]}"));
    }

    @Test
    public void firebaseForm() throws Exception {
        assertEquals(MAPPER.readTree("{\".indexOn\": [\"height\"]}"),
                parse("{\"fieldNames\": [\"height\"]}").toJson());
        assertEquals(MAPPER.readTree("{\".indexOn\": \".value\"}"), IndexSpec.byValue().toJson());
    }

    @Test
    public void storeForm() throws Exception {
        IndexSpec spec = parse("{\".indexOn\": [\"a\", \"b/c\"]}");
        assertEquals(spec, IndexSpec.fromStore(spec.toStore()));
        assertEquals(IndexSpec.byValue(), IndexSpec.fromStore(IndexSpec.byValue().toStore()));
        assertNull(IndexSpec.fromStore("garbage"));
    }

    @Test
    public void rejected() {
        assertRejected(1, null);
        assertRejected(1, "[\"height\"]");
        assertRejected(1, "{}");
        assertRejected(1, "{\"fieldNames\": [\"a\"], \"byValue\": true}");
        assertRejected(1, "{\"index\": \"a\"}");
        assertRejected(2, "{\"fieldNames\": \"a\"}");
        assertRejected(2, "{\".indexOn\": 3}");
        assertRejected(3, "{\"byValue\": false}");
        assertRejected(4, "{\"fieldNames\": []}");
        assertRejected(5, "{\".indexOn\": [1]}");
        assertRejected(6, "{\".indexOn\": [\"a\", \".value\"]}");
        assertRejected(7, "{\"fieldNames\": [\"a.b\"]}");
        assertRejected(7, "{\"fieldNames\": [\"a//b\"]}");
    }

    private static IndexSpec parse(String json) throws Exception {
        return IndexSpec.fromJson(MAPPER.readTree(json));
    }

    private static void assertRejected(int code, String json) {
        try {
            JsonNode body = json == null ? null : MAPPER.readTree(json);
            IndexSpec.fromJson(body);
            fail("expected InvalidIndexException for " + json);
        } catch (InvalidIndexException e) {
            assertEquals(json, code, e.getCode());
        } catch (Exception e) {
            fail(e.toString());
        }
    }
}
