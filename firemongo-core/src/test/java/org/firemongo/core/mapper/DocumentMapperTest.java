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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.firemongo.api.InvalidDataException;
import org.firemongo.store.DocumentStore;
import org.firemongo.store.DocumentStoreException;
import org.firemongo.store.MemoryDocumentStore;
import org.firemongo.store.WriteBatch;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class DocumentMapperTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final List<String> NONE = Collections.emptyList();

    private DocumentStore store;

    private DocumentMapper mapper;

    @Before
    public void setUp() {
        store = new MemoryDocumentStore();
        mapper = new DocumentMapper(store);
    }

    @Test
    public void replaceDocument() throws Exception {
        write("t-rex", NONE, "{\"height\": 6, \"tags\": [\"big\", \"old\"]}", WriteMode.REPLACE);
        assertEquals(json("{\"height\": 6, \"tags\": [\"big\", \"old\"]}"), read("t-rex"));
        assertEquals(json("\"old\""), read("t-rex", "tags", "1"));

        write("t-rex", NONE, "{\"length\": 12}", WriteMode.REPLACE);
        assertEquals(json("{\"length\": 12}"), read("t-rex"));
        assertEquals("t-rex", store.find("dinosaurs", "t-rex").get(StoredDocument.FM_ID));
    }

    @Test
    public void nestedReplace() throws Exception {
        write("t-rex", keys("dimensions", "height"), "6", WriteMode.REPLACE);
        assertEquals(json("{\"dimensions\": {\"height\": 6}}"), read("t-rex"));
        assertNull(read("t-rex", "dimensions", "height", "meters"));
        assertNull(read("t-rex", "missing", "x"));
        assertNull(read("unknown"));
    }

    @Test
    public void scalarOnTheWayIsReplaced() throws Exception {
        write("t-rex", keys("a"), "\"scalar\"", WriteMode.REPLACE);
        write("t-rex", keys("a", "b"), "true", WriteMode.REPLACE);
        assertEquals(json("{\"a\": {\"b\": true}}"), read("t-rex"));
    }

    @Test
    public void mergePatch() throws Exception {
        write("t-rex", NONE, "{\"a\": 1, \"b\": {\"c\": 2, \"d\": 3}}", WriteMode.REPLACE);
        write("t-rex", NONE, "{\"a\": 5, \"b/c\": 4, \"e\": \"x\"}", WriteMode.MERGE_PATCH);
        assertEquals(json("{\"a\": 5, \"b\": {\"c\": 4, \"d\": 3}, \"e\": \"x\"}"), read("t-rex"));

        // a member replaces the child, no deep merge
        write("t-rex", NONE, "{\"b\": {\"z\": 0}}", WriteMode.MERGE_PATCH);
        assertEquals(json("{\"z\": 0}"), read("t-rex", "b"));

        write("t-rex", NONE, "{\"b\": null, \"e\": null}", WriteMode.MERGE_PATCH);
        assertEquals(json("{\"a\": 5}"), read("t-rex"));

        // a value that is not an object replaces
        write("t-rex", keys("a"), "[1, 2]", WriteMode.MERGE_PATCH);
        assertEquals(json("[1, 2]"), read("t-rex", "a"));
    }

    @Test
    public void mergeIsIdempotent() throws Exception {
        write("t-rex", NONE, "{\"a\": 1}", WriteMode.REPLACE);
        String patch = "{\"b\": {\"c\": 2}, \"d/e\": 3}";
        write("t-rex", NONE, patch, WriteMode.MERGE_PATCH);
        JsonNode once = read("t-rex");
        write("t-rex", NONE, patch, WriteMode.MERGE_PATCH);
        assertEquals(once, read("t-rex"));
    }

    @Test
    public void deletePrunesEmptyObjects() throws Exception {
        write("t-rex", keys("a", "b", "c"), "1", WriteMode.REPLACE);
        write("t-rex", keys("x"), "2", WriteMode.REPLACE);
        delete("t-rex", "a", "b", "c");
        assertEquals(json("{\"x\": 2}"), read("t-rex"));

        // absent path
        delete("t-rex", "a", "b");
        delete("t-rex", "x", "y");
        assertEquals(json("{\"x\": 2}"), read("t-rex"));

        delete("t-rex", "x");
        assertNull(store.find("dinosaurs", "t-rex"));
        assertTrue(store.hasCollection("dinosaurs"));
    }

    @Test
    public void emptyValueRemovesDocument() throws Exception {
        write("t-rex", NONE, "{\"a\": 1}", WriteMode.REPLACE);
        write("t-rex", NONE, "{}", WriteMode.REPLACE);
        assertNull(store.find("dinosaurs", "t-rex"));

        write("t-rex", NONE, "{\"a\": {}, \"b\": null}", WriteMode.REPLACE);
        assertNull(store.find("dinosaurs", "t-rex"));
    }

    @Test
    public void arrays() throws Exception {
        write("t-rex", keys("list"), "[\"a\", \"b\", \"c\"]", WriteMode.REPLACE);
        write("t-rex", keys("list", "1"), "\"B\"", WriteMode.REPLACE);
        assertEquals(json("[\"a\", \"B\", \"c\"]"), read("t-rex", "list"));

        delete("t-rex", "list", "2");
        assertEquals(json("[\"a\", \"B\"]"), read("t-rex", "list"));

        // removing an element in the middle turns the list into an object
        delete("t-rex", "list", "0");
        assertEquals(json("{\"1\": \"B\"}"), read("t-rex", "list"));

        write("t-rex", keys("other"), "[1]", WriteMode.REPLACE);
        write("t-rex", keys("other", "name"), "2", WriteMode.REPLACE);
        assertEquals(json("{\"0\": 1, \"name\": 2}"), read("t-rex", "other"));
    }

    @Test
    public void invalidKeys() throws Exception {
        try {
            write("t-rex", NONE, "{\"a.b\": 1}", WriteMode.REPLACE);
            fail("expected InvalidDataException");
        } catch (InvalidDataException e) {
            assertEquals(2, e.getCode());
        }
        try {
            write("t-rex", NONE, "{\"a//b\": 1}", WriteMode.MERGE_PATCH);
            fail("expected InvalidDataException");
        } catch (InvalidDataException e) {
            assertEquals(3, e.getCode());
        }
        assertEquals(Arrays.asList("a", "b"), DocumentMapper.splitMergeKey("/a/b"));
    }

    @Test
    public void changesAreApplied() throws Exception {
        WriteBatch batch = new WriteBatch();
        mapper.update("dinosaurs", "t-rex", Arrays.asList(
                new DocumentMapper.Change(keys("a"), 1L),
                new DocumentMapper.Change(keys("b", "c"), 2L),
                new DocumentMapper.Change(keys("a"), null)), batch);
        assertEquals(1, batch.size());
        store.apply(batch);
        assertEquals(json("{\"b\": {\"c\": 2}}"), read("t-rex"));
    }

    @Test
    public void everyWriteCountsModifications() throws Exception {
        write("t-rex", NONE, "{\"a\": 1}", WriteMode.REPLACE);
        assertEquals(1L, store.find("dinosaurs", "t-rex").get(StoredDocument.MOD_COUNT));
        write("t-rex", keys("b"), "2", WriteMode.REPLACE);
        assertEquals(2L, store.find("dinosaurs", "t-rex").get(StoredDocument.MOD_COUNT));
    }

    @Test
    public void concurrentChangeIsDetected() throws Exception {
        write("t-rex", NONE, "{\"a\": 1}", WriteMode.REPLACE);
        WriteBatch batch = new WriteBatch();
        mapper.write("dinosaurs", "t-rex", keys("b"), json("2"), WriteMode.REPLACE, batch);

        // another writer changes the document after it was read
        write("t-rex", keys("c"), "3", WriteMode.REPLACE);
        try {
            store.apply(batch);
            fail("expected DocumentStoreException");
        } catch (DocumentStoreException e) {
            assertTrue(e.isConflict());
        }
        assertEquals(json("{\"a\": 1, \"c\": 3}"), read("t-rex"));
    }

    @Test
    public void concurrentCreateIsDetected() throws Exception {
        WriteBatch batch = new WriteBatch();
        mapper.write("dinosaurs", "t-rex", keys("a"), json("1"), WriteMode.REPLACE, batch);
        write("t-rex", keys("b"), "2", WriteMode.REPLACE);
        try {
            store.apply(batch);
            fail("expected DocumentStoreException");
        } catch (DocumentStoreException e) {
            assertTrue(e.isConflict());
        }
    }

    @Test
    public void removeAt() throws Exception {
        Object value = JsonConversion.toStore(json("{\"a\": {\"b\": 1}, \"c\": [1, 2, 3]}"));
        value = DocumentMapper.removeAt(value, keys("c", "2"));
        assertEquals(json("{\"a\": {\"b\": 1}, \"c\": [1, 2]}"), JsonConversion.toJson(value));
        value = DocumentMapper.removeAt(value, keys("a", "b"));
        assertEquals(json("{\"c\": [1, 2]}"), JsonConversion.toJson(value));
        value = DocumentMapper.removeAt(value, keys("x", "y"));
        assertEquals(json("{\"c\": [1, 2]}"), JsonConversion.toJson(value));
        assertNull(DocumentMapper.removeAt(value, keys("c")));
    }

    private void write(String id, List<String> nested, String value, WriteMode mode) throws Exception {
        WriteBatch batch = new WriteBatch();
        mapper.write("dinosaurs", id, nested, json(value), mode, batch);
        store.apply(batch);
    }

    private void delete(String id, String... nested) {
        WriteBatch batch = new WriteBatch();
        mapper.delete("dinosaurs", id, keys(nested), batch);
        store.apply(batch);
    }

    private JsonNode read(String id, String... nested) {
        return mapper.read("dinosaurs", id, keys(nested));
    }

    private static List<String> keys(String... keys) {
        return Arrays.asList(keys);
    }

    private static JsonNode json(String json) throws Exception {
        return MAPPER.readTree(json);
    }
}
