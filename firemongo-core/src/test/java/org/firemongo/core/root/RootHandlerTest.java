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
package org.firemongo.core.root;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.Arrays;
import java.util.Map;

import org.firemongo.api.InvalidDataException;
import org.firemongo.api.RootConflictException;
import org.firemongo.core.mapper.DocumentMapper;
import org.firemongo.core.mapper.StoredDocument;
import org.firemongo.core.mapper.WriteMode;
import org.firemongo.core.path.PathResolver;
import org.firemongo.store.DocumentStore;
import org.firemongo.store.MemoryDocumentStore;
import org.firemongo.store.WriteBatch;
import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

public class RootHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private DocumentStore store;

    private RootHandler roots;

    @Before
    public void setUp() {
        store = new MemoryDocumentStore();
        roots = new RootHandler(store, new DocumentMapper(store));
    }

    @Test
    public void forms() throws Exception {
        assertEquals(CollectionForm.ABSENT, roots.getForm("c"));
        store.createCollection("c");
        assertEquals(CollectionForm.EMPTY, roots.getForm("c"));
        writeCollection("c", "42", WriteMode.REPLACE, false);
        assertEquals(CollectionForm.SCALAR, roots.getForm("c"));
        writeCollection("c", "{\"a\": 1}", WriteMode.REPLACE, false);
        assertEquals(CollectionForm.KEYED, roots.getForm("c"));
    }

    @Test
    public void scalarOverDocumentsNeedsPromotion() throws Exception {
        writeCollection("c", "{\"a\": 1, \"b\": 2}", WriteMode.REPLACE, false);
        try {
            writeCollection("c", "[1, 2]", WriteMode.REPLACE, false);
            fail("expected RootConflictException");
        } catch (RootConflictException e) {
            assertEquals(1, e.getCode());
        }
        assertEquals(json("{\"a\": 1, \"b\": 2}"), roots.readCollection("c"));

        writeCollection("c", "[1, 2]", WriteMode.REPLACE, true);
        assertEquals(json("[1, 2]"), roots.readCollection("c"));
        assertEquals(1, store.count("c"));
        Map<String, Object> doc = store.find("c", StoredDocument.ROOT_KEY);
        assertTrue(roots.isRootForm(doc));
        assertEquals(json("[1, 2]"), roots.unwrapRoot(doc));
    }

    @Test
    public void objectReplacesRootValue() throws Exception {
        writeCollection("c", "\"text\"", WriteMode.REPLACE, false);
        writeCollection("c", "{\"a\": 1}", WriteMode.MERGE_PATCH, false);
        assertEquals(json("{\"a\": 1}"), roots.readCollection("c"));
        assertNull(store.find("c", StoredDocument.ROOT_KEY));
    }

    @Test
    public void replaceAndMerge() throws Exception {
        writeCollection("c", "{\"a\": 1, \"b\": {\"x\": 1}}", WriteMode.REPLACE, false);
        writeCollection("c", "{\"b/y\": 2, \"c\": 3, \"a\": null}", WriteMode.MERGE_PATCH, false);
        assertEquals(json("{\"b\": {\"x\": 1, \"y\": 2}, \"c\": 3}"), roots.readCollection("c"));

        writeCollection("c", "{\"d\": 4}", WriteMode.REPLACE, false);
        assertEquals(json("{\"d\": 4}"), roots.readCollection("c"));

        writeCollection("c", "{}", WriteMode.REPLACE, false);
        assertEquals(json("{}"), roots.readCollection("c"));
        assertTrue(store.hasCollection("c"));
    }

    @Test
    public void rootDocumentIdIsReserved() throws Exception {
        try {
            writeCollection("c", "{\"__fm_root__\": 1}", WriteMode.REPLACE, false);
            fail("expected InvalidDataException");
        } catch (InvalidDataException e) {
            assertEquals(5, e.getCode());
        }
    }

    @Test
    public void databaseRoot() throws Exception {
        writeCollection("users", "{\"alice\": 1}", WriteMode.REPLACE, false);
        store.createCollection(PathResolver.RULES_COLLECTION);

        writeDatabase("{\"a\": {\"x\": 1}, \"b\": 2}", WriteMode.REPLACE);
        assertFalse(store.hasCollection("users"));
        assertTrue(store.hasCollection(PathResolver.RULES_COLLECTION));
        assertEquals(json("{\"a\": {\"x\": 1}, \"b\": 2}"), roots.readDatabase());
        assertTrue(roots.isRootFallback("a"));
        assertTrue(roots.hasRootValue("a"));
        assertFalse(roots.hasRootValue("z"));
        assertEquals(json("{\"x\": 1}"), roots.readCollection("a"));
        assertNull(roots.readCollection("z"));

        writeDatabase("{\"c\": 3, \"a/y\": 2}", WriteMode.MERGE_PATCH);
        assertEquals(json("{\"a\": {\"x\": 1, \"y\": 2}, \"b\": 2, \"c\": 3}"), roots.readDatabase());

        writeDatabase("{\"d\": 4}", WriteMode.REPLACE);
        assertEquals(json("{\"d\": 4}"), roots.readDatabase());
    }

    @Test
    public void databaseRootRejects() throws Exception {
        try {
            writeDatabase("[1]", WriteMode.REPLACE);
            fail("expected InvalidDataException");
        } catch (InvalidDataException e) {
            assertEquals(4, e.getCode());
        }
        try {
            writeDatabase("{\"__fm_rules__\": {}}", WriteMode.MERGE_PATCH);
            fail("expected InvalidDataException");
        } catch (InvalidDataException e) {
            assertEquals(5, e.getCode());
        }
    }

    @Test
    public void newCollectionDropsRootValues() throws Exception {
        writeDatabase("{\"a\": 1}", WriteMode.REPLACE);
        writeCollection("users", "{\"alice\": true}", WriteMode.REPLACE, false);
        assertFalse(store.hasCollection(PathResolver.ROOT_COLLECTION));
        assertEquals(json("{\"users\": {\"alice\": true}}"), roots.readDatabase());

        writeDatabase("{\"a\": 1}", WriteMode.REPLACE);
        WriteBatch batch = new WriteBatch();
        roots.ensureDataCollection("users", batch);
        store.apply(batch);
        assertFalse(store.hasCollection(PathResolver.ROOT_COLLECTION));
    }

    @Test
    public void deletes() throws Exception {
        assertNull(roots.readDatabase());
        writeCollection("a", "{\"x\": 1}", WriteMode.REPLACE, false);
        writeCollection("b", "{}", WriteMode.REPLACE, false);
        assertEquals(json("{\"a\": {\"x\": 1}, \"b\": {}}"), roots.readDatabase());

        WriteBatch batch = new WriteBatch();
        roots.deleteCollection("a", batch);
        store.apply(batch);
        assertNull(roots.readCollection("a"));

        store.createCollection(PathResolver.RULES_COLLECTION);
        batch = new WriteBatch();
        roots.deleteDatabase(batch);
        store.apply(batch);
        assertNull(roots.readDatabase());
        assertTrue(store.hasCollection(PathResolver.RULES_COLLECTION));
    }

    @Test
    public void deleteInRootValue() throws Exception {
        writeCollection("settings", "[\"a\", {\"x\": 1, \"y\": 2}]", WriteMode.REPLACE, false);

        WriteBatch batch = new WriteBatch();
        roots.deleteInRootValue("settings", Arrays.asList("1", "x"), batch);
        store.apply(batch);
        assertEquals(json("[\"a\", {\"y\": 2}]"), roots.readCollection("settings"));

        batch = new WriteBatch();
        roots.deleteInRootValue("settings", Arrays.asList("1"), batch);
        store.apply(batch);
        assertEquals(json("[\"a\"]"), roots.readCollection("settings"));

        batch = new WriteBatch();
        roots.deleteInRootValue("settings", Arrays.asList("0"), batch);
        store.apply(batch);
        assertEquals(json("{}"), roots.readCollection("settings"));
        assertEquals(CollectionForm.EMPTY, roots.getForm("settings"));

        // nothing to delete
        batch = new WriteBatch();
        roots.deleteInRootValue("settings", Arrays.asList("0"), batch);
        assertTrue(batch.isEmpty());
    }

    private void writeCollection(String collection, String value, WriteMode mode, boolean promote)
            throws Exception {
        WriteBatch batch = new WriteBatch();
        roots.writeAtCollectionRoot(collection, json(value), mode, promote, batch);
        store.apply(batch);
    }

    private void writeDatabase(String value, WriteMode mode) throws Exception {
        WriteBatch batch = new WriteBatch();
        roots.writeAtDatabaseRoot(json(value), mode, batch);
        store.apply(batch);
    }

    private static JsonNode json(String json) throws Exception {
        return MAPPER.readTree(json);
    }
}
