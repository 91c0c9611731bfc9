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
package org.firemongo.store;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

public class MemoryDocumentStoreTest {

    private DocumentStore store;

    @Before
    public void setUp() {
        store = new MemoryDocumentStore();
    }

    @Test
    public void addGetAndRemove() {
        store.createOrUpdate("users", new UpdateOp("alice", true)
                .set("name", "Alice")
                .set("age", 30L));
        Map<String, Object> doc = store.find("users", "alice");
        assertNotNull(doc);
        assertEquals("alice", doc.get(UpdateOp.ID));
        assertEquals("Alice", doc.get("name"));
        assertEquals(30L, doc.get("age"));

        store.remove("users", "alice");
        assertNull(store.find("users", "alice"));
        assertTrue(store.hasCollection("users"));
    }

    @Test
    public void createOrUpdateReturnsOldDocument() {
        assertNull(store.createOrUpdate("c", new UpdateOp("k", true).set("a", 1L)));
        Map<String, Object> old = store.createOrUpdate("c", new UpdateOp("k", true)
                .set("a", 2L).unset("b"));
        assertNotNull(old);
        assertEquals(1L, old.get("a"));
        assertEquals(2L, store.find("c", "k").get("a"));
    }

    @Test
    public void updateMissingDocumentFails() {
        try {
            store.createOrUpdate("c", new UpdateOp("missing", false).set("a", 1L));
            fail("expected DocumentStoreException");
        } catch (DocumentStoreException e) {
            assertFalse(e.isTransient());
        }
        assertFalse(store.hasCollection("c"));
    }

    @Test
    public void returnedDocumentsAreCopies() {
        Map<String, Object> nested = new LinkedHashMap<String, Object>();
        nested.put("x", 1L);
        store.createOrUpdate("c", new UpdateOp("k", true).set("v", nested));
        nested.put("y", 2L);

        @SuppressWarnings("unchecked")
        Map<String, Object> v = (Map<String, Object>) store.find("c", "k").get("v");
        assertEquals(1, v.size());
        v.put("z", 3L);
        assertEquals(1, ((Map<?, ?>) store.find("c", "k").get("v")).size());
    }

    @Test
    public void queryIsOrderedByKey() {
        for (String key : new String[] {"d", "a", "c", "b", "e"}) {
            store.createOrUpdate("c", new UpdateOp(key, true).set("v", key));
        }
        assertEquals(keys("a", "b", "c", "d", "e"), keysOf(store.query("c", null, null, 100)));
        assertEquals(keys("b", "c"), keysOf(store.query("c", "b", "d", 100)));
        assertEquals(keys("a", "b"), keysOf(store.query("c", null, null, 2)));
        assertTrue(store.query("unknown", null, null, 10).isEmpty());
    }

    @Test
    public void queryByProperty() {
        store.createOrUpdate("c", new UpdateOp("a", true).set("v", 3L));
        store.createOrUpdate("c", new UpdateOp("b", true).set("v", 1L));
        store.createOrUpdate("c", new UpdateOp("c", true).set("v", 2.5));
        store.createOrUpdate("c", new UpdateOp("d", true).set("v", "text"));
        store.createOrUpdate("c", new UpdateOp("e", true).set("v", 1L));
        store.createOrUpdate("c", new UpdateOp("f", true).set("other", 1L));

        // all documents that have the property, numbers before strings, ties by key
        assertEquals(keys("b", "e", "c", "a", "d"),
                keysOf(store.query("c", "v", null, null, false, Integer.MAX_VALUE)));
        // a bound only matches values of its own kind
        assertEquals(keys("c", "a"), keysOf(store.query("c", "v", 2L, null, false, 10)));
        assertEquals(keys("a", "c"), keysOf(store.query("c", "v", 2L, 10L, true, 10)));
        assertEquals(keys("b", "e"), keysOf(store.query("c", "v", 1L, 1L, false, 10)));
        assertEquals(keys("d"), keysOf(store.query("c", "v", "a", "z", false, 10)));
        assertEquals(keys("b"), keysOf(store.query("c", "v", 0L, 5L, false, 1)));
        assertTrue(store.query("c", "v", null, null, false, 0).isEmpty());
        assertTrue(store.query("unknown", "v", null, null, false, 10).isEmpty());
    }

    @Test
    public void queryByNestedProperty() {
        Map<String, Object> nested = new LinkedHashMap<String, Object>();
        nested.put("height", 4L);
        store.createOrUpdate("c", new UpdateOp("x", true).set("v", nested));
        store.createOrUpdate("c", new UpdateOp("y", true).set("v", 4L));
        assertEquals(keys("x"), keysOf(store.query("c", "v.height", null, null, false, 10)));
    }

    @Test
    public void conditionalUpdate() {
        store.createOrUpdate("c", new UpdateOp("k", true)
                .set("v", 1L).increment("_modCount", 1).equals("_modCount", null));
        assertEquals(1L, store.find("c", "k").get("_modCount"));

        store.createOrUpdate("c", new UpdateOp("k", true)
                .set("v", 2L).increment("_modCount", 1).equals("_modCount", 1L));
        assertEquals(2L, store.find("c", "k").get("_modCount"));
        assertEquals(2L, store.find("c", "k").get("v"));

        try {
            store.createOrUpdate("c", new UpdateOp("k", true)
                    .set("v", 3L).equals("_modCount", 1L));
            fail("expected DocumentStoreException");
        } catch (DocumentStoreException e) {
            assertTrue(e.isConflict());
        }
        try {
            store.createOrUpdate("c", new UpdateOp("k", true)
                    .set("v", 3L).equals("_modCount", null));
            fail("expected DocumentStoreException");
        } catch (DocumentStoreException e) {
            assertTrue(e.isConflict());
        }
        assertEquals(2L, store.find("c", "k").get("v"));
    }

    @Test
    public void conflictingBatchAppliesNothing() {
        store.createOrUpdate("c", new UpdateOp("k", true).set("v", 1L).increment("_modCount", 1));
        WriteBatch batch = new WriteBatch()
                .update("c", new UpdateOp("other", true).set("v", 1L))
                .update("c", new UpdateOp("k", true).set("v", 2L).equals("_modCount", 5L));
        try {
            store.apply(batch);
            fail("expected DocumentStoreException");
        } catch (DocumentStoreException e) {
            assertTrue(e.isConflict());
            assertFalse(e.isTransient());
        }
        assertNull(store.find("c", "other"));
        assertEquals(1L, store.find("c", "k").get("v"));
    }

    @Test
    public void collections() {
        store.createCollection("empty");
        assertTrue(store.hasCollection("empty"));
        assertEquals(0, store.count("empty"));

        store.createOrUpdate("full", new UpdateOp("k", true));
        assertEquals(1, store.count("full"));
        assertEquals(keys("empty", "full"), new ArrayList<String>(store.getCollectionNames()));

        store.removeAll("full");
        assertTrue(store.hasCollection("full"));
        assertEquals(0, store.count("full"));

        store.dropCollection("full");
        assertFalse(store.hasCollection("full"));
        // idempotent
        store.dropCollection("full");
        store.remove("full", "k");
    }

    @Test
    public void batchIsAllOrNothing() {
        store.createOrUpdate("a", new UpdateOp("k", true).set("v", 1L));
        WriteBatch batch = new WriteBatch()
                .dropCollection("a")
                .update("b", new UpdateOp("k", true).set("v", 2L))
                .update("b", new UpdateOp("missing", false).set("v", 3L));
        assertTrue(store.supportsTransactions());
        try {
            store.apply(batch);
            fail("expected DocumentStoreException");
        } catch (DocumentStoreException e) {
            // expected
        }
        assertTrue(store.hasCollection("a"));
        assertFalse(store.hasCollection("b"));
    }

    @Test
    public void batch() {
        store.createOrUpdate("a", new UpdateOp("k", true).set("v", 1L));
        store.apply(new WriteBatch()
                .dropCollection("a")
                .createCollection("b")
                .update("c", new UpdateOp("k", true).set("v", 2L)));
        assertEquals(keys("b", "c"), new ArrayList<String>(store.getCollectionNames()));
        assertEquals(2L, store.find("c", "k").get("v"));
    }

    private static List<String> keys(String... keys) {
        List<String> list = new ArrayList<String>();
        for (String k : keys) {
            list.add(k);
        }
        return list;
    }

    private static List<String> keysOf(List<Map<String, Object>> docs) {
        List<String> list = new ArrayList<String>();
        for (Map<String, Object> doc : docs) {
            list.add((String) doc.get(UpdateOp.ID));
        }
        return list;
    }
}
