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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.store.UpdateOp.Operation;
import org.firemongo.store.util.Utils;

/**
 * Emulates a MongoDB store in memory. Batches are applied atomically: a
 * batch holds the write lock for all of its steps.
 */
public class MemoryDocumentStore implements DocumentStore {

    /**
     * Key: the collection name, value: the documents ordered by key.
     */
    private final ConcurrentHashMap<String, ConcurrentSkipListMap<String, Map<String, Object>>> collections =
            new ConcurrentHashMap<String, ConcurrentSkipListMap<String, Map<String, Object>>>();

    private final ReadWriteLock rwLock = new ReentrantReadWriteLock();

    @Override
    public Map<String, Object> find(String collection, String key) {
        Lock lock = rwLock.readLock();
        lock.lock();
        try {
            ConcurrentSkipListMap<String, Map<String, Object>> map = collections.get(collection);
            if (map == null) {
                return null;
            }
            Map<String, Object> n = map.get(key);
            if (n == null) {
                return null;
            }
            return Utils.copyDocument(n);
        } finally {
            lock.unlock();
        }
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> query(String collection, @CheckForNull String fromKey,
                                           @CheckForNull String toKey, int limit) {
        Lock lock = rwLock.readLock();
        lock.lock();
        try {
            ArrayList<Map<String, Object>> list = new ArrayList<Map<String, Object>>();
            ConcurrentSkipListMap<String, Map<String, Object>> map = collections.get(collection);
            if (map == null) {
                return list;
            }
            NavigableMap<String, Map<String, Object>> sub = map;
            if (fromKey != null) {
                sub = sub.tailMap(fromKey, true);
            }
            if (toKey != null) {
                sub = sub.headMap(toKey, false);
            }
            for (Map<String, Object> n : sub.values()) {
                if (list.size() >= limit) {
                    break;
                }
                list.add(Utils.copyDocument(n));
            }
            return list;
        } finally {
            lock.unlock();
        }
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> query(String collection, final String property,
                                           @CheckForNull Object fromValue,
                                           @CheckForNull Object toValue,
                                           final boolean descending, int limit) {
        Lock lock = rwLock.readLock();
        lock.lock();
        try {
            List<Map<String, Object>> list = new ArrayList<Map<String, Object>>();
            ConcurrentSkipListMap<String, Map<String, Object>> map = collections.get(collection);
            if (map == null || limit <= 0) {
                return list;
            }
            for (Map<String, Object> n : map.values()) {
                Object v = Utils.getProperty(n, property);
                if (v == null) {
                    continue;
                }
                if (fromValue != null
                        && (!Utils.isSameType(v, fromValue) || Utils.compareValues(v, fromValue) < 0)) {
                    continue;
                }
                if (toValue != null
                        && (!Utils.isSameType(v, toValue) || Utils.compareValues(v, toValue) > 0)) {
                    continue;
                }
                list.add(n);
            }
            // the scan is in key order, and the sort is stable
            Comparator<Map<String, Object>> byValue = (a, b) -> Utils.compareValues(
                    Utils.getProperty(a, property), Utils.getProperty(b, property));
            Collections.sort(list, descending ? byValue.reversed() : byValue);
            List<Map<String, Object>> result = new ArrayList<Map<String, Object>>();
            for (Map<String, Object> n : list) {
                if (result.size() >= limit) {
                    break;
                }
                result.add(Utils.copyDocument(n));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long count(String collection) {
        ConcurrentSkipListMap<String, Map<String, Object>> map = collections.get(collection);
        return map == null ? 0 : map.size();
    }

    @Override
    public boolean hasCollection(String collection) {
        return collections.containsKey(collection);
    }

    @Nonnull
    @Override
    public Set<String> getCollectionNames() {
        return new TreeSet<String>(collections.keySet());
    }

    @Override
    public void createCollection(String collection) {
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            getOrCreate(collection);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void dropCollection(String collection) {
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            collections.remove(collection);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void removeAll(String collection) {
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            ConcurrentSkipListMap<String, Map<String, Object>> map = collections.get(collection);
            if (map != null) {
                map.clear();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void remove(String collection, String key) {
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            ConcurrentSkipListMap<String, Map<String, Object>> map = collections.get(collection);
            if (map != null) {
                map.remove(key);
            }
        } finally {
            lock.unlock();
        }
    }

    @CheckForNull
    @Override
    public Map<String, Object> createOrUpdate(String collection, UpdateOp update) {
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            return internalCreateOrUpdate(collection, update);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void ensureIndex(String collection, String property) {
        // ignore, every query is a scan
    }

    @Override
    public boolean supportsTransactions() {
        return true;
    }

    @Override
    public void apply(WriteBatch batch) {
        Lock lock = rwLock.writeLock();
        lock.lock();
        try {
            // validate first, so that a batch either applies completely or not at all;
            // conditions are checked against the state before the batch
            for (WriteBatch.Step step : batch.getSteps()) {
                if (step.getKind() == WriteBatch.Step.Kind.UPDATE) {
                    UpdateOp op = step.getUpdate();
                    Map<String, Object> doc = get(step.getCollection(), op.getKey());
                    if (!op.isNew() && doc == null) {
                        throw new DocumentStoreException("Document does not exist: " + op.getKey());
                    }
                    if (!Utils.checkConditions(doc, op)) {
                        throw conflict(step.getCollection(), op);
                    }
                }
            }
            for (WriteBatch.Step step : batch.getSteps()) {
                step.applyTo(this);
            }
        } finally {
            lock.unlock();
        }
    }

    private Map<String, Object> get(String collection, String key) {
        ConcurrentSkipListMap<String, Map<String, Object>> map = collections.get(collection);
        return map == null ? null : map.get(key);
    }

    private static DocumentStoreException conflict(String collection, UpdateOp op) {
        return new DocumentStoreException("Conditions do not match: " + collection + "/" + op.getKey()
                + " " + op.getConditions(), null, DocumentStoreException.Type.CONFLICT);
    }

    private ConcurrentSkipListMap<String, Map<String, Object>> getOrCreate(String collection) {
        ConcurrentSkipListMap<String, Map<String, Object>> map = collections.get(collection);
        if (map == null) {
            map = new ConcurrentSkipListMap<String, Map<String, Object>>();
            ConcurrentSkipListMap<String, Map<String, Object>> old = collections.putIfAbsent(collection, map);
            if (old != null) {
                map = old;
            }
        }
        return map;
    }

    private Map<String, Object> internalCreateOrUpdate(String collection, UpdateOp update) {
        if (!Utils.checkConditions(get(collection, update.getKey()), update)) {
            throw conflict(collection, update);
        }
        ConcurrentSkipListMap<String, Map<String, Object>> map;
        if (update.isNew()) {
            map = getOrCreate(collection);
        } else {
            map = collections.get(collection);
        }
        Map<String, Object> n = map == null ? null : map.get(update.getKey());
        Map<String, Object> oldDoc = null;
        if (n == null) {
            if (!update.isNew()) {
                throw new DocumentStoreException("Document does not exist: " + update.getKey());
            }
            n = Utils.newMap();
            n.put(UpdateOp.ID, update.getKey());
            map.put(update.getKey(), n);
        } else {
            oldDoc = Utils.copyDocument(n);
        }
        applyChanges(n, update);
        return oldDoc;
    }

    public static void applyChanges(Map<String, Object> target, UpdateOp update) {
        for (Entry<String, Operation> e : update.changes.entrySet()) {
            String k = e.getKey();
            Operation op = e.getValue();
            switch (op.type) {
                case SET: {
                    target.put(k, Utils.deepCopy(op.value));
                    break;
                }
                case UNSET: {
                    target.remove(k);
                    break;
                }
                case INCREMENT: {
                    Object old = target.get(k);
                    long x = (Long) op.value;
                    target.put(k, old == null ? x : ((Number) old).longValue() + x);
                    break;
                }
            }
        }
    }

    @Override
    public String toString() {
        StringBuilder buff = new StringBuilder();
        for (String c : getCollectionNames()) {
            buff.append("Collection: ").append(c).append('\n');
            Map<String, Map<String, Object>> docs = collections.get(c);
            if (docs == null) {
                continue;
            }
            for (Entry<String, Map<String, Object>> e : docs.entrySet()) {
                buff.append(e.getKey()).append('=').append(e.getValue()).append('\n');
            }
            buff.append("\n");
        }
        return buff.toString();
    }

    @Override
    public void dispose() {
        // ignore
    }

}
