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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.InvalidDataException;
import org.firemongo.core.path.PathResolver;
import org.firemongo.store.DocumentStore;
import org.firemongo.store.WriteBatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Maps values at nested paths onto stored documents.
 * <p>
 * The whole value of a document is kept in its {@code _fm_val} field.
 * Nested reads and writes load that value, descend into it in memory and
 * write it back as a whole, so every write is a single-document upsert.
 * Missing intermediate objects are created, and a scalar on the way is
 * replaced by an object. Objects that become empty by a delete are removed,
 * and a document whose value becomes empty is removed (the collection
 * stays).
 * <p>
 * The write back is conditional on the {@code _modCount} of the document
 * that was read, so a concurrent change of the same document makes the
 * store reject the batch with a conflict.
 */
public class DocumentMapper {

    private final DocumentStore store;

    public DocumentMapper(@Nonnull DocumentStore store) {
        this.store = checkNotNull(store);
    }

    /**
     * Read the value at a path inside a document.
     *
     * @param collection the collection
     * @param id the document id
     * @param nestedKeys the keys inside the document, possibly empty
     * @return the value, or null if there is none
     */
    @CheckForNull
    public JsonNode read(@Nonnull String collection, @Nonnull String id,
                         @Nonnull List<String> nestedKeys) {
        Map<String, Object> doc = store.find(collection, id);
        if (doc == null) {
            return null;
        }
        Object v = descend(StoredDocument.getValue(doc), nestedKeys);
        return v == null ? null : JsonConversion.toJson(v);
    }

    /**
     * Add the operations that write a value at a path inside a document to
     * the batch. The document is read when this method is called.
     *
     * @param collection the collection
     * @param id the document id
     * @param nestedKeys the keys inside the document, possibly empty
     * @param value the value
     * @param mode the write mode
     * @param batch the batch to add to
     * @throws InvalidDataException if the value contains an invalid key
     */
    public void write(@Nonnull String collection, @Nonnull String id,
                      @Nonnull List<String> nestedKeys, @Nonnull JsonNode value,
                      @Nonnull WriteMode mode, @Nonnull WriteBatch batch)
            throws InvalidDataException {
        update(collection, id, toChanges(nestedKeys, value, mode), batch);
    }

    /**
     * Add the operations that delete the value at a path inside a document
     * to the batch. Deleting a path that does not exist does nothing.
     */
    public void delete(@Nonnull String collection, @Nonnull String id,
                       @Nonnull List<String> nestedKeys, @Nonnull WriteBatch batch) {
        if (nestedKeys.isEmpty()) {
            batch.remove(collection, id);
            return;
        }
        update(collection, id, ImmutableList.of(new Change(nestedKeys, null)), batch);
    }

    /**
     * Apply a list of changes, in order, to the value of one document and
     * add the resulting write to the batch.
     *
     * @param collection the collection
     * @param id the document id
     * @param changes the changes, relative to the document value
     * @param batch the batch to add to
     */
    public void update(@Nonnull String collection, @Nonnull String id,
                       @Nonnull List<Change> changes, @Nonnull WriteBatch batch) {
        if (changes.isEmpty()) {
            return;
        }
        Map<String, Object> doc = store.find(collection, id);
        Object root = StoredDocument.getValue(doc);
        for (Change c : changes) {
            root = setAt(root, c.getKeys(), 0, c.getValue());
        }
        if (JsonConversion.isEmpty(root)) {
            if (doc != null) {
                batch.remove(collection, id);
            }
        } else {
            batch.update(collection, StoredDocument.newDocument(id, root,
                    StoredDocument.getModCount(doc)));
        }
    }

    /**
     * Turn a write into a list of changes. With {@link WriteMode#MERGE_PATCH}
     * and an object value, there is one change per member. A member name may
     * contain slashes to address a deeper child, and a {@code null} member
     * removes the child.
     *
     * @param base the path of the write
     * @param value the value
     * @param mode the write mode
     * @return the changes
     * @throws InvalidDataException if the value contains an invalid key
     */
    @Nonnull
    public static List<Change> toChanges(@Nonnull List<String> base, @Nonnull JsonNode value,
                                         @Nonnull WriteMode mode) throws InvalidDataException {
        List<Change> changes = Lists.newArrayList();
        if (mode == WriteMode.MERGE_PATCH && value.isObject()) {
            Iterator<Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Entry<String, JsonNode> e = it.next();
                JsonConversion.validateKeys(e.getValue());
                List<String> keys = ImmutableList.<String>builder()
                        .addAll(base).addAll(splitMergeKey(e.getKey())).build();
                changes.add(new Change(keys, toStoreValue(e.getValue())));
            }
        } else {
            JsonConversion.validateKeys(value);
            changes.add(new Change(base, toStoreValue(value)));
        }
        return changes;
    }

    /**
     * Split a member name of a merge patch into keys.
     *
     * @param key the member name, for example {@code scores/round1}
     * @return the keys
     * @throws InvalidDataException if a key is invalid
     */
    @Nonnull
    public static List<String> splitMergeKey(@Nonnull String key) throws InvalidDataException {
        String k = key.startsWith("/") ? key.substring(1) : key;
        List<String> keys = Lists.newArrayList();
        for (String s : k.split("/", -1)) {
            if (!PathResolver.isValidKey(s)) {
                throw new InvalidDataException(3, "Invalid key '" + key + "' in update");
            }
            keys.add(s);
        }
        return keys;
    }

    @CheckForNull
    private static Object toStoreValue(JsonNode value) {
        Object v = JsonConversion.toStore(value);
        return JsonConversion.isEmpty(v) ? null : v;
    }

    /**
     * Remove the value at a path, in place.
     *
     * @param value the value, in store form
     * @param keys the path relative to the value
     * @return the remaining value, null if it became empty
     */
    @CheckForNull
    public static Object removeAt(@CheckForNull Object value, @Nonnull List<String> keys) {
        return setAt(value, keys, 0, null);
    }

    @CheckForNull
    @SuppressWarnings("unchecked")
    static Object descend(@CheckForNull Object value, List<String> keys) {
        Object v = value;
        for (String k : keys) {
            if (v instanceof Map) {
                v = ((Map<String, Object>) v).get(k);
            } else if (v instanceof List) {
                List<Object> list = (List<Object>) v;
                int index = getIndex(k, list);
                v = index < 0 ? null : list.get(index);
            } else {
                return null;
            }
        }
        return v;
    }

    /**
     * Set or remove the value at a path. Containers along the path are
     * modified in place.
     *
     * @param node the current value
     * @param keys the path
     * @param i the position in the path
     * @param value the new value, or null to remove
     * @return the new value of the node, null if it became empty
     */
    @CheckForNull
    @SuppressWarnings("unchecked")
    static Object setAt(@CheckForNull Object node, List<String> keys, int i, @CheckForNull Object value) {
        if (i == keys.size()) {
            return value;
        }
        String k = keys.get(i);
        if (node instanceof List) {
            List<Object> list = (List<Object>) node;
            int index = getIndex(k, list);
            if (index >= 0) {
                Object child = setAt(list.get(index), keys, i + 1, value);
                if (child != null) {
                    list.set(index, child);
                    return list;
                }
                if (index == list.size() - 1) {
                    list.remove(index);
                    return list.isEmpty() ? null : list;
                }
            }
            if (value == null && index < 0) {
                return node;
            }
            node = asMap(list);
        }
        Map<String, Object> map;
        if (node instanceof Map) {
            map = (Map<String, Object>) node;
        } else if (value == null) {
            // nothing to remove
            return node;
        } else {
            map = new LinkedHashMap<String, Object>();
        }
        if (value == null && !map.containsKey(k)) {
            return map.isEmpty() ? null : map;
        }
        Object child = setAt(map.get(k), keys, i + 1, value);
        if (child == null) {
            map.remove(k);
        } else {
            map.put(k, child);
        }
        return map.isEmpty() ? null : map;
    }

    private static Map<String, Object> asMap(List<Object> list) {
        Map<String, Object> map = new LinkedHashMap<String, Object>();
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) != null) {
                map.put(String.valueOf(i), list.get(i));
            }
        }
        return map;
    }

    private static int getIndex(String key, List<Object> list) {
        if (key.isEmpty() || key.length() > 9) {
            return -1;
        }
        for (int i = 0; i < key.length(); i++) {
            if (key.charAt(i) < '0' || key.charAt(i) > '9') {
                return -1;
            }
        }
        if (key.length() > 1 && key.charAt(0) == '0') {
            return -1;
        }
        int index = Integer.parseInt(key);
        return index < list.size() ? index : -1;
    }

    /**
     * Set (or, with a null value, remove) the value at a path relative to
     * the value of a document.
     */
    public static final class Change {

        private final List<String> keys;

        private final Object value;

        public Change(@Nonnull List<String> keys, @CheckForNull Object value) {
            this.keys = ImmutableList.copyOf(keys);
            this.value = value;
        }

        @Nonnull
        public List<String> getKeys() {
            return keys;
        }

        /**
         * @return the value in store form, or null to remove
         */
        @CheckForNull
        public Object getValue() {
            return value;
        }

        @Override
        public String toString() {
            return keys + "=" + value;
        }
    }
}
