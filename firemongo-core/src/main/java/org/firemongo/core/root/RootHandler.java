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

import static com.google.common.base.Preconditions.checkNotNull;
import static org.firemongo.core.path.PathResolver.ROOT_COLLECTION;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.InvalidDataException;
import org.firemongo.api.RootConflictException;
import org.firemongo.core.mapper.DocumentMapper;
import org.firemongo.core.mapper.DocumentMapper.Change;
import org.firemongo.core.mapper.JsonConversion;
import org.firemongo.core.mapper.StoredDocument;
import org.firemongo.core.mapper.WriteMode;
import org.firemongo.core.path.PathResolver;
import org.firemongo.store.DocumentStore;
import org.firemongo.store.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * Handles values written directly at a collection or at the database root.
 * <p>
 * A collection holds either ordinary documents or one root document
 * ({@code {_id: "__fm_root__", __fm_root__: value}}) with a scalar or array
 * value. Values written at the database root are kept as documents of the
 * {@code __root__} collection, which only exists while there is no other
 * data collection.
 */
public class RootHandler {

    private static final Logger LOG = LoggerFactory.getLogger(RootHandler.class);

    private final DocumentStore store;

    private final DocumentMapper mapper;

    public RootHandler(@Nonnull DocumentStore store, @Nonnull DocumentMapper mapper) {
        this.store = checkNotNull(store);
        this.mapper = checkNotNull(mapper);
    }

    /**
     * Check the state of a collection.
     *
     * @param collection the collection
     * @return the form
     */
    @Nonnull
    public CollectionForm getForm(@Nonnull String collection) {
        if (!store.hasCollection(collection)) {
            return CollectionForm.ABSENT;
        }
        if (store.query(collection, null, null, 1).isEmpty()) {
            return CollectionForm.EMPTY;
        }
        Map<String, Object> root = store.find(collection, StoredDocument.ROOT_KEY);
        if (root != null && isRootForm(root)) {
            return CollectionForm.SCALAR;
        }
        return CollectionForm.KEYED;
    }

    public boolean isRootForm(@Nonnull Map<String, Object> document) {
        return StoredDocument.ROOT_KEY.equals(document.get(StoredDocument.ID))
                && document.containsKey(StoredDocument.ROOT_KEY);
    }

    @Nonnull
    public JsonNode unwrapRoot(@Nonnull Map<String, Object> document) {
        return JsonConversion.toJson(document.get(StoredDocument.ROOT_KEY));
    }

    /**
     * Add the operations that write a value at collection level to the
     * batch.
     *
     * @param collection the collection
     * @param value the value
     * @param mode the write mode
     * @param promote whether a scalar may replace the documents of the
     *            collection
     * @param batch the batch to add to
     * @throws RootConflictException if the value is not an object, the
     *             collection holds documents, and promote is not set
     * @throws InvalidDataException if the value contains an invalid key
     */
    public void writeAtCollectionRoot(@Nonnull String collection, @Nonnull JsonNode value,
                                      @Nonnull WriteMode mode, boolean promote,
                                      @Nonnull WriteBatch batch)
            throws RootConflictException, InvalidDataException {
        CollectionForm form = getForm(collection);
        if (!value.isObject()) {
            JsonConversion.validateKeys(value);
            if (form == CollectionForm.KEYED) {
                if (!promote) {
                    throw new RootConflictException(1, "Collection '" + collection
                            + "' holds documents; a value that is not an object can only replace them"
                            + " when promotion is requested");
                }
                LOG.info("Promoting collection {} to a root value, its documents are removed", collection);
                batch.removeAll(collection);
            }
            dropRootCollection(batch);
            batch.update(collection, StoredDocument.newRootDocument(JsonConversion.toStore(value)));
            return;
        }
        List<Change> changes = toMemberChanges(value, mode);
        checkDocumentIds(changes);
        dropRootCollection(batch);
        if (mode == WriteMode.REPLACE) {
            if (form == CollectionForm.KEYED || form == CollectionForm.SCALAR) {
                batch.removeAll(collection);
            }
            batch.createCollection(collection);
            for (Change c : changes) {
                if (c.getValue() != null) {
                    batch.update(collection, StoredDocument.newDocument(c.getKeys().get(0), c.getValue()));
                }
            }
        } else {
            if (form == CollectionForm.SCALAR) {
                batch.remove(collection, StoredDocument.ROOT_KEY);
            }
            batch.createCollection(collection);
            updateByDocument(collection, changes, batch);
        }
    }

    /**
     * Add the operations that write a value at the database root to the
     * batch. All data collections are dropped; the members of the value are
     * stored in the {@code __root__} collection.
     *
     * @param value the value, must be an object
     * @param mode the write mode
     * @param batch the batch to add to
     * @throws InvalidDataException if the value is not an object or contains
     *             an invalid key
     */
    public void writeAtDatabaseRoot(@Nonnull JsonNode value, @Nonnull WriteMode mode,
                                    @Nonnull WriteBatch batch) throws InvalidDataException {
        if (!value.isObject()) {
            throw new InvalidDataException(4, "Only an object can be written at the database root");
        }
        List<Change> changes = toMemberChanges(value, mode);
        for (Change c : changes) {
            if (PathResolver.isReserved(c.getKeys().get(0))) {
                throw new InvalidDataException(5, "Reserved name: " + c.getKeys().get(0));
            }
        }
        LOG.info("Writing at the database root, all data collections are dropped");
        for (String name : store.getCollectionNames()) {
            if (!PathResolver.isReserved(name)) {
                batch.dropCollection(name);
            }
        }
        if (mode == WriteMode.REPLACE) {
            batch.dropCollection(ROOT_COLLECTION);
            batch.createCollection(ROOT_COLLECTION);
            for (Change c : changes) {
                if (c.getValue() != null) {
                    batch.update(ROOT_COLLECTION,
                            StoredDocument.newDocument(c.getKeys().get(0), c.getValue()));
                }
            }
        } else {
            batch.createCollection(ROOT_COLLECTION);
            updateByDocument(ROOT_COLLECTION, changes, batch);
        }
    }

    /**
     * Add the operations needed before a document of the collection is
     * written: the {@code __root__} collection is dropped, and so is the
     * root document of the collection.
     *
     * @param collection the collection
     * @param batch the batch to add to
     */
    public void ensureDataCollection(@Nonnull String collection, @Nonnull WriteBatch batch) {
        dropRootCollection(batch);
        if (getForm(collection) == CollectionForm.SCALAR) {
            batch.remove(collection, StoredDocument.ROOT_KEY);
        }
    }

    /**
     * Add the operations that delete the value at a path below a collection
     * that holds a root value. The root document is rewritten without the
     * child, or removed if nothing is left.
     *
     * @param collection the collection
     * @param keys the path below the collection
     * @param batch the batch to add to
     */
    public void deleteInRootValue(@Nonnull String collection, @Nonnull List<String> keys,
                                  @Nonnull WriteBatch batch) {
        Map<String, Object> doc = store.find(collection, StoredDocument.ROOT_KEY);
        if (doc == null || !isRootForm(doc)) {
            return;
        }
        Object value = DocumentMapper.removeAt(
                JsonConversion.toStore(unwrapRoot(doc)), keys);
        if (value == null) {
            batch.remove(collection, StoredDocument.ROOT_KEY);
        } else {
            batch.update(collection, StoredDocument.newRootDocument(value)
                    .equals(StoredDocument.MOD_COUNT, StoredDocument.getModCount(doc)));
        }
    }

    /**
     * Whether paths of the collection resolve against the values written at
     * the database root: the collection does not exist but {@code __root__}
     * does.
     */
    public boolean isRootFallback(@Nonnull String collection) {
        return !store.hasCollection(collection) && store.hasCollection(ROOT_COLLECTION);
    }

    /**
     * Whether writes below the collection go to the value of the same name
     * that was written at the database root.
     */
    public boolean hasRootValue(@Nonnull String collection) {
        return isRootFallback(collection) && store.find(ROOT_COLLECTION, collection) != null;
    }

    /**
     * Read a whole collection.
     *
     * @param collection the collection
     * @return the root value, an object of all documents (empty if there is
     *         none), or null if the collection does not exist
     */
    @CheckForNull
    public JsonNode readCollection(@Nonnull String collection) {
        if (!store.hasCollection(collection)) {
            if (store.hasCollection(ROOT_COLLECTION)) {
                return mapper.read(ROOT_COLLECTION, collection, ImmutableList.<String>of());
            }
            return null;
        }
        return readDocuments(collection);
    }

    /**
     * Read the whole database.
     *
     * @return the values written at the database root, or an object of all
     *         data collections, or null if there is no data at all
     */
    @CheckForNull
    public JsonNode readDatabase() {
        if (store.hasCollection(ROOT_COLLECTION)) {
            return readDocuments(ROOT_COLLECTION);
        }
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        for (String name : store.getCollectionNames()) {
            if (!PathResolver.isReserved(name)) {
                obj.set(name, readDocuments(name));
            }
        }
        return obj.size() == 0 ? null : obj;
    }

    /**
     * Add the operations that delete a collection to the batch.
     */
    public void deleteCollection(@Nonnull String collection, @Nonnull WriteBatch batch) {
        if (store.hasCollection(collection)) {
            batch.dropCollection(collection);
        } else if (store.hasCollection(ROOT_COLLECTION)) {
            batch.remove(ROOT_COLLECTION, collection);
        }
    }

    /**
     * Add the operations that delete all data to the batch. The rules are
     * kept.
     */
    public void deleteDatabase(@Nonnull WriteBatch batch) {
        for (String name : store.getCollectionNames()) {
            if (!PathResolver.RULES_COLLECTION.equals(name)) {
                batch.dropCollection(name);
            }
        }
    }

    private JsonNode readDocuments(String collection) {
        ObjectNode obj = JsonNodeFactory.instance.objectNode();
        for (Map<String, Object> doc : store.query(collection, null, null, Integer.MAX_VALUE)) {
            if (isRootForm(doc)) {
                return unwrapRoot(doc);
            }
            obj.set(StoredDocument.getKey(doc), JsonConversion.toJson(StoredDocument.getValue(doc)));
        }
        return obj;
    }

    private void dropRootCollection(WriteBatch batch) {
        if (store.hasCollection(ROOT_COLLECTION)) {
            LOG.debug("Dropping the values written at the database root");
            batch.dropCollection(ROOT_COLLECTION);
        }
    }

    /**
     * One change per member of an object. Only a merge patch may address
     * deeper children with slashes in member names.
     */
    private static List<Change> toMemberChanges(JsonNode value, WriteMode mode)
            throws InvalidDataException {
        if (mode == WriteMode.REPLACE) {
            JsonConversion.validateKeys(value);
        }
        return DocumentMapper.toChanges(ImmutableList.<String>of(), value, WriteMode.MERGE_PATCH);
    }

    private static void checkDocumentIds(List<Change> changes) throws InvalidDataException {
        for (Change c : changes) {
            if (StoredDocument.ROOT_KEY.equals(c.getKeys().get(0))) {
                throw new InvalidDataException(5, "Reserved name: " + StoredDocument.ROOT_KEY);
            }
        }
    }

    /**
     * Apply changes whose first key is a document id, one write per
     * document.
     */
    private void updateByDocument(String collection, List<Change> changes, WriteBatch batch) {
        Map<String, List<Change>> byId = new LinkedHashMap<String, List<Change>>();
        for (Change c : changes) {
            List<String> keys = c.getKeys();
            List<Change> list = byId.get(keys.get(0));
            if (list == null) {
                list = Lists.newArrayList();
                byId.put(keys.get(0), list);
            }
            list.add(new Change(keys.subList(1, keys.size()), c.getValue()));
        }
        for (Entry<String, List<Change>> e : byId.entrySet()) {
            mapper.update(collection, e.getKey(), e.getValue(), batch);
        }
    }
}
