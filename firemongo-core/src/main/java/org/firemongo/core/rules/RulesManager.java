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

import static com.google.common.base.Preconditions.checkNotNull;
import static org.firemongo.core.path.PathResolver.ROOT_COLLECTION;
import static org.firemongo.core.path.PathResolver.RULES_COLLECTION;

import java.util.Map;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.InvalidIndexException;
import org.firemongo.core.mapper.StoredDocument;
import org.firemongo.core.path.PathResolver;
import org.firemongo.store.DocumentStore;
import org.firemongo.store.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Keeps the index rules in the {@code __fm_rules__} collection, one document
 * per rule key. A rule key is a collection name, {@code __root__} for the
 * database root, or a slash-separated path for deeper children. Data
 * operations never touch this collection.
 */
public class RulesManager {

    private static final Logger LOG = LoggerFactory.getLogger(RulesManager.class);

    private static final String FIELD_PREFIX = StoredDocument.FM_VAL + ".";

    private final DocumentStore store;

    public RulesManager(@Nonnull DocumentStore store) {
        this.store = checkNotNull(store);
    }

    /**
     * Declare the index of a rule key, replacing the previous declaration.
     *
     * @param key the rule key
     * @param body the declaration, see {@link IndexSpec#fromJson(JsonNode)}
     * @return the stored declaration
     * @throws InvalidIndexException if the key or the declaration is invalid
     */
    @Nonnull
    public IndexSpec setRules(@Nonnull String key, @CheckForNull JsonNode body) throws InvalidIndexException {
        checkKey(key);
        IndexSpec spec = IndexSpec.fromJson(body);
        store.createOrUpdate(RULES_COLLECTION, StoredDocument.newDocument(key, spec.toStore()));
        LOG.info("Index rules for {} set to {}", key, spec);
        if (!spec.isByValue()) {
            ensureNativeIndexes(key, spec);
        }
        return spec;
    }

    /**
     * @param key the rule key
     * @return the index declared for the key, or null
     */
    @CheckForNull
    public IndexSpec getIndexFor(@Nonnull String key) {
        Map<String, Object> doc = store.find(RULES_COLLECTION, key);
        return doc == null ? null : IndexSpec.fromStore(StoredDocument.getValue(doc));
    }

    /**
     * @param key the rule key
     * @return the rules in Firebase form, or null if there are none
     */
    @CheckForNull
    public JsonNode getRules(@Nonnull String key) {
        IndexSpec spec = getIndexFor(key);
        return spec == null ? null : spec.toJson();
    }

    /**
     * @return all rules, keyed by rule key
     */
    @Nonnull
    public ObjectNode getAllRules() {
        ObjectNode all = JsonNodeFactory.instance.objectNode();
        for (Map<String, Object> doc : store.query(RULES_COLLECTION, null, null, Integer.MAX_VALUE)) {
            IndexSpec spec = IndexSpec.fromStore(StoredDocument.getValue(doc));
            if (spec != null) {
                all.set(StoredDocument.getKey(doc), spec.toJson());
            }
        }
        return all;
    }

    /**
     * Remove the rules of a key. Native indexes are kept.
     *
     * @param key the rule key
     * @return whether there were rules
     */
    public boolean deleteRules(@Nonnull String key) {
        boolean existed = store.find(RULES_COLLECTION, key) != null;
        store.remove(RULES_COLLECTION, key);
        if (existed) {
            LOG.info("Index rules for {} removed", key);
        }
        return existed;
    }

    /**
     * Remove all rules.
     */
    public void deleteAllRules() {
        store.removeAll(RULES_COLLECTION);
        LOG.info("All index rules removed");
    }

    /**
     * Create the native indexes declared for a collection. Dropping a
     * collection drops its native indexes, so this is called again whenever
     * a collection is created. Failures are logged and otherwise ignored.
     *
     * @param collection the collection
     */
    public void ensureNativeIndexes(@Nonnull String collection) {
        IndexSpec spec = getIndexFor(collection);
        if (spec != null && !spec.isByValue()) {
            ensureNativeIndexes(collection, spec);
        }
    }

    private void ensureNativeIndexes(String key, IndexSpec spec) {
        if (key.indexOf('/') >= 0 || ROOT_COLLECTION.equals(key) || !store.hasCollection(key)) {
            return;
        }
        for (String field : spec.getFieldNames()) {
            try {
                store.ensureIndex(key, FIELD_PREFIX + field.replace('/', '.'));
            } catch (DocumentStoreException e) {
                LOG.warn("Could not create an index on {} for {}: {}", key, field, e.getMessage());
            }
        }
    }

    private static void checkKey(String key) throws InvalidIndexException {
        if (ROOT_COLLECTION.equals(key)) {
            return;
        }
        for (String s : key.split("/", -1)) {
            if (!PathResolver.isValidKey(s)) {
                throw new InvalidIndexException(8, "Invalid rule key: " + key);
            }
        }
    }
}
