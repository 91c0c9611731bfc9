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
package org.firemongo.core;

import static com.google.common.base.Preconditions.checkNotNull;
import static org.firemongo.core.path.PathResolver.ROOT_COLLECTION;

import java.util.List;
import java.util.Map;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.FireMongoException;
import org.firemongo.api.InvalidDataException;
import org.firemongo.api.InvalidIndexException;
import org.firemongo.api.InvalidQueryException;
import org.firemongo.api.PartialApplicationException;
import org.firemongo.api.StoreUnavailableException;
import org.firemongo.core.mapper.DocumentMapper;
import org.firemongo.core.mapper.StoredDocument;
import org.firemongo.core.mapper.WriteMode;
import org.firemongo.core.path.PathResolver;
import org.firemongo.core.path.PathSegments;
import org.firemongo.core.path.PathType;
import org.firemongo.core.query.Query;
import org.firemongo.core.query.QueryEngine;
import org.firemongo.core.query.QueryResult;
import org.firemongo.core.root.CollectionForm;
import org.firemongo.core.root.RootHandler;
import org.firemongo.core.rules.RulesManager;
import org.firemongo.core.util.PushIdGenerator;
import org.firemongo.core.util.SystemPropertySupplier;
import org.firemongo.store.DocumentStore;
import org.firemongo.store.DocumentStoreException;
import org.firemongo.store.MongoDocumentStore;
import org.firemongo.store.PartialWriteException;
import org.firemongo.store.WriteBatch;
import org.firemongo.store.util.LoggingDocumentStoreWrapper;
import org.firemongo.store.util.MongoConnection;
import org.firemongo.store.util.RetryingDocumentStoreWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import com.google.common.primitives.Ints;

/**
 * A realtime database emulated on a document store.
 * <p>
 * Every path addresses a value in one JSON tree. The first segment of a path
 * is a collection, the second a document of it and the remaining segments
 * are keys inside the document value. Index rules are read and written
 * through paths below {@code /__fm_rules__}.
 * <p>
 * An instance holds no state of its own and can be used by many threads at
 * once. Writes that touch more than one document are collected in a
 * {@link WriteBatch} and applied at the end of the call. A batch that
 * conflicts with a concurrent change of the same documents is prepared and
 * applied again, up to {@link #MAX_CONFLICT_RETRIES} times.
 */
public class FireMongo {

    private static final Logger LOG = LoggerFactory.getLogger(FireMongo.class);

    public static final String MONGO_URI_PROPERTY = "firemongo.mongo.uri";

    public static final String STRICT_INDEXES_PROPERTY = "firemongo.query.strictIndexes";

    public static final String RETRY_BACKOFF_PROPERTY = "firemongo.store.retryBackoffMillis";

    public static final String LOGGING_PROPERTY = "firemongo.store.logging";

    public static final String DEFAULT_MONGO_URI = "mongodb://localhost:27017/firemongo";

    private static final SystemPropertySupplier<String> MONGO_URI =
            SystemPropertySupplier.create(MONGO_URI_PROPERTY, DEFAULT_MONGO_URI)
                    .loggingTo(LOG).hideValue();

    private static final SystemPropertySupplier<Boolean> STRICT_INDEXES =
            SystemPropertySupplier.create(STRICT_INDEXES_PROPERTY, Boolean.FALSE).loggingTo(LOG);

    private static final SystemPropertySupplier<Long> RETRY_BACKOFF =
            SystemPropertySupplier.create(RETRY_BACKOFF_PROPERTY, 100L)
                    .loggingTo(LOG).validateWith(v -> v >= 0);

    private static final SystemPropertySupplier<Boolean> LOGGING =
            SystemPropertySupplier.create(LOGGING_PROPERTY, Boolean.FALSE).loggingTo(LOG);

    /**
     * How many times a write is repeated after a conflict with a concurrent
     * write.
     */
    static final int MAX_CONFLICT_RETRIES = 3;

    private static final Joiner SLASH = Joiner.on('/');

    private final DocumentStore store;

    private final DocumentMapper mapper;

    private final RootHandler roots;

    private final RulesManager rules;

    private final QueryEngine queries;

    private final PushIdGenerator pushIds = new PushIdGenerator();

    FireMongo(@Nonnull DocumentStore store, boolean strictIndexes) {
        this.store = checkNotNull(store);
        this.mapper = new DocumentMapper(store);
        this.roots = new RootHandler(store, mapper);
        this.rules = new RulesManager(store);
        this.queries = new QueryEngine(store, rules, strictIndexes);
    }

    @Nonnull
    public DocumentStore getDocumentStore() {
        return store;
    }

    @CheckForNull
    public JsonNode get(@Nonnull String path) throws FireMongoException {
        return get(path, Query.NONE);
    }

    /**
     * Read the value at a path.
     *
     * @param path the path
     * @param query the query to apply, {@link Query#NONE} to read the whole
     *            value
     * @return the value, or null if there is none
     * @throws FireMongoException if the path or query is invalid, or the
     *             store is unavailable
     */
    @CheckForNull
    public JsonNode get(@Nonnull String path, @Nonnull Query query) throws FireMongoException {
        try {
            if (PathResolver.isRulesPath(path)) {
                if (!query.isEmpty()) {
                    throw new InvalidQueryException(8, "Index rules can not be queried");
                }
                String key = PathResolver.resolveRulesKey(path);
                return key == null ? rules.getAllRules() : rules.getRules(key);
            }
            PathSegments segments = PathResolver.resolve(path);
            return queries.apply(getRuleKey(segments), source(segments, query).get(), query);
        } catch (DocumentStoreException e) {
            throw translate(e);
        }
    }

    /**
     * Query the children of the value at a path. The value is read again
     * each time the result is iterated; store failures during iteration
     * surface as {@link DocumentStoreException}.
     *
     * @param path the path
     * @param query the query
     * @return the lazy result
     * @throws FireMongoException if the path or query is invalid
     */
    @Nonnull
    public QueryResult query(@Nonnull String path, @Nonnull Query query) throws FireMongoException {
        if (PathResolver.isRulesPath(path)) {
            throw new InvalidQueryException(8, "Index rules can not be queried");
        }
        final PathSegments segments = PathResolver.resolve(path);
        try {
            return queries.query(getRuleKey(segments), source(segments, query), query);
        } catch (DocumentStoreException e) {
            throw translate(e);
        }
    }

    @Nonnull
    public JsonNode put(@Nonnull String path, @CheckForNull JsonNode value) throws FireMongoException {
        return put(path, value, WriteOptions.DEFAULT);
    }

    /**
     * Replace the value at a path.
     *
     * @param path the path
     * @param value the new value
     * @param options the write options
     * @return the value as written
     * @throws FireMongoException if the value can not be written
     */
    @Nonnull
    public JsonNode put(@Nonnull String path, @CheckForNull JsonNode value,
                        @Nonnull WriteOptions options) throws FireMongoException {
        return write(path, value, WriteMode.REPLACE, options);
    }

    @Nonnull
    public JsonNode patch(@Nonnull String path, @CheckForNull JsonNode value) throws FireMongoException {
        return patch(path, value, WriteOptions.DEFAULT);
    }

    /**
     * Merge an object into the value at a path. Member names may contain
     * slashes to update deeper children, and a {@code null} member removes
     * the child. A value that is not an object replaces the target.
     *
     * @param path the path
     * @param value the patch
     * @param options the write options
     * @return the patch
     * @throws FireMongoException if the patch can not be applied
     */
    @Nonnull
    public JsonNode patch(@Nonnull String path, @CheckForNull JsonNode value,
                          @Nonnull WriteOptions options) throws FireMongoException {
        return write(path, value, WriteMode.MERGE_PATCH, options);
    }

    /**
     * Add a child with a generated name below a path. Below the database
     * root the child is a new collection.
     *
     * @param path the path of the parent
     * @param value the value of the child
     * @return the generated name
     * @throws FireMongoException if the value can not be written
     */
    @Nonnull
    public String post(@Nonnull String path, @CheckForNull JsonNode value) throws FireMongoException {
        checkPayload(value);
        if (PathResolver.isRulesPath(path)) {
            throw new InvalidIndexException(9, "Index rules are set with PUT");
        }
        PathSegments segments = PathResolver.resolve(path);
        String name = pushIds.newId();
        PathSegments child = segments.child(name);
        try {
            apply(child.getCollection(),
                    batch -> prepareWrite(child, value, WriteMode.REPLACE, false, batch));
        } catch (DocumentStoreException e) {
            throw translate(e);
        }
        return name;
    }

    /**
     * Delete the value at a path. Deleting a value that does not exist
     * succeeds. Deleting the database root keeps the index rules.
     *
     * @param path the path
     * @throws FireMongoException if the path is invalid, or the store is
     *             unavailable
     */
    public void delete(@Nonnull String path) throws FireMongoException {
        try {
            if (PathResolver.isRulesPath(path)) {
                String key = PathResolver.resolveRulesKey(path);
                if (key == null) {
                    rules.deleteAllRules();
                } else {
                    rules.deleteRules(key);
                }
                return;
            }
            PathSegments segments = PathResolver.resolve(path);
            apply(null, batch -> prepareDelete(segments, batch));
        } catch (DocumentStoreException e) {
            throw translate(e);
        }
    }

    /**
     * @param key the rule key, {@code __root__} for the database root
     * @return the rules in Firebase form, or null
     */
    @CheckForNull
    public JsonNode getRules(@Nonnull String key) throws FireMongoException {
        try {
            return rules.getRules(key);
        } catch (DocumentStoreException e) {
            throw translate(e);
        }
    }

    /**
     * @param key the rule key, {@code __root__} for the database root
     * @param body the index declaration
     * @return the declaration as stored, in Firebase form
     */
    @Nonnull
    public JsonNode setRules(@Nonnull String key, @CheckForNull JsonNode body) throws FireMongoException {
        try {
            return rules.setRules(key, body).toJson();
        } catch (DocumentStoreException e) {
            throw translate(e);
        }
    }

    /**
     * @param key the rule key
     * @return whether there were rules for the key
     */
    public boolean deleteRules(@Nonnull String key) throws FireMongoException {
        try {
            return rules.deleteRules(key);
        } catch (DocumentStoreException e) {
            throw translate(e);
        }
    }

    public void dispose() {
        store.dispose();
    }

    private JsonNode write(String path, JsonNode value, WriteMode mode, WriteOptions options)
            throws FireMongoException {
        checkPayload(value);
        try {
            if (PathResolver.isRulesPath(path)) {
                String key = PathResolver.resolveRulesKey(path);
                return rules.setRules(key == null ? ROOT_COLLECTION : key, value).toJson();
            }
            PathSegments segments = PathResolver.resolve(path);
            apply(segments.getCollection(),
                    batch -> prepareWrite(segments, value, mode, options.isPromote(), batch));
            return value;
        } catch (DocumentStoreException e) {
            throw translate(e);
        }
    }

    private void prepareWrite(PathSegments segments, JsonNode value, WriteMode mode,
                              boolean promote, WriteBatch batch) throws FireMongoException {
        String collection = segments.getCollection();
        switch (segments.getType()) {
            case DATABASE_ROOT:
                roots.writeAtDatabaseRoot(value, mode, batch);
                break;
            case COLLECTION_ROOT:
                if (roots.hasRootValue(collection)) {
                    mapper.write(ROOT_COLLECTION, collection, ImmutableList.<String>of(),
                            value, mode, batch);
                } else {
                    roots.writeAtCollectionRoot(collection, value, mode, promote, batch);
                }
                break;
            default:
                if (roots.hasRootValue(collection)) {
                    mapper.write(ROOT_COLLECTION, collection, belowCollection(segments),
                            value, mode, batch);
                } else {
                    roots.ensureDataCollection(collection, batch);
                    mapper.write(collection, segments.getDocumentId(),
                            segments.getNestedKeys(), value, mode, batch);
                }
        }
    }

    private void prepareDelete(PathSegments segments, WriteBatch batch) {
        String collection = segments.getCollection();
        switch (segments.getType()) {
            case DATABASE_ROOT:
                roots.deleteDatabase(batch);
                break;
            case COLLECTION_ROOT:
                roots.deleteCollection(collection, batch);
                break;
            default:
                if (roots.hasRootValue(collection)) {
                    mapper.delete(ROOT_COLLECTION, collection, belowCollection(segments), batch);
                } else if (roots.getForm(collection) == CollectionForm.SCALAR) {
                    roots.deleteInRootValue(collection, belowCollection(segments), batch);
                } else {
                    mapper.delete(collection, segments.getDocumentId(),
                            segments.getNestedKeys(), batch);
                }
        }
    }

    /**
     * The value a query runs on. A query on a collection of documents that
     * is covered by an index only reads the candidate documents.
     */
    private Supplier<JsonNode> source(PathSegments segments, Query query) {
        if (segments.getType() == PathType.COLLECTION_ROOT && !query.isEmpty()
                && queries.isIndexed(getRuleKey(segments), query)) {
            String collection = segments.getCollection();
            return () -> roots.getForm(collection) == CollectionForm.KEYED
                    ? queries.readIndexed(collection, query) : read(segments);
        }
        return () -> read(segments);
    }

    @CheckForNull
    private JsonNode read(PathSegments segments) {
        String collection = segments.getCollection();
        switch (segments.getType()) {
            case DATABASE_ROOT:
                return roots.readDatabase();
            case COLLECTION_ROOT:
                return roots.readCollection(collection);
            default:
                if (roots.isRootFallback(collection)) {
                    return mapper.read(ROOT_COLLECTION, collection, belowCollection(segments));
                }
                JsonNode value = mapper.read(collection, segments.getDocumentId(),
                        segments.getNestedKeys());
                if (value == null) {
                    // the collection may hold a root value
                    Map<String, Object> doc = store.find(collection, StoredDocument.ROOT_KEY);
                    if (doc != null && roots.isRootForm(doc)) {
                        return descend(roots.unwrapRoot(doc), belowCollection(segments));
                    }
                }
                return value;
        }
    }

    /**
     * Prepare and apply a batch, and prepare it again from the current
     * state if it conflicts with a concurrent write. If the write creates
     * the given collection, its native indexes are created too.
     *
     * @param collection the collection written to, empty or null for none
     * @param preparation adds the operations to a batch
     */
    private void apply(@CheckForNull String collection, BatchPreparation preparation)
            throws FireMongoException {
        boolean existed = Strings.isNullOrEmpty(collection) || store.hasCollection(collection);
        for (int retries = 0;; retries++) {
            WriteBatch batch = new WriteBatch();
            preparation.prepare(batch);
            try {
                apply(batch);
                break;
            } catch (DocumentStoreException e) {
                if (!isRetryable(e) || retries >= MAX_CONFLICT_RETRIES) {
                    throw e;
                }
                LOG.debug("Conflict with a concurrent write, retrying ({}): {}",
                        retries + 1, e.getMessage());
            }
        }
        if (!existed && store.hasCollection(collection)) {
            rules.ensureNativeIndexes(collection);
        }
    }

    private void apply(WriteBatch batch) {
        if (batch.isEmpty()) {
            return;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Applying {}", batch);
        }
        store.apply(batch);
    }

    private static boolean isRetryable(DocumentStoreException e) {
        return e.isConflict() && !(e instanceof PartialWriteException);
    }

    private static String getRuleKey(PathSegments segments) {
        if (segments.getType() == PathType.DATABASE_ROOT) {
            return ROOT_COLLECTION;
        }
        return SLASH.join(segments.getSegments());
    }

    private static List<String> belowCollection(PathSegments segments) {
        List<String> all = segments.getSegments();
        return all.subList(1, all.size());
    }

    @CheckForNull
    private static JsonNode descend(JsonNode value, List<String> keys) {
        JsonNode n = value;
        for (String k : keys) {
            if (n.isArray()) {
                Integer index = Ints.tryParse(k);
                n = index == null ? MissingNode.getInstance() : n.path(index);
            } else {
                n = n.path(k);
            }
        }
        return n.isMissingNode() || n.isNull() ? null : n;
    }

    private static void checkPayload(JsonNode value) throws InvalidDataException {
        if (value == null || value.isNull() || value.isMissingNode()) {
            throw new InvalidDataException(1, "Data cannot be null");
        }
    }

    private static FireMongoException translate(DocumentStoreException e) {
        if (e instanceof PartialWriteException) {
            PartialWriteException p = (PartialWriteException) e;
            LOG.error("Write applied partially, {} of {} steps: {}",
                    p.getAppliedSteps(), p.getTotalSteps(), e.getMessage());
            return new PartialApplicationException(1, "Write applied partially ("
                    + p.getAppliedSteps() + " of " + p.getTotalSteps()
                    + " steps), repeat the request: " + e.getMessage(),
                    p.getAppliedSteps(), p.getTotalSteps(), e);
        }
        if (e.isConflict()) {
            LOG.warn("Write conflicts with concurrent writes: {}", e.getMessage());
            return new StoreUnavailableException(2, "Concurrent update, repeat the request: "
                    + e.getMessage(), e);
        }
        if (e.isTransient()) {
            LOG.warn("Store unavailable: {}", e.getMessage());
            return new StoreUnavailableException(1, "Store unavailable: " + e.getMessage(), e);
        }
        throw e;
    }

    /**
     * Adds the operations of a write to a batch.
     */
    private interface BatchPreparation {

        void prepare(WriteBatch batch) throws FireMongoException;
    }

    /**
     * Configures and opens a {@link FireMongo}. Defaults are read from the
     * system properties.
     */
    public static class Builder {

        private DocumentStore store;

        private String mongoUri = MONGO_URI.get();

        private boolean strictIndexes = STRICT_INDEXES.get();

        private long retryBackoffMillis = RETRY_BACKOFF.get();

        private boolean logging = LOGGING.get();

        /**
         * Use the given store instead of connecting to MongoDB.
         */
        public Builder setDocumentStore(@Nonnull DocumentStore store) {
            this.store = checkNotNull(store);
            return this;
        }

        public Builder setMongoUri(@Nonnull String mongoUri) {
            this.mongoUri = checkNotNull(mongoUri);
            return this;
        }

        /**
         * Reject queries that order by a field or by value without a
         * matching index declaration.
         */
        public Builder setStrictIndexes(boolean strictIndexes) {
            this.strictIndexes = strictIndexes;
            return this;
        }

        public Builder setRetryBackoffMillis(long retryBackoffMillis) {
            this.retryBackoffMillis = retryBackoffMillis;
            return this;
        }

        /**
         * Log every store call at DEBUG level.
         */
        public Builder setLogging(boolean logging) {
            this.logging = logging;
            return this;
        }

        public FireMongo open() {
            DocumentStore s = store;
            if (s == null) {
                MongoConnection connection = new MongoConnection(mongoUri);
                s = new MongoDocumentStore(connection.getDB());
                LOG.info("Connected to {}", connection.getDB().getName());
            }
            if (logging) {
                s = new LoggingDocumentStoreWrapper(s);
            }
            s = new RetryingDocumentStoreWrapper(s, retryBackoffMillis);
            return new FireMongo(s, strictIndexes);
        }
    }
}
