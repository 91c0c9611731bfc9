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
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;
import java.util.TreeSet;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.bson.types.Decimal128;
import org.firemongo.store.UpdateOp.Operation;
import org.firemongo.store.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mongodb.BasicDBObject;
import com.mongodb.DB;
import com.mongodb.DBCollection;
import com.mongodb.DBCursor;
import com.mongodb.DBObject;
import com.mongodb.DuplicateKeyException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoException;
import com.mongodb.MongoNodeIsRecoveringException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoServerException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.QueryBuilder;

/**
 * A document store that uses MongoDB as the backend. Each logical
 * collection maps to a MongoDB collection of the same name.
 * <p>
 * Batches are applied one step at a time, see
 * {@link WriteBatch#applySequentially(DocumentStore)}.
 */
public class MongoDocumentStore implements DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(MongoDocumentStore.class);

    /**
     * Error code of the "NamespaceExists" server error.
     */
    private static final int NAMESPACE_EXISTS = 48;

    /**
     * Error code of a duplicate key.
     */
    private static final int DUPLICATE_KEY = 11000;

    private final DB db;

    public MongoDocumentStore(DB db) {
        this.db = db;
    }

    @CheckForNull
    @Override
    public Map<String, Object> find(String collection, String key) {
        log("find", collection, key);
        try {
            DBObject doc = db.getCollection(collection).findOne(getByKeyQuery(key));
            if (doc == null) {
                return null;
            }
            return convertFromDBObject(doc);
        } catch (MongoException e) {
            throw convert(e, "Failed to read " + collection + "/" + key);
        }
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> query(String collection, @CheckForNull String fromKey,
                                           @CheckForNull String toKey, int limit) {
        log("query", collection, fromKey, toKey, limit);
        QueryBuilder queryBuilder = QueryBuilder.start(UpdateOp.ID);
        if (fromKey != null) {
            queryBuilder.greaterThanEquals(fromKey);
        }
        if (toKey != null) {
            queryBuilder.lessThan(toKey);
        }
        DBObject query = fromKey == null && toKey == null
                ? new BasicDBObject() : queryBuilder.get();
        List<Map<String, Object>> list = new ArrayList<Map<String, Object>>();
        DBCursor cursor = null;
        try {
            cursor = db.getCollection(collection).find(query)
                    .sort(new BasicDBObject(UpdateOp.ID, 1));
            for (int i = 0; i < limit && cursor.hasNext(); i++) {
                list.add(convertFromDBObject(cursor.next()));
            }
            return list;
        } catch (MongoException e) {
            throw convert(e, "Failed to query " + collection);
        } finally {
            if (cursor != null) {
                cursor.close();
            }
        }
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> query(String collection, String property,
                                           @CheckForNull Object fromValue,
                                           @CheckForNull Object toValue,
                                           boolean descending, int limit) {
        log("query", collection, property, fromValue, toValue, descending, limit);
        List<Map<String, Object>> list = new ArrayList<Map<String, Object>>();
        if (limit <= 0) {
            return list;
        }
        QueryBuilder queryBuilder = QueryBuilder.start(property).exists(true);
        if (fromValue != null) {
            queryBuilder.greaterThanEquals(fromValue);
        }
        if (toValue != null) {
            queryBuilder.lessThanEquals(toValue);
        }
        DBObject sort = new BasicDBObject(property, descending ? -1 : 1).append(UpdateOp.ID, 1);
        DBCursor cursor = null;
        try {
            cursor = db.getCollection(collection).find(queryBuilder.get()).sort(sort);
            if (limit < Integer.MAX_VALUE) {
                cursor.limit(limit);
            }
            while (cursor.hasNext()) {
                list.add(convertFromDBObject(cursor.next()));
            }
            return list;
        } catch (MongoException e) {
            throw convert(e, "Failed to query " + collection + " by " + property);
        } finally {
            if (cursor != null) {
                cursor.close();
            }
        }
    }

    @Override
    public long count(String collection) {
        try {
            return db.getCollection(collection).count();
        } catch (MongoException e) {
            throw convert(e, "Failed to count " + collection);
        }
    }

    @Override
    public boolean hasCollection(String collection) {
        try {
            return db.collectionExists(collection);
        } catch (MongoException e) {
            throw convert(e, "Failed to look up collection " + collection);
        }
    }

    @Nonnull
    @Override
    public Set<String> getCollectionNames() {
        try {
            Set<String> names = new TreeSet<String>();
            for (String name : db.getCollectionNames()) {
                if (!name.startsWith("system.")) {
                    names.add(name);
                }
            }
            return names;
        } catch (MongoException e) {
            throw convert(e, "Failed to list collections");
        }
    }

    @Override
    public void createCollection(String collection) {
        log("createCollection", collection);
        try {
            if (!db.collectionExists(collection)) {
                db.createCollection(collection, new BasicDBObject());
            }
        } catch (MongoCommandException e) {
            if (e.getErrorCode() != NAMESPACE_EXISTS) {
                throw convert(e, "Failed to create collection " + collection);
            }
            LOG.debug("Collection {} was created concurrently", collection);
        } catch (MongoException e) {
            throw convert(e, "Failed to create collection " + collection);
        }
    }

    @Override
    public void dropCollection(String collection) {
        log("dropCollection", collection);
        try {
            db.getCollection(collection).drop();
        } catch (MongoException e) {
            throw convert(e, "Failed to drop collection " + collection);
        }
    }

    @Override
    public void removeAll(String collection) {
        log("removeAll", collection);
        try {
            db.getCollection(collection).remove(new BasicDBObject());
        } catch (MongoException e) {
            throw convert(e, "Failed to clear collection " + collection);
        }
    }

    @Override
    public void remove(String collection, String key) {
        log("remove", collection, key);
        try {
            db.getCollection(collection).remove(getByKeyQuery(key));
        } catch (MongoException e) {
            throw convert(e, "Remove failed: " + collection + "/" + key);
        }
    }

    @CheckForNull
    @Override
    public Map<String, Object> createOrUpdate(String collection, UpdateOp updateOp) {
        log("createOrUpdate", collection, updateOp);
        DBCollection dbCollection = db.getCollection(collection);
        DBObject query = getByKeyQuery(updateOp.getKey());
        for (Entry<String, Object> c : updateOp.getConditions().entrySet()) {
            if (c.getValue() == null) {
                query.put(c.getKey(), new BasicDBObject("$exists", false));
            } else {
                query.put(c.getKey(), c.getValue());
            }
        }

        BasicDBObject setUpdates = new BasicDBObject();
        BasicDBObject unsetUpdates = new BasicDBObject();
        BasicDBObject incUpdates = new BasicDBObject();
        for (Entry<String, Operation> entry : updateOp.changes.entrySet()) {
            Operation op = entry.getValue();
            switch (op.type) {
                case SET: {
                    setUpdates.append(entry.getKey(), op.value);
                    break;
                }
                case UNSET: {
                    unsetUpdates.append(entry.getKey(), "");
                    break;
                }
                case INCREMENT: {
                    incUpdates.append(entry.getKey(), op.value);
                    break;
                }
            }
        }
        try {
            if (setUpdates.isEmpty() && unsetUpdates.isEmpty() && incUpdates.isEmpty()) {
                return touch(dbCollection, query, updateOp);
            }
            BasicDBObject update = new BasicDBObject();
            if (!setUpdates.isEmpty()) {
                update.append("$set", setUpdates);
            }
            if (!unsetUpdates.isEmpty()) {
                update.append("$unset", unsetUpdates);
            }
            if (!incUpdates.isEmpty()) {
                update.append("$inc", incUpdates);
            }
            DBObject oldDoc = dbCollection.findAndModify(query, null /*fields*/,
                    null /*sort*/, false /*remove*/, update, false /*returnNew*/,
                    updateOp.isNew() /*upsert*/);
            if (oldDoc == null) {
                if (!updateOp.isNew()) {
                    if (updateOp.hasConditions()
                            && dbCollection.findOne(getByKeyQuery(updateOp.getKey())) != null) {
                        throw conflict(collection, updateOp, null);
                    }
                    throw new DocumentStoreException("Document does not exist: " + updateOp.getKey());
                }
                return null;
            }
            return convertFromDBObject(oldDoc);
        } catch (MongoServerException e) {
            // the upsert of a document that exists but does not match the conditions
            if (updateOp.hasConditions() && e.getCode() == DUPLICATE_KEY) {
                throw conflict(collection, updateOp, e);
            }
            throw convert(e, "Update failed: " + collection + "/" + updateOp.getKey());
        } catch (MongoException e) {
            throw convert(e, "Update failed: " + collection + "/" + updateOp.getKey());
        }
    }

    /**
     * An update without changes only makes sure the document exists.
     */
    private static Map<String, Object> touch(DBCollection dbCollection, DBObject query, UpdateOp updateOp) {
        DBObject oldDoc = dbCollection.findOne(query);
        if (oldDoc != null) {
            return convertFromDBObject(oldDoc);
        }
        if (!updateOp.isNew()) {
            throw new DocumentStoreException("Document does not exist: " + updateOp.getKey());
        }
        try {
            dbCollection.insert(new BasicDBObject(UpdateOp.ID, updateOp.getKey()));
        } catch (DuplicateKeyException e) {
            if (updateOp.hasConditions()) {
                throw conflict(dbCollection.getName(), updateOp, e);
            }
            LOG.debug("Document {} was created concurrently", updateOp.getKey());
        }
        return null;
    }

    private static DocumentStoreException conflict(String collection, UpdateOp updateOp,
                                                   @CheckForNull Throwable cause) {
        return new DocumentStoreException("Conditions do not match: " + collection + "/"
                + updateOp.getKey() + " " + updateOp.getConditions(),
                cause, DocumentStoreException.Type.CONFLICT);
    }

    @Override
    public void ensureIndex(String collection, String property) {
        log("ensureIndex", collection, property);
        try {
            db.getCollection(collection).createIndex(new BasicDBObject(property, 1));
        } catch (MongoException e) {
            throw convert(e, "Failed to create index on " + collection + "." + property);
        }
    }

    @Override
    public boolean supportsTransactions() {
        return false;
    }

    @Override
    public void apply(WriteBatch batch) {
        log("apply", batch);
        batch.applySequentially(this);
    }

    /**
     * Convert a driver exception. Network problems, timeouts and elections
     * are reported as {@link DocumentStoreException.Type#TRANSIENT}.
     */
    static DocumentStoreException convert(MongoException e, String message) {
        DocumentStoreException.Type type = DocumentStoreException.Type.GENERIC;
        if (e instanceof MongoSocketException
                || e instanceof MongoTimeoutException
                || e instanceof MongoNotPrimaryException
                || e instanceof MongoNodeIsRecoveringException) {
            type = DocumentStoreException.Type.TRANSIENT;
        }
        return new DocumentStoreException(message + ": " + e.getMessage(), e, type);
    }

    static Map<String, Object> convertFromDBObject(DBObject n) {
        Map<String, Object> copy = Utils.newMap();
        for (String key : n.keySet()) {
            copy.put(key, convertValue(n.get(key)));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Object convertValue(Object o) {
        if (o instanceof Map) {
            Map<String, Object> map = new LinkedHashMap<String, Object>();
            for (Entry<String, Object> e : ((Map<String, Object>) o).entrySet()) {
                map.put(e.getKey(), convertValue(e.getValue()));
            }
            return map;
        } else if (o instanceof List) {
            List<Object> source = (List<Object>) o;
            List<Object> list = new ArrayList<Object>(source.size());
            for (Object x : source) {
                list.add(convertValue(x));
            }
            return list;
        } else if (o instanceof Decimal128) {
            return ((Decimal128) o).bigDecimalValue().doubleValue();
        } else if (o instanceof Integer) {
            return ((Integer) o).longValue();
        }
        return o;
    }

    private static DBObject getByKeyQuery(String key) {
        return QueryBuilder.start(UpdateOp.ID).is(key).get();
    }

    @Override
    public void dispose() {
        db.getMongo().close();
    }

    private static void log(String message, Object... args) {
        if (LOG.isDebugEnabled()) {
            String argList = Arrays.toString(args);
            if (argList.length() > 10000) {
                argList = argList.length() + ": " + argList;
            }
            LOG.debug(message + argList);
        }
    }

}
