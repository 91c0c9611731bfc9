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
package org.firemongo.store.util;

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.store.DocumentStore;
import org.firemongo.store.DocumentStoreException;
import org.firemongo.store.UpdateOp;
import org.firemongo.store.WriteBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Implements a <code>DocumentStore</code> wrapper and logs all calls, in a
 * form that reads like a replayable script.
 */
public class LoggingDocumentStoreWrapper implements DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(LoggingDocumentStoreWrapper.class);

    private final DocumentStore store;

    public LoggingDocumentStoreWrapper(DocumentStore store) {
        this.store = store;
    }

    @Override
    public Map<String, Object> find(String collection, String key) {
        try {
            logMethod("find", collection, key);
            return logResult(store.find(collection, key));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> query(String collection,
                                           @CheckForNull String fromKey,
                                           @CheckForNull String toKey,
                                           int limit) {
        try {
            logMethod("query", collection, fromKey, toKey, limit);
            return logResult(store.query(collection, fromKey, toKey, limit));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> query(String collection, String property,
                                           @CheckForNull Object fromValue,
                                           @CheckForNull Object toValue,
                                           boolean descending, int limit) {
        try {
            logMethod("query", collection, property, fromValue, toValue, descending, limit);
            return logResult(store.query(collection, property, fromValue, toValue, descending, limit));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public long count(String collection) {
        try {
            logMethod("count", collection);
            return logResult(store.count(collection));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public boolean hasCollection(String collection) {
        try {
            logMethod("hasCollection", collection);
            return logResult(store.hasCollection(collection));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Nonnull
    @Override
    public Set<String> getCollectionNames() {
        try {
            logMethod("getCollectionNames");
            return logResult(store.getCollectionNames());
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public void createCollection(String collection) {
        try {
            logMethod("createCollection", collection);
            store.createCollection(collection);
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public void dropCollection(String collection) {
        try {
            logMethod("dropCollection", collection);
            store.dropCollection(collection);
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public void removeAll(String collection) {
        try {
            logMethod("removeAll", collection);
            store.removeAll(collection);
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public void remove(String collection, String key) {
        try {
            logMethod("remove", collection, key);
            store.remove(collection, key);
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public Map<String, Object> createOrUpdate(String collection, UpdateOp update)
            throws DocumentStoreException {
        try {
            logMethod("createOrUpdate", collection, update);
            return logResult(store.createOrUpdate(collection, update));
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public void ensureIndex(String collection, String property) {
        try {
            logMethod("ensureIndex", collection, property);
            store.ensureIndex(collection, property);
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public boolean supportsTransactions() {
        return store.supportsTransactions();
    }

    @Override
    public void apply(WriteBatch batch) {
        try {
            logMethod("apply", batch);
            store.apply(batch);
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    @Override
    public void dispose() {
        try {
            logMethod("dispose");
            store.dispose();
        } catch (RuntimeException e) {
            logException(e);
            throw e;
        }
    }

    private static void logMethod(String methodName, Object... args) {
        if (!LOG.isDebugEnabled()) {
            return;
        }
        StringBuilder buff = new StringBuilder("ds");
        buff.append('.').append(methodName).append('(');
        for (int i = 0; i < args.length; i++) {
            if (i > 0) {
                buff.append(", ");
            }
            buff.append(quote(args[i]));
        }
        buff.append(");");
        LOG.debug(buff.toString());
    }

    public static String quote(Object o) {
        if (o == null) {
            return "null";
        } else if (o instanceof String) {
            String s = (String) o;
            return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return o.toString();
    }

    private static void logException(Exception e) {
        LOG.debug("// exception: " + e.toString());
    }

    private static <T> T logResult(T result) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("// " + quote(result));
        }
        return result;
    }
}
