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

import static com.google.common.base.Preconditions.checkArgument;

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

import com.google.common.base.Supplier;

/**
 * A <code>DocumentStore</code> wrapper that repeats an operation once when
 * it failed with a {@link DocumentStoreException.Type#TRANSIENT} exception.
 * <p>
 * Only single-document operations are repeated. A {@link WriteBatch} is
 * passed through as is: it may have been applied partially.
 */
public class RetryingDocumentStoreWrapper implements DocumentStore {

    private static final Logger LOG = LoggerFactory.getLogger(RetryingDocumentStoreWrapper.class);

    private final DocumentStore store;

    private final long backoffMillis;

    public RetryingDocumentStoreWrapper(DocumentStore store, long backoffMillis) {
        checkArgument(backoffMillis >= 0, "backoffMillis must not be negative: %s", backoffMillis);
        this.store = store;
        this.backoffMillis = backoffMillis;
    }

    @Override
    public Map<String, Object> find(final String collection, final String key) {
        return execute("find", () -> store.find(collection, key));
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> query(final String collection,
                                           @CheckForNull final String fromKey,
                                           @CheckForNull final String toKey,
                                           final int limit) {
        return execute("query", () -> store.query(collection, fromKey, toKey, limit));
    }

    @Nonnull
    @Override
    public List<Map<String, Object>> query(final String collection, final String property,
                                           @CheckForNull final Object fromValue,
                                           @CheckForNull final Object toValue,
                                           final boolean descending, final int limit) {
        return execute("query", () -> store.query(collection, property, fromValue, toValue, descending, limit));
    }

    @Override
    public long count(final String collection) {
        return execute("count", () -> store.count(collection));
    }

    @Override
    public boolean hasCollection(final String collection) {
        return execute("hasCollection", () -> store.hasCollection(collection));
    }

    @Nonnull
    @Override
    public Set<String> getCollectionNames() {
        return execute("getCollectionNames", store::getCollectionNames);
    }

    @Override
    public void createCollection(final String collection) {
        execute("createCollection", () -> {
            store.createCollection(collection);
            return null;
        });
    }

    @Override
    public void dropCollection(final String collection) {
        execute("dropCollection", () -> {
            store.dropCollection(collection);
            return null;
        });
    }

    @Override
    public void removeAll(final String collection) {
        execute("removeAll", () -> {
            store.removeAll(collection);
            return null;
        });
    }

    @Override
    public void remove(final String collection, final String key) {
        execute("remove", () -> {
            store.remove(collection, key);
            return null;
        });
    }

    @Override
    public Map<String, Object> createOrUpdate(final String collection, final UpdateOp update) {
        return execute("createOrUpdate", () -> store.createOrUpdate(collection, update));
    }

    @Override
    public void ensureIndex(final String collection, final String property) {
        execute("ensureIndex", () -> {
            store.ensureIndex(collection, property);
            return null;
        });
    }

    @Override
    public boolean supportsTransactions() {
        return store.supportsTransactions();
    }

    @Override
    public void apply(WriteBatch batch) {
        store.apply(batch);
    }

    @Override
    public void dispose() {
        store.dispose();
    }

    private <T> T execute(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DocumentStoreException e) {
            if (!e.isTransient()) {
                throw e;
            }
            LOG.warn("Transient failure in {}, retrying once in {} ms: {}",
                    operation, backoffMillis, e.getMessage());
            sleep();
            return call.get();
        }
    }

    private void sleep() {
        if (backoffMillis == 0) {
            return;
        }
        try {
            Thread.sleep(backoffMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DocumentStoreException("Interrupted while waiting to retry", e);
        }
    }

}
