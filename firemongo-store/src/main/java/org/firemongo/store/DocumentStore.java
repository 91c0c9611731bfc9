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

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The interface for the backend storage for documents.
 * <p>
 * Collections are addressed by name and come into existence either
 * explicitly ({@link #createCollection(String)}) or with the first document
 * written to them. Documents are maps keyed by their {@link UpdateOp#ID}.
 * All mutating methods are idempotent.
 */
public interface DocumentStore {

    /**
     * Get a document.
     * <p>
     * The returned map is a clone (the caller can modify it without affecting
     * the stored version).
     *
     * @param collection the collection
     * @param key the key
     * @return the map, or null if not found
     * @throws DocumentStoreException if the store could not be read
     */
    @CheckForNull
    Map<String, Object> find(String collection, String key) throws DocumentStoreException;

    /**
     * Get a list of documents ordered by key, where the key is greater than
     * or equal to a start value and less than an end value.
     *
     * @param collection the collection
     * @param fromKey the start value (including), or null for no lower bound
     * @param toKey the end value (excluding), or null for no upper bound
     * @param limit the maximum number of entries to return
     * @return the list (possibly empty)
     * @throws DocumentStoreException if the store could not be read
     */
    @Nonnull
    List<Map<String, Object>> query(String collection, @CheckForNull String fromKey,
                                    @CheckForNull String toKey, int limit)
            throws DocumentStoreException;

    /**
     * Get the documents that have a (possibly dotted) property, ordered by
     * the value of that property and then by key. A range bound only
     * matches values of its own kind: a numeric bound selects numbers, a
     * string bound strings. Values of different kinds are ordered null,
     * numbers, strings, maps, lists, booleans.
     *
     * @param collection the collection
     * @param property the property, for example {@code _fm_val.height}
     * @param fromValue the lowest value (including), or null for no lower
     *            bound
     * @param toValue the highest value (including), or null for no upper
     *            bound
     * @param descending whether the highest values come first
     * @param limit the maximum number of entries to return
     * @return the list (possibly empty)
     * @throws DocumentStoreException if the store could not be read
     */
    @Nonnull
    List<Map<String, Object>> query(String collection, String property,
                                    @CheckForNull Object fromValue, @CheckForNull Object toValue,
                                    boolean descending, int limit)
            throws DocumentStoreException;

    /**
     * @param collection the collection
     * @return the number of documents in the collection
     */
    long count(String collection) throws DocumentStoreException;

    /**
     * @param collection the collection
     * @return whether the collection exists (it may be empty)
     */
    boolean hasCollection(String collection) throws DocumentStoreException;

    /**
     * @return the names of all existing collections
     */
    @Nonnull
    Set<String> getCollectionNames() throws DocumentStoreException;

    /**
     * Create an empty collection, if it does not exist yet.
     */
    void createCollection(String collection) throws DocumentStoreException;

    /**
     * Drop a collection with all its documents, if it exists.
     */
    void dropCollection(String collection) throws DocumentStoreException;

    /**
     * Remove all documents of a collection. The collection itself stays.
     */
    void removeAll(String collection) throws DocumentStoreException;

    /**
     * Remove a document, if it exists.
     *
     * @param collection the collection
     * @param key the key
     */
    void remove(String collection, String key) throws DocumentStoreException;

    /**
     * Create or update a document. For MongoDb, this is using "findAndModify"
     * with the "upsert" flag (insert or update).
     *
     * @param collection the collection
     * @param update the update operation
     * @return the old document, or null if it did not exist
     * @throws DocumentStoreException if the operation failed; with type
     *             {@link DocumentStoreException.Type#CONFLICT} if the
     *             conditions of the update do not match
     */
    @CheckForNull
    Map<String, Object> createOrUpdate(String collection, UpdateOp update)
            throws DocumentStoreException;

    /**
     * Declare an ascending secondary index on a (possibly dotted) property.
     * Stores without secondary indexes ignore this.
     */
    void ensureIndex(String collection, String property) throws DocumentStoreException;

    /**
     * @return whether {@link #apply(WriteBatch)} is all-or-nothing
     */
    boolean supportsTransactions();

    /**
     * Apply all steps of a batch, in order. If the store supports
     * transactions, either all steps are applied or none. Otherwise the steps
     * are applied one by one, and a failure after the first step is reported
     * as a {@link PartialWriteException}.
     *
     * @param batch the batch
     * @throws DocumentStoreException if the batch could not be applied
     */
    void apply(WriteBatch batch) throws DocumentStoreException;

    /**
     * Dispose this instance.
     */
    void dispose();

}
