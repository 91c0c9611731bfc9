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

import java.util.Map;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.store.UpdateOp;

/**
 * Field names and helpers for the documents the mapper stores. A stored
 * document looks like {@code {_id: key, _fm_id: key, _fm_val: value}}.
 */
public final class StoredDocument {

    /**
     * The primary key, equal to {@link #FM_ID}.
     */
    public static final String ID = UpdateOp.ID;

    /**
     * The logical key of the entry.
     */
    public static final String FM_ID = "_fm_id";

    /**
     * The value of the entry.
     */
    public static final String FM_VAL = "_fm_val";

    /**
     * Key and field name of the document that holds a scalar written at
     * collection level.
     */
    public static final String ROOT_KEY = "__fm_root__";

    /**
     * The number of updates to a document, used to detect concurrent
     * read-modify-write cycles.
     */
    public static final String MOD_COUNT = "_modCount";

    private StoredDocument() {
    }

    /**
     * Create the upsert operation that stores a value under a key.
     *
     * @param key the key
     * @param storeValue the value, in store form
     * @return the update operation
     */
    @Nonnull
    public static UpdateOp newDocument(@Nonnull String key, @Nonnull Object storeValue) {
        return new UpdateOp(key, true)
                .set(FM_ID, key)
                .set(FM_VAL, storeValue)
                .increment(MOD_COUNT, 1);
    }

    /**
     * Create the upsert operation that stores a value under a key, but only
     * if the document was not changed since it was read.
     *
     * @param key the key
     * @param storeValue the value, in store form
     * @param modCount the {@link #MOD_COUNT} of the document when it was
     *            read, null if it did not exist or had none
     * @return the conditional update operation
     */
    @Nonnull
    public static UpdateOp newDocument(@Nonnull String key, @Nonnull Object storeValue,
                                       @CheckForNull Object modCount) {
        return newDocument(key, storeValue).equals(MOD_COUNT, modCount);
    }

    /**
     * Create the upsert operation that stores a value at collection level.
     *
     * @param storeValue the value, in store form
     * @return the update operation
     */
    @Nonnull
    public static UpdateOp newRootDocument(@Nonnull Object storeValue) {
        return new UpdateOp(ROOT_KEY, true)
                .set(ROOT_KEY, storeValue)
                .increment(MOD_COUNT, 1);
    }

    @CheckForNull
    public static Object getModCount(@CheckForNull Map<String, Object> doc) {
        return doc == null ? null : doc.get(MOD_COUNT);
    }

    /**
     * @param doc a stored document
     * @return the logical key
     */
    @Nonnull
    public static String getKey(@Nonnull Map<String, Object> doc) {
        Object id = doc.get(FM_ID);
        if (id == null) {
            id = doc.get(ID);
        }
        return String.valueOf(id);
    }

    @CheckForNull
    public static Object getValue(@CheckForNull Map<String, Object> doc) {
        return doc == null ? null : doc.get(FM_VAL);
    }

}
