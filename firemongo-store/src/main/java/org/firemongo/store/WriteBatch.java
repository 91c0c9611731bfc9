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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

/**
 * An ordered list of primitive store operations that together form one
 * logical change spanning several documents or collections.
 * <p>
 * Every step is idempotent: running a batch again after a partial failure
 * converges to the same end state.
 */
public class WriteBatch {

    private final List<Step> steps = Lists.newArrayList();

    public WriteBatch createCollection(@Nonnull String collection) {
        steps.add(new Step(Step.Kind.CREATE_COLLECTION, collection, null, null));
        return this;
    }

    public WriteBatch dropCollection(@Nonnull String collection) {
        steps.add(new Step(Step.Kind.DROP_COLLECTION, collection, null, null));
        return this;
    }

    /**
     * Remove all documents but keep the (then empty) collection.
     */
    public WriteBatch removeAll(@Nonnull String collection) {
        steps.add(new Step(Step.Kind.REMOVE_ALL, collection, null, null));
        return this;
    }

    public WriteBatch remove(@Nonnull String collection, @Nonnull String key) {
        steps.add(new Step(Step.Kind.REMOVE, collection, checkNotNull(key), null));
        return this;
    }

    public WriteBatch update(@Nonnull String collection, @Nonnull UpdateOp update) {
        steps.add(new Step(Step.Kind.UPDATE, collection, update.getKey(), update));
        return this;
    }

    @Nonnull
    public List<Step> getSteps() {
        return ImmutableList.copyOf(steps);
    }

    public int size() {
        return steps.size();
    }

    public boolean isEmpty() {
        return steps.isEmpty();
    }

    /**
     * Apply every step, in order, one at a time. Stores that can not run the
     * batch atomically use this.
     *
     * @param store the target store
     * @throws PartialWriteException if a step after the first one failed
     * @throws DocumentStoreException if the first step failed
     */
    public void applySequentially(@Nonnull DocumentStore store) throws DocumentStoreException {
        int applied = 0;
        for (Step step : steps) {
            try {
                step.applyTo(store);
            } catch (RuntimeException e) {
                if (applied == 0) {
                    throw DocumentStoreException.convert(e);
                }
                throw new PartialWriteException(applied, steps.size(), step, e);
            }
            applied++;
        }
    }

    @Override
    public String toString() {
        return steps.toString();
    }

    /**
     * One primitive operation.
     */
    public static final class Step {

        public enum Kind {
            CREATE_COLLECTION,
            DROP_COLLECTION,
            REMOVE_ALL,
            REMOVE,
            UPDATE
        }

        private final Kind kind;
        private final String collection;
        private final String key;
        private final UpdateOp update;

        Step(Kind kind, String collection, String key, UpdateOp update) {
            this.kind = kind;
            this.collection = checkNotNull(collection);
            this.key = key;
            this.update = update;
        }

        @Nonnull
        public Kind getKind() {
            return kind;
        }

        @Nonnull
        public String getCollection() {
            return collection;
        }

        @CheckForNull
        public String getKey() {
            return key;
        }

        @CheckForNull
        public UpdateOp getUpdate() {
            return update;
        }

        void applyTo(DocumentStore store) {
            switch (kind) {
                case CREATE_COLLECTION:
                    store.createCollection(collection);
                    break;
                case DROP_COLLECTION:
                    store.dropCollection(collection);
                    break;
                case REMOVE_ALL:
                    store.removeAll(collection);
                    break;
                case REMOVE:
                    store.remove(collection, key);
                    break;
                case UPDATE:
                    store.createOrUpdate(collection, update);
                    break;
                default:
                    throw new IllegalStateException(kind.name());
            }
        }

        @Override
        public String toString() {
            StringBuilder buff = new StringBuilder();
            buff.append(kind).append(' ').append(collection);
            if (key != null) {
                buff.append('/').append(key);
            }
            return buff.toString();
        }
    }

}
