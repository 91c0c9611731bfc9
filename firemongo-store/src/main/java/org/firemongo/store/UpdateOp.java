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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * An "update" operation for one document. Without an increment, applying the
 * same operation twice leaves the document in the same state as applying it
 * once. An operation with conditions is only applied if the document
 * matches all of them.
 */
public class UpdateOp {

    /**
     * The primary key field of every stored document.
     */
    public static final String ID = "_id";

    final String key;

    final boolean isNew;

    final Map<String, Operation> changes = new TreeMap<String, Operation>();

    /**
     * Key: the property, value: the expected value, null if the property
     * must be missing.
     */
    final Map<String, Object> conditions = new TreeMap<String, Object>();

    /**
     * Create an update operation for the given document.
     *
     * @param key the primary key
     * @param isNew whether the document may be created if it does not exist
     */
    public UpdateOp(@Nonnull String key, boolean isNew) {
        this.key = checkNotNull(key);
        this.isNew = isNew;
    }

    @Nonnull
    public String getKey() {
        return key;
    }

    public boolean isNew() {
        return isNew;
    }

    /**
     * Set the property.
     *
     * @param property the property name
     * @param value the value
     * @return this
     */
    public UpdateOp set(@Nonnull String property, Object value) {
        checkArgument(!ID.equals(property), "The primary key can not be modified");
        Operation op = new Operation();
        op.type = Operation.Type.SET;
        op.value = value;
        changes.put(property, op);
        return this;
    }

    /**
     * Remove the property from the document.
     *
     * @param property the property name
     * @return this
     */
    public UpdateOp unset(@Nonnull String property) {
        checkArgument(!ID.equals(property), "The primary key can not be removed");
        Operation op = new Operation();
        op.type = Operation.Type.UNSET;
        changes.put(property, op);
        return this;
    }

    /**
     * Increment the value of a property. A missing property counts as zero.
     *
     * @param property the property name
     * @param value the increment
     * @return this
     */
    public UpdateOp increment(@Nonnull String property, long value) {
        checkArgument(!ID.equals(property), "The primary key can not be modified");
        Operation op = new Operation();
        op.type = Operation.Type.INCREMENT;
        op.value = value;
        changes.put(property, op);
        return this;
    }

    /**
     * Only apply this operation if the property has the given value.
     *
     * @param property the property name
     * @param value the expected value, or null if the property must be
     *            missing (or the document must not exist)
     * @return this
     */
    public UpdateOp equals(@Nonnull String property, @CheckForNull Object value) {
        checkArgument(!ID.equals(property), "Conditions on the primary key are not supported");
        conditions.put(property, value);
        return this;
    }

    @Nonnull
    public Map<String, Object> getConditions() {
        return Collections.unmodifiableMap(conditions);
    }

    public boolean hasConditions() {
        return !conditions.isEmpty();
    }

    @Nonnull
    public Map<String, Operation> getChanges() {
        return Collections.unmodifiableMap(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    @Override
    public String toString() {
        String s = "key: " + key + " " + (isNew ? "upsert" : "update") + " " + changes;
        return conditions.isEmpty() ? s : s + " if " + conditions;
    }

    /**
     * An operation for a given property within a document.
     */
    public static class Operation {

        /**
         * The operation type.
         */
        public enum Type {

            /**
             * Set the value.
             * The sub-key is not used.
             */
            SET,

            /**
             * Remove the property.
             * The sub-key and value are not used.
             */
            UNSET,

            /**
             * Increment the Long value with the provided Long value.
             * The sub-key is not used.
             */
            INCREMENT

        }

        Type type;

        Object value;

        public Type getType() {
            return type;
        }

        public Object getValue() {
            return value;
        }

        @Override
        public String toString() {
            return type + " " + value;
        }

    }

}
