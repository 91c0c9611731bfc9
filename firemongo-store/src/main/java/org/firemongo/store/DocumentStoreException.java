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

import javax.annotation.Nonnull;

/**
 * <code>DocumentStoreException</code> is a runtime exception for
 * {@code DocumentStore} implementations to signal unexpected problems like
 * a communication exception.
 */
public class DocumentStoreException extends RuntimeException {

    private static final long serialVersionUID = 634445274043721284L;

    public enum Type {

        /**
         * A failure that may go away when the operation is repeated, for
         * example a lost connection or a timeout.
         */
        TRANSIENT,

        /**
         * The conditions of an update did not match the stored document,
         * because it was changed concurrently.
         */
        CONFLICT,

        /**
         * Any other failure.
         */
        GENERIC
    }

    private final Type type;

    public DocumentStoreException(String message) {
        this(message, null, Type.GENERIC);
    }

    public DocumentStoreException(Throwable cause) {
        this(getMessage(cause), cause, Type.GENERIC);
    }

    public DocumentStoreException(String message, Throwable cause) {
        this(message, cause, Type.GENERIC);
    }

    public DocumentStoreException(String message, Throwable cause, Type type) {
        super(message, cause);
        this.type = type;
    }

    /**
     * Converts the given {@code Throwable} into a {@code DocumentStoreException}.
     * If the {@code Throwable} is an instance of {@code DocumentStoreException}
     * it is returned as is, otherwise a new generic exception is created.
     *
     * @param t the exception
     * @return a {@code DocumentStoreException}
     */
    public static DocumentStoreException convert(@Nonnull Throwable t) {
        return convert(t, getMessage(t));
    }

    public static DocumentStoreException convert(@Nonnull Throwable t, String msg) {
        if (t instanceof DocumentStoreException) {
            return (DocumentStoreException) t;
        }
        return new DocumentStoreException(msg, t);
    }

    @Nonnull
    public Type getType() {
        return type;
    }

    public boolean isTransient() {
        return type == Type.TRANSIENT;
    }

    public boolean isConflict() {
        return type == Type.CONFLICT;
    }

    private static String getMessage(Throwable t) {
        return t == null ? null : t.getMessage() == null ? t.toString() : t.getMessage();
    }
}
