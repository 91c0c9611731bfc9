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
package org.firemongo.api;

import static java.lang.String.format;

import javax.annotation.Nonnull;

/**
 * Main exception thrown by the methods of {@code FireMongo} indicating that
 * a request could not be processed. Every exception carries a type name and
 * a type-specific numeric code, and formats its message as
 * {@code FireMongo<type><code>: <detail>}.
 */
public class FireMongoException extends Exception {

    /**
     * Source name for exceptions thrown by FireMongo.
     */
    public static final String FIREMONGO = "FireMongo";

    /**
     * Type name for malformed paths.
     */
    public static final String PATH = "Path";

    /**
     * Type name for paths that address a reserved collection.
     */
    public static final String RESERVED_NAME = "ReservedName";

    /**
     * Type name for ambiguous scalar-versus-object writes.
     */
    public static final String ROOT_CONFLICT = "RootConflict";

    /**
     * Type name for malformed index rules.
     */
    public static final String INDEX = "Index";

    /**
     * Type name for invalid query parameter combinations.
     */
    public static final String QUERY = "Query";

    /**
     * Type name for unacceptable payloads.
     */
    public static final String DATA = "Data";

    /**
     * Type name for an unreachable or failing document store.
     */
    public static final String STORE = "Store";

    /**
     * Type name for multi-step writes that were applied partially.
     */
    public static final String PARTIAL = "Partial";

    private static final long serialVersionUID = -5173904263212749811L;

    private final String type;

    private final int code;

    private final String detail;

    public FireMongoException(String type, int code, String message, Throwable cause) {
        super(format("%s%s%04d: %s", FIREMONGO, type, code, message), cause);
        this.type = type;
        this.code = code;
        this.detail = message;
    }

    public FireMongoException(String type, int code, String message) {
        this(type, code, message, null);
    }

    /**
     * Checks whether this exception is of the given type.
     *
     * @param type type name
     * @return {@code true} iff this exception is of the given type
     */
    public boolean isOfType(String type) {
        return this.type.equals(type);
    }

    /**
     * Return the name of the type of this exception.
     *
     * @return type name
     */
    @Nonnull
    public String getType() {
        return type;
    }

    /**
     * Returns the type-specific error code of this exception.
     *
     * @return error code
     */
    public int getCode() {
        return code;
    }

    /**
     * @return the message without the type and code prefix
     */
    @Nonnull
    public String getDetail() {
        return detail;
    }
}
