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
package org.firemongo.core.path;

/**
 * Classification of a resolved path by its depth.
 */
public enum PathType {

    /**
     * No segment: the whole database.
     */
    DATABASE_ROOT,

    /**
     * One segment: a collection.
     */
    COLLECTION_ROOT,

    /**
     * Two segments: one document of a collection.
     */
    DOCUMENT_ROOT,

    /**
     * Three or more segments: a value inside a document.
     */
    NESTED_PATH;

    static PathType forDepth(int depth) {
        switch (depth) {
            case 0:
                return DATABASE_ROOT;
            case 1:
                return COLLECTION_ROOT;
            case 2:
                return DOCUMENT_ROOT;
            default:
                return NESTED_PATH;
        }
    }
}
