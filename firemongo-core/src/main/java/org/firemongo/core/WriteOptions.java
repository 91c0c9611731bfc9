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
package org.firemongo.core;

/**
 * Options of a PUT or PATCH.
 */
public final class WriteOptions {

    public static final WriteOptions DEFAULT = new WriteOptions(false);

    /**
     * Allow a value that is not an object to replace all documents of a
     * collection.
     */
    public static final WriteOptions PROMOTE = new WriteOptions(true);

    private final boolean promote;

    private WriteOptions(boolean promote) {
        this.promote = promote;
    }

    public boolean isPromote() {
        return promote;
    }

    @Override
    public String toString() {
        return promote ? "promote" : "default";
    }
}
