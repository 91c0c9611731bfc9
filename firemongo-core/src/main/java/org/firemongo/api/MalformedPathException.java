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

/**
 * Thrown when a path can not be parsed, for example because it contains an empty segment.
 */
public class MalformedPathException extends FireMongoException {

    private static final long serialVersionUID = 4418290563145581760L;

    public MalformedPathException(int code, String message) {
        super(PATH, code, message);
    }

    public MalformedPathException(int code, String message, Throwable cause) {
        super(PATH, code, message, cause);
    }
}
