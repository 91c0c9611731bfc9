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
 * Thrown when a write that consists of several store operations failed
 * after some of them were already applied. Repeating the same request
 * converges to the intended state, but it is never repeated automatically.
 */
public class PartialApplicationException extends FireMongoException {

    private static final long serialVersionUID = 1573326970844718662L;

    private final int appliedSteps;

    private final int totalSteps;

    public PartialApplicationException(int code, String message,
                                       int appliedSteps, int totalSteps, Throwable cause) {
        super(PARTIAL, code, message, cause);
        this.appliedSteps = appliedSteps;
        this.totalSteps = totalSteps;
    }

    public int getAppliedSteps() {
        return appliedSteps;
    }

    public int getTotalSteps() {
        return totalSteps;
    }
}
