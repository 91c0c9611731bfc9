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

/**
 * Thrown when a {@link WriteBatch} failed after some of its steps were
 * already applied. The batch must not be retried blindly.
 */
public class PartialWriteException extends DocumentStoreException {

    private static final long serialVersionUID = -2166348735291577503L;

    private final int appliedSteps;

    private final int totalSteps;

    public PartialWriteException(int appliedSteps, int totalSteps,
                                 WriteBatch.Step failedStep, Throwable cause) {
        super(String.format("Batch failed at step %d of %d (%s), %d step(s) already applied",
                appliedSteps + 1, totalSteps, failedStep, appliedSteps), cause, Type.GENERIC);
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
