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
package org.firemongo.core.util;

import java.util.Random;

/**
 * Generates the names of children created by POST. A name is 20 characters
 * long: 8 characters encode the creation time in milliseconds and 12 random
 * characters follow. The alphabet is in ASCII order, so names sort by
 * creation time. Names generated within the same millisecond increment the
 * random part of the previous name.
 */
public class PushIdGenerator {

    private static final String PUSH_CHARS =
            "-0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ_abcdefghijklmnopqrstuvwxyz";

    private final Random random;

    private long lastTimestamp = -1;

    private final int[] lastRandomChars = new int[12];

    public PushIdGenerator() {
        this(new Random());
    }

    PushIdGenerator(Random random) {
        this.random = random;
    }

    /**
     * @return a new, unique name
     */
    public String newId() {
        return newId(getCurrentTimestamp());
    }

    synchronized String newId(long timestamp) {
        if (timestamp < lastTimestamp) {
            // the clock went backwards
            timestamp = lastTimestamp;
        }
        boolean duplicateTime = timestamp == lastTimestamp;
        lastTimestamp = timestamp;

        char[] timeChars = new char[8];
        long t = timestamp;
        for (int i = 7; i >= 0; i--) {
            timeChars[i] = PUSH_CHARS.charAt((int) (t % 64));
            t = t / 64;
        }
        StringBuilder id = new StringBuilder(20).append(timeChars);

        if (!duplicateTime) {
            for (int i = 0; i < 12; i++) {
                lastRandomChars[i] = random.nextInt(64);
            }
        } else {
            int i = 11;
            for (; i >= 0 && lastRandomChars[i] == 63; i--) {
                lastRandomChars[i] = 0;
            }
            if (i >= 0) {
                lastRandomChars[i]++;
            }
        }
        for (int i = 0; i < 12; i++) {
            id.append(PUSH_CHARS.charAt(lastRandomChars[i]));
        }
        return id.toString();
    }

    private static long getCurrentTimestamp() {
        return System.currentTimeMillis();
    }
}
