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

import static org.junit.Assert.assertEquals;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import org.junit.Test;
import org.slf4j.Logger;

public class SystemPropertySupplierTest {

    @Test
    public void testBoolean() {
        assertEquals(Boolean.TRUE,
                SystemPropertySupplier.create("foo", Boolean.TRUE).usingSystemPropertyReader((n) -> null).get());
        assertEquals(Boolean.TRUE,
                SystemPropertySupplier.create("foo", Boolean.FALSE).usingSystemPropertyReader((n) -> "true").get());
        assertEquals(Boolean.FALSE,
                SystemPropertySupplier.create("foo", Boolean.TRUE).usingSystemPropertyReader((n) -> " false ").get());
        // anything else is malformed
        assertEquals(Boolean.FALSE,
                SystemPropertySupplier.create("foo", Boolean.FALSE).usingSystemPropertyReader((n) -> "yes").get());
    }

    @Test
    public void testLong() {
        assertEquals(Long.valueOf(100),
                SystemPropertySupplier.create("foo", 100L).usingSystemPropertyReader((n) -> null).get());
        assertEquals(Long.valueOf(250),
                SystemPropertySupplier.create("foo", 100L).usingSystemPropertyReader((n) -> "250").get());
    }

    @Test
    public void testString() {
        assertEquals("mongodb://h/db", SystemPropertySupplier.create("uri", "mongodb://localhost/firemongo")
                .usingSystemPropertyReader((n) -> "mongodb://h/db").get());
    }

    @Test
    public void testFilter() {
        Logger log = mock(Logger.class);
        long backoff = SystemPropertySupplier.create("foo", 100L).loggingTo(log)
                .usingSystemPropertyReader((n) -> "-1").validateWith(n -> n >= 0).get();
        assertEquals(100L, backoff);
        verify(log).error("Ignoring invalid value '{}' for system property {}", "-1", "foo");
    }

    @Test
    public void testNonParseable() {
        Logger log = mock(Logger.class);
        long backoff = SystemPropertySupplier.create("foo", 100L).loggingTo(log)
                .usingSystemPropertyReader((n) -> "abc").get();
        assertEquals(100L, backoff);
        verify(log).error("Ignoring malformed value '{}' for system property {}", "abc", "foo");
    }

    @Test
    public void testHidden() {
        Logger log = mock(Logger.class);
        String uri = SystemPropertySupplier.create("uri", "").hideValue().loggingTo(log)
                .usingSystemPropertyReader((n) -> "mongodb://user:secret@h/db").get();
        assertEquals("mongodb://user:secret@h/db", uri);
        verify(log).info("System property {} found to be '{}'", "uri", "*****");
        verify(log, never()).trace(anyString(), eq("uri"), eq("mongodb://user:secret@h/db"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnsupportedType() {
        SystemPropertySupplier.create("foo", new Object());
    }
}
