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

import static com.google.common.base.Preconditions.checkNotNull;

import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads one configuration value from the system properties.
 * <ul>
 * <li>TRACE level logging of reading the property
 * <li>ERROR level logging when the value does not parse or is rejected by
 * the validator, in which case the default is used
 * <li>INFO level logging when the value differs from the default
 * </ul>
 * Supported types are {@link Boolean}, {@link Integer}, {@link Long} and
 * {@link String}. Booleans must be spelled {@code true} or {@code false}.
 */
public class SystemPropertySupplier<T> implements Supplier<T> {

    private static final Logger LOG = LoggerFactory.getLogger(SystemPropertySupplier.class);

    private static final String HIDDEN = "*****";

    private final String propName;
    private final T defaultValue;
    private final Function<String, T> parser;

    private Logger log = LOG;
    private boolean hideValue;
    private Predicate<T> validator = (a) -> true;
    private Function<String, String> sysPropReader = System::getProperty;

    private SystemPropertySupplier(@Nonnull String propName, @Nonnull T defaultValue) {
        this.propName = checkNotNull(propName, "propertyName must be non-null");
        this.defaultValue = checkNotNull(defaultValue, "defaultValue must be non-null");
        this.parser = getValueParser(defaultValue);
    }

    /**
     * Create it for a given property name and default value.
     */
    public static <U> SystemPropertySupplier<U> create(@Nonnull String propName, @Nonnull U defaultValue) {
        return new SystemPropertySupplier<U>(propName, defaultValue);
    }

    /**
     * Specify the {@link Logger} to log to (defaults to this classes logger otherwise).
     */
    public SystemPropertySupplier<T> loggingTo(@Nonnull Logger log) {
        this.log = checkNotNull(log);
        return this;
    }

    /**
     * Specify a validation expression.
     */
    public SystemPropertySupplier<T> validateWith(@Nonnull Predicate<T> validator) {
        this.validator = checkNotNull(validator);
        return this;
    }

    /**
     * Hide the value in log messages, for connection strings with
     * credentials.
     */
    public SystemPropertySupplier<T> hideValue() {
        this.hideValue = true;
        return this;
    }

    /**
     * <em>For unit testing</em>: specify a function to read system properties
     * (overriding default of {@code System.getProperty(String}).
     */
    SystemPropertySupplier<T> usingSystemPropertyReader(@Nonnull Function<String, String> sysPropReader) {
        this.sysPropReader = checkNotNull(sysPropReader);
        return this;
    }

    /**
     * @return the value of the system property, or the default
     */
    @Override
    public T get() {
        T returnValue = defaultValue;
        String value = sysPropReader.apply(propName);
        if (value == null) {
            log.trace("System property {} not set", propName);
            return returnValue;
        }
        String displayedValue = hideValue ? HIDDEN : value;
        log.trace("System property {} set to '{}'", propName, displayedValue);
        try {
            T v = parser.apply(value.trim());
            if (!validator.test(v)) {
                log.error("Ignoring invalid value '{}' for system property {}", displayedValue, propName);
            } else {
                returnValue = v;
            }
        } catch (IllegalArgumentException ex) {
            log.error("Ignoring malformed value '{}' for system property {}", displayedValue, propName);
        }
        if (!returnValue.equals(defaultValue)) {
            log.info("System property {} found to be '{}'", propName,
                    hideValue ? HIDDEN : returnValue);
        }
        return returnValue;
    }

    @SuppressWarnings("unchecked")
    private static <T> Function<String, T> getValueParser(T defaultValue) {
        if (defaultValue instanceof Boolean) {
            return v -> (T) parseBoolean(v);
        } else if (defaultValue instanceof Integer) {
            return v -> (T) Integer.valueOf(v);
        } else if (defaultValue instanceof Long) {
            return v -> (T) Long.valueOf(v);
        } else if (defaultValue instanceof String) {
            return v -> (T) v;
        } else {
            throw new IllegalArgumentException(
                    String.format("expects a defaultValue of Boolean, Integer, Long, or String, but got: %s",
                            defaultValue.getClass()));
        }
    }

    private static Boolean parseBoolean(String v) {
        if ("true".equalsIgnoreCase(v)) {
            return Boolean.TRUE;
        } else if ("false".equalsIgnoreCase(v)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("Not a boolean: " + v);
    }
}
