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

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import org.firemongo.api.MalformedPathException;
import org.firemongo.api.ReservedNameException;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

/**
 * Parses slash-delimited request paths.
 * <p>
 * One leading and one trailing slash are optional, and a trailing
 * {@code .json} suffix is ignored. A segment must not be empty and must not
 * contain any of {@code . $ # [ ]} or a control character.
 */
public final class PathResolver {

    /**
     * The collection that holds the values written at the database root.
     */
    public static final String ROOT_COLLECTION = "__root__";

    /**
     * The collection that holds the index rules.
     */
    public static final String RULES_COLLECTION = "__fm_rules__";

    private static final ImmutableSet<String> RESERVED =
            ImmutableSet.of(ROOT_COLLECTION, RULES_COLLECTION);

    private static final String JSON_SUFFIX = ".json";

    private static final String ROOT_DOCUMENT = "__fm_root__";

    private PathResolver() {
        // utility class
    }

    /**
     * Resolve a data path.
     *
     * @param path the path, {@code null} and the empty string denote the root
     * @return the segments
     * @throws MalformedPathException if a segment is empty or contains an
     *             illegal character
     * @throws ReservedNameException if the collection or the document id is
     *             reserved
     */
    @Nonnull
    public static PathSegments resolve(@CheckForNull String path)
            throws MalformedPathException, ReservedNameException {
        List<String> segments = split(path);
        if (!segments.isEmpty() && RESERVED.contains(segments.get(0))) {
            throw new ReservedNameException(1,
                    "Collection name is reserved: " + segments.get(0));
        }
        if (segments.size() > 1 && ROOT_DOCUMENT.equals(segments.get(1))) {
            throw new ReservedNameException(2, "Document id is reserved: " + ROOT_DOCUMENT);
        }
        return new PathSegments(segments);
    }

    /**
     * @param path the path
     * @return whether the path addresses the index rules
     */
    public static boolean isRulesPath(@CheckForNull String path) {
        String p = normalize(path);
        return p.equals(RULES_COLLECTION) || p.startsWith(RULES_COLLECTION + "/");
    }

    /**
     * Get the rule key of a rules path: the segments after the rules
     * collection, joined with slashes.
     *
     * @param path a path for which {@link #isRulesPath(String)} is true
     * @return the rule key, or null if the path addresses all rules
     * @throws MalformedPathException if a segment is empty or invalid
     */
    @CheckForNull
    public static String resolveRulesKey(@Nonnull String path) throws MalformedPathException {
        List<String> segments = split(path);
        if (segments.isEmpty() || !RULES_COLLECTION.equals(segments.get(0))) {
            throw new MalformedPathException(3, "Not a rules path: " + path);
        }
        if (segments.size() == 1) {
            return null;
        }
        return Joiner.on('/').join(segments.subList(1, segments.size()));
    }

    /**
     * Check whether a key can be used as a path segment, a collection name,
     * a document id or a field name inside a value.
     *
     * @param key the key
     * @return true if valid
     */
    public static boolean isValidKey(@CheckForNull String key) {
        if (key == null || key.isEmpty()) {
            return false;
        }
        for (int i = 0; i < key.length(); i++) {
            char c = key.charAt(i);
            switch (c) {
                case '/':
                case '.':
                case '$':
                case '#':
                case '[':
                case ']':
                    return false;
                default:
                    if (c < 0x20 || c == 0x7f) {
                        return false;
                    }
            }
        }
        return true;
    }

    public static boolean isReserved(String collection) {
        return RESERVED.contains(collection);
    }

    private static List<String> split(String path) throws MalformedPathException {
        String p = normalize(path);
        List<String> segments = Lists.newArrayList();
        if (p.isEmpty()) {
            return segments;
        }
        for (String s : p.split("/", -1)) {
            if (s.isEmpty()) {
                throw new MalformedPathException(1, "Path may not contain empty segments: " + path);
            }
            if (!isValidKey(s)) {
                throw new MalformedPathException(2, "Invalid path segment '" + s + "': " + path);
            }
            segments.add(s);
        }
        return segments;
    }

    private static String normalize(String path) {
        String p = path == null ? "" : path;
        if (p.endsWith(JSON_SUFFIX)) {
            p = p.substring(0, p.length() - JSON_SUFFIX.length());
        }
        if (p.startsWith("/")) {
            p = p.substring(1);
        }
        if (p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        return p;
    }
}
