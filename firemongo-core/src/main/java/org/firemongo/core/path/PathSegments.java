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

import static com.google.common.base.Preconditions.checkArgument;

import java.util.List;

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;

/**
 * The validated segments of a path: the collection, the document id and the
 * keys inside the document. Instances are immutable.
 */
public final class PathSegments {

    private static final Joiner DOT = Joiner.on('.');

    private static final Joiner SLASH = Joiner.on('/');

    public static final PathSegments ROOT = new PathSegments(ImmutableList.<String>of());

    private final ImmutableList<String> segments;

    private final PathType type;

    PathSegments(List<String> segments) {
        this.segments = ImmutableList.copyOf(segments);
        this.type = PathType.forDepth(segments.size());
    }

    @Nonnull
    public PathType getType() {
        return type;
    }

    /**
     * @return the collection name, or the empty string for the database root
     */
    @Nonnull
    public String getCollection() {
        return segments.isEmpty() ? "" : segments.get(0);
    }

    @CheckForNull
    public String getDocumentId() {
        return segments.size() < 2 ? null : segments.get(1);
    }

    /**
     * @return the keys inside the document, possibly empty
     */
    @Nonnull
    public List<String> getNestedKeys() {
        return segments.size() <= 2 ? ImmutableList.<String>of() : segments.subList(2, segments.size());
    }

    /**
     * @return the nested keys joined with dots, or the empty string
     */
    @Nonnull
    public String getNestedKeyPath() {
        return DOT.join(getNestedKeys());
    }

    @Nonnull
    public List<String> getSegments() {
        return segments;
    }

    public int getDepth() {
        return segments.size();
    }

    /**
     * Get the path of a child. The name must be a valid key.
     *
     * @param name the child name
     * @return the child path
     */
    @Nonnull
    public PathSegments child(@Nonnull String name) {
        checkArgument(PathResolver.isValidKey(name), "Invalid key: %s", name);
        return new PathSegments(ImmutableList.<String>builder().addAll(segments).add(name).build());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        } else if (o instanceof PathSegments) {
            return segments.equals(((PathSegments) o).segments);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return "/" + SLASH.join(segments);
    }
}
