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
package org.firemongo.store.util;

import com.mongodb.DB;
import com.mongodb.MongoClient;
import com.mongodb.MongoClientURI;

/**
 * The {@code MongoConnection} abstracts connection to the {@code MongoDB}.
 */
public class MongoConnection {

    private static final String DEFAULT_DATABASE = "firemongo";

    private final DB db;
    private final MongoClient mongo;

    /**
     * Constructs a new connection using the given MongoDB URI. If the URI
     * does not name a database, {@code firemongo} is used.
     *
     * @param uri the MongoDB connection string
     */
    public MongoConnection(String uri) {
        MongoClientURI clientUri = new MongoClientURI(uri);
        mongo = new MongoClient(clientUri);
        String database = clientUri.getDatabase();
        db = mongo.getDB(database == null ? DEFAULT_DATABASE : database);
    }

    /**
     * Constructs a new {@code MongoConnection}.
     *
     * @param host The host address.
     * @param port The port.
     * @param database The database name.
     */
    public MongoConnection(String host, int port, String database) {
        this("mongodb://" + host + ":" + port + "/" + database);
    }

    /**
     * Returns the {@link DB}.
     *
     * @return The {@link DB}.
     */
    public DB getDB() {
        return db;
    }

    /**
     * Closes the underlying Mongo instance
     */
    public void close() {
        mongo.close();
    }
}
