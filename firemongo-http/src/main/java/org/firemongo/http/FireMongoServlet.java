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
package org.firemongo.http;

import java.io.IOException;
import java.util.Map;

import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

import org.firemongo.api.FireMongoException;
import org.firemongo.api.InvalidDataException;
import org.firemongo.api.PartialApplicationException;
import org.firemongo.core.FireMongo;
import org.firemongo.core.WriteOptions;
import org.firemongo.core.query.Query;
import org.firemongo.store.DocumentStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.Maps;

/**
 * Serves the REST interface of a {@link FireMongo} instance. The path info
 * of the request is the database path; GET, PUT, PATCH, POST and DELETE
 * map to the operations of the same name. Request and response bodies are
 * JSON.
 */
public class FireMongoServlet extends HttpServlet {

    private static final long serialVersionUID = 2071534466613624085L;

    private static final Logger LOG = LoggerFactory.getLogger(FireMongoServlet.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String PATH = "firemongo.path";

    private static final String METHOD_PATCH = "PATCH";

    private static final String PRINT = "print";

    private static final String PRETTY = "pretty";

    private static final String PROMOTE = "promote";

    private transient FireMongo fireMongo;

    private boolean owner;

    /**
     * Create a servlet that opens its {@link FireMongo} on {@link #init()},
     * configured by system properties.
     */
    public FireMongoServlet() {
    }

    public FireMongoServlet(FireMongo fireMongo) {
        this.fireMongo = fireMongo;
    }

    @Override
    public void init() throws ServletException {
        if (fireMongo == null) {
            try {
                fireMongo = new FireMongo.Builder().open();
                owner = true;
            } catch (RuntimeException e) {
                throw new ServletException("Could not open the document store", e);
            }
        }
    }

    @Override
    public void destroy() {
        if (owner && fireMongo != null) {
            fireMongo.dispose();
            fireMongo = null;
        }
    }

    @Override
    protected void service(
            HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        // the container has already decoded the path info
        String path = request.getPathInfo();
        request.setAttribute(PATH, path == null ? "/" : path);
        try {
            if (METHOD_PATCH.equalsIgnoreCase(request.getMethod())) {
                doPatch(request, response);
            } else {
                super.service(request, response);
            }
        } catch (DocumentStoreException e) {
            LOG.error("{} {} failed", request.getMethod(), path, e);
            throw new ServletException(e);
        }
    }

    @Override
    protected void doGet(
            HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        try {
            Query query = Query.fromParameters(getParameters(request));
            JsonNode value = fireMongo.get(getPath(request), query);
            if (value == null) {
                send(request, response, HttpServletResponse.SC_NOT_FOUND, null);
            } else {
                send(request, response, HttpServletResponse.SC_OK, value);
            }
        } catch (FireMongoException e) {
            sendError(request, response, e);
        }
    }

    @Override
    protected void doPut(
            HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        try {
            JsonNode value = fireMongo.put(getPath(request), readBody(request), getWriteOptions(request));
            send(request, response, HttpServletResponse.SC_OK, value);
        } catch (FireMongoException e) {
            sendError(request, response, e);
        }
    }

    protected void doPatch(
            HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        try {
            JsonNode value = fireMongo.patch(getPath(request), readBody(request), getWriteOptions(request));
            send(request, response, HttpServletResponse.SC_OK, value);
        } catch (FireMongoException e) {
            sendError(request, response, e);
        }
    }

    @Override
    protected void doPost(
            HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        try {
            String name = fireMongo.post(getPath(request), readBody(request));
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            result.put("name", name);
            send(request, response, HttpServletResponse.SC_OK, result);
        } catch (FireMongoException e) {
            sendError(request, response, e);
        }
    }

    @Override
    protected void doDelete(
            HttpServletRequest request, HttpServletResponse response)
            throws ServletException, IOException {
        try {
            fireMongo.delete(getPath(request));
            send(request, response, HttpServletResponse.SC_OK, null);
        } catch (FireMongoException e) {
            sendError(request, response, e);
        }
    }

    private static String getPath(HttpServletRequest request) {
        return (String) request.getAttribute(PATH);
    }

    private static Map<String, String> getParameters(HttpServletRequest request) {
        Map<String, String> parameters = Maps.newLinkedHashMap();
        for (Map.Entry<String, String[]> e : request.getParameterMap().entrySet()) {
            String[] values = e.getValue();
            if (values != null && values.length > 0) {
                parameters.put(e.getKey(), values[0]);
            }
        }
        return parameters;
    }

    private static WriteOptions getWriteOptions(HttpServletRequest request) {
        return "true".equals(request.getParameter(PROMOTE)) ? WriteOptions.PROMOTE : WriteOptions.DEFAULT;
    }

    private static JsonNode readBody(HttpServletRequest request)
            throws IOException, InvalidDataException {
        try {
            return MAPPER.readTree(request.getInputStream());
        } catch (JsonProcessingException e) {
            throw new InvalidDataException(6, "Invalid data; couldn't parse JSON: "
                    + e.getOriginalMessage(), e);
        }
    }

    private static void send(HttpServletRequest request, HttpServletResponse response,
                             int status, JsonNode body) throws IOException {
        response.setStatus(status);
        response.setContentType("application/json");
        response.setCharacterEncoding("UTF-8");
        ObjectWriter writer = PRETTY.equals(request.getParameter(PRINT))
                ? MAPPER.writerWithDefaultPrettyPrinter() : MAPPER.writer();
        writer.writeValue(response.getOutputStream(),
                body == null ? JsonNodeFactory.instance.nullNode() : body);
    }

    private static void sendError(HttpServletRequest request, HttpServletResponse response,
                                  FireMongoException e) throws IOException {
        int status = getStatus(e);
        if (status >= HttpServletResponse.SC_INTERNAL_SERVER_ERROR) {
            LOG.warn("{} {} failed: {}", request.getMethod(), getPath(request), e.getMessage());
        } else {
            LOG.debug("{} {} rejected: {}", request.getMethod(), getPath(request), e.getMessage());
        }
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        body.put("error", e.getMessage());
        body.put("type", e.getType());
        body.put("code", e.getCode());
        if (e instanceof PartialApplicationException) {
            body.put("partial", true);
        }
        send(request, response, status, body);
    }

    static int getStatus(FireMongoException e) {
        String type = e.getType();
        if (FireMongoException.ROOT_CONFLICT.equals(type)) {
            return HttpServletResponse.SC_CONFLICT;
        } else if (FireMongoException.DATA.equals(type)) {
            return 422;
        } else if (FireMongoException.STORE.equals(type)) {
            return HttpServletResponse.SC_SERVICE_UNAVAILABLE;
        } else if (FireMongoException.PARTIAL.equals(type)) {
            return HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
        }
        return HttpServletResponse.SC_BAD_REQUEST;
    }
}
