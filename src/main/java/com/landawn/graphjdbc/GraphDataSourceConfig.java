/*
 * Copyright (c) 2025, Haiyang Li.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.landawn.graphjdbc;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import javax.sql.DataSource;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import com.landawn.abacus.util.Configuration;
import com.landawn.abacus.util.ExceptionUtil;
import com.landawn.abacus.util.N;
import com.landawn.abacus.util.Strings;

/**
 * The {@code dataSource} element of a {@code graph-jdbc.xml} file.
 *
 * <pre>{@code
 * <graphJdbc>
 *     <dataSource name="graph" env="dev">
 *         <sqlLog>true</sqlLog>
 *         <perfLog>1000</perfLog>
 *         <queryTimeout>30</queryTimeout>
 *         <connection>
 *             <url>jdbc:sqlserver://localhost:1433;databaseName=graph</url>
 *             <user>sa</user>
 *             <password>secret</password>
 *             <minIdle>2</minIdle>
 *             <maxActive>16</maxActive>
 *         </connection>
 *     </dataSource>
 * </graphJdbc>
 * }</pre>
 */
public final class GraphDataSourceConfig extends Configuration {

    public static final String DEFAULT_RESOURCE_NAME = "graph-jdbc.xml";

    public static final String DATA_SOURCE = "dataSource";

    public static final String NAME = "name";

    public static final String ENV = "env";

    public static final String SQL_LOG = "sqlLog";

    public static final String PERF_LOG = "perfLog";

    public static final String QUERY_TIMEOUT = "queryTimeout";

    public static final int DEFAULT_QUERY_TIMEOUT = 0;

    public static final String CONNECTION = "connection";

    public static final String URL = "url";

    public static final String USER = "user";

    public static final String PASSWORD = "password";

    public static final String MIN_IDLE = "minIdle";

    public static final int DEFAULT_MIN_IDLE = 8;

    public static final String MAX_ACTIVE = "maxActive";

    public static final int DEFAULT_MAX_ACTIVE = 32;

    private Map<String, String> connectionProps;

    public GraphDataSourceConfig(final Element element, final Map<String, String> properties) {
        super(element, properties);

        if (this.getAttribute(NAME) == null) {
            throw new IllegalArgumentException("must set the 'name' attribute in 'dataSource' element. for example: <dataSource name=\"graph\" env=\"dev\">");
        }

        if (connectionProps == null || Strings.isBlank(connectionProps.get(URL))) {
            throw new IllegalArgumentException("must set the 'url' in the 'connection' element of dataSource: " + getAttribute(NAME));
        }
    }

    /**
     * Loads the first {@code dataSource} element of {@link #DEFAULT_RESOURCE_NAME}.
     *
     * @return
     */
    public static GraphDataSourceConfig load() {
        return load(DEFAULT_RESOURCE_NAME);
    }

    /**
     * Loads the first {@code dataSource} element of the named resource, looked up on the class path first
     * and then in the common configuration folders.
     *
     * @param resourceName
     * @return
     * @throws IllegalArgumentException if the resource can't be found or doesn't declare a data source
     */
    public static GraphDataSourceConfig load(final String resourceName) {
        return load(resourceName, null);
    }

    /**
     * Loads the {@code dataSource} element whose {@code env} attribute equals {@code env},
     * or the first one if {@code env} is {@code null}.
     *
     * @param resourceName
     * @param env
     * @return
     */
    public static GraphDataSourceConfig load(final String resourceName, final String env) {
        N.checkArgNotEmpty(resourceName, "resourceName");

        try (InputStream is = openResource(resourceName)) {
            return load(is, env);
        } catch (final IOException e) {
            throw ExceptionUtil.toRuntimeException(e, true);
        }
    }

    /**
     *
     * @param is
     * @param env
     * @return
     */
    public static GraphDataSourceConfig load(final InputStream is, final String env) {
        N.checkArgNotNull(is, "inputStream");

        final Document doc = Configuration.parse(is);
        final Element root = doc.getDocumentElement();

        if (DATA_SOURCE.equals(root.getNodeName())) {
            return new GraphDataSourceConfig(root, new HashMap<>());
        }

        final NodeList nodes = root.getElementsByTagName(DATA_SOURCE);

        for (int i = 0, len = nodes.getLength(); i < len; i++) {
            final Element element = (Element) nodes.item(i);

            if (env == null || env.equals(element.getAttribute(ENV))) {
                return new GraphDataSourceConfig(element, new HashMap<>());
            }
        }

        throw new IllegalArgumentException("No 'dataSource' element found" + (env == null ? "" : " for env: " + env));
    }

    private static InputStream openResource(final String resourceName) throws IOException {
        final InputStream is = GraphDataSourceConfig.class.getClassLoader().getResourceAsStream(resourceName);

        if (is != null) {
            return is;
        }

        final File file = Configuration.findFile(resourceName);

        if (file == null || !file.exists()) {
            throw new IllegalArgumentException("No configuration file found by name: " + resourceName);
        }

        return new FileInputStream(file);
    }

    public String name() {
        return getAttribute(NAME);
    }

    public String env() {
        return getAttribute(ENV);
    }

    public Map<String, String> getConnectionProps() {
        return connectionProps;
    }

    public int queryTimeout() {
        return getInt(getAttributes(), QUERY_TIMEOUT, DEFAULT_QUERY_TIMEOUT);
    }

    public boolean isSqlLogEnabled() {
        return Boolean.parseBoolean(getAttribute(SQL_LOG));
    }

    /**
     * @return the perf-log threshold in milliseconds, or -1 if perf logging isn't configured
     */
    public long perfLogThreshold() {
        final String value = getAttribute(PERF_LOG);

        return Strings.isBlank(value) ? -1 : Long.parseLong(value.trim());
    }

    /**
     * Creates a HikariCP pool from the {@code connection} element.
     *
     * @return
     */
    public DataSource createDataSource() {
        return GraphJdbcUtil.createHikariDataSource(connectionProps.get(URL), connectionProps.get(USER), connectionProps.get(PASSWORD),
                getInt(connectionProps, MIN_IDLE, DEFAULT_MIN_IDLE), getInt(connectionProps, MAX_ACTIVE, DEFAULT_MAX_ACTIVE));
    }

    /**
     * Creates a pool with {@link #createDataSource()} and wraps it in a context carrying the configured query timeout.
     *
     * @return
     */
    public ExecutionContext createExecutionContext() {
        return ExecutionContext.of(createDataSource()).withTimeout(queryTimeout());
    }

    /**
     * Applies {@code sqlLog} and {@code perfLog} to the SQL log switches of the current thread.
     */
    public void applySqlLogSettings() {
        if (isSqlLogEnabled()) {
            GraphJdbcUtil.enableSqlLog();
        } else {
            GraphJdbcUtil.disableSqlLog();
        }

        final long perfLog = perfLogThreshold();

        if (perfLog >= 0) {
            GraphJdbcUtil.setMinExecutionTimeForSqlPerfLog(perfLog);
        }
    }

    private static int getInt(final Map<String, String> props, final String key, final int defaultValue) {
        final String value = props.get(key);

        return Strings.isBlank(value) ? defaultValue : Integer.parseInt(value.trim());
    }

    @Override
    protected void complexElement2Attr(final Element element) {
        final String eleName = element.getNodeName();

        if (CONNECTION.equals(eleName)) {
            connectionProps = Collections.unmodifiableMap(new Configuration(element, this.props) {
            }.getAttributes());
        } else {
            throw new IllegalArgumentException("Unknown element: " + eleName);
        }
    }
}
