package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import javax.sql.DataSource;

import org.junit.jupiter.api.Test;

import com.zaxxer.hikari.HikariDataSource;

public class GraphDataSourceConfigTest extends TestBase {

    @Test
    public void testLoad() {
        GraphDataSourceConfig config = GraphDataSourceConfig.load();

        assertEquals("graph", config.name());
        assertEquals("test", config.env());
        assertEquals(30, config.queryTimeout());
        assertTrue(config.isSqlLogEnabled());
        assertEquals(500L, config.perfLogThreshold());
        assertEquals("jdbc:h2:mem:graph_config_test;DB_CLOSE_DELAY=-1", config.getConnectionProps().get(GraphDataSourceConfig.URL));
        assertEquals("4", config.getConnectionProps().get(GraphDataSourceConfig.MAX_ACTIVE));
    }

    @Test
    public void testLoadByEnv() {
        GraphDataSourceConfig config = GraphDataSourceConfig.load(GraphDataSourceConfig.DEFAULT_RESOURCE_NAME, "dev");

        assertEquals("dev", config.env());
        assertEquals(0, config.queryTimeout());
        assertFalse(config.isSqlLogEnabled());
        assertEquals(-1L, config.perfLogThreshold());
    }

    @Test
    public void testUnknownEnv() {
        assertThrows(IllegalArgumentException.class, () -> GraphDataSourceConfig.load(GraphDataSourceConfig.DEFAULT_RESOURCE_NAME, "prod"));
    }

    @Test
    public void testMissingUrl() {
        String xml = "<graphJdbc><dataSource name=\"graph\"><connection><user>sa</user></connection></dataSource></graphJdbc>";

        assertThrows(IllegalArgumentException.class, () -> GraphDataSourceConfig.load(toStream(xml), null));
    }

    @Test
    public void testUnknownElement() {
        String xml = "<dataSource name=\"graph\"><pool><size>1</size></pool></dataSource>";

        assertThrows(IllegalArgumentException.class, () -> GraphDataSourceConfig.load(toStream(xml), null));
    }

    @Test
    public void testApplySqlLogSettings() {
        GraphDataSourceConfig.load().applySqlLogSettings();

        assertTrue(GraphJdbcUtil.isSqlLogEnabled());
        assertEquals(500L, GraphJdbcUtil.getMinExecutionTimeForSqlPerfLog());
    }

    @Test
    public void testCreateExecutionContext() {
        ExecutionContext context = GraphDataSourceConfig.load().createExecutionContext();
        DataSource ds = context.dataSource();

        try {
            assertEquals(30, context.timeout());
            assertEquals(1, context.executeScalar("SELECT 1", null, int.class));
        } finally {
            ((HikariDataSource) ds).close();
        }
    }

    private static InputStream toStream(String xml) {
        return new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));
    }
}
