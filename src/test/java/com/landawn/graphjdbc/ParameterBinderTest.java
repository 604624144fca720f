package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import com.landawn.abacus.util.N;

public class ParameterBinderTest extends TestBase {

    @Test
    public void testBindMap() {
        List<QueryParameter> parameters = ParameterBinder.bind(N.asLinkedHashMap("name", "Alice", "age", 30));

        assertEquals(2, parameters.size());
        assertEquals("name", parameters.get(0).getName());
        assertEquals(DbType.STRING, parameters.get(0).getDbType());
        assertEquals("age", parameters.get(1).getName());
        assertEquals(DbType.INT, parameters.get(1).getDbType());
        assertEquals(ParameterDirection.INPUT, parameters.get(1).getDirection());
    }

    @Test
    public void testBindBean() {
        Map<String, QueryParameter> parameters = ParameterBinder.bind(new Person(7, "Bob", 41, null))
                .stream()
                .collect(Collectors.toMap(QueryParameter::getName, Function.identity()));

        assertEquals(4, parameters.size());

        assertEquals(DbType.LONG, parameters.get("id").getDbType());
        assertFalse(parameters.get("id").isNullable());
        assertEquals(7L, parameters.get("id").getValue());

        assertEquals(DbType.INT, parameters.get("age").getDbType());
        assertFalse(parameters.get("age").isNullable());

        assertEquals(DbType.DOUBLE, parameters.get("score").getDbType());
        assertTrue(parameters.get("score").isNullable());
        assertNull(parameters.get("score").getValue());
    }

    @Test
    public void testUnsupportedTypeBoundAsString() {
        UUID uuid = UUID.randomUUID();
        QueryParameter parameter = ParameterBinder.toParameter("key", uuid, UUID.class);

        assertEquals(DbType.STRING, parameter.getDbType());
        assertEquals(uuid.toString(), parameter.getValue());
        assertTrue(parameter.isNullable());
    }

    @Test
    public void testNullSource() {
        assertTrue(ParameterBinder.bind(null).isEmpty());
        assertTrue(ParameterBinder.toMap(null).isEmpty());
    }

    @Test
    public void testNullKey() {
        Map<String, Object> map = new HashMap<>();
        map.put(null, 1);

        assertThrows(IllegalArgumentException.class, () -> ParameterBinder.bind(map));
    }

    @Test
    public void testNoProperty() {
        assertTrue(ParameterBinder.bind(new Object()).isEmpty());
        assertTrue(ParameterBinder.bind(new NoProperty()).isEmpty());
        assertTrue(ParameterBinder.toMap(new NoProperty()).isEmpty());
    }

    static class NoProperty {
    }
}
