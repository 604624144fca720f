package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.util.UUID;

import org.junit.jupiter.api.Test;

public class OutParameterTest extends TestBase {

    @Test
    public void testNotAvailableBeforeCompletion() {
        OutParameter<Integer> handle = OutParameter.of(Integer.class);
        handle.attach(QueryParameter.of("count", null, ParameterDirection.OUTPUT, DbType.INT, 0, 0, 0));

        assertFalse(handle.isAvailable());
        assertThrows(IllegalStateException.class, handle::getValue);
    }

    @Test
    public void testConvertedValue() {
        OutParameter<Long> handle = OutParameter.of(Long.class);
        QueryParameter parameter = QueryParameter.of("count", null, ParameterDirection.OUTPUT, DbType.LONG, 0, 0, 0);
        handle.attach(parameter);

        parameter.setValue(12);
        handle.complete();

        assertTrue(handle.isAvailable());
        assertEquals(12L, handle.getValue());
    }

    @Test
    public void testNullValue() {
        OutParameter<String> handle = OutParameter.of(String.class);
        handle.attach(QueryParameter.of("name", null, ParameterDirection.OUTPUT, DbType.STRING, 0, 0, 0));
        handle.complete();

        assertNull(handle.getValue());
    }

    @Test
    public void testNullValueForPrimitive() {
        OutParameter<Integer> handle = OutParameter.of(int.class);
        handle.attach(QueryParameter.of("count", null, ParameterDirection.OUTPUT, DbType.INT, 0, 0, 0));
        handle.complete();

        assertThrows(IllegalStateException.class, handle::getValue);
    }

    @Test
    public void testAttachTwice() {
        OutParameter<Integer> handle = OutParameter.of(Integer.class);
        handle.attach(QueryParameter.of("a", null, ParameterDirection.OUTPUT, DbType.INT, 0, 0, 0));

        assertThrows(IllegalStateException.class, () -> handle.attach(QueryParameter.of("b", null, ParameterDirection.OUTPUT, DbType.INT, 0, 0, 0)));
    }

    @Test
    public void testDbType() {
        assertEquals(DbType.INT, OutParameter.of(Integer.class).dbType());
        assertEquals(DbType.DECIMAL, OutParameter.of(BigDecimal.class).dbType());
        assertEquals(DbType.STRING, OutParameter.of(UUID.class).dbType());
    }
}
