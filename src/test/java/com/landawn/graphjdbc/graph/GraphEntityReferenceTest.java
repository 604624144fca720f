package com.landawn.graphjdbc.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import com.landawn.abacus.util.N;
import com.landawn.graphjdbc.TestBase;

public class GraphEntityReferenceTest extends TestBase {

    @Mock
    private GraphCrudService service;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    public void testResolvedOnce() {
        Map<String, Object> bag = N.asMap("name", "Alice");
        when(service.resolveNodeId("Person", bag)).thenReturn("node-1");

        GraphEntityReference ref = GraphEntityReference.of("Person", bag);

        assertFalse(ref.isResolved());
        assertEquals("node-1", ref.resolveId(service));
        assertEquals("node-1", ref.resolveId(service));
        assertTrue(ref.isResolved());
        verify(service, times(1)).resolveNodeId("Person", bag);
    }

    @Test
    public void testNotFoundIsRemembered() {
        GraphEntityReference ref = GraphEntityReference.of("Person", N.asMap("name", "Nobody"));

        assertNull(ref.resolveId(service));
        assertNull(ref.resolveId(service));
        verify(service, times(1)).resolveNodeId("Person", ref.parameters());
    }

    @Test
    public void testEmptyTable() {
        assertThrows(IllegalArgumentException.class, () -> GraphEntityReference.of("", null));
    }
}
