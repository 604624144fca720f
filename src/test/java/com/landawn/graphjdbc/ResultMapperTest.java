package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ResultMapperTest extends TestBase {

    private Connection conn;

    @BeforeEach
    public void setUp() throws SQLException {
        JdbcDataSource ds = new JdbcDataSource();
        ds.setURL("jdbc:h2:mem:result_mapper_test;DB_CLOSE_DELAY=-1");
        conn = ds.getConnection();

        try (Statement stmt = conn.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS person");
            stmt.execute("CREATE TABLE person(id BIGINT PRIMARY KEY, first_name VARCHAR(64), age INT, score DOUBLE, nickname VARCHAR(64))");
            stmt.execute("INSERT INTO person VALUES(1, 'Alice', 30, 9.5, 'Al')");
            stmt.execute("INSERT INTO person VALUES(2, 'Bob', 41, NULL, NULL)");
            stmt.execute("INSERT INTO person VALUES(3, 'Carol', 25, 7.0, 'Caz')");
        }
    }

    @AfterEach
    public void tearDown() throws SQLException {
        conn.close();
    }

    @Test
    public void testComputeKey() {
        int expected = ((17 * 31 + "a".hashCode()) * 31) + "b".hashCode();

        assertEquals(expected, ResultMapper.computeKey(List.of("a", "b")));
        assertTrue(ResultMapper.computeKey(List.of("a", "b")) != ResultMapper.computeKey(List.of("b", "a")));
    }

    @Test
    public void testBindingsCached() {
        ResultMapper<Person> mapper = ResultMapper.of(Person.class);

        FieldBindingSet first = mapper.bindingsFor(List.of("ID", "FIRST_NAME"));
        FieldBindingSet second = mapper.bindingsFor(new ArrayList<>(List.of("ID", "FIRST_NAME")));

        assertSame(first, second);
        assertNotSame(first, mapper.bindingsFor(List.of("FIRST_NAME", "ID")));
        assertSame(mapper, ResultMapper.of(Person.class));
    }

    @Test
    public void testBindings() {
        FieldBindingSet bindingSet = ResultMapper.of(Person.class).bindingsFor(List.of("ID", "first_name", "NICKNAME", "Age"));

        assertEquals(Person.class, bindingSet.targetType());
        assertEquals(List.of("id", "firstName", "age"), bindingSet.bindings().stream().map(ColumnBinding::propName).collect(Collectors.toList()));
        assertEquals(List.of(1, 2, 4), bindingSet.bindings().stream().map(ColumnBinding::columnIndex).collect(Collectors.toList()));
        assertEquals(List.of("ID", "first_name", "Age"), bindingSet.bindings().stream().map(ColumnBinding::columnName).collect(Collectors.toList()));
        assertEquals(List.of("ID", "first_name", "NICKNAME", "Age"), bindingSet.columnNames());
    }

    @Test
    public void testMapUnmatchedColumn() throws SQLException {
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT id, nickname FROM person WHERE id = 1")) {
            List<Person> result = ResultMapper.of(Person.class).list(rs);

            assertEquals(1, result.size());
            assertEquals(1L, result.get(0).getId());
            assertNull(result.get(0).getFirstName());
            assertEquals(0, result.get(0).getAge());
        }
    }

    @Test
    public void testList() throws SQLException {
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT * FROM person ORDER BY id")) {
            List<Person> result = ResultMapper.of(Person.class).list(rs);

            assertEquals(3, result.size());
            assertEquals(new Person(1, "Alice", 30, 9.5), result.get(0));
            assertEquals(new Person(2, "Bob", 41, null), result.get(1));
        }
    }

    @Test
    public void testStream() throws SQLException {
        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT id, first_name FROM person ORDER BY id")) {
            List<String> names = ResultMapper.of(Person.class).stream(rs).map(Person::getFirstName).toList();

            assertEquals(List.of("Alice", "Bob", "Carol"), names);
        }
    }

    @Test
    public void testForEachCancelled() throws SQLException {
        CancellationToken token = CancellationToken.create();
        List<Person> result = new ArrayList<>();

        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT * FROM person ORDER BY id")) {
            assertThrows(CancellationException.class, () -> ResultMapper.of(Person.class).forEach(rs, p -> {
                result.add(p);
                token.cancel();
            }, token));
        }

        assertEquals(1, result.size());
    }

    @Test
    public void testForEachAsync() throws Exception {
        List<Person> result = new ArrayList<>();

        try (Statement stmt = conn.createStatement(); ResultSet rs = stmt.executeQuery("SELECT * FROM person ORDER BY id")) {
            ResultMapper.of(Person.class).forEachAsync(rs, result::add, CancellationToken.NONE, SAME_THREAD).get();
        }

        assertEquals(3, result.size());
    }

    @Test
    public void testTypeWithoutProperty() {
        assertThrows(IllegalArgumentException.class, () -> ResultMapper.of(Object.class));
    }
}
