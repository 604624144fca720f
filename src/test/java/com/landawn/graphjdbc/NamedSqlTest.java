package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

public class NamedSqlTest extends TestBase {

    @Test
    public void testParse() {
        NamedSql namedSql = NamedSql.parse("SELECT * FROM Person WHERE name = @name AND age > @age");

        assertEquals("SELECT * FROM Person WHERE name = ? AND age > ?", namedSql.parameterizedSql());
        assertEquals(List.of("name", "age"), namedSql.parameterNames());
        assertEquals(2, namedSql.parameterCount());
    }

    @Test
    public void testRepeatedName() {
        NamedSql namedSql = NamedSql.parse("SELECT * FROM Person WHERE first = @name OR last = @name");

        assertEquals(List.of("name", "name"), namedSql.parameterNames());
    }

    @Test
    public void testQuotedTextAndComments() {
        String sql = "SELECT '@notParam', [col@x], \"@y\" FROM t -- @comment\n WHERE a = @a /* @b */ AND @@ROWCOUNT > 0";
        NamedSql namedSql = NamedSql.parse(sql);

        assertEquals(List.of("a"), namedSql.parameterNames());
        assertEquals("SELECT '@notParam', [col@x], \"@y\" FROM t -- @comment\n WHERE a = ? /* @b */ AND @@ROWCOUNT > 0", namedSql.parameterizedSql());
    }

    @Test
    public void testDeclaredLocalVariables() {
        String sql = "DECLARE @n INT = @minAge, @label NVARCHAR(20), @price DECIMAL(10, 2);\n"
                + "SELECT @n = COUNT(*) FROM Person WHERE age > @N AND name IN (@first, @last);\n" + "SELECT @n, @label";
        NamedSql namedSql = NamedSql.parse(sql);

        assertEquals(List.of("minAge", "first", "last"), namedSql.parameterNames());
        assertEquals("DECLARE @n INT = ?, @label NVARCHAR(20), @price DECIMAL(10, 2);\n"
                + "SELECT @n = COUNT(*) FROM Person WHERE age > @N AND name IN (?, ?);\n" + "SELECT @n, @label", namedSql.parameterizedSql());
    }

    @Test
    public void testDeclarationEndsAtSemicolon() {
        NamedSql namedSql = NamedSql.parse("DECLARE @n INT; SELECT a, @b FROM t WHERE c = @n");

        assertEquals(List.of("b"), namedSql.parameterNames());
        assertEquals("DECLARE @n INT; SELECT a, ? FROM t WHERE c = @n", namedSql.parameterizedSql());
    }

    @Test
    public void testReservedIdNames() {
        NamedSql namedSql = NamedSql.parse("INSERT INTO FriendOf VALUES(@_from_id, @_to_id, @since)");

        assertEquals(List.of("_from_id", "_to_id", "since"), namedSql.parameterNames());
        assertEquals("INSERT INTO FriendOf VALUES(?, ?, ?)", namedSql.parameterizedSql());
    }

    @Test
    public void testNoParameter() {
        NamedSql namedSql = NamedSql.parse("SELECT COUNT(*) FROM Person");

        assertTrue(namedSql.parameterNames().isEmpty());
        assertEquals(namedSql.sql(), namedSql.parameterizedSql());
    }

    @Test
    public void testCached() {
        String sql = "SELECT * FROM Person WHERE id = @id";

        assertSame(NamedSql.parse(sql), NamedSql.parse(sql));
    }

    @Test
    public void testEmptySql() {
        assertThrows(IllegalArgumentException.class, () -> NamedSql.parse(""));
    }
}
