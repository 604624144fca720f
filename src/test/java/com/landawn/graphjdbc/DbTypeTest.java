package com.landawn.graphjdbc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDateTime;
import java.util.Date;
import java.util.UUID;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

public class DbTypeTest extends TestBase {

    @Mock
    private PreparedStatement stmt;

    @Mock
    private CallableStatement cstmt;

    @BeforeEach
    public void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    public void testValueOf() {
        assertEquals(DbType.LONG, DbType.valueOf(long.class));
        assertEquals(DbType.LONG, DbType.valueOf(Long.class));
        assertEquals(DbType.INT, DbType.valueOf(Integer.class));
        assertEquals(DbType.BYTE, DbType.valueOf(byte.class));
        assertEquals(DbType.STRING, DbType.valueOf(String.class));
        assertEquals(DbType.FLOAT, DbType.valueOf(Float.class));
        assertEquals(DbType.DOUBLE, DbType.valueOf(double.class));
        assertEquals(DbType.BOOLEAN, DbType.valueOf(Boolean.class));
        assertEquals(DbType.CHAR, DbType.valueOf(char.class));
        assertEquals(DbType.DATE_TIME, DbType.valueOf(Date.class));
        assertEquals(DbType.DATE_TIME, DbType.valueOf(Timestamp.class));
        assertEquals(DbType.DATE_TIME, DbType.valueOf(LocalDateTime.class));
        assertEquals(DbType.DECIMAL, DbType.valueOf(BigDecimal.class));
    }

    @Test
    public void testSqlAndJavaType() {
        assertEquals(Types.BIGINT, DbType.LONG.sqlType());
        assertEquals(Types.NVARCHAR, DbType.STRING.sqlType());
        assertEquals(long.class, DbType.LONG.javaType());
        assertEquals(Timestamp.class, DbType.DATE_TIME.javaType());

        for (DbType dbType : DbType.values()) {
            assertEquals(dbType, DbType.valueOf(dbType.javaType()));
        }
    }

    @Test
    public void testValueOfUnsupported() {
        assertNull(DbType.valueOf(UUID.class));
        assertNull(DbType.valueOf((Class<?>) null));
    }

    @Test
    public void testBind() throws SQLException {
        DbType.INT.bind(stmt, 1, 5);
        DbType.STRING.bind(stmt, 2, "Alice");
        DbType.LONG.bind(stmt, 3, null);

        LocalDateTime now = LocalDateTime.of(2024, 1, 2, 3, 4, 5);
        DbType.DATE_TIME.bind(stmt, 4, now);

        verify(stmt).setInt(1, 5);
        verify(stmt).setString(2, "Alice");
        verify(stmt).setNull(3, Types.BIGINT);
        verify(stmt).setTimestamp(4, Timestamp.valueOf(now));
    }

    @Test
    public void testRegisterOut() throws SQLException {
        DbType.INT.registerOut(cstmt, 1, 0);
        DbType.DECIMAL.registerOut(cstmt, 2, 4);

        verify(cstmt).registerOutParameter(1, Types.INTEGER);
        verify(cstmt).registerOutParameter(2, Types.DECIMAL, 4);
    }
}
