package com.apistack.persistence.dialect;

import com.apistack.common.exception.DataException;
import com.apistack.persistence.DatabaseEngine;
import com.apistack.persistence.DatabaseSettings;
import org.junit.jupiter.api.Test;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

/**
 * Tests for the engine-specific parts of SQL generation, binding and error classification
 */
public class SqlDialectTest {

    private final PostgresDialect postgres = new PostgresDialect();
    private final OracleDialect oracle = new OracleDialect();

    @Test
    void testForEngine() {
        assertInstanceOf(PostgresDialect.class, SqlDialects.forEngine(DatabaseEngine.POSTGRES));
        assertInstanceOf(OracleDialect.class, SqlDialects.forEngine(DatabaseEngine.ORACLE));
        assertThrows(IllegalArgumentException.class, () -> SqlDialects.forEngine(null));
    }

    @Test
    void testEngineFromConfig() {
        assertEquals(DatabaseEngine.POSTGRES, DatabaseEngine.fromConfig("postgres"));
        assertEquals(DatabaseEngine.POSTGRES, DatabaseEngine.fromConfig("PostgreSQL"));
        assertEquals(DatabaseEngine.ORACLE, DatabaseEngine.fromConfig(" oracle "));
        assertThrows(IllegalArgumentException.class, () -> DatabaseEngine.fromConfig("mysql"));
        assertThrows(IllegalArgumentException.class, () -> DatabaseEngine.fromConfig(""));
    }

    @Test
    void testJdbcUrls() {
        DatabaseSettings settings = DatabaseSettings.builder()
                .host("db.internal").port(5432).database("app").build();
        assertEquals("jdbc:postgresql://db.internal:5432/app", postgres.jdbcUrl(settings));

        settings = DatabaseSettings.builder().host("ora.internal").port(1521).database("FREEPDB1").build();
        assertEquals("jdbc:oracle:thin:@//ora.internal:1521/FREEPDB1", oracle.jdbcUrl(settings));
    }

    @Test
    void testQuotingAndFolding() {
        assertEquals("\"users\"", postgres.quoteIdentifier(postgres.foldCase("Users")));
        assertEquals("\"USERS\"", oracle.quoteIdentifier(oracle.foldCase("users")));
        assertEquals("\"we\"\"ird\"", postgres.quoteIdentifier("we\"ird"));
        assertThrows(IllegalArgumentException.class, () -> oracle.quoteIdentifier(" "));
    }

    @Test
    void testPagination() {
        assertEquals("SELECT * FROM t ORDER BY id LIMIT 20 OFFSET 40",
                postgres.paginate("SELECT * FROM t ORDER BY id", 40, 20));
        assertEquals("SELECT * FROM t ORDER BY id OFFSET 40 ROWS FETCH NEXT 20 ROWS ONLY",
                oracle.paginate("SELECT * FROM t ORDER BY id", 40, 20));
        assertThrows(IllegalArgumentException.class, () -> postgres.paginate("SELECT 1", -1, 10));
        assertThrows(IllegalArgumentException.class, () -> oracle.paginate("SELECT 1", 0, 0));
    }

    @Test
    void testOracleBindsBooleanAsNumberAndUuidAsText() throws SQLException {
        PreparedStatement statement = mock(PreparedStatement.class);
        UUID id = UUID.randomUUID();

        oracle.bind(statement, 1, true);
        oracle.bind(statement, 2, id);

        verify(statement).setInt(1, 1);
        verify(statement).setString(2, id.toString());
    }

    @Test
    void testPostgresBindsNativeTypes() throws SQLException {
        PreparedStatement statement = mock(PreparedStatement.class);
        UUID id = UUID.randomUUID();

        postgres.bind(statement, 1, true);
        postgres.bind(statement, 2, id);
        postgres.bind(statement, 3, DatabaseEngine.ORACLE);

        verify(statement).setBoolean(1, true);
        verify(statement).setObject(2, id);
        verify(statement).setString(3, "ORACLE");
    }

    @Test
    void testPostgresClassification() {
        assertEquals(DataException.Kind.CONFLICT, postgres.classify(new SQLException("dup", "23505")));
        assertEquals(DataException.Kind.CONFLICT, postgres.classify(new SQLException("deadlock", "40P01")));
        assertEquals(DataException.Kind.TIMEOUT, postgres.classify(new SQLException("cancel", "57014")));
        assertEquals(DataException.Kind.CONNECTION_LOST, postgres.classify(new SQLException("io", "08006")));
        assertEquals(DataException.Kind.CONNECTION_LOST, postgres.classify(new SQLException("shutdown", "57P01")));
        assertEquals(DataException.Kind.OTHER, postgres.classify(new SQLException("syntax", "42601")));
    }

    @Test
    void testOracleClassification() {
        assertEquals(DataException.Kind.CONFLICT, oracle.classify(new SQLException("ORA-00001", "23000", 1)));
        assertEquals(DataException.Kind.CONFLICT, oracle.classify(new SQLException("ORA-02291", "23000", 2291)));
        assertEquals(DataException.Kind.TIMEOUT, oracle.classify(new SQLException("ORA-01013", "72000", 1013)));
        assertEquals(DataException.Kind.CONNECTION_LOST, oracle.classify(new SQLException("IO Error", null, 17002)));
        assertEquals(DataException.Kind.OTHER, oracle.classify(new SQLException("ORA-00942", "42000", 942)));
    }

    @Test
    void testTimeoutsAndPoolExhaustion() {
        assertEquals(DataException.Kind.TIMEOUT, oracle.classify(new SQLTimeoutException("slow")));
        assertEquals(DataException.Kind.TIMEOUT,
                postgres.classify(new SQLTransientConnectionException("Connection is not available")));
    }

    @Test
    void testChainedExceptionIsClassified() {
        SQLException batch = new SQLException("batch failed", "42000");
        batch.setNextException(new SQLException("dup", "23505"));

        assertEquals(DataException.Kind.CONFLICT, postgres.classify(batch));
    }
}
