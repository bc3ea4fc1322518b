package com.apistack.persistence.dialect;

import com.apistack.common.exception.DataException;
import com.apistack.persistence.DatabaseEngine;
import com.apistack.persistence.DatabaseSettings;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Locale;
import java.util.UUID;

/**
 * Oracle: upper-case folding, OFFSET/FETCH paging, booleans as NUMBER(1), UUIDs as VARCHAR2(36).
 */
public class OracleDialect extends AbstractSqlDialect {

    @Override
    public DatabaseEngine engine() {
        return DatabaseEngine.ORACLE;
    }

    @Override
    public String driverClassName() {
        return "oracle.jdbc.OracleDriver";
    }

    @Override
    public String jdbcUrl(DatabaseSettings settings) {
        return "jdbc:oracle:thin:@//" + settings.getHost() + ":" + settings.getPort() + "/" + settings.getDatabase();
    }

    @Override
    public String validationQuery() {
        return "SELECT 1 FROM DUAL";
    }

    @Override
    public String foldCase(String identifier) {
        requireIdentifier(identifier);
        return identifier.toUpperCase(Locale.ROOT);
    }

    @Override
    public String paginate(String sql, long offset, int limit) {
        requirePage(offset, limit);
        return sql + " OFFSET " + offset + " ROWS FETCH NEXT " + limit + " ROWS ONLY";
    }

    @Override
    protected void bindBoolean(PreparedStatement statement, int index, boolean value) throws SQLException {
        statement.setInt(index, value ? 1 : 0);
    }

    @Override
    protected void bindUuid(PreparedStatement statement, int index, UUID value) throws SQLException {
        statement.setString(index, value.toString());
    }

    @Override
    protected DataException.Kind classifyVendor(SQLException e) {
        switch (e.getErrorCode()) {
            case 1:     // ORA-00001 unique constraint violated
            case 2291:  // parent key not found
            case 2292:  // child record found
            case 60:    // deadlock
            case 8177:  // can't serialize access
                return DataException.Kind.CONFLICT;
            case 1013:  // user requested cancel, raised by query timeout
            case 12170: // connect timeout
                return DataException.Kind.TIMEOUT;
            case 3113:
            case 3114:
            case 12541:
            case 17002:
            case 17008:
            case 17410:
                return DataException.Kind.CONNECTION_LOST;
            default:
                return DataException.Kind.OTHER;
        }
    }

    @Override
    public boolean supportsVectorSearch() {
        return false;
    }
}
