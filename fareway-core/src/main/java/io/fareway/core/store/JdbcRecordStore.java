package io.fareway.core.store;

import io.fareway.core.model.Deadline;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RecordStore} over plain JDBC. Used with the SQLite driver for local data sets, but any
 * driver on the classpath works since only portable SQL is emitted.
 */
public final class JdbcRecordStore implements RecordStore {
    private static final Logger LOG = LoggerFactory.getLogger(JdbcRecordStore.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final String jdbcUrl;
    private final Duration timeout;
    private final String probeTable;

    public JdbcRecordStore(String jdbcUrl, Duration timeout, String probeTable) {
        if (jdbcUrl == null || jdbcUrl.isBlank()) {
            throw new IllegalArgumentException("jdbcUrl must not be blank");
        }
        this.jdbcUrl = jdbcUrl;
        this.timeout = timeout;
        this.probeTable = identifier(probeTable);
    }

    @Override
    public List<Map<String, Object>> select(Query query, Deadline deadline) throws RecordStoreException {
        List<Object> params = new ArrayList<>();
        String sql = toSql(query, params);
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setQueryTimeout(timeoutSeconds(deadline));
            for (int i = 0; i < params.size(); i++) {
                statement.setObject(i + 1, params.get(i));
            }
            try (ResultSet resultSet = statement.executeQuery()) {
                return readRows(resultSet);
            }
        } catch (SQLException e) {
            throw new RecordStoreException("Database error: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<Map<String, Object>> selectOne(String table, String id, Deadline deadline) throws RecordStoreException {
        List<Map<String, Object>> rows = select(Query.from(table).eq("id", id).limit(2).build(), deadline);
        if (rows.size() > 1) {
            throw new RecordStoreException("Database error: multiple rows in " + table + " for id " + id);
        }
        return rows.stream().findFirst();
    }

    @Override
    public boolean ping() {
        String sql = "SELECT id FROM " + probeTable + " LIMIT 1";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setQueryTimeout(timeoutSeconds(Deadline.none()));
            statement.executeQuery().close();
            return true;
        } catch (SQLException | RecordStoreException e) {
            LOG.error("Database connection test failed: {}", e.getMessage());
            return false;
        }
    }

    String toSql(Query query, List<Object> params) throws RecordStoreException {
        StringBuilder sql = new StringBuilder("SELECT ");
        if (query.columns().isEmpty()) {
            sql.append('*');
        } else {
            List<String> columns = new ArrayList<>();
            for (String column : query.columns()) {
                columns.add(checked(column));
            }
            sql.append(String.join(", ", columns));
        }
        sql.append(" FROM ").append(checked(query.table()));

        List<String> clauses = new ArrayList<>();
        for (Filter filter : query.filters()) {
            String field = checked(filter.field());
            switch (filter.op()) {
                case EQ -> clauses.add(field + " = ?");
                case ILIKE -> clauses.add("LOWER(" + field + ") LIKE LOWER(?) ESCAPE '" + Filter.LIKE_ESCAPE + "'");
                case GTE -> clauses.add(field + " >= ?");
                case LTE -> clauses.add(field + " <= ?");
                default -> throw new RecordStoreException("Unsupported filter operator " + filter.op());
            }
            params.add(filter.value());
        }
        if (!clauses.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", clauses));
        }
        if (query.orderBy() != null) {
            sql.append(" ORDER BY ").append(checked(query.orderBy())).append(query.descending() ? " DESC" : " ASC");
        }
        if (query.limit() != null) {
            sql.append(" LIMIT ?");
            params.add(query.limit());
        }
        return sql.toString();
    }

    private Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private int timeoutSeconds(Deadline deadline) throws RecordStoreException {
        if (deadline.isExpired()) {
            throw new RecordStoreException("Database error: deadline exceeded before query");
        }
        long seconds = (long) Math.ceil(deadline.cap(timeout).toMillis() / 1000.0);
        return (int) Math.max(1, seconds);
    }

    private List<Map<String, Object>> readRows(ResultSet resultSet) throws SQLException {
        ResultSetMetaData meta = resultSet.getMetaData();
        int columnCount = meta.getColumnCount();
        List<Map<String, Object>> rows = new ArrayList<>();
        while (resultSet.next()) {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 1; i <= columnCount; i++) {
                row.put(meta.getColumnLabel(i), resultSet.getObject(i));
            }
            rows.add(row);
        }
        return rows;
    }

    private static String checked(String name) throws RecordStoreException {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new RecordStoreException("Invalid identifier: " + name);
        }
        return name;
    }

    private static String identifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid identifier: " + name);
        }
        return name;
    }
}
