package com.flagship.gold_history.history;

import com.flagship.gold_history.entity.EntityDefinition;
import com.flagship.gold_history.entity.HistoryColumn;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * History tables in PostgreSQL, accessed with plain JDBC.
 *
 * SQL is derived from the {@link EntityDefinition}: every history table has
 * the natural key column, the business columns, and the SCD2 technical
 * columns (valid_from, valid_to, is_current, is_deleted, record_hash,
 * batch_id, ingested_at).
 *
 * Writes are applied in list order inside the caller's transaction. CLOSE
 * and OVERWRITE only match the row that is still current with the expected
 * hash; any other outcome fails the unit with {@link HashMismatchRaceException}.
 * A value the table rejects fails it with {@link InvalidSnapshotException}.
 * The partial unique index on (key) where is_current backs this up for
 * concurrent inserts.
 */
@Repository
@Slf4j
public class JdbcHistoryStore implements HistoryStore {

    private static final String TECHNICAL_COLUMNS =
        "valid_from, valid_to, is_current, is_deleted, record_hash, batch_id, ingested_at";

    private final JdbcTemplate jdbcTemplate;

    public JdbcHistoryStore(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional(readOnly = true)
    public <T> Map<String, HistoryRecord<T>> findCurrent(EntityDefinition<T> definition) {
        List<HistoryRecord<T>> rows = jdbcTemplate.query(
            selectSql(definition) + " WHERE is_current",
            rowMapper(definition));
        Map<String, HistoryRecord<T>> byKey = new LinkedHashMap<>();
        for (HistoryRecord<T> row : rows) {
            byKey.put(row.getNaturalKey(), row);
        }
        return byKey;
    }

    @Override
    @Transactional(readOnly = true)
    public <T> Optional<HistoryRecord<T>> findCurrentVersion(EntityDefinition<T> definition, String naturalKey) {
        List<HistoryRecord<T>> rows = jdbcTemplate.query(
            selectSql(definition) + " WHERE " + definition.getKeyColumn() + " = ? AND is_current",
            rowMapper(definition),
            naturalKey);
        return rows.stream().findFirst();
    }

    @Override
    @Transactional(readOnly = true)
    public <T> List<HistoryRecord<T>> findHistory(EntityDefinition<T> definition, String naturalKey) {
        return jdbcTemplate.query(
            selectSql(definition) + " WHERE " + definition.getKeyColumn() + " = ? ORDER BY valid_from",
            rowMapper(definition),
            naturalKey);
    }

    @Override
    @Transactional
    public <T> void apply(EntityDefinition<T> definition, List<HistoryWrite<T>> writes) {
        if (writes.isEmpty()) {
            return;
        }
        try {
            for (HistoryWrite<T> write : writes) {
                switch (write.getType()) {
                    case CLOSE -> close(definition, write);
                    case OVERWRITE -> overwrite(definition, write);
                    case INSERT -> insert(definition, write.getRecord());
                }
            }
        } catch (DuplicateKeyException e) {
            // a second current row for a key: another writer got there first
            throw new HashMismatchRaceException(
                "Concurrent insert of a current version into " + definition.getTable(), e);
        } catch (DataIntegrityViolationException e) {
            // oversized or out-of-range value: the same rows fail on every retry
            throw new InvalidSnapshotException(
                "Snapshot value rejected by " + definition.getTable() + ": " + e.getMostSpecificCause().getMessage(), e);
        } catch (DataAccessException e) {
            throw new StoreWriteFailureException("Failed to write history of " + definition.getTable(), e);
        }
        log.debug("Applied {} writes to {}", writes.size(), definition.getTable());
    }

    private <T> void close(EntityDefinition<T> definition, HistoryWrite<T> write) {
        String sql = "UPDATE " + definition.getTable()
            + " SET valid_to = ?, is_current = false"
            + " WHERE " + definition.getKeyColumn() + " = ? AND valid_from = ? AND record_hash = ? AND is_current";
        int updated = jdbcTemplate.update(sql,
            date(write.getCloseAt()),
            write.getNaturalKey(),
            date(write.getTargetValidFrom()),
            write.getExpectedHash());
        requireOneRow(updated, definition, write);
    }

    private <T> void overwrite(EntityDefinition<T> definition, HistoryWrite<T> write) {
        HistoryRecord<T> replacement = write.getRecord();
        String assignments = definition.getBusinessColumns().stream()
            .map(column -> column.getName() + " = ?")
            .collect(Collectors.joining(", "));
        String sql = "UPDATE " + definition.getTable()
            + " SET " + assignments + ", is_deleted = ?, record_hash = ?, batch_id = ?, ingested_at = ?"
            + " WHERE " + definition.getKeyColumn() + " = ? AND valid_from = ? AND record_hash = ? AND is_current";

        List<Object> args = new ArrayList<>(businessValues(definition, replacement.getAttributes()));
        args.add(replacement.isDeleted());
        args.add(replacement.getRecordHash());
        args.add(replacement.getBatchId());
        args.add(Timestamp.from(replacement.getIngestedAt()));
        args.add(write.getNaturalKey());
        args.add(date(write.getTargetValidFrom()));
        args.add(write.getExpectedHash());

        int updated = jdbcTemplate.update(sql, args.toArray());
        requireOneRow(updated, definition, write);
    }

    private <T> void insert(EntityDefinition<T> definition, HistoryRecord<T> record) {
        List<HistoryColumn> columns = definition.getBusinessColumns();
        String columnList = definition.getKeyColumn() + ", "
            + columns.stream().map(HistoryColumn::getName).collect(Collectors.joining(", "))
            + ", " + TECHNICAL_COLUMNS;
        int placeholders = columns.size() + 8;
        String sql = "INSERT INTO " + definition.getTable() + " (" + columnList + ") VALUES ("
            + String.join(", ", Collections.nCopies(placeholders, "?")) + ")";

        List<Object> args = new ArrayList<>();
        args.add(record.getNaturalKey());
        args.addAll(businessValues(definition, record.getAttributes()));
        args.add(date(record.getValidFrom()));
        args.add(date(record.getValidTo()));
        args.add(record.isCurrent());
        args.add(record.isDeleted());
        args.add(record.getRecordHash());
        args.add(record.getBatchId());
        args.add(Timestamp.from(record.getIngestedAt()));

        jdbcTemplate.update(sql, args.toArray());
    }

    private <T> List<Object> businessValues(EntityDefinition<T> definition, T attributes) {
        Map<String, Object> values = definition.toColumns(attributes);
        List<Object> args = new ArrayList<>();
        for (HistoryColumn column : definition.getBusinessColumns()) {
            args.add(new SqlParameterValue(column.getType().getSqlType(), values.get(column.getName())));
        }
        return args;
    }

    private static <T> void requireOneRow(int updated, EntityDefinition<T> definition, HistoryWrite<T> write) {
        if (updated != 1) {
            throw new HashMismatchRaceException(definition.getTable(), write.getNaturalKey(),
                write.getTargetValidFrom(), write.getExpectedHash());
        }
    }

    private static SqlParameterValue date(LocalDate date) {
        return new SqlParameterValue(Types.DATE, date);
    }

    private static String selectSql(EntityDefinition<?> definition) {
        String business = definition.getBusinessColumns().stream()
            .map(HistoryColumn::getName)
            .collect(Collectors.joining(", "));
        return "SELECT " + definition.getKeyColumn() + ", " + business + ", " + TECHNICAL_COLUMNS
            + " FROM " + definition.getTable();
    }

    private static <T> RowMapper<HistoryRecord<T>> rowMapper(EntityDefinition<T> definition) {
        return (rs, rowNum) -> {
            String key = rs.getString(definition.getKeyColumn());
            Map<String, Object> columns = new LinkedHashMap<>();
            for (HistoryColumn column : definition.getBusinessColumns()) {
                columns.put(column.getName(), column.getType().read(rs, column.getName()));
            }
            Timestamp ingestedAt = rs.getTimestamp("ingested_at");
            return HistoryRecord.<T>builder()
                .naturalKey(key)
                .attributes(definition.fromColumns(key, columns))
                .validFrom(rs.getObject("valid_from", LocalDate.class))
                .validTo(rs.getObject("valid_to", LocalDate.class))
                .current(rs.getBoolean("is_current"))
                .deleted(rs.getBoolean("is_deleted"))
                .recordHash(rs.getString("record_hash"))
                .batchId(rs.getLong("batch_id"))
                .ingestedAt(ingestedAt == null ? null : ingestedAt.toInstant())
                .build();
        };
    }
}
