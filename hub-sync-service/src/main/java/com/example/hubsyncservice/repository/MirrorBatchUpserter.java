package com.example.hubsyncservice.repository;

import com.example.hubsyncservice.entity.MirrorRow;
import com.example.hubsyncservice.metrics.SyncMetrics;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import lombok.extern.slf4j.Slf4j;
import org.hibernate.query.TypedParameterValue;
import org.postgresql.util.PSQLException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Idempotent batch writer for the mirror tables.
 *
 * Rows are split into chunks of {@code hub.sync.batch-size} (50). Each chunk is one multi-row
 * {@code INSERT ... ON CONFLICT (workspace_id, linear_id) DO UPDATE} committed in its own
 * transaction; every column is overwritten (last write wins, no field merge).
 *
 * The chunk sequence as a whole is NOT atomic: when chunk k fails it rolls back alone, chunks
 * 1..k-1 stay committed, the exception propagates and chunks after k are never attempted.
 * Re-running the same input is safe.
 */
@Repository
@Slf4j
public class MirrorBatchUpserter {

    @PersistenceContext
    private EntityManager entityManager;

    private final TransactionTemplate transactionTemplate;
    private final SyncMetrics syncMetrics;
    private final int batchSize;

    public MirrorBatchUpserter(PlatformTransactionManager transactionManager,
                               SyncMetrics syncMetrics,
                               @Value("${hub.sync.batch-size:50}") int batchSize) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.syncMetrics = syncMetrics;
        this.batchSize = batchSize;
    }

    /**
     * Rows sharing a {@code linear_id} are collapsed first, keeping the last occurrence: a single
     * {@code ON CONFLICT DO UPDATE} statement may not touch the same row twice.
     *
     * @return number of rows written
     */
    public <T extends MirrorRow> int upsert(MirrorTable<T> table, List<T> input) {
        if (input == null || input.isEmpty()) {
            return 0;
        }

        List<T> rows = lastPerLinearId(input);
        if (rows.size() < input.size()) {
            log.debug("Collapsed {} duplicate row(s) for {}", input.size() - rows.size(), table.tableName());
        }

        int totalAffected = 0;
        int batches = 0;
        for (int start = 0; start < rows.size(); start += batchSize) {
            List<T> batch = rows.subList(start, Math.min(start + batchSize, rows.size()));
            Integer affected;
            try {
                affected = transactionTemplate.execute(status -> executeBatchUpsert(table, batch));
            } catch (RuntimeException e) {
                if (isUniqueViolation(e)) {
                    log.error("❌ UNIQUE constraint violation in {}: {}", table.tableName(), e.getMessage());
                    syncMetrics.recordConstraintViolation();
                }
                log.error("❌ Upsert into {} failed at batch {} (rows {}..{}); {} earlier batch(es) committed",
                        table.tableName(), batches + 1, start, start + batch.size() - 1, batches);
                throw e;
            }
            totalAffected += affected == null ? 0 : affected;
            batches++;
        }

        syncMetrics.recordRowsUpserted(table.tableName(), totalAffected);
        log.debug("Batch upserted {} rows into {} in {} batches", totalAffected, table.tableName(), batches);
        return totalAffected;
    }

    public <T extends MirrorRow> int deleteByNaturalKey(MirrorTable<T> table, String workspaceId, String linearId) {
        String sql = "DELETE FROM " + table.tableName() + " WHERE workspace_id = ?1 AND linear_id = ?2";
        Integer deleted = transactionTemplate.execute(status -> entityManager.createNativeQuery(sql)
                .setParameter(1, workspaceId)
                .setParameter(2, linearId)
                .executeUpdate());
        int count = deleted == null ? 0 : deleted;
        syncMetrics.recordRowsDeleted(table.tableName(), count);
        return count;
    }

    /**
     * One round trip per chunk: {@code INSERT ... VALUES (...), (...) ON CONFLICT ... DO UPDATE}.
     */
    private <T extends MirrorRow> int executeBatchUpsert(MirrorTable<T> table, List<T> batch) {
        List<MirrorTable.Column<T, ?>> columns = table.columns();
        String placeholders = columns.stream().map(c -> "?").collect(Collectors.joining(", ", "(", ")"));

        StringBuilder sql = new StringBuilder("INSERT INTO ")
                .append(table.tableName())
                .append(" (")
                .append(String.join(", ", table.columnNames()))
                .append(") VALUES\n");
        for (int i = 0; i < batch.size(); i++) {
            sql.append(placeholders);
            if (i < batch.size() - 1) {
                sql.append(",\n");
            }
        }
        sql.append("\nON CONFLICT (")
                .append(String.join(", ", MirrorTable.NATURAL_KEY))
                .append(")\nDO UPDATE SET ")
                .append(table.columnNames().stream()
                        .filter(name -> !MirrorTable.NATURAL_KEY.contains(name))
                        .map(name -> name + " = EXCLUDED." + name)
                        .collect(Collectors.joining(", ")));

        Query query = entityManager.createNativeQuery(sql.toString());

        int paramIndex = 1;
        for (T row : batch) {
            for (MirrorTable.Column<T, ?> column : columns) {
                query.setParameter(paramIndex++, typed(column, row));
            }
        }

        return query.executeUpdate();
    }

    // Typed binding keeps null values bindable for every column type.
    private static <T, V> TypedParameterValue<V> typed(MirrorTable.Column<T, V> column, T row) {
        return new TypedParameterValue<>(column.type(), column.valueOf(row));
    }

    private static <T extends MirrorRow> List<T> lastPerLinearId(List<T> rows) {
        Map<String, T> byLinearId = new LinkedHashMap<>();
        for (T row : rows) {
            byLinearId.remove(row.getLinearId());
            byLinearId.put(row.getLinearId(), row);
        }
        return byLinearId.size() == rows.size() ? rows : new ArrayList<>(byLinearId.values());
    }

    private static boolean isUniqueViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof PSQLException psqle && "23505".equals(psqle.getSQLState())) {
                return true;
            }
        }
        return false;
    }
}
