package it.berlink.querywatch.spring.jdbc;

import com.p6spy.engine.common.StatementInformation;
import com.p6spy.engine.event.SimpleJdbcEventListener;
import it.berlink.querywatch.log.ThreadLocalStatementLog;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLException;
import java.time.Instant;
import java.util.Locale;

/**
 * P6Spy listener that records every executed statement into the calling
 * thread's statement log.
 *
 * Registered through {@code META-INF/services}, so P6Spy instantiates it
 * with the no-arg constructor.
 */
@Slf4j
public class StatementCaptureListener extends SimpleJdbcEventListener {

    private static final double NANOS_PER_SECOND = 1_000_000_000d;

    private final ThreadLocalStatementLog statementLog;

    public StatementCaptureListener() {
        this(ThreadLocalStatementLog.getInstance());
    }

    StatementCaptureListener(ThreadLocalStatementLog statementLog) {
        this.statementLog = statementLog;
    }

    @Override
    public void onAfterAnyExecute(StatementInformation statementInformation, long timeElapsedNanos, SQLException e) {
        String sql = sqlOf(statementInformation);
        if (sql == null || sql.isBlank() || isHousekeeping(sql)) {
            return;
        }
        try {
            String origin = statementInformation.getConnectionInformation() != null
                ? statementInformation.getConnectionInformation().getUrl()
                : null;
            statementLog.append(sql, Math.max(0, timeElapsedNanos) / NANOS_PER_SECOND, Instant.now(), origin);
        } catch (RuntimeException ex) {
            log.warn("Could not record statement: {}", ex.getMessage());
        }
    }

    private static String sqlOf(StatementInformation statementInformation) {
        String sql = statementInformation.getSqlWithValues();
        return sql == null || sql.isBlank() ? statementInformation.getSql() : sql;
    }

    /**
     * Connection checks and session setup issued by pools and drivers.
     */
    static boolean isHousekeeping(String sql) {
        String normalized = sql.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("select 1")
            || normalized.startsWith("set ")
            || normalized.contains("information_schema");
    }
}
