package com.ivamare.eventstore.exception;

import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classifies SQLite failures as transient (worth retrying on the next attempt)
 * or permanent.
 *
 * <p>Transient conditions on a single-host SQLite file are mostly lock
 * contention between the writer and a checkpoint or another process:
 * <ul>
 *   <li>SQLITE_BUSY (5) and its extended codes</li>
 *   <li>SQLITE_LOCKED (6) and its extended codes</li>
 *   <li>Connection pool exhaustion and query timeouts</li>
 * </ul>
 *
 * @see <a href="https://www.sqlite.org/rescode.html">SQLite Result Codes</a>
 */
public final class DatabaseExceptionClassifier {

    private DatabaseExceptionClassifier() {
        // Utility class - no instantiation
    }

    private static final Set<Integer> TRANSIENT_PRIMARY_CODES = Set.of(
        5,  // SQLITE_BUSY
        6   // SQLITE_LOCKED
    );

    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "database is locked",
        "database table is locked",
        "sqlite_busy",
        "sqlite_locked",
        "connection is not available",
        "interrupted during connection acquisition"
    };

    /**
     * Determine if the exception is transient.
     *
     * @param ex the exception to classify
     * @return true if a later retry may succeed
     */
    public static boolean isTransient(Throwable ex) {
        return !"Unknown".equals(getTransientReason(ex));
    }

    /**
     * Get the SQLite result code from an exception if available.
     *
     * @param ex the exception to inspect
     * @return the result code, or null if no SQLException is in the chain
     */
    public static Integer getResultCode(Throwable ex) {
        if (ex == null) {
            return null;
        }
        if (ex instanceof SQLException sqlEx) {
            return sqlEx.getErrorCode();
        }
        if (ex.getCause() != null && ex.getCause() != ex) {
            return getResultCode(ex.getCause());
        }
        return null;
    }

    /**
     * Get a brief description of why the exception was classified as transient.
     *
     * @param ex the exception to describe
     * @return the transient condition, or "Unknown" if not transient
     */
    public static String getTransientReason(Throwable ex) {
        if (ex == null) {
            return "Unknown";
        }

        // Check subclasses before parent classes to ensure all branches are reachable
        if (ex instanceof CannotGetJdbcConnectionException) {
            return "Spring CannotGetJdbcConnectionException";
        }
        if (ex instanceof PessimisticLockingFailureException) {
            return "Spring " + ex.getClass().getSimpleName();
        }
        if (ex instanceof QueryTimeoutException) {
            return "Spring QueryTimeoutException";
        }
        if (ex instanceof TransientDataAccessException) {
            return "Spring " + ex.getClass().getSimpleName();
        }
        if (ex instanceof SQLTimeoutException) {
            return "JDBC SQLTimeoutException";
        }
        if (ex instanceof SQLTransientException) {
            return "JDBC SQLTransientException";
        }

        if (ex instanceof SQLException sqlEx) {
            int primary = sqlEx.getErrorCode() & 0xff;
            if (TRANSIENT_PRIMARY_CODES.contains(primary)) {
                return "SQLite result code " + sqlEx.getErrorCode();
            }
        }

        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return "Message pattern: " + pattern;
                }
            }
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return getTransientReason(cause);
        }

        return "Unknown";
    }
}
