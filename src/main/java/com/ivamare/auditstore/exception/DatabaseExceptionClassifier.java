package com.ivamare.auditstore.exception;

import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;

import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Classifies database exceptions raised by the audit store.
 *
 * <p>Three classes of failure matter to the write path:
 * <ul>
 *   <li>transient failures (connection loss, timeouts, shutdown, resource exhaustion)
 *       which send the event to the DLQ</li>
 *   <li>foreign key violations on the parent reference</li>
 *   <li>inserts routed to a range partition that does not exist</li>
 * </ul>
 *
 * @see <a href="https://www.postgresql.org/docs/current/errcodes-appendix.html">PostgreSQL Error Codes</a>
 */
public final class DatabaseExceptionClassifier {

    /** foreign_key_violation */
    public static final String FOREIGN_KEY_VIOLATION = "23503";

    /** check_violation, also raised by PostgreSQL when no partition accepts a row */
    public static final String CHECK_VIOLATION = "23514";

    private static final String NO_PARTITION_MESSAGE = "no partition of relation";

    private DatabaseExceptionClassifier() {
    }

    /**
     * PostgreSQL SQL states that indicate a transient condition.
     *
     * <p>08xxx connection, 53xxx insufficient resources, 57xxx operator
     * intervention, 40xxx transaction rollback.
     */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
        "08000", "08001", "08003", "08004", "08006", "08007", "08P01",
        "53000", "53100", "53200", "53300",
        "57014", // query_canceled (statement timeout)
        "57P01", "57P02", "57P03", "57P04",
        "40001", "40P01"
    );

    private static final String[] TRANSIENT_MESSAGE_PATTERNS = {
        "connection refused",
        "connection reset",
        "connection timed out",
        "socket timeout",
        "read timed out",
        "connection is not available",
        "pool exhausted",
        "connection closed",
        "broken pipe",
        "terminating connection",
        "could not connect to server",
        "the database system is starting up",
        "the database system is shutting down"
    };

    /**
     * Determine if the exception means storage is temporarily unavailable.
     *
     * @param ex the exception to classify
     * @return true if the write may succeed later without any change to the event
     */
    public static boolean isTransient(Throwable ex) {
        if (ex == null) {
            return false;
        }

        // Subclasses before parent classes
        if (ex instanceof CannotGetJdbcConnectionException
                || ex instanceof QueryTimeoutException
                || ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException) {
            return true;
        }

        if (ex instanceof SQLTimeoutException
                || ex instanceof SQLTransientException
                || ex instanceof SQLRecoverableException
                || ex instanceof SQLNonTransientConnectionException) {
            return true;
        }

        if (ex instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                return true;
            }
        }

        String message = ex.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            for (String pattern : TRANSIENT_MESSAGE_PATTERNS) {
                if (lowerMessage.contains(pattern)) {
                    return true;
                }
            }
        }

        Throwable cause = ex.getCause();
        if (cause != null && cause != ex) {
            return isTransient(cause);
        }

        return false;
    }

    /**
     * Check whether the exception is a violation of the parent event foreign key.
     *
     * @param ex the exception to inspect
     * @return true for SQL state 23503
     */
    public static boolean isForeignKeyViolation(Throwable ex) {
        return FOREIGN_KEY_VIOLATION.equals(getSqlState(ex));
    }

    /**
     * Check whether the exception was raised because no range partition accepts the row.
     *
     * @param ex the exception to inspect
     * @return true if PostgreSQL reported a missing partition
     */
    public static boolean isPartitionMissing(Throwable ex) {
        if (!CHECK_VIOLATION.equals(getSqlState(ex))) {
            return false;
        }
        for (Throwable t = ex; t != null; t = t.getCause() == t ? null : t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.toLowerCase().contains(NO_PARTITION_MESSAGE)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Get the SQL state from an exception if available.
     *
     * @param ex the exception to inspect
     * @return the SQL state code, or null if not available
     */
    public static String getSqlState(Throwable ex) {
        if (ex == null) {
            return null;
        }
        if (ex instanceof SQLException sqlEx && sqlEx.getSQLState() != null) {
            return sqlEx.getSQLState();
        }
        if (ex.getCause() != null && ex.getCause() != ex) {
            return getSqlState(ex.getCause());
        }
        return null;
    }

    /**
     * Get a brief description of why the exception was classified as transient.
     *
     * @param ex the exception to describe
     * @return a brief description, or "Unknown"
     */
    public static String getTransientReason(Throwable ex) {
        if (ex == null) {
            return "Unknown";
        }
        if (ex instanceof CannotGetJdbcConnectionException) {
            return "Spring CannotGetJdbcConnectionException";
        }
        if (ex instanceof TransientDataAccessException
                || ex instanceof RecoverableDataAccessException
                || ex instanceof DataAccessResourceFailureException) {
            return "Spring " + ex.getClass().getSimpleName();
        }
        if (ex instanceof SQLException sqlEx) {
            String sqlState = sqlEx.getSQLState();
            if (sqlState != null && TRANSIENT_SQL_STATES.contains(sqlState)) {
                return "SQL state " + sqlState;
            }
            if (ex instanceof SQLTransientException || ex instanceof SQLRecoverableException
                    || ex instanceof SQLNonTransientConnectionException) {
                return "JDBC " + ex.getClass().getSimpleName();
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
