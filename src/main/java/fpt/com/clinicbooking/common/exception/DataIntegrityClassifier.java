package fpt.com.clinicbooking.common.exception;

import java.sql.SQLException;

/**
 * Maps a JDBC failure to the constraint kind behind it, using the SQLState first and the
 * MySQL vendor code when the state is the generic {@code 23000}.
 */
public final class DataIntegrityClassifier {

    private DataIntegrityClassifier() {}

    public static DataConstraintKind classify(Throwable ex) {
        SQLException sql = findSqlException(ex);
        if (sql == null) return DataConstraintKind.UNKNOWN;

        String state = sql.getSQLState();
        if (state != null) {
            switch (state) {
                case "23505":
                    return DataConstraintKind.UNIQUE;
                case "23503": // child exists (PostgreSQL, H2)
                case "23506": // parent missing (H2)
                    return DataConstraintKind.FOREIGN_KEY;
                case "23513": // H2
                case "23514":
                    return DataConstraintKind.CHECK;
                case "23502":
                    return DataConstraintKind.NOT_NULL;
                default:
                    break;
            }
        }

        switch (sql.getErrorCode()) {
            case 1062:
                return DataConstraintKind.UNIQUE;
            case 1451:
            case 1452:
                return DataConstraintKind.FOREIGN_KEY;
            case 3819:
                return DataConstraintKind.CHECK;
            case 1048:
                return DataConstraintKind.NOT_NULL;
            default:
                return DataConstraintKind.UNKNOWN;
        }
    }

    private static SQLException findSqlException(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof SQLException) return (SQLException) current;
            if (current.getCause() == current) break;
            current = current.getCause();
        }
        return null;
    }
}
