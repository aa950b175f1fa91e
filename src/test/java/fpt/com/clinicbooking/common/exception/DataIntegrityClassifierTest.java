package fpt.com.clinicbooking.common.exception;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;

class DataIntegrityClassifierTest {

    private static DataIntegrityViolationException wrap(String state, int vendorCode) {
        SQLException sql = new SQLException("constraint failed", state, vendorCode);
        return new DataIntegrityViolationException("could not execute statement",
                new RuntimeException("hibernate", sql));
    }

    @Test
    void classify_readsPostgresSqlStates() {
        assertEquals(DataConstraintKind.UNIQUE, DataIntegrityClassifier.classify(wrap("23505", 0)));
        assertEquals(DataConstraintKind.FOREIGN_KEY, DataIntegrityClassifier.classify(wrap("23503", 0)));
        assertEquals(DataConstraintKind.CHECK, DataIntegrityClassifier.classify(wrap("23514", 0)));
        assertEquals(DataConstraintKind.NOT_NULL, DataIntegrityClassifier.classify(wrap("23502", 0)));
    }

    @Test
    void classify_readsH2SpecificStates() {
        assertEquals(DataConstraintKind.FOREIGN_KEY, DataIntegrityClassifier.classify(wrap("23506", 0)));
        assertEquals(DataConstraintKind.CHECK, DataIntegrityClassifier.classify(wrap("23513", 0)));
    }

    @Test
    void classify_fallsBackToMysqlVendorCodes_whenStateIsGeneric() {
        assertEquals(DataConstraintKind.UNIQUE, DataIntegrityClassifier.classify(wrap("23000", 1062)));
        assertEquals(DataConstraintKind.FOREIGN_KEY, DataIntegrityClassifier.classify(wrap("23000", 1451)));
        assertEquals(DataConstraintKind.FOREIGN_KEY, DataIntegrityClassifier.classify(wrap("23000", 1452)));
        assertEquals(DataConstraintKind.CHECK, DataIntegrityClassifier.classify(wrap("HY000", 3819)));
        assertEquals(DataConstraintKind.NOT_NULL, DataIntegrityClassifier.classify(wrap("23000", 1048)));
    }

    @Test
    void classify_returnsUnknown_whenNoSqlExceptionInChain() {
        DataConstraintKind kind = DataIntegrityClassifier.classify(
                new DataIntegrityViolationException("no cause"));

        assertEquals(DataConstraintKind.UNKNOWN, kind);
        assertEquals("DATA_INTEGRITY_VIOLATION", kind.getCode());
        assertEquals(HttpStatus.CONFLICT, kind.getStatus());
    }

    @Test
    void kinds_mapToDistinctHttpStatuses() {
        assertEquals(HttpStatus.CONFLICT, DataConstraintKind.UNIQUE.getStatus());
        assertEquals(HttpStatus.CONFLICT, DataConstraintKind.FOREIGN_KEY.getStatus());
        assertEquals(HttpStatus.BAD_REQUEST, DataConstraintKind.CHECK.getStatus());
        assertEquals(HttpStatus.BAD_REQUEST, DataConstraintKind.NOT_NULL.getStatus());
    }
}
