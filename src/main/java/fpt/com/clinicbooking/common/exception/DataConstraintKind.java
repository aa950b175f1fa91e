package fpt.com.clinicbooking.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Kind of database constraint that rejected a write.
 */
public enum DataConstraintKind {
    UNIQUE("UNIQUE_VIOLATION", HttpStatus.CONFLICT),
    FOREIGN_KEY("FOREIGN_KEY_VIOLATION", HttpStatus.CONFLICT),
    CHECK("CHECK_VIOLATION", HttpStatus.BAD_REQUEST),
    NOT_NULL("NOT_NULL_VIOLATION", HttpStatus.BAD_REQUEST),
    UNKNOWN("DATA_INTEGRITY_VIOLATION", HttpStatus.CONFLICT);

    private final String code;
    private final HttpStatus status;

    DataConstraintKind(String code, HttpStatus status) {
        this.code = code;
        this.status = status;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getStatus() {
        return status;
    }
}
