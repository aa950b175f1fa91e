package fpt.com.clinicbooking.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Duplicate key or a delete blocked by rows that still reference the target.
 */
public class ConflictException extends AppException {

    public ConflictException(String code) {
        super(code, HttpStatus.CONFLICT);
    }

    public ConflictException(String code, Map<String, Object> params) {
        super(code, HttpStatus.CONFLICT, params);
    }
}
