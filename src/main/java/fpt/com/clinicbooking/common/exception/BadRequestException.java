package fpt.com.clinicbooking.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Input the service rejects before touching the database (bad schedule, missing price).
 */
public class BadRequestException extends AppException {

    public BadRequestException(String code) {
        super(code, HttpStatus.BAD_REQUEST);
    }

    public BadRequestException(String code, Map<String, Object> params) {
        super(code, HttpStatus.BAD_REQUEST, params);
    }
}
