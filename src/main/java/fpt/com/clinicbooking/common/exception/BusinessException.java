package fpt.com.clinicbooking.common.exception;

import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * A request that is well-formed but breaks a clinic rule (e.g. editing a paid invoice).
 */
public class BusinessException extends AppException {
    public BusinessException(String code) {
        super(code, HttpStatus.UNPROCESSABLE_ENTITY);
    }
    public BusinessException(String code, Map<String, Object> params) {
        super(code, HttpStatus.UNPROCESSABLE_ENTITY, params);
    }
}
