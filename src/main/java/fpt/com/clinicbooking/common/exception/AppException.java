package fpt.com.clinicbooking.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

import java.util.Map;

/**
 * Base of the clinic's coded errors. {@code code} is the UPPER_SNAKE key returned as
 * {@code error} in the response body, {@code params} (may be null) goes out as {@code data}.
 */
@Getter
public class AppException extends RuntimeException {

    private final String code;
    private final HttpStatus status;
    private final Map<String, Object> params;

    public AppException(String code, HttpStatus status) {
        this(code, status, null);
    }

    public AppException(String code, HttpStatus status, Map<String, Object> params) {
        super(params == null || params.isEmpty() ? code : code + " " + params);
        this.code = code;
        this.status = status;
        this.params = params;
    }
}
