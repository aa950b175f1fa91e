package fpt.com.clinicbooking.common.util;


import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Error envelope returned by the global exception handler.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    private boolean success;
    private String message;
    private String error;
    private T data;
    private LocalDateTime timestamp;

    public static <T> ApiResponse<T> fail(String error, String message, T data) {
        return ApiResponse.<T>builder()
                .success(false)
                .error(error)
                .message(message)
                .data(data)
                .timestamp(LocalDateTime.now())
                .build();
    }

    public static ApiResponse<Void> fail(String error, String message) {
        return fail(error, message, null);
    }
}
