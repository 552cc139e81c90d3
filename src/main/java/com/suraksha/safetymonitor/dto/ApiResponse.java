package com.suraksha.safetymonitor.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

/**
 * Generic response wrapper used for error bodies and informational replies.
 *
 * Error bodies always carry a stable {@code code} (see ErrorCode); clients
 * switch on it rather than on {@code message}.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse {

    private boolean success;
    private String code;
    private String message;
    private Object data;

    /** Shorthand for a successful response with data. */
    public static ApiResponse success(Object data, String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(true);
        r.setMessage(message);
        r.setData(data);
        return r;
    }

    /** Shorthand for an error response. */
    public static ApiResponse error(String code, String message) {
        ApiResponse r = new ApiResponse();
        r.setSuccess(false);
        r.setCode(code);
        r.setMessage(message);
        return r;
    }

}
