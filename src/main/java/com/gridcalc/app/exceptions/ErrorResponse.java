package com.gridcalc.app.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Simple DTO to structure error responses with a code and message.
 * For example:
 * {
 *   "code": "PARSE_ERROR",
 *   "message": "Unexpected token ')' at position 4",
 *   "position": 4
 * }
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {
    private String code;
    private String message;
    private Integer position;

    public ErrorResponse(String code, String message) {
        this.code = code;
        this.message = message;
    }

    public ErrorResponse(String code, String message, Integer position) {
        this(code, message);
        this.position = position;
    }

    public String getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public Integer getPosition() {
        return position;
    }
}
