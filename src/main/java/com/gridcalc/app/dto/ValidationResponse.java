package com.gridcalc.app.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Collections;
import java.util.List;

/**
 * Diagnostics for a formula that was parsed but not stored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResponse {
    private final boolean valid;
    private final String message;
    private final Integer position;
    private final List<String> references;
    private final List<String> functions;
    private final List<String> unknownFunctions;

    private ValidationResponse(boolean valid, String message, Integer position, List<String> references,
                               List<String> functions, List<String> unknownFunctions) {
        this.valid = valid;
        this.message = message;
        this.position = position;
        this.references = references;
        this.functions = functions;
        this.unknownFunctions = unknownFunctions;
    }

    public static ValidationResponse valid(List<String> references, List<String> functions,
                                           List<String> unknownFunctions) {
        String message = unknownFunctions.isEmpty()
                ? "Formula is valid"
                : "Formula is valid but uses unknown functions: " + String.join(", ", unknownFunctions);
        return new ValidationResponse(true, message, null, references, functions, unknownFunctions);
    }

    public static ValidationResponse invalid(String message, int position) {
        return new ValidationResponse(false, message, position, Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList());
    }

    public boolean isValid() {
        return valid;
    }

    public String getMessage() {
        return message;
    }

    public Integer getPosition() {
        return position;
    }

    public List<String> getReferences() {
        return references;
    }

    public List<String> getFunctions() {
        return functions;
    }

    public List<String> getUnknownFunctions() {
        return unknownFunctions;
    }
}
