package com.collabnote.backend.modules.collaboration.application;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import com.collabnote.backend.global.error.ProblemException;

import org.springframework.http.HttpStatus;

/**
 * Business failures of collaboration operations. None of them is worth retrying.
 */
public class CollaborationException extends ProblemException {

    public enum Kind {
        VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
        NOT_FOUND(HttpStatus.NOT_FOUND),
        FORBIDDEN(HttpStatus.FORBIDDEN),
        // rendered exactly like NOT_FOUND
        NOT_FOUND_OR_FORBIDDEN(HttpStatus.NOT_FOUND);

        private final HttpStatus status;

        Kind(HttpStatus status) {
            this.status = status;
        }

        public HttpStatus status() {
            return status;
        }
    }

    private final Kind kind;
    private final Map<String, String> fieldErrors;

    private CollaborationException(Kind kind, String code, String detail, Map<String, String> fieldErrors) {
        super(kind.status(), code, detail);
        this.kind = kind;
        this.fieldErrors = fieldErrors;
    }

    public static CollaborationException validation(Map<String, String> fieldErrors) {
        Map<String, String> copy = new LinkedHashMap<>(fieldErrors);
        String detail = copy.entrySet().stream()
                .map(entry -> entry.getKey() + ": " + entry.getValue())
                .collect(Collectors.joining("; "));
        return new CollaborationException(Kind.VALIDATION_ERROR, "VALIDATION_ERROR", detail, copy);
    }

    public static CollaborationException validation(String field, String message) {
        return validation(Map.of(field, message));
    }

    public static CollaborationException notFound(String code, String detail) {
        return new CollaborationException(Kind.NOT_FOUND, code, detail, Map.of());
    }

    public static CollaborationException forbidden(String code, String detail) {
        return new CollaborationException(Kind.FORBIDDEN, code, detail, Map.of());
    }

    public static CollaborationException notFoundOrForbidden(String code, String detail) {
        return new CollaborationException(Kind.NOT_FOUND_OR_FORBIDDEN, code, detail, Map.of());
    }

    public Kind getKind() {
        return kind;
    }

    @Override
    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
