package co.fanki.machineflow.shared;

import co.fanki.machineflow.expression.domain.ExpressionError;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps exceptions to the {@code {error, errorCode}} bodies the controllers
 * answer with.
 *
 * <p>Codes ending in {@code _NOT_FOUND} answer 404, every other domain
 * error 400. Expression errors also carry the offending fragment and its
 * position.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class ErrorResponses {

    /** Error code for rejected arguments. */
    public static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    private ErrorResponses() {
    }

    /**
     * Builds the response for a domain exception.
     *
     * @param e the exception
     * @return the error response
     */
    public static ResponseEntity<Map<String, Object>> of(
            final DomainException e) {
        final Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("errorCode", e.getErrorCode());
        if (e instanceof ExpressionError) {
            final ExpressionError expressionError = (ExpressionError) e;
            body.put("fragment", expressionError.getFragment());
            body.put("position", expressionError.getPosition());
        }
        final HttpStatus status = e.getErrorCode().endsWith("_NOT_FOUND")
                ? HttpStatus.NOT_FOUND : HttpStatus.BAD_REQUEST;
        return ResponseEntity.status(status).body(body);
    }

    /**
     * Builds the response for a rejected argument.
     *
     * @param e the exception
     * @return a 400 response
     */
    public static ResponseEntity<Map<String, Object>> of(
            final IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of(
                "error", String.valueOf(e.getMessage()),
                "errorCode", INVALID_ARGUMENT));
    }

}
