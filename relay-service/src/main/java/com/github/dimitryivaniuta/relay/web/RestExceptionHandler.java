package com.github.dimitryivaniuta.relay.web;

import com.github.dimitryivaniuta.relay.common.web.ApiError;
import com.github.dimitryivaniuta.relay.common.web.CorrelationIdFilter;
import com.github.dimitryivaniuta.relay.error.InvalidIdempotencyKeyException;
import com.github.dimitryivaniuta.relay.error.InvalidQueryException;
import com.github.dimitryivaniuta.relay.error.InvalidSchemaDefinitionException;
import com.github.dimitryivaniuta.relay.error.InvalidUploadException;
import com.github.dimitryivaniuta.relay.error.PayloadValidationException;
import com.github.dimitryivaniuta.relay.error.RecordNotFoundException;
import com.github.dimitryivaniuta.relay.error.RegistryUnavailableException;
import com.github.dimitryivaniuta.relay.error.RelayException;
import com.github.dimitryivaniuta.relay.error.SchemaNotFoundException;
import com.github.dimitryivaniuta.relay.error.TransformException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * Maps failures to the shared {@link ApiError} payload.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(RelayException.class)
    public ResponseEntity<ApiError> relay(RelayException ex, ServerWebExchange exchange) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.warn("{} {} -> {} {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(),
                    status.value(), ex.getMessage());
        } else {
            log.debug("{} {} -> {} {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(),
                    status.value(), ex.getMessage());
        }
        ResponseEntity.BodyBuilder builder = ResponseEntity.status(status);
        if (ex instanceof RegistryUnavailableException) {
            builder.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        }
        return builder.body(body(exchange, ApiError.of(ex.code(), ex.getMessage(), detailsOf(ex))));
    }

    /** Malformed JSON, bad path/query parameters, missing multipart parts. */
    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ApiError> badInput(ServerWebInputException ex, ServerWebExchange exchange) {
        String reason = ex.getReason() != null ? ex.getReason() : "Malformed request";
        return ResponseEntity.badRequest().body(body(exchange, ApiError.of("BAD_REQUEST", reason)));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> responseStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatusCode status = ex.getStatusCode();
        String code = status instanceof HttpStatus hs ? hs.name() : "HTTP_" + status.value();
        String reason = ex.getReason() != null ? ex.getReason() : code;
        return ResponseEntity.status(status).body(body(exchange, ApiError.of(code, reason)));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> unexpected(Exception ex, ServerWebExchange exchange) {
        log.error("Unhandled error on {} {}", exchange.getRequest().getMethod(), exchange.getRequest().getPath(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(exchange, ApiError.of("INTERNAL_ERROR", "Unexpected error")));
    }

    static HttpStatus statusOf(RelayException ex) {
        if (ex instanceof SchemaNotFoundException || ex instanceof RecordNotFoundException) return HttpStatus.NOT_FOUND;
        if (ex instanceof RegistryUnavailableException) return HttpStatus.SERVICE_UNAVAILABLE;
        if (ex instanceof InvalidSchemaDefinitionException) return HttpStatus.BAD_GATEWAY;
        if (ex instanceof PayloadValidationException || ex instanceof TransformException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (ex instanceof InvalidQueryException || ex instanceof InvalidUploadException
                || ex instanceof InvalidIdempotencyKeyException) return HttpStatus.BAD_REQUEST;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    /** Field-level detail callers need to correct a payload; null when there is none. */
    static Map<String, Object> detailsOf(RelayException ex) {
        Map<String, Object> details = new LinkedHashMap<>();
        if (ex instanceof PayloadValidationException pve) {
            details.put("field", pve.getFieldPath());
            details.put("constraint", pve.getConstraint());
        } else if (ex instanceof TransformException te) {
            details.put("field", te.getField());
        } else if (ex instanceof SchemaNotFoundException snf) {
            details.put("schema", snf.getSchemaName());
            if (snf.getVersion() != null) details.put("version", snf.getVersion());
        }
        return details.isEmpty() ? null : details;
    }

    private static ApiError body(ServerWebExchange exchange, ApiError error) {
        String cid = CorrelationIdFilter.current(exchange);
        return cid == null ? error : error.withCorrelationId(cid);
    }
}
