package com.example.embeddingindex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Renders failures as {@code {"error": {"code": ..., "message": ...}}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EmbeddingIndexException.class)
    public ResponseEntity<ApiModels.ErrorResponse> handle(EmbeddingIndexException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.error("Request failed [{}]: {}", e.getCode(), e.getMessage(), e);
        } else {
            log.debug("Request rejected [{}]: {}", e.getCode(), e.getMessage());
        }
        return ResponseEntity.status(status).body(new ApiModels.ErrorResponse(e.getCode(), e.getMessage()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ApiModels.ErrorResponse> tooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE)
                .body(new ApiModels.ErrorResponse("FILE_TOO_LARGE", "Upload exceeds the size limit"));
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ApiModels.ErrorResponse> badRequest(Exception e) {
        return ResponseEntity.badRequest().body(new ApiModels.ErrorResponse("INVALID_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiModels.ErrorResponse> unexpected(Exception e) {
        // framework errors (405, 415, ...) keep their own status
        if (e instanceof ErrorResponse) {
            ErrorResponse er = (ErrorResponse) e;
            if (er.getStatusCode().is4xxClientError()) {
                return ResponseEntity.status(er.getStatusCode())
                        .body(new ApiModels.ErrorResponse("INVALID_REQUEST", er.getBody().getDetail()));
            }
        }
        log.error("Unhandled error", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiModels.ErrorResponse("INTERNAL", "Internal server error"));
    }

    static HttpStatus statusFor(EmbeddingIndexException e) {
        if (e instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof GateExhaustedException) return HttpStatus.SERVICE_UNAVAILABLE;
        if (e instanceof CapacityExceededException) return HttpStatus.INSUFFICIENT_STORAGE;
        if (e instanceof InvalidRequestException) {
            return "FILE_TOO_LARGE".equals(e.getCode()) ? HttpStatus.PAYLOAD_TOO_LARGE : HttpStatus.BAD_REQUEST;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
