package com.dbkeeper.server.configuration;

import com.baomidou.mybatisplus.core.exceptions.MybatisPlusException;
import com.dbkeeper.server.exception.BusinessException;
import com.dbkeeper.server.exception.DbException;
import com.dbkeeper.server.exception.DbKeeperException;
import com.dbkeeper.server.exception.FileOperationException;
import com.dbkeeper.server.exception.JsonException;
import com.dbkeeper.server.exception.ResourceNotFoundException;
import com.dbkeeper.server.exception.ValidationException;
import com.dbkeeper.server.model.api.global.DbKeeperHttpResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;


@RestControllerAdvice
@Slf4j
public class GlobalControllerAdvice {

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleBusinessException(BusinessException e) {
        log.warn("controller failed. business logic failed. ", e);
        return toResponse(DbKeeperHttpResponse.fail(e));
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleResourceNotFoundException(ResourceNotFoundException e) {
        log.warn("controller failed. resource not found. ", e);
        return toResponse(DbKeeperHttpResponse.fail(e));
    }

    @ExceptionHandler(FileOperationException.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleFileOperationException(FileOperationException e) {
        log.warn("controller failed. file operation failed. ", e);
        return toResponse(DbKeeperHttpResponse.fail(e));
    }

    @ExceptionHandler(JsonException.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleJsonException(JsonException e) {
        log.warn("controller failed. json process failed. ", e);
        return toResponse(DbKeeperHttpResponse.fail(e));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleValidationException(ValidationException e) {
        log.warn("controller failed. validation failed. ", e);
        return toResponse(DbKeeperHttpResponse.fail(e));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("controller failed. request body is not readable. ", e);
        return toResponse(DbKeeperHttpResponse.fail(
                new ValidationException("request body is not readable. " + e.getMostSpecificCause().getMessage())));
    }

    @ExceptionHandler(MybatisPlusException.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleDBException(MybatisPlusException e) {
        log.warn("controller failed. db error happen.", e);
        return toResponse(DbKeeperHttpResponse.fail(new DbException("db error.", e)));
    }

    @ExceptionHandler(DbKeeperException.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleDbKeeperException(DbKeeperException e) {
        log.warn("controller failed. DbKeeperException happen", e);
        return toResponse(DbKeeperHttpResponse.fail(e));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<DbKeeperHttpResponse<Void>> handleGlobalException(Exception e) {
        log.warn("controller failed.", e);
        return toResponse(DbKeeperHttpResponse.fail(HttpStatus.INTERNAL_SERVER_ERROR, e.toString()));
    }

    private static ResponseEntity<DbKeeperHttpResponse<Void>> toResponse(DbKeeperHttpResponse<Void> response) {
        return ResponseEntity.status(response.getStatusCode()).body(response);
    }
}
