package com.aec.DriveSrv.controller;

import com.aec.DriveSrv.dto.ErrorResponseDto;
import com.aec.DriveSrv.exception.DriveProviderException;
import com.aec.DriveSrv.exception.InvalidRequestException;
import com.aec.DriveSrv.exception.ScanLimitExceededException;
import com.aec.DriveSrv.exception.SizeExceededException;
import com.aec.DriveSrv.exception.StorageException;
import com.aec.DriveSrv.exception.UnauthenticatedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(UnauthenticatedException.class)
    public ResponseEntity<ErrorResponseDto> handleUnauthenticated(UnauthenticatedException ex) {
        return build(HttpStatus.UNAUTHORIZED, "UNAUTHENTICATED", ex.getMessage());
    }

    @ExceptionHandler(ScanLimitExceededException.class)
    public ResponseEntity<ErrorResponseDto> handleScanLimit(ScanLimitExceededException ex) {
        return build(HttpStatus.BAD_REQUEST, "SCAN_LIMIT_EXCEEDED", ex.getMessage());
    }

    @ExceptionHandler(SizeExceededException.class)
    public ResponseEntity<ErrorResponseDto> handleSize(SizeExceededException ex) {
        return build(HttpStatus.BAD_REQUEST, "SIZE_EXCEEDED", ex.getMessage());
    }

    @ExceptionHandler(InvalidRequestException.class)
    public ResponseEntity<ErrorResponseDto> handleInvalid(InvalidRequestException ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_REQUEST", ex.getMessage());
    }

    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponseDto> handleValidation(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "VALIDATION_ERROR", "Request body is missing or invalid");
    }

    @ExceptionHandler(DriveProviderException.class)
    public ResponseEntity<ErrorResponseDto> handleProvider(DriveProviderException ex) {
        log.error("Drive provider failure (status {}): {}", ex.getStatusCode(), ex.getMessage(), ex);
        return build(HttpStatus.BAD_GATEWAY, "PROVIDER_ERROR", "Google Drive request failed");
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponseDto> handleStorage(StorageException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "STORAGE_ERROR", "Could not store downloaded file");
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        // framework errors (unknown route, wrong method, ...) keep their own status
        if (ex instanceof ErrorResponse) {
            HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
            if (status != null && status.is4xxClientError()) {
                return build(status, "REQUEST_ERROR", status.getReasonPhrase());
            }
        }
        log.error("Unhandled exception: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Internal server error");
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponseDto(code, message));
    }
}
