package com.prospectpulse.backend.controller;

import com.prospectpulse.backend.dto.ErrorResponse;
import com.prospectpulse.backend.exception.LockBusyException;
import com.prospectpulse.backend.exception.NotFoundException;
import com.prospectpulse.backend.exception.ProspectPulseException;
import com.prospectpulse.backend.exception.StoreUnavailableException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Maps coordination failures to HTTP responses.
 */
final class ApiErrors {

    private ApiErrors() {
    }

    static HttpStatus statusOf(ProspectPulseException e) {
        if (e instanceof NotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (e instanceof LockBusyException) {
            return HttpStatus.CONFLICT;
        }
        if (e instanceof StoreUnavailableException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    static ResponseEntity<ErrorResponse> of(ProspectPulseException e) {
        return ResponseEntity.status(statusOf(e)).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    static ResponseEntity<ErrorResponse> badRequest(String message) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", message));
    }

    static ResponseEntity<ErrorResponse> internal(String message) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorResponse("INTERNAL_ERROR", message));
    }
}
