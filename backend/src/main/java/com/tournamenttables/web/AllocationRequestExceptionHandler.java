package com.tournamenttables.web;

import com.tournamenttables.allocation.InsufficientTablesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class AllocationRequestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(AllocationRequestExceptionHandler.class);

    @ExceptionHandler(AllocationRequestException.class)
    public ResponseEntity<AllocationErrorResponse> handle(AllocationRequestException ex) {
        return ResponseEntity
                .status(ex.getStatus())
                .body(new AllocationErrorResponse(ex.getCode(), ex.getMessage()));
    }

    @ExceptionHandler(InsufficientTablesException.class)
    public ResponseEntity<AllocationErrorResponse> handleInsufficientTables(InsufficientTablesException ex) {
        return ResponseEntity
                .status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(new AllocationErrorResponse("insufficient_tables", ex.getMessage()));
    }

    /**
     * Version mismatches and deferred unique-index violations both mean another write to the same
     * round committed first.
     */
    @ExceptionHandler({ObjectOptimisticLockingFailureException.class, DataIntegrityViolationException.class})
    public ResponseEntity<AllocationErrorResponse> handleConcurrentModification(RuntimeException ex) {
        log.warn("Rejected allocation write after concurrent modification: {}", ex.getMessage());
        return ResponseEntity
                .status(HttpStatus.CONFLICT)
                .body(new AllocationErrorResponse(
                        "concurrent_modification",
                        "Allocations were modified concurrently; reload the round and retry"
                ));
    }

    public record AllocationErrorResponse(
            String code,
            String message
    ) {
    }
}
