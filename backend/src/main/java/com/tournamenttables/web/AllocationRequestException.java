package com.tournamenttables.web;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Rejected generate, view or edit request. Nothing has been written when this is thrown.
 */
@Getter
public class AllocationRequestException extends RuntimeException {

    private final HttpStatus status;
    private final String code;

    public AllocationRequestException(HttpStatus status, String code, String message) {
        super(message);
        this.status = status;
        this.code = code;
    }

    public static AllocationRequestException notFound(String detail) {
        return new AllocationRequestException(HttpStatus.NOT_FOUND, "not_found", detail);
    }

    public static AllocationRequestException tableNotInTournament(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "table_not_in_tournament", detail);
    }

    public static AllocationRequestException tableOccupied(String detail) {
        return new AllocationRequestException(HttpStatus.CONFLICT, "table_occupied", detail);
    }

    public static AllocationRequestException selfSwap(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "self_swap", detail);
    }

    public static AllocationRequestException crossRoundSwap(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "cross_round_swap", detail);
    }

    public static AllocationRequestException byeHasNoTable(String detail) {
        return new AllocationRequestException(HttpStatus.BAD_REQUEST, "bye_has_no_table", detail);
    }

    public static AllocationRequestException concurrentModification(String detail) {
        return new AllocationRequestException(HttpStatus.CONFLICT, "concurrent_modification", detail);
    }
}
