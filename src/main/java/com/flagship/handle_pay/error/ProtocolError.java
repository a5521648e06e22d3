package com.flagship.handle_pay.error;

import org.springframework.http.HttpStatus;

/**
 * Failure reasons reported by the dispatcher, vault and fee distributor.
 *
 * Every error aborts the whole call. Batches are never partially committed.
 */
public enum ProtocolError {

    /**
     * Zero, negative or out-of-range amount where a positive one is required.
     */
    INVALID_AMOUNT(HttpStatus.BAD_REQUEST),

    /**
     * Zero or malformed recipient, receiver or owner address.
     */
    INVALID_ADDRESS(HttpStatus.BAD_REQUEST),

    INVALID_HANDLE(HttpStatus.BAD_REQUEST),

    /**
     * Fee rate above the component ceiling.
     */
    INVALID_FEE_RATE(HttpStatus.BAD_REQUEST),

    LENGTH_MISMATCH(HttpStatus.BAD_REQUEST),

    EMPTY_BATCH(HttpStatus.BAD_REQUEST),

    /**
     * Attached value differs from the declared batch total.
     */
    AMOUNT_MISMATCH(HttpStatus.BAD_REQUEST),

    /**
     * Caller is not the resolved handle owner, fee receiver, stakeholder or admin.
     */
    UNAUTHORIZED(HttpStatus.FORBIDDEN),

    NOTHING_TO_WITHDRAW(HttpStatus.CONFLICT),

    NOTHING_TO_CLAIM(HttpStatus.CONFLICT),

    /**
     * The underlying custody move reported failure.
     */
    TRANSFER_FAILED(HttpStatus.UNPROCESSABLE_ENTITY),

    /**
     * A state-mutating entry point was re-entered while a call was in progress.
     */
    REENTRANT_CALL(HttpStatus.CONFLICT);

    private final HttpStatus httpStatus;

    ProtocolError(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
