package com.flagship.handle_pay.error;

/**
 * Raised when a protocol operation is rejected.
 * The enclosing transaction rolls back every state change made by the call.
 */
public class ProtocolException extends RuntimeException {

    private final ProtocolError error;

    public ProtocolException(ProtocolError error, String message) {
        super(message);
        this.error = error;
    }

    public ProtocolException(ProtocolError error, String message, Throwable cause) {
        super(message, cause);
        this.error = error;
    }

    public ProtocolError getError() {
        return error;
    }

    public static ProtocolException unauthorized(String message) {
        return new ProtocolException(ProtocolError.UNAUTHORIZED, message);
    }

    public static ProtocolException transferFailed(String message) {
        return new ProtocolException(ProtocolError.TRANSFER_FAILED, message);
    }
}
