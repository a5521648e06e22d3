package com.flagship.handle_pay.identity;

import com.flagship.handle_pay.error.ProtocolError;
import com.flagship.handle_pay.error.ProtocolException;
import org.web3j.crypto.Hash;

/**
 * Fixed-width vault key for a handle: keccak-256 of its UTF-8 bytes, 0x-prefixed.
 */
public final class HandleHash {

    private HandleHash() {
    }

    public static String of(String handle) {
        return Hash.sha3String(requireHandle(handle));
    }

    /**
     * Handles are opaque; the only rule is that they are not empty. Whitespace
     * is part of the handle.
     */
    public static String requireHandle(String handle) {
        if (handle == null || handle.isEmpty()) {
            throw new ProtocolException(ProtocolError.INVALID_HANDLE, "Handle must not be empty");
        }
        return handle;
    }
}
