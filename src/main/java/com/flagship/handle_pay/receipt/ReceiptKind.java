package com.flagship.handle_pay.receipt;

public enum ReceiptKind {
    SINGLE,
    BATCH
}
