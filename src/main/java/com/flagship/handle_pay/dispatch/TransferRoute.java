package com.flagship.handle_pay.dispatch;

/**
 * Where a transfer's value went.
 */
public enum TransferRoute {

    /**
     * Paid to the registered owner, net of the dispatcher fee.
     */
    DIRECT,

    /**
     * Deposited fee-free into the vault for an unregistered handle.
     */
    ESCROWED
}
