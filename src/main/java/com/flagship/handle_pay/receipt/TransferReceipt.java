package com.flagship.handle_pay.receipt;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.dispatch.BatchTransferResult;
import com.flagship.handle_pay.dispatch.TransferResult;
import com.flagship.handle_pay.dispatch.TransferRoute;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of a completed dispatcher call, returned again when the same
 * idempotency key is replayed.
 *
 * For a batch, {@code route}, {@code handle} and {@code recipient} are null,
 * {@code amount} is the batch total and {@code netAmount} is what reached
 * recipients or the vault.
 */
@Value
public class TransferReceipt {
    UUID id;
    ReceiptKind kind;
    Address sender;
    AssetId asset;
    TransferRoute route;
    String handle;
    Address recipient;
    BigInteger amount;
    BigInteger netAmount;
    BigInteger fee;
    int recipientCount;
    Instant createdAt;

    public static TransferReceipt forTransfer(TransferResult result) {
        return new TransferReceipt(
            UUID.randomUUID(),
            ReceiptKind.SINGLE,
            result.getSender(),
            result.getAsset(),
            result.getRoute(),
            result.getHandle(),
            result.getRecipient(),
            result.getAmount(),
            result.getNetAmount(),
            result.getFee(),
            1,
            Instant.now()
        );
    }

    public static TransferReceipt forBatch(BatchTransferResult result, int recipientCount) {
        return new TransferReceipt(
            result.getBatchId(),
            ReceiptKind.BATCH,
            result.getSender(),
            result.getAsset(),
            null,
            null,
            null,
            result.total(),
            result.getDirectPaid().add(result.getEscrowedTotal()),
            result.getFee(),
            recipientCount,
            Instant.now()
        );
    }
}
