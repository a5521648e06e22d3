package com.flagship.handle_pay.receipt;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.dispatch.TransferRoute;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for transfer receipts.
 *
 * - No setters: receipts are written once and never updated
 * - Unique idempotency key: a replayed request cannot produce a second receipt
 * - Amounts are NUMERIC(78,0), wide enough for any uint256
 */
@Entity
@Table(
    name = "transfer_receipts",
    indexes = {
        @Index(name = "idx_transfer_receipts_sender", columnList = "sender")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferReceiptEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "idempotency_key", nullable = false, unique = true, updatable = false)
    private String idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 16)
    private ReceiptKind kind;

    @Column(nullable = false, updatable = false, length = 42)
    private String sender;

    @Column(nullable = false, updatable = false, length = 42)
    private String asset;

    @Enumerated(EnumType.STRING)
    @Column(updatable = false, length = 16)
    private TransferRoute route;

    @Column(updatable = false)
    private String handle;

    @Column(updatable = false, length = 42)
    private String recipient;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigDecimal amount;

    @Column(name = "net_amount", nullable = false, updatable = false, precision = 78, scale = 0)
    private BigDecimal netAmount;

    @Column(nullable = false, updatable = false, precision = 78, scale = 0)
    private BigDecimal fee;

    @Column(name = "recipient_count", nullable = false, updatable = false)
    private int recipientCount;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }

    /**
     * The only way to create receipt entities. The idempotency key is a persistence
     * concern and stays out of the domain receipt.
     */
    static TransferReceiptEntity fromDomain(TransferReceipt receipt, String idempotencyKey) {
        return new TransferReceiptEntity(
            receipt.getId(),
            idempotencyKey,
            receipt.getKind(),
            receipt.getSender().getValue(),
            receipt.getAsset().toString(),
            receipt.getRoute(),
            receipt.getHandle(),
            receipt.getRecipient() != null ? receipt.getRecipient().getValue() : null,
            new BigDecimal(receipt.getAmount()),
            new BigDecimal(receipt.getNetAmount()),
            new BigDecimal(receipt.getFee()),
            receipt.getRecipientCount(),
            receipt.getCreatedAt()
        );
    }

    public TransferReceipt toDomain() {
        return new TransferReceipt(
            id,
            kind,
            Address.of(sender),
            AssetId.of(asset),
            route,
            handle,
            recipient != null ? Address.of(recipient) : null,
            amount.toBigIntegerExact(),
            netAmount.toBigIntegerExact(),
            fee.toBigIntegerExact(),
            recipientCount,
            createdAt
        );
    }
}
