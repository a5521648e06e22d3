package com.flagship.handle_pay.receipt;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Persistence for transfer receipts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ReceiptService {

    private final TransferReceiptRepository repository;

    /**
     * Saves the receipt in the transaction that moved the value, so a rolled-back
     * transfer leaves no receipt and a duplicate key rolls back the transfer.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransferReceipt save(TransferReceipt receipt, String idempotencyKey) {
        TransferReceiptEntity saved = repository.saveAndFlush(TransferReceiptEntity.fromDomain(receipt, idempotencyKey));
        log.debug("Saved {} receipt {} for idempotency key {}", receipt.getKind(), receipt.getId(), idempotencyKey);
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<TransferReceipt> findById(UUID id) {
        return repository.findById(id).map(TransferReceiptEntity::toDomain);
    }
}
