package com.flagship.handle_pay.receipt;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TransferReceiptRepository extends JpaRepository<TransferReceiptEntity, UUID> {

    Optional<TransferReceiptEntity> findByIdempotencyKey(String idempotencyKey);
}
