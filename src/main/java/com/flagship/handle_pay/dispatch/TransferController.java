package com.flagship.handle_pay.dispatch;

import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.dispatch.dto.BatchTransferRequest;
import com.flagship.handle_pay.dispatch.dto.TransferReceiptResponse;
import com.flagship.handle_pay.dispatch.dto.TransferRequest;
import com.flagship.handle_pay.observability.CorrelationIdFilter;
import com.flagship.handle_pay.observability.ProtocolMetrics;
import com.flagship.handle_pay.receipt.IdempotencyService;
import com.flagship.handle_pay.receipt.ReceiptService;
import com.flagship.handle_pay.receipt.TransferReceipt;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Optional;
import java.util.UUID;

/**
 * REST controller for dispatcher transfers.
 *
 * Transfers require an Idempotency-Key header: replaying a key returns the
 * stored receipt without moving value again. The receipt is written in the
 * same transaction as the transfer.
 */
@RestController
@RequestMapping("/api/transfers")
@RequiredArgsConstructor
@Slf4j
public class TransferController {

    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

    private final TransferDispatcher dispatcher;
    private final ReceiptService receiptService;
    private final IdempotencyService idempotencyService;
    private final ProtocolMetrics metrics;

    @PostMapping
    @Transactional
    public ResponseEntity<TransferReceiptResponse> transfer(
            @Valid @RequestBody TransferRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {

        log.info("Received transfer request: idempotencyKey={}, amount={}, asset={}",
                idempotencyKey, request.getAmount(), request.getAsset());

        Optional<ResponseEntity<TransferReceiptResponse>> replay = replay(idempotencyKey);
        if (replay.isPresent()) {
            return replay.get();
        }

        TransferResult result = dispatcher.transfer(
            Address.of(callerHeader), request.getHandle(), request.getAmount(), request.getAsset());
        TransferReceipt receipt = receiptService.save(TransferReceipt.forTransfer(result), idempotencyKey);
        idempotencyService.storeIdempotencyKey(idempotencyKey, receipt.getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(TransferReceiptResponse.from(receipt));
    }

    @PostMapping("/batch")
    @Transactional
    public ResponseEntity<TransferReceiptResponse> batchTransfer(
            @RequestBody BatchTransferRequest request,
            @RequestHeader(IDEMPOTENCY_KEY_HEADER) String idempotencyKey,
            @RequestHeader(CorrelationIdFilter.CALLER_HEADER) String callerHeader) {

        log.info("Received batch transfer request: idempotencyKey={}, recipients={}, asset={}",
                idempotencyKey, request.recipientCount(), request.getAsset());

        Optional<ResponseEntity<TransferReceiptResponse>> replay = replay(idempotencyKey);
        if (replay.isPresent()) {
            return replay.get();
        }

        BatchTransferResult result = dispatcher.batchTransfer(Address.of(callerHeader), request.toCommand());
        TransferReceipt receipt = receiptService.save(
            TransferReceipt.forBatch(result, request.recipientCount()), idempotencyKey);
        idempotencyService.storeIdempotencyKey(idempotencyKey, receipt.getId());

        return ResponseEntity.status(HttpStatus.CREATED).body(TransferReceiptResponse.from(receipt));
    }

    @GetMapping("/{id}")
    public ResponseEntity<TransferReceiptResponse> getReceipt(@PathVariable("id") UUID id) {
        return receiptService.findById(id)
            .map(receipt -> ResponseEntity.ok(TransferReceiptResponse.from(receipt)))
            .orElse(ResponseEntity.notFound().build());
    }

    /**
     * Fee and net amount a direct transfer of {@code amount} would produce now.
     */
    @GetMapping("/fees/quote")
    public ResponseEntity<FeeQuote> quoteFee(@RequestParam("amount") BigInteger amount) {
        return ResponseEntity.ok(dispatcher.quoteFee(amount));
    }

    private Optional<ResponseEntity<TransferReceiptResponse>> replay(String idempotencyKey) {
        Optional<UUID> existingReceiptId = idempotencyService.checkIdempotencyKey(idempotencyKey);
        if (existingReceiptId.isEmpty()) {
            metrics.recordIdempotencyMiss();
            return Optional.empty();
        }

        metrics.recordIdempotencyHit();
        log.info("Idempotency key already used, returning receipt {}", existingReceiptId.get());
        TransferReceipt existing = receiptService.findById(existingReceiptId.get())
            .orElseThrow(() -> new IllegalStateException(
                "Receipt found by idempotency key but not by ID: " + existingReceiptId.get()));
        return Optional.of(ResponseEntity.ok(TransferReceiptResponse.from(existing)));
    }
}
