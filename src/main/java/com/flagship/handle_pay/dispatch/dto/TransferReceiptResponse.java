package com.flagship.handle_pay.dispatch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.handle_pay.asset.Address;
import com.flagship.handle_pay.asset.AssetId;
import com.flagship.handle_pay.dispatch.TransferRoute;
import com.flagship.handle_pay.receipt.ReceiptKind;
import com.flagship.handle_pay.receipt.TransferReceipt;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransferReceiptResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    ReceiptKind kind;

    @JsonProperty("sender")
    Address sender;

    @JsonProperty("asset")
    AssetId asset;

    @JsonProperty("route")
    TransferRoute route;

    @JsonProperty("handle")
    String handle;

    @JsonProperty("recipient")
    Address recipient;

    @JsonProperty("amount")
    BigInteger amount;

    @JsonProperty("net_amount")
    BigInteger netAmount;

    @JsonProperty("fee")
    BigInteger fee;

    @JsonProperty("recipient_count")
    int recipientCount;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransferReceiptResponse from(TransferReceipt receipt) {
        return TransferReceiptResponse.builder()
            .id(receipt.getId())
            .kind(receipt.getKind())
            .sender(receipt.getSender())
            .asset(receipt.getAsset())
            .route(receipt.getRoute())
            .handle(receipt.getHandle())
            .recipient(receipt.getRecipient())
            .amount(receipt.getAmount())
            .netAmount(receipt.getNetAmount())
            .fee(receipt.getFee())
            .recipientCount(receipt.getRecipientCount())
            .createdAt(receipt.getCreatedAt())
            .build();
    }
}
