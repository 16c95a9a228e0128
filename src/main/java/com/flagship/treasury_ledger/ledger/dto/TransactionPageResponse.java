package com.flagship.treasury_ledger.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.treasury_ledger.ledger.TransactionPage;
import lombok.Value;

import java.util.List;

@Value
public class TransactionPageResponse {

    @JsonProperty("items")
    List<TransactionResponse> items;

    @JsonProperty("total")
    long total;

    @JsonProperty("limit")
    int limit;

    @JsonProperty("offset")
    int offset;

    public static TransactionPageResponse from(TransactionPage page) {
        return new TransactionPageResponse(
            page.getItems().stream().map(TransactionResponse::from).toList(),
            page.getTotal(), page.getLimit(), page.getOffset());
    }
}
