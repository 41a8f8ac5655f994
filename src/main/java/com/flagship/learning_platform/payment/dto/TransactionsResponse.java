package com.flagship.learning_platform.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class TransactionsResponse {

    @JsonProperty("data")
    List<PaymentResponse> data;

    @JsonProperty("total")
    int total;

    public static TransactionsResponse of(List<PaymentResponse> data) {
        return new TransactionsResponse(data, data.size());
    }
}
