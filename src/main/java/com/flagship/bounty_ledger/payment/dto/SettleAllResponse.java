package com.flagship.bounty_ledger.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.bounty_ledger.payment.SettlementResult;
import lombok.Value;

import java.util.List;

@Value
public class SettleAllResponse {

    @JsonProperty("processed")
    int processed;

    @JsonProperty("completed")
    long completed;

    @JsonProperty("failed")
    long failed;

    @JsonProperty("results")
    List<SettlementResponse> results;

    public static SettleAllResponse from(List<SettlementResult> results) {
        long completed = results.stream().filter(SettlementResult::isSuccess).count();
        return new SettleAllResponse(results.size(), completed, results.size() - completed,
                results.stream().map(SettlementResponse::from).toList());
    }
}
