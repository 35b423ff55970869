package com.flagship.bounty_ledger.collaborator;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class RewardsClaim {
    boolean success;
    String signature;
    BigDecimal amountClaimed;
    String error;

    public static RewardsClaim failed(String error) {
        return new RewardsClaim(false, null, null, error);
    }
}
