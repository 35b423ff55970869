package com.flagship.bounty_ledger.ledger;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class BudgetSnapshot {
    Budget budget;
    String fundingAddress;
    BigDecimal liveBalance;
    String network;
}
