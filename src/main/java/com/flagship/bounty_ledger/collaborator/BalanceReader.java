package com.flagship.bounty_ledger.collaborator;

import java.math.BigDecimal;

public interface BalanceReader {

    BigDecimal balanceOf(String address);
}
