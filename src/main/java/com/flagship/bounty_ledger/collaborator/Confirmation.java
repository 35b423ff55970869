package com.flagship.bounty_ledger.collaborator;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Amount and parties are present only when the network reports a confirmed plain transfer.
 */
@Value
public class Confirmation {
    boolean confirmed;
    BigDecimal amount;
    String from;
    String to;

    public static Confirmation notConfirmed() {
        return new Confirmation(false, null, null, null);
    }
}
