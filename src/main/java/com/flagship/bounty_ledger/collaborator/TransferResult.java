package com.flagship.bounty_ledger.collaborator;

import lombok.Value;

@Value
public class TransferResult {
    boolean success;
    String signature;
    String error;

    public static TransferResult succeeded(String signature) {
        return new TransferResult(true, signature, null);
    }

    public static TransferResult failed(String error) {
        return new TransferResult(false, null, error);
    }
}
