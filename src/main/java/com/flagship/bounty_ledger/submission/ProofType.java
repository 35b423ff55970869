package com.flagship.bounty_ledger.submission;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ProofType {
    @JsonProperty("image")
    IMAGE,
    @JsonProperty("url")
    URL,
    @JsonProperty("text")
    TEXT;

    public String label() {
        return name().toLowerCase();
    }
}
