package com.flagship.bounty_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Typed view of the {@code bounty.*} configuration tree.
 */
@ConfigurationProperties(prefix = "bounty")
@Getter
@Setter
public class BountyProperties {

    private Limits limits = new Limits();
    private Admin admin = new Admin();
    private Judge judge = new Judge();
    private Settlement settlement = new Settlement();
    private Rewards rewards = new Rewards();

    @Getter
    @Setter
    public static class Limits {
        /** Largest reward a Task may carry; enforced at creation. */
        private BigDecimal maxReward = new BigDecimal("10");
        /** Largest amount a single transfer may move; enforced before settlement. */
        private BigDecimal maxPayment = new BigDecimal("10");
    }

    @Getter
    @Setter
    public static class Admin {
        private String apiKey;
        private RateLimit rateLimit = new RateLimit();

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class RateLimit {
        private int maxRequests = 5;
        private Duration window = Duration.ofMinutes(1);
        private boolean redisEnabled = false;
    }

    @Getter
    @Setter
    public static class Judge {
        private String baseUrl = "https://api.anthropic.com";
        private String apiKey;
        private String model = "claude-sonnet-4-20250514";
        private int maxTokens = 1024;
        private Duration timeout = Duration.ofSeconds(60);

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Settlement {
        private String rpcUrl = "https://api.devnet.solana.com";
        private String network = "devnet";
        private String signerUrl;
        private String fundingAddress;
        private Duration transferTimeout = Duration.ofSeconds(90);
        private Duration confirmTimeout = Duration.ofSeconds(30);

        public boolean isSignerConfigured() {
            return signerUrl != null && !signerUrl.isBlank();
        }

        public boolean hasFundingAddress() {
            return fundingAddress != null && !fundingAddress.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Rewards {
        private String baseUrl = "https://pumpportal.fun/api";
        private Duration timeout = Duration.ofSeconds(10);
    }
}
