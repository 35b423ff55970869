package com.flagship.bounty_ledger.user;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "users")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UserEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, updatable = false, unique = true, length = 100)
    private String username;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Column(name = "wallet_address", length = 64)
    private String walletAddress;

    @Column(name = "total_earnings", nullable = false, precision = 18, scale = 9)
    private BigDecimal totalEarnings;

    @Column(name = "tasks_completed", nullable = false)
    private int tasksCompleted;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Version
    private long version;

    static UserEntity fromDomain(User user) {
        return new UserEntity(user.getId(), user.getUsername(), user.getPasswordHash(),
                user.getWalletAddress(), user.getTotalEarnings(), user.getTasksCompleted(),
                user.getCreatedAt(), 0L);
    }

    public User toDomain() {
        return new User(id, username, passwordHash, walletAddress, totalEarnings, tasksCompleted, createdAt);
    }

    void updateFromDomain(User user) {
        if (!user.getId().equals(this.id)) {
            throw new IllegalArgumentException("User id mismatch: " + user.getId() + " vs " + this.id);
        }
        this.walletAddress = user.getWalletAddress();
        this.totalEarnings = user.getTotalEarnings();
        this.tasksCompleted = user.getTasksCompleted();
    }
}
