package com.flagship.bounty_ledger.user;

import com.flagship.bounty_ledger.collaborator.solana.PayoutAddressValidator;
import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.exception.InvalidCredentialsException;
import com.flagship.bounty_ledger.exception.NotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Worker accounts: registration, credential check, payout address and earnings.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    static final int MIN_PASSWORD_LENGTH = 6;

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final PayoutAddressValidator addressValidator;

    @Transactional
    public User register(String username, String password, String walletAddress) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        if (password == null || password.length() < MIN_PASSWORD_LENGTH) {
            throw new IllegalArgumentException("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        String wallet = normalizeAddress(walletAddress);
        if (userRepository.existsByUsername(username.trim())) {
            throw new ConflictException("Username already exists");
        }

        User user = User.register(username.trim(), passwordEncoder.encode(password), wallet);
        userRepository.save(UserEntity.fromDomain(user));
        log.info("Registered user {} ({})", user.getUsername(), user.getId());
        return user;
    }

    /**
     * Wrong username and wrong password are indistinguishable to the caller.
     */
    @Transactional(readOnly = true)
    public User login(String username, String password) {
        return userRepository.findByUsername(username == null ? "" : username.trim())
                .map(UserEntity::toDomain)
                .filter(user -> password != null && passwordEncoder.matches(password, user.getPasswordHash()))
                .orElseThrow(() -> new InvalidCredentialsException("Invalid credentials"));
    }

    @Transactional(readOnly = true)
    public User getUser(UUID userId) {
        return userRepository.findById(userId)
                .map(UserEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("User", userId));
    }

    @Transactional
    public User setPayoutAddress(UUID userId, String walletAddress) {
        String wallet = normalizeAddress(walletAddress);
        if (wallet == null) {
            throw new IllegalArgumentException("Wallet address is required");
        }
        UserEntity entity = userRepository.findById(userId)
                .orElseThrow(() -> NotFoundException.of("User", userId));
        User updated = entity.toDomain().withWalletAddress(wallet);
        entity.updateFromDomain(updated);
        log.info("User {} set payout address", userId);
        return updated;
    }

    /**
     * Adds one confirmed payment to the worker's totals. Only the settlement commit calls this.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public User recordEarning(UUID userId, BigDecimal amount) {
        UserEntity entity = userRepository.findById(userId)
                .orElseThrow(() -> NotFoundException.of("User", userId));
        User updated = entity.toDomain().recordEarning(amount);
        entity.updateFromDomain(updated);
        return updated;
    }

    @Transactional(readOnly = true)
    public long countUsers() {
        return userRepository.count();
    }

    private String normalizeAddress(String walletAddress) {
        if (walletAddress == null || walletAddress.isBlank()) {
            return null;
        }
        String trimmed = walletAddress.trim();
        if (!addressValidator.isValid(trimmed)) {
            throw new IllegalArgumentException("Invalid wallet address");
        }
        return trimmed;
    }
}
