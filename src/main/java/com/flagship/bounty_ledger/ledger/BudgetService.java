package com.flagship.bounty_ledger.ledger;

import com.flagship.bounty_ledger.collaborator.BalanceReader;
import com.flagship.bounty_ledger.collaborator.BoundedCaller;
import com.flagship.bounty_ledger.collaborator.BudgetAdvice;
import com.flagship.bounty_ledger.collaborator.BudgetAdvisor;
import com.flagship.bounty_ledger.collaborator.Collaborator;
import com.flagship.bounty_ledger.collaborator.CreatorRewards;
import com.flagship.bounty_ledger.collaborator.RewardsClaim;
import com.flagship.bounty_ledger.collaborator.RewardsSource;
import com.flagship.bounty_ledger.collaborator.solana.PayoutAddressValidator;
import com.flagship.bounty_ledger.config.BountyProperties;
import com.flagship.bounty_ledger.exception.CollaboratorException;
import com.flagship.bounty_ledger.exception.ConflictException;
import com.flagship.bounty_ledger.payment.Payment;
import com.flagship.bounty_ledger.payment.PaymentService;
import com.flagship.bounty_ledger.task.TaskPersistenceService;
import com.flagship.bounty_ledger.task.TaskStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Operator view of the funding side: the ledger record, the live network balance and the
 * creator rewards that can top the balance up.
 *
 * Nothing here gates settlement. Operators read the balance before bulk-settling.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BudgetService {

    private final LedgerService ledgerService;
    private final BalanceReader balanceReader;
    private final RewardsSource rewardsSource;
    private final BudgetAdvisor budgetAdvisor;
    private final PaymentService paymentService;
    private final TaskPersistenceService taskPersistenceService;
    private final PayoutAddressValidator addressValidator;
    private final BoundedCaller boundedCaller;
    private final BountyProperties properties;

    /**
     * The ledger record plus the funding address's live balance. An unreachable network leaves
     * the live balance out rather than failing the read.
     */
    public BudgetSnapshot getBudget() {
        Budget budget = ledgerService.getBudget();
        BountyProperties.Settlement settlement = properties.getSettlement();
        if (!settlement.hasFundingAddress()) {
            return new BudgetSnapshot(budget, null, null, settlement.getNetwork());
        }
        BigDecimal liveBalance = null;
        try {
            liveBalance = readBalance(settlement.getFundingAddress());
        } catch (CollaboratorException e) {
            log.warn("Live balance unavailable: {}", e.getMessage());
        }
        return new BudgetSnapshot(budget, settlement.getFundingAddress(), liveBalance, settlement.getNetwork());
    }

    /**
     * Overwrites the recorded balance with the funding address's current network balance.
     *
     * @throws ConflictException if no funding address is configured
     */
    public Budget refreshBalance() {
        String fundingAddress = requireFundingAddress();
        BigDecimal balance = readBalance(fundingAddress);
        return ledgerService.recordBalance(balance, fundingAddress);
    }

    public CreatorRewards creatorRewards(String walletAddress) {
        String address = resolveAddress(walletAddress);
        return boundedCaller.call(Collaborator.REWARDS_SOURCE, properties.getRewards().getTimeout(),
                () -> rewardsSource.query(address));
    }

    /**
     * Claims accrued creator rewards; a successful claim is credited to the recorded balance.
     */
    public RewardsClaim claimRewards(String walletAddress) {
        String address = resolveAddress(walletAddress);
        RewardsClaim claim = boundedCaller.call(Collaborator.REWARDS_SOURCE, properties.getRewards().getTimeout(),
                () -> rewardsSource.claim(address));
        if (claim.isSuccess() && claim.getAmountClaimed() != null && claim.getAmountClaimed().signum() > 0) {
            ledgerService.creditBalance(claim.getAmountClaimed());
            log.info("Claimed {} in creator rewards for {}", claim.getAmountClaimed().toPlainString(), address);
        } else if (!claim.isSuccess()) {
            log.warn("Creator rewards claim for {} failed: {}", address, claim.getError());
        }
        return claim;
    }

    /**
     * Asks the advisor to assess the recorded balance against pending payouts and completed work.
     *
     * @throws CollaboratorException if the advisor fails or times out
     */
    public BudgetAdvice analyze() {
        BigDecimal balance = ledgerService.getBudget().getBalance();
        BigDecimal pending = paymentService.listPending().stream()
                .map(Payment::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        long completedTasks = taskPersistenceService.countByStatus(TaskStatus.COMPLETED);

        BudgetAdvice advice = boundedCaller.call(Collaborator.BUDGET_ADVISOR, properties.getJudge().getTimeout(),
                () -> budgetAdvisor.advise(balance, pending, completedTasks));
        if (advice == null) {
            throw new CollaboratorException(Collaborator.BUDGET_ADVISOR.getDisplayName(), "Advisor returned no analysis");
        }
        log.info("Budget analysis: balance={}, pending={}, completedTasks={}, healthScore={}",
                balance.toPlainString(), pending.toPlainString(), completedTasks, advice.getHealthScore());
        return advice;
    }

    private BigDecimal readBalance(String address) {
        return boundedCaller.call(Collaborator.BALANCE_READER, properties.getSettlement().getConfirmTimeout(),
                () -> balanceReader.balanceOf(address));
    }

    private String requireFundingAddress() {
        if (!properties.getSettlement().hasFundingAddress()) {
            throw new ConflictException("Funding address is not configured");
        }
        return properties.getSettlement().getFundingAddress();
    }

    private String resolveAddress(String walletAddress) {
        String address = walletAddress == null || walletAddress.isBlank()
                ? requireFundingAddress()
                : walletAddress.trim();
        if (!addressValidator.isValid(address)) {
            throw new IllegalArgumentException("Invalid wallet address");
        }
        return address;
    }
}
