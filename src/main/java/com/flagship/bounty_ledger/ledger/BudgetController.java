package com.flagship.bounty_ledger.ledger;

import com.flagship.bounty_ledger.collaborator.RewardsClaim;
import com.flagship.bounty_ledger.ledger.dto.BudgetAnalysisResponse;
import com.flagship.bounty_ledger.ledger.dto.BudgetResponse;
import com.flagship.bounty_ledger.ledger.dto.ClaimRewardsRequest;
import com.flagship.bounty_ledger.ledger.dto.ClaimRewardsResponse;
import com.flagship.bounty_ledger.ledger.dto.CreatorRewardsResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Admin-only budget reads and mutations.
 */
@RestController
@RequestMapping("/api/budget")
@RequiredArgsConstructor
public class BudgetController {

    private final BudgetService budgetService;

    @GetMapping
    public BudgetResponse getBudget() {
        return BudgetResponse.from(budgetService.getBudget());
    }

    @PostMapping("/refresh")
    public BudgetResponse refreshBalance() {
        return BudgetResponse.from(budgetService.refreshBalance());
    }

    @GetMapping("/creator-rewards")
    public CreatorRewardsResponse creatorRewards(
            @RequestParam(name = "wallet_address", required = false) String walletAddress) {
        return CreatorRewardsResponse.from(budgetService.creatorRewards(walletAddress));
    }

    @PostMapping("/claim-rewards")
    public ResponseEntity<ClaimRewardsResponse> claimRewards(
            @RequestBody(required = false) ClaimRewardsRequest request) {
        RewardsClaim claim = budgetService.claimRewards(request == null ? null : request.getWalletAddress());
        HttpStatus status = claim.isSuccess() ? HttpStatus.OK : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(ClaimRewardsResponse.from(claim));
    }

    @GetMapping("/analyze")
    public BudgetAnalysisResponse analyze() {
        return BudgetAnalysisResponse.from(budgetService.analyze());
    }
}
