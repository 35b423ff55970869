package com.flagship.bounty_ledger.collaborator;

/**
 * Creator-fee rewards accrued to the funding address on the token launch platform.
 */
public interface RewardsSource {

    CreatorRewards query(String address);

    RewardsClaim claim(String address);
}
