package com.flagship.settlement_ledger.ledger;

import lombok.Value;

/**
 * Rules for dispute handling that the transaction format leaves open.
 *
 * allowOnLockedAccount: accept dispute, resolve and chargeback records for a
 * client whose account is locked. When false they fail with ACCOUNT_LOCKED.
 *
 * allowRedisputeAfterChargeback: accept a new dispute on a transaction that was
 * already charged back. When false it fails with ALREADY_CHARGED_BACK.
 */
@Value
public class DisputePolicy {
    boolean allowOnLockedAccount;
    boolean allowRedisputeAfterChargeback;

    /**
     * Both questions answered "no".
     */
    public static DisputePolicy strict() {
        return new DisputePolicy(false, false);
    }
}
