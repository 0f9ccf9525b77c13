package com.flagship.settlement_ledger.ledger;

import lombok.Getter;

/**
 * Everything one replay mutates: accounts, applied transactions and disputes.
 * Create one per replay and pass it to every {@link TransactionEngine#apply} call.
 */
@Getter
public class LedgerState {

    private final ClientLedger ledger = new ClientLedger();
    private final TransactionHistory history = new TransactionHistory();
    private final DisputeSet disputes = new DisputeSet();
}
