package com.flagship.settlement_ledger.ledger;

import com.flagship.settlement_ledger.transaction.DisputeAction;
import com.flagship.settlement_ledger.transaction.FundsMovement;
import com.flagship.settlement_ledger.transaction.TransactionRecord;
import org.springframework.stereotype.Service;

/**
 * Applies transaction records to a {@link LedgerState}.
 *
 * Enforces the account rules and the dispute lifecycle of a disputable
 * transaction:
 * - NORMAL → DISPUTED (dispute)
 * - DISPUTED → NORMAL (resolve)
 * - DISPUTED → CHARGED_BACK (chargeback, locks the account)
 *
 * The engine keeps no state of its own and does no I/O. Each record is either
 * applied completely or rejected without touching the state. Records must be
 * applied in input order because disputes depend on earlier deposits and
 * withdrawals.
 */
@Service
public class TransactionEngine {

    private final DisputePolicy disputePolicy;

    public TransactionEngine(DisputePolicy disputePolicy) {
        this.disputePolicy = disputePolicy;
    }

    /**
     * Applies one record.
     *
     * @param state the replay's state, mutated only when the record is applied
     * @param record validated record
     * @return applied, or rejected with the reason
     */
    public ApplyResult apply(LedgerState state, TransactionRecord record) {
        try {
            switch (record.getType()) {
                case DEPOSIT -> deposit(state, (FundsMovement) record);
                case WITHDRAWAL -> withdraw(state, (FundsMovement) record);
                case DISPUTE -> dispute(state, (DisputeAction) record);
                case RESOLVE -> resolve(state, (DisputeAction) record);
                case CHARGEBACK -> chargeback(state, (DisputeAction) record);
            }
            return ApplyResult.applied();
        } catch (TransactionRejectedException e) {
            return ApplyResult.rejected(e.getError());
        }
    }

    private void deposit(LedgerState state, FundsMovement deposit) {
        ClientAccount account = state.getLedger().getOrCreate(deposit.getClientId());
        requireUnusedTransactionId(state, deposit);
        requireUnlocked(account, deposit);

        account.credit(deposit.getAmount());
        state.getHistory().record(HistoricalTransaction.of(deposit));
    }

    private void withdraw(LedgerState state, FundsMovement withdrawal) {
        ClientAccount account = state.getLedger().getOrCreate(withdrawal.getClientId());
        requireUnusedTransactionId(state, withdrawal);
        requireUnlocked(account, withdrawal);

        if (account.getAvailable().compareTo(withdrawal.getAmount()) < 0) {
            throw reject(TransactionErrorKind.INSUFFICIENT_FUNDS, withdrawal,
                String.format("Client %d cannot withdraw %s in transaction %d: %s available",
                    withdrawal.getClientId(), withdrawal.getAmount().toPlainString(),
                    withdrawal.getTransactionId(), account.getAvailable().toPlainString()));
        }

        account.debit(withdrawal.getAmount());
        state.getHistory().record(HistoricalTransaction.of(withdrawal));
    }

    private void dispute(LedgerState state, DisputeAction dispute) {
        HistoricalTransaction target = findOwnedTransaction(state, dispute, TransactionErrorKind.TRANSACTION_NOT_FOUND);
        ClientAccount account = state.getLedger().getOrCreate(target.getClientId());
        requireDisputesAllowed(account, dispute);

        DisputeSet disputes = state.getDisputes();
        if (disputes.isChargedBack(target.getTransactionId()) && !disputePolicy.isAllowRedisputeAfterChargeback()) {
            throw reject(TransactionErrorKind.ALREADY_CHARGED_BACK, dispute,
                String.format("Transaction %d was already charged back", dispute.getTransactionId()));
        }
        if (disputes.isDisputed(target.getTransactionId())) {
            throw reject(TransactionErrorKind.ALREADY_DISPUTED, dispute,
                String.format("Transaction %d is already disputed", dispute.getTransactionId()));
        }

        account.hold(target.getAmount());
        disputes.open(target.getTransactionId());
    }

    private void resolve(LedgerState state, DisputeAction resolve) {
        HistoricalTransaction target = findDisputedTransaction(state, resolve);
        ClientAccount account = state.getLedger().getOrCreate(target.getClientId());

        account.release(target.getAmount());
        state.getDisputes().resolve(target.getTransactionId());
    }

    private void chargeback(LedgerState state, DisputeAction chargeback) {
        HistoricalTransaction target = findDisputedTransaction(state, chargeback);
        ClientAccount account = state.getLedger().getOrCreate(target.getClientId());

        account.chargeBack(target.getAmount());
        state.getDisputes().chargeBack(target.getTransactionId());
    }

    private HistoricalTransaction findDisputedTransaction(LedgerState state, DisputeAction action) {
        HistoricalTransaction target = findOwnedTransaction(state, action, TransactionErrorKind.TRANSACTION_NOT_DISPUTED);
        requireDisputesAllowed(state.getLedger().getOrCreate(target.getClientId()), action);

        if (!state.getDisputes().isDisputed(target.getTransactionId())) {
            throw reject(TransactionErrorKind.TRANSACTION_NOT_DISPUTED, action,
                String.format("Transaction %d is not disputed", action.getTransactionId()));
        }
        return target;
    }

    private HistoricalTransaction findOwnedTransaction(LedgerState state, DisputeAction action,
                                                       TransactionErrorKind missingKind) {
        HistoricalTransaction target = state.getHistory().find(action.getTransactionId())
            .orElseThrow(() -> reject(missingKind, action,
                String.format("Transaction %d does not exist", action.getTransactionId())));

        if (target.getClientId() != action.getClientId()) {
            throw reject(TransactionErrorKind.CLIENT_MISMATCH, action,
                String.format("Transaction %d belongs to client %d, not client %d",
                    action.getTransactionId(), target.getClientId(), action.getClientId()));
        }
        return target;
    }

    private void requireUnusedTransactionId(LedgerState state, FundsMovement movement) {
        if (state.getHistory().contains(movement.getTransactionId())) {
            throw reject(TransactionErrorKind.DUPLICATE_TRANSACTION, movement,
                String.format("Transaction %d already exists", movement.getTransactionId()));
        }
    }

    private void requireUnlocked(ClientAccount account, TransactionRecord record) {
        if (account.isLocked()) {
            throw reject(TransactionErrorKind.ACCOUNT_LOCKED, record,
                String.format("Client %d is locked, %s %d refused",
                    account.getClientId(), record.getType().getValue(), record.getTransactionId()));
        }
    }

    private void requireDisputesAllowed(ClientAccount account, DisputeAction action) {
        if (!disputePolicy.isAllowOnLockedAccount()) {
            requireUnlocked(account, action);
        }
    }

    private static TransactionRejectedException reject(TransactionErrorKind kind, TransactionRecord record,
                                                       String message) {
        return new TransactionRejectedException(TransactionError.of(kind, record, message));
    }
}
