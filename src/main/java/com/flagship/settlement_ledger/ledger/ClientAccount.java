package com.flagship.settlement_ledger.ledger;

import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Balance state of one client.
 *
 * Invariants:
 * - total = available + held
 * - held is never negative
 * - available only goes negative when a dispute holds funds that were already spent
 *
 * The mutators are package-private: only {@link TransactionEngine} moves money.
 */
@Getter
@ToString
public class ClientAccount {

    private final int clientId;
    private BigDecimal available;
    private BigDecimal held;
    private boolean locked;

    ClientAccount(int clientId) {
        this.clientId = clientId;
        this.available = BigDecimal.ZERO;
        this.held = BigDecimal.ZERO;
        this.locked = false;
    }

    public BigDecimal getTotal() {
        return available.add(held);
    }

    void credit(BigDecimal amount) {
        available = available.add(amount);
    }

    void debit(BigDecimal amount) {
        if (available.compareTo(amount) < 0) {
            throw new IllegalStateException(
                String.format("Cannot debit %s from client %d: only %s available",
                    amount.toPlainString(), clientId, available.toPlainString()));
        }
        available = available.subtract(amount);
    }

    /**
     * Moves funds from available to held. Available may go negative.
     */
    void hold(BigDecimal amount) {
        available = available.subtract(amount);
        held = held.add(amount);
    }

    /**
     * Moves previously held funds back to available.
     */
    void release(BigDecimal amount) {
        requireHeld(amount);
        held = held.subtract(amount);
        available = available.add(amount);
    }

    /**
     * Removes previously held funds from the account and locks it.
     */
    void chargeBack(BigDecimal amount) {
        requireHeld(amount);
        held = held.subtract(amount);
        locked = true;
    }

    private void requireHeld(BigDecimal amount) {
        if (held.compareTo(amount) < 0) {
            throw new IllegalStateException(
                String.format("Client %d holds %s, cannot take %s out of held funds",
                    clientId, held.toPlainString(), amount.toPlainString()));
        }
    }
}
