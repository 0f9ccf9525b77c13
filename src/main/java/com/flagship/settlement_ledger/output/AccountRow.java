package com.flagship.settlement_ledger.output;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.flagship.settlement_ledger.ledger.ClientAccount;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Final state of one client, as written to the output CSV.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountRow {
    int client;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;

    public static AccountRow from(ClientAccount account) {
        return new AccountRow(
            account.getClientId(),
            normalize(account.getAvailable()),
            normalize(account.getHeld()),
            normalize(account.getTotal()),
            account.isLocked()
        );
    }

    // 10.0 and 10 print the same, so a file never mixes scales
    private static BigDecimal normalize(BigDecimal amount) {
        return amount.signum() == 0 ? BigDecimal.ZERO : amount.stripTrailingZeros();
    }
}
