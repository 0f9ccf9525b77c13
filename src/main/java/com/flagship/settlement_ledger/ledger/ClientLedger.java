package com.flagship.settlement_ledger.ledger;

import java.util.Collection;
import java.util.Collections;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Client id to account mapping. Holds exactly one account per client,
 * kept in client id order so that output is deterministic.
 */
public class ClientLedger {

    private final SortedMap<Integer, ClientAccount> accounts = new TreeMap<>();

    ClientAccount getOrCreate(int clientId) {
        return accounts.computeIfAbsent(clientId, ClientAccount::new);
    }

    public Optional<ClientAccount> find(int clientId) {
        return Optional.ofNullable(accounts.get(clientId));
    }

    /**
     * All accounts, ordered by client id. The view is read-only.
     */
    public Collection<ClientAccount> accounts() {
        return Collections.unmodifiableCollection(accounts.values());
    }

    public int size() {
        return accounts.size();
    }
}
