package com.lendmatch.auth;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Keeps manager approvals in memory.
 */
@Service
public class InMemoryPermissionManager implements PermissionManager {

    private static final Logger log = LoggerFactory.getLogger(InMemoryPermissionManager.class);

    private final Map<String, Set<String>> managersByDelegator = new ConcurrentHashMap<>();

    @Override
    public boolean isManagedBy(String delegator, String manager) {
        if (delegator == null || manager == null) {
            return false;
        }
        if (delegator.equalsIgnoreCase(manager)) {
            return true;
        }
        return managersByDelegator.getOrDefault(normalize(delegator), Set.of()).contains(normalize(manager));
    }

    @Override
    public void approveManager(String delegator, String manager, boolean isAllowed) {
        Set<String> managers =
                managersByDelegator.computeIfAbsent(normalize(delegator), d -> ConcurrentHashMap.newKeySet());
        if (isAllowed) {
            managers.add(normalize(manager));
        } else {
            managers.remove(normalize(manager));
        }
        log.info("Manager {} {} for {}", manager, isAllowed ? "approved" : "revoked", delegator);
    }

    private String normalize(String address) {
        return address.toLowerCase();
    }
}
