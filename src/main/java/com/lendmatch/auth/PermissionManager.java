package com.lendmatch.auth;

/**
 * Delegation of position management. A delegator always manages their own positions;
 * anyone else needs an explicit approval.
 */
public interface PermissionManager {

    boolean isManagedBy(String delegator, String manager);

    void approveManager(String delegator, String manager, boolean isAllowed);
}
