package com.permissionbroker.hooks;

/**
 * Side effect tied to granting a particular permission type, supplied by the embedding platform.
 * <p>
 * Runs exactly once for every granted permission of that type; never on denial and never for checks.
 */
@FunctionalInterface
public interface GrantHook {

    /**
     * @param ownerId process id of the context the permission was granted to
     */
    void onGranted(int ownerId);
}
