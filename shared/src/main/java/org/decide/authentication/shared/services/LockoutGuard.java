package org.decide.authentication.shared.services;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Counts consecutive failed sign-in attempts per account and blocks the account once the
 * configured threshold is reached. The count lives in {@link CodeStorageService}, whose backing
 * store increments atomically, so concurrent failures for one account are never lost.
 */
public class LockoutGuard {

    private static final Logger LOG = LogManager.getLogger(LockoutGuard.class);

    private final CodeStorageService codeStorageService;
    private final UserStore userStore;
    private final int maxFailedLoginAttempts;

    public LockoutGuard(
            CodeStorageService codeStorageService,
            UserStore userStore,
            int maxFailedLoginAttempts) {
        if (maxFailedLoginAttempts < 1) {
            throw new IllegalArgumentException("maxFailedLoginAttempts must be at least 1");
        }
        this.codeStorageService = codeStorageService;
        this.userStore = userStore;
        this.maxFailedLoginAttempts = maxFailedLoginAttempts;
    }

    /**
     * @param accountKey the username the attempt was made for; it need not belong to an account
     * @return true when this failure blocked the account
     */
    public boolean recordFailure(String accountKey) {
        long count = codeStorageService.increaseIncorrectPasswordCount(accountKey);
        if (count < maxFailedLoginAttempts) {
            return false;
        }
        LOG.info("Failed sign in threshold of {} reached", maxFailedLoginAttempts);
        codeStorageService.deleteIncorrectPasswordCount(accountKey);

        var blockedUser =
                userStore
                        .findByUsername(accountKey)
                        .flatMap(user -> userStore.update(user.getId(), u -> u.withBlocked(true)));
        if (blockedUser.isEmpty()) {
            LOG.info("No account to block for the failed sign in attempts");
            return false;
        }
        LOG.warn(
                "Blocked user {} after repeated failed sign in attempts",
                blockedUser.get().getId());
        return true;
    }

    public void recordSuccess(String accountKey) {
        codeStorageService.deleteIncorrectPasswordCount(accountKey);
    }

    public long getFailureCount(String accountKey) {
        return codeStorageService.getIncorrectPasswordCount(accountKey);
    }

    public int getMaxFailedLoginAttempts() {
        return maxFailedLoginAttempts;
    }
}
