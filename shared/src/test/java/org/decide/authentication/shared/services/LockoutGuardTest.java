package org.decide.authentication.shared.services;

import org.decide.authentication.shared.entity.User;
import org.decide.authentication.shared.exceptions.UserAlreadyExistsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class LockoutGuardTest {

    private static final String USERNAME = "voter1";
    private static final int MAX_ATTEMPTS = 3;

    private final UserStore userStore = new InMemoryUserStore();
    private final CodeStorageService codeStorageService =
            new CodeStorageService(new InMemoryKeyValueStore());
    private final LockoutGuard lockoutGuard =
            new LockoutGuard(codeStorageService, userStore, MAX_ATTEMPTS);
    private User user;

    @BeforeEach
    void setup() throws UserAlreadyExistsException {
        user = userStore.create(new User().withUsername(USERNAME).withPassword("hash"));
    }

    @Test
    void shouldCountFailuresBelowTheThreshold() {
        assertFalse(lockoutGuard.recordFailure(USERNAME));
        assertFalse(lockoutGuard.recordFailure(USERNAME));

        assertThat(lockoutGuard.getFailureCount(USERNAME), equalTo(2L));
        assertFalse(userStore.findById(user.getId()).get().isBlocked());
    }

    @Test
    void shouldBlockTheAccountAndResetTheCounterAtTheThreshold() {
        lockoutGuard.recordFailure(USERNAME);
        lockoutGuard.recordFailure(USERNAME);

        assertTrue(lockoutGuard.recordFailure(USERNAME));
        assertTrue(userStore.findById(user.getId()).get().isBlocked());
        assertThat(lockoutGuard.getFailureCount(USERNAME), equalTo(0L));
    }

    @Test
    void shouldResetTheCounterOnSuccess() {
        lockoutGuard.recordFailure(USERNAME);
        lockoutGuard.recordFailure(USERNAME);

        lockoutGuard.recordSuccess(USERNAME);

        assertThat(lockoutGuard.getFailureCount(USERNAME), equalTo(0L));
        assertFalse(lockoutGuard.recordFailure(USERNAME));
        assertFalse(lockoutGuard.recordFailure(USERNAME));
        assertFalse(userStore.findById(user.getId()).get().isBlocked());
    }

    @Test
    void shouldNotReportABlockForAnUnknownAccount() {
        for (int i = 0; i < MAX_ATTEMPTS - 1; i++) {
            assertFalse(lockoutGuard.recordFailure("nobody"));
        }

        assertFalse(lockoutGuard.recordFailure("nobody"));
        assertThat(lockoutGuard.getFailureCount("nobody"), equalTo(0L));
    }

    @Test
    void shouldBlockOnTheFirstFailureWithAThresholdOfOne() {
        var strictGuard = new LockoutGuard(codeStorageService, userStore, 1);

        assertTrue(strictGuard.recordFailure(USERNAME));
        assertTrue(userStore.findById(user.getId()).get().isBlocked());
    }

    @Test
    void shouldRejectAThresholdBelowOne() {
        assertThrows(
                IllegalArgumentException.class,
                () -> new LockoutGuard(codeStorageService, userStore, 0));
    }

    @Test
    void shouldNotTouchTheUserStoreBelowTheThreshold() {
        var mockUserStore = mock(UserStore.class);
        var mockCodeStorage = mock(CodeStorageService.class);
        when(mockCodeStorage.increaseIncorrectPasswordCount(USERNAME)).thenReturn(1L);
        var guard = new LockoutGuard(mockCodeStorage, mockUserStore, MAX_ATTEMPTS);

        guard.recordFailure(USERNAME);

        verify(mockUserStore, never()).update(anyLong(), any());
        verify(mockCodeStorage, never()).deleteIncorrectPasswordCount(USERNAME);
    }

    @Test
    void shouldCountEveryConcurrentFailure() throws Exception {
        var guard = new LockoutGuard(codeStorageService, userStore, 1000);
        int threads = 10;
        int failuresPerThread = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                tasks.add(
                        () -> {
                            for (int j = 0; j < failuresPerThread; j++) {
                                guard.recordFailure(USERNAME);
                            }
                            return true;
                        });
            }
            for (Future<Boolean> future : executor.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(guard.getFailureCount(USERNAME), equalTo((long) threads * failuresPerThread));
        assertFalse(userStore.findById(user.getId()).get().isBlocked());
    }

    @Test
    void shouldBlockExactlyOnceWhenConcurrentFailuresCrossTheThreshold() throws Exception {
        int threads = MAX_ATTEMPTS;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        List<Future<Boolean>> results;
        try {
            List<Callable<Boolean>> tasks = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                tasks.add(() -> lockoutGuard.recordFailure(USERNAME));
            }
            results = executor.invokeAll(tasks);
        } finally {
            executor.shutdown();
        }

        long blocks = 0;
        for (Future<Boolean> result : results) {
            if (result.get()) {
                blocks++;
            }
        }
        assertThat(blocks, equalTo(1L));
        assertTrue(userStore.findById(user.getId()).get().isBlocked());
    }
}
