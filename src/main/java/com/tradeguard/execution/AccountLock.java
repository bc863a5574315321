package com.tradeguard.execution;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import org.springframework.stereotype.Component;

/**
 * The single mutual-exclusion boundary for one account.
 *
 * <p>Decision execution, venue event application and health ticks all run under it, so a risk
 * check always sees an exposure aggregate that no concurrent decision or fill can invalidate
 * before the resulting order is registered. Fair, so a steady stream of venue events cannot
 * starve decisions.
 */
@Component
public class AccountLock {

    private final ReentrantLock lock = new ReentrantLock(true);

    public <T> T call(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void run(Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }
}
