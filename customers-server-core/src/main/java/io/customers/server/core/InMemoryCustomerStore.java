package io.customers.server.core;

import io.customers.server.spi.Customer;
import io.customers.server.spi.CustomerStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * {@link CustomerStore} holding the collection in an {@link ArrayList} behind a {@link ReentrantLock}.
 *
 * <p>One instance exists per process and is shared by every request. Nothing is ever written back
 * to disk.
 */
public final class InMemoryCustomerStore implements CustomerStore {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Customer> customers;

    public InMemoryCustomerStore() {
        this.customers = new ArrayList<>();
    }

    /**
     * Creates a store pre-populated with {@code initial}, in iteration order.
     *
     * @throws IllegalArgumentException if two customers share a guid
     */
    public InMemoryCustomerStore(Collection<Customer> initial) {
        Objects.requireNonNull(initial, "initial");
        Set<String> seen = new HashSet<>();
        for (Customer c : initial) {
            Objects.requireNonNull(c, "customer");
            if (!seen.add(c.guid())) throw new IllegalArgumentException("duplicate guid: " + c.guid());
        }
        this.customers = new ArrayList<>(initial);
    }

    @Override
    public Handle acquire() {
        lock.lock();
        return new LockedHandle();
    }

    /** True while some thread holds the guard. Diagnostic only. */
    boolean isLocked() {
        return lock.isLocked();
    }

    private final class LockedHandle implements Handle {
        private boolean open = true;

        @Override
        public List<Customer> customers() {
            if (!open) throw new IllegalStateException("handle already closed");
            return customers;
        }

        @Override
        public void close() {
            if (!open) return;
            open = false;
            lock.unlock();
        }
    }
}
