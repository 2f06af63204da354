package io.customers.server.core;

import io.customers.server.spi.Customer;
import io.customers.server.spi.CustomerOutcome;
import io.customers.server.spi.CustomerStore;

import java.util.List;
import java.util.ListIterator;
import java.util.Objects;

/**
 * The five customer operations.
 *
 * <p>Each operation takes the store's guard exactly once and releases it before returning, so
 * every operation is atomic with respect to the others. No operation calls another while holding
 * the guard.
 */
public final class CustomerOperations {
    private final CustomerStore store;

    public CustomerOperations(CustomerStore store) {
        this.store = Objects.requireNonNull(store, "store");
    }

    /**
     * Point-in-time snapshot of every customer, in insertion order.
     */
    public CustomerOutcome list() {
        List<Customer> snapshot;
        try (CustomerStore.Handle handle = store.acquire()) {
            snapshot = List.copyOf(handle.customers());
        }
        return CustomerOutcome.listed(snapshot);
    }

    /**
     * Appends {@code candidate} unless its guid is already stored.
     *
     * @return {@code CREATED}, or {@code CONFLICT} with the store unchanged
     */
    public CustomerOutcome create(Customer candidate) {
        Objects.requireNonNull(candidate, "candidate");
        try (CustomerStore.Handle handle = store.acquire()) {
            List<Customer> customers = handle.customers();
            for (Customer existing : customers) {
                if (existing.guid().equals(candidate.guid())) {
                    return CustomerOutcome.conflict(candidate.guid());
                }
            }
            customers.add(candidate);
        }
        return CustomerOutcome.created(candidate.guid());
    }

    /**
     * @return {@code FOUND} with the customer, or {@code NOT_FOUND}
     */
    public CustomerOutcome fetch(String guid) {
        Objects.requireNonNull(guid, "guid");
        try (CustomerStore.Handle handle = store.acquire()) {
            for (Customer existing : handle.customers()) {
                if (existing.guid().equals(guid)) {
                    return CustomerOutcome.found(existing);
                }
            }
        }
        return CustomerOutcome.notFound(guid);
    }

    /**
     * Replaces the customer with {@code updated.guid()} in place. All fields are overwritten.
     *
     * @return {@code UPDATED}, or {@code NOT_FOUND} with the store unchanged
     */
    public CustomerOutcome update(Customer updated) {
        Objects.requireNonNull(updated, "updated");
        try (CustomerStore.Handle handle = store.acquire()) {
            ListIterator<Customer> it = handle.customers().listIterator();
            while (it.hasNext()) {
                if (it.next().guid().equals(updated.guid())) {
                    it.set(updated);
                    return CustomerOutcome.updated(updated.guid());
                }
            }
        }
        return CustomerOutcome.notFound(updated.guid());
    }

    /**
     * Removes every customer with {@code guid} in one pass, keeping the order of the rest.
     *
     * @return {@code DELETED} if anything was removed, otherwise {@code NOT_FOUND}
     */
    public CustomerOutcome delete(String guid) {
        Objects.requireNonNull(guid, "guid");
        boolean removed;
        try (CustomerStore.Handle handle = store.acquire()) {
            removed = handle.customers().removeIf(c -> c.guid().equals(guid));
        }
        return removed ? CustomerOutcome.deleted(guid) : CustomerOutcome.notFound(guid);
    }
}
