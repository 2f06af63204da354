package io.customers.server.spi;

import java.util.List;

/**
 * The single shared collection of customers.
 *
 * <p>The collection is only reachable through {@link #acquire()}, which hands out exclusive access
 * until the returned {@link Handle} is closed:
 * <pre>{@code
 * try (CustomerStore.Handle handle = store.acquire()) {
 *     handle.customers().add(customer);
 * }
 * }</pre>
 */
public interface CustomerStore {

    /**
     * Blocks until no other holder is active, then returns exclusive access to the collection.
     */
    Handle acquire();

    /**
     * Exclusive access to the collection. Closing it releases the guard.
     */
    interface Handle extends AutoCloseable {

        /**
         * The live, insertion-ordered collection. Only valid until {@link #close()}.
         *
         * @throws IllegalStateException if the handle was already closed
         */
        List<Customer> customers();

        /**
         * Releases the guard. Closing twice is a no-op.
         */
        @Override
        void close();
    }
}
