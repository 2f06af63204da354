package io.customers.server.spi;

import java.util.Objects;

/**
 * A customer record.
 *
 * <p>{@code guid} identifies the record and never changes once the record is stored. All other
 * fields are replaced wholesale on update. Values are taken as given: no format checks are made.
 */
public record Customer(String guid, String firstName, String lastName, String email, String address) {

    public Customer {
        Objects.requireNonNull(guid, "guid");
        Objects.requireNonNull(firstName, "firstName");
        Objects.requireNonNull(lastName, "lastName");
        Objects.requireNonNull(email, "email");
        Objects.requireNonNull(address, "address");
    }

    /**
     * Returns a copy of this record carrying the given guid.
     */
    public Customer withGuid(String guid) {
        if (this.guid.equals(guid)) return this;
        return new Customer(guid, firstName, lastName, email, address);
    }
}
