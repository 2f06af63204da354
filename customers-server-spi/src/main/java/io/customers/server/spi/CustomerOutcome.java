package io.customers.server.spi;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of a customer operation or of routing a request.
 *
 * <p>Only {@link Status#LISTED} and {@link Status#FOUND} carry a payload.
 */
public final class CustomerOutcome {
    public enum Status {
        LISTED,
        CREATED,
        FOUND,
        UPDATED,
        DELETED,
        CONFLICT,         // guid already stored
        NOT_FOUND,        // no customer with that guid
        BAD_REQUEST,      // body is not a well-formed customer
        ROUTE_NOT_FOUND   // no route for method + path
    }

    private final Status status;
    private final List<Customer> customers;
    private final Customer customer;
    private final String guid;
    private final String message;

    private CustomerOutcome(Status status, List<Customer> customers, Customer customer, String guid, String message) {
        this.status = Objects.requireNonNull(status, "status");
        this.customers = customers;
        this.customer = customer;
        this.guid = guid;
        this.message = message;
    }

    public static CustomerOutcome listed(List<Customer> snapshot) {
        return new CustomerOutcome(Status.LISTED, List.copyOf(snapshot), null, null, null);
    }

    public static CustomerOutcome created(String guid) {
        return new CustomerOutcome(Status.CREATED, null, null, Objects.requireNonNull(guid, "guid"), null);
    }

    public static CustomerOutcome found(Customer customer) {
        Objects.requireNonNull(customer, "customer");
        return new CustomerOutcome(Status.FOUND, null, customer, customer.guid(), null);
    }

    public static CustomerOutcome updated(String guid) {
        return new CustomerOutcome(Status.UPDATED, null, null, guid, null);
    }

    public static CustomerOutcome deleted(String guid) {
        return new CustomerOutcome(Status.DELETED, null, null, guid, null);
    }

    public static CustomerOutcome conflict(String guid) {
        return new CustomerOutcome(Status.CONFLICT, null, null, guid, "guid already exists");
    }

    public static CustomerOutcome notFound(String guid) {
        return new CustomerOutcome(Status.NOT_FOUND, null, null, guid, "customer not found");
    }

    public static CustomerOutcome badRequest(String message) {
        return new CustomerOutcome(Status.BAD_REQUEST, null, null, null, message);
    }

    public static CustomerOutcome routeNotFound() {
        return new CustomerOutcome(Status.ROUTE_NOT_FOUND, null, null, null, null);
    }

    public Status status() {
        return status;
    }

    /**
     * Snapshot of the collection, present only for {@link Status#LISTED}.
     */
    public Optional<List<Customer>> customers() {
        return Optional.ofNullable(customers);
    }

    /**
     * The matching customer, present only for {@link Status#FOUND}.
     */
    public Optional<Customer> customer() {
        return Optional.ofNullable(customer);
    }

    /**
     * The guid the operation was about, if any.
     */
    public Optional<String> guid() {
        return Optional.ofNullable(guid);
    }

    public Optional<String> message() {
        return Optional.ofNullable(message);
    }

    @Override
    public String toString() {
        return "CustomerOutcome{" + status + (guid == null ? "" : ", guid=" + guid) + "}";
    }
}
