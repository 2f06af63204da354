package io.customers.server.core;

/**
 * HTTP methods understood by {@link CustomersHandler}. Hosts map anything else to a 404.
 */
public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    PATCH,
    DELETE,
    OPTIONS
}
