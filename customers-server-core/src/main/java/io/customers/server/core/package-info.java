/**
 * Framework-neutral server core for the customers service.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.customers.server.core.CustomersHandler} (outcome to response mapping)</li>
 *   <li>{@link io.customers.server.core.CustomerRoutes} (ordered route table)</li>
 *   <li>{@link io.customers.server.core.CustomerOperations} (list, create, fetch, update, delete)</li>
 *   <li>{@link io.customers.server.core.InMemoryCustomerStore} (the shared store)</li>
 *   <li>{@link io.customers.server.core.CustomerLoader} (initial data)</li>
 * </ul>
 *
 * <p>Hosts adapt {@link io.customers.server.core.ServerRequest} and
 * {@link io.customers.server.core.ServerResponse} to their HTTP runtimes.
 */
package io.customers.server.core;
