/**
 * Server-side SPI for the customers service.
 *
 * <p>Holds the {@link io.customers.server.spi.Customer} record, the guarded
 * {@link io.customers.server.spi.CustomerStore} and the
 * {@link io.customers.server.spi.CustomerOutcome} every operation returns. The SPI is blocking;
 * hosts run it on whatever threads their HTTP runtime provides.
 */
package io.customers.server.spi;
