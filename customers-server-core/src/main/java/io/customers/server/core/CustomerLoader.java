package io.customers.server.core;

import io.customers.json.spi.JsonCodec;
import io.customers.json.spi.JsonException;
import io.customers.server.spi.Customer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads the initial customer list from a JSON file.
 *
 * <p>The file holds a JSON array of customers. Whatever goes wrong (missing file, I/O error,
 * malformed JSON, null entries, duplicate guids) the loader logs it and returns an empty list: the service
 * then starts with an empty store.
 */
public final class CustomerLoader {
    private static final Logger log = LoggerFactory.getLogger(CustomerLoader.class);

    /** Default data file, relative to the working directory. */
    public static final Path DEFAULT_DATA_FILE = Path.of("data", "customers.json");

    private CustomerLoader() {}

    public static List<Customer> load(Path file, JsonCodec codec) {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(codec, "codec");

        List<Customer> customers;
        try (InputStream in = Files.newInputStream(file)) {
            customers = codec.readList(in, Customer.class);
        } catch (NoSuchFileException e) {
            log.info("No customer data at {}, starting empty", file.toAbsolutePath());
            return List.of();
        } catch (IOException | JsonException e) {
            log.warn("Could not load customers from {}, starting empty: {}", file.toAbsolutePath(), e.getMessage());
            return List.of();
        }

        Set<String> guids = new HashSet<>();
        for (Customer c : customers) {
            if (c == null) {
                log.warn("Null entry in {}, starting empty", file.toAbsolutePath());
                return List.of();
            }
            if (!guids.add(c.guid())) {
                log.warn("Duplicate guid '{}' in {}, starting empty", c.guid(), file.toAbsolutePath());
                return List.of();
            }
        }
        log.info("Loaded {} customers from {}", customers.size(), file.toAbsolutePath());
        return List.copyOf(customers);
    }

    /**
     * Builds the process-wide store from {@code file}.
     */
    public static InMemoryCustomerStore loadStore(Path file, JsonCodec codec) {
        return new InMemoryCustomerStore(load(file, codec));
    }
}
