package io.customers.server.javalin;

import io.customers.server.core.CustomerLoader;
import io.customers.server.core.CustomersHandler;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Properties;

/**
 * Settings for {@link CustomerServer}.
 *
 * <p>{@link #load()} reads {@code customers.properties} from the class path and then applies JVM
 * system properties with the same keys:
 * <pre>
 * customers.host=127.0.0.1
 * customers.port=3000
 * customers.data-file=data/customers.json
 * customers.max-body-size=16384
 * </pre>
 */
public final class CustomerServerConfig {

    public static final String HOST = "customers.host";
    public static final String PORT = "customers.port";
    public static final String DATA_FILE = "customers.data-file";
    public static final String MAX_BODY_SIZE = "customers.max-body-size";

    static final String RESOURCE = "customers.properties";

    private final String host;
    private final int port;
    private final Path dataFile;
    private final long maxBodySize;

    private CustomerServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.dataFile = builder.dataFile;
        this.maxBodySize = builder.maxBodySize;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Class path defaults overridden by system properties.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static CustomerServerConfig load() {
        Properties merged = new Properties();
        try (InputStream in = CustomerServerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) merged.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read " + RESOURCE, e);
        }
        for (String key : new String[] {HOST, PORT, DATA_FILE, MAX_BODY_SIZE}) {
            String override = System.getProperty(key);
            if (override != null) merged.setProperty(key, override);
        }
        return from(merged);
    }

    /**
     * Builds a config from {@code props}; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static CustomerServerConfig from(Properties props) {
        Builder b = builder();
        String host = props.getProperty(HOST);
        if (host != null) b.host(host.trim());
        String port = props.getProperty(PORT);
        if (port != null) b.port(parseInt(PORT, port));
        String dataFile = props.getProperty(DATA_FILE);
        if (dataFile != null) b.dataFile(Path.of(dataFile.trim()));
        String maxBody = props.getProperty(MAX_BODY_SIZE);
        if (maxBody != null) b.maxBodySize(parseLong(MAX_BODY_SIZE, maxBody));
        return b.build();
    }

    public String host() {
        return host;
    }

    /** Port to bind; 0 picks a free one. */
    public int port() {
        return port;
    }

    public Path dataFile() {
        return dataFile;
    }

    public long maxBodySize() {
        return maxBodySize;
    }

    @Override
    public String toString() {
        return "CustomerServerConfig{host=" + host + ", port=" + port + ", dataFile=" + dataFile
                + ", maxBodySize=" + maxBodySize + "}";
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + raw, e);
        }
    }

    private static long parseLong(String key, String raw) {
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid " + key + ": " + raw, e);
        }
    }

    /**
     * Builder for {@link CustomerServerConfig}.
     */
    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = 3000;
        private Path dataFile = CustomerLoader.DEFAULT_DATA_FILE;
        private long maxBodySize = CustomersHandler.DEFAULT_MAX_BODY_SIZE;

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        public Builder port(int port) {
            if (port < 0 || port > 65535) throw new IllegalArgumentException("port out of range: " + port);
            this.port = port;
            return this;
        }

        public Builder dataFile(Path dataFile) {
            this.dataFile = Objects.requireNonNull(dataFile, "dataFile");
            return this;
        }

        public Builder maxBodySize(long maxBodySize) {
            if (maxBodySize <= 0) throw new IllegalArgumentException("max body size must be positive: " + maxBodySize);
            this.maxBodySize = maxBodySize;
            return this;
        }

        public CustomerServerConfig build() {
            if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
            return new CustomerServerConfig(this);
        }
    }
}
