package io.customers.json.spi;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * {@link ServiceLoader} entry point for {@link JsonCodec} implementations.
 *
 * <p>Implementations register themselves in
 * {@code META-INF/services/io.customers.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    JsonCodec codec();

    /**
     * Returns the codec of the first provider found on the given class loader.
     */
    static Optional<JsonCodec> load(ClassLoader cl) {
        for (JsonCodecProvider provider : ServiceLoader.load(JsonCodecProvider.class, cl)) {
            JsonCodec codec = provider.codec();
            if (codec != null) return Optional.of(codec);
        }
        return Optional.empty();
    }

    /**
     * Like {@link #load(ClassLoader)} on the context class loader, failing when no codec is installed.
     *
     * @throws IllegalStateException if no provider is on the class path
     */
    static JsonCodec loadDefault() {
        return load(Thread.currentThread().getContextClassLoader())
                .orElseThrow(() -> new IllegalStateException("no JsonCodecProvider installed; add customers-json-jackson"));
    }
}
