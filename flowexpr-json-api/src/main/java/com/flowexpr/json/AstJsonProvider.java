package com.flowexpr.json;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Entry point for converting expression trees to and from JSON.
 *
 * <p>Implementations register themselves in
 * {@code META-INF/services/com.flowexpr.json.AstJsonProvider}; flowexpr-jackson
 * ships one named {@code Jackson}. Every provider reads and writes the same
 * document shape, so JSON written by one can be read by another:</p>
 * <pre>{@code
 * {"tag": "SUMOP", "children": [
 *     {"tag": "NUM", "value": 1}, {"tag": "OP", "value": "+"}, {"tag": "NUM", "value": 2}]}
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Name used by {@link #getProvider(String)}, e.g. {@code Jackson}.
     */
    String getName();

    /**
     * Returns the first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        return find(provider -> true).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider on the classpath, add flowexpr-jackson to the dependencies"));
    }

    /**
     * Returns the provider called {@code name}, compared ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        return find(provider -> provider.getName().equalsIgnoreCase(name))
            .orElseThrow(() -> new IllegalStateException("No AstJsonProvider named '" + name
                + "', available: " + names()));
    }

    /**
     * Names of all providers on the classpath, in discovery order.
     */
    static List<String> names() {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(AstJsonProvider::getName)
            .collect(Collectors.toList());
    }

    private static Optional<AstJsonProvider> find(Predicate<AstJsonProvider> filter) {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(filter)
            .findFirst();
    }
}
