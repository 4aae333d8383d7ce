package com.rbparser.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Source of a JSON serializer for syntax trees. Implementations are discovered
 * with {@link ServiceLoader}; putting garnet-jackson on the classpath is enough.
 *
 * <pre>{@code
 * String json = AstJsonProvider.getProvider().getSerializer().serialize(program);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * The provider name, for example "Jackson".
     */
    String getName();

    /**
     * The first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        Iterator<AstJsonProvider> iterator = ServiceLoader.load(AstJsonProvider.class).iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add garnet-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * The provider with the given name, ignoring case.
     *
     * @throws IllegalStateException if no provider matches
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider found with name '" + name + "'.");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).iterator().hasNext();
    }
}
