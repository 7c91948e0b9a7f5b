package com.syntree.json;

import com.syntree.Logging;
import org.apache.log4j.Logger;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for tree JSON serialization/deserialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., syntree-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(tree);
 * Node copy = provider.getDeserializer().deserialize(json);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * Returns the serializer for converting trees to JSON.
     *
     * @return the tree JSON serializer
     */
    AstJsonSerializer getSerializer();

    /**
     * Returns the deserializer for converting JSON to trees.
     *
     * @return the tree JSON deserializer
     */
    AstJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     *
     * @return the provider name
     */
    String getName();

    /**
     * Gets the first available AstJsonProvider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static AstJsonProvider getProvider() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        Iterator<AstJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            AstJsonProvider provider = iterator.next();
            Logger logger = Logging.getLogger("json");
            if (logger.isDebugEnabled()) {
                logger.debug("Using JSON provider " + provider.getName());
            }
            return provider;
        }
        throw new IllegalStateException(
            "No AstJsonProvider found on the classpath. " +
            "Add syntree-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets an AstJsonProvider by name via ServiceLoader.
     *
     * @param name the provider name (e.g., "Jackson")
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static AstJsonProvider getProvider(String name) {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        for (AstJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No AstJsonProvider found with name '" + name + "'. " +
            "Ensure the appropriate provider JAR is on the classpath."
        );
    }

    /**
     * Checks if any provider is available on the classpath.
     *
     * @return true if at least one provider is available
     */
    static boolean isProviderAvailable() {
        ServiceLoader<AstJsonProvider> loader = ServiceLoader.load(AstJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
