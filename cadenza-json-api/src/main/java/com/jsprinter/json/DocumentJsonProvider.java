package com.jsprinter.json;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceLoader;

/**
 * Provider interface for document tree and source map JSON handling.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., cadenza-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * DocumentJsonProvider provider = DocumentJsonProvider.getProvider();
 * Document document = provider.getDeserializer().deserializeDocument(json);
 * PrintResult result = Cadenza.printToJs(document, source, options);
 * String map = provider.getSourceMapSerializer().serialize(Cadenza.sourceMap(result, source, "Card.astro"));
 * }</pre>
 */
public interface DocumentJsonProvider {

    /**
     * Returns the serializer for converting nodes to JSON.
     */
    DocumentJsonSerializer getSerializer();

    /**
     * Returns the deserializer for converting JSON to nodes and options.
     */
    DocumentJsonDeserializer getDeserializer();

    /**
     * Returns the serializer for source maps.
     */
    SourceMapJsonSerializer getSourceMapSerializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     */
    String getName();

    /**
     * Gets the first available DocumentJsonProvider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static DocumentJsonProvider getProvider() {
        Iterator<DocumentJsonProvider> providers = load().iterator();
        if (!providers.hasNext()) {
            throw new IllegalStateException(
                "No DocumentJsonProvider found on the classpath. " +
                "Add cadenza-jackson (or another provider) to your dependencies."
            );
        }
        return providers.next();
    }

    /**
     * Gets a DocumentJsonProvider by name via ServiceLoader. Names are compared ignoring case.
     *
     * @param name the provider name (e.g., "Jackson")
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static DocumentJsonProvider getProvider(String name) {
        List<String> available = new ArrayList<>();
        for (DocumentJsonProvider provider : load()) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
            available.add(provider.getName());
        }
        throw new IllegalStateException(
            "No DocumentJsonProvider named '" + name + "'; available: " + available
        );
    }

    /**
     * Checks if any provider is available on the classpath.
     */
    static boolean isProviderAvailable() {
        return load().findFirst().isPresent();
    }

    private static ServiceLoader<DocumentJsonProvider> load() {
        return ServiceLoader.load(DocumentJsonProvider.class, DocumentJsonProvider.class.getClassLoader());
    }
}
