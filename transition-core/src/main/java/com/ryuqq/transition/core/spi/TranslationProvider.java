package com.ryuqq.transition.core.spi;

/**
 * Translation boundary SPI.
 *
 * <p>Maps a key of the form {@code "<TypeName>:<StateOrTriggerName>"} to a display label.
 * The provider is injected into the engine; there is no process-wide catalog.</p>
 *
 * @author Transition Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface TranslationProvider {

    /**
     * Translates a key.
     *
     * @param key translation key, e.g. {@code "Order:pay"}
     * @return the label, or the key itself when the catalog has no entry
     */
    String translate(String key);

    /**
     * Provider that returns every key unchanged.
     *
     * @return identity provider
     */
    static TranslationProvider identity() {
        return key -> key;
    }

    /**
     * Builds a translation key.
     *
     * @param typeName entity type name
     * @param name state or trigger name
     * @return {@code typeName + ":" + name}
     */
    static String keyOf(String typeName, String name) {
        return typeName + ":" + name;
    }
}
