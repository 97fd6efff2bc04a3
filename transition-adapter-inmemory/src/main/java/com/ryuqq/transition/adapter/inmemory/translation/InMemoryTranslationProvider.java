package com.ryuqq.transition.adapter.inmemory.translation;

import com.ryuqq.transition.core.spi.TranslationProvider;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link TranslationProvider}.
 *
 * <p>Keys follow {@code "<TypeName>:<StateOrTriggerName>"}. A key without a label
 * translates to itself.</p>
 *
 * <pre>
 * InMemoryTranslationProvider translations = new InMemoryTranslationProvider()
 *     .register("Order", "Paid", "결제 완료")
 *     .register("Order", "pay", "결제하기");
 * </pre>
 *
 * @author Transition Team
 * @since 1.0.0
 */
public class InMemoryTranslationProvider implements TranslationProvider {

    private final ConcurrentHashMap<String, String> labels;

    /**
     * Creates an empty catalog.
     */
    public InMemoryTranslationProvider() {
        this(Map.of());
    }

    /**
     * Creates a catalog from existing labels.
     *
     * @param labels translation key to label
     */
    public InMemoryTranslationProvider(Map<String, String> labels) {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        this.labels = new ConcurrentHashMap<>(labels);
    }

    /**
     * Registers a label for a state or trigger of a type.
     *
     * @param typeName entity type name
     * @param name state or trigger name
     * @param label display label
     * @return this provider
     */
    public InMemoryTranslationProvider register(String typeName, String name, String label) {
        if (label == null) {
            throw new IllegalArgumentException("label cannot be null");
        }
        labels.put(TranslationProvider.keyOf(typeName, name), label);
        return this;
    }

    @Override
    public String translate(String key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        return labels.getOrDefault(key, key);
    }
}
