package com.imperium.lexi.service.impl;

import com.imperium.lexi.ai.embedding.EmbeddingProvider;
import com.imperium.lexi.exception.EmbeddingException;
import com.imperium.lexi.service.EmbeddingService;
import com.imperium.lexi.util.TextDigests;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Service
public class EmbeddingServiceImpl implements EmbeddingService {

    private static final Logger log = LoggerFactory.getLogger(EmbeddingServiceImpl.class);

    private final List<EmbeddingProvider> providers;
    private final String defaultProvider;
    private final int dimension;
    private final int maxInputChars;
    private final Set<String> driftWarned = ConcurrentHashMap.newKeySet();

    public EmbeddingServiceImpl(List<EmbeddingProvider> providers,
                                @Value("${app.ai.embedding.default-provider:openai}") String defaultProvider,
                                @Value("${app.ai.embedding.dimension:1536}") int dimension,
                                @Value("${app.ai.embedding.max-input-chars:8000}") int maxInputChars) {
        if (providers == null || providers.isEmpty()) {
            throw new IllegalStateException("At least one embedding provider is required");
        }
        this.providers = List.copyOf(providers);
        this.defaultProvider = defaultProvider;
        this.dimension = dimension;
        this.maxInputChars = maxInputChars;
    }

    @Override
    public float[] generateEmbedding(String text) {
        return generateEmbedding(text, defaultProvider);
    }

    @Override
    public float[] generateEmbedding(String text, String preferredProvider) {
        return embed(text, preferredProvider).vector();
    }

    @Override
    public EmbeddingResult embed(String text, String preferredProvider) {
        requireText(text);
        String input = TextDigests.truncate(text, maxInputChars);

        EmbeddingException failure = null;
        for (EmbeddingProvider provider : chainFor(preferredProvider)) {
            if (!provider.isConfigured()) {
                log.debug("Embedding provider {} not configured, skipping", provider.name());
                continue;
            }
            try {
                float[] vector = provider.embed(input);
                if (vector == null || vector.length == 0) {
                    throw new EmbeddingException(provider.name() + " returned an empty embedding");
                }
                checkDimension(provider.name(), vector);
                return new EmbeddingResult(vector, provider.name());
            } catch (RuntimeException e) {
                log.warn("{} embedding failed, trying next provider: {}", provider.name(), e.getMessage());
                if (failure == null) {
                    failure = new EmbeddingException("All embedding providers failed");
                }
                failure.addSuppressed(e);
            }
        }
        if (failure == null) {
            failure = new EmbeddingException("No embedding provider is configured");
        }
        log.error("All embedding providers failed for text of length {}", input.length());
        throw failure;
    }

    @Override
    public List<float[]> generateEmbeddingsBatch(List<String> texts, String provider) {
        if (texts == null || texts.isEmpty()) {
            throw new IllegalArgumentException("Texts must be a non-empty list");
        }
        texts.forEach(EmbeddingServiceImpl::requireText);
        List<String> inputs = texts.stream().map(t -> TextDigests.truncate(t, maxInputChars)).toList();

        EmbeddingProvider preferred = chainFor(provider).get(0);
        if (preferred.isConfigured() && preferred.supportsBatch()) {
            try {
                List<float[]> vectors = preferred.embedBatch(inputs);
                if (vectors != null && vectors.size() == inputs.size()) {
                    vectors.forEach(v -> checkDimension(preferred.name(), v));
                    return vectors;
                }
                log.warn("{} batch embedding returned {} vectors for {} inputs, falling back to individual",
                        preferred.name(), vectors != null ? vectors.size() : 0, inputs.size());
            } catch (RuntimeException e) {
                log.warn("{} batch embedding failed, falling back to individual: {}", preferred.name(), e.getMessage());
            }
        }

        List<float[]> vectors = new ArrayList<>(inputs.size());
        for (String input : inputs) {
            vectors.add(generateEmbedding(input, preferred.name()));
        }
        return vectors;
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getDefaultProvider() {
        return defaultProvider;
    }

    /** 首选后端在前，其余按注册顺序作为备用 */
    private List<EmbeddingProvider> chainFor(String preferredProvider) {
        String preferred = preferredProvider != null ? preferredProvider : defaultProvider;
        EmbeddingProvider first = findProvider(preferred);
        if (first == null) {
            first = findProvider(defaultProvider);
        }
        if (first == null) {
            first = providers.get(0);
        }
        List<EmbeddingProvider> chain = new ArrayList<>(providers.size());
        chain.add(first);
        for (EmbeddingProvider p : providers) {
            if (p != first) {
                chain.add(p);
            }
        }
        return chain;
    }

    private EmbeddingProvider findProvider(String name) {
        for (EmbeddingProvider p : providers) {
            if (p.name().equals(name)) {
                return p;
            }
        }
        return null;
    }

    private void checkDimension(String provider, float[] vector) {
        if (vector != null && vector.length != dimension && driftWarned.add(provider + ":" + vector.length)) {
            log.warn("Embedding dimension drift: {} produced {} dims, deployment expects {}",
                    provider, vector.length, dimension);
        }
    }

    private static void requireText(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Text is required and must be a non-empty string");
        }
    }
}
