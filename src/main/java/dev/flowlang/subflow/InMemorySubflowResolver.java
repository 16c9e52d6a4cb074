package dev.flowlang.subflow;

import dev.flowlang.model.FlowDocument;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves references against documents registered up front. Useful for embedding and tests.
 */
public final class InMemorySubflowResolver implements SubflowResolver {

    private final Map<String, FlowDocument> byReference = new ConcurrentHashMap<>();
    private final Map<String, FlowDocument> byIdentity = new ConcurrentHashMap<>();

    /** Registers a document under its own name. */
    public InMemorySubflowResolver register(FlowDocument document) {
        return register(document.name(), document);
    }

    public InMemorySubflowResolver register(String reference, FlowDocument document) {
        byReference.put(reference, document);
        byIdentity.put(document.identity(), document);
        return this;
    }

    @Override
    public Optional<FlowSource> resolve(String reference, FlowSource caller) {
        return Optional.ofNullable(byReference.get(reference)).map(FlowSource::of);
    }

    @Override
    public FlowDocument read(FlowSource source) throws IOException {
        FlowDocument document = byIdentity.get(source.identity());
        if (document == null) {
            throw new IOException("No registered flow with identity " + source.identity());
        }
        return document;
    }

    @Override
    public List<String> listAvailable(FlowSource caller) {
        var names = new ArrayList<>(byReference.keySet());
        Collections.sort(names);
        return names;
    }
}
