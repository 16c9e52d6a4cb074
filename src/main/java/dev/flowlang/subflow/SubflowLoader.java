package dev.flowlang.subflow;

import dev.flowlang.engine.FlowValidator;
import dev.flowlang.error.CircularDependencyException;
import dev.flowlang.error.FlowException;
import dev.flowlang.error.ValidationException;
import dev.flowlang.model.ErrorKind;
import dev.flowlang.model.FlowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Resolves subflow references for one top-level execution. Documents are parsed and validated
 * once per identity and shared by every call site afterwards.
 */
public final class SubflowLoader {

    private static final Logger log = LoggerFactory.getLogger(SubflowLoader.class);

    private final SubflowResolver resolver;
    private final int maxDepth;
    private final Map<String, FlowDocument> cache = new ConcurrentHashMap<>();

    public SubflowLoader(SubflowResolver resolver, int maxDepth) {
        this.resolver = resolver;
        this.maxDepth = maxDepth;
    }

    /**
     * Resolve {@code reference} from the innermost flow of {@code callChain}, refusing to enter a
     * flow that is already on the chain.
     *
     * @param callChain identities from the top-level flow down to the caller, never empty
     * @throws CircularDependencyException when the target is already on the chain
     * @throws ValidationException when the reference cannot be resolved or the document is invalid
     */
    public LoadedFlow load(String reference, List<FlowSource> callChain) {
        FlowSource caller = callChain.get(callChain.size() - 1);
        FlowSource source = resolver.resolve(reference, caller)
            .orElseThrow(() -> new ValidationException(
                "Subflow '%s' not found (called from '%s')".formatted(reference, caller.name())));

        checkCycle(callChain, source);
        if (callChain.size() >= maxDepth) {
            throw new FlowException(ErrorKind.CIRCULAR_DEPENDENCY,
                "Subflow nesting exceeds maximum depth of %d at '%s'".formatted(maxDepth, reference));
        }
        return new LoadedFlow(source, document(source));
    }

    /**
     * Fails when {@code target} already appears on {@code callChain}. Only canonical identities
     * are compared.
     */
    public static void checkCycle(List<FlowSource> callChain, FlowSource target) {
        for (FlowSource entry : callChain) {
            if (entry.identity().equals(target.identity())) {
                var names = new ArrayList<String>();
                callChain.forEach(s -> names.add(s.name()));
                names.add(target.name());
                throw new CircularDependencyException(names);
            }
        }
    }

    private FlowDocument document(FlowSource source) {
        FlowDocument cached = cache.get(source.identity());
        if (cached != null) {
            return cached;
        }
        FlowDocument document;
        try {
            document = resolver.read(source);
        } catch (IOException e) {
            throw new FlowException(ErrorKind.VALIDATION,
                "Failed to load subflow '%s': %s".formatted(source.name(), e.getMessage()), e);
        }
        List<String> errors = FlowValidator.validate(document);
        if (!errors.isEmpty()) {
            throw new ValidationException(source.name(), errors);
        }
        log.debug("Loaded subflow '{}' from {}", source.name(), source.identity());
        FlowDocument prior = cache.putIfAbsent(source.identity(), document);
        return prior != null ? prior : document;
    }
}
