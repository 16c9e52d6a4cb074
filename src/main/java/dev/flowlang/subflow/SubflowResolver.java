package dev.flowlang.subflow;

import dev.flowlang.model.FlowDocument;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Discovery policy for subflow references. Implementations map a textual reference to a
 * canonical identity and read the document behind it; cycle detection only ever compares the
 * identities they return.
 */
public interface SubflowResolver {

    /**
     * Locate the flow a reference points to.
     *
     * @param reference name or path written in the subflow step
     * @param caller    the flow containing the step
     * @return the resolved source, or empty when nothing matches
     */
    Optional<FlowSource> resolve(String reference, FlowSource caller);

    FlowDocument read(FlowSource source) throws IOException;

    /** Names of subflows discoverable from {@code caller}, sorted. */
    default List<String> listAvailable(FlowSource caller) {
        return List.of();
    }
}
