package dev.flowlang.task;

import java.util.Optional;

/**
 * Looks up pre-configured connection handles by name. Pooling and lifecycle belong to the
 * implementation, which must be safe for concurrent use.
 */
@FunctionalInterface
public interface ConnectionResolver {

    ConnectionResolver NONE = name -> Optional.empty();

    Optional<Object> resolve(String name);
}
