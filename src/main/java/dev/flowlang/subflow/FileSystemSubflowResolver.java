package dev.flowlang.subflow;

import dev.flowlang.engine.FlowLoader;
import dev.flowlang.model.EngineOptions;
import dev.flowlang.model.FlowDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Finds subflows on disk. First match wins, in this order:
 * <ol>
 *   <li>a direct file: {@code ref}, {@code ref.yaml}, {@code ref.yml} or {@code ref.json}</li>
 *   <li>a subdirectory holding the canonical file: {@code ref/flow.yaml}</li>
 *   <li>a sibling of the caller's directory: {@code ../ref/flow.yaml}, {@code ../ref.yaml}</li>
 *   <li>ancestors up to {@link EngineOptions#ancestorSearchDepth()} levels: {@code ../../ref/flow.yaml}, ...</li>
 * </ol>
 * Paths are relative to the caller's directory, or to the configured flows directory when the
 * caller was not loaded from disk.
 */
public final class FileSystemSubflowResolver implements SubflowResolver {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSubflowResolver.class);
    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml", ".json");

    private final EngineOptions options;

    public FileSystemSubflowResolver(EngineOptions options) {
        this.options = options;
    }

    @Override
    public Optional<FlowSource> resolve(String reference, FlowSource caller) {
        Path base = baseDirectory(caller);
        for (Path candidate : candidates(reference, base)) {
            if (Files.isRegularFile(candidate)) {
                Path path = candidate.toAbsolutePath().normalize();
                log.debug("Resolved subflow '{}' to {}", reference, path);
                return Optional.of(new FlowSource(path.toString(), reference, path.getParent()));
            }
        }
        return Optional.empty();
    }

    @Override
    public FlowDocument read(FlowSource source) throws IOException {
        return FlowLoader.loadFromFile(Path.of(source.identity()));
    }

    @Override
    public List<String> listAvailable(FlowSource caller) {
        Path base = baseDirectory(caller);
        var names = new TreeSet<String>();
        if (!Files.isDirectory(base)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(base)) {
            entries.forEach(entry -> {
                String fileName = entry.getFileName().toString();
                if (Files.isDirectory(entry) && Files.isRegularFile(entry.resolve(options.canonicalFileName()))) {
                    names.add(fileName);
                } else if (Files.isRegularFile(entry) && !fileName.equals(options.canonicalFileName())) {
                    for (String extension : EXTENSIONS) {
                        if (fileName.endsWith(extension)) {
                            names.add(fileName.substring(0, fileName.length() - extension.length()));
                        }
                    }
                }
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list subflows in " + base, e);
        }
        return new ArrayList<>(names);
    }

    List<Path> candidates(String reference, Path base) {
        var candidates = new ArrayList<Path>();
        String canonical = options.canonicalFileName();

        // (a) direct file match
        candidates.add(base.resolve(reference));
        for (String extension : EXTENSIONS) {
            candidates.add(base.resolve(reference + extension));
        }

        // (b) subdirectory with the canonical file
        candidates.add(base.resolve(reference).resolve(canonical));

        // (c) sibling directories
        Path parent = base.getParent();
        if (parent != null) {
            candidates.add(parent.resolve(reference).resolve(canonical));
            for (String extension : EXTENSIONS) {
                candidates.add(parent.resolve(reference + extension));
            }
        }

        // (d) ancestors, bounded
        Path current = parent;
        for (int depth = 1; depth < options.ancestorSearchDepth() && current != null; depth++) {
            current = current.getParent();
            if (current != null) {
                candidates.add(current.resolve(reference).resolve(canonical));
            }
        }
        return candidates;
    }

    private Path baseDirectory(FlowSource caller) {
        if (caller != null && caller.directory() != null) {
            return caller.directory();
        }
        return options.flowsDirectory();
    }
}
