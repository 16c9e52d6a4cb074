package dev.flowlang.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One case of a switch step. {@code when} holds one or more literals; the case matches when the
 * discriminant equals any of them.
 */
public record SwitchCase(List<Object> when, List<Step> steps) {

    public SwitchCase {
        when = when == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(when));
        steps = steps == null ? List.of() : List.copyOf(steps);
    }
}
