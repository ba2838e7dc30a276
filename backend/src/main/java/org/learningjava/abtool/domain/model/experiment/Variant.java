package org.learningjava.abtool.domain.model.experiment;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One candidate content version of an experiment.
 *
 * @param id            variant id, the key used in traffic split and results
 * @param name          human readable label
 * @param content       content payload served to participants
 * @param optimizations labels of the optimizations applied to the content (may be empty)
 * @param metadata      free-form attributes (may be empty)
 */
public record Variant(
        String id,
        String name,
        String content,
        List<String> optimizations,
        Map<String, Object> metadata
) {
    public Variant {
        optimizations = optimizations == null ? List.of()
                : optimizations.stream().filter(Objects::nonNull).toList();
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static Variant of(String id, String name, String content) {
        return new Variant(id, name, content, List.of(), Map.of());
    }

    public Variant withId(String newId) {
        return new Variant(newId, name, content, optimizations, metadata);
    }
}
