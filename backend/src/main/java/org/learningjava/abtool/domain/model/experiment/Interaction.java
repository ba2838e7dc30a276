package org.learningjava.abtool.domain.model.experiment;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single participant interaction. Every interaction counts as an impression;
 * {@code type == "conversion"} additionally counts as a conversion.
 */
public record Interaction(String type, Map<String, Double> metrics) {

    public static final String CONVERSION = "conversion";
    public static final String IMPRESSION = "impression";

    public Interaction {
        Map<String, Double> clean = new LinkedHashMap<>();
        if (metrics != null) {
            metrics.forEach((k, v) -> {
                if (k != null && v != null) clean.put(k, v);
            });
        }
        metrics = Collections.unmodifiableMap(clean);
    }

    public static Interaction impression() {
        return new Interaction(IMPRESSION, Map.of());
    }

    public static Interaction conversion() {
        return new Interaction(CONVERSION, Map.of());
    }

    @JsonIgnore
    public boolean isConversion() {
        return CONVERSION.equals(type);
    }
}
