package org.learningjava.abtool.domain.service.lifecycle;

import org.learningjava.abtool.domain.exception.InvalidExperimentException;
import org.learningjava.abtool.domain.model.experiment.Experiment;
import org.learningjava.abtool.domain.model.experiment.ExperimentConfig;
import org.learningjava.abtool.domain.model.experiment.ExperimentDefaults;
import org.learningjava.abtool.domain.model.experiment.ExperimentStatus;
import org.learningjava.abtool.domain.model.experiment.Variant;
import org.learningjava.abtool.domain.model.experiment.VariantResults;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/** Resolves an {@link ExperimentConfig} against defaults into a new, validated, active experiment. */
@Component
public class ExperimentFactory {

    static final String VARIANT = "variant";
    static final String CONTROL_NAME = "Current Version";
    static final String VARIANT_NAME = "Optimized Version";

    private final ExperimentValidator validator;

    public ExperimentFactory(ExperimentValidator validator) {
        this.validator = validator;
    }

    public Experiment create(ExperimentConfig config, ExperimentDefaults defaults, Instant now) {
        if (config == null) {
            throw new InvalidExperimentException("Experiment config is required");
        }

        Experiment e = new Experiment();
        e.setId(newId());
        e.setName(config.name());
        e.setDescription(config.description());
        e.setContentType(config.contentType());

        Map<String, Variant> variants = config.hasExplicitVariants()
                ? normalize(config.variants())
                : fromContent(config);
        e.setVariants(variants);
        e.setTrafficSplit(config.trafficSplit() != null ? config.trafficSplit() : evenSplit(variants.keySet()));
        e.setMetrics(config.metrics() != null ? config.metrics() : defaults.metrics());

        e.setMinSampleSize(config.minSampleSize() != null ? config.minSampleSize() : defaults.minSampleSize());
        e.setSignificanceThreshold(config.significanceThreshold() != null
                ? config.significanceThreshold() : defaults.significanceThreshold());
        e.setStatisticalPower(defaults.statisticalPower());
        e.setExpectedEffectSize(config.expectedEffectSize() != null
                ? config.expectedEffectSize() : defaults.expectedEffectSize());

        e.setStatus(ExperimentStatus.ACTIVE);
        e.setStartDate(now);
        e.setPlannedEndDate(config.plannedEndDate() != null
                ? config.plannedEndDate() : now.plus(Duration.ofDays(defaults.durationDays())));

        validator.validate(e);

        for (String variantId : variants.keySet()) {
            e.getResults().put(variantId, new VariantResults());
        }
        return e;
    }

    /** The map key is the variant id; a payload id that disagrees is overwritten. */
    private static Map<String, Variant> normalize(Map<String, Variant> raw) {
        Map<String, Variant> out = new LinkedHashMap<>();
        raw.forEach((id, v) -> {
            Variant payload = v == null ? Variant.of(id, id, null) : v;
            out.put(id, id != null && id.equals(payload.id()) ? payload : payload.withId(id));
        });
        return out;
    }

    private static Map<String, Variant> fromContent(ExperimentConfig c) {
        Map<String, Variant> out = new LinkedHashMap<>();
        if (c.originalContent() == null && c.variantContent() == null) {
            return out;
        }
        out.put(Experiment.CONTROL, new Variant(Experiment.CONTROL, CONTROL_NAME, c.originalContent(),
                List.of(), Map.of()));
        out.put(VARIANT, new Variant(VARIANT,
                c.variantName() != null ? c.variantName() : VARIANT_NAME,
                c.variantContent(), c.optimizations(), Map.of()));

        List<Variant> extra = c.additionalVariants() == null ? List.of() : c.additionalVariants();
        for (int i = 0; i < extra.size(); i++) {
            String id = VARIANT + "_" + (i + 2);
            Variant v = extra.get(i);
            if (v == null) {
                throw new InvalidExperimentException("additionalVariants[" + i + "] is null");
            }
            out.put(id, new Variant(id, v.name(), v.content(), v.optimizations(), v.metadata()));
        }
        return out;
    }

    /** Even integer split; the remainder goes to the earliest variants. */
    static Map<String, Integer> evenSplit(Iterable<String> variantIds) {
        List<String> ids = new ArrayList<>();
        variantIds.forEach(ids::add);
        Map<String, Integer> split = new LinkedHashMap<>();
        if (ids.isEmpty()) return split;

        int base = 100 / ids.size();
        int remainder = 100 % ids.size();
        for (int i = 0; i < ids.size(); i++) {
            split.put(ids.get(i), base + (i < remainder ? 1 : 0));
        }
        return split;
    }

    private static String newId() {
        return UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }
}
