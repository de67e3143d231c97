package org.wordscope.core.lookup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Ordered cascade of {@link LookupStage}s. Stages are asked in order until one hits.
 *
 * <p>When no stage hits, the outcome of the last stage is returned, so a trailing system of record
 * decides whether the whole lookup is a miss or an error.</p>
 */
public class LookupChain<K, V> {
    private static final Logger logger = LoggerFactory.getLogger(LookupChain.class);

    private final String name;
    private final List<LookupStage<K, V>> stages;

    public LookupChain(String name, List<LookupStage<K, V>> stages) {
        if (stages.isEmpty()) {
            throw new IllegalArgumentException("Lookup chain '" + name + "' needs at least one stage");
        }
        this.name = name;
        this.stages = List.copyOf(stages);
    }

    public Lookup<V> resolve(K key) {
        Lookup<V> outcome = Lookup.miss();
        for (LookupStage<K, V> stage : stages) {
            outcome = stage.lookup(key);
            if (outcome.isHit()) {
                logger.debug("{}: '{}' hit for {}", name, stage.name(), key);
                return outcome;
            }
            if (outcome.isError()) {
                logger.warn("{}: '{}' failed for {}, falling through: {}",
                        name, stage.name(), key, outcome.error().map(Exception::getMessage).orElse("unknown"));
            } else {
                logger.debug("{}: '{}' missed for {}", name, stage.name(), key);
            }
        }
        return outcome;
    }

    public List<String> stageNames() {
        return stages.stream().map(LookupStage::name).toList();
    }
}
