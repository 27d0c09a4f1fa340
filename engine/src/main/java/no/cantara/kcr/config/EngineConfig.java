package no.cantara.kcr.config;

import no.cantara.kcr.error.ConfigurationException;
import no.cantara.kcr.retrieval.PromotionBoosts;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Engine-wide tuning loaded from {@code kcr-engine.yaml}.
 *
 * @param boosts             additive promotion boosts
 * @param overFetchFactor    vector-store rows requested per wanted result
 * @param maxChainDepth      cap on supersession chain walks
 * @param decayBase          per-hop supersession multiplier
 * @param parallelism        worker threads used by the default assembly executor
 */
public record EngineConfig(
        PromotionBoosts boosts,
        int overFetchFactor,
        int maxChainDepth,
        double decayBase,
        int parallelism
) {
    public static final String DEFAULT_RESOURCE = "kcr-engine.yaml";

    private static final Yaml YAML = new Yaml(new SafeConstructor(new LoaderOptions()));

    public EngineConfig {
        if (boosts == null) boosts = PromotionBoosts.defaults();
        List<String> problems = new ArrayList<>();
        if (boosts.critical() < 0 || boosts.important() < 0 || boosts.standard() < 0) {
            problems.add("boosts must not be negative");
        }
        if (overFetchFactor < 1) problems.add("over_fetch_factor must be >= 1, got " + overFetchFactor);
        if (maxChainDepth < 1) problems.add("supersession.max_chain_depth must be >= 1, got " + maxChainDepth);
        if (!(decayBase > 0 && decayBase <= 1)) problems.add("supersession.decay_base must be in (0, 1], got " + decayBase);
        if (parallelism < 1) problems.add("assembly.parallelism must be >= 1, got " + parallelism);
        if (!problems.isEmpty()) {
            throw new ConfigurationException("Invalid engine configuration: " + String.join("; ", problems));
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(PromotionBoosts.defaults(), 2, 10, 0.5, 4);
    }

    /** Loads {@value #DEFAULT_RESOURCE} from the classpath, or returns the defaults when absent. */
    public static EngineConfig loadDefault() {
        try (InputStream is = EngineConfig.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            return is == null ? defaults() : load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULT_RESOURCE, e);
        }
    }

    public static EngineConfig load(Path path) {
        try (InputStream is = Files.newInputStream(path)) {
            return load(is);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read engine configuration " + path, e);
        }
    }

    public static EngineConfig load(InputStream is) {
        try {
            Map<String, Object> data = YAML.load(is);
            return fromMap(data != null ? data : Map.of());
        } catch (YAMLException | ClassCastException e) {
            throw new ConfigurationException("Malformed engine configuration: " + e.getMessage(), e);
        }
    }

    /** Builds a config from parsed YAML; absent keys keep their default values. */
    public static EngineConfig fromMap(Map<String, Object> data) {
        EngineConfig d = defaults();
        Map<String, Object> boosts = section(data, "boosts");
        Map<String, Object> supersession = section(data, "supersession");
        Map<String, Object> assembly = section(data, "assembly");

        return new EngineConfig(
                new PromotionBoosts(
                        number(boosts, "critical", d.boosts().critical()),
                        number(boosts, "important", d.boosts().important()),
                        number(boosts, "standard", d.boosts().standard())),
                (int) number(data, "over_fetch_factor", d.overFetchFactor()),
                (int) number(supersession, "max_chain_depth", d.maxChainDepth()),
                number(supersession, "decay_base", d.decayBase()),
                (int) number(assembly, "parallelism", d.parallelism()));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> section(Map<String, Object> data, String key) {
        Object value = data.get(key);
        if (value == null) return Map.of();
        if (!(value instanceof Map)) {
            throw new ConfigurationException("'" + key + "' must be a mapping");
        }
        return (Map<String, Object>) value;
    }

    private static double number(Map<String, Object> data, String key, double fallback) {
        Object value = data.get(key);
        if (value == null) return fallback;
        if (value instanceof Number n) return n.doubleValue();
        throw new ConfigurationException("'" + key + "' must be a number, got '" + value + "'");
    }
}
