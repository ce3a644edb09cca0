package com.trading.indicator.io;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trading.indicator.indicator.Indicator;
import com.trading.indicator.series.BaseSeries;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Reads a JSON {@link IndicatorSetDefinition} and builds the indicators it
 * names over a base series.
 *
 * <pre>{@code
 * {
 *   "indicatorSet": {
 *     "name": "daily",
 *     "indicators": [
 *       { "name": "ma",  "type": "MA",  "properties": { "period1": 5 } },
 *       { "name": "kdj", "type": "KD" }
 *     ]
 *   }
 * }
 * }</pre>
 */
@Log4j2
public final class IndicatorSetLoader {
    private final ObjectMapper mapper;

    public IndicatorSetLoader() {
        this(new ObjectMapper());
    }

    public IndicatorSetLoader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    /** Factory for creating indicators from JSON properties. */
    @FunctionalInterface
    public interface IndicatorFactory {
        Indicator create(BaseSeries baseSer, Map<String, Object> properties);
    }

    public IndicatorSetDefinition parse(String json) {
        try {
            return mapper.readValue(json, IndicatorSetDefinition.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid indicator set JSON: " + e.getOriginalMessage(), e);
        }
    }

    public IndicatorSetDefinition parse(Path path) throws IOException {
        return mapper.readValue(path.toFile(), IndicatorSetDefinition.class);
    }

    /** @throws IllegalArgumentException if the resource does not exist. */
    public IndicatorSetDefinition parseResource(String resource) {
        try (InputStream in = IndicatorSetLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null)
                throw new IllegalArgumentException("Indicator set resource not found: " + resource);
            return mapper.readValue(in, IndicatorSetDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read indicator set resource " + resource, e);
        }
    }

    public IndicatorSet load(BaseSeries baseSer, String json) {
        return build(baseSer, parse(json));
    }

    /**
     * Builds the indicators of {@code def} over {@code baseSer}.
     *
     * @throws IllegalArgumentException on a missing name or type, a duplicate
     *                                  name, an unknown type or a bad factor.
     */
    public IndicatorSet build(BaseSeries baseSer, IndicatorSetDefinition def) {
        IndicatorSetDefinition.SetInfo info = def.getIndicatorSet();
        if (info == null)
            throw new IllegalArgumentException("Missing 'indicatorSet' key");

        List<IndicatorSetDefinition.IndicatorDef> defs = info.getIndicators() != null ? info.getIndicators() : List.of();
        Map<String, Indicator> indicators = new LinkedHashMap<>(defs.size() * 2);

        for (IndicatorSetDefinition.IndicatorDef id : defs) {
            if (id.getName() == null || id.getName().isEmpty())
                throw new IllegalArgumentException("Indicator without a name in set " + info.getName());
            if (id.getType() == null)
                throw new IllegalArgumentException("Indicator '" + id.getName() + "' has no type");
            if (indicators.containsKey(id.getName()))
                throw new IllegalArgumentException("Duplicate indicator name '" + id.getName() + "'");

            IndicatorType type = IndicatorType.fromString(id.getType());
            Map<String, Object> props = id.getProperties() != null ? id.getProperties() : Map.of();
            Indicator indicator = type.getFactory().create(baseSer, props);
            indicators.put(id.getName(), indicator);
            log.debug("Indicator '{}' created: {}", id.getName(), indicator);
        }

        log.info("Loaded indicator set '{}' ({} indicators) over {}", info.getName(), indicators.size(),
                baseSer.name());
        return new IndicatorSet(info.getName(), baseSer, indicators);
    }

    static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        try {
            return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Property '" + key + "' is not a number: " + v, e);
        }
    }
}
