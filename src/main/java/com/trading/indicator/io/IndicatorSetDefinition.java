package com.trading.indicator.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of a set of indicators to attach to one base series.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class IndicatorSetDefinition {
    private SetInfo indicatorSet;

    /** Meta-information and members of the set. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class SetInfo {
        private String name, version;
        private List<IndicatorDef> indicators;
    }

    /** Definition of a single indicator. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class IndicatorDef {
        private String name, type, description;
        private Map<String, Object> properties;
    }
}
