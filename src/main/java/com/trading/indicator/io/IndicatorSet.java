package com.trading.indicator.io;

import com.trading.indicator.indicator.Indicator;
import com.trading.indicator.series.BaseSeries;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import lombok.Getter;

/**
 * Named indicators over one base series, refreshed together so that they share
 * one session and with it every common sub-computation.
 */
public final class IndicatorSet {
    @Getter
    private final String name;
    private final BaseSeries baseSeries;
    private final Map<String, Indicator> indicators;

    IndicatorSet(String name, BaseSeries baseSeries, Map<String, Indicator> indicators) {
        this.name = name;
        this.baseSeries = baseSeries;
        this.indicators = Collections.unmodifiableMap(new LinkedHashMap<>(indicators));
    }

    /** Refreshes every indicator from {@code fromTime} in session {@code sessionId}. */
    public void refresh(long sessionId, long fromTime) {
        for (Indicator indicator : indicators.values()) {
            indicator.computeFrom(sessionId, fromTime);
        }
    }

    /** @throws IllegalArgumentException if there is no indicator of that name. */
    public Indicator get(String indicatorName) {
        Indicator indicator = indicators.get(indicatorName);
        if (indicator == null)
            throw new IllegalArgumentException("No indicator '" + indicatorName + "' in set " + name);
        return indicator;
    }

    /** @return Indicators in definition order. */
    public Map<String, Indicator> indicators() {
        return indicators;
    }

    public BaseSeries baseSeries() {
        return baseSeries;
    }

    public int size() {
        return indicators.size();
    }
}
