package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.series.ObjectVar;
import com.trading.indicator.util.ProbMass;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Historical volume distribution: how the traded volume of the last 50, 100
 * and 200 bars spreads over the close price range.
 *
 * <p>
 * The full profiles are kept in {@link #profile(String)} columns
 * {@code HVD1..3}. The price of each profile's densest bin is published as the
 * outputs {@code POC1..3} (point of control).
 */
public final class HvdIndicator extends Indicator {
    public static final Factor N_INTERVALS = new Factor("Number of Intervals", 30, 1, 1, 100);
    public static final Factor PERIOD1 = Factor.of("Period1", 50);
    public static final Factor PERIOD2 = Factor.of("Period2", 100);
    public static final Factor PERIOD3 = Factor.of("Period3", 200);

    private final Factor nIntervals;
    private final Factor period1;
    private final Factor period2;
    private final Factor period3;

    private final ObjectVar<ProbMass> hvd1;
    private final ObjectVar<ProbMass> hvd2;
    private final ObjectVar<ProbMass> hvd3;
    private final Map<String, ObjectVar<ProbMass>> profiles = new LinkedHashMap<>();

    private final DoubleVar poc1;
    private final DoubleVar poc2;
    private final DoubleVar poc3;

    public HvdIndicator(BaseSeries baseSer) {
        this(baseSer, N_INTERVALS, PERIOD1, PERIOD2, PERIOD3);
    }

    public HvdIndicator(BaseSeries baseSer, Factor nIntervals, Factor period1, Factor period2, Factor period3) {
        super(baseSer, "HVD");
        this.nIntervals = factor(nIntervals);
        this.period1 = factor(period1);
        this.period2 = factor(period2);
        this.period3 = factor(period3);
        this.hvd1 = profileVar("HVD1");
        this.hvd2 = profileVar("HVD2");
        this.hvd3 = profileVar("HVD3");
        this.poc1 = addOutput("POC1");
        this.poc2 = addOutput("POC2");
        this.poc3 = addOutput("POC3");
    }

    private ObjectVar<ProbMass> profileVar(String profileName) {
        ObjectVar<ProbMass> v = objectVar(profileName);
        profiles.put(profileName, v);
        return v;
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            spot(i, hvd1, poc1, period1);
            spot(i, hvd2, poc2, period2);
            spot(i, hvd3, poc3, period3);
        }
    }

    private void spot(int i, ObjectVar<ProbMass> hvd, DoubleVar poc, Factor period) {
        ProbMass mass = probMass(i, C, V, period, nIntervals);
        hvd.set(i, mass);
        poc.setDouble(i, mass == null ? Null.DOUBLE : mass.value(mass.modeBin()));
    }

    /** @throws IllegalArgumentException if there is no such profile. */
    public ObjectVar<ProbMass> profile(String profileName) {
        ObjectVar<ProbMass> v = profiles.get(profileName);
        if (v == null)
            throw new IllegalArgumentException(name() + ": no profile '" + profileName + "', have " + profiles.keySet());
        return v;
    }

    public Map<String, ObjectVar<ProbMass>> profiles() {
        return Collections.unmodifiableMap(profiles);
    }
}
