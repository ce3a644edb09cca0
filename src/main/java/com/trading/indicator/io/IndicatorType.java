package com.trading.indicator.io;

import com.trading.indicator.api.Factor;
import com.trading.indicator.indicator.ArbrIndicator;
import com.trading.indicator.indicator.BollIndicator;
import com.trading.indicator.indicator.DmiIndicator;
import com.trading.indicator.indicator.GmmaIndicator;
import com.trading.indicator.indicator.HvdIndicator;
import com.trading.indicator.indicator.Indicator;
import com.trading.indicator.indicator.KdIndicator;
import com.trading.indicator.indicator.MaIndicator;
import com.trading.indicator.indicator.MacdIndicator;
import com.trading.indicator.indicator.RsiIndicator;
import com.trading.indicator.indicator.VolIndicator;
import com.trading.indicator.indicator.ZigzagIndicator;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public enum IndicatorType {
    MA(MaIndicator.class, (ser, props) -> new MaIndicator(ser,
            factor(props, "period1", MaIndicator.PERIOD1),
            factor(props, "period2", MaIndicator.PERIOD2),
            factor(props, "period3", MaIndicator.PERIOD3))),
    BOLL(BollIndicator.class, (ser, props) -> new BollIndicator(ser,
            factor(props, "period", BollIndicator.PERIOD),
            factor(props, "alpha1", BollIndicator.ALPHA1),
            factor(props, "alpha2", BollIndicator.ALPHA2))),
    DMI(DmiIndicator.class, (ser, props) -> new DmiIndicator(ser,
            factor(props, "periodDi", DmiIndicator.PERIOD_DI),
            factor(props, "periodAdx", DmiIndicator.PERIOD_ADX))),
    KD(KdIndicator.class, (ser, props) -> new KdIndicator(ser,
            factor(props, "period", KdIndicator.PERIOD),
            factor(props, "periodK", KdIndicator.PERIOD_K),
            factor(props, "periodD", KdIndicator.PERIOD_D))),
    RSI(RsiIndicator.class, (ser, props) -> new RsiIndicator(ser,
            factor(props, "period", RsiIndicator.PERIOD),
            factor(props, "oversold", RsiIndicator.OVERSOLD),
            factor(props, "overbought", RsiIndicator.OVERBOUGHT))),
    MACD(MacdIndicator.class, (ser, props) -> new MacdIndicator(ser,
            factor(props, "fast", MacdIndicator.PERIOD_FAST),
            factor(props, "slow", MacdIndicator.PERIOD_SLOW),
            factor(props, "signal", MacdIndicator.PERIOD_SIGNAL))),
    ZIGZAG(ZigzagIndicator.class, (ser, props) -> new ZigzagIndicator(ser,
            factor(props, "percent", ZigzagIndicator.PERCENT))),
    VOL(VolIndicator.class, (ser, props) -> new VolIndicator(ser,
            factor(props, "period1", VolIndicator.PERIOD1),
            factor(props, "period2", VolIndicator.PERIOD2))),
    ARBR(ArbrIndicator.class, (ser, props) -> new ArbrIndicator(ser,
            factor(props, "period", ArbrIndicator.PERIOD))),
    GMMA(GmmaIndicator.class, (ser, props) -> new GmmaIndicator(ser, gmmaPeriods(props))),
    HVD(HvdIndicator.class, (ser, props) -> new HvdIndicator(ser,
            factor(props, "nIntervals", HvdIndicator.N_INTERVALS),
            factor(props, "period1", HvdIndicator.PERIOD1),
            factor(props, "period2", HvdIndicator.PERIOD2),
            factor(props, "period3", HvdIndicator.PERIOD3)));

    private final Class<? extends Indicator> indicatorClass;
    private final IndicatorSetLoader.IndicatorFactory factory;

    IndicatorType(Class<? extends Indicator> indicatorClass, IndicatorSetLoader.IndicatorFactory factory) {
        this.indicatorClass = indicatorClass;
        this.factory = factory;
    }

    public Class<? extends Indicator> getIndicatorClass() {
        return indicatorClass;
    }

    public IndicatorSetLoader.IndicatorFactory getFactory() {
        return factory;
    }

    /** The default factor with its value overridden from {@code props}, if present there. */
    private static Factor factor(Map<String, Object> props, String key, Factor defaultFactor) {
        double v = IndicatorSetLoader.getDouble(props, key, defaultFactor.value());
        return v == defaultFactor.value() ? defaultFactor : defaultFactor.withValue(v);
    }

    /** Keys {@code short1..short6} then {@code long1..long6}. */
    private static List<Factor> gmmaPeriods(Map<String, Object> props) {
        List<Factor> periods = new ArrayList<>();
        int half = GmmaIndicator.PERIODS.size() / 2;
        for (int k = 0; k < GmmaIndicator.PERIODS.size(); k++) {
            String key = k < half ? "short" + (k + 1) : "long" + (k - half + 1);
            periods.add(factor(props, key, GmmaIndicator.PERIODS.get(k)));
        }
        return periods;
    }

    public static IndicatorType fromString(String text) {
        for (IndicatorType t : IndicatorType.values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown IndicatorType: " + text);
    }
}
