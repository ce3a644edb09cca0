package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;

import java.util.ArrayList;
import java.util.List;

/**
 * Guppy multiple moving average: six short and six long simple moving averages
 * of the close, published as {@code MA01} to {@code MA12}.
 */
public final class GmmaIndicator extends Indicator {
    public static final List<Factor> PERIODS = List.of(
            Factor.of("Period Short 1", 3),
            Factor.of("Period Short 2", 5),
            Factor.of("Period Short 3", 8),
            Factor.of("Period Short 4", 10),
            Factor.of("Period Short 5", 12),
            Factor.of("Period Short 6", 15),
            Factor.of("Period Long 1", 30),
            Factor.of("Period Long 2", 35),
            Factor.of("Period Long 3", 40),
            Factor.of("Period Long 4", 45),
            Factor.of("Period Long 5", 50),
            Factor.of("Period Long 6", 60));

    private final List<Factor> periods = new ArrayList<>();
    private final List<DoubleVar> mas = new ArrayList<>();

    public GmmaIndicator(BaseSeries baseSer) {
        this(baseSer, PERIODS);
    }

    /** @param periods Exactly twelve periods, the short ones first. */
    public GmmaIndicator(BaseSeries baseSer, List<Factor> periods) {
        super(baseSer, "GMMA");
        if (periods.size() != PERIODS.size())
            throw new IllegalArgumentException("GMMA needs " + PERIODS.size() + " periods, got " + periods.size());
        for (int k = 0; k < periods.size(); k++) {
            this.periods.add(factor(periods.get(k)));
            this.mas.add(addOutput(String.format("MA%02d", k + 1)));
        }
    }

    @Override
    protected void compute(int fromIdx, int size) {
        for (int i = fromIdx; i < size; i++) {
            for (int k = 0; k < mas.size(); k++) {
                mas.get(k).setDouble(i, ma(i, C, periods.get(k)));
            }
        }
    }
}
