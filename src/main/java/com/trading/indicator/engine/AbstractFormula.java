package com.trading.indicator.engine;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Side;
import com.trading.indicator.api.TVar;
import com.trading.indicator.fn.AdxFunction;
import com.trading.indicator.fn.AdxrFunction;
import com.trading.indicator.fn.BollFunction;
import com.trading.indicator.fn.CciFunction;
import com.trading.indicator.fn.DiFunction;
import com.trading.indicator.fn.DmFunction;
import com.trading.indicator.fn.DxFunction;
import com.trading.indicator.fn.EmaFunction;
import com.trading.indicator.fn.MaFunction;
import com.trading.indicator.fn.MacdFunction;
import com.trading.indicator.fn.MaxFunction;
import com.trading.indicator.fn.MfiFunction;
import com.trading.indicator.fn.MinFunction;
import com.trading.indicator.fn.MtmFunction;
import com.trading.indicator.fn.ObvFunction;
import com.trading.indicator.fn.ProbMassFunction;
import com.trading.indicator.fn.RocFunction;
import com.trading.indicator.fn.RsiFunction;
import com.trading.indicator.fn.SarFunction;
import com.trading.indicator.fn.StdDevFunction;
import com.trading.indicator.fn.StochDFunction;
import com.trading.indicator.fn.StochJFunction;
import com.trading.indicator.fn.StochKFunction;
import com.trading.indicator.fn.SumFunction;
import com.trading.indicator.fn.TrFunction;
import com.trading.indicator.fn.WmsFunction;
import com.trading.indicator.fn.ZigzagFunction;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import com.trading.indicator.series.ObjectVar;
import com.trading.indicator.series.TimeAxis;
import com.trading.indicator.util.ProbMass;

import java.util.ArrayList;
import java.util.List;

/**
 * Common ground of functions and indicators: the base series, its OHLCV
 * columns, owned working columns, and the primitive operators.
 *
 * <p>
 * Every operator resolves the shared function instance for its arguments from
 * the base series registry and reads it in the caller's current session, so a
 * sub-computation shared by many callers runs once per session.
 */
public abstract class AbstractFormula {
    protected final BaseSeries baseSer;
    protected final TimeAxis axis;

    protected final DoubleVar O;
    protected final DoubleVar H;
    protected final DoubleVar L;
    protected final DoubleVar C;
    protected final DoubleVar V;
    protected final ObjectVar<Boolean> E;

    private final List<TVar<?>> vars = new ArrayList<>();

    protected AbstractFormula(BaseSeries baseSer) {
        if (baseSer == null)
            throw new IllegalArgumentException("Base series must not be null");
        this.baseSer = baseSer;
        this.axis = baseSer.timeAxis();
        this.O = baseSer.open();
        this.H = baseSer.high();
        this.L = baseSer.low();
        this.C = baseSer.close();
        this.V = baseSer.volume();
        this.E = baseSer.isClosed();
    }

    /** The session under which operators are evaluated right now. */
    protected abstract long currentSessionId();

    public final BaseSeries baseSeries() {
        return baseSer;
    }

    /** Creates a double column owned by this formula. */
    protected final DoubleVar doubleVar(String name) {
        DoubleVar v = new DoubleVar(name, axis);
        vars.add(v);
        return v;
    }

    /** Creates a reference column owned by this formula. */
    protected final <T> ObjectVar<T> objectVar(String name) {
        ObjectVar<T> v = new ObjectVar<>(name, axis);
        vars.add(v);
        return v;
    }

    /** Grows every owned column to the axis size. */
    protected final void ensureVarsCapacity() {
        for (int i = 0; i < vars.size(); i++) {
            vars.get(i).ensureCapacity();
        }
    }

    // ── Window statistics ───────────────────────────────────────────

    protected final double sum(int idx, DoubleVar baseVar, Factor period) {
        return SumFunction.of(baseSer, baseVar, period).sum(currentSessionId(), idx);
    }

    protected final double max(int idx, DoubleVar baseVar, Factor period) {
        return MaxFunction.of(baseSer, baseVar, period).max(currentSessionId(), idx);
    }

    protected final double min(int idx, DoubleVar baseVar, Factor period) {
        return MinFunction.of(baseSer, baseVar, period).min(currentSessionId(), idx);
    }

    protected final double ma(int idx, DoubleVar baseVar, Factor period) {
        return MaFunction.of(baseSer, baseVar, period).ma(currentSessionId(), idx);
    }

    protected final double ema(int idx, DoubleVar baseVar, Factor period) {
        return EmaFunction.of(baseSer, baseVar, period).ema(currentSessionId(), idx);
    }

    protected final double stdDev(int idx, DoubleVar baseVar, Factor period) {
        return StdDevFunction.of(baseSer, baseVar, period).stdDev(currentSessionId(), idx);
    }

    // ── Directional movement ────────────────────────────────────────

    protected final double tr(int idx) {
        return TrFunction.of(baseSer).tr(currentSessionId(), idx);
    }

    protected final double dmPlus(int idx) {
        return DmFunction.of(baseSer).dmPlus(currentSessionId(), idx);
    }

    protected final double dmMinus(int idx) {
        return DmFunction.of(baseSer).dmMinus(currentSessionId(), idx);
    }

    protected final double diPlus(int idx, Factor period) {
        return DiFunction.of(baseSer, period).diPlus(currentSessionId(), idx);
    }

    protected final double diMinus(int idx, Factor period) {
        return DiFunction.of(baseSer, period).diMinus(currentSessionId(), idx);
    }

    protected final double dx(int idx, Factor period) {
        return DxFunction.of(baseSer, period).dx(currentSessionId(), idx);
    }

    protected final double adx(int idx, Factor periodDi, Factor periodAdx) {
        return AdxFunction.of(baseSer, periodDi, periodAdx).adx(currentSessionId(), idx);
    }

    protected final double adxr(int idx, Factor periodDi, Factor periodAdx) {
        return AdxrFunction.of(baseSer, periodDi, periodAdx).adxr(currentSessionId(), idx);
    }

    // ── Bands, oscillators, momentum ────────────────────────────────

    protected final double bollMiddle(int idx, DoubleVar baseVar, Factor period, Factor alpha) {
        return BollFunction.of(baseSer, baseVar, period, alpha).bollMiddle(currentSessionId(), idx);
    }

    protected final double bollUpper(int idx, DoubleVar baseVar, Factor period, Factor alpha) {
        return BollFunction.of(baseSer, baseVar, period, alpha).bollUpper(currentSessionId(), idx);
    }

    protected final double bollLower(int idx, DoubleVar baseVar, Factor period, Factor alpha) {
        return BollFunction.of(baseSer, baseVar, period, alpha).bollLower(currentSessionId(), idx);
    }

    protected final double cci(int idx, Factor period, Factor alpha) {
        return CciFunction.of(baseSer, period, alpha).cci(currentSessionId(), idx);
    }

    protected final double macd(int idx, DoubleVar baseVar, Factor periodSlow, Factor periodFast) {
        return MacdFunction.of(baseSer, baseVar, periodSlow, periodFast).macd(currentSessionId(), idx);
    }

    protected final double mfi(int idx, Factor period) {
        return MfiFunction.of(baseSer, period).mfi(currentSessionId(), idx);
    }

    protected final double mtm(int idx, DoubleVar baseVar, Factor period) {
        return MtmFunction.of(baseSer, baseVar, period).mtm(currentSessionId(), idx);
    }

    protected final double obv(int idx) {
        return ObvFunction.of(baseSer).obv(currentSessionId(), idx);
    }

    protected final double roc(int idx, DoubleVar baseVar, Factor period) {
        return RocFunction.of(baseSer, baseVar, period).roc(currentSessionId(), idx);
    }

    protected final double rsi(int idx, Factor period) {
        return RsiFunction.of(baseSer, period).rsi(currentSessionId(), idx);
    }

    protected final double sar(int idx, Factor initial, Factor step, Factor maximum) {
        return SarFunction.of(baseSer, initial, step, maximum).sar(currentSessionId(), idx);
    }

    protected final Side sarSide(int idx, Factor initial, Factor step, Factor maximum) {
        return SarFunction.of(baseSer, initial, step, maximum).sarSide(currentSessionId(), idx);
    }

    protected final double stochK(int idx, Factor period, Factor periodK) {
        return StochKFunction.of(baseSer, period, periodK).stochK(currentSessionId(), idx);
    }

    protected final double stochD(int idx, Factor period, Factor periodK, Factor periodD) {
        return StochDFunction.of(baseSer, period, periodK, periodD).stochD(currentSessionId(), idx);
    }

    protected final double stochJ(int idx, Factor period, Factor periodK, Factor periodD) {
        return StochJFunction.of(baseSer, period, periodK, periodD).stochJ(currentSessionId(), idx);
    }

    protected final double wms(int idx, Factor period) {
        return WmsFunction.of(baseSer, period).wms(currentSessionId(), idx);
    }

    // ── Turning points (lookahead) ──────────────────────────────────

    protected final double zigzag(int idx, Factor percent) {
        return ZigzagFunction.of(baseSer, percent).zigzag(currentSessionId(), idx);
    }

    protected final double pseudoZigzag(int idx, Factor percent) {
        return ZigzagFunction.of(baseSer, percent).pseudoZigzag(currentSessionId(), idx);
    }

    protected final Side zigzagSide(int idx, Factor percent) {
        return ZigzagFunction.of(baseSer, percent).zigzagSide(currentSessionId(), idx);
    }

    // ── Distributions ───────────────────────────────────────────────

    protected final ProbMass probMass(int idx, DoubleVar baseVar, Factor period, Factor nIntervals) {
        return ProbMassFunction.of(baseSer, baseVar, period, nIntervals).probMass(currentSessionId(), idx);
    }

    protected final ProbMass probMass(int idx, DoubleVar baseVar, DoubleVar weight, Factor period,
            Factor nIntervals) {
        return ProbMassFunction.of(baseSer, baseVar, weight, period, nIntervals).probMass(currentSessionId(), idx);
    }
}
