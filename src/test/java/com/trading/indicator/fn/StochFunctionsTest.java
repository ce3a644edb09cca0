package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import org.junit.Before;
import org.junit.Test;

import static com.trading.indicator.fn.MaFunctionTest.closes;
import static org.junit.Assert.*;

public class StochFunctionsTest {

    private final Factor period = Factor.of("Period K", 3);
    private final Factor periodK = Factor.of("Period K Smoothing", 1);
    private final Factor periodD = Factor.of("Period D Smoothing", 2);

    private BaseSeries ser;

    @Before
    public void setUp() {
        ser = new BaseSeries("test");
        ser.append(Bar.of(0, 9, 10, 8, 9, 0));
        ser.append(Bar.of(1, 10, 11, 9, 10, 0));
        ser.append(Bar.of(2, 11, 12, 10, 12, 0));
        ser.append(Bar.of(3, 12, 12, 11, 11, 0));
    }

    @Test
    public void testStochastics() {
        StochKFunction k = StochKFunction.of(ser, period, periodK);
        assertTrue(Null.is(k.stochK(1, 1)));
        assertEquals(100.0, k.stochK(1, 2), 1e-9);
        assertEquals(200.0 / 3.0, k.stochK(1, 3), 1e-9);

        double d = StochDFunction.of(ser, period, periodK, periodD).stochD(1, 3);
        assertEquals(250.0 / 3.0, d, 1e-9);

        double j = StochJFunction.of(ser, period, periodK, periodD).stochJ(1, 3);
        assertEquals(3 * 200.0 / 3.0 - 2 * 250.0 / 3.0, j, 1e-9);
    }

    @Test
    public void testWilliams() {
        WmsFunction wms = WmsFunction.of(ser, period);
        assertTrue(Null.is(wms.wms(1, 1)));
        assertEquals(0.0, wms.wms(1, 2), 1e-9);
        assertEquals(100.0 / 3.0, wms.wms(1, 3), 1e-9);
    }

    @Test
    public void testFlatRangeIsMidpoint() {
        BaseSeries flat = closes(5, 5, 5);
        assertEquals(50.0, StochKFunction.of(flat, period, periodK).stochK(1, 2), 0.0);
        assertEquals(50.0, WmsFunction.of(flat, period).wms(1, 2), 0.0);
    }
}
