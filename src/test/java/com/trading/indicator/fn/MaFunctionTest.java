package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.util.StatsFunctions;
import org.junit.Test;

import static org.junit.Assert.*;

public class MaFunctionTest {

    static BaseSeries closes(double... closes) {
        BaseSeries ser = new BaseSeries("test");
        for (int i = 0; i < closes.length; i++) {
            ser.append(Bar.ofClose(i, closes[i]));
        }
        return ser;
    }

    @Test
    public void testSma5() {
        BaseSeries ser = closes(1, 2, 3, 4, 5, 6, 7);
        MaFunction ma = MaFunction.of(ser, ser.close(), Factor.of("Period", 5));

        for (int i = 0; i < 4; i++) {
            assertTrue("Index " + i + " has insufficient history", Null.is(ma.ma(1, i)));
        }
        assertEquals(3.0, ma.ma(1, 4), 1e-12);
        assertEquals(4.0, ma.ma(1, 5), 1e-12);
        assertEquals(5.0, ma.ma(1, 6), 1e-12);
    }

    @Test
    public void testSma3EndToEnd() {
        BaseSeries ser = closes(10, 11, 12, 11, 10, 9, 10, 11, 12, 13);
        MaFunction ma = MaFunction.of(ser, ser.close(), Factor.of("Period", 3));

        assertEquals(12.0, ma.ma(1, 9), 1e-9);
        assertTrue(Null.is(ma.ma(1, 1)));
        assertEquals(9, ma.computedIdx());
    }

    @Test
    public void testIncrementalMatchesFullWindow() {
        BaseSeries ser = closes(5, 3, 8, 1, 9, 2, 7, 4, 6, 10, 3, 5);
        Factor period = Factor.of("Period", 4);
        MaFunction ma = MaFunction.of(ser, ser.close(), period);
        MaxFunction max = MaxFunction.of(ser, ser.close(), period);
        MinFunction min = MinFunction.of(ser, ser.close(), period);
        SumFunction sum = SumFunction.of(ser, ser.close(), period);

        for (int i = 3; i < ser.size(); i++) {
            assertEquals(StatsFunctions.ma(ser.close(), i - 3, i), ma.ma(1, i), 1e-9);
            assertEquals(StatsFunctions.max(ser.close(), i - 3, i), max.max(1, i), 0.0);
            assertEquals(StatsFunctions.min(ser.close(), i - 3, i), min.min(1, i), 0.0);
            assertEquals(StatsFunctions.sum(ser.close(), i - 3, i), sum.sum(1, i), 1e-9);
        }
    }

    @Test
    public void testMaxMinLeavingExtreme() {
        BaseSeries ser = closes(9, 1, 5, 4, 3);
        Factor period = Factor.of("Period", 3);
        MaxFunction max = MaxFunction.of(ser, ser.close(), period);
        MinFunction min = MinFunction.of(ser, ser.close(), period);

        assertEquals(9.0, max.max(1, 2), 0.0);
        // 9 leaves the window
        assertEquals(5.0, max.max(1, 3), 0.0);
        assertEquals(1.0, min.min(1, 3), 0.0);
        // 1 leaves the window
        assertEquals(3.0, min.min(1, 4), 0.0);
    }

    @Test
    public void testPeriodOne() {
        BaseSeries ser = closes(4, 6);
        MaFunction ma = MaFunction.of(ser, ser.close(), Factor.of("Period", 1));
        assertEquals(4.0, ma.ma(1, 0), 0.0);
        assertEquals(6.0, ma.ma(1, 1), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testZeroPeriodRejected() {
        BaseSeries ser = closes(1, 2);
        MaFunction.of(ser, ser.close(), Factor.of("Period", 0));
    }

    @Test
    public void testName() {
        BaseSeries ser = closes(1);
        assertEquals("MA(close, Period=5)", MaFunction.of(ser, ser.close(), Factor.of("Period", 5)).name());
    }
}
