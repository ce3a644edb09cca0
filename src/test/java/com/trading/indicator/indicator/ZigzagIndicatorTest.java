package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.series.DoubleVar;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ZigzagIndicatorTest {

    private BaseSeries ser;
    private ZigzagIndicator indicator;

    static Bar bar(long time, double high, double low) {
        double mid = (high + low) / 2;
        return Bar.of(time, mid, high, low, mid, 100);
    }

    @Before
    public void setUp() {
        ser = new BaseSeries("test");
        ser.append(bar(0, 10, 9));
        ser.append(bar(1, 12, 11));
        ser.append(bar(2, 11, 10));
        ser.append(bar(3, 10, 9));
        ser.append(bar(4, 9, 8));
        ser.append(bar(5, 10, 9.5));
        ser.append(bar(6, 11, 10));
        ser.append(bar(7, 10.5, 10.2));
        indicator = new ZigzagIndicator(ser, Factor.of("Turn Percent", 0.1, 0.01));
    }

    @Test
    public void testFullRefresh() {
        indicator.computeFrom(1, Long.MIN_VALUE);
        DoubleVar zigzag = indicator.output("ZIGZAG");
        DoubleVar pseudo = indicator.output("PSEUDO");

        assertEquals(12.0, zigzag.getDouble(1), 0.0);
        assertEquals(8.0, zigzag.getDouble(4), 0.0);
        for (int i : new int[] { 0, 2, 3, 5, 6, 7 }) {
            assertTrue("No turning point at " + i, Null.is(zigzag.getDouble(i)));
        }
        assertEquals(11.0, pseudo.getDouble(6), 0.0);
        assertTrue(Null.is(pseudo.getDouble(7)));
    }

    @Test
    public void testIncrementalRefreshRewritesPastTurningPoint() {
        indicator.computeFrom(1, Long.MIN_VALUE);

        ser.append(bar(8, 9.5, 9));
        indicator.computeFrom(2, 8);

        DoubleVar zigzag = indicator.output("ZIGZAG");
        DoubleVar pseudo = indicator.output("PSEUDO");
        assertEquals(11.0, zigzag.getDouble(6), 0.0);
        assertEquals(9.0, pseudo.getDouble(8), 0.0);
        assertEquals(12.0, zigzag.getDouble(1), 0.0);

        ser.updateLast(bar(8, 10.8, 10.5));
        indicator.computeFrom(3, 8);
        assertTrue(Null.is(zigzag.getDouble(6)));
        assertTrue(Null.is(pseudo.getDouble(8)));
        assertEquals(11.0, pseudo.getDouble(6), 0.0);
    }
}
