package com.trading.indicator.indicator;

import com.trading.indicator.api.Null;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ArbrIndicatorTest {

    private BaseSeries ser;
    private ArbrIndicator arbr;

    @Before
    public void setUp() {
        ser = new BaseSeries("test");
        ser.append(Bar.of(0, 10, 12, 9, 11, 100));
        ser.append(Bar.of(1, 11, 14, 10, 13, 100));
        ser.append(Bar.of(2, 13, 13, 11, 12, 100));
        // opens and closes at the low: nothing below the open or the close
        ser.append(Bar.of(3, 12, 13, 12, 12, 100));
        ser.append(Bar.of(4, 12, 14, 12, 12, 100));
        arbr = new ArbrIndicator(ser, ArbrIndicator.PERIOD.withValue(2));
        arbr.computeFrom(1, Long.MIN_VALUE);
    }

    @Test
    public void testRatios() {
        assertTrue(Null.is(arbr.output("AR").getDouble(0)));
        assertEquals(250.0, arbr.output("AR").getDouble(1), 1e-9);
        assertEquals(40.0, arbr.output("BR").getDouble(1), 1e-9);
        assertEquals(100.0, arbr.output("AR").getDouble(2), 1e-9);
        assertEquals(50.0, arbr.output("BR").getDouble(2), 1e-9);
    }

    @Test
    public void testZeroDenominatorIsNull() {
        assertTrue(Null.is(arbr.output("AR").getDouble(4)));
        assertTrue(Null.is(arbr.output("BR").getDouble(4)));
    }

    @Test
    public void testLiveUpdateOfLastBar() {
        ser.updateLast(Bar.of(4, 12, 14, 11, 13, 100));
        arbr.computeFrom(2, ser.timeAxis().lastTime());
        // up 1 + 2, dn 0 + 1
        assertEquals(300.0, arbr.output("AR").getDouble(4), 1e-9);
        // bs 1 + 1, ss 0 + 2
        assertEquals(100.0, arbr.output("BR").getDouble(4), 1e-9);
    }
}
