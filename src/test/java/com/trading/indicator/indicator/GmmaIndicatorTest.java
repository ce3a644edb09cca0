package com.trading.indicator.indicator;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.fn.MaFunction;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class GmmaIndicatorTest {

    private BaseSeries ser;

    @Before
    public void setUp() {
        ser = new BaseSeries("test");
        for (int i = 0; i < 60; i++) {
            ser.append(Bar.ofClose(i, i));
        }
    }

    @Test
    public void testShortAndLongAverages() {
        GmmaIndicator gmma = new GmmaIndicator(ser);
        gmma.computeFrom(1, Long.MIN_VALUE);

        assertEquals(12, gmma.outputs().size());
        assertEquals("MA01", gmma.outputs().keySet().iterator().next());
        assertEquals(58.0, gmma.output("MA01").getDouble(59), 1e-9);
        assertEquals(52.0, gmma.output("MA06").getDouble(59), 1e-9);
        assertEquals(29.5, gmma.output("MA12").getDouble(59), 1e-9);
        assertTrue(Null.is(gmma.output("MA12").getDouble(58)));

        MaFunction shared = MaFunction.of(ser, ser.close(), GmmaIndicator.PERIODS.get(0));
        assertEquals(59, shared.computedIdx());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRequiresTwelvePeriods() {
        List<Factor> periods = new ArrayList<>(GmmaIndicator.PERIODS);
        periods.remove(11);
        new GmmaIndicator(ser, periods);
    }
}
