package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.series.BaseSeries;
import org.junit.Test;

import static com.trading.indicator.fn.MaFunctionTest.closes;
import static org.junit.Assert.*;

public class BollFunctionTest {

    @Test
    public void testPopulationStdDev() {
        BaseSeries ser = closes(1, 2, 3, 4, 5);
        StdDevFunction sd = StdDevFunction.of(ser, ser.close(), Factor.of("Period", 5));
        assertTrue(Null.is(sd.stdDev(1, 3)));
        assertEquals(Math.sqrt(2.0), sd.stdDev(1, 4), 1e-12);
    }

    @Test
    public void testBands() {
        BaseSeries ser = closes(1, 2, 3, 4, 5);
        Factor period = Factor.of("Period", 5);
        Factor alpha = Factor.of("Alpha", 2.0, 0.1);
        BollFunction boll = BollFunction.of(ser, ser.close(), period, alpha);

        assertEquals(3.0, boll.bollMiddle(1, 4), 1e-12);
        assertEquals(3.0 + 2 * Math.sqrt(2.0), boll.bollUpper(1, 4), 1e-12);
        assertEquals(3.0 - 2 * Math.sqrt(2.0), boll.bollLower(1, 4), 1e-12);
        assertTrue(Null.is(boll.bollUpper(1, 3)));

        // middle band is the shared MA
        assertEquals(4, MaFunction.of(ser, ser.close(), period).computedIdx());
    }
}
