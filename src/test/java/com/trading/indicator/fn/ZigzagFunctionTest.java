package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.api.Side;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ZigzagFunctionTest {

    private BaseSeries ser;
    private ZigzagFunction zz;

    static Bar bar(long time, double high, double low) {
        double mid = (high + low) / 2;
        return Bar.of(time, mid, high, low, mid, 100);
    }

    @Before
    public void setUp() {
        ser = new BaseSeries("test");
        ser.append(bar(0, 10, 9));
        ser.append(bar(1, 12, 11)); // high of the first up leg
        ser.append(bar(2, 11, 10));
        ser.append(bar(3, 10, 9)); // 16.7% below 12: turn down
        ser.append(bar(4, 9, 8)); // low of the down leg
        ser.append(bar(5, 10, 9.5)); // 18.75% above 8: turn up
        ser.append(bar(6, 11, 10));
        ser.append(bar(7, 10.5, 10.2));
        zz = ZigzagFunction.of(ser, Factor.of("Turn Percent", 0.1, 0.01));
    }

    @Test
    public void testConfirmedTurningPoints() {
        assertEquals(12.0, zz.zigzag(1, 1), 0.0);
        // settled by the reversal at 3, without computing further
        assertEquals(3, zz.computedIdx());

        assertEquals(8.0, zz.zigzag(1, 4), 0.0);
        assertTrue(Null.is(zz.zigzag(1, 0)));
        assertTrue(Null.is(zz.zigzag(1, 2)));
        assertTrue(Null.is(zz.zigzag(1, 6)));
        assertEquals(7, zz.computedIdx());
    }

    @Test
    public void testSides() {
        assertEquals(Side.ENTER_LONG, zz.zigzagSide(1, 0));
        assertEquals(Side.ENTER_LONG, zz.zigzagSide(1, 2));
        assertEquals(Side.EXIT_LONG, zz.zigzagSide(1, 3));
        assertEquals(Side.EXIT_LONG, zz.zigzagSide(1, 4));
        assertEquals(Side.ENTER_LONG, zz.zigzagSide(1, 5));
        // no lookahead for the side
        assertEquals(5, zz.computedIdx());
    }

    @Test
    public void testPseudoIncludesTentativeExtreme() {
        assertEquals(11.0, zz.pseudoZigzag(1, 6), 0.0);
        assertEquals(12.0, zz.pseudoZigzag(1, 1), 0.0);
        assertEquals(8.0, zz.pseudoZigzag(1, 4), 0.0);
        assertTrue(Null.is(zz.pseudoZigzag(1, 7)));
        assertTrue(Null.is(zz.zigzag(1, 6)));
    }

    @Test
    public void testLiveBarConfirmsAndRetracts() {
        assertEquals(11.0, zz.pseudoZigzag(1, 6), 0.0);

        // 13.6% below 11: the up leg ends at 6
        ser.append(bar(8, 9.5, 9));
        assertEquals(11.0, zz.zigzag(2, 6), 0.0);
        assertEquals(9.0, zz.pseudoZigzag(2, 8), 0.0);
        assertEquals(11.0, zz.pseudoZigzag(2, 6), 0.0);

        // the forming bar recovers: the turn at 6 is no longer confirmed
        ser.updateLast(bar(8, 10.8, 10.5));
        assertTrue(Null.is(zz.zigzag(3, 8)));
        assertTrue(Null.is(zz.zigzag(3, 6)));
        assertTrue(Null.is(zz.pseudoZigzag(3, 8)));
        assertEquals(11.0, zz.pseudoZigzag(3, 6), 0.0);
        assertEquals(Side.ENTER_LONG, zz.zigzagSide(3, 8));

        // earlier confirmed points are untouched
        assertEquals(12.0, zz.zigzag(3, 1), 0.0);
        assertEquals(8.0, zz.zigzag(3, 4), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonPositivePercentRejected() {
        ZigzagFunction.of(ser, Factor.of("Turn Percent", 0.0));
    }
}
