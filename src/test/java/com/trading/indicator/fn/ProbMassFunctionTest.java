package com.trading.indicator.fn;

import com.trading.indicator.api.Factor;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import com.trading.indicator.util.ProbMass;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class ProbMassFunctionTest {

    private BaseSeries ser;
    private final Factor period = Factor.of("Period", 3);
    private final Factor nIntervals = Factor.of("Number of Intervals", 3);

    @Before
    public void setUp() {
        ser = new BaseSeries("test");
        double[] closes = { 1, 2, 3, 4, 5 };
        double[] volumes = { 1, 1, 1, 1, 6 };
        for (int i = 0; i < closes.length; i++) {
            ser.append(Bar.of(i, closes[i], closes[i], closes[i], closes[i], volumes[i]));
        }
    }

    @Test
    public void testUnweightedWindow() {
        ProbMassFunction fn = ProbMassFunction.of(ser, ser.close(), period, nIntervals);
        assertNull(fn.probMass(1, 1));

        ProbMass mass = fn.probMass(1, 4);
        assertEquals(3, mass.size());
        assertEquals(3.0, mass.value(0), 1e-12);
        assertEquals(4.0, mass.value(1), 1e-12);
        assertEquals(5.0, mass.value(2), 1e-12);
        for (int k = 0; k < 3; k++) {
            assertEquals(1.0 / 3.0, mass.mass(k), 1e-12);
        }
    }

    @Test
    public void testVolumeWeightedWindow() {
        ProbMassFunction fn = ProbMassFunction.of(ser, ser.close(), ser.volume(), period, nIntervals);
        ProbMass mass = fn.probMass(1, 4);
        assertEquals(0.125, mass.mass(0), 1e-12);
        assertEquals(0.125, mass.mass(1), 1e-12);
        assertEquals(0.75, mass.mass(2), 1e-12);
        assertEquals(2, mass.modeBin());
    }

    @Test
    public void testWeightIsPartOfIdentity() {
        ProbMassFunction plain = ProbMassFunction.of(ser, ser.close(), period, nIntervals);
        assertSame(plain, ProbMassFunction.of(ser, ser.close(), null, period, nIntervals));
        assertNotSame(plain, ProbMassFunction.of(ser, ser.close(), ser.volume(), period, nIntervals));
        assertEquals("PROBMASS(close, volume, Period=3, Number of Intervals=3)",
                ProbMassFunction.of(ser, ser.close(), ser.volume(), period, nIntervals).name());
    }

    @Test
    public void testNewSessionSeesUpdatedLastBar() {
        ProbMassFunction fn = ProbMassFunction.of(ser, ser.close(), ser.volume(), period, nIntervals);
        assertEquals(0.75, fn.probMass(1, 4).mass(2), 1e-12);

        ser.updateLast(Bar.of(4, 5, 5, 5, 5, 2));
        assertEquals(0.75, fn.probMass(1, 4).mass(2), 1e-12);
        assertEquals(0.5, fn.probMass(2, 4).mass(2), 1e-12);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsZeroIntervals() {
        ProbMassFunction.of(ser, ser.close(), period, Factor.of("Number of Intervals", 0));
    }
}
