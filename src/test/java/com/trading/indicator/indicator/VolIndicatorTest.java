package com.trading.indicator.indicator;

import com.trading.indicator.api.Null;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import org.junit.Test;

import static org.junit.Assert.*;

public class VolIndicatorTest {

    @Test
    public void testVolumeAndAverages() {
        BaseSeries ser = new BaseSeries("test");
        for (int i = 0; i < 10; i++) {
            ser.append(Bar.of(i, 10, 11, 9, 10, i + 1));
        }
        VolIndicator vol = new VolIndicator(ser);
        vol.computeFrom(1, Long.MIN_VALUE);

        assertEquals(10.0, vol.output("VOL").getDouble(9), 0.0);
        assertEquals(8.0, vol.output("MA1").getDouble(9), 1e-12);
        assertEquals(5.5, vol.output("MA2").getDouble(9), 1e-12);
        assertTrue(Null.is(vol.output("MA2").getDouble(8)));
        assertTrue(Null.is(vol.output("MA1").getDouble(3)));
    }
}
