package com.trading.indicator.io;

import com.trading.indicator.api.Factor;
import com.trading.indicator.api.Null;
import com.trading.indicator.indicator.Indicator;
import com.trading.indicator.indicator.KdIndicator;
import com.trading.indicator.indicator.MaIndicator;
import com.trading.indicator.indicator.MacdIndicator;
import com.trading.indicator.series.Bar;
import com.trading.indicator.series.BaseSeries;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class IndicatorSetLoaderTest {

    private BaseSeries ser;
    private IndicatorSetLoader loader;

    @Before
    public void setUp() {
        ser = new BaseSeries("test");
        for (int i = 0; i < 30; i++) {
            double c = 50 + (i % 7) - (i % 3);
            ser.append(Bar.of(i, c, c + 1, c - 1, c, 10));
        }
        loader = new IndicatorSetLoader();
    }

    @Test
    public void testLoadFixture() {
        IndicatorSetDefinition def = loader.parseResource("test-indicators.json");
        assertEquals("test", def.getIndicatorSet().getName());
        assertEquals(3, def.getIndicatorSet().getIndicators().size());

        IndicatorSet set = loader.build(ser, def);
        assertEquals("test", set.getName());
        assertEquals(List.of("fastMa", "macd", "kd"), List.copyOf(set.indicators().keySet()));

        Indicator ma = set.get("fastMa");
        assertTrue(ma instanceof MaIndicator);
        assertEquals(Factor.of("Period 1", 3), ma.factors().get("Period 1"));
        // numbers given as strings are accepted
        assertEquals(7.0, ma.factors().get("Period 3").value(), 0.0);
        assertTrue(set.get("macd") instanceof MacdIndicator);
        assertEquals(KdIndicator.PERIOD, set.get("kd").factors().get("Period K"));
    }

    @Test
    public void testRefreshComputesAllIndicators() {
        IndicatorSet set = loader.build(ser, loader.parseResource("test-indicators.json"));
        set.refresh(1, Long.MIN_VALUE);

        for (Indicator indicator : set.indicators().values()) {
            assertEquals(29L, indicator.computedTime());
        }
        assertFalse(Null.is(set.get("fastMa").output("MA1").getDouble(29)));
        assertFalse(Null.is(set.get("kd").output("K").getDouble(29)));
    }

    @Test
    public void testDefaultExampleLoads() {
        IndicatorSet set = loader.build(ser, loader.parseResource("indicators.json"));
        assertEquals("daily", set.getName());
        assertEquals(11, set.size());
        set.refresh(1, Long.MIN_VALUE);
        assertEquals(2.5, set.get("boll").factors().get("Alpha2").value(), 0.0);
        assertEquals(26.0, set.get("arbr").factors().get("Period").value(), 0.0);
        assertEquals(12, set.get("gmma").outputs().size());
        assertEquals(ser.timeAxis().lastTime(), set.get("hvd").computedTime());
    }

    @Test
    public void testGmmaAndHvdProperties() {
        String json = "{\"indicatorSet\":{\"name\":\"s\",\"indicators\":["
                + "{\"name\":\"g\",\"type\":\"gmma\",\"properties\":{\"short1\":2,\"long6\":25}},"
                + "{\"name\":\"h\",\"type\":\"HVD\",\"properties\":"
                + "{\"nIntervals\":5,\"period1\":10,\"period2\":20,\"period3\":30}}]}}";
        IndicatorSet set = loader.load(ser, json);

        Map<String, Factor> gmma = set.get("g").factors();
        assertEquals(2.0, gmma.get("Period Short 1").value(), 0.0);
        assertEquals(5.0, gmma.get("Period Short 2").value(), 0.0);
        assertEquals(25.0, gmma.get("Period Long 6").value(), 0.0);

        set.refresh(1, Long.MIN_VALUE);
        Indicator hvd = set.get("h");
        assertEquals(5.0, hvd.factors().get("Number of Intervals").value(), 0.0);
        assertFalse(Null.is(hvd.output("POC3").getDouble(29)));
        assertTrue(Null.is(hvd.output("POC3").getDouble(28)));
    }

    @Test
    public void testLoadFromString() {
        String json = "{\"indicatorSet\":{\"name\":\"s\",\"indicators\":[{\"name\":\"z\",\"type\":\"zigzag\","
                + "\"properties\":{\"percent\":0.05}}]}}";
        IndicatorSet set = loader.load(ser, json);
        assertEquals(0.05, set.get("z").factors().get("Turn Percent").value(), 0.0);
        assertSame(ser, set.baseSeries());
    }

    @Test
    public void testUnknownTypeRejected() {
        try {
            loader.load(ser, "{\"indicatorSet\":{\"indicators\":[{\"name\":\"x\",\"type\":\"FOO\"}]}}");
            fail("Expected IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            assertTrue(e.getMessage().contains("FOO"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNameRejected() {
        loader.load(ser, "{\"indicatorSet\":{\"indicators\":[{\"name\":\"x\",\"type\":\"MA\"},"
                + "{\"name\":\"x\",\"type\":\"KD\"}]}}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingSetRejected() {
        loader.load(ser, "{}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMalformedJsonRejected() {
        loader.parse("{\"indicatorSet\":");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBadFactorRejected() {
        loader.load(ser, "{\"indicatorSet\":{\"indicators\":[{\"name\":\"x\",\"type\":\"MA\","
                + "\"properties\":{\"period1\":\"five\"}}]}}");
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingResourceRejected() {
        loader.parseResource("no-such-file.json");
    }

    @Test
    public void testTypeLookupIgnoresCase() {
        assertEquals(IndicatorType.MACD, IndicatorType.fromString("macd"));
        assertEquals(MaIndicator.class, IndicatorType.MA.getIndicatorClass());
        Indicator ma = IndicatorType.MA.getFactory().create(ser, Map.of());
        assertEquals(MaIndicator.PERIOD1, ma.factors().get("Period 1"));
    }
}
