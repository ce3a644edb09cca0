package com.trading.indicator.series;

import com.trading.indicator.api.Factor;
import com.trading.indicator.engine.Function;
import com.trading.indicator.fn.EmaFunction;
import com.trading.indicator.fn.MaFunction;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.Assert.*;

public class BaseSeriesTest {

    private BaseSeries ser;

    @Before
    public void setUp() {
        ser = new BaseSeries("test");
        for (int i = 0; i < 5; i++) {
            ser.append(Bar.of(i * 60L, 10 + i, 11 + i, 9 + i, 10.5 + i, 100 * (i + 1)));
        }
    }

    @Test
    public void testAppendWritesColumns() {
        assertEquals(5, ser.size());
        assertEquals(13.0, ser.open().getDouble(3), 0.0);
        assertEquals(14.0, ser.high().getDouble(3), 0.0);
        assertEquals(12.0, ser.low().getDouble(3), 0.0);
        assertEquals(13.5, ser.close().getDouble(3), 0.0);
        assertEquals(400.0, ser.volume().getDouble(3), 0.0);
        assertEquals(Boolean.TRUE, ser.isClosed().get(3));
        assertEquals(Bar.of(180L, 13, 14, 12, 13.5, 400), ser.bar(3));
    }

    @Test
    public void testOutOfOrderAppendRejected() {
        try {
            ser.append(Bar.ofClose(120L, 1.0));
            fail("Expected OutOfOrderTimestampException");
        } catch (OutOfOrderTimestampException expected) {
        }
        assertEquals(5, ser.size());
        assertEquals(240L, ser.timeAxis().lastTime());
    }

    @Test
    public void testBatchAppendIsAllOrNothing() {
        List<Bar> bars = new ArrayList<>();
        bars.add(Bar.ofClose(300L, 1.0));
        bars.add(Bar.ofClose(360L, 2.0));
        bars.add(Bar.ofClose(360L, 3.0));
        try {
            ser.append(bars);
            fail("Expected OutOfOrderTimestampException");
        } catch (OutOfOrderTimestampException e) {
            assertEquals(360L, e.rejectedTime());
        }
        assertEquals(5, ser.size());

        bars.remove(2);
        ser.append(bars);
        assertEquals(7, ser.size());
        assertEquals(2.0, ser.close().getDouble(6), 0.0);
    }

    @Test
    public void testUpdateLast() {
        ser.updateLast(new Bar(240L, 14, 20, 13, 19, 900, false));
        assertEquals(5, ser.size());
        assertEquals(19.0, ser.close().getDouble(4), 0.0);
        assertEquals(Boolean.FALSE, ser.isClosed().get(4));
    }

    @Test(expected = IllegalStateException.class)
    public void testUpdateLastWrongTime() {
        ser.updateLast(Bar.ofClose(300L, 1.0));
    }

    @Test(expected = IllegalStateException.class)
    public void testUpdateLastOnEmptySeries() {
        new BaseSeries("empty").updateLast(Bar.ofClose(0L, 1.0));
    }

    @Test
    public void testRegistryReturnsSameInstanceForEqualArguments() {
        MaFunction a = MaFunction.of(ser, ser.close(), Factor.of("Period", 3));
        MaFunction b = MaFunction.of(ser, ser.close(), Factor.of("Period", 3));
        MaFunction c = MaFunction.of(ser, ser.close(), Factor.of("Period", 4));
        MaFunction d = MaFunction.of(ser, ser.open(), Factor.of("Period", 3));
        EmaFunction e = EmaFunction.of(ser, ser.close(), Factor.of("Period", 3));

        assertSame(a, b);
        assertNotSame(a, c);
        assertNotSame(a, d);
        assertNotNull(e);
        assertEquals(4, ser.functions().size());
    }

    @Test
    public void testConcurrentFirstRequestConstructsOnce() throws Exception {
        final int threads = 8;
        final CountDownLatch start = new CountDownLatch(1);
        final CountDownLatch done = new CountDownLatch(threads);
        final Set<MaFunction> seen = ConcurrentHashMap.newKeySet();
        final AtomicReference<Throwable> failure = new AtomicReference<>();

        for (int t = 0; t < threads; t++) {
            new Thread(() -> {
                try {
                    start.await();
                    seen.add(MaFunction.of(ser, ser.close(), Factor.of("Period", 5)));
                } catch (Throwable e) {
                    failure.set(e);
                } finally {
                    done.countDown();
                }
            }).start();
        }

        start.countDown();
        assertTrue("Workers did not finish", done.await(5, TimeUnit.SECONDS));
        assertNull(failure.get());
        assertEquals(1, seen.size());
        assertEquals(1, ser.functions().size());
    }

    /** Parks inside the spot at {@code blockAt} until released. */
    static final class BlockingFunction extends Function {
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch release = new CountDownLatch(1);
        final AtomicInteger sizeSeenAfterRelease = new AtomicInteger(-1);
        private final int blockAt;

        BlockingFunction(BaseSeries baseSer, int blockAt) {
            super(baseSer, "BLOCK");
            this.blockAt = blockAt;
        }

        @Override
        protected void computeSpot(int i) {
            if (i != blockAt)
                return;
            entered.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS))
                    throw new IllegalStateException("never released");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
            sizeSeenAfterRelease.set(axis.size());
        }
    }

    @Test
    public void testAppendWaitsForInFlightComputation() throws Exception {
        final BlockingFunction fn = new BlockingFunction(ser, 4);
        final CountDownLatch appended = new CountDownLatch(1);
        final AtomicReference<Throwable> failure = new AtomicReference<>();

        Thread computer = new Thread(() -> {
            try {
                fn.computeTo(1, 4);
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        computer.start();
        assertTrue("Computation did not start", fn.entered.await(5, TimeUnit.SECONDS));

        Thread appender = new Thread(() -> {
            try {
                ser.append(Bar.ofClose(300L, 1.0));
            } catch (Throwable e) {
                failure.set(e);
            } finally {
                appended.countDown();
            }
        });
        appender.start();

        assertFalse("Append must block while a computation holds the axis",
                appended.await(200, TimeUnit.MILLISECONDS));
        assertEquals(5, ser.size());

        fn.release.countDown();
        assertTrue("Append did not complete", appended.await(5, TimeUnit.SECONDS));
        computer.join(5000);
        appender.join(5000);

        assertNull(failure.get());
        assertEquals("The computation saw a stable axis length", 5, fn.sizeSeenAfterRelease.get());
        assertEquals(4, fn.computedIdx());
        assertEquals(6, ser.size());
    }
}
