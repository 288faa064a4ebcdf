package solcore.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class TimeSeriesTest {

    private static final Instant T0 = Instant.parse("2024-01-15T00:00:00Z");

    @Test
    void rejectsUnorderedOrDuplicateTimestamps() {
        Instant[] dup = {T0, T0};
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(dup, new double[]{1, 2}));

        Instant[] backwards = {T0.plusSeconds(60), T0};
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(backwards, new double[]{1, 2}));
    }

    @Test
    void rejectsLengthMismatch() {
        Instant[] t = AtmosphereFixtures.hourly(T0, 3);
        assertThrows(IllegalArgumentException.class, () -> new TimeSeries(t, new double[]{1, 2}));
    }

    @Test
    void sliceIsInclusiveOnBothEnds() {
        Instant[] t = AtmosphereFixtures.hourly(T0, 5);
        TimeSeries s = new TimeSeries(t, new double[]{0, 1, 2, 3, 4});

        TimeSeries mid = s.slice(t[1], t[3]);
        assertEquals(3, mid.size());
        assertEquals(1.0, mid.valueAt(0));
        assertEquals(3.0, mid.valueAt(2));

        assertEquals(5, s.slice(null, null).size());
        assertTrue(s.slice(t[4].plusSeconds(1), null).isEmpty());
    }

    @Test
    void alignToFillsMissingTimestampsWithNaN() {
        Instant[] t = AtmosphereFixtures.hourly(T0, 3);
        TimeSeries s = new TimeSeries(new Instant[]{t[0], t[2]}, new double[]{10, 30});

        double[] aligned = s.alignTo(t);
        assertArrayEquals(new double[]{10, Double.NaN, 30}, aligned);
    }

    @Test
    void valuesAreCopiedOnTheWayInAndOut() {
        Instant[] t = AtmosphereFixtures.hourly(T0, 2);
        double[] v = {1, 2};
        TimeSeries s = new TimeSeries(t, v);
        v[0] = 99;
        s.getValues()[1] = 99;
        assertEquals(1.0, s.valueAt(0));
        assertEquals(2.0, s.valueAt(1));
    }
}
