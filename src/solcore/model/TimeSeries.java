package solcore.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable time series: strictly ascending unique UTC timestamps with one value each.
 * Missing values are stored as NaN.
 */
public final class TimeSeries {

    private final Instant[] times;
    private final double[] values;

    public TimeSeries(Instant[] times, double[] values) {
        Objects.requireNonNull(times, "times");
        Objects.requireNonNull(values, "values");
        if (times.length != values.length) {
            throw new IllegalArgumentException(
                    "times/values length mismatch: " + times.length + " != " + values.length);
        }
        for (int i = 1; i < times.length; i++) {
            if (!times[i].isAfter(times[i - 1])) {
                throw new IllegalArgumentException(
                        "timestamps must be strictly ascending: " + times[i - 1] + " -> " + times[i]);
            }
        }
        this.times = times.clone();
        this.values = values.clone();
    }

    /** Same timestamps, new values. */
    public TimeSeries withValues(double[] newValues) {
        return new TimeSeries(times, newValues);
    }

    public static TimeSeries constant(Instant[] times, double value) {
        double[] v = new double[times.length];
        Arrays.fill(v, value);
        return new TimeSeries(times, v);
    }

    public int size() {
        return times.length;
    }

    public boolean isEmpty() {
        return times.length == 0;
    }

    public Instant timeAt(int i) {
        return times[i];
    }

    public double valueAt(int i) {
        return values[i];
    }

    /** Defensive copy of the timestamps. */
    public Instant[] getTimes() {
        return times.clone();
    }

    /** Defensive copy of the values. */
    public double[] getValues() {
        return values.clone();
    }

    public boolean sameTimesAs(TimeSeries other) {
        return Arrays.equals(times, other.times);
    }

    /**
     * Sub-series with start <= t <= end. Null bounds are open.
     */
    public TimeSeries slice(Instant start, Instant end) {
        int from = 0;
        int to = times.length;
        if (start != null) {
            while (from < to && times[from].isBefore(start)) from++;
        }
        if (end != null) {
            while (to > from && times[to - 1].isAfter(end)) to--;
        }
        return new TimeSeries(Arrays.copyOfRange(times, from, to), Arrays.copyOfRange(values, from, to));
    }

    /**
     * Joins this series onto the given time index: values whose timestamp is not
     * present here come out as NaN.
     */
    public double[] alignTo(Instant[] index) {
        Map<Instant, Double> byTime = new HashMap<>(times.length * 2);
        for (int i = 0; i < times.length; i++) {
            byTime.put(times[i], values[i]);
        }
        double[] out = new double[index.length];
        for (int i = 0; i < index.length; i++) {
            Double v = byTime.get(index[i]);
            out[i] = (v == null) ? Double.NaN : v;
        }
        return out;
    }

    @Override
    public String toString() {
        if (times.length == 0) return "TimeSeries[empty]";
        return "TimeSeries[" + times.length + " points, " + times[0] + " .. " + times[times.length - 1] + "]";
    }
}
