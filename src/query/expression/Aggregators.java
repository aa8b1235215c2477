// This file is part of SeriesMath.
// Copyright (C) 2026  The SeriesMath Authors.
//
// This program is free software: you can redistribute it and/or modify it
// under the terms of the GNU Lesser General Public License as published by
// the Free Software Foundation, either version 2.1 of the License, or (at your
// option) any later version.  This program is distributed in the hope that it
// will be useful, but WITHOUT ANY WARRANTY; without even the implied warranty
// of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the GNU Lesser
// General Public License for more details.  You should have received a copy
// of the GNU Lesser General Public License along with this program.  If not,
// see <http://www.gnu.org/licenses/>.
package net.seriesmath.query.expression;

import java.util.Collections;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import com.google.common.collect.Maps;

/**
 * Common {@link AggregateFunction}s. Unless noted otherwise NaNs are skipped
 * and a column without any real value aggregates to NaN.
 */
public final class Aggregators {

  /** Sums the values. */
  public static final AggregateFunction SUM = new Sum("sum");

  /** Averages the values. */
  public static final AggregateFunction AVG = new Avg("avg");

  /** Returns the smallest value. */
  public static final AggregateFunction MIN = new Min("min");

  /** Returns the largest value. */
  public static final AggregateFunction MAX = new Max("max");

  /** Returns the median value. */
  public static final AggregateFunction MEDIAN = new Median("median");

  /** Multiplies the values. Any NaN makes the product NaN. */
  public static final AggregateFunction MULTIPLY = new Multiply("multiply");

  /** Subtracts every following value from the first real one. */
  public static final AggregateFunction DIFF = new Diff("diff");

  /** Returns the population standard deviation. */
  public static final AggregateFunction DEV = new StdDev("stddev");

  /** Counts the real values. Returns 0, not NaN, for an all-NaN column. */
  public static final AggregateFunction COUNT = new Count("count");

  /** Returns the difference between the largest and smallest value. */
  public static final AggregateFunction RANGE = new Range("range");

  /** Returns the first real value. */
  public static final AggregateFunction FIRST = new First("first");

  /** Returns the last real value. */
  public static final AggregateFunction LAST = new Last("last");

  /** Maps an aggregator name to its instance */
  private static final Map<String, AggregateFunction> aggregators;

  static {
    aggregators = Maps.newHashMapWithExpectedSize(16);
    aggregators.put("sum", SUM);
    aggregators.put("total", SUM);
    aggregators.put("avg", AVG);
    aggregators.put("average", AVG);
    aggregators.put("min", MIN);
    aggregators.put("max", MAX);
    aggregators.put("median", MEDIAN);
    aggregators.put("multiply", MULTIPLY);
    aggregators.put("diff", DIFF);
    aggregators.put("stddev", DEV);
    aggregators.put("count", COUNT);
    aggregators.put("range", RANGE);
    aggregators.put("rangeOf", RANGE);
    aggregators.put("first", FIRST);
    aggregators.put("last", LAST);
  }

  private Aggregators() {
    // Can't create instances of this utility class.
  }

  /**
   * Returns the set of the names that can be used with {@link #get get}.
   */
  public static Set<String> set() {
    return Collections.unmodifiableSet(aggregators.keySet());
  }

  /**
   * Returns the aggregator corresponding to the given name.
   * @param name The name of the aggregator to get.
   * @throws NoSuchElementException if the given name doesn't exist.
   * @see #set
   */
  public static AggregateFunction get(final String name) {
    final AggregateFunction agg = aggregators.get(name);
    if (agg != null) {
      return agg;
    }
    throw new NoSuchElementException("No such aggregator: " + name);
  }

  /** Base for the named aggregators. */
  private abstract static class Named implements AggregateFunction {
    private final String name;

    Named(final String name) {
      this.name = name;
    }

    @Override
    public String toString() {
      return name;
    }
  }

  private static final class Sum extends Named {
    Sum(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      double result = 0.;
      int n = 0;
      for (final double val : values) {
        if (!Double.isNaN(val)) {
          result += val;
          ++n;
        }
      }
      return (0 == n) ? Double.NaN : result;
    }
  }

  private static final class Avg extends Named {
    Avg(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      double result = 0.;
      int n = 0;
      for (final double val : values) {
        if (!Double.isNaN(val)) {
          result += val;
          ++n;
        }
      }
      return (0 == n) ? Double.NaN : result / n;
    }
  }

  private static final class Min extends Named {
    Min(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      double min = Double.POSITIVE_INFINITY;
      boolean found = false;
      for (final double val : values) {
        if (!Double.isNaN(val)) {
          found = true;
          if (val < min) {
            min = val;
          }
        }
      }
      return found ? min : Double.NaN;
    }
  }

  private static final class Max extends Named {
    Max(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      double max = Double.NEGATIVE_INFINITY;
      boolean found = false;
      for (final double val : values) {
        if (!Double.isNaN(val)) {
          found = true;
          if (val > max) {
            max = val;
          }
        }
      }
      return found ? max : Double.NaN;
    }
  }

  private static final class Median extends Named {
    Median(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      final double[] real = real(values);
      if (real.length == 0) {
        // in this case we may have had lots of NaNs so just drop em.
        return Double.NaN;
      }
      return new Percentile(50).evaluate(real);
    }
  }

  private static final class Multiply extends Named {
    Multiply(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      if (values.length == 0) {
        return Double.NaN;
      }
      double result = 1.;
      for (final double val : values) {
        result *= val;
      }
      return result;
    }
  }

  private static final class Diff extends Named {
    Diff(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      double result = Double.NaN;
      for (final double val : values) {
        if (Double.isNaN(val)) {
          continue;
        }
        result = Double.isNaN(result) ? val : result - val;
      }
      return result;
    }
  }

  private static final class StdDev extends Named {
    StdDev(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      // Welford's online algorithm
      double mean = 0.;
      double m2 = 0.;
      int n = 0;
      for (final double val : values) {
        if (Double.isNaN(val)) {
          continue;
        }
        n++;
        final double delta = val - mean;
        mean += delta / n;
        m2 += delta * (val - mean);
      }
      return (0 == n) ? Double.NaN : Math.sqrt(m2 / n);
    }
  }

  private static final class Count extends Named {
    Count(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      int n = 0;
      for (final double val : values) {
        if (!Double.isNaN(val)) {
          n++;
        }
      }
      return n;
    }
  }

  private static final class Range extends Named {
    Range(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      return MAX.aggregate(values) - MIN.aggregate(values);
    }
  }

  private static final class First extends Named {
    First(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      for (final double val : values) {
        if (!Double.isNaN(val)) {
          return val;
        }
      }
      return Double.NaN;
    }
  }

  private static final class Last extends Named {
    Last(final String name) {
      super(name);
    }

    @Override
    public double aggregate(final double[] values) {
      for (int i = values.length - 1; i >= 0; i--) {
        if (!Double.isNaN(values[i])) {
          return values[i];
        }
      }
      return Double.NaN;
    }
  }

  /** @return a copy of the values without NaNs */
  private static double[] real(final double[] values) {
    int n = 0;
    for (final double val : values) {
      if (!Double.isNaN(val)) {
        n++;
      }
    }
    final double[] real = new double[n];
    int ix = 0;
    for (final double val : values) {
      if (!Double.isNaN(val)) {
        real[ix++] = val;
      }
    }
    return real;
  }
}
