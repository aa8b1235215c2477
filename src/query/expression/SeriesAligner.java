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

import java.math.RoundingMode;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;
import com.google.common.math.LongMath;

import net.seriesmath.core.Series;

/**
 * Reconciles a set of series onto one time grid.
 * <p>
 * Every series is padded with NaNs so that all of them cover the earliest
 * start and the latest stop. When extrapolation is enabled, series with a
 * coarser step are first resampled onto the finest step by linear
 * interpolation, and points past the last known sample follow the slope of
 * the last segment.
 * <p>
 * The inputs are never modified. A series that needs changes is replaced by
 * a new instance in the returned list, one that already fits is returned as
 * is. Passes repeat until nothing changes.
 * @since 1.0
 */
public class SeriesAligner {
  private static final Logger LOG = LoggerFactory.getLogger(SeriesAligner.class);

  /** Whether or not to resample coarse series onto the finest step */
  private final boolean extrapolate;

  /**
   * Default ctor
   * @param extrapolate Whether or not to resample series with a larger step
   * onto the smallest step. If false only the bounds are reconciled.
   */
  public SeriesAligner(final boolean extrapolate) {
    this.extrapolate = extrapolate;
  }

  /** @return whether or not coarse series are resampled */
  public boolean extrapolate() {
    return extrapolate;
  }

  /**
   * Aligns the series.
   * @param series The series to align, not modified
   * @return A new list with the aligned series in input order
   * @throws EmptyInputException if the list was null or empty
   * @throws IllegalArgumentException if a series had a step of zero or less
   */
  public List<Series> align(final List<Series> series) {
    if (series == null || series.isEmpty()) {
      throw new EmptyInputException("Cannot align an empty set of series");
    }
    for (final Series s : series) {
      if (s.step() <= 0) {
        throw new IllegalArgumentException("Invalid step " + s.step() 
            + " for series " + s.name());
      }
    }

    final List<Series> aligned = Lists.newArrayList(series);
    int passes = 0;
    boolean changed;
    do {
      changed = false;
      if (extrapolate) {
        changed |= resampleAll(aligned);
      }
      changed |= padAll(aligned);
      passes++;
    } while (changed);

    if (LOG.isDebugEnabled()) {
      LOG.debug("Aligned " + aligned.size() + " series in " + passes 
          + " pass(es)");
    }
    return aligned;
  }

  /**
   * Resamples every series coarser than the finest step.
   * @param series The working list, entries are replaced
   * @return true if at least one series was replaced
   */
  private boolean resampleAll(final List<Series> series) {
    long min_step = Long.MAX_VALUE;
    for (final Series s : series) {
      min_step = Math.min(min_step, s.step());
    }
    boolean changed = false;
    for (int i = 0; i < series.size(); i++) {
      final Series s = series.get(i);
      if (s.step() > min_step) {
        series.set(i, resample(s, min_step));
        changed = true;
      }
    }
    return changed;
  }

  /**
   * Pads every series to the common bounds.
   * @param series The working list, entries are replaced
   * @return true if at least one series was replaced
   */
  private boolean padAll(final List<Series> series) {
    long min_start = Long.MAX_VALUE;
    long max_stop = Long.MIN_VALUE;
    for (final Series s : series) {
      min_start = Math.min(min_start, s.startTime());
      max_stop = Math.max(max_stop, s.stopTime());
    }
    boolean changed = false;
    for (int i = 0; i < series.size(); i++) {
      final Series s = series.get(i);
      if (s.startTime() != min_start || s.stopTime() != max_stop) {
        series.set(i, pad(s, min_start, max_stop));
        changed = true;
      }
    }
    return changed;
  }

  /**
   * Prepends and appends NaNs so the series spans the given bounds. The
   * number of points is computed with the series' own step.
   * @param series The series to pad
   * @param start The common start time
   * @param stop The common stop time
   * @return A new padded series
   */
  static Series pad(final Series series, final long start, final long stop) {
    final int leading = (int) ((series.startTime() - start) / series.step());
    final int trailing = (int) ((stop - series.stopTime()) / series.step());
    final double[] values = new double[leading + series.size() + trailing];
    Arrays.fill(values, 0, leading, Double.NaN);
    System.arraycopy(series.values(), 0, values, leading, series.size());
    Arrays.fill(values, leading + series.size(), values.length, Double.NaN);
    return series.derive(start, stop, series.step(), values);
  }

  /**
   * Resamples a series onto a finer step. Points between two known samples
   * are linearly interpolated, points past the last sample are extrapolated
   * with the slope of the last segment. A series with less than two samples
   * has no slope so only its known sample is kept.
   * @param series The series to resample
   * @param step The new, smaller step
   * @return A new series covering the same bounds
   */
  static Series resample(final Series series, final long step) {
    final double[] source = series.values();
    final long source_step = series.step();
    final int count = (int) LongMath.divide(
        Math.max(0, series.stopTime() - series.startTime()), step,
        RoundingMode.CEILING);
    final double[] values = new double[count];
    final int last = source.length - 1;

    for (int i = 0; i < count; i++) {
      final long offset = i * step;
      final int segment = (int) (offset / source_step);
      final long into_segment = offset - (segment * source_step);

      if (segment <= last && into_segment == 0) {
        values[i] = source[segment];
      } else if (segment < last) {
        final double slope = (source[segment + 1] - source[segment]) 
            / source_step;
        values[i] = source[segment] + (slope * into_segment);
      } else if (last < 1) {
        values[i] = Double.NaN;
      } else {
        final double slope = (source[last] - source[last - 1]) / source_step;
        values[i] = source[last] + (slope * (offset - (last * source_step)));
      }
    }

    if (LOG.isDebugEnabled()) {
      LOG.debug("Resampled " + series.name() + " from " + source_step + "s (" 
          + source.length + " points) to " + step + "s (" + count + " points)");
    }
    return series.derive(series.startTime(), series.stopTime(), step, values);
  }
}
