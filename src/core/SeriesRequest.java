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
package net.seriesmath.core;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * Identifies a fetch of raw series: a metric pattern over a time window.
 * Used as the key of the resolved values map handed to evaluators.
 * @since 1.0
 */
public final class SeriesRequest {
  /** The metric name or glob pattern */
  private final String metric;

  /** The start of the window in seconds */
  private final long from;

  /** The end of the window in seconds */
  private final long until;

  /**
   * Default ctor
   * @param metric The metric name or glob pattern
   * @param from The start of the window in seconds
   * @param until The end of the window in seconds
   * @throws IllegalArgumentException if the metric was null or empty
   */
  public SeriesRequest(final String metric, final long from, final long until) {
    if (metric == null || metric.isEmpty()) {
      throw new IllegalArgumentException("Metric cannot be null or empty");
    }
    this.metric = metric;
    this.from = from;
    this.until = until;
  }

  /** @return the metric name or pattern */
  public String metric() {
    return metric;
  }

  /** @return the start of the window in seconds */
  public long from() {
    return from;
  }

  /** @return the end of the window in seconds */
  public long until() {
    return until;
  }

  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SeriesRequest)) {
      return false;
    }
    final SeriesRequest other = (SeriesRequest) o;
    return from == other.from
        && until == other.until
        && metric.equals(other.metric);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(metric, from, until);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("metric", metric)
        .add("from", from)
        .add("until", until)
        .toString();
  }
}
