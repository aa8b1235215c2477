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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonAutoDetect;
import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

/**
 * A named sequence of samples on a uniform time grid. Timestamps are Unix
 * epoch seconds and a missing sample is stored as {@link Double#NaN}.
 * <p>
 * The metadata of a series (name, tags, bounds and step) never changes after
 * construction. The value buffer however is the array passed to the
 * constructor and {@link #values()} hands it out as is. That lets a transform
 * fill the preallocated buffer of an output template, but it also means two
 * series derived from each other may share a buffer. Use {@link #deepCopy()}
 * when a private buffer is needed.
 * <p>
 * Serializes to the Graphite render JSON shape:
 * <pre>{"target":"a.b","tags":{..},"datapoints":[[1.0,60],[null,120]]}</pre>
 * @since 1.0
 */
@JsonAutoDetect(fieldVisibility = Visibility.NONE,
    getterVisibility = Visibility.NONE,
    isGetterVisibility = Visibility.NONE)
@JsonInclude(Include.NON_EMPTY)
@JsonPropertyOrder({ "target", "tags", "datapoints" })
public class Series {

  /** The display name, e.g. "sumSeries(a.b.*)" */
  private final String name;

  /** Optional tags, never null */
  private final Map<String, String> tags;

  /** The timestamp of the first sample in seconds */
  private final long start_time;

  /** The exclusive end of the series in seconds */
  private final long stop_time;

  /** The interval between samples in seconds */
  private final long step;

  /** The samples, NaN for missing values */
  private final double[] values;

  /**
   * Ctor without tags.
   * @param name The display name of the series
   * @param start_time The timestamp of the first sample in seconds
   * @param stop_time The end of the series in seconds
   * @param step The sample interval in seconds
   * @param values The samples. The array is NOT copied.
   * @throws IllegalArgumentException if the name or values were null
   */
  public Series(final String name,
                final long start_time,
                final long stop_time,
                final long step,
                final double[] values) {
    this(name, null, start_time, stop_time, step, values);
  }

  /**
   * Default ctor.
   * @param name The display name of the series
   * @param tags An optional map of tags, may be null
   * @param start_time The timestamp of the first sample in seconds
   * @param stop_time The end of the series in seconds
   * @param step The sample interval in seconds
   * @param values The samples. The array is NOT copied.
   * @throws IllegalArgumentException if the name or values were null
   */
  public Series(final String name,
                final Map<String, String> tags,
                final long start_time,
                final long stop_time,
                final long step,
                final double[] values) {
    if (name == null) {
      throw new IllegalArgumentException("Series name cannot be null");
    }
    if (values == null) {
      throw new IllegalArgumentException("Values cannot be null");
    }
    this.name = name;
    this.tags = tags == null || tags.isEmpty() ?
        Collections.<String, String>emptyMap() : ImmutableMap.copyOf(tags);
    this.start_time = start_time;
    this.stop_time = stop_time;
    this.step = step;
    this.values = values;
  }

  /** @return the display name of the series */
  @JsonProperty("target")
  public String name() {
    return name;
  }

  /** @return an immutable map of tags, may be empty */
  @JsonProperty("tags")
  public Map<String, String> tags() {
    return tags;
  }

  /** @return the timestamp of the first sample in seconds */
  public long startTime() {
    return start_time;
  }

  /** @return the end of the series in seconds */
  public long stopTime() {
    return stop_time;
  }

  /** @return the sample interval in seconds */
  public long step() {
    return step;
  }

  /** @return the backing sample buffer. Writes are visible to every series
   * sharing the buffer. */
  public double[] values() {
    return values;
  }

  /** @return the number of samples in the buffer */
  public int size() {
    return values.length;
  }

  /**
   * @param index The index of the sample
   * @return the sample at the index, NaN if missing
   * @throws ArrayIndexOutOfBoundsException if the index is out of range
   */
  public double value(final int index) {
    return values[index];
  }

  /**
   * @param index The index of the sample
   * @return the timestamp of the sample at the given index
   */
  public long timestamp(final int index) {
    return start_time + (index * step);
  }

  /**
   * Returns a shallow copy of this series with a new name. The value buffer
   * is shared.
   * @param new_name The name of the derived series
   * @return A new series
   */
  public Series withName(final String new_name) {
    return new Series(new_name, tags, start_time, stop_time, step, values);
  }

  /**
   * Returns a shallow copy of this series with a new name and buffer. Bounds,
   * step and tags are kept.
   * @param new_name The name of the derived series
   * @param new_values The buffer of the derived series, not copied
   * @return A new series
   */
  public Series derive(final String new_name, final double[] new_values) {
    return new Series(new_name, tags, start_time, stop_time, step, new_values);
  }

  /**
   * Returns a copy of this series with new bounds, step and buffer. The name
   * and tags are kept.
   * @param new_start The new start time in seconds
   * @param new_stop The new stop time in seconds
   * @param new_step The new step in seconds
   * @param new_values The buffer of the derived series, not copied
   * @return A new series
   */
  public Series derive(final long new_start,
                       final long new_stop,
                       final long new_step,
                       final double[] new_values) {
    return new Series(name, tags, new_start, new_stop, new_step, new_values);
  }

  /** @return a copy of this series with its own value buffer */
  public Series deepCopy() {
    return derive(start_time, stop_time, step,
        Arrays.copyOf(values, values.length));
  }

  /** @return the samples as [value, timestamp] pairs with null for NaNs.
   * Always written, an empty series renders as an empty array. */
  @JsonProperty("datapoints")
  @JsonInclude(Include.ALWAYS)
  List<Object[]> datapoints() {
    final List<Object[]> dps = Lists.newArrayListWithCapacity(values.length);
    for (int i = 0; i < values.length; i++) {
      dps.add(new Object[] {
          Double.isNaN(values[i]) ? null : values[i], timestamp(i) });
    }
    return dps;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("tags", tags)
        .add("start_time", start_time)
        .add("stop_time", stop_time)
        .add("step", step)
        .add("values", values.length)
        .toString();
  }
}
