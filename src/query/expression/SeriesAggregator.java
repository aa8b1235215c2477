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

import java.util.List;

import com.google.common.collect.Lists;

import net.seriesmath.core.Series;

/**
 * Combines a set of series into one by applying an {@link AggregateFunction}
 * to every timestamp of the aligned inputs, e.g. for sumSeries or
 * averageSeries.
 * @since 1.0
 */
public class SeriesAggregator {

  /** The aligner applied to the inputs */
  private final SeriesAligner aligner;

  /**
   * Default ctor
   * @param aligner The aligner to reconcile inputs with
   * @throws IllegalArgumentException if the aligner was null
   */
  public SeriesAggregator(final SeriesAligner aligner) {
    if (aligner == null) {
      throw new IllegalArgumentException("Aligner cannot be null");
    }
    this.aligner = aligner;
  }

  /**
   * Aligns the series and aggregates them index by index. The output takes
   * its bounds, step and tags from the first aligned series and is named
   * {@code <target>(<raw args>)} after the node. An input shorter than the
   * first contributes NaN past its end.
   * @param node The function call node, used for naming
   * @param series The series to combine, not modified
   * @param function The aggregation to apply to every column
   * @return A list with the single aggregated series
   * @throws EmptyInputException if there were no series
   */
  public List<Series> aggregate(final ExpressionNode node,
                                final List<Series> series,
                                final AggregateFunction function) {
    if (series == null || series.isEmpty()) {
      throw new EmptyInputException("Cannot aggregate an empty set of series");
    }
    if (node == null) {
      throw new IllegalArgumentException("Node cannot be null");
    }
    if (function == null) {
      throw new IllegalArgumentException("Aggregate function cannot be null");
    }

    final List<Series> aligned = aligner.align(series);
    final Series first = aligned.get(0);
    final double[] values = new double[first.size()];

    for (int i = 0; i < values.length; i++) {
      final double[] column = new double[aligned.size()];
      for (int x = 0; x < column.length; x++) {
        final Series s = aligned.get(x);
        column[x] = i < s.size() ? s.value(i) : Double.NaN;
      }
      values[i] = column.length > 0 ? function.aggregate(column) : Double.NaN;
    }

    final Series result = first.derive(
        node.target() + "(" + node.rawArgs() + ")", values);
    return Lists.newArrayList(result);
  }
}
