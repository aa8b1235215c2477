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
import java.util.Map;

import com.google.common.collect.Lists;

import net.seriesmath.core.Series;
import net.seriesmath.core.SeriesRequest;

/**
 * Applies a {@link SeriesTransform} to every series of the first argument of
 * a call, producing one output per input, e.g. for scale or absolute.
 * @since 1.0
 */
public class SeriesTransformer {

  /** The resolver for the first argument */
  private final SeriesResolver resolver;

  /**
   * Default ctor
   * @param resolver The resolver used for the first argument
   * @throws IllegalArgumentException if the resolver was null
   */
  public SeriesTransformer(final SeriesResolver resolver) {
    if (resolver == null) {
      throw new IllegalArgumentException("Resolver cannot be null");
    }
    this.resolver = resolver;
  }

  /**
   * Resolves the first argument of the node and transforms each series.
   * Every output template is a copy of its input named
   * {@code <target>(<input name>)} with an unfilled buffer of the same length.
   * @param node The function call node
   * @param from The start of the window in seconds
   * @param until The end of the window in seconds
   * @param values The raw series of the request
   * @param transform The per series transform
   * @return The outputs in input order
   * @throws MissingTimeseriesException if the node has no arguments or the
   * first argument failed to resolve
   */
  public List<Series> forEachSeries(final ExpressionNode node,
                                    final long from,
                                    final long until,
                                    final Map<SeriesRequest, List<Series>> values,
                                    final SeriesTransform transform) {
    if (node == null) {
      throw new IllegalArgumentException("Node cannot be null");
    }
    if (transform == null) {
      throw new IllegalArgumentException("Transform cannot be null");
    }
    final List<ExpressionNode> args = node.args();
    if (args == null || args.isEmpty()) {
      throw new MissingTimeseriesException("Function " + node.target() 
          + " requires a series argument");
    }

    final List<Series> inputs;
    try {
      inputs = resolver.resolveArg(args.get(0), from, until, values);
    } catch (RuntimeException e) {
      throw new MissingTimeseriesException("Unable to resolve the series of " 
          + node.target(), e);
    }

    final List<Series> results = Lists.newArrayListWithCapacity(inputs.size());
    for (final Series input : inputs) {
      final Series output = input.derive(
          node.target() + "(" + input.name() + ")", new double[input.size()]);
      results.add(transform.apply(input, output));
    }
    return results;
  }
}
