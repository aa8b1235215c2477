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
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.collect.Lists;

import net.seriesmath.core.Series;
import net.seriesmath.core.SeriesRequest;

/**
 * Turns the argument nodes of a function call into series through the
 * injected {@link Evaluator}. Arguments matching nothing are tolerated as
 * long as at least one argument produced series.
 * @since 1.0
 */
public class SeriesResolver {
  private static final Logger LOG = LoggerFactory.getLogger(SeriesResolver.class);

  /** Used to rebuild the raw arguments from series names */
  private static final Joiner COMMA_JOINER = Joiner.on(',');

  /** The evaluator used for every argument */
  private final Evaluator evaluator;

  /**
   * Default ctor
   * @param evaluator The evaluator to resolve arguments with
   * @throws IllegalArgumentException if the evaluator was null
   */
  public SeriesResolver(final Evaluator evaluator) {
    if (evaluator == null) {
      throw new IllegalArgumentException("Evaluator cannot be null");
    }
    this.evaluator = evaluator;
  }

  /**
   * Resolves a single argument.
   * @param arg The argument node
   * @param from The start of the window in seconds
   * @param until The end of the window in seconds
   * @param values The raw series of the request
   * @return The series returned by the evaluator, never null
   * @throws MissingTimeseriesException if the node is neither a name nor a
   * function call
   */
  public List<Series> resolveArg(final ExpressionNode arg,
                                 final long from,
                                 final long until,
                                 final Map<SeriesRequest, List<Series>> values) {
    if (arg == null) {
      throw new IllegalArgumentException("Argument cannot be null");
    }
    if (!arg.isName() && !arg.isFunction()) {
      throw new MissingTimeseriesException("Argument " + arg.target() 
          + " is not a series list");
    }
    final List<Series> series = evaluator.evaluate(arg, from, until, values);
    if (series == null) {
      return Collections.emptyList();
    }
    return series;
  }

  /**
   * Resolves the arguments in order and concatenates their series. An
   * argument throwing {@link SeriesDoesNotExistException} contributes nothing,
   * any other exception aborts the resolution.
   * @param args The argument nodes
   * @param from The start of the window in seconds
   * @param until The end of the window in seconds
   * @param values The raw series of the request
   * @return The concatenated series, never empty
   * @throws SeriesDoesNotExistException if no argument produced a series
   */
  public List<Series> resolveArgs(final List<ExpressionNode> args,
                                  final long from,
                                  final long until,
                                  final Map<SeriesRequest, List<Series>> values) {
    if (args == null) {
      throw new IllegalArgumentException("Arguments cannot be null");
    }
    final List<Series> resolved = Lists.newArrayList();
    for (final ExpressionNode arg : args) {
      try {
        resolved.addAll(resolveArg(arg, from, until, values));
      } catch (SeriesDoesNotExistException e) {
        if (LOG.isDebugEnabled()) {
          LOG.debug("Skipping argument " + arg.target() + ": " + e.getMessage());
        }
      }
    }
    if (resolved.isEmpty()) {
      throw new SeriesDoesNotExistException("No series found for " 
          + args.size() + " argument(s)");
    }
    return resolved;
  }

  /**
   * Resolves every argument of the node like {@link #resolveArgs}. When fewer
   * series than arguments came back, the node's raw arguments are replaced by
   * the names of the resolved series so the display name of the call only
   * lists what was combined.
   * @param node The function call node
   * @param from The start of the window in seconds
   * @param until The end of the window in seconds
   * @param values The raw series of the request
   * @return The concatenated series, never empty
   * @throws SeriesDoesNotExistException if no argument produced a series
   */
  public List<Series> resolveArgsAndPrune(final ExpressionNode node,
                                          final long from,
                                          final long until,
                                          final Map<SeriesRequest, List<Series>> values) {
    if (node == null) {
      throw new IllegalArgumentException("Node cannot be null");
    }
    final List<ExpressionNode> args = node.args();
    final List<Series> resolved = resolveArgs(args, from, until, values);
    if (resolved.size() < args.size()) {
      final String raw_args = joinNames(resolved);
      LOG.debug("Rewriting arguments of {} from [{}] to [{}]", 
          node.target(), node.rawArgs(), raw_args);
      node.setRawArgs(raw_args);
    }
    return resolved;
  }

  /**
   * @param series The series to list
   * @return the names of the series joined by commas
   */
  public static String joinNames(final List<Series> series) {
    final List<String> names = Lists.newArrayListWithCapacity(series.size());
    for (final Series s : series) {
      names.add(s.name());
    }
    return COMMA_JOINER.join(names);
  }
}
