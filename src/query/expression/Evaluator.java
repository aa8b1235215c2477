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

import net.seriesmath.core.Series;
import net.seriesmath.core.SeriesRequest;

/**
 * Recursively evaluates an expression node into series. Implementations walk
 * the tree, look up raw fetches in the values map and dispatch function
 * calls. Failures are thrown, e.g. {@link SeriesDoesNotExistException} for a
 * pattern without matches or {@link UnknownFunctionException} for a call
 * without an implementation.
 * @since 1.0
 */
public interface Evaluator {

  /**
   * Evaluates the node over the given window.
   * @param node The node to evaluate
   * @param from The start of the window in seconds
   * @param until The end of the window in seconds
   * @param values The raw series fetched for the request, keyed by fetch
   * @return The resolved series, possibly empty
   */
  public List<Series> evaluate(ExpressionNode node,
                               long from,
                               long until,
                               Map<SeriesRequest, List<Series>> values);
}
