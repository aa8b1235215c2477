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

/**
 * Reduces the values of several aligned series at one timestamp to a single
 * value. The column is passed verbatim, NaNs included, so the implementation
 * owns the policy for missing data.
 * @since 1.0
 */
public interface AggregateFunction {

  /**
   * @param values One value per input series, in input order
   * @return the aggregated value, NaN if nothing could be computed
   */
  public double aggregate(double[] values);
}
