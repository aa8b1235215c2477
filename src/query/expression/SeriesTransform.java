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

import net.seriesmath.core.Series;

/**
 * Computes one derived series from one input series.
 * @since 1.0
 */
public interface SeriesTransform {

  /**
   * @param input The series to transform. Must not be modified.
   * @param output A template named after the call with a preallocated,
   * unfilled buffer of the input's length
   * @return the filled output, usually the template itself
   */
  public Series apply(Series input, Series output);
}
