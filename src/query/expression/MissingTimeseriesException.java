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
 * Thrown when a function argument cannot possibly resolve to series, e.g. a
 * numeric or string literal passed where a series list was expected.
 * @since 1.0
 */
public final class MissingTimeseriesException extends EvaluationException {

  /**
   * Default ctor
   * @param msg Message describing the problem.
   */
  public MissingTimeseriesException(final String msg) {
    super(msg);
  }

  /**
   * Ctor with a cause
   * @param msg Message describing the problem.
   * @param cause The resolution failure.
   */
  public MissingTimeseriesException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

  private static final long serialVersionUID = -3065829741580920816L;
}
