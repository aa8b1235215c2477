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
 * Base class for the failures raised while resolving and combining the
 * series of a function expression. Callers decide how to surface them to
 * users.
 * @since 1.0
 */
public class EvaluationException extends RuntimeException {

  /**
   * Default ctor
   * @param msg Message describing the problem.
   */
  public EvaluationException(final String msg) {
    super(msg);
  }

  /**
   * Ctor with a cause
   * @param msg Message describing the problem.
   * @param cause The underlying exception.
   */
  public EvaluationException(final String msg, final Throwable cause) {
    super(msg, cause);
  }

  private static final long serialVersionUID = 4711553087290713645L;
}
