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

/**
 * A node of a parsed function expression as seen by the helpers in this
 * package. Parsers own the implementation; the helpers only read the
 * arguments and, when series went missing, rewrite the raw argument text so
 * the generated display name matches what was actually combined.
 * @since 1.0
 */
public interface ExpressionNode {

  /** @return the child argument nodes in order, never null */
  public List<ExpressionNode> args();

  /** @return the function name for calls or the metric for name nodes */
  public String target();

  /** @return the raw text between the parentheses of a function call */
  public String rawArgs();

  /**
   * Replaces the raw argument text.
   * @param raw_args The new text, e.g. "a.b,c.d"
   */
  public void setRawArgs(String raw_args);

  /** @return true if the node is a metric name or pattern reference */
  public boolean isName();

  /** @return true if the node is a function call */
  public boolean isFunction();
}
