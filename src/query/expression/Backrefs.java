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

import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for Graphite style back references ({@code \1}, {@code \2}, ...)
 * used by alias substitution functions.
 * <p>
 * Only {@code \N} is special in a replacement. Every other character,
 * including a lone backslash or a dollar sign, is copied as is. The whole
 * digit run names the group, so {@code \10} is group ten, and a group that
 * does not exist or did not participate in the match expands to nothing.
 * @since 1.0
 */
public final class Backrefs {

  /** Matches a back reference such as \1 */
  public static final Pattern BACKREF = Pattern.compile("\\\\(\\d+)");

  /** No instantiation for you! */
  private Backrefs() { }

  /**
   * Expands the back references of a replacement against a match.
   * @param match The match supplying the groups
   * @param replacement The Graphite replacement, e.g. "host.\1"
   * @return The expanded text
   * @throws IllegalArgumentException if the match or replacement was null
   */
  public static String expand(final MatchResult match, 
                              final String replacement) {
    if (match == null) {
      throw new IllegalArgumentException("Match cannot be null");
    }
    if (replacement == null) {
      throw new IllegalArgumentException("Replacement cannot be null");
    }
    final StringBuilder buf = new StringBuilder(replacement.length());
    final Matcher refs = BACKREF.matcher(replacement);
    int last = 0;
    while (refs.find()) {
      buf.append(replacement, last, refs.start());
      final String group = group(match, refs.group(1));
      if (group != null) {
        buf.append(group);
      }
      last = refs.end();
    }
    buf.append(replacement, last, replacement.length());
    return buf.toString();
  }

  /**
   * Replaces every match of the pattern in the name with the expanded
   * replacement.
   * @param name The name to rewrite
   * @param search The regular expression to look for
   * @param replacement The Graphite replacement with back references
   * @return The rewritten name
   * @throws IllegalArgumentException if an argument was null
   */
  public static String substitute(final String name,
                                  final Pattern search,
                                  final String replacement) {
    if (name == null) {
      throw new IllegalArgumentException("Name cannot be null");
    }
    if (search == null) {
      throw new IllegalArgumentException("Pattern cannot be null");
    }
    if (replacement == null) {
      throw new IllegalArgumentException("Replacement cannot be null");
    }
    final Matcher matcher = search.matcher(name);
    final StringBuffer buf = new StringBuffer(name.length());
    while (matcher.find()) {
      matcher.appendReplacement(buf, 
          Matcher.quoteReplacement(expand(matcher, replacement)));
    }
    matcher.appendTail(buf);
    return buf.toString();
  }

  /** @return the group named by the digits, null if there is no such group */
  private static String group(final MatchResult match, final String digits) {
    final int index;
    try {
      index = Integer.parseInt(digits);
    } catch (NumberFormatException e) {
      // more digits than an int holds, can't be a group
      return null;
    }
    if (index > match.groupCount()) {
      return null;
    }
    return match.group(index);
  }
}
