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

import java.util.EnumSet;
import java.util.Set;

import com.google.common.base.Splitter;
import com.google.common.collect.Sets;

import net.seriesmath.utils.Config;

/**
 * Decides which characters may appear in a metric name. ASCII letters,
 * digits and the pattern punctuation of the query language are always name
 * characters. Characters outside ASCII are accepted when they belong to one
 * of the configured Unicode scripts, or to any script when configured with
 * {@code all}.
 * @since 1.0
 */
public final class NameCharClassifier {

  /** The config key listing the extra scripts */
  public static final String UNICODE_SCRIPTS_KEY = 
      "seriesmath.expression.name.unicode_scripts";

  /** The keyword accepting every Unicode letter and digit */
  public static final String ALL_SCRIPTS = "all";

  /** ASCII punctuation allowed in names and patterns */
  private static final String NAME_PUNCTUATION = "._-*?:[]^$<>&#/%@=";

  /** A classifier accepting ASCII name characters only */
  public static final NameCharClassifier ASCII = 
      new NameCharClassifier(EnumSet.noneOf(Character.UnicodeScript.class), 
          false);

  /** The extra scripts */
  private final Set<Character.UnicodeScript> scripts;

  /** Whether every letter and digit is accepted */
  private final boolean all_scripts;

  /**
   * Default ctor
   * @param scripts The Unicode scripts accepted on top of ASCII
   * @param all_scripts Whether to accept any Unicode letter or digit
   */
  public NameCharClassifier(final Set<Character.UnicodeScript> scripts,
                            final boolean all_scripts) {
    if (scripts == null) {
      throw new IllegalArgumentException("Scripts cannot be null");
    }
    this.scripts = scripts.isEmpty() ? 
        EnumSet.noneOf(Character.UnicodeScript.class) : EnumSet.copyOf(scripts);
    this.all_scripts = all_scripts;
  }

  /**
   * Builds a classifier from the comma separated script names under
   * {@link #UNICODE_SCRIPTS_KEY}, e.g. "cyrillic,greek" or "all".
   * @param config The configuration to read
   * @return A classifier, {@link #ASCII} if nothing was configured
   * @throws IllegalArgumentException if a script name was not recognized
   */
  public static NameCharClassifier fromConfig(final Config config) {
    if (!config.hasProperty(UNICODE_SCRIPTS_KEY)) {
      return ASCII;
    }
    final Set<Character.UnicodeScript> scripts = Sets.newHashSet();
    boolean all_scripts = false;
    for (final String name : Splitter.on(',').trimResults().omitEmptyStrings()
        .split(config.getString(UNICODE_SCRIPTS_KEY))) {
      if (ALL_SCRIPTS.equalsIgnoreCase(name)) {
        all_scripts = true;
      } else {
        scripts.add(Character.UnicodeScript.forName(name));
      }
    }
    return new NameCharClassifier(scripts, all_scripts);
  }

  /**
   * @param cp The code point to check
   * @return true if the code point is an ASCII letter, digit or pattern
   * punctuation
   */
  public boolean isNameChar(final int cp) {
    return (cp >= 'a' && cp <= 'z')
        || (cp >= 'A' && cp <= 'Z')
        || (cp >= '0' && cp <= '9')
        || (cp < 128 && NAME_PUNCTUATION.indexOf(cp) >= 0);
  }

  /**
   * @param cp The code point to check
   * @return true if the code point falls within the configured scripts
   */
  public boolean isExtendedNameChar(final int cp) {
    if (cp < 128) {
      return false;
    }
    if (all_scripts) {
      return Character.isLetterOrDigit(cp);
    }
    return !scripts.isEmpty() && scripts.contains(Character.UnicodeScript.of(cp));
  }
}
