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
 * Pulls the bare metric name out of the raw text of a function argument,
 * e.g. "sys.cpu.{user,sys}.load" out of "sumSeries(sys.cpu.{user,sys}.load)"
 * or "sys.cpu" out of "sys.cpu;dc=east".
 * <p>
 * The scanner stops at a tag separator (';'), at an unbalanced closing brace,
 * at a comma outside of braces or at a closing parenthesis. Characters that
 * are not part of a name move the start of the name past them, which drops
 * function names and separators leading the metric.
 * @since 1.0
 */
public class MetricNameExtractor {

  /** Scanner states */
  enum State {
    /** Reading the name outside of braces */
    IN_NAME,
    /** Inside one or more levels of glob braces, commas are part of the name */
    IN_BRACES,
    /** Found the end of the name */
    DONE
  }

  /** The character classes */
  private final NameCharClassifier classifier;

  /**
   * Default ctor
   * @param classifier The classifier for name characters
   * @throws IllegalArgumentException if the classifier was null
   */
  public MetricNameExtractor(final NameCharClassifier classifier) {
    if (classifier == null) {
      throw new IllegalArgumentException("Classifier cannot be null");
    }
    this.classifier = classifier;
  }

  /**
   * Scans the text for the metric name.
   * @param text The raw argument text
   * @return The metric name, may be empty
   * @throws IllegalArgumentException if the text was null
   */
  public String extract(final String text) {
    if (text == null) {
      throw new IllegalArgumentException("Text cannot be null");
    }
    State state = State.IN_NAME;
    int start = 0;
    int braces = 0;
    int i = 0;

    while (i < text.length()) {
      final int cp = text.codePointAt(i);
      final int width = Character.charCount(cp);
      if (classifier.isNameChar(cp)) {
        i += width;
        continue;
      }

      switch (cp) {
        case ';':
          state = State.DONE;
          break;
        case '{':
          braces++;
          state = State.IN_BRACES;
          break;
        case '}':
          if (braces == 0) {
            state = State.DONE;
          } else if (--braces == 0) {
            state = State.IN_NAME;
          }
          break;
        case ',':
          if (state == State.IN_NAME) {
            state = State.DONE;
          }
          break;
        case ')':
          state = State.DONE;
          break;
        default:
          if (!classifier.isExtendedNameChar(cp)) {
            // leading noise, the name starts after it
            start = i + width;
          }
      }

      if (state == State.DONE) {
        break;
      }
      i += width;
    }
    return text.substring(start, i);
  }

  /** @return the classifier used for name characters */
  public NameCharClassifier classifier() {
    return classifier;
  }
}
