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

import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.EnumSet;

import org.junit.Test;

import net.seriesmath.utils.Config;

public class TestNameCharClassifier {

  @Test
  public void asciiNameChars() throws Exception {
    final NameCharClassifier classifier = NameCharClassifier.ASCII;
    for (final char c : "azAZ09._-*?:[]^$<>&#/%@=".toCharArray()) {
      assertTrue("Expected a name char: " + c, classifier.isNameChar(c));
    }
    for (final char c : ";{},() '\"\t!".toCharArray()) {
      assertFalse("Unexpected name char: " + c, classifier.isNameChar(c));
    }
    assertFalse(classifier.isNameChar('é'));
  }

  @Test
  public void asciiIsNeverExtended() throws Exception {
    final NameCharClassifier all = new NameCharClassifier(
        EnumSet.noneOf(Character.UnicodeScript.class), true);
    assertFalse(all.isExtendedNameChar('a'));
    assertFalse(all.isExtendedNameChar(' '));
    assertTrue(all.isExtendedNameChar('é'));
    assertFalse(all.isExtendedNameChar('\u00a0'));
  }

  @Test
  public void scripts() throws Exception {
    final NameCharClassifier greek = new NameCharClassifier(
        EnumSet.of(Character.UnicodeScript.GREEK), false);
    assertTrue(greek.isExtendedNameChar('λ'));
    assertFalse(greek.isExtendedNameChar('ж'));
    assertFalse(NameCharClassifier.ASCII.isExtendedNameChar('λ'));
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorNullScripts() throws Exception {
    new NameCharClassifier(null, false);
  }

  @Test
  public void fromConfigDefault() throws Exception {
    assertSame(NameCharClassifier.ASCII, 
        NameCharClassifier.fromConfig(new Config()));
  }

  @Test
  public void fromConfigScripts() throws Exception {
    final Config config = new Config();
    config.overrideConfig(NameCharClassifier.UNICODE_SCRIPTS_KEY, 
        "cyrillic, Greek");
    final NameCharClassifier classifier = NameCharClassifier.fromConfig(config);
    assertTrue(classifier.isExtendedNameChar('ж'));
    assertTrue(classifier.isExtendedNameChar('λ'));
    assertFalse(classifier.isExtendedNameChar('ホ'));
  }

  @Test
  public void fromConfigAll() throws Exception {
    final Config config = new Config();
    config.overrideConfig(NameCharClassifier.UNICODE_SCRIPTS_KEY, "ALL");
    final NameCharClassifier classifier = NameCharClassifier.fromConfig(config);
    assertTrue(classifier.isExtendedNameChar('ホ'));
    assertTrue(classifier.isExtendedNameChar('٣'));
  }

  @Test (expected = IllegalArgumentException.class)
  public void fromConfigUnknownScript() throws Exception {
    final Config config = new Config();
    config.overrideConfig(NameCharClassifier.UNICODE_SCRIPTS_KEY, "klingon");
    NameCharClassifier.fromConfig(config);
  }
}
