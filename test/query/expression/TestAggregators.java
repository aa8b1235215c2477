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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.NoSuchElementException;

import org.junit.Test;

public class TestAggregators {
  private static final double NaN = Double.NaN;
  private static final double[] VALUES = new double[] { 4, NaN, 1, 7 };
  private static final double[] ALL_NAN = new double[] { NaN, NaN };

  @Test
  public void get() throws Exception {
    assertSame(Aggregators.SUM, Aggregators.get("sum"));
    assertSame(Aggregators.SUM, Aggregators.get("total"));
    assertSame(Aggregators.AVG, Aggregators.get("average"));
    assertSame(Aggregators.RANGE, Aggregators.get("rangeOf"));
    assertTrue(Aggregators.set().contains("median"));
    assertEquals("stddev", Aggregators.DEV.toString());
  }

  @Test (expected = NoSuchElementException.class)
  public void getUnknown() throws Exception {
    Aggregators.get("nosuchagg");
  }

  @Test (expected = UnsupportedOperationException.class)
  public void setIsImmutable() throws Exception {
    Aggregators.set().remove("sum");
  }

  @Test
  public void sum() throws Exception {
    assertEquals(12, Aggregators.SUM.aggregate(VALUES), 0.0001);
    assertTrue(Double.isNaN(Aggregators.SUM.aggregate(ALL_NAN)));
    assertTrue(Double.isNaN(Aggregators.SUM.aggregate(new double[0])));
  }

  @Test
  public void avg() throws Exception {
    assertEquals(4, Aggregators.AVG.aggregate(VALUES), 0.0001);
    assertTrue(Double.isNaN(Aggregators.AVG.aggregate(ALL_NAN)));
  }

  @Test
  public void minMax() throws Exception {
    assertEquals(1, Aggregators.MIN.aggregate(VALUES), 0.0001);
    assertEquals(7, Aggregators.MAX.aggregate(VALUES), 0.0001);
    assertEquals(-3, Aggregators.MIN.aggregate(new double[] { NaN, -3 }), 
        0.0001);
    assertTrue(Double.isNaN(Aggregators.MIN.aggregate(ALL_NAN)));
    assertTrue(Double.isNaN(Aggregators.MAX.aggregate(ALL_NAN)));
  }

  @Test
  public void median() throws Exception {
    assertEquals(4, Aggregators.MEDIAN.aggregate(VALUES), 0.0001);
    assertEquals(2.5, Aggregators.MEDIAN.aggregate(
        new double[] { 4, 1, 3, 2 }), 0.0001);
    assertTrue(Double.isNaN(Aggregators.MEDIAN.aggregate(ALL_NAN)));
  }

  @Test
  public void multiply() throws Exception {
    assertEquals(24, Aggregators.MULTIPLY.aggregate(
        new double[] { 2, 3, 4 }), 0.0001);
    assertTrue(Double.isNaN(Aggregators.MULTIPLY.aggregate(VALUES)));
    assertTrue(Double.isNaN(Aggregators.MULTIPLY.aggregate(new double[0])));
  }

  @Test
  public void diff() throws Exception {
    assertEquals(-4, Aggregators.DIFF.aggregate(VALUES), 0.0001);
    assertEquals(5, Aggregators.DIFF.aggregate(new double[] { NaN, 5 }), 
        0.0001);
    assertTrue(Double.isNaN(Aggregators.DIFF.aggregate(ALL_NAN)));
  }

  @Test
  public void stddev() throws Exception {
    assertEquals(2, Aggregators.DEV.aggregate(
        new double[] { 2, 4, 4, 4, NaN, 5, 5, 7, 9 }), 0.0001);
    assertEquals(0, Aggregators.DEV.aggregate(new double[] { 3 }), 0.0001);
    assertTrue(Double.isNaN(Aggregators.DEV.aggregate(ALL_NAN)));
  }

  @Test
  public void count() throws Exception {
    assertEquals(3, Aggregators.COUNT.aggregate(VALUES), 0.0001);
    assertEquals(0, Aggregators.COUNT.aggregate(ALL_NAN), 0.0001);
  }

  @Test
  public void range() throws Exception {
    assertEquals(6, Aggregators.RANGE.aggregate(VALUES), 0.0001);
    assertTrue(Double.isNaN(Aggregators.RANGE.aggregate(ALL_NAN)));
  }

  @Test
  public void firstLast() throws Exception {
    assertEquals(4, Aggregators.FIRST.aggregate(VALUES), 0.0001);
    assertEquals(7, Aggregators.LAST.aggregate(VALUES), 0.0001);
    assertEquals(1, Aggregators.FIRST.aggregate(
        new double[] { NaN, 1, 2 }), 0.0001);
    assertEquals(1, Aggregators.LAST.aggregate(
        new double[] { 1, NaN }), 0.0001);
    assertTrue(Double.isNaN(Aggregators.LAST.aggregate(ALL_NAN)));
  }
}
