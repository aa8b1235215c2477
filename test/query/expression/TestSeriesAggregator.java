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

import static net.seriesmath.core.SeriesForTest.INTERVAL;
import static net.seriesmath.core.SeriesForTest.START_TIME;
import static net.seriesmath.core.SeriesForTest.callNode;
import static net.seriesmath.core.SeriesForTest.fromArray;
import static net.seriesmath.core.SeriesForTest.generator;
import static net.seriesmath.core.SeriesForTest.nameNode;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;

import java.util.List;

import org.junit.Before;
import org.junit.Test;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import net.seriesmath.core.Series;

public class TestSeriesAggregator {
  private static final double NaN = Double.NaN;

  private ExpressionNode node;
  private SeriesAggregator aggregator;

  @Before
  public void before() throws Exception {
    node = callNode("sumSeries", "sys.cpu.*", nameNode("sys.cpu.*"));
    aggregator = new SeriesAggregator(new SeriesAligner(false));
  }

  @Test (expected = IllegalArgumentException.class)
  public void ctorNullAligner() throws Exception {
    new SeriesAggregator(null);
  }

  @Test
  public void aggregateShapeAndName() throws Exception {
    final List<Series> inputs = Lists.newArrayList(
        generator("sys.cpu.a", START_TIME, INTERVAL, 5, 1, 1),
        generator("sys.cpu.b", START_TIME, INTERVAL, 5, 10, 1),
        generator("sys.cpu.c", START_TIME, INTERVAL, 5, 100, 1));
    final List<Series> results = aggregator.aggregate(node, inputs, 
        Aggregators.SUM);

    assertEquals(1, results.size());
    final Series result = results.get(0);
    assertEquals("sumSeries(sys.cpu.*)", result.name());
    assertEquals(5, result.size());
    assertEquals(START_TIME, result.startTime());
    assertEquals(INTERVAL, result.step());
    assertArrayEquals(new double[] { 111, 114, 117, 120, 123 }, 
        result.values(), 0.0001);
  }

  @Test
  public void aggregateNaNPassThrough() throws Exception {
    final Series gap = fromArray("sys.cpu.a", START_TIME, INTERVAL, 1, NaN, 3);
    final Series full = fromArray("sys.cpu.b", START_TIME, INTERVAL, 10, 20, 30);
    final List<Series> results = aggregator.aggregate(node, 
        Lists.newArrayList(gap, full), Aggregators.SUM);
    assertArrayEquals(new double[] { 11, 20, 33 }, results.get(0).values(), 
        0.0001);
  }

  @Test
  public void aggregateFunctionSeesRawColumn() throws Exception {
    final List<double[]> columns = Lists.newArrayList();
    final AggregateFunction recorder = new AggregateFunction() {
      @Override
      public double aggregate(final double[] values) {
        columns.add(values);
        return 0;
      }
    };
    final Series a = fromArray("a", START_TIME, INTERVAL, 1, NaN);
    final Series b = fromArray("b", START_TIME, INTERVAL, 2, 3);
    aggregator.aggregate(node, Lists.newArrayList(a, b), recorder);

    assertEquals(2, columns.size());
    assertArrayEquals(new double[] { 1, 2 }, columns.get(0), 0.0001);
    assertArrayEquals(new double[] { NaN, 3 }, columns.get(1), 0.0001);
  }

  @Test
  public void aggregateAlignsInputs() throws Exception {
    final Series a = generator("a", START_TIME, INTERVAL, 4, 1, 1);
    final Series b = generator("b", START_TIME + (2 * INTERVAL), INTERVAL, 2, 
        10, 1);
    final Series result = aggregator.aggregate(node, 
        Lists.newArrayList(a, b), Aggregators.SUM).get(0);
    assertArrayEquals(new double[] { 1, 2, 13, 15 }, result.values(), 0.0001);
    // inputs are untouched
    assertEquals(2, b.size());
    assertEquals(START_TIME + (2 * INTERVAL), b.startTime());
  }

  @Test
  public void aggregateMetadataFromFirst() throws Exception {
    final Series a = new Series("a", ImmutableMap.of("host", "web01"), 
        START_TIME, START_TIME + (2 * INTERVAL), INTERVAL, 
        new double[] { 1, 2 });
    final Series b = fromArray("b", START_TIME, INTERVAL, 3, 4);
    final Series result = aggregator.aggregate(node, 
        Lists.newArrayList(a, b), Aggregators.MAX).get(0);
    assertEquals("web01", result.tags().get("host"));
    assertNotSame(a.values(), result.values());
    assertArrayEquals(new double[] { 3, 4 }, result.values(), 0.0001);
  }

  @Test
  public void aggregateMixedStepsShorterInput() throws Exception {
    final Series fine = fromArray("fine", START_TIME, 10, 1, 2, 3, 4);
    final Series coarse = fromArray("coarse", START_TIME, 20, 10, 20);
    final Series result = aggregator.aggregate(node, 
        Lists.newArrayList(fine, coarse), Aggregators.SUM).get(0);
    // no extrapolation so the coarse series runs out after two samples
    assertArrayEquals(new double[] { 11, 22, 3, 4 }, result.values(), 0.0001);
  }

  @Test
  public void aggregateMixedStepsExtrapolated() throws Exception {
    final SeriesAggregator extrapolating = 
        new SeriesAggregator(new SeriesAligner(true));
    final Series fine = fromArray("fine", START_TIME, 10, 1, 2, 3, 4);
    final Series coarse = fromArray("coarse", START_TIME, 20, 10, 20);
    final Series result = extrapolating.aggregate(node, 
        Lists.newArrayList(fine, coarse), Aggregators.SUM).get(0);
    assertEquals(10, result.step());
    assertArrayEquals(new double[] { 11, 17, 23, 29 }, result.values(), 0.0001);
  }

  @Test
  public void aggregateSingleInput() throws Exception {
    final Series a = fromArray("a", START_TIME, INTERVAL, 1, 2);
    final List<Series> results = aggregator.aggregate(node, 
        Lists.newArrayList(a), Aggregators.AVG);
    assertEquals(1, results.size());
    assertArrayEquals(new double[] { 1, 2 }, results.get(0).values(), 0.0001);
  }

  @Test (expected = EmptyInputException.class)
  public void aggregateEmpty() throws Exception {
    aggregator.aggregate(node, Lists.<Series>newArrayList(), Aggregators.SUM);
  }

  @Test (expected = EmptyInputException.class)
  public void aggregateNull() throws Exception {
    aggregator.aggregate(node, null, Aggregators.SUM);
  }

  @Test (expected = IllegalArgumentException.class)
  public void aggregateNullFunction() throws Exception {
    aggregator.aggregate(node, 
        Lists.newArrayList(fromArray("a", START_TIME, INTERVAL, 1)), null);
  }

  @Test
  public void aggregateUsesRewrittenRawArgs() throws Exception {
    final ExpressionNode pruned = callNode("sumSeries", "sys.cpu.a");
    final Series result = aggregator.aggregate(pruned, 
        Lists.newArrayList(fromArray("sys.cpu.a", START_TIME, INTERVAL, 1)), 
        Aggregators.SUM).get(0);
    assertEquals("sumSeries(sys.cpu.a)", result.name());
    assertEquals(1, result.size());
  }
}
