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
package net.seriesmath.utils;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.Test;

import com.fasterxml.jackson.core.type.TypeReference;
import com.google.common.collect.ImmutableMap;

import net.seriesmath.core.Series;

public final class TestJSON {

  @Test
  public void getMapper() throws Exception {
    assertNotNull(JSON.getMapper());
    assertSame(JSON.getMapper(), JSON.getMapper());
  }

  @Test
  public void serializeSeries() throws Exception {
    final Series series = new Series("sys.cpu", 60, 240, 60, 
        new double[] { 1.5, Double.NaN, 3 });
    assertEquals("{\"target\":\"sys.cpu\",\"datapoints\":"
        + "[[1.5,60],[null,120],[3.0,180]]}", JSON.serializeToString(series));
  }

  @Test
  public void serializeSeriesWithTags() throws Exception {
    final Series series = new Series("sys.cpu", 
        ImmutableMap.of("host", "web01"), 60, 120, 60, new double[] { 2 });
    assertEquals("{\"target\":\"sys.cpu\",\"tags\":{\"host\":\"web01\"},"
        + "\"datapoints\":[[2.0,60]]}", JSON.serializeToString(series));
  }

  @Test
  public void serializeEmptySeriesKeepsDatapoints() throws Exception {
    final Series series = new Series("a.b", 60, 60, 60, new double[0]);
    assertEquals("{\"target\":\"a.b\",\"datapoints\":[]}", 
        JSON.serializeToString(series));
  }

  @Test
  public void serializeToBytes() throws Exception {
    final Series series = new Series("a", 0, 0, 60, new double[0]);
    assertEquals("{\"target\":\"a\",\"datapoints\":[]}", 
        new String(JSON.serializeToBytes(series), StandardCharsets.UTF_8));
  }

  @Test
  public void parseRenderedSeries() throws Exception {
    final String json = JSON.serializeToString(new Series("sys.cpu", 60, 180, 
        60, new double[] { Double.NaN, 4 }));
    final Map<String, Object> parsed = JSON.parseToObject(json, 
        new TypeReference<Map<String, Object>>() { });
    assertEquals("sys.cpu", parsed.get("target"));
    @SuppressWarnings("unchecked")
    final List<List<Object>> dps = (List<List<Object>>) parsed.get("datapoints");
    assertEquals(2, dps.size());
    assertNull(dps.get(0).get(0));
    assertEquals(4.0, ((Number) dps.get(1).get(0)).doubleValue(), 0.0001);
    assertEquals(120, ((Number) dps.get(1).get(1)).longValue());
  }

  @Test
  public void parseNonNumericNumbers() throws Exception {
    final double[] parsed = JSON.parseToObject("[1.0,NaN,Infinity]", 
        new TypeReference<double[]>() { });
    assertArrayEquals(new double[] { 1, Double.NaN, Double.POSITIVE_INFINITY }, 
        parsed, 0.0001);
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectNull() throws Exception {
    JSON.parseToObject(null, new TypeReference<HashMap<String, String>>() { });
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectEmpty() throws Exception {
    JSON.parseToObject("", new TypeReference<HashMap<String, String>>() { });
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectNullType() throws Exception {
    JSON.parseToObject("{}", (TypeReference<HashMap<String, String>>) null);
  }

  @Test (expected = IllegalArgumentException.class)
  public void parseToObjectBadJson() throws Exception {
    JSON.parseToObject("{\"target\":", 
        new TypeReference<HashMap<String, String>>() { });
  }

  @Test (expected = IllegalArgumentException.class)
  public void serializeToStringNull() throws Exception {
    JSON.serializeToString(null);
  }

  @Test (expected = JSONException.class)
  public void serializeToStringUnserializable() throws Exception {
    JSON.serializeToString(new Object());
  }
}
