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
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.primitives.Ints;

import net.seriesmath.core.Series;
import net.seriesmath.core.SeriesRequest;
import net.seriesmath.utils.Config;

/**
 * The entry point for query function implementations: resolves arguments,
 * aligns, aggregates and transforms series and extracts metric names. An
 * instance is configured once with its {@link Evaluator} and extrapolation
 * setting and is safe to share between threads.
 * @since 1.0
 */
public class ExpressionHelper {
  private static final Logger LOG = LoggerFactory.getLogger(ExpressionHelper.class);

  private final SeriesResolver resolver;
  private final SeriesAligner aligner;
  private final SeriesAggregator aggregator;
  private final SeriesTransformer transformer;
  private final MetricNameExtractor extractor;

  /**
   * Ctor reading the extrapolation flag and the name scripts from the config.
   * @param evaluator The evaluator for arguments
   * @param config The configuration to read
   * @throws IllegalArgumentException if the evaluator or config was null or
   * a configured script name was invalid
   */
  public ExpressionHelper(final Evaluator evaluator, final Config config) {
    this(evaluator, checkConfig(config).extrapolate_points(), 
        NameCharClassifier.fromConfig(config));
  }

  /**
   * Default ctor
   * @param evaluator The evaluator for arguments
   * @param extrapolate Whether or not to resample coarse series when aligning
   * @param classifier The classifier used to extract metric names
   * @throws IllegalArgumentException if the evaluator or classifier was null
   */
  public ExpressionHelper(final Evaluator evaluator,
                          final boolean extrapolate,
                          final NameCharClassifier classifier) {
    resolver = new SeriesResolver(evaluator);
    aligner = new SeriesAligner(extrapolate);
    aggregator = new SeriesAggregator(aligner);
    transformer = new SeriesTransformer(resolver);
    extractor = new MetricNameExtractor(classifier);
    LOG.debug("Initialized expression helper with extrapolation {}", 
        extrapolate ? "enabled" : "disabled");
  }

  /** @see SeriesResolver#resolveArg */
  public List<Series> resolveArg(final ExpressionNode arg,
                                 final long from,
                                 final long until,
                                 final Map<SeriesRequest, List<Series>> values) {
    return resolver.resolveArg(arg, from, until, values);
  }

  /** @see SeriesResolver#resolveArgs */
  public List<Series> resolveArgs(final List<ExpressionNode> args,
                                  final long from,
                                  final long until,
                                  final Map<SeriesRequest, List<Series>> values) {
    return resolver.resolveArgs(args, from, until, values);
  }

  /** @see SeriesResolver#resolveArgsAndPrune */
  public List<Series> resolveArgsAndPrune(final ExpressionNode node,
                                          final long from,
                                          final long until,
                                          final Map<SeriesRequest, List<Series>> values) {
    return resolver.resolveArgsAndPrune(node, from, until, values);
  }

  /** @see SeriesAligner#align */
  public List<Series> alignSeries(final List<Series> series) {
    return aligner.align(series);
  }

  /** @see SeriesAggregator#aggregate */
  public List<Series> aggregate(final ExpressionNode node,
                                final List<Series> series,
                                final AggregateFunction function) {
    return aggregator.aggregate(node, series, function);
  }

  /** @see SeriesTransformer#forEachSeries */
  public List<Series> forEachSeries(final ExpressionNode node,
                                    final long from,
                                    final long until,
                                    final Map<SeriesRequest, List<Series>> values,
                                    final SeriesTransform transform) {
    return transformer.forEachSeries(node, from, until, values, transform);
  }

  /** @see MetricNameExtractor#extract */
  public String extractMetricName(final String text) {
    return extractor.extract(text);
  }

  /** @return whether or not alignment extrapolates */
  public boolean extrapolate() {
    return aligner.extrapolate();
  }

  /**
   * @param set The values to search, in any order
   * @param value The value to look for
   * @return true if the value is in the set
   */
  public static boolean contains(final int[] set, final int value) {
    return set != null && Ints.contains(set, value);
  }

  private static Config checkConfig(final Config config) {
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null");
    }
    return config;
  }
}
