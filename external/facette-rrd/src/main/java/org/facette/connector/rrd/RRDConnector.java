/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package org.facette.connector.rrd;

import com.google.common.annotations.VisibleForTesting;
import org.facette.catalog.CatalogException;
import org.facette.catalog.ConfigException;
import org.facette.catalog.DiscoveryException;
import org.facette.catalog.Metric;
import org.facette.catalog.Origin;
import org.facette.catalog.QueryException;
import org.facette.catalog.StorageException;
import org.facette.catalog.connector.Connector;
import org.facette.catalog.connector.ConnectorFactory;
import org.facette.catalog.connector.DiscoveryChannel;
import org.facette.catalog.query.GroupQuery;
import org.facette.catalog.query.PlotResult;
import org.facette.connector.rrd.engine.ExportResult;
import org.facette.connector.rrd.engine.Exporter;
import org.facette.connector.rrd.engine.GraphInfo;
import org.facette.connector.rrd.engine.Grapher;
import org.facette.connector.rrd.engine.RRDEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Connector for round robin database files.
 *
 * Discovery walks a directory tree and matches every file path, relative to the
 * tree root, against a pattern whose {@code source} and {@code metric} groups
 * identify the metric. Every dataset of a matching file becomes a metric named
 * {@code <metric>/<dataset>}.
 *
 * Settings: {@code path} (tree root) and {@code pattern}, both mandatory.
 */
public class RRDConnector implements Connector {
    private final static Logger LOG = LoggerFactory.getLogger(RRDConnector.class);

    public static final String TYPE = "rrd";
    public static final String PATH = "path";
    public static final String PATTERN = "pattern";

    static final long VALUE_WINDOW = TimeUnit.MINUTES.toMillis(1);

    private final Origin origin;
    private final String path;
    private final String pattern;
    private final RRDEngine engine;

    // source -> metric -> database file and dataset
    private final Map<String, Map<String, RRDMetric>> metrics = new ConcurrentHashMap<>();

    public RRDConnector(Origin origin, String path, String pattern, RRDEngine engine) {
        this.origin = origin;
        this.path = path;
        this.pattern = pattern;
        this.engine = engine;
    }

    /**
     * @param engine engine used by every connector the factory creates
     * @return a factory to register under {@link #TYPE}
     */
    public static ConnectorFactory factory(final RRDEngine engine) {
        return (origin, config) -> {
            if (!config.containsKey(PATH)) {
                throw new ConfigException("missing `" + PATH + "' mandatory connector setting");
            } else if (!config.containsKey(PATTERN)) {
                throw new ConfigException("missing `" + PATTERN + "' mandatory connector setting");
            }
            return new RRDConnector(origin, config.get(PATH), config.get(PATTERN), engine);
        };
    }

    @Override
    public Map<String, PlotResult> getPlots(GroupQuery query, long startTime, long endTime, long step,
                                            double[] percentiles) throws CatalogException {
        return getData(query, startTime, endTime, step, percentiles, false);
    }

    @Override
    public Map<String, Map<String, Double>> getValue(GroupQuery query, long refTime,
                                                     double[] percentiles) throws CatalogException {
        Map<String, PlotResult> data = getData(query, refTime - VALUE_WINDOW, refTime, VALUE_WINDOW, percentiles, true);

        Map<String, Map<String, Double>> result = new LinkedHashMap<>();
        for (Map.Entry<String, PlotResult> entry : data.entrySet()) {
            result.put(entry.getKey(), entry.getValue().getInfo());
        }
        return result;
    }

    @Override
    public void update(DiscoveryChannel channel) throws CatalogException {
        try {
            Pattern re = RRDPattern.compile(pattern);
            Path root = Paths.get(path);

            LOG.info("Discovering `{}' files under {}", origin.getName(), root);

            DiscoveryVisitor visitor = new DiscoveryVisitor(root, re, channel);
            try {
                Files.walkFileTree(root, EnumSet.of(FileVisitOption.FOLLOW_LINKS), Integer.MAX_VALUE, visitor);
            } catch (IOException e) {
                throw new DiscoveryException("unable to walk `" + path + "': " + e.getMessage(), e);
            }
            if (visitor.error != null) {
                throw visitor.error;
            }

            LOG.info("Discovered {} files for origin `{}'", visitor.matched, origin.getName());
        } finally {
            channel.close();
        }
    }

    /**
     * @return the database file and dataset of a discovered metric
     * @throws QueryException if this connector never discovered the metric
     */
    RRDMetric resolve(Metric metric) throws QueryException {
        Map<String, RRDMetric> sourceMetrics = metrics.get(metric.getSource().getName());
        RRDMetric rrdMetric = sourceMetrics != null ? sourceMetrics.get(metric.getName()) : null;
        if (rrdMetric == null) {
            throw new QueryException("unknown metric `" + metric + "'");
        }
        return rrdMetric;
    }

    @VisibleForTesting
    RRDMetric getMetric(String source, String metric) {
        Map<String, RRDMetric> sourceMetrics = metrics.get(source);
        return sourceMetrics != null ? sourceMetrics.get(metric) : null;
    }

    private Map<String, PlotResult> getData(GroupQuery query, long startTime, long endTime, long step,
                                            double[] percentiles, boolean infoOnly) throws CatalogException {
        RRDQueryPlan plan = RRDQueryPlan.build(query, this);
        Map<String, String> outputs = plan.getOutputs();
        Map<String, PlotResult> result = new LinkedHashMap<>();

        LOG.debug("Evaluating {} from {} to {}", query, startTime, endTime);

        Grapher graph = engine.newGrapher();
        plan.define(graph);
        for (Map.Entry<String, String> output : outputs.entrySet()) {
            RRDStatistics.setGraph(graph, output.getKey(), output.getValue(), percentiles);
        }

        if (!infoOnly) {
            Exporter xport = engine.newExporter();
            plan.define(xport);
            for (String serieTemp : outputs.keySet()) {
                xport.xportDef(serieTemp, serieTemp);
            }

            ExportResult data = xport.xport(startTime, endTime, step);
            List<String> legends = data.getLegends();
            for (int index = 0; index < legends.size(); index++) {
                PlotResult plots = new PlotResult();
                for (int row = 0; row < data.getRowCount(); row++) {
                    plots.addPlot(data.valueAt(index, row));
                }
                result.put(outputs.get(legends.get(index)), plots);
            }
        }

        GraphInfo info = graph.graph(startTime, endTime);
        RRDStatistics.parseInfo(info, result);

        return result;
    }

    private class DiscoveryVisitor extends SimpleFileVisitor<Path> {
        private final Path root;
        private final Pattern re;
        private final DiscoveryChannel channel;
        private DiscoveryException error;
        private int matched = 0;

        DiscoveryVisitor(Path root, Pattern re, DiscoveryChannel channel) {
            this.root = root;
            this.re = re;
            this.channel = channel;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (!attrs.isRegularFile()) {
                return FileVisitResult.CONTINUE;
            }

            String relative = root.relativize(file).toString().replace(File.separatorChar, '/');
            Matcher matcher = re.matcher(relative);
            if (!matcher.find()
                    || matcher.group(RRDPattern.SOURCE) == null
                    || matcher.group(RRDPattern.METRIC) == null) {
                LOG.warn("file `{}' does not match pattern", file);
                return FileVisitResult.CONTINUE;
            }

            String source = matcher.group(RRDPattern.SOURCE);
            String metric = matcher.group(RRDPattern.METRIC);
            String filePath = file.toString();

            List<String> datasets;
            try {
                datasets = engine.datasets(filePath);
            } catch (StorageException e) {
                error = new DiscoveryException("unable to read `" + filePath + "': " + e.getMessage(), e);
                return FileVisitResult.TERMINATE;
            }

            Map<String, RRDMetric> sourceMetrics = metrics.computeIfAbsent(source, k -> new ConcurrentHashMap<>());
            for (String dataset : datasets) {
                String metricName = metric + "/" + dataset;
                sourceMetrics.put(metricName, new RRDMetric(dataset, filePath));
                channel.send(source, metricName);
            }
            matched++;

            return FileVisitResult.CONTINUE;
        }
    }
}
