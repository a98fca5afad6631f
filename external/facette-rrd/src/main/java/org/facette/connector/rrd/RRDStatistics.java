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

import org.facette.catalog.query.PlotResult;
import org.facette.connector.rrd.engine.GraphInfo;
import org.facette.connector.rrd.engine.Grapher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Statistics requested for every output serie, and parsing of the printed results.
 *
 * Each print line reads {@code <output name>,<label>,<value>}.
 */
final class RRDStatistics {
    private final static Logger LOG = LoggerFactory.getLogger(RRDStatistics.class);

    private RRDStatistics() {
    }

    /**
     * Requests min, avg, max, last and one reading per percentile for a serie.
     *
     * @param graph statistics request
     * @param serieName engine side serie name
     * @param itemName output name the printed lines are keyed by
     * @param percentiles percentile readings to request
     */
    static void setGraph(Grapher graph, String serieName, String itemName, double[] percentiles) {
        graph.vdef(serieName + "-min", serieName + ",MINIMUM");
        graph.print(serieName + "-min", itemName + ",min,%lf");

        graph.vdef(serieName + "-avg", serieName + ",AVERAGE");
        graph.print(serieName + "-avg", itemName + ",avg,%lf");

        graph.vdef(serieName + "-max", serieName + ",MAXIMUM");
        graph.print(serieName + "-max", itemName + ",max,%lf");

        graph.vdef(serieName + "-last", serieName + ",LAST");
        graph.print(serieName + "-last", itemName + ",last,%lf");

        for (int index = 0; index < percentiles.length; index++) {
            String cdef = serieName + "-cdef" + index;
            String vdef = serieName + "-vdef" + index;

            // undefined samples count as 0
            graph.cdef(cdef, serieName + ",UN,0," + serieName + ",IF");
            graph.vdef(vdef, String.format(Locale.ROOT, "%s,%f,PERCENT", cdef, percentiles[index]));
            graph.print(vdef, itemName + "," + percentileLabel(percentiles[index]) + ",%lf");
        }
    }

    /**
     * @return {@code 50th} for whole percentiles, {@code 95.50th} otherwise
     */
    static String percentileLabel(double percentile) {
        if (percentile != Math.rint(percentile)) {
            return String.format(Locale.ROOT, "%.2fth", percentile);
        }
        return String.format(Locale.ROOT, "%.0fth", percentile);
    }

    /**
     * Stores every printed value in the result of its output serie, creating the
     * result when the serie has no samples. Values that do not parse become NaN.
     */
    static void parseInfo(GraphInfo info, Map<String, PlotResult> data) {
        for (String line : info.getPrint()) {
            int valueSep = line.lastIndexOf(',');
            int labelSep = valueSep > 0 ? line.lastIndexOf(',', valueSep - 1) : -1;
            if (labelSep < 0) {
                LOG.warn("Ignoring malformed statistics line `{}'", line);
                continue;
            }

            String name = line.substring(0, labelSep);
            String label = line.substring(labelSep + 1, valueSep);

            double value;
            try {
                value = Double.parseDouble(line.substring(valueSep + 1).trim());
            } catch (NumberFormatException e) {
                value = Double.NaN;
            }

            PlotResult result = data.get(name);
            if (result == null) {
                result = new PlotResult();
                data.put(name, result);
            }
            result.setInfo(label, value);
        }
    }
}
