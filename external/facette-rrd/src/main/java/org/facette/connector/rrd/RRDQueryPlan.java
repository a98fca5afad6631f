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

import com.google.common.base.Joiner;
import org.facette.catalog.QueryException;
import org.facette.catalog.query.GroupQuery;
import org.facette.catalog.query.GroupType;
import org.facette.catalog.query.Serie;
import org.facette.connector.rrd.engine.SeriesDefinitions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Series definitions evaluating a group query, replayed on both the statistics
 * and the export requests.
 *
 * NONE defines {@code serieN-orig0} per input serie, scales it into
 * {@code serieN-orig1}, then applies the group scale into {@code serieN}.
 * SUM and AVG define {@code serie0-tmpI} per input serie, fold them into
 * {@code serie0-orig} and apply the group scale into {@code serie0}.
 */
class RRDQueryPlan {
    static final String CONSOLIDATION = "AVERAGE";

    private interface Step {
        void apply(SeriesDefinitions target);
    }

    private final List<Step> steps = new ArrayList<>();
    private final Map<String, String> outputs = new LinkedHashMap<>();

    private RRDQueryPlan() {
    }

    /**
     * @param query group query
     * @param connector resolves metrics to database files
     * @return the plan
     * @throws QueryException if the group has no series, an unknown operator or
     *     a metric the connector does not know
     */
    static RRDQueryPlan build(GroupQuery query, RRDConnector connector) throws QueryException {
        List<Serie> series = query.getSeries();
        GroupType type = query.getType();

        if (series.isEmpty()) {
            throw new QueryException("group has no series");
        } else if (type != GroupType.NONE && series.size() == 1) {
            // nothing to combine
            type = GroupType.NONE;
        }

        if (type == null) {
            throw new QueryException("unknown operator type");
        }

        RRDQueryPlan plan = new RRDQueryPlan();
        switch (type) {
            case NONE:
                plan.buildNone(query, connector);
                break;
            case SUM:
            case AVG:
                plan.buildAggregate(query, type, connector);
                break;
            default:
                throw new QueryException("unknown operator type");
        }
        return plan;
    }

    private void buildNone(GroupQuery query, RRDConnector connector) throws QueryException {
        int count = 0;
        for (Serie serie : query.getSeries()) {
            if (serie.getMetric() == null) {
                continue;
            }

            String serieTemp = "serie" + count;
            count++;

            def(serieTemp + "-orig0", connector.resolve(serie.getMetric()));
            scale(serieTemp + "-orig1", serieTemp + "-orig0", serie.getScale());
            scale(serieTemp, serieTemp + "-orig1", query.getScale());

            outputs.put(serieTemp, serie.getName());
        }
    }

    private void buildAggregate(GroupQuery query, GroupType type, RRDConnector connector) throws QueryException {
        String serieName = "serie0";
        List<String> stack = new ArrayList<>();
        int count = 0;

        List<Serie> series = query.getSeries();
        for (int index = 0; index < series.size(); index++) {
            Serie serie = series.get(index);
            if (serie.getMetric() == null) {
                continue;
            }

            String serieTemp = serieName + "-tmp" + index;
            def(serieTemp, connector.resolve(serie.getMetric()));

            stack.add(serieTemp);
            if (count > 0) {
                stack.add("+");
            }
            count++;
        }

        if (count == 0) {
            throw new QueryException("group has no resolvable series");
        }

        if (type == GroupType.AVG) {
            // average over the series actually folded
            stack.add(Integer.toString(count));
            stack.add("/");
        }

        final String expression = Joiner.on(',').join(stack);
        steps.add(target -> target.cdef(serieName + "-orig", expression));
        scale(serieName, serieName + "-orig", query.getScale());

        outputs.put(serieName, query.getName());
    }

    private void def(final String vname, final RRDMetric metric) {
        steps.add(target -> target.def(vname, metric.getFilePath(), metric.getDataset(), CONSOLIDATION));
    }

    // a zero scale leaves the serie untouched
    private void scale(final String vname, final String input, double scale) {
        final String expression = scale != 0
                ? String.format(Locale.ROOT, "%s,%f,*", input, scale)
                : input;
        steps.add(target -> target.cdef(vname, expression));
    }

    /**
     * Replays every definition on a request.
     */
    void define(SeriesDefinitions target) {
        for (Step step : steps) {
            step.apply(target);
        }
    }

    /**
     * @return output names keyed by engine side serie name, in output order
     */
    Map<String, String> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }
}
