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
package org.facette.catalog.connector;

import org.facette.catalog.CatalogException;
import org.facette.catalog.query.GroupQuery;
import org.facette.catalog.query.PlotResult;

import java.util.Map;

/**
 * Bridges the catalog and the query engine to one storage technology.
 */
public interface Connector {

    /**
     * Runs one discovery pass, sending every (source, metric) pair found on the
     * given channel. Implementations close the channel once the pass is over,
     * whether it completed or aborted.
     *
     * @param channel channel drained by the owning origin
     * @throws CatalogException if the pass cannot complete
     */
    void update(DiscoveryChannel channel) throws CatalogException;

    /**
     * Calculates plot data and statistics for every output serie of a group over
     * a time interval.
     *
     * @param query group query to evaluate
     * @param startTime interval start, epoch milliseconds
     * @param endTime interval end, epoch milliseconds
     * @param step sample step in milliseconds
     * @param percentiles percentile readings to add to the statistics
     * @return results keyed by output serie name
     * @throws CatalogException on an invalid query or a storage failure
     */
    Map<String, PlotResult> getPlots(GroupQuery query, long startTime, long endTime, long step,
                                     double[] percentiles) throws CatalogException;

    /**
     * Calculates the statistics of every output serie of a group at a reference time.
     *
     * @param query group query to evaluate
     * @param refTime reference time, epoch milliseconds
     * @param percentiles percentile readings to add to the statistics
     * @return statistics keyed by output serie name, then by statistic label
     * @throws CatalogException on an invalid query or a storage failure
     */
    Map<String, Map<String, Double>> getValue(GroupQuery query, long refTime,
                                              double[] percentiles) throws CatalogException;
}
