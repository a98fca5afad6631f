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
package org.facette.catalog.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Samples and statistics of one output serie. Undefined samples are NaN.
 */
public class PlotResult {
    private final List<Double> plots = new ArrayList<>();
    private final Map<String, Double> info = new LinkedHashMap<>();

    public void addPlot(double value) {
        plots.add(value);
    }

    public void setInfo(String label, double value) {
        info.put(label, value);
    }

    public List<Double> getPlots() {
        return Collections.unmodifiableList(plots);
    }

    /**
     * @return statistic values keyed by label (min, avg, max, last, 95th...)
     */
    public Map<String, Double> getInfo() {
        return Collections.unmodifiableMap(info);
    }

    public String toString() {
        return "plots: " + plots + " info: " + info;
    }
}
