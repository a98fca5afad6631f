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

import org.facette.catalog.Metric;

/**
 * A named input serie of a group query. A serie without a resolved metric is
 * skipped during evaluation.
 */
public class Serie {
    private final String name;
    private final Metric metric;
    private final double scale;

    public Serie(String name, Metric metric) {
        this(name, metric, 0);
    }

    /**
     * @param name output name of the serie
     * @param metric resolved metric, may be null
     * @param scale multiplier applied to the serie, 0 for none
     */
    public Serie(String name, Metric metric, double scale) {
        this.name = name;
        this.metric = metric;
        this.scale = scale;
    }

    public String getName() {
        return name;
    }

    public Metric getMetric() {
        return metric;
    }

    public double getScale() {
        return scale;
    }

    public String toString() {
        return name + "=" + metric + (scale != 0 ? " x" + scale : "");
    }
}
