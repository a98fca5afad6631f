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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A logical request combining one or more series under an aggregation operator
 * and scale factors.
 */
public class GroupQuery {
    private final String name;
    private final List<Serie> series;
    private final GroupType type;
    private final double scale;

    public GroupQuery(String name, List<Serie> series, GroupType type) {
        this(name, series, type, 0);
    }

    /**
     * @param name group name, used as output name by aggregating operators
     * @param series input series, in output order
     * @param type aggregation operator
     * @param scale multiplier applied to every output serie, 0 for none
     */
    public GroupQuery(String name, List<Serie> series, GroupType type, double scale) {
        this.name = name;
        this.series = ImmutableList.copyOf(series);
        this.type = type;
        this.scale = scale;
    }

    public String getName() {
        return name;
    }

    public List<Serie> getSeries() {
        return series;
    }

    public GroupType getType() {
        return type;
    }

    public double getScale() {
        return scale;
    }

    public String toString() {
        return "group: " + name + " type: " + type + " scale: " + scale + " series: " + series;
    }
}
