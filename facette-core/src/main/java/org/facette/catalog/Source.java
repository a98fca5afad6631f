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
package org.facette.catalog;

import com.google.common.collect.ImmutableList;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.Lock;

/**
 * A monitored host or entity grouping metrics, scoped to one {@link Origin}.
 * Sources are created lazily by discovery.
 */
public class Source {
    private final String name;
    private final Origin origin;
    private final Map<String, Metric> metrics = new HashMap<>();

    Source(String name, Origin origin) {
        this.name = name;
        this.origin = origin;
    }

    public String getName() {
        return name;
    }

    public Origin getOrigin() {
        return origin;
    }

    /**
     * @param name metric name
     * @return the metric or null if this source has no metric with that name
     */
    public Metric getMetric(String name) {
        Lock lock = origin.getCatalog().readLock();
        lock.lock();
        try {
            return metrics.get(name);
        } finally {
            lock.unlock();
        }
    }

    public List<Metric> getMetrics() {
        Lock lock = origin.getCatalog().readLock();
        lock.lock();
        try {
            return ImmutableList.copyOf(metrics.values());
        } finally {
            lock.unlock();
        }
    }

    // caller holds the catalog write lock
    boolean addMetric(String metricName) {
        if (metrics.containsKey(metricName)) {
            return false;
        }
        metrics.put(metricName, new Metric(metricName, this));
        return true;
    }

    // caller holds the catalog read lock
    Metric lookupMetric(String metricName) {
        return metrics.get(metricName);
    }

    public String toString() {
        return origin.getName() + "/" + name;
    }
}
