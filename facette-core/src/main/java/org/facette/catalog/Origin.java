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
import org.facette.catalog.connector.Connector;
import org.facette.catalog.connector.DiscoveredMetric;
import org.facette.catalog.connector.DiscoveryChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.locks.Lock;

/**
 * One configured storage backend instance. Owns its connector and the
 * source/metric tree that connector discovers.
 */
public class Origin {
    private final static Logger LOG = LoggerFactory.getLogger(Origin.class);

    private final String name;
    private final Catalog catalog;
    private final Map<String, Source> sources = new HashMap<>();
    private Connector connector;

    Origin(String name, Catalog catalog) {
        this.name = name;
        this.catalog = catalog;
    }

    public String getName() {
        return name;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public Connector getConnector() {
        return connector;
    }

    void setConnector(Connector connector) {
        this.connector = connector;
    }

    /**
     * @param name source name
     * @return the source or null if this origin has no source with that name
     */
    public Source getSource(String name) {
        Lock lock = catalog.readLock();
        lock.lock();
        try {
            return sources.get(name);
        } finally {
            lock.unlock();
        }
    }

    public List<Source> getSources() {
        Lock lock = catalog.readLock();
        lock.lock();
        try {
            return ImmutableList.copyOf(sources.values());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs one discovery pass of the connector.
     *
     * The connector runs on a catalog worker thread while this thread drains
     * the discovery channel into the source/metric tree. Pairs received before
     * a failure stay registered.
     *
     * @throws CatalogException the connector failure, if any
     */
    public synchronized void update() throws CatalogException {
        final DiscoveryChannel channel = new DiscoveryChannel();

        LOG.debug("Starting discovery of origin `{}'", name);

        Future<Void> task = catalog.submitDiscovery(() -> {
            try {
                connector.update(channel);
            } finally {
                channel.close();
            }
            return null;
        });

        int added = 0;
        try {
            DiscoveredMetric item;
            while ((item = channel.receive()) != null) {
                if (addMetric(item.getSource(), item.getMetric())) {
                    LOG.debug("origin `{}' discovered {}", name, item);
                    added++;
                }
            }
            task.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            task.cancel(true);
            throw new DiscoveryException("interrupted during discovery of origin `" + name + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CatalogException) {
                throw (CatalogException) cause;
            }
            throw new DiscoveryException("discovery of origin `" + name + "' failed", cause);
        } finally {
            LOG.info("origin `{}' discovery registered {} new metrics", name, added);
        }
    }

    boolean addMetric(String sourceName, String metricName) {
        Lock lock = catalog.writeLock();
        lock.lock();
        try {
            Source source = sources.get(sourceName);
            if (source == null) {
                source = new Source(sourceName, this);
                sources.put(sourceName, source);
            }
            return source.addMetric(metricName);
        } finally {
            lock.unlock();
        }
    }

    // caller holds the catalog read lock
    Source lookupSource(String sourceName) {
        return sources.get(sourceName);
    }

    public String toString() {
        return name;
    }
}
