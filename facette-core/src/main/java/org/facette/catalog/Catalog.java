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
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.facette.catalog.config.CatalogConfig;
import org.facette.catalog.connector.Connector;
import org.facette.catalog.connector.ConnectorRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory inventory of origins, their sources and metrics.
 *
 * Lookups may run while an update is in progress: the whole tree is guarded by
 * one read/write lock, discovery merges take the write lock one pair at a time.
 */
public class Catalog implements Closeable {
    private final static Logger LOG = LoggerFactory.getLogger(Catalog.class);

    private final ConnectorRegistry registry;
    private final Map<String, Origin> origins = new LinkedHashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ExecutorService discoveryExecutor;
    private volatile long updated = 0L;

    /**
     * @param registry connector factories available to {@link #addOrigin}
     */
    public Catalog(ConnectorRegistry registry) {
        this.registry = registry;
        this.discoveryExecutor = Executors.newCachedThreadPool(new ThreadFactoryBuilder()
                .setNameFormat("catalog-discovery-%d")
                .setDaemon(true)
                .build());
    }

    /**
     * Adds every origin of a loaded configuration, in configuration order.
     *
     * @param config loaded catalog configuration
     * @throws ConfigException on the first origin that cannot be added
     */
    public void configure(CatalogConfig config) throws ConfigException {
        for (Map.Entry<String, Map<String, String>> entry : config.getOrigins().entrySet()) {
            addOrigin(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Adds a new origin, creating its connector from the factory registered for
     * the {@code type} setting.
     *
     * @param name origin name, unique within the catalog
     * @param config raw origin settings
     * @return the new origin
     * @throws ConfigException if the type is missing or unknown, the name is
     *     already taken, or the connector factory rejects the settings
     */
    public Origin addOrigin(String name, Map<String, String> config) throws ConfigException {
        String type = config.get("type");
        if (type == null) {
            throw new ConfigException("missing backend type");
        }
        if (!registry.contains(type)) {
            throw new ConfigException("unknown `" + type + "' backend type");
        }
        if (getOrigin(name) != null) {
            throw new ConfigException("origin `" + name + "' already exists");
        }

        ImmutableMap.Builder<String, String> settings = ImmutableMap.builder();
        for (Map.Entry<String, String> entry : config.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                throw new ConfigException("setting `" + entry.getKey() + "' of origin `" + name + "' has no value");
            }
            settings.put(entry.getKey(), entry.getValue());
        }

        Origin origin = new Origin(name, this);
        Connector connector = registry.get(type).create(origin, settings.build());
        origin.setConnector(connector);

        lock.writeLock().lock();
        try {
            if (origins.containsKey(name)) {
                throw new ConfigException("origin `" + name + "' already exists");
            }
            origins.put(name, origin);
        } finally {
            lock.writeLock().unlock();
        }

        LOG.info("Added origin `{}' of type `{}'", name, type);
        return origin;
    }

    /**
     * @param name origin name
     * @return the origin or null if unknown
     */
    public Origin getOrigin(String name) {
        lock.readLock().lock();
        try {
            return origins.get(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> getOriginNames() {
        lock.readLock().lock();
        try {
            return ImmutableSet.copyOf(origins.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Looks a metric up by origin, source and name. Unknown intermediate levels
     * are not an error.
     *
     * @return the metric or null if any level is unknown
     */
    public Metric getMetric(String origin, String source, String name) {
        lock.readLock().lock();
        try {
            Origin o = origins.get(origin);
            if (o == null) {
                return null;
            }
            Source s = o.lookupSource(source);
            if (s == null) {
                return null;
            }
            return s.lookupMetric(name);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean metricExists(String origin, String source, String name) {
        return getMetric(origin, source, name) != null;
    }

    /**
     * Refreshes every origin, one after the other. A failing origin does not stop
     * the others from being refreshed, and what it discovered before failing stays
     * registered. The update time only advances when every origin succeeded.
     *
     * @throws CatalogException the last origin failure, if any
     */
    public void update() throws CatalogException {
        CatalogException lastError = null;

        LOG.info("catalog update started");

        for (Origin origin : snapshotOrigins()) {
            try {
                origin.update();
            } catch (CatalogException e) {
                LOG.error("origin `{}' update failed", origin.getName(), e);
                lastError = e;
            }
        }

        if (lastError != null) {
            LOG.info("catalog update failed");
            throw lastError;
        }

        updated = System.currentTimeMillis();

        LOG.info("catalog update completed");
    }

    /**
     * @return time of the last update where every origin succeeded, epoch
     *     milliseconds, or 0 if there was none
     */
    public long getUpdated() {
        return updated;
    }

    @Override
    public void close() {
        discoveryExecutor.shutdownNow();
    }

    Future<Void> submitDiscovery(Callable<Void> task) throws DiscoveryException {
        try {
            return discoveryExecutor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new DiscoveryException("catalog is closed", e);
        }
    }

    Lock readLock() {
        return lock.readLock();
    }

    Lock writeLock() {
        return lock.writeLock();
    }

    private List<Origin> snapshotOrigins() {
        lock.readLock().lock();
        try {
            return ImmutableList.copyOf(origins.values());
        } finally {
            lock.readLock().unlock();
        }
    }
}
