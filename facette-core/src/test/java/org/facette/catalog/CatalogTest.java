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

import org.facette.catalog.connector.Connector;
import org.facette.catalog.connector.ConnectorFactory;
import org.facette.catalog.connector.ConnectorRegistry;
import org.facette.catalog.connector.DiscoveryChannel;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.stubbing.Answer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

public class CatalogTest {

    private Connector good;
    private Connector bad;
    private Catalog catalog;

    private static Answer<Void> discover(final String... pairs) {
        return invocation -> {
            DiscoveryChannel channel = invocation.getArgument(0);
            for (int i = 0; i < pairs.length; i += 2) {
                channel.send(pairs[i], pairs[i + 1]);
            }
            channel.close();
            return null;
        };
    }

    private static Map<String, String> config(String type) {
        Map<String, String> config = new HashMap<>();
        config.put("type", type);
        return config;
    }

    @Before
    public void setUp() {
        good = mock(Connector.class);
        bad = mock(Connector.class);

        ConnectorRegistry registry = ConnectorRegistry.builder()
                .register("good", (origin, config) -> good)
                .register("bad", (origin, config) -> bad)
                .register("strict", (origin, config) -> {
                    throw new ConfigException("missing `path' mandatory connector setting");
                })
                .build();
        catalog = new Catalog(registry);
    }

    @After
    public void tearDown() {
        catalog.close();
    }

    @Test
    public void testAddOriginMissingType() {
        try {
            catalog.addOrigin("o1", new HashMap<String, String>());
            fail("Expected ConfigException");
        } catch (ConfigException e) {
            assertEquals("missing backend type", e.getMessage());
        }
        assertTrue(catalog.getOriginNames().isEmpty());
    }

    @Test
    public void testAddOriginUnknownType() {
        try {
            catalog.addOrigin("o1", config("graphite"));
            fail("Expected ConfigException");
        } catch (ConfigException e) {
            assertEquals("unknown `graphite' backend type", e.getMessage());
        }
        assertTrue(catalog.getOriginNames().isEmpty());
        assertNull(catalog.getOrigin("o1"));
    }

    @Test
    public void testAddOriginFactoryError() {
        try {
            catalog.addOrigin("o1", config("strict"));
            fail("Expected ConfigException");
        } catch (ConfigException e) {
            assertEquals("missing `path' mandatory connector setting", e.getMessage());
        }
        assertNull(catalog.getOrigin("o1"));
    }

    @Test
    public void testAddOriginPassesSettings() throws Exception {
        ConnectorFactory factory = mock(ConnectorFactory.class);
        doAnswer(invocation -> good).when(factory).create(any(Origin.class), any());
        Catalog other = new Catalog(ConnectorRegistry.builder().register("rrd", factory).build());
        try {
            Map<String, String> config = config("rrd");
            config.put("path", "/var/lib/rrd");
            Origin origin = other.addOrigin("o1", config);

            verify(factory).create(origin, config);
            assertSame(good, origin.getConnector());
            assertSame(other, origin.getCatalog());
        } finally {
            other.close();
        }
    }

    @Test
    public void testAddOriginRejectsMissingValue() {
        Map<String, String> config = config("good");
        config.put("path", null);
        try {
            catalog.addOrigin("o1", config);
            fail("Expected ConfigException");
        } catch (ConfigException e) {
            assertEquals("setting `path' of origin `o1' has no value", e.getMessage());
        }
        assertNull(catalog.getOrigin("o1"));
    }

    @Test
    public void testAddOriginRejectsDuplicate() throws Exception {
        Origin first = catalog.addOrigin("o1", config("good"));
        try {
            catalog.addOrigin("o1", config("bad"));
            fail("Expected ConfigException");
        } catch (ConfigException e) {
            assertEquals("origin `o1' already exists", e.getMessage());
        }
        assertSame(first, catalog.getOrigin("o1"));
        assertSame(good, catalog.getOrigin("o1").getConnector());
    }

    @Test
    public void testMetricLookupMissingLevels() throws Exception {
        doAnswer(discover("host1", "cpu/value")).when(good).update(any(DiscoveryChannel.class));
        catalog.addOrigin("o1", config("good"));
        catalog.update();

        assertTrue(catalog.metricExists("o1", "host1", "cpu/value"));
        assertNotNull(catalog.getMetric("o1", "host1", "cpu/value"));

        String[][] missing = {
                {"unknown", "host1", "cpu/value"},
                {"o1", "unknown", "cpu/value"},
                {"o1", "host1", "unknown"},
        };
        for (String[] m : missing) {
            assertFalse(catalog.metricExists(m[0], m[1], m[2]));
            assertNull(catalog.getMetric(m[0], m[1], m[2]));
        }
    }

    @Test
    public void testUpdateBuildsTree() throws Exception {
        doAnswer(discover("host1", "cpu/value", "host1", "load/shortterm", "host2", "cpu/value", "host1", "cpu/value"))
                .when(good).update(any(DiscoveryChannel.class));
        Origin origin = catalog.addOrigin("o1", config("good"));

        assertEquals(0L, catalog.getUpdated());
        catalog.update();

        assertTrue(catalog.getUpdated() > 0L);
        assertEquals(2, origin.getSources().size());
        assertEquals(2, origin.getSource("host1").getMetrics().size());
        assertEquals(1, origin.getSource("host2").getMetrics().size());

        Metric metric = catalog.getMetric("o1", "host1", "load/shortterm");
        assertEquals("load/shortterm", metric.getName());
        assertSame(origin.getSource("host1"), metric.getSource());
        assertSame(origin, metric.getSource().getOrigin());
    }

    @Test
    public void testUpdateKeepsGoodOriginOnPartialFailure() throws Exception {
        doAnswer(discover("host1", "cpu/value")).when(good).update(any(DiscoveryChannel.class));
        catalog.addOrigin("o1", config("good"));
        catalog.update();
        long updated = catalog.getUpdated();

        doAnswer(invocation -> {
            DiscoveryChannel channel = invocation.getArgument(0);
            channel.send("host2", "mem/used");
            throw new DiscoveryException("unable to walk /var/lib/rrd");
        }).when(bad).update(any(DiscoveryChannel.class));
        catalog.addOrigin("o2", config("bad"));

        try {
            catalog.update();
            fail("Expected DiscoveryException");
        } catch (DiscoveryException e) {
            assertEquals("unable to walk /var/lib/rrd", e.getMessage());
        }

        assertEquals(updated, catalog.getUpdated());
        assertTrue(catalog.metricExists("o1", "host1", "cpu/value"));
        // best effort: what was found before the failure stays
        assertTrue(catalog.metricExists("o2", "host2", "mem/used"));
    }

    @Test
    public void testUpdateAttemptsEveryOrigin() throws Exception {
        doAnswer(invocation -> {
            throw new DiscoveryException("first failure");
        }).when(bad).update(any(DiscoveryChannel.class));
        doAnswer(discover("host1", "cpu/value")).when(good).update(any(DiscoveryChannel.class));

        catalog.addOrigin("o1", config("bad"));
        catalog.addOrigin("o2", config("good"));

        try {
            catalog.update();
            fail("Expected DiscoveryException");
        } catch (DiscoveryException e) {
            assertEquals("first failure", e.getMessage());
        }
        verify(good).update(any(DiscoveryChannel.class));
        assertTrue(catalog.metricExists("o2", "host1", "cpu/value"));
        assertEquals(0L, catalog.getUpdated());
    }

    @Test
    public void testUpdateReportsLastError() throws Exception {
        Connector worse = mock(Connector.class);
        doAnswer(invocation -> {
            throw new DiscoveryException("first failure");
        }).when(bad).update(any(DiscoveryChannel.class));
        doAnswer(invocation -> {
            throw new ConfigException("missing pattern keyword `source'");
        }).when(worse).update(any(DiscoveryChannel.class));

        Catalog other = new Catalog(ConnectorRegistry.builder()
                .register("bad", (origin, config) -> bad)
                .register("worse", (origin, config) -> worse)
                .build());
        try {
            other.addOrigin("o1", config("bad"));
            other.addOrigin("o2", config("worse"));
            other.update();
            fail("Expected ConfigException");
        } catch (ConfigException e) {
            assertEquals("missing pattern keyword `source'", e.getMessage());
        } finally {
            other.close();
        }
    }

    @Test
    public void testUpdateWrapsUnexpectedConnectorFailure() throws Exception {
        doAnswer(invocation -> {
            throw new IllegalStateException("boom");
        }).when(bad).update(any(DiscoveryChannel.class));
        catalog.addOrigin("o1", config("bad"));

        try {
            catalog.update();
            fail("Expected DiscoveryException");
        } catch (DiscoveryException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void testUpdateWithoutOriginsSucceeds() throws Exception {
        catalog.update();
        assertTrue(catalog.getUpdated() > 0L);
        verify(good, never()).update(any(DiscoveryChannel.class));
    }

    @Test
    public void testUpdateAfterClose() throws Exception {
        catalog.addOrigin("o1", config("good"));
        catalog.addOrigin("o2", config("bad"));
        catalog.close();

        try {
            catalog.update();
            fail("Expected DiscoveryException");
        } catch (DiscoveryException e) {
            assertEquals("catalog is closed", e.getMessage());
        }
        verify(good, never()).update(any(DiscoveryChannel.class));
        verify(bad, never()).update(any(DiscoveryChannel.class));
        assertEquals(0L, catalog.getUpdated());
    }

    @Test(timeout = 10000)
    public void testLookupsWhileDiscoveryIsRunning() throws Exception {
        final CountDownLatch firstSent = new CountDownLatch(1);
        final CountDownLatch resume = new CountDownLatch(1);
        doAnswer(invocation -> {
            DiscoveryChannel channel = invocation.getArgument(0);
            channel.send("host1", "cpu/value");
            firstSent.countDown();
            resume.await();
            channel.send("host2", "mem/used");
            channel.close();
            return null;
        }).when(good).update(any(DiscoveryChannel.class));
        Origin origin = catalog.addOrigin("o1", config("good"));

        ExecutorService updater = Executors.newSingleThreadExecutor();
        try {
            Future<Void> update = updater.submit(() -> {
                catalog.update();
                return null;
            });
            firstSent.await();
            while (!catalog.metricExists("o1", "host1", "cpu/value")) {
                Thread.sleep(10);
            }

            // the connector is still blocked mid-walk
            assertFalse(update.isDone());
            assertEquals(Collections.singleton("o1"), catalog.getOriginNames());
            assertEquals(1, origin.getSources().size());
            assertNotNull(origin.getSource("host1").getMetric("cpu/value"));
            assertEquals(1, origin.getSource("host1").getMetrics().size());
            assertFalse(catalog.metricExists("o1", "host2", "mem/used"));
            assertEquals(0L, catalog.getUpdated());

            resume.countDown();
            update.get();
        } finally {
            resume.countDown();
            updater.shutdownNow();
        }

        assertTrue(catalog.metricExists("o1", "host2", "mem/used"));
        assertTrue(catalog.getUpdated() > 0L);
    }
}
