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

import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class DiscoveryChannelTest {

    @Test
    public void testReceiveUntilClosed() throws Exception {
        DiscoveryChannel channel = new DiscoveryChannel();
        channel.send("host1", "cpu/value");
        channel.send("host2", "load/shortterm");
        assertFalse(channel.isClosed());
        channel.close();
        assertTrue(channel.isClosed());

        DiscoveredMetric first = channel.receive();
        assertEquals("host1", first.getSource());
        assertEquals("cpu/value", first.getMetric());
        assertEquals("host2/load/shortterm", channel.receive().toString());
        assertNull(channel.receive());
        // stays drained
        assertNull(channel.receive());
    }

    @Test
    public void testCloseOnlyOnce() throws Exception {
        DiscoveryChannel channel = new DiscoveryChannel();
        channel.send("host1", "cpu/value");
        channel.close();
        channel.close();

        assertEquals("host1/cpu/value", channel.receive().toString());
        assertNull(channel.receive());
    }

    @Test
    public void testSendAfterClose() {
        DiscoveryChannel channel = new DiscoveryChannel();
        channel.close();
        try {
            channel.send("host1", "cpu/value");
            fail("Expected IllegalStateException");
        } catch (IllegalStateException e) {
            assertEquals("discovery channel is closed", e.getMessage());
        }
    }

    @Test
    public void testConcurrentProducer() throws Exception {
        final DiscoveryChannel channel = new DiscoveryChannel();
        final int count = 10000;
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<?> producer = executor.submit(() -> {
                for (int i = 0; i < count; i++) {
                    channel.send("host" + (i % 10), "metric" + i);
                }
                channel.close();
            });

            List<DiscoveredMetric> received = new ArrayList<>();
            DiscoveredMetric item;
            while ((item = channel.receive()) != null) {
                received.add(item);
            }
            producer.get(10, TimeUnit.SECONDS);

            assertEquals(count, received.size());
            assertEquals("metric0", received.get(0).getMetric());
            assertEquals("metric" + (count - 1), received.get(count - 1).getMetric());
        } finally {
            executor.shutdownNow();
        }
    }
}
