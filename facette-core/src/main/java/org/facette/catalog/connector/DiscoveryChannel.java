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

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single producer, single consumer handoff between a connector discovery pass and
 * the origin merging its results.
 *
 * The producer {@link #send}s pairs and then {@link #close}s the channel. The
 * consumer calls {@link #receive} until it returns null, which only happens
 * once the channel is closed and every pair sent before the close was received.
 * The queue is unbounded so a slow consumer never blocks the producer.
 */
public class DiscoveryChannel {
    private static final DiscoveredMetric END = new DiscoveredMetric(null, null);

    private final BlockingQueue<DiscoveredMetric> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private boolean drained = false;

    /**
     * @param source source name
     * @param metric metric name
     * @throws IllegalStateException if the channel is already closed
     */
    public void send(String source, String metric) {
        if (closed.get()) {
            throw new IllegalStateException("discovery channel is closed");
        }
        queue.add(new DiscoveredMetric(source, metric));
    }

    /**
     * Signals the end of discovery. Only the first call has an effect.
     */
    public void close() {
        if (closed.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Blocks until a pair is available or the channel is closed.
     *
     * @return the next pair, or null once the channel is closed and drained
     * @throws InterruptedException if interrupted while waiting
     */
    public DiscoveredMetric receive() throws InterruptedException {
        if (drained) {
            return null;
        }
        DiscoveredMetric item = queue.take();
        if (item == END) {
            drained = true;
            return null;
        }
        return item;
    }
}
