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

import com.google.common.collect.ImmutableMap;

/**
 * Maps backend type names to connector factories. A registry is assembled once at
 * startup through its {@link Builder} and is read only afterwards.
 */
public class ConnectorRegistry {
    private final ImmutableMap<String, ConnectorFactory> factories;

    private ConnectorRegistry(ImmutableMap<String, ConnectorFactory> factories) {
        this.factories = factories;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @param type backend type name
     * @return the factory registered for that type, or null
     */
    public ConnectorFactory get(String type) {
        return factories.get(type);
    }

    public boolean contains(String type) {
        return factories.containsKey(type);
    }

    public static class Builder {
        private final ImmutableMap.Builder<String, ConnectorFactory> factories = ImmutableMap.builder();

        private Builder() {
        }

        /**
         * Registers a backend type. Registering the same type twice fails when
         * the registry is built.
         *
         * @param type backend type name, as used by the {@code type} origin setting
         * @param factory factory creating connectors of that type
         * @return this for invocation chaining
         */
        public Builder register(String type, ConnectorFactory factory) {
            factories.put(type, factory);
            return this;
        }

        public ConnectorRegistry build() {
            return new ConnectorRegistry(factories.build());
        }
    }
}
