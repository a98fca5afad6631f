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

/**
 * A named, queryable time series scoped to one {@link Source}.
 *
 * The name is the logical key connectors resolve their own storage handles from
 * (for RRD files it is the composite {@code base/dataset} name). The catalog
 * never holds connector specific resolution data.
 */
public class Metric {
    private final String name;
    private final Source source;

    Metric(String name, Source source) {
        this.name = name;
        this.source = source;
    }

    public String getName() {
        return name;
    }

    public Source getSource() {
        return source;
    }

    public String toString() {
        return source.getOrigin().getName() + "/" + source.getName() + "/" + name;
    }
}
