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
package org.facette.connector.rrd.engine;

import org.facette.catalog.StorageException;

import java.util.List;

/**
 * The operations the RRD connector needs from a round robin database engine.
 * Implementations wrap a concrete RRD library; every failure is reported as a
 * {@link StorageException} and passed through by the connector as is.
 */
public interface RRDEngine {

    /**
     * Reads the metadata of a database file.
     *
     * @param filePath database file
     * @return names of the datasets stored in the file
     * @throws StorageException if the file metadata cannot be read
     */
    List<String> datasets(String filePath) throws StorageException;

    /**
     * @return a new statistics request
     */
    Grapher newGrapher();

    /**
     * @return a new samples export request
     */
    Exporter newExporter();
}
