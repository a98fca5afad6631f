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

/**
 * Exports samples of named series over a time range.
 */
public interface Exporter extends SeriesDefinitions {

    /**
     * Adds a serie to the export.
     *
     * @param vname serie name
     * @param label legend of the exported column
     */
    void xportDef(String vname, String label);

    /**
     * @param startTime epoch milliseconds
     * @param endTime epoch milliseconds
     * @param step sample step in milliseconds
     * @return the exported samples
     * @throws StorageException on any engine failure
     */
    ExportResult xport(long startTime, long endTime, long step) throws StorageException;
}
