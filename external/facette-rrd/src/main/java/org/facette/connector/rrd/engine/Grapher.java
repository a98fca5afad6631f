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
 * Computes statistics over named series and renders them as text.
 */
public interface Grapher extends SeriesDefinitions {

    /**
     * Defines a named value reduced from a serie, e.g. {@code serie0,MAXIMUM} or
     * {@code serie0,95.000000,PERCENT}.
     */
    void vdef(String vname, String rpn);

    /**
     * Requests a value to be printed. The format holds one {@code %lf}
     * placeholder replaced by the value.
     */
    void print(String vname, String format);

    /**
     * @param startTime epoch milliseconds
     * @param endTime epoch milliseconds
     * @return the printed lines, in request order
     * @throws StorageException on any engine failure
     */
    GraphInfo graph(long startTime, long endTime) throws StorageException;
}
