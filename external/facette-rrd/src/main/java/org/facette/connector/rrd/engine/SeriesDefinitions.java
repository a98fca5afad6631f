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

/**
 * Named series shared by statistics and export requests.
 */
public interface SeriesDefinitions {

    /**
     * Defines a named serie read from a database file.
     *
     * @param vname serie name
     * @param filePath database file
     * @param dataset dataset inside the file
     * @param cf consolidation function (AVERAGE, MIN, MAX, LAST)
     */
    void def(String vname, String filePath, String dataset, String cf);

    /**
     * Defines a named serie derived from previously defined ones.
     *
     * @param vname serie name
     * @param rpn expression in reverse polish notation, e.g. {@code a,b,+,2,/}
     */
    void cdef(String vname, String rpn);
}
