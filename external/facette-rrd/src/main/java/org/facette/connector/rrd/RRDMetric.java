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
package org.facette.connector.rrd;

/**
 * Where the samples of one discovered metric live.
 */
public class RRDMetric {
    private final String dataset;
    private final String filePath;

    public RRDMetric(String dataset, String filePath) {
        this.dataset = dataset;
        this.filePath = filePath;
    }

    public String getDataset() {
        return dataset;
    }

    public String getFilePath() {
        return filePath;
    }

    public String toString() {
        return filePath + ":" + dataset;
    }
}
