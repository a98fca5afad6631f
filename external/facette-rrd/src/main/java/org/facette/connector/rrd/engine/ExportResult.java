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

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Exported samples, one column per legend. Undefined samples are NaN.
 */
public class ExportResult {
    private final List<String> legends;
    private final double[][] values;
    private final int rowCount;

    /**
     * @param legends column legends
     * @param values samples indexed by column, then row
     */
    public ExportResult(List<String> legends, double[][] values) {
        if (legends.size() != values.length) {
            throw new IllegalArgumentException("got " + values.length + " columns for " + legends.size() + " legends");
        }
        this.legends = ImmutableList.copyOf(legends);
        this.values = values;
        this.rowCount = values.length == 0 ? 0 : values[0].length;
    }

    public List<String> getLegends() {
        return legends;
    }

    public int getRowCount() {
        return rowCount;
    }

    public double valueAt(int legendIndex, int row) {
        return values[legendIndex][row];
    }
}
