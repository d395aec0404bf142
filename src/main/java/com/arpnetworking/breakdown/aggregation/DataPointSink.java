/*
 * Copyright 2017 Inscope Metrics
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.arpnetworking.breakdown.aggregation;

import com.arpnetworking.breakdown.model.DataPoint;

/**
 * Push interface for feeding data points one at a time. Callers must not
 * have more than one call in flight at once, and must call {@link #flush()}
 * exactly once after the last data point.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
public interface DataPointSink {

    /**
     * Consume a data point.
     *
     * @param dataPoint The data point.
     * @throws IllegalStateException if the sink has been flushed.
     */
    void accept(DataPoint dataPoint);

    /**
     * Signal that no further data points will be written.
     *
     * @throws IllegalStateException if the sink has already been flushed.
     */
    void flush();
}
