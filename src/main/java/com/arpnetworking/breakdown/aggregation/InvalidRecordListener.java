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
 * Receives data points rejected by an {@link Aggregator}.
 *
 * @author Brandon Arp (brandon dot arp at inscopemetrics dot com)
 */
@FunctionalInterface
public interface InvalidRecordListener {

    /**
     * Invoked once for each rejected data point, synchronously from
     * {@link Aggregator#accept(DataPoint)}.
     *
     * @param dataPoint The original data point.
     * @param error The reason the data point was rejected.
     * @param recordIndex The 1-based position of the data point among all data points seen.
     */
    void onInvalidRecord(DataPoint dataPoint, InvalidFieldValueException error, long recordIndex);
}
