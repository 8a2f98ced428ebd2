/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.strata.client.exec;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/** Runtime statistics of one plan operator, shown by explain analyze. */
public final class OperatorStats {

    private long actRows;
    private long loops;
    private long timeNanos;
    private final Map<String, String> details = new LinkedHashMap<>();

    public synchronized void addRows(long rows) {
        actRows += rows;
    }

    public synchronized void addLoops(long count) {
        loops += count;
    }

    public synchronized void addTime(long nanos) {
        timeNanos += nanos;
    }

    /** Adds a named detail, for example {@code cop_task} of a reader. */
    public synchronized void putDetail(String name, String value) {
        details.put(name, value);
    }

    public synchronized long getActRows() {
        return actRows;
    }

    public synchronized long getLoops() {
        return loops;
    }

    public synchronized long getTimeNanos() {
        return timeNanos;
    }

    /** Formats the statistics, for example {@code time:1.2ms, loops:2, cop_task:{num:4}}. */
    public synchronized String getExecutionInfo() {
        StringBuilder sb = new StringBuilder();
        sb.append("time:").append(formatDuration(timeNanos)).append(", loops:").append(loops);
        for (Map.Entry<String, String> detail : details.entrySet()) {
            sb.append(", ").append(detail.getKey()).append(":").append(detail.getValue());
        }
        return sb.toString();
    }

    static String formatDuration(long nanos) {
        if (nanos < TimeUnit.MILLISECONDS.toNanos(1)) {
            return String.format(Locale.ROOT, "%.1fµs", nanos / 1_000.0);
        }
        if (nanos < TimeUnit.SECONDS.toNanos(1)) {
            return String.format(Locale.ROOT, "%.1fms", nanos / 1_000_000.0);
        }
        return String.format(Locale.ROOT, "%.2fs", nanos / 1_000_000_000.0);
    }
}
