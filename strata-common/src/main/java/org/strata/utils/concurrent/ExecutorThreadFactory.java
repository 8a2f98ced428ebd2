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

package org.strata.utils.concurrent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A thread factory that names its threads {@code <poolName>-thread-<n>}, makes them daemons and
 * logs uncaught exceptions.
 */
public class ExecutorThreadFactory implements ThreadFactory {

    private static final Logger LOG = LoggerFactory.getLogger(ExecutorThreadFactory.class);

    private final AtomicInteger threadNumber = new AtomicInteger(1);
    private final String namePrefix;

    public ExecutorThreadFactory(String poolName) {
        this.namePrefix = poolName + "-thread-";
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread t = new Thread(runnable, namePrefix + threadNumber.getAndIncrement());
        t.setDaemon(true);
        t.setUncaughtExceptionHandler(
                (thread, e) -> LOG.error("Thread '{}' produced an uncaught exception.", thread, e));
        return t;
    }
}
