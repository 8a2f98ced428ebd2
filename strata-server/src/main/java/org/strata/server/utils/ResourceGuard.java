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

package org.strata.server.utils;

import org.strata.annotation.Internal;

import java.io.IOException;

/**
 * Guards a shared resource, such as a RocksDB instance, against being released while clients
 * still use it. Clients acquire a {@link Lease} before each use and close it afterwards. {@link
 * #close()} first rejects new leases and then blocks until all open leases are closed.
 */
@Internal
public class ResourceGuard implements AutoCloseable {

    private final Object lock = new Object();

    /** Number of open leases. */
    private int leaseCount;

    /** Once set, no new lease is handed out. */
    private volatile boolean closed;

    /**
     * Acquires a lease on the resource.
     *
     * @throws IOException if the guard is already closed.
     */
    public Lease acquireResource() throws IOException {
        synchronized (lock) {
            if (closed) {
                throw new IOException("Resource guard was already closed.");
            }
            ++leaseCount;
        }
        return new Lease();
    }

    private void releaseResource() {
        synchronized (lock) {
            --leaseCount;
            if (closed && leaseCount == 0) {
                lock.notifyAll();
            }
        }
    }

    /**
     * Closes the guard and waits, uninterruptibly, until every open lease is closed. An interrupt
     * received while waiting is restored on return.
     */
    @Override
    public void close() {
        boolean interrupted = false;
        synchronized (lock) {
            closed = true;
            while (leaseCount > 0) {
                try {
                    lock.wait();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isClosed() {
        return closed;
    }

    public int getLeaseCount() {
        synchronized (lock) {
            return leaseCount;
        }
    }

    /** A lease on the guarded resource; closing it more than once has no further effect. */
    public final class Lease implements AutoCloseable {

        private boolean released;

        private Lease() {}

        @Override
        public void close() {
            if (!released) {
                released = true;
                releaseResource();
            }
        }
    }
}
