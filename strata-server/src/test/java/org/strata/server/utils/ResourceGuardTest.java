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

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** Tests for {@link ResourceGuard}. */
class ResourceGuardTest {

    @Test
    void testCloseWaitsForOpenLeases() throws Exception {
        ResourceGuard guard = new ResourceGuard();
        ResourceGuard.Lease first = guard.acquireResource();
        ResourceGuard.Lease second = guard.acquireResource();
        assertThat(guard.getLeaseCount()).isEqualTo(2);

        CompletableFuture<Void> closing = CompletableFuture.runAsync(guard::close);
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (!guard.isClosed() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertThat(guard.isClosed()).isTrue();
        assertThat(closing).isNotDone();
        assertThatThrownBy(guard::acquireResource).isInstanceOf(IOException.class);

        first.close();
        first.close();
        assertThat(guard.getLeaseCount()).isEqualTo(1);
        assertThat(closing).isNotDone();

        second.close();
        closing.get(10, TimeUnit.SECONDS);
        assertThat(guard.getLeaseCount()).isZero();
    }

    @Test
    void testCloseWithoutLeasesReturnsImmediately() {
        ResourceGuard guard = new ResourceGuard();
        guard.close();
        guard.close();
        assertThat(guard.isClosed()).isTrue();
    }
}
