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

import org.strata.exception.StrataRuntimeException;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/** A collection of utilities that expand the usage of {@link CompletableFuture}. */
public class FutureUtils {

    private FutureUtils() {}

    public static <T> CompletableFuture<T> completedExceptionally(Throwable cause) {
        CompletableFuture<T> future = new CompletableFuture<>();
        future.completeExceptionally(cause);
        return future;
    }

    /** Completes once all futures completed, with their results in the given order. */
    public static <T> CompletableFuture<List<T>> combineAll(List<CompletableFuture<T>> futures) {
        return CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .thenApply(
                        ignored ->
                                futures.stream()
                                        .map(CompletableFuture::join)
                                        .collect(Collectors.toList()));
    }

    /** Wraps the throwable to rethrow it from a completion stage, unless it is wrapped already. */
    public static CompletionException asCompletionException(Throwable throwable) {
        if (throwable instanceof CompletionException) {
            return (CompletionException) throwable;
        }
        return new CompletionException(throwable);
    }

    /** Strips {@link CompletionException} and {@link ExecutionException} wrappers. */
    public static Throwable stripException(Throwable throwable) {
        Throwable t = throwable;
        while ((t instanceof CompletionException || t instanceof ExecutionException)
                && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    /**
     * Waits for the future and rethrows its failure unwrapped: unchecked causes as they are,
     * checked ones wrapped in a {@link StrataRuntimeException}.
     */
    public static <T> T getUninterruptibly(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StrataRuntimeException("Interrupted while waiting for the result.", e);
        } catch (ExecutionException e) {
            Throwable cause = stripException(e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new StrataRuntimeException(cause.getMessage(), cause);
        }
    }
}
