/*
 * Copyright 2026 The gRPC Authors
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

package io.grpcmiddleware;

import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Runs once per call, after the service implementation finished and before the status is sent
 * to the client.
 *
 * <p>Handlers observe the outcome; they cannot change it. An exception thrown by a handler is
 * logged and does not prevent the remaining handlers or the close of the call.
 */
@ThreadSafe
@FunctionalInterface
public interface PostCallHandler {

  /**
   * Called with the call's outcome.
   *
   * @param error {@code null} if the call completed with {@link io.grpc.Status#OK}; the exception
   *     raised by a {@link PreCallHandler} or the implementation; otherwise a
   *     {@link io.grpc.StatusRuntimeException} carrying the status and trailers the
   *     implementation closed the call with
   * @param call the call that completed
   */
  void onPostCall(@Nullable Throwable error, InterceptedCall call);
}
