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

import javax.annotation.concurrent.ThreadSafe;

/**
 * Runs before the service implementation is started.
 *
 * <p>Handlers run in the order they were added to the {@link InterceptingDispatcher}. Throwing
 * aborts the call: later handlers and the implementation are skipped, and the call is closed
 * with {@link io.grpc.Status#fromThrowable} of the exception. Throw a
 * {@link io.grpc.StatusRuntimeException} to choose the status the client sees, e.g.
 * {@code Status.UNAUTHENTICATED} from an authentication check.
 */
@ThreadSafe
@FunctionalInterface
public interface PreCallHandler {
  void onPreCall(InterceptedCall call);
}
