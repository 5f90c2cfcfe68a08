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

import io.grpc.Attributes;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import javax.annotation.Nullable;

/**
 * One in-flight server call as seen by {@link PreCallHandler}s and {@link PostCallHandler}s.
 *
 * <p>The view is the same for unary and all three streaming method types. Handlers may read the
 * inbound headers and send response headers early, but the call's lifecycle stays with the
 * service implementation.
 */
public interface InterceptedCall {

  /** The descriptor of the method being called. */
  MethodDescriptor<?, ?> getMethodDescriptor();

  /** The fully qualified method name, e.g. {@code "package.Service/Method"}. */
  String getFullMethodName();

  /**
   * The headers the client sent with the call. Key names are lower-cased by {@link Metadata}.
   */
  Metadata getHeaders();

  /**
   * Sends response headers to the client ahead of any response message. Can be called at most
   * once per call, by anyone; the transport rejects a second attempt with an
   * {@link IllegalStateException}. With tracing enabled, allow-listed request headers not already
   * in {@code headers} are added to them.
   */
  void sendHeaders(Metadata headers);

  /** Transport attributes of the call, such as the remote address. */
  Attributes getAttributes();

  /** The authority the client used for the call, or {@code null} if unknown. */
  @Nullable
  String getAuthority();

  /** Returns {@code true} once the client has cancelled the call. */
  boolean isCancelled();
}
