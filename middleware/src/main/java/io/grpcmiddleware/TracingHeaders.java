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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import io.grpc.Metadata;

/**
 * The request headers that {@link InterceptingDispatcher#enableTracing} echoes back to the
 * client: the B3 propagation headers used by Zipkin and Jaeger, plus the request metadata Envoy
 * adds at the edge.
 */
public final class TracingHeaders {
  public static final Metadata.Key<String> X_FORWARDED_FOR = key("x-forwarded-for");
  public static final Metadata.Key<String> X_FORWARDED_PROTO = key("x-forwarded-proto");
  public static final Metadata.Key<String> X_REQUEST_ID = key("x-request-id");
  public static final Metadata.Key<String> X_ENVOY_INTERNAL = key("x-envoy-internal");
  public static final Metadata.Key<String> X_B3_TRACEID = key("x-b3-traceid");
  public static final Metadata.Key<String> X_B3_SPANID = key("x-b3-spanid");
  public static final Metadata.Key<String> X_B3_SAMPLED = key("x-b3-sampled");

  /** Names of all relayed headers. */
  public static final ImmutableSet<String> ALLOW_LIST = ImmutableSet.of(
      X_FORWARDED_FOR.name(),
      X_FORWARDED_PROTO.name(),
      X_REQUEST_ID.name(),
      X_ENVOY_INTERNAL.name(),
      X_B3_TRACEID.name(),
      X_B3_SPANID.name(),
      X_B3_SAMPLED.name());

  // Prevent instantiation
  private TracingHeaders() {}

  /** Returns {@code true} if a header with exactly this name is relayed. */
  public static boolean isAllowed(String name) {
    return ALLOW_LIST.contains(name);
  }

  /**
   * Returns new metadata holding the first value of every allow-listed header present in
   * {@code inbound}. Other headers and later values of a repeated header are left out.
   */
  public static Metadata copyAllowed(Metadata inbound) {
    Metadata outbound = new Metadata();
    for (String name : inbound.keys()) {
      if (!isAllowed(name)) {
        continue;
      }
      Metadata.Key<String> key = key(name);
      Iterable<String> values = inbound.getAll(key);
      String first = values == null ? null : Iterables.getFirst(values, null);
      if (first != null) {
        outbound.put(key, first);
      }
    }
    return outbound;
  }

  private static Metadata.Key<String> key(String name) {
    return Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER);
  }
}
