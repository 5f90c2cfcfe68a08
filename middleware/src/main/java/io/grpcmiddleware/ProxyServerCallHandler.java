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

import static com.google.common.base.Preconditions.checkNotNull;

import io.grpc.ForwardingServerCall.SimpleForwardingServerCall;
import io.grpc.ForwardingServerCallListener.SimpleForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.Status;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Stands in for a service method's handler and runs the {@link InterceptingDispatcher} handler
 * chains around it.
 */
final class ProxyServerCallHandler<ReqT, RespT> implements ServerCallHandler<ReqT, RespT> {
  private static final Logger logger = Logger.getLogger(ProxyServerCallHandler.class.getName());

  private final InterceptingDispatcher dispatcher;
  private final ServerCallHandler<ReqT, RespT> next;

  ProxyServerCallHandler(InterceptingDispatcher dispatcher, ServerCallHandler<ReqT, RespT> next) {
    this.dispatcher = checkNotNull(dispatcher, "dispatcher");
    this.next = checkNotNull(next, "next");
  }

  @Override
  public ServerCall.Listener<ReqT> startCall(ServerCall<ReqT, RespT> call, Metadata headers) {
    InterceptedServerCall<ReqT, RespT> interceptedCall =
        new InterceptedServerCall<>(call, headers, dispatcher);
    try {
      dispatcher.runPreCallHandlers(interceptedCall);
      ServerCall.Listener<ReqT> listener = next.startCall(interceptedCall, headers);
      return new GuardingListener<>(listener, interceptedCall);
    } catch (RuntimeException e) {
      interceptedCall.closeWithException(e);
      return new ServerCall.Listener<ReqT>() {};
    }
  }

  /**
   * The call handed to the implementation. Its {@link #close} runs the post-call chain first, at
   * most once per call.
   */
  static final class InterceptedServerCall<ReqT, RespT>
      extends SimpleForwardingServerCall<ReqT, RespT> implements InterceptedCall {
    private final Metadata headers;
    private final InterceptingDispatcher dispatcher;
    private final AtomicBoolean completed = new AtomicBoolean();
    private volatile boolean headersSent;
    private volatile boolean abandoned;

    InterceptedServerCall(
        ServerCall<ReqT, RespT> delegate, Metadata headers, InterceptingDispatcher dispatcher) {
      super(delegate);
      this.headers = headers;
      this.dispatcher = dispatcher;
    }

    @Override
    public String getFullMethodName() {
      return getMethodDescriptor().getFullMethodName();
    }

    @Override
    public Metadata getHeaders() {
      return headers;
    }

    /** Adds the allow-listed tracing headers the implementation did not set itself. */
    @Override
    public void sendHeaders(Metadata responseHeaders) {
      if (dispatcher.isTracingEnabled() && headers != null) {
        Metadata relayed = TracingHeaders.copyAllowed(headers);
        for (String name : relayed.keys()) {
          Metadata.Key<String> key = Metadata.Key.of(name, Metadata.ASCII_STRING_MARSHALLER);
          if (!responseHeaders.containsKey(key)) {
            responseHeaders.put(key, relayed.get(key));
          }
        }
      }
      super.sendHeaders(responseHeaders);
      headersSent = true;
    }

    @Override
    public void close(Status status, Metadata trailers) {
      if (completed.compareAndSet(false, true)) {
        Throwable error = status.isOk() ? null : status.asRuntimeException(trailers);
        finish(error);
      }
      // A repeated close is left for the transport to reject.
      super.close(status, trailers);
    }

    /** Ends the call with {@code e} unless the implementation already closed it. */
    void closeWithException(RuntimeException e) {
      if (!completed.compareAndSet(false, true)) {
        logger.log(
            Level.FINE, "Dropping exception raised after " + getFullMethodName() + " completed", e);
        return;
      }
      abandoned = true;
      finish(e);
      Metadata trailers = Status.trailersFromThrowable(e);
      super.close(Status.fromThrowable(e), trailers != null ? trailers : new Metadata());
    }

    /**
     * Returns {@code true} once the call was ended because of an exception rather than by the
     * implementation.
     */
    boolean isAbandoned() {
      return abandoned;
    }

    private void finish(@Nullable Throwable error) {
      dispatcher.runPostCallHandlers(this, error);
      if (dispatcher.isTracingEnabled() && !headersSent) {
        relayTracingHeaders();
      }
    }

    private void relayTracingHeaders() {
      try {
        if (headers != null) {
          sendHeaders(TracingHeaders.copyAllowed(headers));
        }
      } catch (RuntimeException e) {
        logger.log(Level.FINE, "Unable to relay tracing headers for " + getFullMethodName(), e);
      }
    }
  }

  /**
   * Routes exceptions thrown from the implementation's listener to the post-call path. Once such
   * an exception closed the call, only {@code onCancel} and {@code onComplete} still reach the
   * implementation.
   */
  private static final class GuardingListener<ReqT>
      extends SimpleForwardingServerCallListener<ReqT> {
    private final InterceptedServerCall<ReqT, ?> call;

    GuardingListener(ServerCall.Listener<ReqT> delegate, InterceptedServerCall<ReqT, ?> call) {
      super(delegate);
      this.call = call;
    }

    @Override
    public void onMessage(ReqT message) {
      if (call.isAbandoned()) {
        return;
      }
      try {
        super.onMessage(message);
      } catch (RuntimeException e) {
        call.closeWithException(e);
      }
    }

    @Override
    public void onHalfClose() {
      if (call.isAbandoned()) {
        return;
      }
      try {
        super.onHalfClose();
      } catch (RuntimeException e) {
        call.closeWithException(e);
      }
    }

    @Override
    public void onCancel() {
      try {
        super.onCancel();
      } catch (RuntimeException e) {
        call.closeWithException(e);
      }
    }

    @Override
    public void onComplete() {
      try {
        super.onComplete();
      } catch (RuntimeException e) {
        call.closeWithException(e);
      }
    }

    @Override
    public void onReady() {
      if (call.isAbandoned()) {
        return;
      }
      try {
        super.onReady();
      } catch (RuntimeException e) {
        call.closeWithException(e);
      }
    }
  }
}
