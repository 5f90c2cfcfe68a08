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

import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import io.grpc.BindableService;
import io.grpc.ServerBuilder;
import io.grpc.ServerMethodDefinition;
import io.grpc.ServerServiceDefinition;
import io.grpc.util.MutableHandlerRegistry;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Registers services with a server so that every call runs through a chain of
 * {@link PreCallHandler}s before the implementation and a chain of {@link PostCallHandler}s
 * after it.
 *
 * <p>For each call:
 * <ol>
 * <li>The pre-call handlers run in order. If one throws, the rest and the implementation are
 *     skipped.</li>
 * <li>The implementation is started. Exceptions it throws, from {@code startCall} or from any
 *     listener callback, are caught.</li>
 * <li>When the implementation closes the call, or when an exception was caught before it did,
 *     the post-call handlers run in order, tracing headers are sent if enabled and no response
 *     headers went out yet, and the call is closed with the implementation's status and
 *     trailers (or the status of the caught exception). This happens exactly once per call;
 *     exceptions caught after it are dropped.</li>
 * </ol>
 *
 * <p>A call that is cancelled and never closed by its implementation does not reach the
 * post-call handlers.
 *
 * <pre>
 * ServerBuilder&lt;?&gt; serverBuilder = ServerBuilder.forPort(8080);
 * InterceptingDispatcher dispatcher = InterceptingDispatcher.forServer(serverBuilder)
 *     .addPreCallHandler(authenticator)
 *     .addPostCallHandler(accessLog)
 *     .build();
 * dispatcher.enableTracing();
 * dispatcher.addService(new GreeterImpl());
 * Server server = serverBuilder.build().start();
 * </pre>
 *
 * <p>Handler chains are shared by all services added to one dispatcher. Use separate
 * dispatchers on the same server for services that need different handlers.
 */
@ThreadSafe
public final class InterceptingDispatcher {
  private static final Logger logger = Logger.getLogger(InterceptingDispatcher.class.getName());

  private final ServiceRegistrar registrar;
  private final ImmutableList<PreCallHandler> preCallHandlers;
  private final ImmutableList<PostCallHandler> postCallHandlers;
  private volatile boolean tracingEnabled;

  private InterceptingDispatcher(Builder builder) {
    this.registrar = builder.registrar;
    this.preCallHandlers = builder.preCallHandlers.build();
    this.postCallHandlers = builder.postCallHandlers.build();
  }

  /** Creates a builder for a dispatcher that adds services to a server before it is built. */
  public static Builder forServer(ServerBuilder<?> serverBuilder) {
    checkNotNull(serverBuilder, "serverBuilder");
    return new Builder(serverBuilder::addService);
  }

  /**
   * Creates a builder for a dispatcher that adds services to a registry, typically the fallback
   * registry of a running server.
   */
  public static Builder forRegistry(MutableHandlerRegistry registry) {
    checkNotNull(registry, "registry");
    return new Builder(registry::addService);
  }

  /**
   * Registers {@code service} with every method replaced by one that runs the handler chains
   * around the original. Method names and descriptors are unchanged.
   */
  public void addService(ServerServiceDefinition service) {
    checkNotNull(service, "service");
    ServerServiceDefinition.Builder proxy =
        ServerServiceDefinition.builder(service.getServiceDescriptor());
    for (ServerMethodDefinition<?, ?> method : service.getMethods()) {
      proxy.addMethod(proxyMethod(method));
    }
    registrar.addService(proxy.build());
  }

  /** Binds {@code service} and registers it like {@link #addService(ServerServiceDefinition)}. */
  public void addService(BindableService service) {
    checkNotNull(service, "service");
    addService(service.bindService());
  }

  /**
   * Echoes the {@link TracingHeaders} of every subsequent call back to the client as response
   * headers. There is no way to turn this off again.
   *
   * <p>Allow-listed headers are added to the response headers the implementation sends, unless
   * it already set them. If a call ends without response headers, as on errors and on calls
   * rejected by a {@link PreCallHandler}, they are sent on their own after the post-call handlers
   * run.
   */
  public void enableTracing() {
    tracingEnabled = true;
  }

  public boolean isTracingEnabled() {
    return tracingEnabled;
  }

  private <ReqT, RespT> ServerMethodDefinition<ReqT, RespT> proxyMethod(
      ServerMethodDefinition<ReqT, RespT> method) {
    return method.withServerCallHandler(
        new ProxyServerCallHandler<>(this, method.getServerCallHandler()));
  }

  void runPreCallHandlers(InterceptedCall call) {
    for (PreCallHandler handler : preCallHandlers) {
      handler.onPreCall(call);
    }
  }

  void runPostCallHandlers(InterceptedCall call, @Nullable Throwable error) {
    for (PostCallHandler handler : postCallHandlers) {
      try {
        handler.onPostCall(error, call);
      } catch (RuntimeException e) {
        logger.log(
            Level.WARNING,
            "Post-call handler " + handler + " failed for " + call.getFullMethodName(),
            e);
      }
    }
  }

  /** The server side of {@link #addService}. */
  private interface ServiceRegistrar {
    void addService(ServerServiceDefinition service);
  }

  /** Builder for {@link InterceptingDispatcher}. Both handler chains start empty. */
  public static final class Builder {
    private final ServiceRegistrar registrar;
    private final ImmutableList.Builder<PreCallHandler> preCallHandlers = ImmutableList.builder();
    private final ImmutableList.Builder<PostCallHandler> postCallHandlers =
        ImmutableList.builder();

    private Builder(ServiceRegistrar registrar) {
      this.registrar = registrar;
    }

    /** Appends a handler to the pre-call chain. */
    @CanIgnoreReturnValue
    public Builder addPreCallHandler(PreCallHandler handler) {
      preCallHandlers.add(checkNotNull(handler, "handler"));
      return this;
    }

    /** Appends handlers to the pre-call chain, in iteration order. */
    @CanIgnoreReturnValue
    public Builder addPreCallHandlers(Iterable<? extends PreCallHandler> handlers) {
      checkNotNull(handlers, "handlers");
      for (PreCallHandler handler : handlers) {
        addPreCallHandler(handler);
      }
      return this;
    }

    /** Appends a handler to the post-call chain. */
    @CanIgnoreReturnValue
    public Builder addPostCallHandler(PostCallHandler handler) {
      postCallHandlers.add(checkNotNull(handler, "handler"));
      return this;
    }

    /** Appends handlers to the post-call chain, in iteration order. */
    @CanIgnoreReturnValue
    public Builder addPostCallHandlers(Iterable<? extends PostCallHandler> handlers) {
      checkNotNull(handlers, "handlers");
      for (PostCallHandler handler : handlers) {
        addPostCallHandler(handler);
      }
      return this;
    }

    public InterceptingDispatcher build() {
      return new InterceptingDispatcher(this);
    }
  }
}
