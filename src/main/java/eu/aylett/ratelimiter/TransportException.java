/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.ratelimiter;

import org.jspecify.annotations.Nullable;

import java.io.EOFException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.ClosedChannelException;
import java.util.Locale;

/**
 * A failed call, as the transport layer reports it to the rate limiter.
 * <p>
 * Transports convert their own failures into this type once, at the edge.
 * {@link RetryManager#classify} then only has to look at the {@link Kind} and,
 * for HTTP errors, the status. Any other exception an operation throws is
 * treated as permanent.
 * </p>
 */
public class TransportException extends RuntimeException {
  public enum Kind {
    /** The server answered with an error status. */
    HTTP,
    /** No answer in time. */
    TIMEOUT,
    /** The connection was closed underneath the call. */
    CONNECTION_CLOSED,
    /** Nothing was listening. */
    CONNECTION_REFUSED,
    /** The peer reset the connection. */
    CONNECTION_RESET,
  }

  /**
   * What went wrong.
   */
  public final Kind kind;
  /**
   * The HTTP status for {@link Kind#HTTP}, otherwise {@code 0}.
   */
  public final int status;
  /**
   * The decoded error body ({@code Map}, {@code List}, {@code String}) for
   * {@link Kind#HTTP}, if there was one.
   */
  public final @Nullable Object body;

  protected TransportException(Kind kind, int status, @Nullable Object body, String message,
      @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.status = status;
    this.body = body;
  }

  public static TransportException http(int status, @Nullable Object body) {
    return new TransportException(Kind.HTTP, status, body, "HTTP " + status + (body == null ? "" : ": " + body),
        null);
  }

  public static TransportException of(Kind kind, @Nullable Throwable cause) {
    if (kind == Kind.HTTP) {
      throw new IllegalArgumentException("HTTP errors need a status; use http(status, body)");
    }
    var message = kind.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    if (cause != null && cause.getMessage() != null) {
      message += ": " + cause.getMessage();
    }
    return new TransportException(kind, 0, null, message, cause);
  }

  public static TransportException timeout() {
    return of(Kind.TIMEOUT, null);
  }

  /**
   * Converts the JDK's own network failures, or returns {@code null} for
   * anything this doesn't recognise.
   */
  public static @Nullable TransportException from(Throwable t) {
    if (t instanceof TransportException transport) {
      return transport;
    }
    if (t instanceof UncheckedIOException unchecked) {
      return from(unchecked.getCause());
    }
    if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) {
      return of(Kind.TIMEOUT, t);
    }
    if (t instanceof ConnectException) {
      return of(Kind.CONNECTION_REFUSED, t);
    }
    if (t instanceof ClosedChannelException || t instanceof EOFException) {
      return of(Kind.CONNECTION_CLOSED, t);
    }
    if (t instanceof SocketException) {
      var message = t.getMessage();
      if (message != null && message.toLowerCase(Locale.ROOT).contains("reset")) {
        return of(Kind.CONNECTION_RESET, t);
      }
      return of(Kind.CONNECTION_CLOSED, t);
    }
    return null;
  }
}
