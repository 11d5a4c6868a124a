/*
 * Copyright (c) 2025 Moataz Abdelnasser
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package com.github.mizosoft.rebound;

import static java.util.Objects.requireNonNull;

import com.github.mizosoft.rebound.internal.Utils;
import java.io.EOFException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.MalformedURLException;
import java.net.NoRouteToHostException;
import java.net.ProtocolException;
import java.net.SocketTimeoutException;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.net.http.HttpTimeoutException;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateNotYetValidException;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import javax.net.ssl.SSLException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Signals a failure at the transport level, classified by a {@link Reason}. Transient reasons
 * describe conditions that may go away on their own, and are thus candidates for retrying.
 */
public class TransportException extends IOException {
  private static final long serialVersionUID = -4286379548133413620L;

  private final Reason reason;

  public TransportException(Reason reason, String message) {
    super(message);
    this.reason = requireNonNull(reason);
  }

  public TransportException(Reason reason, String message, @Nullable Throwable cause) {
    super(message, cause);
    this.reason = requireNonNull(reason);
  }

  public Reason reason() {
    return reason;
  }

  public boolean isTransient() {
    return reason.isTransient();
  }

  /**
   * Returns a {@code TransportException} classifying the given failure. The failure itself is
   * returned if it's already a {@code TransportException}.
   */
  public static TransportException from(Throwable failure) {
    var cause = Utils.getDeepCompletionCause(failure);
    if (cause instanceof TransportException) {
      return (TransportException) cause;
    }
    var reason = classify(cause);
    var message = cause.getMessage();
    return new TransportException(
        reason, message != null ? message : reason.name().toLowerCase(Locale.ROOT), cause);
  }

  private static Reason classify(Throwable cause) {
    if (cause instanceof CancellationException) {
      return Reason.CANCELLED;
    } else if (cause instanceof UnknownHostException) {
      return Reason.CANNOT_FIND_HOST;
    } else if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
      // Also covers HttpConnectTimeoutException.
      return Reason.TIMED_OUT;
    } else if (cause instanceof NoRouteToHostException) {
      return Reason.NOT_CONNECTED_TO_INTERNET;
    } else if (cause instanceof ConnectException) {
      return Reason.CANNOT_CONNECT_TO_HOST;
    } else if (cause instanceof SSLException) {
      return classifySslFailure(cause);
    } else if (cause instanceof MalformedURLException || cause instanceof URISyntaxException) {
      return Reason.BAD_URL;
    } else if (cause instanceof ProtocolException) {
      return Reason.BAD_SERVER_RESPONSE;
    } else if (cause instanceof EOFException) {
      return Reason.NETWORK_CONNECTION_LOST;
    } else if (cause instanceof IOException && isConnectionLostMessage(cause.getMessage())) {
      return Reason.NETWORK_CONNECTION_LOST;
    } else {
      return Reason.UNKNOWN;
    }
  }

  private static Reason classifySslFailure(Throwable sslFailure) {
    for (var cause = sslFailure.getCause(); cause != null; cause = cause.getCause()) {
      if (cause instanceof CertificateExpiredException) {
        return Reason.SERVER_CERTIFICATE_HAS_BAD_DATE;
      } else if (cause instanceof CertificateNotYetValidException) {
        return Reason.SERVER_CERTIFICATE_NOT_YET_VALID;
      }
    }
    return Reason.SECURE_CONNECTION_FAILED;
  }

  private static boolean isConnectionLostMessage(@Nullable String message) {
    if (message == null) {
      return false;
    }
    var lowerCaseMessage = message.toLowerCase(Locale.ROOT);
    return lowerCaseMessage.contains("connection reset")
        || lowerCaseMessage.contains("connection closed")
        || lowerCaseMessage.contains("connection was closed")
        || lowerCaseMessage.contains("broken pipe");
  }

  /** The closed set of transport failure reasons. */
  public enum Reason {
    BACKGROUND_SESSION_IN_USE_BY_ANOTHER_PROCESS(true),
    BACKGROUND_SESSION_WAS_DISCONNECTED(true),
    BAD_SERVER_RESPONSE(true),
    CALL_IS_ACTIVE(true),
    CANNOT_CONNECT_TO_HOST(true),
    CANNOT_FIND_HOST(true),
    CANNOT_LOAD_FROM_NETWORK(true),
    DATA_NOT_ALLOWED(true),
    DNS_LOOKUP_FAILED(true),
    DOWNLOAD_DECODING_FAILED_MID_STREAM(true),
    DOWNLOAD_DECODING_FAILED_TO_COMPLETE(true),
    INTERNATIONAL_ROAMING_OFF(true),
    NETWORK_CONNECTION_LOST(true),
    NOT_CONNECTED_TO_INTERNET(true),
    SECURE_CONNECTION_FAILED(true),
    SERVER_CERTIFICATE_HAS_BAD_DATE(true),
    SERVER_CERTIFICATE_NOT_YET_VALID(true),
    TIMED_OUT(true),

    CANCELLED(false),
    BAD_URL(false),
    UNSUPPORTED_URL(false),
    CANNOT_PARSE_RESPONSE(false),
    CANNOT_DECODE_CONTENT_DATA(false),
    CLIENT_CERTIFICATE_REJECTED(false),
    CLIENT_CERTIFICATE_REQUIRED(false),
    SERVER_CERTIFICATE_UNTRUSTED(false),
    HTTP_TOO_MANY_REDIRECTS(false),
    USER_AUTHENTICATION_REQUIRED(false),
    UNKNOWN(false);

    private final boolean isTransient;

    Reason(boolean isTransient) {
      this.isTransient = isTransient;
    }

    /** Returns whether failures with this reason may succeed if the request is sent again. */
    public boolean isTransient() {
      return isTransient;
    }

    /** Returns all transient reasons. */
    public static Set<Reason> transientReasons() {
      var reasons = EnumSet.noneOf(Reason.class);
      for (var reason : values()) {
        if (reason.isTransient) {
          reasons.add(reason);
        }
      }
      return reasons;
    }
  }
}
