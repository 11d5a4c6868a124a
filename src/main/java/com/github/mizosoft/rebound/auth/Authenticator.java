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

package com.github.mizosoft.rebound.auth;

import com.github.mizosoft.rebound.OutgoingRequest;
import com.github.mizosoft.rebound.ResponseInfo;
import java.util.concurrent.CompletableFuture;

/**
 * Applies and refreshes credentials of type {@code C} on behalf of an {@link
 * AuthenticationInterceptor}.
 *
 * @param <C> the type of the credential
 */
public interface Authenticator<C extends AuthenticationCredential> {

  /** Returns a copy of the given request that's authenticated with the given credential. */
  OutgoingRequest apply(C credential, OutgoingRequest request);

  /**
   * Asynchronously refreshes the given credential. At most one refresh is in progress at a time
   * per interceptor. A failed future fails every request waiting on the refresh.
   */
  CompletableFuture<C> refresh(C credential);

  /**
   * Returns whether the given request failed because it wasn't properly authenticated. The default
   * implementation checks for a {@code 401 Unauthorized} status.
   */
  default boolean didFailDueToAuthenticationError(
      OutgoingRequest request, ResponseInfo response, Throwable error) {
    return response.statusCode() == 401;
  }

  /**
   * Returns whether the given request was authenticated with the given credential. A request that
   * failed with an older credential is retried right away with the current one, without refreshing.
   */
  boolean isAuthenticatedWith(OutgoingRequest request, C credential);
}
