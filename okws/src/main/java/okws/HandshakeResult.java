/*
 * Copyright (C) 2024 Square, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package okws;

import javax.annotation.Nullable;

/** The outcome of negotiating one upgrade request. */
public final class HandshakeResult {
  private final @Nullable Headers responseHeaders;
  private final @Nullable WebSocketUpgrader upgrader;
  private final @Nullable UpgradeError error;
  private final @Nullable String message;

  private HandshakeResult(@Nullable Headers responseHeaders, @Nullable WebSocketUpgrader upgrader,
      @Nullable UpgradeError error, @Nullable String message) {
    this.responseHeaders = responseHeaders;
    this.upgrader = upgrader;
    this.error = error;
    this.message = message;
  }

  public static HandshakeResult accepted(Headers responseHeaders, WebSocketUpgrader upgrader) {
    if (responseHeaders == null) throw new NullPointerException("responseHeaders == null");
    if (upgrader == null) throw new NullPointerException("upgrader == null");
    return new HandshakeResult(responseHeaders, upgrader, null, null);
  }

  public static HandshakeResult rejected(UpgradeError error, String message) {
    if (error == null) throw new NullPointerException("error == null");
    return new HandshakeResult(null, null, error, message);
  }

  public boolean isAccepted() {
    return error == null;
  }

  /** The headers of the 101 response. Null if this result is a rejection. */
  public @Nullable Headers responseHeaders() {
    return responseHeaders;
  }

  /** The upgrader that accepted the request. Null if this result is a rejection. */
  public @Nullable WebSocketUpgrader upgrader() {
    return upgrader;
  }

  /** Why the request was rejected. Null if it was accepted. */
  public @Nullable UpgradeError error() {
    return error;
  }

  public @Nullable String message() {
    return message;
  }

  @Override public String toString() {
    return isAccepted() ? "Accepted" : "Rejected{" + error + ", " + message + "}";
  }
}
