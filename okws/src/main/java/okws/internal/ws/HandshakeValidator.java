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
package okws.internal.ws;

import okws.Headers;
import okws.UpgradeError;
import okws.WebSocketUpgradeException;
import okio.ByteString;

import static okws.internal.ws.WebSocketProtocol.ACCEPT_MAGIC;
import static okws.internal.ws.WebSocketProtocol.VERSION;

/**
 * Checks the headers of an <a href="https://tools.ietf.org/html/rfc6455#section-4.2.1">RFC 6455
 * opening handshake</a> and builds the headers of the response that accepts it.
 */
public final class HandshakeValidator {
  private HandshakeValidator() {
  }

  /**
   * Returns the {@code Sec-WebSocket-Accept} value for the request with {@code headers}.
   *
   * @throws WebSocketUpgradeException with {@link UpgradeError#INVALID_UPGRADE_HEADER} if any of
   *     the required headers are missing or have an unexpected value.
   */
  public static String validate(Headers headers) throws WebSocketUpgradeException {
    if (!headers.containsToken("Connection", "upgrade")) {
      throw invalid("Expected 'Connection' header value 'Upgrade' but was '"
          + headers.get("Connection")
          + "'");
    }

    if (!headers.containsToken("Upgrade", "websocket")) {
      throw invalid("Expected 'Upgrade' header value 'websocket' but was '"
          + headers.get("Upgrade")
          + "'");
    }

    String version = headers.get("Sec-WebSocket-Version");
    if (!VERSION.equals(version)) {
      throw invalid("Expected 'Sec-WebSocket-Version' header value '"
          + VERSION
          + "' but was '"
          + version
          + "'");
    }

    String key = headers.get("Sec-WebSocket-Key");
    if (key == null || key.isEmpty()) {
      throw invalid("Expected 'Sec-WebSocket-Key' header");
    }

    return acceptKey(key);
  }

  /** Returns the base64 of the SHA-1 of {@code key} and the RFC 6455 GUID. */
  public static String acceptKey(String key) {
    return ByteString.encodeUtf8(key + ACCEPT_MAGIC).sha1().base64();
  }

  /**
   * Returns the headers of a 101 response: {@code upgrade}, {@code connection} and {@code
   * sec-websocket-accept}, followed by {@code extraHeaders} in their original order and case.
   */
  public static Headers buildResponseHeaders(String acceptKey, Headers extraHeaders) {
    return new Headers.Builder()
        .add("upgrade", "websocket")
        .add("connection", "upgrade")
        .add("sec-websocket-accept", acceptKey)
        .addAll(extraHeaders)
        .build();
  }

  private static WebSocketUpgradeException invalid(String message) {
    return new WebSocketUpgradeException(UpgradeError.INVALID_UPGRADE_HEADER, message);
  }
}
