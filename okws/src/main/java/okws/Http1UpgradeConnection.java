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

import java.io.IOException;
import java.net.ProtocolException;
import okio.Buffer;
import okio.BufferedSink;
import okio.ByteString;

/**
 * The server side of one HTTP/1.1 connection that expects a WebSocket upgrade. Feed it every byte
 * read from the connection: it buffers until the request head is complete, hands the head to a
 * {@link ConnectionUpgradeCoordinator}, and from then on routes bytes to that coordinator.
 *
 * <p>Requests with a body are not supported; anything after the blank line that ends the request
 * head belongs to the WebSocket.
 */
public final class Http1UpgradeConnection {
  private static final ByteString CRLF_CRLF = ByteString.encodeUtf8("\r\n\r\n");

  /** The longest request head accepted, in bytes. */
  public static final long MAX_REQUEST_HEAD_SIZE = 16 * 1024;

  private final ConnectionUpgradeCoordinator coordinator;
  private final Buffer buffer = new Buffer();

  public Http1UpgradeConnection(UpgraderRegistry registry, BufferedSink sink) {
    this(new ConnectionUpgradeCoordinator(registry, sink));
  }

  public Http1UpgradeConnection(ConnectionUpgradeCoordinator coordinator) {
    if (coordinator == null) throw new NullPointerException("coordinator == null");
    this.coordinator = coordinator;
  }

  public ConnectionUpgradeCoordinator coordinator() {
    return coordinator;
  }

  /**
   * Consumes all of {@code source}.
   *
   * @throws WebSocketUpgradeException if the request head is complete and the upgrade was rejected.
   * @throws WebSocketFrameException if bytes after the upgrade are not well-formed frames.
   * @throws ProtocolException if the request head is malformed or too long.
   */
  public void onBytes(Buffer source) throws IOException {
    switch (coordinator.state()) {
      case AWAITING_REQUEST:
        buffer.write(source, source.size());
        readRequestHead();
        break;
      case FRAME_MODE:
        coordinator.onBytes(source);
        break;
      default:
        throw new IllegalStateException("Unexpected bytes: " + coordinator.state());
    }
  }

  private void readRequestHead() throws IOException {
    long end = buffer.indexOf(CRLF_CRLF);
    if (end == -1) {
      if (buffer.size() > MAX_REQUEST_HEAD_SIZE) {
        throw new ProtocolException("Request head longer than " + MAX_REQUEST_HEAD_SIZE);
      }
      return;
    }

    String requestLine = buffer.readUtf8LineStrict();
    Headers.Builder headers = new Headers.Builder();
    String header;
    while ((header = buffer.readUtf8LineStrict()).length() != 0) {
      headers.addLenient(header);
    }
    RequestHead request = RequestHead.parse(requestLine, headers.build());

    // What remains in the buffer was sent after the request head.
    coordinator.upgrade(request, buffer);
  }
}
