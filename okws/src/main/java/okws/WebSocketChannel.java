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
import javax.annotation.Nullable;

/**
 * The frame-level view of an upgraded connection, handed to an endpoint when it is activated.
 *
 * <p>Frames are delivered one at a time in the order they arrived, usually on the connection's
 * thread. Frames that arrived before the listener was installed are delivered on the thread that
 * installs it, and that thread keeps delivering until it has caught up. {@link #send} and {@link
 * #close} may be called from any thread.
 */
public interface WebSocketChannel {
  /** Returns the request that was upgraded. */
  RequestHead request();

  /**
   * Installs the listener that receives inbound frames. May be called from any thread, including
   * after activation has returned. Frames that arrived before a listener was installed are
   * delivered to it first, in order.
   */
  void setFrameListener(FrameListener listener) throws IOException;

  /**
   * Encodes {@code frame} and writes it to the peer.
   *
   * @throws IOException if a close frame has already been sent or the write fails.
   */
  void send(WebSocketFrame frame) throws IOException;

  /**
   * Sends a close frame with an optional code and reason. No further frames may be sent.
   *
   * @param code Status code as defined by <a
   * href="http://tools.ietf.org/html/rfc6455#section-7.4">Section 7.4 of RFC 6455</a> or {@code
   * 0}.
   * @param reason Reason for shutting down or {@code null}. Requires a nonzero {@code code}.
   */
  void close(int code, @Nullable String reason) throws IOException;
}
