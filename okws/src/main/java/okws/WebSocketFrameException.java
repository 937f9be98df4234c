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

import java.net.ProtocolException;

/**
 * Thrown when inbound bytes are not a well-formed frame. This is fatal to the connection: the
 * caller should send a close frame with {@link #closeCode} if it can and then close it.
 */
public final class WebSocketFrameException extends ProtocolException {
  public final int closeCode;

  public WebSocketFrameException(int closeCode, String message) {
    super(message);
    this.closeCode = closeCode;
  }

  /** The RFC 6455 status code to report in the close frame, such as 1002 or 1009. */
  public int closeCode() {
    return closeCode;
  }
}
