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

import javax.annotation.Nullable;

/** Wire constants of RFC 6455 shared by the frame codec and the handshake. */
public final class WebSocketProtocol {
  /** Appended to {@code Sec-WebSocket-Key} before hashing it into the accept key. */
  public static final String ACCEPT_MAGIC = "258EAFA5-E914-47DA-95CA-C5AB0DC85B11";

  /** The only {@code Sec-WebSocket-Version} a request may ask for. */
  public static final String VERSION = "13";

  // Byte 0: FIN, RSV1, RSV2, RSV3, then a 4-bit opcode.
  static final int B0_FLAG_FIN = 0b10000000;
  static final int B0_FLAG_RSV1 = 0b01000000;
  static final int B0_FLAG_RSV2 = 0b00100000;
  static final int B0_FLAG_RSV3 = 0b00010000;
  static final int B0_MASK_OPCODE = 0b00001111;

  // Byte 1: MASK, then a 7-bit length or one of the extended-length markers.
  static final int B1_FLAG_MASK = 0b10000000;
  static final int B1_MASK_LENGTH = 0b01111111;

  /** Largest length that fits byte 1, and the largest payload of a control frame. */
  public static final long PAYLOAD_BYTE_MAX = 125L;
  /** Length marker for a 16-bit unsigned length in the next two bytes. */
  static final int PAYLOAD_SHORT = 126;
  static final long PAYLOAD_SHORT_MAX = 0xffffL;
  /** Length marker for a 64-bit length in the next eight bytes. */
  static final int PAYLOAD_LONG = 127;

  public static final int CLOSE_PROTOCOL_ERROR = 1002;
  /** Reported for a close frame without a status code. Never sent on the wire. */
  public static final int CLOSE_NO_STATUS_CODE = 1005;
  public static final int CLOSE_MESSAGE_TOO_BIG = 1009;

  /** XORs {@code payload} in place with the repeating 4-byte {@code key}. */
  static void toggleMask(byte[] payload, byte[] key) {
    for (int i = 0; i < payload.length; i++) {
      payload[i] = (byte) (payload[i] ^ key[i & 3]);
    }
  }

  /** Returns why {@code code} may not appear in a close frame, or null if it may. */
  public static @Nullable String closeCodeExceptionMessage(int code) {
    if (code < 1000 || code >= 5000) {
      return "Code must be in range [1000,5000): " + code;
    } else if ((code >= 1004 && code <= 1006) || (code >= 1012 && code <= 2999)) {
      return "Code " + code + " is reserved and may not be used.";
    } else {
      return null;
    }
  }

  public static void validateCloseCode(int code) {
    String message = closeCodeExceptionMessage(code);
    if (message != null) throw new IllegalArgumentException(message);
  }

  private WebSocketProtocol() {
  }
}
