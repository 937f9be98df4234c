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
import okio.Buffer;
import okio.ByteString;

import static okws.internal.ws.WebSocketProtocol.CLOSE_NO_STATUS_CODE;
import static okws.internal.ws.WebSocketProtocol.PAYLOAD_BYTE_MAX;
import static okws.internal.ws.WebSocketProtocol.validateCloseCode;

/**
 * A single <a href="https://tools.ietf.org/html/rfc6455#section-5.2">RFC 6455</a> frame.
 *
 * <p>The payload is always held unmasked. A frame with a {@linkplain #maskKey() mask key} is
 * masked with that key when it is encoded, and a masked frame that is decoded keeps the key it
 * arrived with.
 *
 * <p>Control frames (close, ping and pong) must be final and carry at most 125 bytes.
 * Continuation frames are only meaningful after a non-final text or binary frame; this class
 * doesn't track message boundaries.
 *
 * <p>Instances of this class are immutable.
 */
public final class WebSocketFrame {
  private final boolean fin;
  private final Opcode opcode;
  private final @Nullable ByteString maskKey;
  private final ByteString payload;

  public WebSocketFrame(boolean fin, Opcode opcode, ByteString payload) {
    this(fin, opcode, null, payload);
  }

  public WebSocketFrame(boolean fin, Opcode opcode, @Nullable ByteString maskKey,
      ByteString payload) {
    if (opcode == null) throw new NullPointerException("opcode == null");
    if (payload == null) throw new NullPointerException("payload == null");
    if (maskKey != null && maskKey.size() != 4) {
      throw new IllegalArgumentException("maskKey.size() != 4: " + maskKey.size());
    }
    if (opcode.isControl()) {
      if (!fin) {
        throw new IllegalArgumentException("Control frames must be final.");
      }
      if (payload.size() > PAYLOAD_BYTE_MAX) {
        throw new IllegalArgumentException(
            "Payload size must be less than or equal to " + PAYLOAD_BYTE_MAX);
      }
    }
    this.fin = fin;
    this.opcode = opcode;
    this.maskKey = maskKey;
    this.payload = payload;
  }

  public static WebSocketFrame text(String text) {
    return new WebSocketFrame(true, Opcode.TEXT, ByteString.encodeUtf8(text));
  }

  public static WebSocketFrame binary(ByteString bytes) {
    return new WebSocketFrame(true, Opcode.BINARY, bytes);
  }

  public static WebSocketFrame ping(ByteString payload) {
    return new WebSocketFrame(true, Opcode.PING, payload);
  }

  public static WebSocketFrame pong(ByteString payload) {
    return new WebSocketFrame(true, Opcode.PONG, payload);
  }

  /**
   * Returns a close frame with an optional code and reason.
   *
   * @param code Status code as defined by <a
   * href="http://tools.ietf.org/html/rfc6455#section-7.4">Section 7.4 of RFC 6455</a> or {@code
   * 0} for an empty payload.
   * @param reason Reason for shutting down or {@code null}. Requires a nonzero {@code code}.
   */
  public static WebSocketFrame close(int code, @Nullable String reason) {
    if (code == 0) {
      if (reason != null) throw new IllegalArgumentException("reason without a close code");
      return new WebSocketFrame(true, Opcode.CLOSE, ByteString.EMPTY);
    }
    validateCloseCode(code);
    Buffer buffer = new Buffer().writeShort(code);
    if (reason != null) buffer.writeUtf8(reason);
    return new WebSocketFrame(true, Opcode.CLOSE, buffer.readByteString());
  }

  /** Returns a copy of this frame that is masked with {@code maskKey} when encoded. */
  public WebSocketFrame masked(ByteString maskKey) {
    if (maskKey == null) throw new NullPointerException("maskKey == null");
    return new WebSocketFrame(fin, opcode, maskKey, payload);
  }

  /** Returns a copy of this frame that is encoded without a mask. */
  public WebSocketFrame unmasked() {
    return maskKey != null ? new WebSocketFrame(fin, opcode, null, payload) : this;
  }

  /** True if this is the final fragment in a message. */
  public boolean fin() {
    return fin;
  }

  public Opcode opcode() {
    return opcode;
  }

  public boolean isMasked() {
    return maskKey != null;
  }

  /** The 4-byte key this frame is masked with on the wire, or null if it is not masked. */
  public @Nullable ByteString maskKey() {
    return maskKey;
  }

  /** The unmasked application data. */
  public ByteString payload() {
    return payload;
  }

  /**
   * Returns the status code of a close frame, or {@code 1005} if the payload is empty.
   *
   * @throws IllegalStateException if this is not a close frame.
   */
  public int closeCode() {
    checkClose();
    if (payload.size() < 2) return CLOSE_NO_STATUS_CODE;
    return ((payload.getByte(0) & 0xff) << 8) | (payload.getByte(1) & 0xff);
  }

  /** Returns the UTF-8 reason of a close frame, which may be empty. */
  public String closeReason() {
    checkClose();
    if (payload.size() <= 2) return "";
    return payload.substring(2).utf8();
  }

  private void checkClose() {
    if (opcode != Opcode.CLOSE) throw new IllegalStateException("Not a close frame: " + opcode);
  }

  @Override public boolean equals(@Nullable Object other) {
    if (!(other instanceof WebSocketFrame)) return false;
    WebSocketFrame that = (WebSocketFrame) other;
    return fin == that.fin
        && opcode == that.opcode
        && (maskKey != null ? maskKey.equals(that.maskKey) : that.maskKey == null)
        && payload.equals(that.payload);
  }

  @Override public int hashCode() {
    int result = 17;
    result = 31 * result + (fin ? 1 : 0);
    result = 31 * result + opcode.hashCode();
    result = 31 * result + (maskKey != null ? maskKey.hashCode() : 0);
    result = 31 * result + payload.hashCode();
    return result;
  }

  @Override public String toString() {
    return "WebSocketFrame{fin="
        + fin
        + ", opcode="
        + opcode
        + (maskKey != null ? ", maskKey=" + maskKey.hex() : "")
        + ", payload="
        + payload
        + '}';
  }
}
