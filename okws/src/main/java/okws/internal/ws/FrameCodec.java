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

import java.io.IOException;
import javax.annotation.Nullable;
import okio.Buffer;
import okio.BufferedSink;
import okio.ByteString;
import okws.Opcode;
import okws.WebSocketFrame;
import okws.WebSocketFrameException;

import static java.lang.Integer.toHexString;
import static okws.internal.ws.WebSocketProtocol.B0_FLAG_FIN;
import static okws.internal.ws.WebSocketProtocol.B0_FLAG_RSV1;
import static okws.internal.ws.WebSocketProtocol.B0_FLAG_RSV2;
import static okws.internal.ws.WebSocketProtocol.B0_FLAG_RSV3;
import static okws.internal.ws.WebSocketProtocol.B0_MASK_OPCODE;
import static okws.internal.ws.WebSocketProtocol.B1_FLAG_MASK;
import static okws.internal.ws.WebSocketProtocol.B1_MASK_LENGTH;
import static okws.internal.ws.WebSocketProtocol.CLOSE_MESSAGE_TOO_BIG;
import static okws.internal.ws.WebSocketProtocol.CLOSE_PROTOCOL_ERROR;
import static okws.internal.ws.WebSocketProtocol.PAYLOAD_BYTE_MAX;
import static okws.internal.ws.WebSocketProtocol.PAYLOAD_LONG;
import static okws.internal.ws.WebSocketProtocol.PAYLOAD_SHORT;
import static okws.internal.ws.WebSocketProtocol.PAYLOAD_SHORT_MAX;
import static okws.internal.ws.WebSocketProtocol.toggleMask;

/**
 * An <a href="http://tools.ietf.org/html/rfc6455">RFC 6455</a>-compatible frame encoder and
 * decoder.
 *
 * <p>This class holds no state. A caller that receives a partial frame keeps the bytes in its own
 * buffer and decodes again once more have arrived.
 */
public final class FrameCodec {
  /** A frame and the number of bytes it occupied on the wire. */
  public static final class Decoded {
    public final WebSocketFrame frame;
    public final long byteCount;

    Decoded(WebSocketFrame frame, long byteCount) {
      this.frame = frame;
      this.byteCount = byteCount;
    }
  }

  private FrameCodec() {
  }

  /** Returns the wire encoding of {@code frame}. */
  public static ByteString encode(WebSocketFrame frame) {
    Buffer buffer = new Buffer();
    writeFrame(frame, buffer);
    return buffer.readByteString();
  }

  /** Writes {@code frame} to {@code sink} without flushing. */
  public static void encode(WebSocketFrame frame, BufferedSink sink) throws IOException {
    Buffer buffer = new Buffer();
    writeFrame(frame, buffer);
    sink.write(buffer, buffer.size());
  }

  private static void writeFrame(WebSocketFrame frame, Buffer sink) {
    int b0 = frame.opcode().code();
    if (frame.fin()) {
      b0 |= B0_FLAG_FIN;
    }
    sink.writeByte(b0);

    ByteString payload = frame.payload();
    long byteCount = payload.size();
    int b1 = 0;
    if (frame.isMasked()) {
      b1 |= B1_FLAG_MASK;
    }
    if (byteCount <= PAYLOAD_BYTE_MAX) {
      b1 |= (int) byteCount;
      sink.writeByte(b1);
    } else if (byteCount <= PAYLOAD_SHORT_MAX) {
      b1 |= PAYLOAD_SHORT;
      sink.writeByte(b1);
      sink.writeShort((int) byteCount);
    } else {
      b1 |= PAYLOAD_LONG;
      sink.writeByte(b1);
      sink.writeLong(byteCount);
    }

    if (frame.isMasked()) {
      byte[] maskKey = frame.maskKey().toByteArray();
      sink.write(maskKey);

      byte[] bytes = payload.toByteArray();
      toggleMask(bytes, maskKey);
      sink.write(bytes);
    } else {
      sink.write(payload);
    }
  }

  /** Equivalent to {@code decode(source, Integer.MAX_VALUE)}. */
  public static @Nullable Decoded decode(Buffer source) throws WebSocketFrameException {
    return decode(source, Integer.MAX_VALUE);
  }

  /**
   * Decodes the frame at the head of {@code source} without consuming any bytes. Returns null if
   * {@code source} doesn't yet hold a complete frame.
   *
   * @param maxPayloadSize the largest payload to accept. Larger frames fail with close code 1009.
   *     Values above {@link Integer#MAX_VALUE} are treated as {@link Integer#MAX_VALUE}.
   * @throws WebSocketFrameException if the bytes on hand can't be the start of a valid frame.
   */
  public static @Nullable Decoded decode(Buffer source, long maxPayloadSize)
      throws WebSocketFrameException {
    long available = source.size();
    if (available < 2) return null;

    int b0 = source.getByte(0) & 0xff;

    // Reserved flags are for extensions which we currently do not support.
    if ((b0 & B0_FLAG_RSV1) != 0) throw protocolError("Unexpected rsv1 flag");
    if ((b0 & B0_FLAG_RSV2) != 0) throw protocolError("Unexpected rsv2 flag");
    if ((b0 & B0_FLAG_RSV3) != 0) throw protocolError("Unexpected rsv3 flag");

    Opcode opcode = Opcode.get(b0 & B0_MASK_OPCODE);
    if (opcode == null) {
      throw protocolError("Unknown opcode: " + toHexString(b0 & B0_MASK_OPCODE));
    }

    boolean isFinalFrame = (b0 & B0_FLAG_FIN) != 0;
    if (opcode.isControl() && !isFinalFrame) {
      throw protocolError("Control frames must be final.");
    }

    int b1 = source.getByte(1) & 0xff;
    boolean isMasked = (b1 & B1_FLAG_MASK) != 0;

    // Get frame length, optionally reading from follow-up bytes if indicated by special values.
    long frameLength = b1 & B1_MASK_LENGTH;
    long headerLength = 2;
    if (frameLength == PAYLOAD_SHORT) {
      if (available < 4) return null;
      frameLength = ((source.getByte(2) & 0xffL) << 8) | (source.getByte(3) & 0xffL);
      headerLength = 4;
      if (frameLength <= PAYLOAD_BYTE_MAX) {
        throw protocolError("Frame length " + frameLength + " must use the 7-bit encoding.");
      }
    } else if (frameLength == PAYLOAD_LONG) {
      if (available < 10) return null;
      frameLength = 0;
      for (int i = 2; i < 10; i++) {
        frameLength = (frameLength << 8) | (source.getByte(i) & 0xffL);
      }
      headerLength = 10;
      if (frameLength < 0) {
        throw protocolError(
            "Frame length 0x" + Long.toHexString(frameLength) + " > 0x7FFFFFFFFFFFFFFF");
      }
      if (frameLength <= PAYLOAD_SHORT_MAX) {
        throw protocolError("Frame length " + frameLength + " must use the 16-bit encoding.");
      }
    }

    if (opcode.isControl() && frameLength > PAYLOAD_BYTE_MAX) {
      throw protocolError("Control frame must be less than " + PAYLOAD_BYTE_MAX + "B.");
    }

    // Payloads are materialized as byte arrays.
    long limit = Math.min(maxPayloadSize, Integer.MAX_VALUE);
    if (frameLength > limit) {
      throw new WebSocketFrameException(CLOSE_MESSAGE_TOO_BIG,
          "Frame length " + frameLength + " > " + limit);
    }

    byte[] maskKey = null;
    if (isMasked) {
      if (available < headerLength + 4) return null;
      maskKey = new byte[4];
      for (int i = 0; i < 4; i++) {
        maskKey[i] = source.getByte(headerLength + i);
      }
      headerLength += 4;
    }

    if (available - headerLength < frameLength) return null;
    long byteCount = headerLength + frameLength;

    Buffer payload = new Buffer();
    source.copyTo(payload, headerLength, frameLength);
    byte[] bytes = payload.readByteArray();
    if (maskKey != null) {
      toggleMask(bytes, maskKey);
    }

    WebSocketFrame frame = new WebSocketFrame(isFinalFrame, opcode,
        maskKey != null ? ByteString.of(maskKey) : null, ByteString.of(bytes));
    return new Decoded(frame, byteCount);
  }

  /**
   * Removes and returns the frame at the head of {@code source}, or returns null leaving {@code
   * source} unchanged if it doesn't yet hold a complete frame.
   */
  public static @Nullable WebSocketFrame readFrame(Buffer source, long maxPayloadSize)
      throws IOException {
    Decoded decoded = decode(source, maxPayloadSize);
    if (decoded == null) return null;
    source.skip(decoded.byteCount);
    return decoded.frame;
  }

  private static WebSocketFrameException protocolError(String message) {
    return new WebSocketFrameException(CLOSE_PROTOCOL_ERROR, message);
  }
}
