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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import okio.Buffer;
import okio.BufferedSink;
import okio.ByteString;
import okws.internal.ws.FrameCodec;
import okws.internal.ws.WebSocketProtocol;

import static okws.internal.ws.WebSocketProtocol.CLOSE_NO_STATUS_CODE;
import static okws.internal.ws.WebSocketProtocol.CLOSE_PROTOCOL_ERROR;
import static okws.internal.ws.WebSocketProtocol.PAYLOAD_BYTE_MAX;

/**
 * Drives the opening handshake of one connection and then carries its frames.
 *
 * <p>The HTTP layer calls {@link #upgrade} once it has parsed a request head, passing any bytes it
 * has already read past the end of that head. If the request is accepted the 101 response is
 * written and flushed, the chosen upgrader is activated, and those bytes are decoded as frames.
 * After that every inbound byte goes to {@link #onBytes}.
 *
 * <p>Inbound bytes must be fed from a single thread, the connection's thread. The listener may be
 * installed and frames may be sent from any thread.
 */
public final class ConnectionUpgradeCoordinator {
  private static final Logger logger =
      Logger.getLogger(ConnectionUpgradeCoordinator.class.getName());

  /** The largest inbound payload accepted unless configured otherwise. */
  public static final long DEFAULT_MAX_FRAME_SIZE = 1 << 14;

  public enum State {
    AWAITING_REQUEST,
    VALIDATING,
    ACCEPTED,
    REJECTED,
    FRAME_MODE
  }

  private final UpgraderRegistry registry;
  private final BufferedSink sink;
  private final long maxFrameSize;
  private final Channel channel = new Channel();

  /** Bytes received in frame mode that don't yet form a complete frame. */
  private final Buffer inbound = new Buffer();
  private volatile State state = State.AWAITING_REQUEST;
  private @Nullable RequestHead request;
  private boolean closeReceived;

  /** Guards {@link #listener}, {@link #pendingFrames} and {@link #delivering}. */
  private final Object deliveryLock = new Object();
  private @Nullable FrameListener listener;
  /** Frames not yet handed to the listener, oldest first. */
  private final Deque<WebSocketFrame> pendingFrames = new ArrayDeque<>();
  /** True while some thread is calling the listener. */
  private boolean delivering;

  /** Guards writes to {@link #sink}. */
  private final Object writeLock = new Object();
  /** Access must be guarded by synchronizing on {@link #writeLock}. */
  private boolean closeSent;

  public ConnectionUpgradeCoordinator(UpgraderRegistry registry, BufferedSink sink) {
    this(registry, sink, DEFAULT_MAX_FRAME_SIZE);
  }

  public ConnectionUpgradeCoordinator(UpgraderRegistry registry, BufferedSink sink,
      long maxFrameSize) {
    if (registry == null) throw new NullPointerException("registry == null");
    if (sink == null) throw new NullPointerException("sink == null");
    if (maxFrameSize <= 0) throw new IllegalArgumentException("maxFrameSize <= 0: " + maxFrameSize);
    this.registry = registry;
    this.sink = sink;
    this.maxFrameSize = maxFrameSize;
  }

  public State state() {
    return state;
  }

  /** The request that was upgraded, or null if no request has been accepted. */
  public @Nullable RequestHead request() {
    return request;
  }

  /**
   * Negotiates the upgrade of {@code request}.
   *
   * @param bufferedBytes bytes already read past the end of the request head. They are consumed
   *     and decoded as frames once the chosen upgrader has been activated.
   * @throws WebSocketUpgradeException if the request is rejected. Nothing has been written.
   * @throws IllegalStateException if this connection has already negotiated an upgrade.
   */
  public void upgrade(RequestHead request, Buffer bufferedBytes) throws IOException {
    if (state != State.AWAITING_REQUEST) {
      throw new IllegalStateException("Upgrade already attempted: " + state);
    }
    state = State.VALIDATING;

    HandshakeResult result = registry.select(request);
    if (!result.isAccepted()) {
      state = State.REJECTED;
      if (logger.isLoggable(Level.FINE)) {
        logger.fine("Rejected " + request + ": " + result.error() + " " + result.message());
      }
      throw new WebSocketUpgradeException(result.error(), result.message());
    }

    state = State.ACCEPTED;
    this.request = request;
    writeSwitchingProtocols(result.responseHeaders());
    if (logger.isLoggable(Level.FINE)) {
      logger.fine("Upgraded " + request);
    }

    result.upgrader().activator.activate(channel);

    state = State.FRAME_MODE;
    onBytes(bufferedBytes);
  }

  private void writeSwitchingProtocols(Headers headers) throws IOException {
    synchronized (writeLock) {
      sink.writeUtf8("HTTP/1.1 101 Switching Protocols\r\n");
      for (int i = 0, size = headers.size(); i < size; i++) {
        sink.writeUtf8(headers.name(i));
        sink.writeUtf8(": ");
        sink.writeUtf8(headers.value(i));
        sink.writeUtf8("\r\n");
      }
      sink.writeUtf8("\r\n");
      sink.flush();
    }
  }

  /**
   * Consumes {@code source} and delivers each complete frame to the endpoint. Bytes of a partial
   * frame are retained until the rest arrives.
   *
   * @throws WebSocketFrameException if the bytes are not a well-formed frame. The connection
   *     should then be {@linkplain #fail failed}.
   */
  public void onBytes(Buffer source) throws IOException {
    if (state != State.FRAME_MODE) {
      throw new IllegalStateException("Not upgraded: " + state);
    }
    inbound.write(source, source.size());

    WebSocketFrame frame;
    while ((frame = FrameCodec.readFrame(inbound, maxFrameSize)) != null) {
      onFrame(frame);
    }
  }

  private void onFrame(WebSocketFrame frame) throws IOException {
    if (closeReceived) {
      throw new WebSocketFrameException(CLOSE_PROTOCOL_ERROR,
          "Unexpected " + frame.opcode() + " frame after close");
    }

    if (frame.opcode() == Opcode.CLOSE) {
      closeReceived = true;
      if (frame.payload().size() == 1) {
        throw new WebSocketFrameException(CLOSE_PROTOCOL_ERROR,
            "Malformed close payload length of 1.");
      }
      if (frame.payload().size() != 0) {
        String message = WebSocketProtocol.closeCodeExceptionMessage(frame.closeCode());
        if (message != null) throw new WebSocketFrameException(CLOSE_PROTOCOL_ERROR, message);
      }
    }

    synchronized (deliveryLock) {
      pendingFrames.add(frame);
    }
    deliverPendingFrames();

    if (frame.opcode() == Opcode.CLOSE) {
      replyToClose(frame.closeCode());
    }
  }

  /**
   * Hands queued frames to the listener one at a time, in arrival order. Returns immediately if
   * there is no listener yet or another thread is delivering; that thread picks up frames queued
   * in the meantime before it returns.
   */
  private void deliverPendingFrames() throws IOException {
    while (true) {
      FrameListener listener;
      WebSocketFrame frame;
      synchronized (deliveryLock) {
        if (delivering || this.listener == null || pendingFrames.isEmpty()) return;
        listener = this.listener;
        frame = pendingFrames.poll();
        delivering = true;
      }
      try {
        listener.onFrame(channel, frame);
      } finally {
        synchronized (deliveryLock) {
          delivering = false;
        }
      }
    }
  }

  /** Echoes the peer's close code unless a close frame was already sent. */
  private void replyToClose(int code) throws IOException {
    synchronized (writeLock) {
      if (closeSent) return;
      writeFrame(code != CLOSE_NO_STATUS_CODE
          ? WebSocketFrame.close(code, null)
          : WebSocketFrame.close(0, null));
    }
  }

  /**
   * Reports {@code e} to the peer with a close frame, unless a close frame was already sent. Call
   * this after {@link #onBytes} throws, then close the connection.
   */
  public void fail(ProtocolException e) throws IOException {
    int code = e instanceof WebSocketFrameException
        ? ((WebSocketFrameException) e).closeCode()
        : CLOSE_PROTOCOL_ERROR;
    logger.log(Level.FINE, "Failing " + request, e);
    synchronized (writeLock) {
      if (closeSent) return;
      writeFrame(WebSocketFrame.close(code, closeReason(e.getMessage())));
    }
  }

  /** Returns {@code message} if it fits a close frame beside the status code, or null. */
  private static @Nullable String closeReason(@Nullable String message) {
    if (message == null) return null;
    return ByteString.encodeUtf8(message).size() <= PAYLOAD_BYTE_MAX - 2 ? message : null;
  }

  /** Returns true once close frames have been both sent and received. */
  public boolean isClosed() {
    synchronized (writeLock) {
      return closeSent && closeReceived;
    }
  }

  private void writeFrame(WebSocketFrame frame) throws IOException {
    assert Thread.holdsLock(writeLock);
    if (closeSent) throw new IOException("closed");
    FrameCodec.encode(frame, sink);
    sink.flush();
    if (frame.opcode() == Opcode.CLOSE) {
      closeSent = true;
    }
  }

  final class Channel implements WebSocketChannel {
    @Override public RequestHead request() {
      if (request == null) throw new IllegalStateException("Not upgraded: " + state);
      return request;
    }

    @Override public void setFrameListener(FrameListener listener) throws IOException {
      if (listener == null) throw new NullPointerException("listener == null");
      synchronized (deliveryLock) {
        ConnectionUpgradeCoordinator.this.listener = listener;
      }
      deliverPendingFrames();
    }

    @Override public void send(WebSocketFrame frame) throws IOException {
      if (frame == null) throw new NullPointerException("frame == null");
      State state = ConnectionUpgradeCoordinator.this.state;
      if (state != State.ACCEPTED && state != State.FRAME_MODE) {
        throw new IllegalStateException("Not upgraded: " + state);
      }
      synchronized (writeLock) {
        writeFrame(frame);
      }
    }

    @Override public void close(int code, @Nullable String reason) throws IOException {
      send(WebSocketFrame.close(code, reason));
    }

    @Override public String toString() {
      return "WebSocketChannel{" + request + "}";
    }
  }
}
