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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import okio.Buffer;
import okio.ByteString;
import okws.internal.ws.FrameCodec;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.fail;

public final class ConnectionUpgradeCoordinatorTest {
  private static final String SWITCHING_PROTOCOLS = ""
      + "HTTP/1.1 101 Switching Protocols\r\n"
      + "upgrade: websocket\r\n"
      + "connection: upgrade\r\n"
      + "sec-websocket-accept: OfS0wDaT5NoxF2gqm7Zj2YtetzM=\r\n"
      + "\r\n";
  private static final ByteString MASK_KEY = ByteString.decodeHex("37fa213d");

  private final Buffer sink = new Buffer();
  private final FrameRecorder recorder = new FrameRecorder("server");
  private final List<WebSocketChannel> activated = new ArrayList<>();

  private ConnectionUpgradeCoordinator coordinator(long maxFrameSize) {
    UpgraderRegistry registry = new UpgraderRegistry.Builder()
        .add(WebSocketUpgrader.forPath("/", channel -> {
          activated.add(channel);
          channel.setFrameListener(recorder);
        }))
        .build();
    return new ConnectionUpgradeCoordinator(registry, sink, maxFrameSize);
  }

  private ConnectionUpgradeCoordinator upgraded() throws IOException {
    ConnectionUpgradeCoordinator coordinator =
        coordinator(ConnectionUpgradeCoordinator.DEFAULT_MAX_FRAME_SIZE);
    coordinator.upgrade(UpgraderRegistryTest.request("any"), new Buffer());
    assertThat(sink.readUtf8(SWITCHING_PROTOCOLS.length())).isEqualTo(SWITCHING_PROTOCOLS);
    return coordinator;
  }

  @Test public void acceptWritesSwitchingProtocolsBeforeActivating() throws IOException {
    final List<String> writtenBeforeActivation = new ArrayList<>();
    final List<ConnectionUpgradeCoordinator.State> stateDuringActivation = new ArrayList<>();
    final ConnectionUpgradeCoordinator[] holder = new ConnectionUpgradeCoordinator[1];
    UpgraderRegistry registry = new UpgraderRegistry.Builder()
        .add(request -> Headers.EMPTY, channel -> {
          writtenBeforeActivation.add(sink.snapshot().utf8());
          stateDuringActivation.add(holder[0].state());
        })
        .build();
    ConnectionUpgradeCoordinator coordinator = new ConnectionUpgradeCoordinator(registry, sink);
    holder[0] = coordinator;

    coordinator.upgrade(UpgraderRegistryTest.request("any"), new Buffer());

    assertThat(writtenBeforeActivation).containsExactly(SWITCHING_PROTOCOLS);
    assertThat(stateDuringActivation).containsExactly(ConnectionUpgradeCoordinator.State.ACCEPTED);
    assertThat(coordinator.state()).isEqualTo(ConnectionUpgradeCoordinator.State.FRAME_MODE);
    assertThat(coordinator.request().headers().get("Target")).isEqualTo("any");
  }

  @Test public void rejectionWritesNothing() throws IOException {
    ConnectionUpgradeCoordinator coordinator =
        coordinator(ConnectionUpgradeCoordinator.DEFAULT_MAX_FRAME_SIZE);
    try {
      coordinator.upgrade(RequestHead.get("/", Headers.of("Host", "localhost")), new Buffer());
      fail();
    } catch (WebSocketUpgradeException e) {
      assertThat(e.error()).isEqualTo(UpgradeError.INVALID_UPGRADE_HEADER);
    }
    assertThat(sink.size()).isEqualTo(0L);
    assertThat(activated).isEmpty();
    assertThat(coordinator.state()).isEqualTo(ConnectionUpgradeCoordinator.State.REJECTED);
    assertThat(coordinator.request()).isNull();
  }

  @Test public void unsupportedTargetWritesNothing() throws IOException {
    ConnectionUpgradeCoordinator coordinator =
        coordinator(ConnectionUpgradeCoordinator.DEFAULT_MAX_FRAME_SIZE);
    RequestHead request = RequestHead.get("/other", UpgraderRegistryTest.request("any").headers());
    try {
      coordinator.upgrade(request, new Buffer());
      fail();
    } catch (WebSocketUpgradeException e) {
      assertThat(e.error()).isEqualTo(UpgradeError.UNSUPPORTED_WEBSOCKET_TARGET);
    }
    assertThat(sink.size()).isEqualTo(0L);
    assertThat(activated).isEmpty();
  }

  @Test public void upgradeOnlyOnce() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    try {
      coordinator.upgrade(UpgraderRegistryTest.request("any"), new Buffer());
      fail();
    } catch (IllegalStateException e) {
      assertThat(e.getMessage()).isEqualTo("Upgrade already attempted: FRAME_MODE");
    }
    assertThat(activated).hasSize(1);
    assertThat(sink.size()).isEqualTo(0L);
  }

  @Test public void noSecondAttemptAfterRejection() throws IOException {
    ConnectionUpgradeCoordinator coordinator =
        coordinator(ConnectionUpgradeCoordinator.DEFAULT_MAX_FRAME_SIZE);
    try {
      coordinator.upgrade(RequestHead.get("/", Headers.EMPTY), new Buffer());
      fail();
    } catch (WebSocketUpgradeException expected) {
    }
    try {
      coordinator.upgrade(UpgraderRegistryTest.request("any"), new Buffer());
      fail();
    } catch (IllegalStateException e) {
      assertThat(e.getMessage()).isEqualTo("Upgrade already attempted: REJECTED");
    }
  }

  @Test public void bytesBeforeUpgradeAreRejected() throws IOException {
    ConnectionUpgradeCoordinator coordinator =
        coordinator(ConnectionUpgradeCoordinator.DEFAULT_MAX_FRAME_SIZE);
    try {
      coordinator.onBytes(new Buffer().write(FrameCodec.encode(WebSocketFrame.text("Hello"))));
      fail();
    } catch (IllegalStateException e) {
      assertThat(e.getMessage()).isEqualTo("Not upgraded: AWAITING_REQUEST");
    }
  }

  @Test public void bufferedBytesAreDecodedAfterActivation() throws IOException {
    ConnectionUpgradeCoordinator coordinator =
        coordinator(ConnectionUpgradeCoordinator.DEFAULT_MAX_FRAME_SIZE);
    Buffer leftover = new Buffer()
        .write(FrameCodec.encode(WebSocketFrame.text("Hello").masked(MASK_KEY)))
        .write(FrameCodec.encode(WebSocketFrame.binary(ByteString.encodeUtf8("World"))));

    coordinator.upgrade(UpgraderRegistryTest.request("any"), leftover);

    assertThat(leftover.size()).isEqualTo(0L);
    recorder.assertTextFrame("Hello");
    recorder.assertBinaryFrame(ByteString.encodeUtf8("World"));
    recorder.assertExhausted();
  }

  @Test public void framesBeforeListenerAreQueued() throws IOException {
    final List<WebSocketChannel> channels = new ArrayList<>();
    UpgraderRegistry registry = new UpgraderRegistry.Builder()
        .add(request -> Headers.EMPTY, channel -> channels.add(channel))
        .build();
    ConnectionUpgradeCoordinator coordinator = new ConnectionUpgradeCoordinator(registry, sink);
    Buffer leftover = new Buffer().write(FrameCodec.encode(WebSocketFrame.text("early")));

    coordinator.upgrade(UpgraderRegistryTest.request("any"), leftover);
    coordinator.onBytes(new Buffer().write(FrameCodec.encode(WebSocketFrame.text("late"))));
    recorder.assertExhausted();

    channels.get(0).setFrameListener(recorder);
    recorder.assertTextFrame("early");
    recorder.assertTextFrame("late");
    recorder.assertExhausted();
  }

  @Test public void listenerInstalledFromAnotherThreadKeepsArrivalOrder() throws Exception {
    final CountDownLatch deliveringFirst = new CountDownLatch(1);
    final CountDownLatch secondQueued = new CountDownLatch(1);
    final List<String> delivered = Collections.synchronizedList(new ArrayList<String>());
    final FrameListener listener = (channel, frame) -> {
      String text = frame.payload().utf8();
      if (text.equals("A")) {
        deliveringFirst.countDown();
        try {
          secondQueued.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
          throw new AssertionError(e);
        }
      }
      delivered.add(text + "@" + Thread.currentThread().getName());
    };
    final List<Thread> installers = new ArrayList<>();
    UpgraderRegistry registry = new UpgraderRegistry.Builder()
        .add(request -> Headers.EMPTY, channel -> installers.add(new Thread(() -> {
          try {
            channel.setFrameListener(listener);
          } catch (IOException e) {
            throw new AssertionError(e);
          }
        }, "installer")))
        .build();
    ConnectionUpgradeCoordinator coordinator = new ConnectionUpgradeCoordinator(registry, sink);
    coordinator.upgrade(UpgraderRegistryTest.request("any"),
        new Buffer().write(FrameCodec.encode(WebSocketFrame.text("A"))));

    Thread installer = installers.get(0);
    installer.start();
    assertThat(deliveringFirst.await(5, TimeUnit.SECONDS)).isTrue();

    coordinator.onBytes(new Buffer().write(FrameCodec.encode(WebSocketFrame.text("B"))));
    assertThat(delivered).isEmpty();

    secondQueued.countDown();
    installer.join(5_000);
    assertThat(delivered).containsExactly("A@installer", "B@installer");
  }

  @Test public void partialFrameIsRetained() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    Buffer frame = new Buffer().write(
        FrameCodec.encode(WebSocketFrame.text("Hello").masked(MASK_KEY)));

    Buffer head = new Buffer();
    head.write(frame, 3);
    coordinator.onBytes(head);
    recorder.assertExhausted();

    coordinator.onBytes(frame);
    recorder.assertTextFrame("Hello");
  }

  @Test public void channelSendsFrames() throws IOException {
    upgraded();
    activated.get(0).send(WebSocketFrame.text("Hello"));
    assertThat(sink.readByteString().hex()).isEqualTo("810548656c6c6f");
  }

  @Test public void closeIsEchoed() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    coordinator.onBytes(new Buffer().write(
        FrameCodec.encode(WebSocketFrame.close(1000, "Bye").masked(MASK_KEY))));

    recorder.assertClose(1000, "Bye");
    assertThat(sink.readByteString().hex()).isEqualTo("880203e8");
    assertThat(coordinator.isClosed()).isTrue();
  }

  @Test public void emptyCloseIsEchoedEmpty() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    coordinator.onBytes(new Buffer().write(ByteString.decodeHex("8800")));

    recorder.assertClose(1005, "");
    assertThat(sink.readByteString().hex()).isEqualTo("8800");
    assertThat(coordinator.isClosed()).isTrue();
  }

  @Test public void closeAfterLocalCloseIsNotEchoed() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    activated.get(0).close(1001, "Going away");
    assertThat(coordinator.isClosed()).isFalse();
    sink.clear();

    coordinator.onBytes(new Buffer().write(
        FrameCodec.encode(WebSocketFrame.close(1000, null).masked(MASK_KEY))));
    recorder.assertClose(1000, "");
    assertThat(sink.size()).isEqualTo(0L);
    assertThat(coordinator.isClosed()).isTrue();
  }

  @Test public void sendAfterCloseFails() throws IOException {
    upgraded();
    WebSocketChannel channel = activated.get(0);
    channel.close(1000, null);
    try {
      channel.send(WebSocketFrame.text("Hello"));
      fail();
    } catch (IOException e) {
      assertThat(e.getMessage()).isEqualTo("closed");
    }
  }

  @Test public void frameAfterCloseIsProtocolError() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    Buffer bytes = new Buffer()
        .write(ByteString.decodeHex("8800"))
        .write(FrameCodec.encode(WebSocketFrame.text("Hello")));
    try {
      coordinator.onBytes(bytes);
      fail();
    } catch (WebSocketFrameException e) {
      assertThat(e.closeCode()).isEqualTo(1002);
      assertThat(e.getMessage()).isEqualTo("Unexpected TEXT frame after close");
    }
    recorder.assertClose(1005, "");
    recorder.assertExhausted();
  }

  @Test public void reservedCloseCodeIsProtocolError() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    try {
      coordinator.onBytes(new Buffer().write(ByteString.decodeHex("880203ed")));
      fail();
    } catch (WebSocketFrameException e) {
      assertThat(e.closeCode()).isEqualTo(1002);
      assertThat(e.getMessage()).isEqualTo("Code 1005 is reserved and may not be used.");
    }
    recorder.assertExhausted();
  }

  @Test public void oneByteClosePayloadIsProtocolError() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    try {
      coordinator.onBytes(new Buffer().write(ByteString.decodeHex("880103")));
      fail();
    } catch (WebSocketFrameException e) {
      assertThat(e.closeCode()).isEqualTo(1002);
      assertThat(e.getMessage()).isEqualTo("Malformed close payload length of 1.");
    }
  }

  @Test public void oversizedFrameFailsWithMessageTooBig() throws IOException {
    ConnectionUpgradeCoordinator coordinator = coordinator(10);
    coordinator.upgrade(UpgraderRegistryTest.request("any"), new Buffer());
    sink.clear();

    try {
      coordinator.onBytes(new Buffer().write(
          FrameCodec.encode(WebSocketFrame.text("Hello World"))));
      fail();
    } catch (WebSocketFrameException e) {
      assertThat(e.closeCode()).isEqualTo(1009);
      coordinator.fail(e);
    }

    WebSocketFrame close = FrameCodec.readFrame(sink, Long.MAX_VALUE);
    assertThat(close.closeCode()).isEqualTo(1009);
    assertThat(close.closeReason()).isEqualTo("Frame length 11 > 10");
    recorder.assertExhausted();
  }

  @Test public void failWithPlainProtocolExceptionUsesProtocolError() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    coordinator.fail(new ProtocolException("Bad"));

    WebSocketFrame close = FrameCodec.readFrame(sink, Long.MAX_VALUE);
    assertThat(close.closeCode()).isEqualTo(1002);
    assertThat(close.closeReason()).isEqualTo("Bad");
  }

  @Test public void failOmitsReasonThatDoesNotFit() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    StringBuilder message = new StringBuilder();
    for (int i = 0; i < 124; i++) message.append('x');
    coordinator.fail(new WebSocketFrameException(1002, message.toString()));

    assertThat(sink.readByteString().hex()).isEqualTo("880203ea");
  }

  @Test public void failAfterCloseSentWritesNothing() throws IOException {
    ConnectionUpgradeCoordinator coordinator = upgraded();
    activated.get(0).close(1000, null);
    sink.clear();

    coordinator.fail(new ProtocolException("Bad"));
    assertThat(sink.size()).isEqualTo(0L);
  }
}
