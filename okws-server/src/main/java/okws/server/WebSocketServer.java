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
package okws.server;

import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ProtocolException;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.net.ServerSocketFactory;
import okio.Buffer;
import okio.BufferedSink;
import okio.BufferedSource;
import okio.Okio;
import okws.ConnectionUpgradeCoordinator;
import okws.Http1UpgradeConnection;
import okws.UpgradeError;
import okws.UpgraderRegistry;
import okws.WebSocketUpgradeException;
import okws.internal.NamedRunnable;
import okws.internal.Util;

/**
 * A blocking WebSocket server. Each accepted socket is served on its own thread: the request head
 * is read, the upgrade is negotiated against an {@link UpgraderRegistry}, and inbound frames are
 * delivered to the activated endpoint until close frames have been exchanged or the peer
 * disconnects.
 *
 * <p>Rejected upgrades are answered with {@code 400 Bad Request} or {@code 404 Not Found} and the
 * socket is closed. Malformed frames are answered with a close frame.
 *
 * <p>Configure the server before calling one of the {@code start} methods. A server can be started
 * once.
 */
public final class WebSocketServer implements Closeable {
  private static final Logger logger = Logger.getLogger(WebSocketServer.class.getName());

  private final UpgraderRegistry registry;
  private final Set<Socket> connections =
      Collections.newSetFromMap(new ConcurrentHashMap<Socket, Boolean>());
  private long maxFrameSize = ConnectionUpgradeCoordinator.DEFAULT_MAX_FRAME_SIZE;
  private ServerSocketFactory serverSocketFactory = ServerSocketFactory.getDefault();

  /** Null until the server is started. */
  private ServerSocket serverSocket;
  private ExecutorService executor;

  public WebSocketServer(UpgraderRegistry registry) {
    if (registry == null) throw new NullPointerException("registry == null");
    this.registry = registry;
  }

  /** Sets the largest inbound frame payload, in bytes. Larger frames fail with close code 1009. */
  public void setMaxFrameSize(long maxFrameSize) {
    if (maxFrameSize <= 0) throw new IllegalArgumentException("maxFrameSize <= 0: " + maxFrameSize);
    this.maxFrameSize = maxFrameSize;
  }

  public synchronized void setServerSocketFactory(ServerSocketFactory serverSocketFactory) {
    if (serverSocketFactory == null) throw new NullPointerException("serverSocketFactory == null");
    checkNotStarted();
    this.serverSocketFactory = serverSocketFactory;
  }

  /** Returns the port connections are accepted on. */
  public synchronized int getPort() {
    checkStarted();
    return serverSocket.getLocalPort();
  }

  public synchronized String getHostName() {
    checkStarted();
    return serverSocket.getInetAddress().getHostName();
  }

  /** Starts listening on a free port of the loopback interface. */
  public void start() throws IOException {
    start(0);
  }

  /** Starts listening on {@code port} of the loopback interface, or a free port if it is 0. */
  public void start(int port) throws IOException {
    start(InetAddress.getByName("localhost"), port);
  }

  public synchronized void start(InetAddress address, int port) throws IOException {
    checkNotStarted();
    ServerSocket socket = serverSocketFactory.createServerSocket();
    socket.setReuseAddress(port != 0);
    socket.bind(new InetSocketAddress(address, port), 50);
    serverSocket = socket;

    executor = Executors.newCachedThreadPool(Util.threadFactory("WebSocketServer", false));
    executor.execute(new AcceptLoop());
  }

  /**
   * Stops accepting connections, closes open connections, and waits up to five seconds for their
   * threads to finish. Does nothing if the server was never started.
   */
  public synchronized void shutdown() throws IOException {
    if (serverSocket == null) return;
    serverSocket.close();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        throw new IOException("Gave up waiting for executor to shut down");
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted waiting for executor to shut down", e);
    }
  }

  @Override public void close() throws IOException {
    shutdown();
  }

  @Override public String toString() {
    return "WebSocketServer[" + (serverSocket != null ? serverSocket.getLocalPort() : "unstarted")
        + "]";
  }

  private void checkStarted() {
    if (serverSocket == null) throw new IllegalStateException("Call start() first");
  }

  private void checkNotStarted() {
    if (serverSocket != null) throw new IllegalStateException("Already started");
  }

  /** Accepts sockets until the server socket is closed, then releases every connection. */
  private final class AcceptLoop extends NamedRunnable {
    AcceptLoop() {
      super("WebSocketServer %s", serverSocket.getLocalPort());
    }

    @Override protected void execute() {
      logger.info(WebSocketServer.this + " accepting connections");
      try {
        while (true) {
          Socket socket = serverSocket.accept();
          connections.add(socket);
          executor.execute(new ConnectionTask(socket));
        }
      } catch (SocketException e) {
        logger.info(WebSocketServer.this + " stopped accepting connections: " + e.getMessage());
      } catch (Throwable e) {
        logger.log(Level.WARNING, WebSocketServer.this + " failed unexpectedly", e);
      } finally {
        Util.closeQuietly(serverSocket);
        for (Socket socket : connections) {
          Util.closeQuietly(socket);
        }
        executor.shutdown();
      }
    }
  }

  private final class ConnectionTask extends NamedRunnable {
    private final Socket socket;

    ConnectionTask(Socket socket) {
      super("WebSocketServer %s", socket.getRemoteSocketAddress());
      this.socket = socket;
    }

    @Override protected void execute() {
      try {
        processConnection(socket);
      } catch (IOException e) {
        logger.info(
            WebSocketServer.this + " connection from " + socket.getInetAddress() + " failed: " + e);
      } catch (Exception e) {
        logger.log(Level.SEVERE,
            WebSocketServer.this + " connection from " + socket.getInetAddress() + " crashed", e);
      } finally {
        Util.closeQuietly(socket);
        connections.remove(socket);
      }
    }
  }

  private void processConnection(Socket socket) throws IOException {
    BufferedSource source = Okio.buffer(Okio.source(socket));
    BufferedSink sink = Okio.buffer(Okio.sink(socket));
    ConnectionUpgradeCoordinator coordinator =
        new ConnectionUpgradeCoordinator(registry, sink, maxFrameSize);
    Http1UpgradeConnection connection = new Http1UpgradeConnection(coordinator);

    Buffer buffer = new Buffer();
    try {
      while (!coordinator.isClosed()) {
        if (source.read(buffer, 8192) == -1) {
          if (coordinator.state() == ConnectionUpgradeCoordinator.State.AWAITING_REQUEST) {
            logger.warning(WebSocketServer.this + " connection from " + socket.getInetAddress()
                + " didn't make a request");
          }
          break;
        }
        connection.onBytes(buffer);
      }
    } catch (WebSocketUpgradeException e) {
      logger.info(WebSocketServer.this + " rejected upgrade: " + e.getMessage());
      writeErrorResponse(sink, e.error() == UpgradeError.UNSUPPORTED_WEBSOCKET_TARGET
          ? "404 Not Found"
          : "400 Bad Request");
    } catch (ProtocolException e) {
      ConnectionUpgradeCoordinator.State state = coordinator.state();
      if (state == ConnectionUpgradeCoordinator.State.FRAME_MODE) {
        logger.info(WebSocketServer.this + " failing WebSocket: " + e.getMessage());
        coordinator.fail(e);
      } else if (state == ConnectionUpgradeCoordinator.State.AWAITING_REQUEST) {
        logger.info(WebSocketServer.this + " malformed request: " + e.getMessage());
        writeErrorResponse(sink, "400 Bad Request");
      } else {
        throw e;
      }
    } finally {
      Util.closeQuietly(source);
      Util.closeQuietly(sink);
    }
  }

  private void writeErrorResponse(BufferedSink sink, String status) throws IOException {
    sink.writeUtf8("HTTP/1.1 " + status + "\r\n");
    sink.writeUtf8("Content-Length: 0\r\n");
    sink.writeUtf8("Connection: close\r\n");
    sink.writeUtf8("\r\n");
    sink.flush();
  }
}
