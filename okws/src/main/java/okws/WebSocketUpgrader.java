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
 * An endpoint that may accept WebSocket upgrades. Each upgrader pairs a {@link Selector}, which
 * decides whether to accept a request, with an {@link Activator}, which attaches frame-level
 * behavior to the connection once the request has been accepted.
 *
 * <p>Instances are immutable and may be shared by all connections of a server.
 */
public final class WebSocketUpgrader {
  public interface Selector {
    /**
     * Returns the extra headers to send with the 101 response to accept {@code request}, or null
     * to decline it. Implementations must not block or have side effects.
     */
    @Nullable Headers shouldUpgrade(RequestHead request);
  }

  public interface Activator {
    /**
     * Called once, after the 101 response has been written and before any frame is decoded.
     * Blocking work such as authentication belongs here rather than in the selector.
     */
    void activate(WebSocketChannel channel) throws IOException;
  }

  final Selector selector;
  final Activator activator;

  private WebSocketUpgrader(Selector selector, Activator activator) {
    this.selector = selector;
    this.activator = activator;
  }

  public static WebSocketUpgrader create(Selector selector, Activator activator) {
    if (selector == null) throw new NullPointerException("selector == null");
    if (activator == null) throw new NullPointerException("activator == null");
    return new WebSocketUpgrader(selector, activator);
  }

  /** Returns an upgrader that accepts requests for exactly {@code path}, adding no headers. */
  public static WebSocketUpgrader forPath(final String path, Activator activator) {
    if (path == null) throw new NullPointerException("path == null");
    return create(new Selector() {
      @Override public @Nullable Headers shouldUpgrade(RequestHead request) {
        return path.equals(request.path()) ? Headers.EMPTY : null;
      }
    }, activator);
  }
}
