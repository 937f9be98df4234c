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

import java.util.ArrayList;
import java.util.List;
import okws.internal.Util;
import okws.internal.ws.HandshakeValidator;

/**
 * An ordered list of {@linkplain WebSocketUpgrader upgraders}. The first upgrader whose selector
 * accepts a request wins; upgraders after it are not consulted.
 *
 * <p>Registries are immutable once built and may be shared by all connections of a server.
 */
public final class UpgraderRegistry {
  private final List<WebSocketUpgrader> upgraders;

  UpgraderRegistry(Builder builder) {
    this.upgraders = Util.immutableList(builder.upgraders);
  }

  /**
   * Validates {@code request} and selects the upgrader that accepts it.
   *
   * <p>A request with missing or invalid handshake headers is rejected with {@link
   * UpgradeError#INVALID_UPGRADE_HEADER} before any selector runs. A valid request that no
   * selector accepts is rejected with {@link UpgradeError#UNSUPPORTED_WEBSOCKET_TARGET}.
   */
  public HandshakeResult select(RequestHead request) {
    String acceptKey;
    try {
      acceptKey = HandshakeValidator.validate(request.headers());
    } catch (WebSocketUpgradeException e) {
      return HandshakeResult.rejected(e.error(), e.getMessage());
    }

    for (WebSocketUpgrader upgrader : upgraders) {
      Headers extraHeaders = upgrader.selector.shouldUpgrade(request);
      if (extraHeaders != null) {
        Headers responseHeaders = HandshakeValidator.buildResponseHeaders(acceptKey, extraHeaders);
        return HandshakeResult.accepted(responseHeaders, upgrader);
      }
    }

    return HandshakeResult.rejected(UpgradeError.UNSUPPORTED_WEBSOCKET_TARGET,
        "No upgrader accepted " + request);
  }

  public static final class Builder {
    final List<WebSocketUpgrader> upgraders = new ArrayList<>();

    /** Registers {@code upgrader} after all previously added upgraders. */
    public Builder add(WebSocketUpgrader upgrader) {
      if (upgrader == null) throw new NullPointerException("upgrader == null");
      upgraders.add(upgrader);
      return this;
    }

    public Builder add(WebSocketUpgrader.Selector selector, WebSocketUpgrader.Activator activator) {
      return add(WebSocketUpgrader.create(selector, activator));
    }

    public UpgraderRegistry build() {
      return new UpgraderRegistry(this);
    }
  }
}
