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
 * Thrown when an upgrade request is rejected. Nothing has been written to the connection when this
 * is thrown; the caller decides whether to answer with an HTTP error or to close it.
 */
public final class WebSocketUpgradeException extends ProtocolException {
  public final UpgradeError error;

  public WebSocketUpgradeException(UpgradeError error, String message) {
    super(message);
    if (error == null) throw new NullPointerException("error == null");
    this.error = error;
  }

  public UpgradeError error() {
    return error;
  }
}
