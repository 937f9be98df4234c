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

/** Why an upgrade request was turned down. */
public enum UpgradeError {
  /**
   * The {@code Connection}, {@code Upgrade}, {@code Sec-WebSocket-Version} or {@code
   * Sec-WebSocket-Key} header was missing or had an unexpected value.
   */
  INVALID_UPGRADE_HEADER,

  /** The request was well-formed but no registered upgrader accepted it. */
  UNSUPPORTED_WEBSOCKET_TARGET
}
