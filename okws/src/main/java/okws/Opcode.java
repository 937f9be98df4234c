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

/**
 * Frame opcodes defined by <a href="https://tools.ietf.org/html/rfc6455#section-5.2">RFC 6455</a>.
 * Values 0x3-0x7 and 0xb-0xf are reserved for further frame types and have no constant here.
 */
public enum Opcode {
  CONTINUATION(0x0),
  TEXT(0x1),
  BINARY(0x2),
  CLOSE(0x8),
  PING(0x9),
  PONG(0xa);

  private final int code;

  Opcode(int code) {
    this.code = code;
  }

  /** The 4-bit value of this opcode on the wire. */
  public int code() {
    return code;
  }

  /** Returns true for close, ping and pong. */
  public boolean isControl() {
    return (code & 0b00001000) != 0;
  }

  /** Returns the opcode for {@code code}, or null if it is reserved. */
  public static @Nullable Opcode get(int code) {
    for (Opcode opcode : values()) {
      if (opcode.code == code) return opcode;
    }
    return null;
  }
}
