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
package okws.internal;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ThreadFactory;

/** Helpers shared by the library and the server. */
public final class Util {
  public static final String[] EMPTY_STRING_ARRAY = new String[0];

  private Util() {
  }

  /**
   * Closes {@code closeable} during cleanup, when a failure to close has nowhere useful to go.
   * Null is ignored and unchecked exceptions still propagate.
   */
  public static void closeQuietly(Closeable closeable) {
    if (closeable == null) return;
    try {
      closeable.close();
    } catch (RuntimeException e) {
      throw e;
    } catch (Exception ignored) {
    }
  }

  public static <T> List<T> immutableList(List<T> list) {
    return Collections.unmodifiableList(new ArrayList<>(list));
  }

  /** Returns a factory whose threads are all named {@code name}. */
  public static ThreadFactory threadFactory(String name, boolean daemon) {
    return runnable -> {
      Thread thread = new Thread(runnable, name);
      thread.setDaemon(daemon);
      return thread;
    };
  }

  public static String format(String format, Object... args) {
    return String.format(Locale.US, format, args);
  }
}
