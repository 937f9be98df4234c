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
import javax.annotation.Nullable;

/** The request line and header fields of an HTTP/1.1 request, without its body. */
public final class RequestHead {
  private final String method;
  private final String path;
  private final String version;
  private final Headers headers;

  public RequestHead(String method, String path, String version, Headers headers) {
    if (method == null) throw new NullPointerException("method == null");
    if (path == null) throw new NullPointerException("path == null");
    if (version == null) throw new NullPointerException("version == null");
    if (headers == null) throw new NullPointerException("headers == null");
    this.method = method;
    this.path = path;
    this.version = version;
    this.headers = headers;
  }

  /** Returns a GET request for {@code path} with {@code headers}. */
  public static RequestHead get(String path, Headers headers) {
    return new RequestHead("GET", path, "HTTP/1.1", headers);
  }

  /**
   * Parses a request line like {@code GET /chat HTTP/1.1}. Headers are supplied separately since
   * they follow on their own lines.
   */
  public static RequestHead parse(String requestLine, Headers headers) throws ProtocolException {
    int firstSpace = requestLine.indexOf(' ');
    int lastSpace = requestLine.lastIndexOf(' ');
    if (firstSpace <= 0 || lastSpace == firstSpace || lastSpace == requestLine.length() - 1) {
      throw new ProtocolException("Unexpected request line: " + requestLine);
    }
    String version = requestLine.substring(lastSpace + 1);
    if (!version.startsWith("HTTP/")) {
      throw new ProtocolException("Unexpected request line: " + requestLine);
    }
    String path = requestLine.substring(firstSpace + 1, lastSpace);
    if (path.isEmpty() || path.indexOf(' ') != -1) {
      throw new ProtocolException("Unexpected request line: " + requestLine);
    }
    return new RequestHead(requestLine.substring(0, firstSpace), path, version, headers);
  }

  public String method() {
    return method;
  }

  /** The request target, such as {@code /chat}. */
  public String path() {
    return path;
  }

  public String version() {
    return version;
  }

  public Headers headers() {
    return headers;
  }

  public @Nullable String header(String name) {
    return headers.get(name);
  }

  @Override public String toString() {
    return method + " " + path + " " + version;
  }
}
