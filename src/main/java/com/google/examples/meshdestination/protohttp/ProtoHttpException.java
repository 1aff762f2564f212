// Copyright 2023 Google LLC
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//      http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.

package com.google.examples.meshdestination.protohttp;

import java.io.IOException;

/**
 * A length-prefixed protobuf exchange failed, either because the framing was violated, the
 * payload could not be parsed, or the server reported an error.
 */
public class ProtoHttpException extends IOException {

  /** Status code used when the failure is not tied to an HTTP response. */
  public static final int NO_STATUS = -1;

  private final int statusCode;

  public ProtoHttpException(String message) {
    this(NO_STATUS, message, null);
  }

  public ProtoHttpException(String message, Throwable cause) {
    this(NO_STATUS, message, cause);
  }

  public ProtoHttpException(int statusCode, String message) {
    this(statusCode, message, null);
  }

  public ProtoHttpException(int statusCode, String message, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /** HTTP status code of the failed response, or {@link #NO_STATUS}. */
  public int getStatusCode() {
    return statusCode;
  }
}
