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

import com.google.common.io.ByteStreams;
import com.google.examples.meshdestination.api.v1.ApiError;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.Parser;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.jetbrains.annotations.NotNull;

/**
 * Protobuf over HTTP, as used by internal APIs.
 *
 * <p>Every message is framed as a 4-byte little-endian unsigned length, followed by exactly that
 * many bytes of serialized protobuf. A response with the {@value #ERROR_HEADER} header carries a
 * single framed {@link ApiError} as its body.
 */
public final class ProtoHttp {

  /** Response header that marks an application-level error. */
  public static final String ERROR_HEADER = "linkerd-error";

  /** Content type of framed protobuf bodies. */
  public static final String CONTENT_TYPE = "application/octet-stream";

  static final int LENGTH_PREFIX_BYTES = 4;

  private ProtoHttp() {}

  /** Frames a message. */
  @NotNull
  public static byte[] serializeAsPayload(@NotNull Message message) {
    return frame(message.toByteArray());
  }

  /** Frames raw payload bytes. */
  @NotNull
  public static byte[] frame(@NotNull byte[] payload) {
    return ByteBuffer.allocate(LENGTH_PREFIX_BYTES + payload.length)
        .order(ByteOrder.LITTLE_ENDIAN)
        .putInt(payload.length)
        .put(payload)
        .array();
  }

  /** Frames an {@link ApiError} with the given message, for the body of an error response. */
  @NotNull
  public static byte[] errorPayload(@NotNull String error) {
    return serializeAsPayload(ApiError.newBuilder().setError(error).build());
  }

  /**
   * Reads exactly one frame.
   *
   * @return the payload, without the length prefix
   * @throws ProtoHttpException if the stream ends before the full length prefix or the full payload
   *     could be read
   */
  @NotNull
  public static byte[] readPayload(@NotNull InputStream in) throws IOException {
    byte[] prefix = new byte[LENGTH_PREFIX_BYTES];
    int prefixBytes = ByteStreams.read(in, prefix, 0, LENGTH_PREFIX_BYTES);
    if (prefixBytes < LENGTH_PREFIX_BYTES) {
      throw new ProtoHttpException(
          "Expected "
              + LENGTH_PREFIX_BYTES
              + " bytes of message length, got "
              + prefixBytes);
    }
    long length =
        Integer.toUnsignedLong(ByteBuffer.wrap(prefix).order(ByteOrder.LITTLE_ENDIAN).getInt());
    if (length > Integer.MAX_VALUE - 8) {
      throw new ProtoHttpException("Message length " + length + " exceeds the maximum array size");
    }
    byte[] payload = ByteStreams.toByteArray(ByteStreams.limit(in, length));
    if (payload.length < length) {
      throw new ProtoHttpException(
          "Expected " + length + " bytes of message payload, got " + payload.length);
    }
    return payload;
  }

  /**
   * Reads exactly one frame and parses it.
   *
   * @throws ProtoHttpException if the frame is truncated or the payload is not a valid message
   */
  @NotNull
  public static <T extends Message> T readMessage(
      @NotNull InputStream in, @NotNull Parser<T> parser) throws IOException {
    byte[] payload = readPayload(in);
    try {
      return parser.parseFrom(payload);
    } catch (InvalidProtocolBufferException e) {
      throw new ProtoHttpException("Could not parse message payload", e);
    }
  }

  /**
   * Checks a response for errors.
   *
   * <p>If the {@value #ERROR_HEADER} header is present, the body is read as a framed {@link
   * ApiError}, and its message is thrown. Otherwise any status other than 200 is a transport
   * error. The body is left unread on success.
   *
   * @throws ProtoHttpException if the response reports an error
   */
  public static void checkIfResponseHasError(@NotNull Response response) throws IOException {
    if (response.header(ERROR_HEADER) != null) {
      ResponseBody body = response.body();
      if (body == null) {
        throw new ProtoHttpException(
            response.code(), "Response has " + ERROR_HEADER + " header but no body");
      }
      ApiError apiError;
      try (InputStream in = body.byteStream()) {
        apiError = readMessage(in, ApiError.parser());
      } catch (ProtoHttpException e) {
        throw new ProtoHttpException(
            response.code(),
            "Response has " + ERROR_HEADER + " header, but its body is not an error message",
            e);
      }
      throw new ProtoHttpException(response.code(), apiError.getError());
    }
    if (response.code() != 200) {
      throw new ProtoHttpException(
          response.code(),
          "Unexpected API response: " + response.code() + " " + response.message());
    }
  }
}
