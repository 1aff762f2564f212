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

package com.google.examples.meshdestination.logging;

import com.google.examples.meshdestination.api.v1.GetDestination;
import com.google.examples.meshdestination.api.v1.Update;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.MessageOrBuilder;
import com.google.protobuf.TextFormat;
import com.google.protobuf.util.JsonFormat;
import com.google.protobuf.util.JsonFormat.TypeRegistry;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns Destination API messages into single-line strings for debug logs.
 *
 * <p>Messages are printed as compact JSON, and cut off after a maximum length, since an update for
 * a large Service can list thousands of addresses.
 */
public class MessagePrinter {

  private static final Logger LOG = LoggerFactory.getLogger(MessagePrinter.class);

  static final int DEFAULT_MAX_LENGTH = 2048;

  private final JsonFormat.Printer jsonPrinter;
  private final int maxLength;

  /** Creates a printer that cuts off messages after {@value #DEFAULT_MAX_LENGTH} characters. */
  public MessagePrinter() {
    this(DEFAULT_MAX_LENGTH);
  }

  MessagePrinter(int maxLength) {
    this.jsonPrinter =
        JsonFormat.printer()
            .usingTypeRegistry(
                TypeRegistry.newBuilder()
                    .add(GetDestination.getDescriptor())
                    .add(Update.getDescriptor())
                    .build())
            .omittingInsignificantWhitespace();
    this.maxLength = maxLength;
  }

  /**
   * Create a string representation of a message.
   *
   * @param msg the message, normally a {@code com.google.protobuf.MessageOrBuilder}
   * @return the message as JSON, or as text if it cannot be converted to JSON
   */
  @NotNull
  public String print(Object msg) {
    if (!(msg instanceof MessageOrBuilder)) {
      return String.valueOf(msg);
    }
    MessageOrBuilder message = (MessageOrBuilder) msg;
    String printed;
    try {
      printed = jsonPrinter.print(message);
    } catch (InvalidProtocolBufferException e) {
      LOG.warn("Could not convert message to JSON, using text printer instead: {}", e.getMessage());
      printed = TextFormat.shortDebugString(message);
    }
    if (printed.length() <= maxLength) {
      return printed;
    }
    return printed.substring(0, maxLength) + "... (" + printed.length() + " characters)";
  }
}
