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

import static org.junit.jupiter.api.Assertions.*;

import com.google.examples.meshdestination.api.v1.GetDestination;
import com.google.examples.meshdestination.api.v1.NoEndpoints;
import com.google.examples.meshdestination.api.v1.Update;
import org.junit.jupiter.api.Test;

public class MessagePrinterTest {

  @Test
  void printsCompactJson() {
    Update update =
        Update.newBuilder().setNoEndpoints(NoEndpoints.newBuilder().setExists(true)).build();
    String printed = new MessagePrinter().print(update);
    assertEquals("{\"noEndpoints\":{\"exists\":true}}", printed);
  }

  @Test
  void cutsOffLongMessages() {
    GetDestination request =
        GetDestination.newBuilder().setScheme("k8s").setPath("x".repeat(100)).build();
    String printed = new MessagePrinter(20).print(request);
    assertTrue(printed.startsWith("{\"scheme\":\"k8s\",\"pa"), printed);
    assertTrue(printed.endsWith("characters)"), printed);
  }

  @Test
  void otherObjectsUseToString() {
    assertEquals("null", new MessagePrinter().print(null));
    assertEquals("42", new MessagePrinter().print(42));
  }
}
