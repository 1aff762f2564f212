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

package com.google.examples.meshdestination.cluster;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableRangeSet;
import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import java.util.List;
import java.util.function.Function;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses port lists such as {@code 25,3306,4000-4100,http}, where each comma separated item is a
 * port number, an inclusive range of port numbers, or the name of a container port.
 */
public final class PortRanges {
  private static final Logger LOG = LoggerFactory.getLogger(PortRanges.class);

  private static final int MAX_PORT = 65535;

  private PortRanges() {}

  /**
   * Parses a list of port numbers and ranges.
   *
   * @throws IllegalArgumentException if an item is not a valid port or range
   */
  @NotNull
  public static ImmutableRangeSet<Integer> parse(@NotNull String ports) {
    RangeSet<Integer> parsed = TreeRangeSet.create();
    for (String item : items(ports)) {
      parsed.add(parseItem(item, name -> null));
    }
    return ImmutableRangeSet.copyOf(parsed);
  }

  /**
   * Parses a list of ports, ranges and port names, skipping invalid items.
   *
   * @param namedPorts looks up a port number by name, returns null for unknown names
   */
  @NotNull
  public static ImmutableRangeSet<Integer> parseLenient(
      @NotNull String ports, @NotNull Function<String, Integer> namedPorts) {
    RangeSet<Integer> parsed = TreeRangeSet.create();
    for (String item : items(ports)) {
      try {
        parsed.add(parseItem(item, namedPorts));
      } catch (IllegalArgumentException e) {
        LOG.warn("Skipping invalid port item in {}: {}", ports, e.getMessage());
      }
    }
    return ImmutableRangeSet.copyOf(parsed);
  }

  @NotNull
  private static List<String> items(@NotNull String ports) {
    return Splitter.on(',').trimResults().omitEmptyStrings().splitToList(ports);
  }

  @NotNull
  private static Range<Integer> parseItem(
      @NotNull String item, @NotNull Function<String, Integer> namedPorts) {
    int dash = item.indexOf('-');
    if (dash > 0) {
      int lower = port(item.substring(0, dash));
      int upper = port(item.substring(dash + 1));
      if (lower > upper) {
        throw new IllegalArgumentException("invalid port range " + item);
      }
      return Range.closed(lower, upper);
    }
    if (!item.isEmpty() && Character.isDigit(item.charAt(0))) {
      return Range.singleton(port(item));
    }
    Integer named = namedPorts.apply(item);
    if (named == null) {
      throw new IllegalArgumentException("unknown port " + item);
    }
    return Range.singleton(named);
  }

  private static int port(@NotNull String value) {
    int port;
    try {
      port = Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("invalid port " + value, e);
    }
    if (port < 1 || port > MAX_PORT) {
      throw new IllegalArgumentException("port out of range " + value);
    }
    return port;
  }
}
