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

package com.google.examples.meshdestination.endpoints;

import com.google.common.base.Splitter;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * A Kubernetes Service, or one instance of a headless Service, named by its cluster DNS name.
 *
 * <p>Accepted forms, where {@code zone} is the cluster DNS domain, e.g., {@code cluster.local}:
 *
 * <ul>
 *   <li><code>[name].[namespace].svc.[zone]</code> and <code>[name].[namespace].svc</code>
 *   <li><code>[instance].[name].[namespace].svc.[zone]</code> and <code>
 *       [instance].[name].[namespace].svc</code>, where {@code instance} is the hostname of a pod
 *       behind a headless Service
 * </ul>
 *
 * <p>A trailing dot is allowed.
 *
 * @param namespace Kubernetes Namespace of the Service
 * @param name Kubernetes Service name
 * @param instance pod hostname, only set for instance names
 */
public record ServiceName(
    @NotNull String namespace, @NotNull String name, @Nullable String instance) {

  private static final Pattern DNS_LABEL_CHARACTERS = Pattern.compile("^[a-zA-Z0-9_-]{1,63}$");
  private static final Pattern CONTAINS_ALPHA = Pattern.compile("[a-zA-Z]");
  private static final Splitter DOT = Splitter.on('.');

  /**
   * Parses a host name.
   *
   * @param host host part of an authority
   * @param clusterDomain the cluster DNS domain, e.g., {@code cluster.local}
   * @return the parsed name, or empty if {@code host} is not a valid Service or instance name
   */
  @NotNull
  public static Optional<ServiceName> parse(@NotNull String host, @NotNull String clusterDomain) {
    List<String> labels = splitDnsName(host);
    if (labels.isEmpty()) {
      return Optional.empty();
    }
    List<String> zoneLabels = splitDnsName(clusterDomain);
    labels = stripSuffix(labels, zoneLabels);
    if (labels.isEmpty() || !"svc".equals(labels.get(labels.size() - 1))) {
      return Optional.empty();
    }
    labels = labels.subList(0, labels.size() - 1);
    if (labels.size() == 2) {
      return Optional.of(new ServiceName(labels.get(1), labels.get(0), null));
    }
    if (labels.size() == 3) {
      return Optional.of(new ServiceName(labels.get(2), labels.get(1), labels.get(0)));
    }
    return Optional.empty();
  }

  /** Whether this names a single pod of a headless Service. */
  public boolean isInstance() {
    return instance != null;
  }

  /** Returns the cluster DNS name of this Service, without any instance. */
  @NotNull
  public String serviceFqdn(@NotNull String clusterDomain) {
    return name + "." + namespace + ".svc." + clusterDomain;
  }

  /**
   * Splits a DNS name into labels, or returns an empty list if any label is empty, too long, has
   * invalid characters, starts or ends with a dash, or has no letters.
   */
  @NotNull
  private static List<String> splitDnsName(@NotNull String dnsName) {
    String name = dnsName.endsWith(".") ? dnsName.substring(0, dnsName.length() - 1) : dnsName;
    List<String> labels = DOT.splitToList(name);
    for (String label : labels) {
      if (!DNS_LABEL_CHARACTERS.matcher(label).matches()
          || label.startsWith("-")
          || label.endsWith("-")
          || !CONTAINS_ALPHA.matcher(label).find()) {
        return List.of();
      }
    }
    return labels;
  }

  @NotNull
  private static List<String> stripSuffix(
      @NotNull List<String> labels, @NotNull List<String> suffix) {
    int n = labels.size() - suffix.size();
    if (suffix.isEmpty() || n < 0 || !labels.subList(n, labels.size()).equals(suffix)) {
      return labels;
    }
    return labels.subList(0, n);
  }
}
