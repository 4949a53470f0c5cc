/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.perfcounter.api;

/**
 * Fully qualified address of a counter.
 *
 * @param category counter category, e.g. {@code "Process"}
 * @param counter counter name within the category, e.g. {@code "% Processor Time"}
 * @param instance instance name, empty for categories without instances
 * @param machineName remote host, or null for the local machine
 * @since 1.0.0
 */
public record CounterPath(String category, String counter, String instance, String machineName) {

  public CounterPath {
    if (category == null || category.isBlank()) {
      throw new CounterConfigurationException("category is required");
    }
    if (counter == null || counter.isBlank()) {
      throw new CounterConfigurationException("counter is required");
    }
    if (instance == null) {
      instance = "";
    }
  }

  public static CounterPath local(String category, String counter, String instance) {
    return new CounterPath(category, counter, instance, null);
  }

  public boolean isRemote() {
    return machineName != null;
  }

  public CounterPath withInstance(String newInstance) {
    return new CounterPath(category, counter, newInstance, machineName);
  }

  public CounterPath withCounter(String newCounter) {
    return new CounterPath(category, newCounter, instance, machineName);
  }

  /** Renders as {@code \\machine\Category(instance)\Counter}. */
  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder();
    if (machineName != null) {
      sb.append("\\\\").append(machineName);
    }
    sb.append('\\').append(category);
    if (!instance.isEmpty()) {
      sb.append('(').append(instance).append(')');
    }
    sb.append('\\').append(counter);
    return sb.toString();
  }
}
