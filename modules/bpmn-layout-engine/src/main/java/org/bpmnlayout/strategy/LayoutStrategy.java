/* Licensed under the Apache License, Version 2.0 (the "License");
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

package org.bpmnlayout.strategy;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The layout strategies a caller can request or the selector can recommend.
 * The ids are the ones clients already send over the wire.
 */
public enum LayoutStrategy {

  DETERMINISTIC("deterministic"),
  FULL("elk-full"),
  LANES("elk-lanes"),
  COLLABORATION("elk-collaboration"),
  SUBSET("elk-subset");

  private final String id;

  LayoutStrategy(String id) {
    this.id = id;
  }

  @JsonValue
  public String getId() {
    return id;
  }

  public boolean usesLayeredAlgorithm() {
    return this != DETERMINISTIC;
  }

  public static LayoutStrategy fromId(String id) {
    for (LayoutStrategy strategy : values()) {
      if (strategy.id.equalsIgnoreCase(id)) {
        return strategy;
      }
    }
    throw new IllegalArgumentException("Unknown layout strategy '" + id + "'");
  }

  @Override
  public String toString() {
    return id;
  }
}
