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

package org.bpmnlayout.model;

/**
 * Closed set of BPMN element kinds the layout engine knows how to place.
 */
public enum ElementKind {

  TASK(Category.ACTIVITY),
  USER_TASK(Category.ACTIVITY),
  SERVICE_TASK(Category.ACTIVITY),
  SCRIPT_TASK(Category.ACTIVITY),
  SEND_TASK(Category.ACTIVITY),
  RECEIVE_TASK(Category.ACTIVITY),
  MANUAL_TASK(Category.ACTIVITY),
  BUSINESS_RULE_TASK(Category.ACTIVITY),
  CALL_ACTIVITY(Category.ACTIVITY),

  SUB_PROCESS(Category.SUBPROCESS),
  EVENT_SUB_PROCESS(Category.SUBPROCESS),

  EXCLUSIVE_GATEWAY(Category.GATEWAY),
  PARALLEL_GATEWAY(Category.GATEWAY),
  INCLUSIVE_GATEWAY(Category.GATEWAY),
  EVENT_BASED_GATEWAY(Category.GATEWAY),
  COMPLEX_GATEWAY(Category.GATEWAY),

  START_EVENT(Category.EVENT),
  END_EVENT(Category.EVENT),
  INTERMEDIATE_CATCH_EVENT(Category.EVENT),
  INTERMEDIATE_THROW_EVENT(Category.EVENT),
  BOUNDARY_EVENT(Category.EVENT),

  TEXT_ANNOTATION(Category.ARTIFACT),
  DATA_OBJECT(Category.ARTIFACT),
  DATA_STORE(Category.ARTIFACT),

  PARTICIPANT(Category.CONTAINER),
  LANE(Category.CONTAINER);

  public enum Category {
    ACTIVITY,
    SUBPROCESS,
    GATEWAY,
    EVENT,
    ARTIFACT,
    CONTAINER
  }

  private final Category category;

  ElementKind(Category category) {
    this.category = category;
  }

  public Category getCategory() {
    return category;
  }

  public boolean isGateway() {
    return category == Category.GATEWAY;
  }

  public boolean isEvent() {
    return category == Category.EVENT;
  }

  public boolean isSubProcess() {
    return category == Category.SUBPROCESS;
  }

  public boolean isArtifact() {
    return category == Category.ARTIFACT;
  }

  public boolean isContainer() {
    return category == Category.CONTAINER;
  }

  /**
   * True for elements that take part in sequence flow (activities, subprocesses, gateways, events).
   */
  public boolean isFlowNode() {
    switch (category) {
      case ACTIVITY:
      case SUBPROCESS:
      case GATEWAY:
      case EVENT:
        return true;
      case ARTIFACT:
      case CONTAINER:
        return false;
    }
    throw new IllegalStateException("Unknown category " + category);
  }

  /**
   * Elements whose name is rendered outside of the shape and therefore needs a label position.
   */
  public boolean hasExternalLabel() {
    switch (category) {
      case EVENT:
      case GATEWAY:
        return true;
      case ARTIFACT:
        return this != TEXT_ANNOTATION;
      case ACTIVITY:
      case SUBPROCESS:
      case CONTAINER:
        return false;
    }
    throw new IllegalStateException("Unknown category " + category);
  }
}
