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
 * A task, event, gateway, subprocess or artifact of a {@link Diagram}.
 * Position and size are not stored here but in the node's {@link Shape}.
 */
public class FlowNode {

  protected String id;
  protected ElementKind kind;
  protected String name;
  protected String parentId;
  protected String laneId;
  protected String attachedToId;
  protected String defaultFlowId;
  protected boolean forCompensation;
  protected boolean expanded;

  public FlowNode(String id, ElementKind kind) {
    this.id = id;
    this.kind = kind;
  }

  public FlowNode copy() {
    FlowNode copy = new FlowNode(id, kind);
    copy.name = name;
    copy.parentId = parentId;
    copy.laneId = laneId;
    copy.attachedToId = attachedToId;
    copy.defaultFlowId = defaultFlowId;
    copy.forCompensation = forCompensation;
    copy.expanded = expanded;
    return copy;
  }

  public boolean isTriggeredByEvent() {
    return kind == ElementKind.EVENT_SUB_PROCESS;
  }

  public boolean isBoundaryEvent() {
    return kind == ElementKind.BOUNDARY_EVENT;
  }

  public String getId() {
    return id;
  }

  public ElementKind getKind() {
    return kind;
  }

  public String getName() {
    return name;
  }

  public FlowNode setName(String name) {
    this.name = name;
    return this;
  }

  public String getParentId() {
    return parentId;
  }

  public FlowNode setParentId(String parentId) {
    this.parentId = parentId;
    return this;
  }

  public String getLaneId() {
    return laneId;
  }

  public FlowNode setLaneId(String laneId) {
    this.laneId = laneId;
    return this;
  }

  public String getAttachedToId() {
    return attachedToId;
  }

  public FlowNode setAttachedToId(String attachedToId) {
    this.attachedToId = attachedToId;
    return this;
  }

  public String getDefaultFlowId() {
    return defaultFlowId;
  }

  public FlowNode setDefaultFlowId(String defaultFlowId) {
    this.defaultFlowId = defaultFlowId;
    return this;
  }

  public boolean isForCompensation() {
    return forCompensation;
  }

  public FlowNode setForCompensation(boolean forCompensation) {
    this.forCompensation = forCompensation;
    return this;
  }

  public boolean isExpanded() {
    return expanded;
  }

  public FlowNode setExpanded(boolean expanded) {
    this.expanded = expanded;
    return this;
  }

  @Override
  public String toString() {
    return kind + "[" + id + "]";
  }
}
