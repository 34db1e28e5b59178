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

import java.util.ArrayList;
import java.util.List;

/**
 * A pool (participant), lane or expanded subprocess.
 * <p>
 * For pools and subprocesses the child ids are the directly nested nodes and containers;
 * for lanes they are the flow nodes assigned to the lane.
 */
public class Container {

  protected String id;
  protected ElementKind kind;
  protected String name;
  protected String parentId;
  protected List<String> childIds = new ArrayList<String>();

  public Container(String id, ElementKind kind) {
    if (kind != ElementKind.PARTICIPANT && kind != ElementKind.LANE && !kind.isSubProcess()) {
      throw new IllegalArgumentException("Could not create container: kind " + kind + " of '" + id + "' cannot contain elements");
    }
    this.id = id;
    this.kind = kind;
  }

  public Container copy() {
    Container copy = new Container(id, kind);
    copy.name = name;
    copy.parentId = parentId;
    copy.childIds.addAll(childIds);
    return copy;
  }

  public boolean isParticipant() {
    return kind == ElementKind.PARTICIPANT;
  }

  public boolean isLane() {
    return kind == ElementKind.LANE;
  }

  public boolean isSubProcess() {
    return kind.isSubProcess();
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

  public Container setName(String name) {
    this.name = name;
    return this;
  }

  public String getParentId() {
    return parentId;
  }

  public Container setParentId(String parentId) {
    this.parentId = parentId;
    return this;
  }

  public List<String> getChildIds() {
    return childIds;
  }

  @Override
  public String toString() {
    return kind + "[" + id + "]";
  }
}
