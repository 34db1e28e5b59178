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

package org.bpmnlayout.incremental;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Layout state kept per diagram between invocations: the elements pinned by manual edits.
 * A pinned element keeps its geometry in partial layouts until the next full layout.
 */
public class DiagramLayoutState {

  protected Set<String> pinned = new LinkedHashSet<String>();

  public void pin(String elementId) {
    pinned.add(elementId);
  }

  public void unpin(String elementId) {
    pinned.remove(elementId);
  }

  public boolean isPinned(String elementId) {
    return pinned.contains(elementId);
  }

  public Set<String> getPinnedIds() {
    return Collections.unmodifiableSet(pinned);
  }

  public void clearPins() {
    pinned.clear();
  }

  public DiagramLayoutState copy() {
    DiagramLayoutState copy = new DiagramLayoutState();
    copy.pinned.addAll(pinned);
    return copy;
  }

  public void restore(DiagramLayoutState snapshot) {
    pinned.clear();
    pinned.addAll(snapshot.pinned);
  }

  @Override
  public String toString() {
    return "DiagramLayoutState[pinned=" + pinned + "]";
  }
}
