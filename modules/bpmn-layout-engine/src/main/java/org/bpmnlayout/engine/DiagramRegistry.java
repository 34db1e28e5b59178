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

package org.bpmnlayout.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.bpmnlayout.InvalidLayoutRequestException;
import org.bpmnlayout.model.Diagram;

/**
 * Sessions by diagram id.
 */
public class DiagramRegistry {

  protected ConcurrentMap<String, DiagramSession> sessions = new ConcurrentHashMap<String, DiagramSession>();
  protected LayoutEngine engine;

  public DiagramRegistry() {
    this(new LayoutEngine());
  }

  public DiagramRegistry(LayoutEngine engine) {
    this.engine = engine;
  }

  public DiagramSession register(Diagram diagram) {
    DiagramSession session = new DiagramSession(diagram, engine);
    DiagramSession existing = sessions.putIfAbsent(diagram.getId(), session);
    if (existing != null) {
      throw new InvalidLayoutRequestException("Could not register diagram '" + diagram.getId() + "': it is already registered");
    }
    return session;
  }

  public DiagramSession get(String diagramId) {
    DiagramSession session = diagramId != null ? sessions.get(diagramId) : null;
    if (session == null) {
      throw new InvalidLayoutRequestException("Could not find diagram '" + diagramId + "'");
    }
    return session;
  }

  public boolean contains(String diagramId) {
    return sessions.containsKey(diagramId);
  }

  public DiagramSession remove(String diagramId) {
    return sessions.remove(diagramId);
  }

  public List<String> getDiagramIds() {
    List<String> ids = new ArrayList<String>(sessions.keySet());
    Collections.sort(ids);
    return ids;
  }

  public LayoutResult layout(String diagramId, LayoutOptions options) {
    return get(diagramId).layout(options);
  }
}
