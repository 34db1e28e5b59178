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

package org.bpmnlayout.routing;

import java.util.List;

import org.bpmnlayout.model.Diagram;
import org.bpmnlayout.model.Edge;
import org.bpmnlayout.model.Point;

/**
 * Re-routes a single connection from the current geometry of its endpoints.
 * <p>
 * Implementations may throw a {@link RuntimeException} when the endpoints are in an inconsistent
 * state (no shape, no size, overlapping shapes). Callers catch such failures per edge and fall
 * back to {@link RouteTemplates}.
 */
public interface ConnectionRouter {

  List<Point> route(Diagram diagram, Edge edge);

}
