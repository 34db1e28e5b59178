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

package org.bpmnlayout;

/**
 * A layout request that cannot be served as asked: unknown diagram, a scope element of the
 * wrong kind or element ids that do not exist. Raised before anything is mutated.
 */
public class InvalidLayoutRequestException extends LayoutException {

  private static final long serialVersionUID = 1L;

  public InvalidLayoutRequestException(String message) {
    super(message);
  }
}
