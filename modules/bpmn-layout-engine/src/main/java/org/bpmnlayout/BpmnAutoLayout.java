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

import org.activiti.bpmn.model.BpmnModel;
import org.activiti.bpmn.model.Process;
import org.bpmnlayout.config.LayoutSettings;
import org.bpmnlayout.engine.LayoutEngine;
import org.bpmnlayout.engine.LayoutOptions;
import org.bpmnlayout.engine.LayoutResult;
import org.bpmnlayout.incremental.DiagramLayoutState;
import org.bpmnlayout.interchange.BpmnModelExporter;
import org.bpmnlayout.interchange.BpmnModelImporter;
import org.bpmnlayout.model.Diagram;

/**
 * Auto layouts a {@link BpmnModel}: all processes and pools of the model are laid out as one
 * diagram and the result is written to the model's diagram interchange.
 */
public class BpmnAutoLayout {

  protected BpmnModel bpmnModel;
  protected LayoutSettings settings = new LayoutSettings();
  protected LayoutOptions options = new LayoutOptions();

  // When false, the existing DI is taken as the starting point
  protected boolean resetDiagramInterchange = true;

  public BpmnAutoLayout(BpmnModel bpmnModel) {
    this.bpmnModel = bpmnModel;
  }

  public LayoutResult execute() {
    if (resetDiagramInterchange) {
      bpmnModel.getLocationMap().clear();
      bpmnModel.getFlowLocationMap().clear();
      bpmnModel.getLabelLocationMap().clear();
    }

    Diagram diagram = new BpmnModelImporter().importModel(bpmnModel, getDiagramId());
    LayoutResult result = new LayoutEngine(settings).layout(diagram, new DiagramLayoutState(), options);
    new BpmnModelExporter().exportDiagram(diagram, bpmnModel);
    return result;
  }

  protected String getDiagramId() {
    for (Process process : bpmnModel.getProcesses()) {
      if (process.getId() != null) {
        return process.getId();
      }
    }
    return "diagram";
  }

  // Getters and Setters

  public LayoutSettings getSettings() {
    return settings;
  }

  public void setSettings(LayoutSettings settings) {
    this.settings = settings;
  }

  public LayoutOptions getOptions() {
    return options;
  }

  public void setOptions(LayoutOptions options) {
    this.options = options;
  }

  public boolean isResetDiagramInterchange() {
    return resetDiagramInterchange;
  }

  public void setResetDiagramInterchange(boolean resetDiagramInterchange) {
    this.resetDiagramInterchange = resetDiagramInterchange;
  }

  public int getEventSize() {
    return settings.getEventSize();
  }

  public void setEventSize(int eventSize) {
    settings.setEventSize(eventSize);
  }

  public int getGatewaySize() {
    return settings.getGatewaySize();
  }

  public void setGatewaySize(int gatewaySize) {
    settings.setGatewaySize(gatewaySize);
  }

  public int getTaskWidth() {
    return settings.getTaskWidth();
  }

  public void setTaskWidth(int taskWidth) {
    settings.setTaskWidth(taskWidth);
  }

  public int getTaskHeight() {
    return settings.getTaskHeight();
  }

  public void setTaskHeight(int taskHeight) {
    settings.setTaskHeight(taskHeight);
  }

  public int getSubProcessMargin() {
    return settings.getSubProcessPadding();
  }

  public void setSubProcessMargin(int subProcessMargin) {
    settings.setSubProcessPadding(subProcessMargin);
  }
}
