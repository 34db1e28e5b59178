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

package org.bpmnlayout.config;

import org.bpmnlayout.model.ElementKind;

/**
 * Geometric constants used by the layout engine. All values are in pixels unless stated otherwise.
 * <p>
 * The label scoring weights and the type-aware gap deltas are empirically tuned and exposed
 * here so that callers can override them.
 */
public class LayoutSettings {

  // Element sizes
  protected int eventSize = 36;
  protected int gatewaySize = 50;
  protected int taskWidth = 100;
  protected int taskHeight = 80;
  protected int subProcessWidth = 350;
  protected int subProcessHeight = 200;
  protected int participantWidth = 600;
  protected int participantHeight = 250;
  protected int containerWidth = 300;
  protected int containerHeight = 200;
  protected int annotationWidth = 100;
  protected int annotationHeight = 30;
  protected int dataObjectWidth = 36;
  protected int dataObjectHeight = 50;

  // Spacing
  protected int nodeSpacing = 50;
  protected int layerSpacing = 60;
  protected int originX = 180;
  protected int originY = 80;
  protected int eventTaskGapDelta = 10;
  protected int gatewayEventGapDelta = -5;
  protected int deterministicMaxNodes = 20;

  // Containers
  protected int poolLabelBand = 30;
  protected int lanePadding = 30;
  protected int minLaneHeight = 120;
  protected int poolGap = 30;
  protected int participantPadding = 50;
  protected int subProcessPadding = 40;
  protected int resizeThreshold = 5;

  // Boundary events and compensation
  protected double boundaryAnchorRatio = 0.67;
  protected int boundaryTargetOffsetX = 90;
  protected int boundaryTargetOffsetY = 85;
  protected int compensationOffset = 85;
  protected int boundaryTolerance = 60;

  // Artifacts
  protected int artifactOffset = 80;
  protected int artifactPadding = 20;

  // Routing
  protected int loopbackMargin = 30;
  protected int loopbackHorizontalMargin = 15;
  protected int sameRowThreshold = 15;
  protected int parallelFlowOffset = 12;
  protected double orthogonalTolerance = 2;

  // Labels
  protected int labelWidth = 90;
  protected int labelHeight = 20;
  protected int labelDistance = 10;
  protected int arrowHeadLength = 10;
  protected int flowLabelMinSegment = 30;
  protected int segmentIntersectionWeight = 1;
  protected int labelOverlapWeight = 2;
  protected int boundaryHostOverlapWeight = 10;

  public double getDefaultWidth(ElementKind kind) {
    switch (kind.getCategory()) {
      case ACTIVITY:
        return taskWidth;
      case SUBPROCESS:
        return taskWidth;
      case GATEWAY:
        return gatewaySize;
      case EVENT:
        return eventSize;
      case ARTIFACT:
        return kind == ElementKind.TEXT_ANNOTATION ? annotationWidth : dataObjectWidth;
      case CONTAINER:
        return kind == ElementKind.PARTICIPANT ? participantWidth : containerWidth;
    }
    throw new IllegalStateException("Unknown category " + kind.getCategory());
  }

  public double getDefaultHeight(ElementKind kind) {
    switch (kind.getCategory()) {
      case ACTIVITY:
        return taskHeight;
      case SUBPROCESS:
        return taskHeight;
      case GATEWAY:
        return gatewaySize;
      case EVENT:
        return eventSize;
      case ARTIFACT:
        return kind == ElementKind.TEXT_ANNOTATION ? annotationHeight : dataObjectHeight;
      case CONTAINER:
        return kind == ElementKind.PARTICIPANT ? participantHeight : containerHeight;
    }
    throw new IllegalStateException("Unknown category " + kind.getCategory());
  }

  /**
   * Horizontal gap between two consecutive layers, depending on the kinds on either side.
   */
  public double getGap(ElementKind left, ElementKind right) {
    boolean eventTask = (left.isEvent() && isActivityLike(right)) || (isActivityLike(left) && right.isEvent());
    if (eventTask) {
      return nodeSpacing + eventTaskGapDelta;
    }
    boolean gatewayEvent = (left.isGateway() && right.isEvent()) || (left.isEvent() && right.isGateway());
    if (gatewayEvent) {
      return nodeSpacing + gatewayEventGapDelta;
    }
    return nodeSpacing;
  }

  private boolean isActivityLike(ElementKind kind) {
    return kind.getCategory() == ElementKind.Category.ACTIVITY || kind.isSubProcess();
  }

  // Getters and Setters

  public int getEventSize() {
    return eventSize;
  }

  public void setEventSize(int eventSize) {
    this.eventSize = eventSize;
  }

  public int getGatewaySize() {
    return gatewaySize;
  }

  public void setGatewaySize(int gatewaySize) {
    this.gatewaySize = gatewaySize;
  }

  public int getTaskWidth() {
    return taskWidth;
  }

  public void setTaskWidth(int taskWidth) {
    this.taskWidth = taskWidth;
  }

  public int getTaskHeight() {
    return taskHeight;
  }

  public void setTaskHeight(int taskHeight) {
    this.taskHeight = taskHeight;
  }

  public int getSubProcessWidth() {
    return subProcessWidth;
  }

  public void setSubProcessWidth(int subProcessWidth) {
    this.subProcessWidth = subProcessWidth;
  }

  public int getSubProcessHeight() {
    return subProcessHeight;
  }

  public void setSubProcessHeight(int subProcessHeight) {
    this.subProcessHeight = subProcessHeight;
  }

  public int getParticipantWidth() {
    return participantWidth;
  }

  public void setParticipantWidth(int participantWidth) {
    this.participantWidth = participantWidth;
  }

  public int getParticipantHeight() {
    return participantHeight;
  }

  public void setParticipantHeight(int participantHeight) {
    this.participantHeight = participantHeight;
  }

  public int getContainerWidth() {
    return containerWidth;
  }

  public void setContainerWidth(int containerWidth) {
    this.containerWidth = containerWidth;
  }

  public int getContainerHeight() {
    return containerHeight;
  }

  public void setContainerHeight(int containerHeight) {
    this.containerHeight = containerHeight;
  }

  public int getAnnotationWidth() {
    return annotationWidth;
  }

  public void setAnnotationWidth(int annotationWidth) {
    this.annotationWidth = annotationWidth;
  }

  public int getAnnotationHeight() {
    return annotationHeight;
  }

  public void setAnnotationHeight(int annotationHeight) {
    this.annotationHeight = annotationHeight;
  }

  public int getDataObjectWidth() {
    return dataObjectWidth;
  }

  public void setDataObjectWidth(int dataObjectWidth) {
    this.dataObjectWidth = dataObjectWidth;
  }

  public int getDataObjectHeight() {
    return dataObjectHeight;
  }

  public void setDataObjectHeight(int dataObjectHeight) {
    this.dataObjectHeight = dataObjectHeight;
  }

  public int getNodeSpacing() {
    return nodeSpacing;
  }

  public void setNodeSpacing(int nodeSpacing) {
    this.nodeSpacing = nodeSpacing;
  }

  public int getLayerSpacing() {
    return layerSpacing;
  }

  public void setLayerSpacing(int layerSpacing) {
    this.layerSpacing = layerSpacing;
  }

  public int getOriginX() {
    return originX;
  }

  public void setOriginX(int originX) {
    this.originX = originX;
  }

  public int getOriginY() {
    return originY;
  }

  public void setOriginY(int originY) {
    this.originY = originY;
  }

  public int getEventTaskGapDelta() {
    return eventTaskGapDelta;
  }

  public void setEventTaskGapDelta(int eventTaskGapDelta) {
    this.eventTaskGapDelta = eventTaskGapDelta;
  }

  public int getGatewayEventGapDelta() {
    return gatewayEventGapDelta;
  }

  public void setGatewayEventGapDelta(int gatewayEventGapDelta) {
    this.gatewayEventGapDelta = gatewayEventGapDelta;
  }

  public int getDeterministicMaxNodes() {
    return deterministicMaxNodes;
  }

  public void setDeterministicMaxNodes(int deterministicMaxNodes) {
    this.deterministicMaxNodes = deterministicMaxNodes;
  }

  public int getPoolLabelBand() {
    return poolLabelBand;
  }

  public void setPoolLabelBand(int poolLabelBand) {
    this.poolLabelBand = poolLabelBand;
  }

  public int getLanePadding() {
    return lanePadding;
  }

  public void setLanePadding(int lanePadding) {
    this.lanePadding = lanePadding;
  }

  public int getMinLaneHeight() {
    return minLaneHeight;
  }

  public void setMinLaneHeight(int minLaneHeight) {
    this.minLaneHeight = minLaneHeight;
  }

  public int getPoolGap() {
    return poolGap;
  }

  public void setPoolGap(int poolGap) {
    this.poolGap = poolGap;
  }

  public int getParticipantPadding() {
    return participantPadding;
  }

  public void setParticipantPadding(int participantPadding) {
    this.participantPadding = participantPadding;
  }

  public int getSubProcessPadding() {
    return subProcessPadding;
  }

  public void setSubProcessPadding(int subProcessPadding) {
    this.subProcessPadding = subProcessPadding;
  }

  public int getResizeThreshold() {
    return resizeThreshold;
  }

  public void setResizeThreshold(int resizeThreshold) {
    this.resizeThreshold = resizeThreshold;
  }

  public double getBoundaryAnchorRatio() {
    return boundaryAnchorRatio;
  }

  public void setBoundaryAnchorRatio(double boundaryAnchorRatio) {
    this.boundaryAnchorRatio = boundaryAnchorRatio;
  }

  public int getBoundaryTargetOffsetX() {
    return boundaryTargetOffsetX;
  }

  public void setBoundaryTargetOffsetX(int boundaryTargetOffsetX) {
    this.boundaryTargetOffsetX = boundaryTargetOffsetX;
  }

  public int getBoundaryTargetOffsetY() {
    return boundaryTargetOffsetY;
  }

  public void setBoundaryTargetOffsetY(int boundaryTargetOffsetY) {
    this.boundaryTargetOffsetY = boundaryTargetOffsetY;
  }

  public int getCompensationOffset() {
    return compensationOffset;
  }

  public void setCompensationOffset(int compensationOffset) {
    this.compensationOffset = compensationOffset;
  }

  public int getBoundaryTolerance() {
    return boundaryTolerance;
  }

  public void setBoundaryTolerance(int boundaryTolerance) {
    this.boundaryTolerance = boundaryTolerance;
  }

  public int getArtifactOffset() {
    return artifactOffset;
  }

  public void setArtifactOffset(int artifactOffset) {
    this.artifactOffset = artifactOffset;
  }

  public int getArtifactPadding() {
    return artifactPadding;
  }

  public void setArtifactPadding(int artifactPadding) {
    this.artifactPadding = artifactPadding;
  }

  public int getLoopbackMargin() {
    return loopbackMargin;
  }

  public void setLoopbackMargin(int loopbackMargin) {
    this.loopbackMargin = loopbackMargin;
  }

  public int getLoopbackHorizontalMargin() {
    return loopbackHorizontalMargin;
  }

  public void setLoopbackHorizontalMargin(int loopbackHorizontalMargin) {
    this.loopbackHorizontalMargin = loopbackHorizontalMargin;
  }

  public int getSameRowThreshold() {
    return sameRowThreshold;
  }

  public void setSameRowThreshold(int sameRowThreshold) {
    this.sameRowThreshold = sameRowThreshold;
  }

  public int getParallelFlowOffset() {
    return parallelFlowOffset;
  }

  public void setParallelFlowOffset(int parallelFlowOffset) {
    this.parallelFlowOffset = parallelFlowOffset;
  }

  public double getOrthogonalTolerance() {
    return orthogonalTolerance;
  }

  public void setOrthogonalTolerance(double orthogonalTolerance) {
    this.orthogonalTolerance = orthogonalTolerance;
  }

  public int getLabelWidth() {
    return labelWidth;
  }

  public void setLabelWidth(int labelWidth) {
    this.labelWidth = labelWidth;
  }

  public int getLabelHeight() {
    return labelHeight;
  }

  public void setLabelHeight(int labelHeight) {
    this.labelHeight = labelHeight;
  }

  public int getLabelDistance() {
    return labelDistance;
  }

  public void setLabelDistance(int labelDistance) {
    this.labelDistance = labelDistance;
  }

  public int getArrowHeadLength() {
    return arrowHeadLength;
  }

  public void setArrowHeadLength(int arrowHeadLength) {
    this.arrowHeadLength = arrowHeadLength;
  }

  public int getFlowLabelMinSegment() {
    return flowLabelMinSegment;
  }

  public void setFlowLabelMinSegment(int flowLabelMinSegment) {
    this.flowLabelMinSegment = flowLabelMinSegment;
  }

  public int getSegmentIntersectionWeight() {
    return segmentIntersectionWeight;
  }

  public void setSegmentIntersectionWeight(int segmentIntersectionWeight) {
    this.segmentIntersectionWeight = segmentIntersectionWeight;
  }

  public int getLabelOverlapWeight() {
    return labelOverlapWeight;
  }

  public void setLabelOverlapWeight(int labelOverlapWeight) {
    this.labelOverlapWeight = labelOverlapWeight;
  }

  public int getBoundaryHostOverlapWeight() {
    return boundaryHostOverlapWeight;
  }

  public void setBoundaryHostOverlapWeight(int boundaryHostOverlapWeight) {
    this.boundaryHostOverlapWeight = boundaryHostOverlapWeight;
  }
}
