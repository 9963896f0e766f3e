package org.Fabnet.sampling;

/**
 * Toolset row with its equipment count.
 *
 * @param toolsetId toolset id.
 * @param fab owning fab/building.
 * @param phaseNo phase number, {@code 0} when unphased.
 * @param equipmentCount number of equipment in the toolset.
 */
public record ToolsetInfo(int toolsetId, String fab, int phaseNo, int equipmentCount) {
}
