package org.Fabnet.sampling;

import org.Fabnet.network.model.Equipment;
import org.Fabnet.network.model.PointOfContact;

import java.util.List;

/**
 * Hierarchical catalog the sampler draws from: fab, toolset, equipment, point of contact.
 */
public interface SamplingCatalog {

    List<String> fabs();

    /**
     * Returns toolsets of {@code fab}; {@code phaseNo == 0} means every phase.
     */
    List<ToolsetInfo> toolsets(String fab, int phaseNo);

    List<Equipment> equipmentInToolset(int toolsetId);

    List<PointOfContact> pocsOfEquipment(int equipmentId);
}
