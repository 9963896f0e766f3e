package org.Fabnet.network.graph;

import it.unimi.dsi.fastutil.ints.IntCollection;
import it.unimi.dsi.fastutil.ints.IntSet;
import org.Fabnet.network.model.Equipment;
import org.Fabnet.network.model.NetworkLink;
import org.Fabnet.network.model.NetworkNode;
import org.Fabnet.network.model.PointOfContact;

import java.util.List;
import java.util.Optional;

/**
 * Read contract of the backing store holding the facility network.
 *
 * <p>Implementations may block. Any {@link RuntimeException} thrown here is surfaced by the core
 * as a backing-store failure.</p>
 */
public interface NetworkStore {

    Optional<NetworkNode> findNode(int nodeId);

    /**
     * Returns nodes satisfying every active filter, omitting {@code excludedNodeIds}.
     */
    List<NetworkNode> findNodes(PathFilters filters, IntSet excludedNodeIds);

    /**
     * Returns the subset of {@code nodeIds} that exist. Unknown ids are silently skipped.
     */
    List<NetworkNode> findNodesByIds(IntCollection nodeIds);

    /**
     * Returns every link with at least one endpoint in {@code nodeIds}.
     */
    List<NetworkLink> findLinksTouching(IntSet nodeIds);

    Optional<NetworkLink> findLink(int linkId);

    /**
     * Returns the point of contact bound to {@code nodeId}, if any.
     */
    Optional<PointOfContact> findPocByNode(int nodeId);

    Optional<PointOfContact> findPoc(int pocId);

    Optional<Equipment> findEquipment(int equipmentId);
}
