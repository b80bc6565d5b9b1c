package com.mimecast.directoryauth.node;

/**
 * Snapshot of an <code>available_nodes</code> row.
 */
public class AvailableNode {

    private final String node;
    private final int availableAssignments;
    private final int actives;
    private final boolean downed;

    /**
     * Constructs a new AvailableNode.
     *
     * @param node                 Node host name.
     * @param availableAssignments Remaining assignment capacity.
     * @param actives              Current number of active users.
     * @param downed               True if the node is out of rotation.
     */
    public AvailableNode(String node, int availableAssignments, int actives, boolean downed) {
        this.node = node;
        this.availableAssignments = availableAssignments;
        this.actives = actives;
        this.downed = downed;
    }

    public String getNode() {
        return node;
    }

    public int getAvailableAssignments() {
        return availableAssignments;
    }

    public int getActives() {
        return actives;
    }

    public boolean isDowned() {
        return downed;
    }

    @Override
    public String toString() {
        return "AvailableNode{" +
                "node='" + node + '\'' +
                ", availableAssignments=" + availableAssignments +
                ", actives=" + actives +
                ", downed=" + downed +
                '}';
    }
}
