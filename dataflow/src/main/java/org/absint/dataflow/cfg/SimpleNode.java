package org.absint.dataflow.cfg;

/** A node of a {@link SimpleProcedure}, identified by its number within the procedure. */
public final class SimpleNode {

    private final int id;
    private final String label;

    /**
     * Create a node.
     *
     * @param id the number of the node within its procedure
     * @param label a name used when printing the node
     */
    SimpleNode(int id, String label) {
        this.id = id;
        this.label = label;
    }

    /** @return the number of the node within its procedure */
    public int getId() {
        return id;
    }

    /** @return the name used when printing the node */
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
