package logq.engine.plan;

import java.util.List;

/**
 * Node of a logical plan. Lowering is one node to one physical node; the creator threads
 * variable naming, referenced columns and the data source binding through the tree.
 */
public interface LogicalNode {

    PhysicalPlanResult physical(PhysicalPlanCreator creator);

    /** Column names this node produces, in order. */
    List<String> outputColumns();
}
