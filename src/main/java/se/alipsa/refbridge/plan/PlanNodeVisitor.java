package se.alipsa.refbridge.plan;

/**
 * Visitor over the plan node kinds.
 *
 * @param <R>
 *          the result type
 */
public interface PlanNodeVisitor<R> {

  R visitProject(ProjectNode node);

  R visitAggregation(AggregationNode node);

  R visitWindow(WindowNode node);

  R visitRowNumber(RowNumberNode node);

  R visitTopNRowNumber(TopNRowNumberNode node);

  R visitTableWrite(TableWriteNode node);

  R visitHashJoin(HashJoinNode node);

  R visitNestedLoopJoin(NestedLoopJoinNode node);

  R visitValues(ValuesNode node);

  R visitTableScan(TableScanNode node);

  /**
   * Called for node kinds without a dedicated method.
   *
   * @param node
   *          the node
   * @return the visitor result
   */
  R visitOther(PlanNode node);
}
