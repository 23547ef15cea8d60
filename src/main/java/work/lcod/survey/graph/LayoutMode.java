package work.lcod.survey.graph;

public enum LayoutMode {
    /** Every node placed from scratch. */
    FULL,
    /** Previous positions kept, only changed containers restacked. */
    INCREMENTAL
}
