package logq.engine.query;

public enum ComparisonOp {
    EQ("="), NE("!="), LT("<"), LTE("<="), GT(">"), GTE(">=");

    private final String symbol;

    ComparisonOp(String symbol) { this.symbol = symbol; }

    public String symbol() { return symbol; }

    public boolean isOrdering() { return this != EQ && this != NE; }
}
