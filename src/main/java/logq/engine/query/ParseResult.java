package logq.engine.query;

// Statement parsed from the start of the query text plus whatever text followed it.
public record ParseResult(String remaining, SelectStatement statement) {}
