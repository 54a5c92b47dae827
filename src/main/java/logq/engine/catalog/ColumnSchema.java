package logq.engine.catalog;

// Immutable description of one log column: output name, value type, and how the raw field is decoded.
public record ColumnSchema(String name, DataType type, FieldDecoder decoder) {

    public ColumnSchema(String name, DataType type) {
        this(name, type, FieldDecoders.forType(type));
    }
}
