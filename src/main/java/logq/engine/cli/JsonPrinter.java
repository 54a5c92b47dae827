package logq.engine.cli;

import java.io.IOException;
import java.io.Writer;
import java.util.Map;
import java.util.Optional;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

import logq.engine.exception.OutputException;
import logq.engine.exec.Record;
import logq.engine.exec.RecordStream;
import logq.engine.types.Value;

/**
 * Prints all records as one JSON array of objects, keys in projection order.
 */
public final class JsonPrinter implements ResultPrinter {
    private final Gson gson = new GsonBuilder().serializeNulls().create();

    @Override
    public void print(RecordStream stream, Writer out) {
        JsonArray array = new JsonArray();
        for (Optional<Record> r = stream.next(); r.isPresent(); r = stream.next()) {
            array.add(toJson(r.get()));
        }
        try {
            gson.toJson(array, out);
            out.write('\n');
            out.flush();
        } catch (IOException | JsonIOException e) {
            throw new OutputException("Failed writing JSON output: " + e.getMessage(), e);
        }
    }

    public static JsonObject toJson(Record record) {
        JsonObject obj = new JsonObject();
        for (Map.Entry<String, Value> e : record.toTuples()) obj.add(e.getKey(), toJson(e.getValue()));
        return obj;
    }

    static JsonElement toJson(Value v) {
        return switch (v.type()) {
            case BOOLEAN -> new JsonPrimitive(((Value.BooleanValue) v).value());
            case INT -> new JsonPrimitive(((Value.IntValue) v).value());
            case FLOAT -> new JsonPrimitive(((Value.FloatValue) v).value());
            case STRING, DATE_TIME, HOST, HTTP_REQUEST -> new JsonPrimitive(v.asText());
            case NULL -> JsonNull.INSTANCE;
        };
    }
}
