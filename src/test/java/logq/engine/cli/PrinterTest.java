package logq.engine.cli;

import static org.junit.jupiter.api.Assertions.*;

import java.io.StringWriter;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import logq.engine.exec.Record;
import logq.engine.exec.RecordStream;
import logq.engine.query.QueryProcessor;
import logq.engine.storage.InMemoryDataSource;
import logq.engine.types.Host;
import logq.engine.types.HttpRequest;
import logq.engine.types.Value;

public class PrinterTest {
    private static final String LINE = "2015-05-13T23:39:43.945958Z my-loadbalancer 192.168.131.39:2817 - 0.5 -1 -1 200 - 0 29 "
        + "\"GET http://www.example.com:80/a,b HTTP/1.1\" \"say \\\"hi\\\"\" - -";

    private static RecordStream stream(String query) {
        return new QueryProcessor().stream(query, InMemoryDataSource.of(LINE));
    }

    private static String render(ResultPrinter printer, String query) {
        StringWriter out = new StringWriter();
        try (RecordStream s = stream(query)) {
            printer.print(s, out);
        }
        return out.toString();
    }

    @Test
    void csvQuotesOnlyWhenNeededAndLeavesNullEmpty() {
        String csv = render(new CsvPrinter(), "SELECT elbname, backend_and_port, request, user_agent, elb_status_code FROM elb");
        assertEquals("my-loadbalancer,,\"GET http://www.example.com:80/a,b HTTP/1.1\",\"say \"\"hi\"\"\",200\r\n", csv);
    }

    @Test
    void jsonKeepsTypesAndProjectionOrder() {
        String json = render(new JsonPrinter(),
            "SELECT elb_status_code, request_processing_time, backend_and_port, timestamp, client_and_port FROM elb");
        JsonArray array = JsonParser.parseString(json).getAsJsonArray();
        assertEquals(1, array.size());
        JsonObject obj = array.get(0).getAsJsonObject();
        assertEquals(List.of("elb_status_code", "request_processing_time", "backend_and_port", "timestamp", "client_and_port"),
            List.copyOf(obj.keySet()));
        assertEquals(200, obj.get("elb_status_code").getAsLong());
        assertEquals(0.5, obj.get("request_processing_time").getAsDouble());
        assertTrue(obj.get("backend_and_port").isJsonNull());
        assertEquals("2015-05-13T23:39:43.945958Z", obj.get("timestamp").getAsString());
        assertEquals("192.168.131.39:2817", obj.get("client_and_port").getAsString());
    }

    @Test
    void jsonEncodingDecodesToSameContent() {
        Record r = new Record(List.of("b", "i", "f", "s", "t", "h", "r", "n"), List.of(
            Value.of(true), Value.of(-7L), Value.of(1.25d), Value.of("x\"y"),
            Value.of(OffsetDateTime.of(2019, 2, 6, 0, 0, 38, 0, ZoneOffset.UTC)),
            Value.of(new Host("10.0.0.1", 80)), Value.of(new HttpRequest("GET", "/", "HTTP/1.1")), Value.NULL));
        JsonObject obj = JsonParser.parseString(JsonPrinter.toJson(r).toString()).getAsJsonObject();
        assertTrue(obj.get("b").getAsBoolean());
        assertEquals(-7L, obj.get("i").getAsLong());
        assertEquals(1.25d, obj.get("f").getAsDouble());
        assertEquals("x\"y", obj.get("s").getAsString());
        assertEquals("2019-02-06T00:00:38Z", obj.get("t").getAsString());
        assertEquals("10.0.0.1:80", obj.get("h").getAsString());
        assertEquals("GET / HTTP/1.1", obj.get("r").getAsString());
        assertTrue(obj.get("n").isJsonNull());
    }

    @Test
    void emptyResultIsEmptyArray() {
        String json = render(new JsonPrinter(), "SELECT elbname FROM elb WHERE elb_status_code = 500");
        assertEquals("[]\n", json);
    }

    @Test
    void tableHasHeaderGridAndRowCount() {
        String table = render(new TablePrinter(), "SELECT elbname, elb_status_code, backend_and_port FROM elb");
        String[] lines = table.split("\n");
        assertEquals("+-----------------+-----------------+------------------+", lines[0]);
        assertEquals("| elbname         | elb_status_code | backend_and_port |", lines[1]);
        assertEquals("| my-loadbalancer | 200             | NULL             |", lines[3]);
        assertEquals("(1 row(s))", lines[lines.length - 1]);
    }

    @Test
    void tableForNoRows() {
        assertEquals("(0 row(s))\n", render(new TablePrinter(), "SELECT elbname FROM elb LIMIT 0"));
    }

    @Test
    void outputModeParsing() {
        assertEquals(OutputMode.JSON, OutputMode.fromString("json"));
        assertEquals(OutputMode.CSV, OutputMode.fromString(" CSV "));
        assertThrows(IllegalArgumentException.class, () -> OutputMode.fromString("xml"));
        assertInstanceOf(TablePrinter.class, OutputMode.TABLE.printer());
    }
}
