package logq.engine.exec;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.NoSuchFileException;

import org.junit.jupiter.api.Test;

import logq.engine.catalog.LogCatalog;
import logq.engine.exception.CreateStreamException;
import logq.engine.exception.StreamException;
import logq.engine.storage.DataSource;
import logq.engine.storage.InMemoryDataSource;
import logq.engine.storage.LogLineDecoder;
import logq.engine.storage.MalformedLinePolicy;
import logq.engine.types.Tuple;
import logq.engine.types.Value;

public class LogScanOperatorTest {
    private static final String SQUID = "1286536309.450 98 192.168.0.68 TCP_MISS/200 4480 GET http://x/ - DIRECT/1.2.3.4 text/html";

    @Test
    void scansEveryLine() {
        DataSource src = InMemoryDataSource.ofText(SQUID + "\n" + SQUID.replace(" 98 ", " 12 ") + "\n");
        LogScanOperator scan = new LogScanOperator(src, new LogLineDecoder(LogCatalog.SQUID), MalformedLinePolicy.FAIL);
        scan.open();
        int count = 0;
        for (Tuple t = scan.next(); t != null; t = scan.next()) {
            count++;
            assertEquals(10, t.size());
        }
        scan.close();
        assertEquals(2, count);
    }

    @Test
    void lineNumbersCountBlankLines() {
        DataSource src = InMemoryDataSource.of(SQUID, "", "garbage");
        LogScanOperator scan = new LogScanOperator(src, new LogLineDecoder(LogCatalog.SQUID), MalformedLinePolicy.FAIL);
        scan.open();
        assertNotNull(scan.next());
        StreamException e = assertThrows(StreamException.class, scan::next);
        assertEquals(3, e.lineNumber());
        scan.close();
    }

    @Test
    void skipPolicyCountsDroppedLines() {
        DataSource src = InMemoryDataSource.of("garbage", SQUID, "1286536309.450 x 192.168.0.68 a 1 b c d e f");
        LogScanOperator scan = new LogScanOperator(src, new LogLineDecoder(LogCatalog.SQUID), MalformedLinePolicy.SKIP);
        scan.open();
        Tuple t = scan.next();
        assertEquals(Value.of(98L), t.get(1));
        assertNull(scan.next());
        assertEquals(2, scan.skippedLines());
        scan.close();
    }

    @Test
    void unreadableSourceFailsOnOpen() {
        DataSource broken = new DataSource() {
            @Override public String describe() { return "broken"; }
            @Override public void bind() {}
            @Override public BufferedReader openReader() throws IOException { throw new NoSuchFileException("broken"); }
        };
        LogScanOperator scan = new LogScanOperator(broken, new LogLineDecoder(LogCatalog.SQUID), MalformedLinePolicy.FAIL);
        assertThrows(CreateStreamException.class, scan::open);
        scan.close();
    }
}
