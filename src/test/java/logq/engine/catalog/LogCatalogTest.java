package logq.engine.catalog;

import static org.junit.jupiter.api.Assertions.*;

import java.util.HashSet;
import java.util.List;

import org.junit.jupiter.api.Test;

public class LogCatalogTest {

    @Test
    void knowsExactlyFourFormats() {
        assertEquals(List.of("elb", "alb", "squid", "s3"), LogCatalog.formatNames());
        assertTrue(LogCatalog.isSupported("s3"));
        assertFalse(LogCatalog.isSupported("S3"));
        assertFalse(LogCatalog.isSupported("bogus"));
        assertTrue(LogCatalog.lookup("bogus").isEmpty());
    }

    @Test
    void columnCounts() {
        assertEquals(15, LogCatalog.ELB.columns().size());
        assertEquals(29, LogCatalog.ALB.columns().size());
        assertEquals(10, LogCatalog.SQUID.columns().size());
        assertEquals(24, LogCatalog.S3.columns().size());
    }

    @Test
    void columnNamesAreUniquePerSchema() {
        for (String name : LogCatalog.formatNames()) {
            LogSchema schema = LogCatalog.lookup(name).orElseThrow();
            assertEquals(schema.columns().size(), new HashSet<>(schema.columnNames()).size(), name);
        }
    }

    @Test
    void indexOfFollowsDeclarationOrder() {
        assertEquals(0, LogCatalog.ELB.indexOf("timestamp"));
        assertEquals(7, LogCatalog.ELB.indexOf("elb_status_code"));
        assertEquals(-1, LogCatalog.ELB.indexOf("status"));
        assertEquals(DataType.HTTP_REQUEST, LogCatalog.S3.column(LogCatalog.S3.indexOf("request_uri")).type());
    }
}
