package logq.engine.exec;

import java.io.BufferedReader;
import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import logq.engine.exception.CreateStreamException;
import logq.engine.exception.StreamException;
import logq.engine.storage.DataSource;
import logq.engine.storage.LogLineDecoder;
import logq.engine.storage.MalformedLineException;
import logq.engine.storage.MalformedLinePolicy;
import logq.engine.types.Tuple;

/**
 * Physical operator that reads a log source line by line and decodes each line with the
 * format's schema. Blank lines are ignored. Line numbers are 1-based and count every
 * physical line, blank ones included.
 */
public class LogScanOperator implements Operator {
    private static final Logger LOG = LoggerFactory.getLogger(LogScanOperator.class);

    private final DataSource source;
    private final LogLineDecoder decoder;
    private final MalformedLinePolicy policy;

    private BufferedReader reader;
    private long lineNumber;
    private long emitted;
    private long skipped;

    public LogScanOperator(DataSource source, LogLineDecoder decoder, MalformedLinePolicy policy) {
        this.source = source;
        this.decoder = decoder;
        this.policy = policy;
    }

    @Override
    public void open() {
        if (reader != null) throw new IllegalStateException("scan over " + source.describe() + " already open");
        try {
            reader = source.openReader();
        } catch (IOException e) {
            throw new CreateStreamException("Cannot open " + source.describe() + ": " + e.getMessage(), e);
        }
        lineNumber = 0;
        emitted = 0;
        skipped = 0;
        LOG.debug("Opened {} scan over {}", decoder.schema().name(), source.describe());
    }

    @Override
    public Tuple next() {
        if (reader == null) return null;
        while (true) {
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                throw new StreamException("I/O error reading " + source.describe() + " after line " + lineNumber
                    + ": " + e.getMessage(), lineNumber, e);
            }
            if (line == null) return null;
            lineNumber++;
            if (line.isBlank()) continue;
            try {
                Tuple t = decoder.decode(line, lineNumber);
                emitted++;
                return t;
            } catch (MalformedLineException e) {
                if (policy == MalformedLinePolicy.FAIL) {
                    throw new StreamException(e.getMessage(), lineNumber, e);
                }
                skipped++;
                LOG.warn("Skipping {}", e.getMessage());
            }
        }
    }

    public long skippedLines() { return skipped; }

    @Override
    public void close() {
        if (reader == null) return;
        try {
            reader.close();
        } catch (IOException e) {
            LOG.warn("Failed closing {}: {}", source.describe(), e.getMessage());
        } finally {
            reader = null;
        }
        if (skipped > 0) {
            LOG.warn("Skipped {} malformed {} line(s) in {}", skipped, decoder.schema().name(), source.describe());
        }
        LOG.debug("Closed scan over {} after {} line(s), {} tuple(s)", source.describe(), lineNumber, emitted);
    }
}
