package logq.engine.cli;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import logq.engine.config.EngineConfig;
import logq.engine.exception.LogQueryException;
import logq.engine.exception.OutputException;
import logq.engine.exec.RecordStream;
import logq.engine.query.CompiledQuery;
import logq.engine.query.QueryProcessor;
import logq.engine.storage.DataSource;
import logq.engine.storage.FileDataSource;
import logq.engine.storage.MalformedLinePolicy;
import logq.engine.storage.StdinDataSource;
import picocli.CommandLine;

/**
 * {@code logq select <query> [file]}: runs one query and renders the records.
 * Returns 0 on success and 1 when the query fails at any stage.
 */
@CommandLine.Command(
    name = "select",
    mixinStandardHelpOptions = true,
    description = "Run a SELECT query against an access log file (or standard input)")
public class SelectCommand implements Callable<Integer> {
    private static final Logger LOG = LoggerFactory.getLogger(SelectCommand.class);

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "QUERY",
        description = "e.g. \"SELECT timestamp, request FROM elb WHERE elb_status_code >= 500 LIMIT 10\"")
    String query;

    @CommandLine.Parameters(index = "1", arity = "0..1", paramLabel = "FILE",
        description = "Log file to read; omitted or '-' reads standard input. .gz files are decompressed")
    String file;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "MODE",
        description = "Output mode: ${COMPLETION-CANDIDATES} (default: table, or the config file's value)")
    OutputMode output;

    @CommandLine.Option(names = {"--on-malformed"}, paramLabel = "POLICY",
        description = "What to do with a line that does not decode: ${COMPLETION-CANDIDATES} (default: fail)")
    MalformedLinePolicy onMalformed;

    @CommandLine.Option(names = {"--explain"}, description = "Print the query plan instead of running it")
    boolean explain;

    @CommandLine.Option(names = {"--config"}, paramLabel = "FILE",
        description = "JSON config file (default: ~/" + EngineConfig.DEFAULT_FILE_NAME + ")")
    Path configFile;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        EngineConfig config = EngineConfig.load(configFile != null ? configFile : EngineConfig.defaultLocation())
            .withOutput(output)
            .withOnMalformed(onMalformed);
        try {
            run(config, out);
            return 0;
        } catch (LogQueryException e) {
            LOG.debug("{} while running query: {}", e.kind(), query, e);
            out.flush();
            err.println("Error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private void run(EngineConfig config, PrintWriter out) {
        DataSource source = file == null || file.equals("-") ? new StdinDataSource() : new FileDataSource(Paths.get(file));
        QueryProcessor processor = new QueryProcessor(config.onMalformed());
        CompiledQuery compiled = processor.compile(query, source);
        if (explain) {
            out.print(compiled.explain());
        } else {
            try (RecordStream stream = compiled.open()) {
                config.output().printer().print(stream, out);
            }
        }
        out.flush();
        if (out.checkError()) throw new OutputException("Failed writing to standard output", null);
    }
}
