package logq.engine.config;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;

import logq.engine.cli.OutputMode;
import logq.engine.storage.MalformedLinePolicy;

/**
 * User defaults for the command line, read from a small JSON file:
 * <pre>{ "output": "csv", "onMalformed": "skip" }</pre>
 * Absent keys keep their defaults. A file that cannot be read or parsed is logged and ignored.
 */
public class EngineConfig {
    private static final Logger LOG = LoggerFactory.getLogger(EngineConfig.class);
    public static final String DEFAULT_FILE_NAME = ".logq.json";

    private static final Gson GSON = new Gson();

    private OutputMode output = OutputMode.TABLE;
    private MalformedLinePolicy onMalformed = MalformedLinePolicy.FAIL;

    public OutputMode output() { return output; }
    public MalformedLinePolicy onMalformed() { return onMalformed; }

    public EngineConfig withOutput(OutputMode mode) {
        if (mode != null) this.output = mode;
        return this;
    }

    public EngineConfig withOnMalformed(MalformedLinePolicy policy) {
        if (policy != null) this.onMalformed = policy;
        return this;
    }

    public static EngineConfig defaults() { return new EngineConfig(); }

    /** ~/.logq.json */
    public static Path defaultLocation() {
        return Paths.get(System.getProperty("user.home"), DEFAULT_FILE_NAME);
    }

    public static EngineConfig load(Path file) {
        EngineConfig config = new EngineConfig();
        if (file == null || !Files.exists(file)) return config;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            RawConfig raw = GSON.fromJson(reader, RawConfig.class);
            if (raw != null) config.apply(raw, file);
        } catch (IOException | JsonParseException e) {
            LOG.error("Failed loading config file {}, using defaults", file, e);
            return new EngineConfig();
        }
        LOG.debug("Loaded config from {}: output={}, onMalformed={}", file, config.output, config.onMalformed);
        return config;
    }

    private void apply(RawConfig raw, Path file) {
        try {
            if (raw.output != null) output = OutputMode.fromString(raw.output);
            if (raw.onMalformed != null) onMalformed = MalformedLinePolicy.fromString(raw.onMalformed);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid value in config file {}: {}, using defaults", file, e.getMessage());
            output = OutputMode.TABLE;
            onMalformed = MalformedLinePolicy.FAIL;
        }
    }

    /** Shape of the JSON file. */
    private static final class RawConfig {
        String output;
        String onMalformed;
    }
}
