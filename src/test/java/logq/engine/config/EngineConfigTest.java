package logq.engine.config;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import logq.engine.cli.OutputMode;
import logq.engine.storage.MalformedLinePolicy;

public class EngineConfigTest {

    @Test
    void missingFileGivesDefaults(@TempDir Path dir) {
        EngineConfig c = EngineConfig.load(dir.resolve("absent.json"));
        assertEquals(OutputMode.TABLE, c.output());
        assertEquals(MalformedLinePolicy.FAIL, c.onMalformed());
    }

    @Test
    void readsValuesFromJson(@TempDir Path dir) throws IOException {
        Path f = Files.writeString(dir.resolve("logq.json"), "{ \"output\": \"csv\", \"onMalformed\": \"skip\" }");
        EngineConfig c = EngineConfig.load(f);
        assertEquals(OutputMode.CSV, c.output());
        assertEquals(MalformedLinePolicy.SKIP, c.onMalformed());
    }

    @Test
    void partialFileKeepsOtherDefaults(@TempDir Path dir) throws IOException {
        Path f = Files.writeString(dir.resolve("logq.json"), "{ \"output\": \"JSON\" }");
        EngineConfig c = EngineConfig.load(f);
        assertEquals(OutputMode.JSON, c.output());
        assertEquals(MalformedLinePolicy.FAIL, c.onMalformed());
    }

    @Test
    void invalidFileFallsBackToDefaults(@TempDir Path dir) throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.json"), "{ output: ");
        assertEquals(OutputMode.TABLE, EngineConfig.load(broken).output());
        Path badValue = Files.writeString(dir.resolve("bad.json"), "{ \"output\": \"xml\", \"onMalformed\": \"skip\" }");
        EngineConfig c = EngineConfig.load(badValue);
        assertEquals(OutputMode.TABLE, c.output());
        assertEquals(MalformedLinePolicy.FAIL, c.onMalformed());
    }

    @Test
    void commandLineValuesOverrideFile(@TempDir Path dir) throws IOException {
        Path f = Files.writeString(dir.resolve("logq.json"), "{ \"output\": \"csv\" }");
        EngineConfig c = EngineConfig.load(f).withOutput(OutputMode.JSON).withOnMalformed(null);
        assertEquals(OutputMode.JSON, c.output());
        assertEquals(MalformedLinePolicy.FAIL, c.onMalformed());
    }
}
