package logq.engine.storage;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;

/**
 * Log file on disk. Files ending in ".gz" are decompressed on the fly, which is how ALB
 * and ELB deliver their logs to S3. Invalid UTF-8 sequences are replaced, not rejected.
 */
public class FileDataSource implements DataSource {
    private final Path path;

    public FileDataSource(Path path) {
        if (path == null) throw new IllegalArgumentException("path must not be null");
        this.path = path;
    }

    public Path path() { return path; }

    @Override
    public String describe() { return path.toString(); }

    @Override
    public void bind() throws IOException {
        if (!Files.exists(path)) throw new NoSuchFileException(path.toString());
        if (!Files.isRegularFile(path)) throw new IOException(path + " is not a regular file");
        if (!Files.isReadable(path)) throw new AccessDeniedException(path.toString());
    }

    @Override
    public BufferedReader openReader() throws IOException {
        InputStream in = Files.newInputStream(path);
        try {
            if (path.getFileName().toString().endsWith(".gz")) in = new GZIPInputStream(in);
        } catch (IOException e) {
            in.close();
            throw e;
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    @Override
    public String toString() { return "File(" + path + ")"; }
}
