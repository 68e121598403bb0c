package visualqa.golden;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes {@link VerificationReport}s as pretty-printed JSON.
 */
public final class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    private ReportWriter() {}

    /**
     * Writes {@code report} to {@code path}, creating parent directories.
     *
     * @throws IOException if the file cannot be written
     */
    public static void write(VerificationReport report, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), report);
        log.debug("Wrote report for '{}' to {}", report.getName(), path);
    }

    /**
     * Reads a report previously written by {@link #write}.
     *
     * @throws IOException if the file cannot be read or parsed
     */
    public static VerificationReport read(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), VerificationReport.class);
    }

    public static String toJson(VerificationReport report) throws IOException {
        return MAPPER.writeValueAsString(report);
    }

    public static VerificationReport fromJson(String json) throws IOException {
        return MAPPER.readValue(json, VerificationReport.class);
    }
}
