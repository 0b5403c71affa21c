package modernizer.io;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * JSON artifact reading and writing.
 *
 * <p>Every artifact is written through {@link #writeAtomic(Path, Object)}:
 * the payload goes to a temporary file in the target directory which is then
 * moved over the target, so readers never observe a half-written file.
 */
public final class JsonFiles {

    private static final ObjectMapper JSON = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private JsonFiles() {}

    /** The shared mapper. Configured once; safe for concurrent use. */
    public static ObjectMapper mapper() {
        return JSON;
    }

    public static void writeAtomic(Path target, Object value) throws IOException {
        writeStringAtomic(target, JSON.writeValueAsString(value));
    }

    public static void writeStringAtomic(Path target, String content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    public static Map<String, Object> readMap(Path path) throws IOException {
        return JSON.readValue(path.toFile(), MAP_TYPE);
    }

    public static JsonNode readTree(Path path) throws IOException {
        return JSON.readTree(path.toFile());
    }
}
