package modernizer.state;

import modernizer.exceptions.ModernizeException;
import modernizer.io.JsonFiles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Creates session directories and persists their {@code metadata.json}.
 *
 * <p>Session ids have the form {@code yyyyMMdd_HHmmss_<6 hex>}, so a
 * lexicographic listing is also chronological.
 */
public final class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);
    private static final DateTimeFormatter ID_TIME = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    private static final SecureRandom RANDOM = new SecureRandom();

    private final Path sessionsRoot;

    public SessionStore(Path sessionsRoot) {
        this.sessionsRoot = sessionsRoot;
    }

    public Path sessionsRoot() {
        return sessionsRoot;
    }

    public static String newSessionId() {
        byte[] suffix = new byte[3];
        RANDOM.nextBytes(suffix);
        return LocalDateTime.now().format(ID_TIME) + "_" + HexFormat.of().formatHex(suffix);
    }

    /**
     * Creates a fresh session directory with its fixed sub-directories.
     *
     * @throws ModernizeException if the id is already taken
     */
    public SessionLayout create(String sessionId) throws IOException, ModernizeException {
        Path root = sessionsRoot.resolve(sessionId);
        if (Files.exists(root)) {
            throw new ModernizeException("Session directory already exists: " + root);
        }
        SessionLayout layout = new SessionLayout(root).create();
        log.debug("Created session directory {}", root);
        return layout;
    }

    /** Rewrites {@code metadata.json} atomically. */
    public void save(Session session) throws IOException {
        JsonFiles.writeAtomic(session.layout().metadataFile(), session.toMap());
    }

    /**
     * Reads a session's {@code metadata.json}.
     *
     * @throws ModernizeException if the session is unknown
     */
    public Map<String, Object> getStatus(String sessionId) throws IOException, ModernizeException {
        Path file = new SessionLayout(sessionsRoot.resolve(sessionId)).metadataFile();
        if (!Files.isRegularFile(file)) {
            throw new ModernizeException("Unknown session: " + sessionId);
        }
        return JsonFiles.readMap(file);
    }

    /** Ids of all sessions that have a {@code metadata.json}, oldest first. */
    public List<String> listSessions() throws IOException {
        List<String> ids = new ArrayList<>();
        if (!Files.isDirectory(sessionsRoot)) {
            return ids;
        }
        try (Stream<Path> dirs = Files.list(sessionsRoot)) {
            dirs.filter(d -> Files.isRegularFile(d.resolve("metadata.json")))
                .map(d -> d.getFileName().toString())
                .sorted()
                .forEach(ids::add);
        }
        return ids;
    }
}
