package modernizer.state;

import modernizer.exceptions.ModernizeException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SessionStore")
class SessionStoreTest {

    @TempDir
    Path tempDir;

    private SessionStore store;

    @BeforeEach
    void setUp() {
        store = new SessionStore(tempDir.resolve("sessions"));
    }

    private Session newSession(String id) throws Exception {
        SessionLayout layout = store.create(id);
        return new Session(id, layout, "/src", Map.of("max_repair_attempts", 3), "local");
    }

    @Nested
    @DisplayName("layout")
    class Layout {

        @Test
        @DisplayName("should create the fixed session directories")
        void shouldCreateFixedDirectories() throws Exception {
            SessionLayout layout = store.create("s1");

            assertThat(layout.intermediate()).isDirectory();
            assertThat(layout.logs()).isDirectory();
            assertThat(layout.finalOutput()).isDirectory();
            assertThat(layout.diffReports()).isDirectory();
        }

        @Test
        @DisplayName("should refuse to reuse a session id")
        void shouldRefuseDuplicateId() throws Exception {
            store.create("s1");

            assertThatThrownBy(() -> store.create("s1"))
                    .isInstanceOf(ModernizeException.class)
                    .hasMessageContaining("already exists");
        }

        @Test
        @DisplayName("should generate distinct timestamped ids")
        void shouldGenerateDistinctIds() {
            String a = SessionStore.newSessionId();
            String b = SessionStore.newSessionId();

            assertThat(a).isNotEqualTo(b).matches("\\d{8}_\\d{6}_[0-9a-f]{6}");
        }
    }

    @Nested
    @DisplayName("metadata")
    class Metadata {

        @Test
        @DisplayName("should save and read back a completed session")
        void shouldRoundTripCompletedSession() throws Exception {
            Session session = newSession("s1");
            session.append(StageRecord.ok("stage0_preprocess", Map.of("modified", 1), "intermediate/stage0_preprocess", 12));
            session.finalOutputMirrors("stage0_preprocess");
            session.completed(Map.of("total_units", 1));
            store.save(session);

            Map<String, Object> status = store.getStatus("s1");

            assertThat(status).containsEntry("session_id", "s1")
                    .containsEntry("status", "completed")
                    .containsEntry("final_output_stage", "stage0_preprocess")
                    .containsEntry("completed_stages", List.of("stage0_preprocess"));
        }

        @Test
        @DisplayName("should record failure details")
        void shouldRecordFailure() throws Exception {
            Session session = newSession("s2");
            session.append(StageRecord.error("stage1_structural", "intermediate/stage1_structural", 5, "boom"));
            session.failed("stage1_structural", "boom", "java.io.IOException: boom", Map.of());
            store.save(session);

            Map<String, Object> status = store.getStatus("s2");

            assertThat(status).containsEntry("status", "failed")
                    .containsEntry("failed_stage", "stage1_structural")
                    .containsEntry("error", "boom")
                    .containsEntry("completed_stages", List.of());
        }

        @Test
        @DisplayName("should reject changes after a terminal state")
        void shouldRejectChangesAfterTerminalState() throws Exception {
            Session session = newSession("s3");
            session.completed(Map.of());

            assertThatThrownBy(() -> session.append(StageRecord.ok("stage5_review", Map.of(), "x", 0)))
                    .isInstanceOf(IllegalStateException.class);
            assertThatThrownBy(() -> session.failed("stage5_review", "late", null, Map.of()))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should fail on unknown sessions")
        void shouldFailOnUnknownSession() {
            assertThatThrownBy(() -> store.getStatus("nope"))
                    .isInstanceOf(ModernizeException.class)
                    .hasMessageContaining("Unknown session");
        }

        @Test
        @DisplayName("should list saved sessions oldest first")
        void shouldListSessions() throws Exception {
            store.save(newSession("20260101_000000_aaaaaa"));
            store.save(newSession("20250101_000000_bbbbbb"));
            store.create("no_metadata");

            assertThat(store.listSessions()).containsExactly("20250101_000000_bbbbbb", "20260101_000000_aaaaaa");
        }
    }
}
