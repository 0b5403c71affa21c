package modernizer.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ModernizerConfigLoaderTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearOverrides() {
        System.clearProperty("modernizer.repair.max.attempts");
    }

    @Test
    void loadFromPropertiesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                modernizer.sessions.root=/var/modernizer
                modernizer.repair.max.attempts=5
                modernizer.env.legacy.image=python:2.7-slim
                modernizer.env.modern.interpreter=python3.12
                modernizer.timeout.execution=30
                modernizer.timeout.stage=600
                modernizer.sandbox.mode=LOCAL
                modernizer.verification.workers=2
                modernizer.alert.level=ERROR
                """);

        ModernizerConfig c = ModernizerConfigLoader.loadFromFile(f);

        assertEquals(Path.of("/var/modernizer"), c.sessionsRoot());
        assertEquals(5, c.maxRepairAttempts());
        assertEquals("python:2.7-slim", c.legacyImage());
        assertEquals("python3.12", c.modernInterpreter());
        assertEquals(Duration.ofSeconds(30), c.executionTimeout());
        assertEquals(Duration.ofSeconds(600), c.stageTimeout());
        assertEquals(SandboxMode.LOCAL, c.sandboxMode());
        assertEquals(2, c.verificationWorkers());
        assertEquals(AlertLevel.ERROR, c.alertLevel());
    }

    @Test
    void loadFromYamlFile() throws IOException {
        Path f = tempDir.resolve("test.yml");
        Files.writeString(f, """
                modernizer:
                  repair:
                    max:
                      attempts: 1
                  env:
                    modern:
                      image: python:3.12
                  timeout:
                    execution: 5
                  sandbox:
                    mode: sandboxed
                    runtime: podman
                  preprocess:
                    max:
                      fix:
                        iterations: 8
                """);

        ModernizerConfig c = ModernizerConfigLoader.loadFromFile(f);

        assertEquals(1, c.maxRepairAttempts());
        assertEquals("python:3.12", c.modernImage());
        assertEquals(Duration.ofSeconds(5), c.executionTimeout());
        assertEquals(SandboxMode.SANDBOXED, c.sandboxMode());
        assertEquals("podman", c.containerRuntime());
        assertEquals(8, c.maxFixIterations());
    }

    @Test
    void emptyYamlUsesDefaults() throws IOException {
        Path f = tempDir.resolve("empty.yaml");
        Files.writeString(f, "");

        ModernizerConfig c = ModernizerConfigLoader.loadFromFile(f);

        assertEquals(3, c.maxRepairAttempts());
        assertEquals(SandboxMode.AUTO, c.sandboxMode());
    }

    @Test
    void invalidValuesUseDefaults() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, """
                modernizer.sandbox.mode=INVALID
                modernizer.alert.level=INVALID
                modernizer.repair.max.attempts=-2
                modernizer.timeout.execution=not-a-number
                modernizer.verification.workers=0
                """);

        ModernizerConfig c = ModernizerConfigLoader.loadFromFile(f);

        assertEquals(SandboxMode.AUTO, c.sandboxMode());
        assertEquals(AlertLevel.WARNING, c.alertLevel());
        assertEquals(3, c.maxRepairAttempts());
        assertEquals(Duration.ofSeconds(15), c.executionTimeout());
        assertEquals(4, c.verificationWorkers());
    }

    @Test
    void systemPropertyOverridesFile() throws IOException {
        Path f = tempDir.resolve("test.properties");
        Files.writeString(f, "modernizer.repair.max.attempts=5\n");
        System.setProperty("modernizer.repair.max.attempts", "9");

        assertEquals(9, ModernizerConfigLoader.loadFromFile(f).maxRepairAttempts());
    }

    @Test
    void classpathConfigLoads() {
        ModernizerConfig c = ModernizerConfigLoader.load();

        assertNotNull(c);
        assertEquals("python2", c.legacyInterpreter());
    }

    @Test
    void nonexistentFileThrows() {
        Path f = tempDir.resolve("nonexistent.properties");
        assertThrows(IOException.class, () -> ModernizerConfigLoader.loadFromFile(f));
    }
}
