package netlab.provisioner.api.v1.dto;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class ScriptRunRequestTest {

    @Test
    void requiresNodeAndPath() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> new ScriptRunRequest(" ", "/tmp/x.sh", null, null).validate());
        assertEquals("nodeName is required", e.getMessage());

        assertThrows(IllegalArgumentException.class,
                () -> new ScriptRunRequest("PC1", null, null, null).validate());
    }

    @Test
    void timeoutDefaultsToThirtySeconds() {
        assertEquals(Duration.ofSeconds(30), new ScriptRunRequest("PC1", "/x", null, null).timeoutDuration());
        assertEquals(Duration.ofMillis(1500), new ScriptRunRequest("PC1", "/x", null, 1.5).timeoutDuration());
    }

    @Test
    void rejectsNonPositiveTimeout() {
        assertThrows(IllegalArgumentException.class,
                () -> new ScriptRunRequest("PC1", "/x", "bash", -2.0).validate());
    }
}
