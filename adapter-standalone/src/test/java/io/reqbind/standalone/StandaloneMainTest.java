package io.reqbind.standalone;

import static org.assertj.core.api.Assertions.assertThat;

import io.reqbind.core.error.EndpointConfigException;
import io.reqbind.core.error.SpecParseException;
import io.reqbind.standalone.config.ConfigLoadException;
import io.reqbind.standalone.config.ConfigLoader;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StandaloneMainTest {

    @Test
    void unusableConfigExitsWithConfigStatus(@TempDir Path dir) {
        ConfigLoadException missing = catchLoad(dir.resolve("absent.yaml"));

        assertThat(StandaloneMain.exitStatus(missing)).isEqualTo(StandaloneMain.EXIT_CONFIG);
        assertThat(StandaloneMain.exitStatus(new IllegalArgumentException("--config requires a file path argument")))
                .isEqualTo(StandaloneMain.EXIT_CONFIG);
    }

    @Test
    void rejectedDefinitionsExitWithDefinitionsStatus() {
        assertThat(StandaloneMain.exitStatus(new SpecParseException("bad", null, "users.yaml")))
                .isEqualTo(StandaloneMain.EXIT_DEFINITIONS);
        assertThat(StandaloneMain.exitStatus(new EndpointConfigException("dup", "a", "a.yaml")))
                .isEqualTo(StandaloneMain.EXIT_DEFINITIONS);
    }

    @Test
    void anythingElseExitsWithGenericStatus() {
        assertThat(StandaloneMain.exitStatus(new IllegalStateException("port in use")))
                .isEqualTo(StandaloneMain.EXIT_OTHER);
    }

    private static ConfigLoadException catchLoad(Path path) {
        try {
            ConfigLoader.load(path, name -> null);
        } catch (ConfigLoadException e) {
            return e;
        }
        throw new AssertionError("expected ConfigLoadException");
    }
}
