package nanocalc.io;

import nanocalc.config.EngineConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonFileHandlerTest {

    private JsonFileHandler jsonFileHandler;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        this.jsonFileHandler = new JsonFileHandler();
    }

    @Test
    @DisplayName("Debería leer la configuración del motor desde un archivo JSON")
    void readFromFile_shouldDeserializeEngineConfig() throws IOException {
        Path file = tempDir.resolve("engine.json");
        Files.writeString(file, "{ \"cpuProcessorCount\": 2, \"cacheEnabled\": false }");

        EngineConfig config = jsonFileHandler.readFromFile(file.toString(), EngineConfig.class);

        assertThat(config.getCpuProcessorCount()).isEqualTo(2);
        assertThat(config.isCacheEnabled()).isFalse();
        assertThat(config.getTruncationTolerance()).isEqualTo(1e-8);
    }

    @Test
    @DisplayName("Debería lanzar IOException si el archivo no existe")
    void readFromFile_shouldThrowWhenMissing() {
        String missing = tempDir.resolve("missing.json").toString();

        IOException ex = assertThrows(IOException.class,
                () -> jsonFileHandler.readFromFile(missing, EngineConfig.class));

        assertThat(ex.getMessage()).contains("no existe");
    }

    @Test
    @DisplayName("Debería leer recursos del classpath")
    void readFromClasspath_shouldFindResource() throws IOException {
        Object[] materials = jsonFileHandler.readFromClasspath("materials.json", Object[].class);

        assertThat(materials).hasSize(5);
    }
}
