package nanocalc.io;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Deserializa objetos desde archivos JSON o recursos del classpath (catálogos de
 * materiales, configuración del motor).
 * <p>
 * Genérica: funciona con cualquier tipo compatible con Jackson.
 */
@Slf4j
public class JsonFileHandler {

    // El ObjectMapper es costoso de crear y thread-safe: se comparte.
    private static final ObjectMapper objectMapper = createConfiguredObjectMapper();

    private static ObjectMapper createConfiguredObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.findAndRegisterModules();
        return mapper;
    }

    /**
     * Deserializa un archivo JSON para reconstruir un objeto de un tipo específico.
     *
     * @param filePath   La ruta del archivo JSON a leer.
     * @param objectType El tipo al que se debe convertir el JSON (ej: EngineConfig.class).
     * @throws IOException Si el archivo no existe o hay un error de lectura o formato.
     */
    public <T> T readFromFile(String filePath, Class<T> objectType) throws IOException {
        Path path = Paths.get(filePath);
        log.info("Deserializando archivo {} a un objeto de tipo {}", path.toAbsolutePath(), objectType.getSimpleName());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        try {
            return objectMapper.readValue(path.toFile(), objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el archivo JSON desde {}", path.toAbsolutePath(), e);
            throw e;
        }
    }

    /**
     * Deserializa un recurso del classpath.
     *
     * @param resource   Nombre del recurso (ej: "materials.json").
     * @param objectType El tipo destino.
     * @throws IOException Si el recurso no existe o no se puede parsear.
     */
    public <T> T readFromClasspath(String resource, Class<T> objectType) throws IOException {
        log.info("Deserializando recurso classpath:{} a un objeto de tipo {}", resource, objectType.getSimpleName());
        try (InputStream in = JsonFileHandler.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("El recurso no existe en el classpath: " + resource);
            }
            return objectMapper.readValue(in, objectType);
        } catch (IOException e) {
            log.error("Error fatal al leer o parsear el recurso JSON {}", resource, e);
            throw e;
        }
    }
}
