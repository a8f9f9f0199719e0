package nanocalc.io;

import lombok.extern.slf4j.Slf4j;
import nanocalc.domain.material.MaterialLookup;
import nanocalc.domain.material.MaterialRecord;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Catálogo de materiales en memoria cargado desde JSON.
 * <p>
 * El documento es un array de {@link MaterialRecord}. La búsqueda no distingue mayúsculas y
 * acepta alias. Inmutable tras la carga.
 */
@Slf4j
public class JsonMaterialCatalog implements MaterialLookup {

    public static final String DEFAULT_RESOURCE = "materials.json";

    private final List<MaterialRecord> materials;

    public JsonMaterialCatalog(List<MaterialRecord> materials) {
        this.materials = List.copyOf(materials);
    }

    /**
     * Carga el catálogo por defecto incluido en el classpath.
     */
    public static JsonMaterialCatalog fromClasspath() throws IOException {
        return fromClasspath(DEFAULT_RESOURCE);
    }

    public static JsonMaterialCatalog fromClasspath(String resource) throws IOException {
        MaterialRecord[] records = new JsonFileHandler().readFromClasspath(resource, MaterialRecord[].class);
        log.info("Catálogo de materiales cargado desde classpath:{} ({} materiales)", resource, records.length);
        return new JsonMaterialCatalog(Arrays.asList(records));
    }

    public static JsonMaterialCatalog fromFile(String filePath) throws IOException {
        MaterialRecord[] records = new JsonFileHandler().readFromFile(filePath, MaterialRecord[].class);
        log.info("Catálogo de materiales cargado desde {} ({} materiales)", filePath, records.length);
        return new JsonMaterialCatalog(Arrays.asList(records));
    }

    @Override
    public Optional<MaterialRecord> lookupMaterial(String name) {
        return materials.stream().filter(m -> m.matches(name)).findFirst();
    }

    public List<MaterialRecord> getMaterials() {
        return materials;
    }
}
