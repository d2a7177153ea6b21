package atmogrid.io;

import atmogrid.domain.grid.GridDataset;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Cargador de rejillas serializadas en JSON. El identificador de origen es una ruta
 * relativa al directorio base.
 */
@Slf4j
public class JsonGridDatasetLoader implements GridDatasetLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    private final Path baseDirectory;

    public JsonGridDatasetLoader(Path baseDirectory) {
        this.baseDirectory = Objects.requireNonNull(baseDirectory, "El directorio base no puede ser nulo");
    }

    /**
     * @throws IOException Si el archivo no existe, no se puede leer o algún modelo no respeta el esquema.
     */
    @Override
    public GridDataset load(String sourceId) throws IOException {
        Objects.requireNonNull(sourceId, "El identificador de origen no puede ser nulo");
        Path path = baseDirectory.resolve(sourceId);
        log.info("Leyendo rejilla '{}' desde {}", sourceId, path.toAbsolutePath());

        if (!Files.exists(path)) {
            throw new IOException("El archivo especificado no existe: " + path.toAbsolutePath());
        }

        GridDataset dataset;
        try {
            dataset = objectMapper.readValue(path.toFile(), GridDataset.class);
        } catch (IOException e) {
            log.error("Error al leer o interpretar la rejilla JSON {}", path.toAbsolutePath(), e);
            throw e;
        }

        // El identificador de la caché manda sobre el campo 'source' del archivo
        if (!sourceId.equals(dataset.getSource())) {
            dataset = new GridDataset(dataset.getModels(), dataset.getMaxDepth(), dataset.getVersion(), sourceId,
                    dataset.getDefaultDepthVariable(), dataset.getDefaultInterpVariable());
        }
        log.info("Rejilla cargada: {}", dataset);
        return dataset;
    }
}
