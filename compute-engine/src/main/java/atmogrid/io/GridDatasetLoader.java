package atmogrid.io;

import atmogrid.domain.grid.GridDataset;

import java.io.IOException;

/**
 * Carga una rejilla a partir de un identificador de origen opaco.
 * <p>
 * Debe ser idempotente: el mismo identificador produce siempre la misma rejilla.
 */
public interface GridDatasetLoader {

    GridDataset load(String sourceId) throws IOException;
}
