package atmogrid.compute.service;

import atmogrid.domain.grid.GridDataset;
import atmogrid.io.GridDatasetLoader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Caché de proceso de la rejilla cargada, con una única entrada indexada por el identificador de origen.
 * <p>
 * Las lecturas no bloquean: la rejilla es inmutable y se publica mediante un intercambio atómico.
 * Las recargas se serializan, de modo que una recarga nunca compite con lecturas de la rejilla anterior.
 */
@Slf4j
public class GridDatasetCache {

    private record Entry(String sourceId, GridDataset dataset) {}

    private final GridDatasetLoader loader;
    private final AtomicReference<Entry> current = new AtomicReference<>();
    private final Object reloadLock = new Object();

    public GridDatasetCache(GridDatasetLoader loader) {
        this.loader = Objects.requireNonNull(loader, "El cargador no puede ser nulo");
    }

    public GridDataset get(String sourceId) {
        return get(sourceId, false);
    }

    /**
     * Devuelve la rejilla del origen indicado. Sólo se carga si no hay ninguna, si el origen ha
     * cambiado o si se fuerza la recarga.
     *
     * @throws UncheckedIOException si el cargador falla.
     */
    public GridDataset get(String sourceId, boolean forceReload) {
        Objects.requireNonNull(sourceId, "El identificador de origen no puede ser nulo");

        Entry entry = current.get();
        if (!forceReload && entry != null && entry.sourceId().equals(sourceId)) {
            return entry.dataset();
        }

        synchronized (reloadLock) {
            entry = current.get();
            if (!forceReload && entry != null && entry.sourceId().equals(sourceId)) {
                return entry.dataset();
            }
            if (entry != null && !entry.sourceId().equals(sourceId)) {
                log.info("Origen de la rejilla cambiado ({} -> {}). Recargando.", entry.sourceId(), sourceId);
            }
            try {
                GridDataset dataset = loader.load(sourceId);
                current.set(new Entry(sourceId, dataset));
                return dataset;
            } catch (IOException e) {
                throw new UncheckedIOException("No se pudo cargar la rejilla " + sourceId, e);
            }
        }
    }

    /**
     * Identificador de la rejilla actualmente en caché.
     */
    public Optional<String> currentSource() {
        Entry entry = current.get();
        return entry == null ? Optional.empty() : Optional.of(entry.sourceId());
    }

    public void invalidate() {
        synchronized (reloadLock) {
            current.set(null);
        }
        log.debug("Caché de rejilla invalidada.");
    }
}
