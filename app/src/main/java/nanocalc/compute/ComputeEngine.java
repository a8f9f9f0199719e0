package nanocalc.compute;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import nanocalc.config.EngineConfig;
import nanocalc.exception.CalculationException;
import nanocalc.physics.i.PhysicsModel;
import nanocalc.validation.ParameterValidator;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Orquestador de la evaluación de modelos físicos.
 * <p>
 * Responsabilidades:
 * 1. Evaluación puntual: validar y delegar en {@link PhysicsModel#compute()}, pasando por la caché.
 * 2. Barridos: descomponer en puntos independientes, evaluarlos en paralelo en el pool y
 * reensamblarlos en el mismo orden que la entrada, sin importar el orden en que terminen.
 * 3. Gestionar el ciclo de vida del pool y de la caché (se crean aquí y mueren en {@link #close()}).
 * <p>
 * Trabaja contra {@link PhysicsModel} sin conocer el modelo concreto. No admite cancelación
 * ni timeout: un barrido termina completo o en el primer error (por orden de índice), que
 * aborta el lote entero.
 */
@Slf4j
public class ComputeEngine implements AutoCloseable {

    @Getter
    private final EngineConfig config;
    private final ExecutorService threadPool;
    private final ResultCache cache;

    public ComputeEngine(EngineConfig config) {
        this.config = Objects.requireNonNull(config, "La configuración no puede ser nula.").validated();
        this.threadPool = Executors.newFixedThreadPool(config.getCpuProcessorCount());
        this.cache = config.isCacheEnabled() ? new ResultCache() : null;
        log.info("ComputeEngine inicializado. (Hilos: {}, Caché: {})",
                config.getCpuProcessorCount(), config.isCacheEnabled());
    }

    /**
     * Evaluación de un único punto en el hilo llamante.
     *
     * @throws CalculationException error de validación o numérico del modelo.
     */
    public <R> R evaluate(PhysicsModel<R> model) throws CalculationException {
        return new SweepPointTask<>(0, model, cache).execute();
    }

    /**
     * Barrido paralelo de un modelo sobre su variable de barrido.
     *
     * @param template Modelo base.
     * @param points   Valores de la variable de barrido, en orden.
     * @return Un resultado por punto; {@code result.get(i)} corresponde a {@code points[i]}.
     */
    public <R> List<R> evaluateSweep(PhysicsModel<R> template, double[] points) throws CalculationException {
        Objects.requireNonNull(points, "El array de puntos no puede ser nulo.");
        // Un NaN o infinito no llega a construir su tipo con unidad: error de validación del primer punto inválido.
        ParameterValidator validator = ParameterValidator.start();
        for (double point : points) {
            validator.requireFinite(template.getSweepVariable(), point);
        }
        List<PhysicsModel<R>> models = new ArrayList<>(points.length);
        for (double point : points) {
            models.add(template.atSweepPoint(point));
        }
        log.debug("Barrido de {} sobre '{}' con {} puntos", template.getName(), template.getSweepVariable(), points.length);
        return evaluateAll(models);
    }

    /**
     * Evalúa una lista de modelos independientes en paralelo conservando el orden.
     *
     * @throws CalculationException el primer error por orden de índice; los puntos pendientes se cancelan.
     */
    public <R> List<R> evaluateAll(List<? extends PhysicsModel<R>> models) throws CalculationException {
        int count = models.size();
        List<Future<R>> futures = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            futures.add(threadPool.submit(new SweepPointTask<>(i, models.get(i), cache)));
        }

        List<R> results = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            try {
                results.add(futures.get(i).get());
            } catch (InterruptedException e) {
                cancelFrom(futures, i);
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Barrido interrumpido en el punto " + i, e);
            } catch (ExecutionException e) {
                cancelFrom(futures, i + 1);
                throw unwrap(e, i);
            }
        }
        return results;
    }

    public int cacheSize() {
        return cache == null ? 0 : cache.size();
    }

    /**
     * Estadísticas de la caché, o {@code null} si está desactivada.
     */
    public ResultCache getCache() {
        return cache;
    }

    public void clearCache() {
        if (cache != null) {
            cache.clear();
        }
    }

    private static <R> void cancelFrom(List<Future<R>> futures, int start) {
        for (int j = start; j < futures.size(); j++) {
            futures.get(j).cancel(true);
        }
    }

    private static CalculationException unwrap(ExecutionException e, int index) {
        Throwable cause = e.getCause();
        if (cause instanceof CalculationException calculationException) {
            log.debug("Barrido abortado en el punto {}: {}", index, cause.getMessage());
            return calculationException;
        }
        if (cause instanceof RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        throw new IllegalStateException("Error inesperado en el punto " + index, cause);
    }

    @Override
    public void close() {
        if (threadPool != null && !threadPool.isShutdown()) {
            threadPool.shutdown();
        }
        clearCache();
        log.info("ComputeEngine cerrado.");
    }
}
