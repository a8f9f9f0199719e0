package nanocalc.compute;

import lombok.Getter;
import nanocalc.exception.CalculationException;
import nanocalc.physics.i.CacheKey;
import nanocalc.physics.i.PhysicsModel;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * Unidad de trabajo independiente: evalúa un modelo en un único punto, consultando la caché
 * antes de calcular y guardando el resultado después.
 * <p>
 * Diseñada para ejecutarse en un pool de hilos. No comparte estado mutable salvo la caché.
 *
 * @param <R> Tipo del resultado del modelo.
 */
public class SweepPointTask<R> implements Callable<R> {

    @Getter
    private final int index;
    private final PhysicsModel<R> model;
    private final ResultCache cache;

    /**
     * @param index Posición del punto en el barrido original.
     * @param model Modelo ya situado en su punto.
     * @param cache Caché compartida, o {@code null} si está desactivada.
     */
    public SweepPointTask(int index, PhysicsModel<R> model, ResultCache cache) {
        this.index = index;
        this.model = model;
        this.cache = cache;
    }

    /**
     * Valida, consulta la caché y, si no hay entrada, calcula y guarda.
     */
    public R execute() throws CalculationException {
        model.validate();
        Optional<CacheKey> key = (cache != null) ? model.cacheKey() : Optional.empty();
        if (key.isPresent()) {
            Optional<R> cached = cache.get(key.get());
            if (cached.isPresent()) {
                return cached.get();
            }
        }
        R result = model.compute();
        key.ifPresent(k -> cache.put(k, result));
        return result;
    }

    @Override
    public R call() throws CalculationException {
        return execute();
    }
}
