package nanocalc.compute;

import lombok.extern.slf4j.Slf4j;
import nanocalc.physics.i.CacheKey;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Caché de resultados compartida por todos los hilos del motor.
 * <p>
 * Se apoya en {@link ConcurrentHashMap}: un lector nunca ve una entrada a medio escribir y
 * la escritura solo bloquea el cubo de su propia clave, no a los lectores de otras claves.
 * <p>
 * Política de carreras: si dos hilos calculan a la vez la misma clave, ambos calculan y
 * el último sobrescribe al primero (no hay single-flight). Como el cálculo es determinista,
 * los dos valores son idénticos. No hay política de expulsión: las entradas viven hasta
 * {@link #clear()} o hasta que se cierra el motor.
 */
@Slf4j
public class ResultCache {

    private final ConcurrentMap<CacheKey, Object> entries = new ConcurrentHashMap<>();
    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    /**
     * @param key Clave canónica del cálculo.
     * @param <R> Tipo del resultado; la clave incluye el modelo, así que el tipo es siempre el mismo.
     */
    @SuppressWarnings("unchecked")
    public <R> Optional<R> get(CacheKey key) {
        Object cached = entries.get(key);
        if (cached == null) {
            misses.increment();
            log.debug("Caché MISS: {}", key);
            return Optional.empty();
        }
        hits.increment();
        log.debug("Caché HIT: {}", key);
        return Optional.of((R) cached);
    }

    public <R> void put(CacheKey key, R result) {
        entries.put(key, result);
    }

    public int size() {
        return entries.size();
    }

    public long getHitCount() {
        return hits.sum();
    }

    public long getMissCount() {
        return misses.sum();
    }

    /**
     * Expulsión explícita de todas las entradas.
     */
    public void clear() {
        entries.clear();
        log.debug("Caché vaciada.");
    }
}
