package nanocalc.physics.i;

import java.util.Objects;

/**
 * Clave canónica de un cálculo: el modelo que lo produce más el valor que reúne todos
 * sus parámetros definitorios. Incluir el modelo evita que dos modelos distintos con
 * la misma petición compartan entrada en la caché.
 *
 * @param model      Nombre del modelo.
 * @param parameters Objeto de valor con igualdad por campos (típicamente un record).
 */
public record CacheKey(String model, Object parameters) {

    public CacheKey {
        Objects.requireNonNull(model, "El nombre del modelo no puede ser nulo.");
        Objects.requireNonNull(parameters, "Los parámetros no pueden ser nulos.");
    }
}
