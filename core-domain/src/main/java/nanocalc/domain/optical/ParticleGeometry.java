package nanocalc.domain.optical;

import nanocalc.domain.units.Nanometers;

import java.util.Objects;

/**
 * Geometría de una partícula esférica homogénea.
 *
 * @param radius Radio de la esfera [nm] (> 0).
 */
public record ParticleGeometry(Nanometers radius) {

    public ParticleGeometry {
        Objects.requireNonNull(radius, "El radio no puede ser nulo.");
        if (!radius.isPositive()) {
            throw new IllegalArgumentException("El radio de la partícula debe ser positivo: " + radius);
        }
    }

    /**
     * Sección geométrica π·r² [nm²].
     */
    public double geometricCrossSection() {
        return Math.PI * radius.value() * radius.value();
    }
}
