package nanocalc.domain.thermal;

import lombok.Builder;
import nanocalc.domain.units.Kelvin;
import nanocalc.domain.units.Nanometers;

/**
 * Resultado inmutable del cálculo térmico.
 *
 * @param temperature     Temperatura evaluada [K].
 * @param kappaEffective  Conductividad efectiva de la partícula [W/(m·K)].
 * @param kappaBulk       Conductividad masiva a esa temperatura [W/(m·K)].
 * @param reductionFactor kappaEffective / kappaBulk.
 * @param meanFreePath    Camino libre medio a esa temperatura [nm].
 * @param metadata        Knudsen, régimen y notas.
 */
@Builder
public record ThermalResult(
        Kelvin temperature,
        double kappaEffective,
        double kappaBulk,
        double reductionFactor,
        Nanometers meanFreePath,
        ThermalMetadata metadata
) {
}
