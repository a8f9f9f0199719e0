package nanocalc.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import lombok.extern.jackson.Jacksonized;

/**
 * Configuración del motor de cálculo.
 * <p>
 * Agrupa el paralelismo, la política de caché y los umbrales numéricos del solver de Mie.
 * Puede construirse con el builder o leerse desde JSON; los campos ausentes toman el
 * valor por defecto.
 */
@Value
@Builder
@With
@Jacksonized
public class EngineConfig {

    /**
     * Número de hilos del pool que evalúa los puntos de un barrido en paralelo.
     */
    @Builder.Default
    int cpuProcessorCount = Math.max(1, Runtime.getRuntime().availableProcessors());

    /**
     * Activa la caché de resultados por petición canónica.
     */
    @Builder.Default
    boolean cacheEnabled = true;

    /**
     * Modo estricto: una serie que agota n_max sin cumplir el criterio de truncamiento
     * lanza {@link nanocalc.exception.ConvergenceException} en lugar de devolver un
     * resultado marcado como no convergido.
     */
    @Builder.Default
    boolean failOnNonConvergence = false;

    /**
     * Umbral relativo de truncamiento: la serie se corta cuando la contribución de un término
     * cae por debajo de este valor multiplicado por el mayor término visto.
     */
    @Builder.Default
    double truncationTolerance = 1e-8;

    /**
     * Límite inferior del régimen bien caracterizado del parámetro de tamaño (aviso, no error).
     */
    @Builder.Default
    double minSizeParameter = 0.01;

    /**
     * Límite superior del régimen bien caracterizado del parámetro de tamaño (aviso, no error).
     */
    @Builder.Default
    double maxSizeParameter = 1000.0;

    /**
     * Coeficiente de extinción k por encima del cual se avisa de absorción muy alta.
     */
    @Builder.Default
    double highAbsorptionThreshold = 10.0;

    public static EngineConfig defaults() {
        return EngineConfig.builder().build();
    }

    /**
     * Comprueba la coherencia interna de la configuración.
     *
     * @throws IllegalArgumentException si algún campo es inválido.
     */
    public EngineConfig validated() {
        if (cpuProcessorCount < 1) {
            throw new IllegalArgumentException("cpuProcessorCount debe ser >= 1: " + cpuProcessorCount);
        }
        if (!(truncationTolerance > 0.0 && truncationTolerance < 1.0)) {
            throw new IllegalArgumentException("truncationTolerance debe estar en (0, 1): " + truncationTolerance);
        }
        if (!(minSizeParameter > 0.0 && minSizeParameter < maxSizeParameter)) {
            throw new IllegalArgumentException(String.format(
                    "Rango de parámetro de tamaño inválido: (%s, %s)", minSizeParameter, maxSizeParameter));
        }
        return this;
    }
}
