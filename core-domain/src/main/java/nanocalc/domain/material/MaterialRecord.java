package nanocalc.domain.material;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Getter;
import nanocalc.domain.units.Nanometers;
import nanocalc.domain.units.RefractiveIndex;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Propiedades físicas de un material masivo, identificadas por su nombre.
 * <p>
 * El núcleo consume estos registros pero no los posee: los proporciona un
 * {@link MaterialLookup}. Cada familia de propiedades es opcional, porque no todos los
 * materiales tienen datos ópticos, térmicos y electrónicos a la vez.
 * Inmutable y seguro entre hilos.
 */
public final class MaterialRecord {

    @Getter
    private final String name;
    @Getter
    private final List<String> aliases;
    private final NavigableMap<Double, RefractiveIndex> opticalConstants;
    private final Double bulkThermalConductivity;
    private final Double meanFreePathNm;
    private final BandgapParameters bandgap;

    /**
     * @param name                    Nombre canónico (p. ej. "Gold").
     * @param aliases                 Nombres alternativos (p. ej. "Au").
     * @param opticalConstants        Tabla n + ik por longitud de onda; puede ser vacía.
     * @param bulkThermalConductivity Conductividad masiva a 300 K [W/(m·K)]; puede ser nula.
     * @param meanFreePathNm          Camino libre medio de los portadores de calor a 300 K [nm]; puede ser nulo.
     * @param bandgap                 Parámetros de semiconductor; nulo en metales y aislantes sin datos.
     */
    @JsonCreator
    public MaterialRecord(@JsonProperty("name") String name,
                          @JsonProperty("aliases") List<String> aliases,
                          @JsonProperty("opticalConstants") List<OpticalConstant> opticalConstants,
                          @JsonProperty("bulkThermalConductivity") Double bulkThermalConductivity,
                          @JsonProperty("meanFreePathNm") Double meanFreePathNm,
                          @JsonProperty("bandgap") BandgapParameters bandgap) {
        Objects.requireNonNull(name, "El nombre del material no puede ser nulo.");
        if (name.isBlank()) {
            throw new IllegalArgumentException("El nombre del material no puede estar vacío.");
        }
        TreeMap<Double, RefractiveIndex> table = new TreeMap<>();
        if (opticalConstants != null) {
            for (OpticalConstant entry : opticalConstants) {
                if (entry.wavelength() <= 0) {
                    throw new IllegalArgumentException(String.format(
                            "Constante óptica de '%s' con longitud de onda no positiva: %s", name, entry.wavelength()));
                }
                table.put(entry.wavelength(), entry.toIndex());
            }
        }
        this.name = name;
        this.aliases = (aliases == null) ? List.of() : List.copyOf(aliases);
        this.opticalConstants = Collections.unmodifiableNavigableMap(table);
        this.bulkThermalConductivity = bulkThermalConductivity;
        this.meanFreePathNm = meanFreePathNm;
        this.bandgap = bandgap;
    }

    /**
     * Comprueba si el nombre dado (sin distinguir mayúsculas) identifica a este material.
     */
    public boolean matches(String candidate) {
        if (candidate == null) {
            return false;
        }
        String key = candidate.trim().toLowerCase(Locale.ROOT);
        if (name.toLowerCase(Locale.ROOT).equals(key)) {
            return true;
        }
        return aliases.stream().anyMatch(a -> a.toLowerCase(Locale.ROOT).equals(key));
    }

    public boolean hasOpticalData() {
        return !opticalConstants.isEmpty();
    }

    /**
     * Índice de refracción a la longitud de onda indicada.
     * <p>
     * Interpola linealmente entre los dos puntos tabulados más cercanos y satura en los
     * extremos de la tabla.
     *
     * @return El índice, o vacío si el material no tiene datos ópticos.
     */
    public Optional<RefractiveIndex> refractiveIndexAt(Nanometers wavelength) {
        if (opticalConstants.isEmpty()) {
            return Optional.empty();
        }
        double wl = wavelength.value();
        Map.Entry<Double, RefractiveIndex> lower = opticalConstants.floorEntry(wl);
        Map.Entry<Double, RefractiveIndex> upper = opticalConstants.ceilingEntry(wl);
        if (lower == null) {
            return Optional.of(upper.getValue());
        }
        if (upper == null || lower.getKey().equals(upper.getKey())) {
            return Optional.of(lower.getValue());
        }
        double fraction = (wl - lower.getKey()) / (upper.getKey() - lower.getKey());
        return Optional.of(lower.getValue().interpolate(upper.getValue(), fraction));
    }

    /**
     * Rango tabulado [min, max] de longitudes de onda, si existe.
     */
    public Optional<double[]> opticalRange() {
        if (opticalConstants.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new double[]{opticalConstants.firstKey(), opticalConstants.lastKey()});
    }

    public Optional<Double> getBulkThermalConductivity() {
        return Optional.ofNullable(bulkThermalConductivity);
    }

    public Optional<Nanometers> getMeanFreePath() {
        return Optional.ofNullable(meanFreePathNm).map(Nanometers::of);
    }

    public Optional<BandgapParameters> getBandgap() {
        return Optional.ofNullable(bandgap);
    }

    @Override
    public String toString() {
        return "MaterialRecord[" + name + ", puntos ópticos=" + opticalConstants.size() + "]";
    }
}
