package nanocalc.domain.material;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Parámetros de un semiconductor masivo necesarios para la ecuación de Brus.
 *
 * @param bulkBandgapEv          Gap del material masivo [eV].
 * @param electronEffectiveMass  Masa efectiva del electrón (en unidades de m_e).
 * @param holeEffectiveMass      Masa efectiva del hueco (en unidades de m_e).
 * @param dielectricConstant     Constante dieléctrica relativa ε_r.
 */
public record BandgapParameters(
        double bulkBandgapEv,
        double electronEffectiveMass,
        double holeEffectiveMass,
        double dielectricConstant
) {
    @JsonCreator
    public BandgapParameters(@JsonProperty("bulkBandgapEv") double bulkBandgapEv,
                             @JsonProperty("electronEffectiveMass") double electronEffectiveMass,
                             @JsonProperty("holeEffectiveMass") double holeEffectiveMass,
                             @JsonProperty("dielectricConstant") double dielectricConstant) {
        this.bulkBandgapEv = bulkBandgapEv;
        this.electronEffectiveMass = electronEffectiveMass;
        this.holeEffectiveMass = holeEffectiveMass;
        this.dielectricConstant = dielectricConstant;
    }

    /**
     * Masa reducida del excitón μ* = m_e*·m_h* / (m_e* + m_h*).
     */
    public double reducedMass() {
        return electronEffectiveMass * holeEffectiveMass / (electronEffectiveMass + holeEffectiveMass);
    }
}
