package nanocalc.physics.model;

import lombok.Getter;
import nanocalc.config.PhysicalConstants;
import nanocalc.domain.electronic.ConfinementRegime;
import nanocalc.domain.electronic.ElectronicMetadata;
import nanocalc.domain.electronic.ElectronicRequest;
import nanocalc.domain.electronic.ElectronicResult;
import nanocalc.domain.material.BandgapParameters;
import nanocalc.domain.units.ElectronVolts;
import nanocalc.domain.units.Nanometers;
import nanocalc.exception.CalculationException;
import nanocalc.exception.NumericalInstabilityException;
import nanocalc.exception.ValidationException;
import nanocalc.physics.i.CacheKey;
import nanocalc.physics.i.ElectronicModel;
import nanocalc.validation.ParameterValidator;
import nanocalc.validation.ValidationReport;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Gap de un punto cuántico esférico según la ecuación de Brus (aproximación de masa efectiva):
 * <pre>
 *   E(r) = E_g + ħ²π²/(2r²)·(1/m_e* + 1/m_h*) − 1.786·e²/(4πε₀ε_r·r)
 * </pre>
 */
public class BrusElectronicModel implements ElectronicModel {

    public static final String NAME = "Brus";

    // Coeficiente de la interacción coulombiana electrón-hueco en la esfera (Brus, 1984).
    private static final double COULOMB_COEFFICIENT = 1.786;
    private static final double EFFECTIVE_MASS_MIN_DIAMETER = 1.0;

    @Getter
    private final ElectronicRequest request;

    public BrusElectronicModel(ElectronicRequest request) {
        this.request = Objects.requireNonNull(request, "La petición no puede ser nula.");
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getDescription() {
        return "Gap dependiente del tamaño por confinamiento cuántico (ecuación de Brus)";
    }

    @Override
    public ValidationReport validate() throws ValidationException {
        BandgapParameters p = request.parameters();
        return ParameterValidator.start()
                .requirePositive("diameter", request.diameter().value())
                .requireNonNegative("bulkBandgap", p.bulkBandgapEv())
                .requirePositive("electronEffectiveMass", p.electronEffectiveMass())
                .requirePositive("holeEffectiveMass", p.holeEffectiveMass())
                .requireInRange("dielectricConstant", p.dielectricConstant(), 1.0, Double.MAX_VALUE)
                .warnIfBelow("diameter", request.diameter().value(), EFFECTIVE_MASS_MIN_DIAMETER,
                        "partícula por debajo de 1 nm, la masa efectiva no es aplicable")
                .report();
    }

    @Override
    public ElectronicResult compute() throws CalculationException {
        ValidationReport report = validate();
        BandgapParameters p = request.parameters();

        double radiusMeters = request.radius().toMeters();
        double hbar = PhysicalConstants.HBAR;
        double me = PhysicalConstants.ELECTRON_MASS;
        double e = PhysicalConstants.ELEMENTARY_CHARGE;

        double inverseMasses = 1.0 / (p.electronEffectiveMass() * me) + 1.0 / (p.holeEffectiveMass() * me);
        double confinementJ = hbar * hbar * Math.PI * Math.PI / (2.0 * radiusMeters * radiusMeters) * inverseMasses;
        double coulombJ = -COULOMB_COEFFICIENT * e * e
                / (4.0 * Math.PI * PhysicalConstants.VACUUM_PERMITTIVITY * p.dielectricConstant() * radiusMeters);

        ElectronVolts confinement = ElectronVolts.fromJoules(confinementJ);
        ElectronVolts coulomb = ElectronVolts.fromJoules(coulombJ);
        double gap = p.bulkBandgapEv() + confinement.value() + coulomb.value();
        if (!Double.isFinite(gap)) {
            throw new NumericalInstabilityException("gap no finito para d=" + request.diameter());
        }

        double reducedMass = p.reducedMass();
        Nanometers bohrRadius = Nanometers.of(p.dielectricConstant() * PhysicalConstants.BOHR_RADIUS_NM / reducedMass);
        ConfinementRegime regime = ConfinementRegime.fromRatio(request.radius().value() / bohrRadius.value());

        List<String> notes = new ArrayList<>(report.getWarnings());
        if (gap < p.bulkBandgapEv()) {
            notes.add("El término coulombiano domina: gap por debajo del masivo, fuera del régimen de confinamiento");
        }
        if (regime == ConfinementRegime.WEAK) {
            notes.add("Confinamiento débil: la ecuación de Brus sobreestima el desplazamiento");
        }

        return ElectronicResult.builder()
                .diameter(request.diameter())
                .bandgap(ElectronVolts.of(gap))
                .bulkBandgap(ElectronVolts.of(p.bulkBandgapEv()))
                .confinementEnergy(confinement)
                .coulombCorrection(coulomb)
                .excitonBohrRadius(bohrRadius)
                .regime(regime)
                .metadata(new ElectronicMetadata(reducedMass, p.dielectricConstant(), NAME, notes))
                .build();
    }

    @Override
    public BrusElectronicModel atSweepPoint(double diameterNm) {
        return new BrusElectronicModel(request.withDiameter(Nanometers.of(diameterNm)));
    }

    @Override
    public Optional<CacheKey> cacheKey() {
        return Optional.of(new CacheKey(NAME, request));
    }
}
