package nanocalc.domain.units;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UnitTypesTest {

    @Test
    @DisplayName("Nanometers: conversión a metros y micrómetros")
    void nanometers_shouldConvertLengths() {
        Nanometers wl = Nanometers.of(520.0);

        assertEquals(5.2e-7, wl.toMeters(), 1e-20);
        assertEquals(0.52, wl.toMicrometers(), 1e-12);
        assertEquals(520.0, Nanometers.fromMeters(5.2e-7).value(), 1e-9);
        assertEquals(260.0, wl.times(0.5).value(), 1e-12);
        assertTrue(wl.compareTo(Nanometers.of(600)) < 0);
    }

    @Test
    @DisplayName("Los tipos con unidad rechazan valores no finitos")
    void unitTypes_shouldRejectNonFiniteValues() {
        assertThrows(IllegalArgumentException.class, () -> Nanometers.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> Kelvin.of(Double.POSITIVE_INFINITY));
        assertThrows(IllegalArgumentException.class, () -> ElectronVolts.of(Double.NaN));
        assertThrows(IllegalArgumentException.class, () -> RefractiveIndex.of(1.5, Double.NaN));
    }

    @Test
    @DisplayName("Kelvin: ida y vuelta con Celsius")
    void kelvin_shouldConvertCelsius() {
        assertEquals(298.15, Kelvin.fromCelsius(25.0).value(), 1e-12);
        assertEquals(-273.15, Kelvin.of(0.0).toCelsius(), 1e-12);
    }

    @Test
    @DisplayName("ElectronVolts: energía del fotón E = hc/λ")
    void electronVolts_shouldComputePhotonEnergy() {
        ElectronVolts photon = ElectronVolts.photonEnergy(Nanometers.of(500.0));

        assertEquals(2.4797, photon.value(), 1e-4);
        assertEquals(photon.value() * 1.602176634e-19, photon.toJoules(), 1e-30);
        assertThrows(IllegalArgumentException.class, () -> ElectronVolts.photonEnergy(Nanometers.of(0.0)));
    }

    @Test
    @DisplayName("RefractiveIndex: permitividad ε = (n + ik)² e interpolación lineal")
    void refractiveIndex_shouldComputePermittivityAndInterpolate() {
        RefractiveIndex index = RefractiveIndex.of(0.47, 2.40);

        Complex epsilon = index.toPermittivity();
        assertEquals(0.47 * 0.47 - 2.40 * 2.40, epsilon.re(), 1e-12);
        assertEquals(2 * 0.47 * 2.40, epsilon.im(), 1e-12);

        RefractiveIndex mid = RefractiveIndex.of(1.0, 2.0).interpolate(RefractiveIndex.of(2.0, 4.0), 0.25);
        assertEquals(1.25, mid.real(), 1e-12);
        assertEquals(2.5, mid.imaginary(), 1e-12);
        assertEquals(new Complex(1.33, 0.0), RefractiveIndex.real(1.33).toComplex());
    }
}
