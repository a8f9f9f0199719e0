package nanocalc.domain.optical;

import nanocalc.domain.units.Nanometers;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParticleGeometryTest {

    @Test
    @DisplayName("Sección geométrica π·r²")
    void geometricCrossSection_shouldBePiRSquared() {
        assertEquals(Math.PI * 2500, new ParticleGeometry(Nanometers.of(50)).geometricCrossSection(), 1e-9);
    }

    @Test
    @DisplayName("Radio nulo o no positivo: la geometría no se construye")
    void constructor_nonPositiveRadius_shouldFail() {
        assertThrows(NullPointerException.class, () -> new ParticleGeometry(null));
        assertThrows(IllegalArgumentException.class, () -> new ParticleGeometry(Nanometers.of(0)));
    }
}
