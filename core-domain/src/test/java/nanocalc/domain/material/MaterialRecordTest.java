package nanocalc.domain.material;

import com.fasterxml.jackson.databind.ObjectMapper;
import nanocalc.domain.units.Nanometers;
import nanocalc.domain.units.RefractiveIndex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MaterialRecordTest {

    private final MaterialRecord gold = new MaterialRecord("Gold", List.of("Au"),
            List.of(new OpticalConstant(600, 0.25, 2.98),
                    new OpticalConstant(500, 0.97, 1.87)),
            318.0, 37.7, null);

    @Test
    @DisplayName("Búsqueda por nombre: sin distinguir mayúsculas y aceptando alias")
    void matches_shouldBeCaseInsensitiveAndAcceptAliases() {
        assertTrue(gold.matches("gold"));
        assertTrue(gold.matches(" AU "));
        assertFalse(gold.matches("Silver"));
        assertFalse(gold.matches(null));
    }

    @Test
    @DisplayName("Interpolación lineal entre puntos tabulados (entrada desordenada)")
    void refractiveIndexAt_shouldInterpolateLinearly() {
        RefractiveIndex mid = gold.refractiveIndexAt(Nanometers.of(550)).orElseThrow();

        assertEquals(0.61, mid.real(), 1e-12);
        assertEquals(2.425, mid.imaginary(), 1e-12);
        assertEquals(0.97, gold.refractiveIndexAt(Nanometers.of(500)).orElseThrow().real(), 1e-12);
    }

    @Test
    @DisplayName("Fuera de la tabla el índice satura en el extremo más cercano")
    void refractiveIndexAt_shouldClampOutsideTable() {
        assertEquals(RefractiveIndex.of(0.97, 1.87), gold.refractiveIndexAt(Nanometers.of(300)).orElseThrow());
        assertEquals(RefractiveIndex.of(0.25, 2.98), gold.refractiveIndexAt(Nanometers.of(900)).orElseThrow());
        assertArrayEquals(new double[]{500, 600}, gold.opticalRange().orElseThrow());
    }

    @Test
    @DisplayName("Propiedades ausentes se exponen como Optional vacío")
    void missingProperties_shouldBeEmpty() {
        MaterialRecord bare = new MaterialRecord("X", null, null, null, null, null);

        assertFalse(bare.hasOpticalData());
        assertTrue(bare.refractiveIndexAt(Nanometers.of(500)).isEmpty());
        assertTrue(bare.getBulkThermalConductivity().isEmpty());
        assertTrue(bare.getMeanFreePath().isEmpty());
        assertTrue(bare.getBandgap().isEmpty());
        assertEquals(List.of(), bare.getAliases());
    }

    @Test
    @DisplayName("Construcción inválida: nombre vacío o longitud de onda no positiva")
    void constructor_shouldRejectInvalidData() {
        assertThrows(IllegalArgumentException.class,
                () -> new MaterialRecord(" ", null, null, null, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new MaterialRecord("Bad", null, List.of(new OpticalConstant(0, 1, 0)), null, null, null));
    }

    @Test
    @DisplayName("Deserialización JSON de un semiconductor con parámetros de gap")
    void json_shouldDeserializeSemiconductor() throws Exception {
        String json = "{\"name\":\"CdSe\",\"bulkThermalConductivity\":9.0,"
                + "\"bandgap\":{\"bulkBandgapEv\":1.74,\"electronEffectiveMass\":0.13,"
                + "\"holeEffectiveMass\":0.45,\"dielectricConstant\":10.6}}";

        MaterialRecord cdse = new ObjectMapper().readValue(json, MaterialRecord.class);

        assertEquals("CdSe", cdse.getName());
        BandgapParameters gap = cdse.getBandgap().orElseThrow();
        assertEquals(1.74, gap.bulkBandgapEv());
        assertEquals(0.13 * 0.45 / (0.13 + 0.45), gap.reducedMass(), 1e-12);
        assertFalse(cdse.hasOpticalData());
    }
}
