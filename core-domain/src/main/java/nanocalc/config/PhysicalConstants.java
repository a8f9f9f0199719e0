package nanocalc.config;

/**
 * Constantes físicas fundamentales con los valores CODATA 2018.
 * <p>
 * Todas las magnitudes están en unidades SI salvo que el nombre indique lo contrario
 * (sufijos {@code _NM}, {@code _EV}). Ninguna otra clase del sistema debe repetir
 * estos valores como literales.
 */
public final class PhysicalConstants {

    /** Velocidad de la luz en el vacío [m/s]. */
    public static final double SPEED_OF_LIGHT = 2.99792458e8;

    /** Velocidad de la luz en el vacío [nm/s]. */
    public static final double SPEED_OF_LIGHT_NM_S = 2.99792458e17;

    /** Constante de Planck [J·s]. */
    public static final double PLANCK = 6.62607015e-34;

    /** Constante de Planck reducida ℏ [J·s]. */
    public static final double HBAR = 1.054571817e-34;

    /** Constante de Boltzmann [J/K]. */
    public static final double BOLTZMANN = 1.380649e-23;

    /** Carga elemental [C]. */
    public static final double ELEMENTARY_CHARGE = 1.602176634e-19;

    /** Masa del electrón [kg]. */
    public static final double ELECTRON_MASS = 9.1093837015e-31;

    /** Masa del protón [kg]. */
    public static final double PROTON_MASS = 1.67262192369e-27;

    /** Constante de Avogadro [mol⁻¹]. */
    public static final double AVOGADRO = 6.02214076e23;

    /** Permitividad del vacío ε₀ [F/m]. */
    public static final double VACUUM_PERMITTIVITY = 8.8541878128e-12;

    /** Permeabilidad del vacío μ₀ [H/m]. */
    public static final double VACUUM_PERMEABILITY = 1.25663706212e-6;

    /** Constante de estructura fina α (adimensional). */
    public static final double FINE_STRUCTURE = 7.2973525693e-3;

    /** Constante de Rydberg expresada como energía [eV]. */
    public static final double RYDBERG_EV = 13.605693122994;

    /** Radio de Bohr [m]. */
    public static final double BOHR_RADIUS = 5.29177210903e-11;

    /** Radio de Bohr [nm]. */
    public static final double BOHR_RADIUS_NM = 0.0529177210903;

    /** Temperatura de referencia para propiedades tabuladas a temperatura ambiente [K]. */
    public static final double ROOM_TEMPERATURE = 300.0;

    /**
     * Prohibido construir esta clase utilidad
     */
    private PhysicalConstants() {
    }

    /**
     * Factores de conversión entre unidades.
     */
    public static final class Conversions {

        public static final double EV_TO_J = ELEMENTARY_CHARGE;
        public static final double J_TO_EV = 1.0 / ELEMENTARY_CHARGE;
        public static final double NM_TO_M = 1e-9;
        public static final double M_TO_NM = 1e9;
        public static final double NM_TO_UM = 1e-3;

        /** Producto h·c en eV·nm (energía de un fotón a partir de su longitud de onda). */
        public static final double HC_EV_NM = 1239.84193;

        /** Unidad de masa atómica a kg. */
        public static final double AMU_TO_KG = 1.66053906660e-27;

        private Conversions() {
        }
    }

    /**
     * Magnitudes derivadas de uso frecuente.
     */
    public static final class Compound {

        private Compound() {
        }

        /**
         * Energía térmica k_B·T a la temperatura indicada [eV].
         */
        public static double thermalEnergyEv(double temperatureKelvin) {
            return BOLTZMANN * temperatureKelvin * Conversions.J_TO_EV;
        }

        /**
         * Longitud de onda térmica de de Broglie a 300 K para una partícula de masa dada.
         *
         * @param massKg Masa de la partícula [kg].
         * @return La longitud de onda [nm].
         */
        public static double thermalDeBroglieNm(double massKg) {
            double lambda = PLANCK / Math.sqrt(2.0 * Math.PI * massKg * BOLTZMANN * ROOM_TEMPERATURE);
            return lambda * Conversions.M_TO_NM;
        }

        /**
         * Longitud de onda de plasma a partir de la energía de plasma ℏω_p.
         *
         * @param plasmaEnergyEv Energía de plasma [eV].
         * @return La longitud de onda [nm].
         */
        public static double plasmaWavelengthNm(double plasmaEnergyEv) {
            return Conversions.HC_EV_NM / plasmaEnergyEv;
        }
    }
}
