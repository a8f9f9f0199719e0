package nanocalc.physics.i;

import nanocalc.domain.optical.OpticalResult;

/**
 * Modelo que calcula scattering, absorción y extinción de una nanoestructura.
 * La variable de barrido es la longitud de onda [nm].
 */
public interface OpticalModel extends PhysicsModel<OpticalResult> {

    @Override
    OpticalModel atSweepPoint(double wavelengthNm);

    @Override
    default String getSweepVariable() {
        return "wavelength";
    }
}
