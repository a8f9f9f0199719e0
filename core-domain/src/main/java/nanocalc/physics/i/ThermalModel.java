package nanocalc.physics.i;

import nanocalc.domain.thermal.ThermalResult;

/**
 * Modelo de conductividad térmica. La variable de barrido es la temperatura [K].
 */
public interface ThermalModel extends PhysicsModel<ThermalResult> {

    @Override
    ThermalModel atSweepPoint(double temperatureKelvin);

    @Override
    default String getSweepVariable() {
        return "temperature";
    }
}
