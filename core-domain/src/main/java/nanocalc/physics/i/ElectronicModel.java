package nanocalc.physics.i;

import nanocalc.domain.electronic.ElectronicResult;

/**
 * Modelo de propiedades electrónicas dependientes del tamaño.
 * La variable de barrido es el diámetro [nm].
 */
public interface ElectronicModel extends PhysicsModel<ElectronicResult> {

    @Override
    ElectronicModel atSweepPoint(double diameterNm);

    @Override
    default String getSweepVariable() {
        return "diameter";
    }
}
