package io.github.yok.dks.core.eos;

/**
 * 状態方程式が返す熱力学量の種類です。
 */
public enum ThermodynamicProperty {
    PRESSURE, VOLUME, GRUENEISEN_PARAMETER, HEAT_CAPACITY_V, HEAT_CAPACITY_P, ENTROPY,
    HELMHOLTZ_FREE_ENERGY, GIBBS_FREE_ENERGY, INTERNAL_ENERGY, ENTHALPY,
    ISOTHERMAL_BULK_MODULUS, ADIABATIC_BULK_MODULUS, SHEAR_MODULUS, THERMAL_EXPANSIVITY
}
