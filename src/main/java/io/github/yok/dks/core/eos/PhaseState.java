package io.github.yok.dks.core.eos;

import lombok.Builder;
import lombok.Value;

/**
 * ある状態点 (P, T, V) で評価した熱力学量の一式です。
 *
 * <p>
 * 評価のたびに作り直す一時的な値で、呼び出し間で保持されることはありません。
 * </p>
 */
@Value
@Builder
public class PhaseState {

    /** 圧力 [Pa] です。 */
    double pressure;

    /** 温度 [K] です。 */
    double temperature;

    /** 体積 [m^3/mol] です。 */
    double volume;

    /** Helmholtz 自由エネルギー [J/mol] です。 */
    double helmholtzFreeEnergy;

    /** Gibbs 自由エネルギー [J/mol] です。 */
    double gibbsFreeEnergy;

    /** エンタルピー [J/mol] です。 */
    double enthalpy;

    /** 内部エネルギー [J/mol] です。 */
    double internalEnergy;

    /** エントロピー [J/K/mol] です。 */
    double entropy;

    /** Grüneisen パラメータです。 */
    double grueneisenParameter;

    /** 定積熱容量 [J/K/mol] です。 */
    double heatCapacityV;

    /** 定圧熱容量 [J/K/mol] です（未対応のモデルでは 0）。 */
    double heatCapacityP;

    /** 等温体積弾性率 [Pa] です（未対応のモデルでは 0）。 */
    double isothermalBulkModulus;

    /** 断熱体積弾性率 [Pa] です（未対応のモデルでは 0）。 */
    double adiabaticBulkModulus;

    /** 剛性率 [Pa] です（未対応のモデルでは 0）。 */
    double shearModulus;

    /** 熱膨張率 [1/K] です（未対応のモデルでは 0）。 */
    double thermalExpansivity;
}
