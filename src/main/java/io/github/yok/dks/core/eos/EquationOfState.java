package io.github.yok.dks.core.eos;

import io.github.yok.dks.core.error.DomainException;
import io.github.yok.dks.core.error.EosException;
import io.github.yok.dks.core.error.MissingParameterException;
import io.github.yok.dks.core.error.NonConvergenceException;
import io.github.yok.dks.core.error.RootNotBracketedException;
import io.github.yok.dks.core.param.MineralParameters;

/**
 * 鉱物相の状態方程式を表すインタフェースです。
 *
 * <p>
 * すべての操作は引数だけに依存する純粋関数で、状態を保持しません。 圧力 [Pa]、温度 [K]、体積 [m^3/mol]、エネルギー [J/mol]、エントロピー・熱容量
 * [J/K/mol] の SI 単位を用います。
 * </p>
 *
 * <p>
 * 引数の pressure / temperature / volume は呼び出し形をそろえるために受け取ります。 実装によっては使わない引数があります。
 * </p>
 */
public interface EquationOfState {

    /**
     * 圧力 P(T, V) を返します。
     *
     * @param temperature 温度です
     * @param volume 体積です
     * @param params パラメータセットです
     * @return 圧力です
     */
    double pressure(double temperature, double volume, MineralParameters params);

    /**
     * P(T, V) = pressure を V について解きます。
     *
     * @param pressure 圧力です
     * @param temperature 温度です
     * @param params パラメータセットです
     * @return 体積です
     * @throws RootNotBracketedException 指定圧力が適用範囲外の場合
     * @throws NonConvergenceException 根の精密化が収束しない場合
     * @throws MissingParameterException 必須パラメータが欠落している場合
     * @throws DomainException 探索の開始点が定義域外の場合
     */
    double volume(double pressure, double temperature, MineralParameters params);

    /**
     * {@link #volume(double, double, MineralParameters)} の結果を例外ではなく値として返します。
     *
     * @param pressure 圧力です
     * @param temperature 温度です
     * @param params パラメータセットです
     * @return 逆算結果です
     */
    default VolumeSolution solveVolume(double pressure, double temperature,
            MineralParameters params) {
        try {
            return VolumeSolution.solved(volume(pressure, temperature, params));
        } catch (EosException e) {
            return VolumeSolution.failed(e);
        }
    }

    double grueneisenParameter(double pressure, double temperature, double volume,
            MineralParameters params);

    double heatCapacityV(double pressure, double temperature, double volume,
            MineralParameters params);

    double heatCapacityP(double pressure, double temperature, double volume,
            MineralParameters params);

    double entropy(double pressure, double temperature, double volume, MineralParameters params);

    double helmholtzFreeEnergy(double pressure, double temperature, double volume,
            MineralParameters params);

    double gibbsFreeEnergy(double pressure, double temperature, double volume,
            MineralParameters params);

    double internalEnergy(double pressure, double temperature, double volume,
            MineralParameters params);

    double enthalpy(double pressure, double temperature, double volume, MineralParameters params);

    double isothermalBulkModulus(double pressure, double temperature, double volume,
            MineralParameters params);

    double adiabaticBulkModulus(double pressure, double temperature, double volume,
            MineralParameters params);

    double shearModulus(double pressure, double temperature, double volume,
            MineralParameters params);

    double thermalExpansivity(double pressure, double temperature, double volume,
            MineralParameters params);

    /**
     * 必須パラメータがすべて存在するかを確認します。
     *
     * @param params パラメータセットです
     * @throws MissingParameterException 欠落がある場合（最初に見つかったキーを示します）
     */
    void validateParameters(MineralParameters params);

    /**
     * 指定した量をこのモデルが計算できるかを返します。
     *
     * <p>
     * false の量は例外ではなく 0 を返します。
     * </p>
     *
     * @param property 熱力学量です
     * @return 計算できる場合は true です
     */
    boolean isSupported(ThermodynamicProperty property);
}
