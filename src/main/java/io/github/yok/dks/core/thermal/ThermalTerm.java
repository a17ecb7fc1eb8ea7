package io.github.yok.dks.core.thermal;

import io.github.yok.dks.core.error.DomainException;
import io.github.yok.dks.core.param.MineralParameters;

/**
 * 自由エネルギーの熱的寄与 F_th(T, V) と関連量を計算するクラスです。
 *
 * <p>
 * Grüneisen パラメータを γ(V) = γ0 (V/V0)^q0 と仮定し、 α K_T(V, T0) の V0 から V までの積分を解析的に評価します。 Cv
 * は温度・体積に依存しない定数として扱います。
 * </p>
 */
public final class ThermalTerm {

    private ThermalTerm() {}

    /**
     * Grüneisen パラメータ γ(V) = γ0 (V/V0)^q0 を返します。
     *
     * @param volume 体積 V [m^3/mol] です
     * @param params パラメータセットです
     * @return Grüneisen パラメータです
     */
    public static double grueneisenParameter(double volume, MineralParameters params) {
        return params.grueneisen0() * Math.pow(volume / params.v0(), params.q0());
    }

    /**
     * α K_T(V, T0) を V0 から V まで積分した値 I(V) を返します。
     *
     * <p>
     * I(V) = Cv γ0 / q0 [(V/V0)^q0 - 1] です。 q0 = 0 では極限 Cv γ0 ln(V/V0) を返します。
     * </p>
     *
     * @param volume 体積 V [m^3/mol] です
     * @param params パラメータセットです
     * @return 積分値 [J/K/mol] です
     */
    public static double thermalPressureIntegral(double volume, MineralParameters params) {
        double q0 = params.q0();
        double ratio = volume / params.v0();
        if (q0 == 0.0) {
            return params.cv() * params.grueneisen0() * Math.log(ratio);
        }
        return params.cv() * params.grueneisen0() / q0 * (Math.pow(ratio, q0) - 1.0);
    }

    /**
     * 熱的自由エネルギー F_th(T, V) [J/mol] を返します。
     *
     * <p>
     * F_th = -S0 (T-T0) - Cv [T ln(T/T0) - (T-T0)] - I(V) (T-T0)
     * </p>
     *
     * @param temperature 温度 T [K] です
     * @param volume 体積 V [m^3/mol] です
     * @param params パラメータセットです
     * @return 熱的自由エネルギーです
     * @throws DomainException T または T0 が正でない場合
     */
    public static double thermalFreeEnergy(double temperature, double volume,
            MineralParameters params) {
        double t0 = params.t0();
        checkTemperatures(temperature, t0);
        double dt = temperature - t0;
        return -params.s0() * dt - params.cv() * (temperature * Math.log(temperature / t0) - dt)
                - thermalPressureIntegral(volume, params) * dt;
    }

    /**
     * 熱的エントロピー I(V) + Cv ln(T/T0) [J/K/mol] を返します（S0 は含みません）。
     *
     * @param temperature 温度 T [K] です
     * @param volume 体積 V [m^3/mol] です
     * @param params パラメータセットです
     * @return 熱的エントロピーです
     * @throws DomainException T または T0 が正でない場合
     */
    public static double thermalEntropy(double temperature, double volume,
            MineralParameters params) {
        double t0 = params.t0();
        checkTemperatures(temperature, t0);
        return thermalPressureIntegral(volume, params)
                + params.cv() * Math.log(temperature / t0);
    }

    /**
     * 熱圧力 Cv (T-T0) γ(V) / V [Pa] を返します。
     *
     * @param temperature 温度 T [K] です
     * @param volume 体積 V [m^3/mol] です
     * @param params パラメータセットです
     * @return 熱圧力です
     */
    public static double thermalPressure(double temperature, double volume,
            MineralParameters params) {
        return params.cv() * (temperature - params.t0()) * grueneisenParameter(volume, params)
                / volume;
    }

    /**
     * 対数を取る温度が正であることを確認します。
     *
     * @param temperature 温度 T です
     * @param t0 基準温度 T0 です
     * @throws DomainException いずれかが正でない（NaN を含む）場合
     */
    private static void checkTemperatures(double temperature, double t0) {
        if (!(temperature > 0.0)) {
            throw new DomainException("温度は正である必要があります: T=" + temperature);
        }
        if (!(t0 > 0.0)) {
            throw new DomainException("基準温度は正である必要があります: T_0=" + t0);
        }
    }
}
