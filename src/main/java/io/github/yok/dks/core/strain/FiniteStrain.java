package io.github.yok.dks.core.strain;

import io.github.yok.dks.core.param.MineralParameters;

/**
 * Euler 有限歪みとその 4 次展開による圧縮自由エネルギーを計算するクラスです。
 *
 * <p>
 * f = 1/2 [(V0/V)^(2/3) - 1] を展開変数とし、 F_cmp = 9 K0 V0 (f^2/2 + a3 f^3/6 + a4 f^4/24) の 4
 * 次打ち切りを用います。 係数 a3, a4 は 3 次・4 次の Euler 有限歪み展開の係数を整理したもので、自由パラメータではありません。
 * </p>
 *
 * <p>
 * V <= 0 は検査しません。 べき乗が返す NaN / 無限大はそのまま呼び出し側へ伝播します。
 * </p>
 */
public final class FiniteStrain {

    private FiniteStrain() {}

    /**
     * Euler 有限歪み f(V) を返します。
     *
     * @param volume 体積 V [m^3/mol] です
     * @param params パラメータセットです
     * @return 有限歪み f です
     */
    public static double finiteStrain(double volume, MineralParameters params) {
        return 0.5 * (Math.pow(params.v0() / volume, 2.0 / 3.0) - 1.0);
    }

    /**
     * 3 次の展開係数 a3 = 3 (K0' - 4) を返します。
     *
     * @param params パラメータセットです
     * @return a3 です
     */
    public static double thirdOrderCoefficient(MineralParameters params) {
        return 3.0 * (params.kprime0() - 4.0);
    }

    /**
     * 4 次の展開係数 a4 = 9 [K0 K0'' + K0' (K0' - 7)] + 143 を返します。
     *
     * @param params パラメータセットです
     * @return a4 です
     */
    public static double fourthOrderCoefficient(MineralParameters params) {
        double kprime0 = params.kprime0();
        return 9.0 * (params.k0() * params.kdprime0() + kprime0 * (kprime0 - 7.0)) + 143.0;
    }

    /**
     * 圧縮自由エネルギー F_cmp(V) [J/mol] を返します。
     *
     * @param volume 体積 V [m^3/mol] です
     * @param params パラメータセットです
     * @return 圧縮自由エネルギーです
     */
    public static double compressiveFreeEnergy(double volume, MineralParameters params) {
        double f = finiteStrain(volume, params);
        double a3 = thirdOrderCoefficient(params);
        double a4 = fourthOrderCoefficient(params);
        return 9.0 * params.k0() * params.v0()
                * (f * f / 2.0 + a3 * f * f * f / 6.0 + a4 * f * f * f * f / 24.0);
    }

    /**
     * 圧縮項の圧力 -dF_cmp/dV [Pa] を返します。
     *
     * <p>
     * P_cmp = 3 K0 (1+2f)^(5/2) (f + a3 f^2/2 + a4 f^3/6)
     * </p>
     *
     * @param volume 体積 V [m^3/mol] です
     * @param params パラメータセットです
     * @return 圧縮項の圧力です
     */
    public static double compressivePressure(double volume, MineralParameters params) {
        double f = finiteStrain(volume, params);
        double a3 = thirdOrderCoefficient(params);
        double a4 = fourthOrderCoefficient(params);
        return 3.0 * params.k0() * Math.pow(1.0 + 2.0 * f, 2.5)
                * (f + a3 * f * f / 2.0 + a4 / 6.0 * f * f * f);
    }
}
