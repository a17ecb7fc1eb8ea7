package io.github.yok.dks.core.param;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 有限歪み固体 EOS に必要な較正パラメータのキーを表す列挙型です。
 *
 * <p>
 * 宣言順は欠落チェックの順序でもあります。
 * </p>
 */
@Getter
@RequiredArgsConstructor
public enum ParameterKey {

    /** 基準体積 V0 [m^3/mol] です。 */
    V_0("V_0"),

    /** 基準温度 T0 [K] です。 */
    T_0("T_0"),

    /** 基準内部エネルギー E0 [J/mol] です。 */
    E_0("E_0"),

    /** 基準エントロピー S0 [J/K/mol] です。 */
    S_0("S_0"),

    /** 基準等温体積弾性率 K0 [Pa] です。 */
    K_0("K_0"),

    /** K0 の圧力一階微分 K0' です。 */
    KPRIME_0("Kprime_0"),

    /** K0 の圧力二階微分 K0'' [1/Pa] です。 */
    KDPRIME_0("Kdprime_0"),

    /** 化学式あたりの原子数 n です。 */
    N("n"),

    /** 定積熱容量 Cv [J/K/mol] です（温度非依存）。 */
    CV("Cv"),

    /** 基準 Grüneisen パラメータ γ0 です。 */
    GRUENEISEN_0("grueneisen_0"),

    /** Grüneisen パラメータの体積指数 q0 です。 */
    Q_0("q_0");

    /**
     * パラメータ表で用いるキー名です。
     */
    private final String key;
}
