package io.github.yok.dks;

import io.github.yok.dks.core.param.MineralParameters;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * テストで共通に使うパラメータセットです。
 */
public final class ReferenceMinerals {

    public static final double V0 = 1.0e-5;
    public static final double T0 = 300.0;
    public static final double K0 = 250.0e9;
    public static final double CV = 100.0;
    public static final double GAMMA0 = 1.5;

    private ReferenceMinerals() {}

    /**
     * V0=1e-5, T0=300, K0=250 GPa, K0'=4, K0''=-0.02/GPa, Cv=100, γ0=1.5, q0=1, S0=E0=0, n=1 の相です。
     *
     * @return パラメータセットです
     */
    public static MineralParameters userMineral() {
        return MineralParameters.of("user_mineral", rawParameters());
    }

    /**
     * {@link #userMineral()} と同じ値のキー名と値の対応です（変更可能なコピー）。
     *
     * @return キー名と値の対応です
     */
    public static Map<String, Double> rawParameters() {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("V_0", V0);
        m.put("T_0", T0);
        m.put("E_0", 0.0);
        m.put("S_0", 0.0);
        m.put("K_0", K0);
        m.put("Kprime_0", 4.0);
        m.put("Kdprime_0", -0.02e-9);
        m.put("n", 1.0);
        m.put("Cv", CV);
        m.put("grueneisen_0", GAMMA0);
        m.put("q_0", 1.0);
        return m;
    }
}
