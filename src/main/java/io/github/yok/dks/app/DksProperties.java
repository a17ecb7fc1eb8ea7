package io.github.yok.dks.app;

import io.github.yok.dks.core.param.ParameterKey;
import io.github.yok.dks.core.solver.RootSearchSettings;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * dks-eos の設定値（dks.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "dks")
public class DksProperties {

    /**
     * 鉱物相の較正パラメータです。
     */
    @Valid
    private Mineral mineral = new Mineral();

    /**
     * 体積逆算の数値設定です。
     */
    private RootSearch rootSearch = new RootSearch();

    /**
     * (P, T) スイープの設定です。
     */
    @Valid
    private Sweep sweep = new Sweep();

    /**
     * 出力設定です。
     */
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "dks")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Mineral m = getMineral();
        RootSearch r = getRootSearch();
        Sweep s = getSweep();
        Output o = getOutput();

        // 先頭改行を入れて、ログの可読性を上げます。
        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "mineral",
                // name: 相の名前
                "name", m.getName(),
                // V_0: 基準体積 [m^3/mol]
                "V_0", m.getV0(),
                // T_0: 基準温度 [K]
                "T_0", m.getT0(),
                // E_0: 基準内部エネルギー [J/mol]
                "E_0", m.getE0(),
                // S_0: 基準エントロピー [J/K/mol]
                "S_0", m.getS0(),
                // K_0: 基準等温体積弾性率 [Pa]
                "K_0", m.getK0(),
                // Kprime_0: K0 の圧力一階微分
                "Kprime_0", m.getKprime0(),
                // Kdprime_0: K0 の圧力二階微分 [1/Pa]
                "Kdprime_0", m.getKdprime0(),
                // n: 化学式あたりの原子数
                "n", m.getN(),
                // Cv: 定積熱容量 [J/K/mol]
                "Cv", m.getCv(),
                // grueneisen_0: 基準 Grüneisen パラメータ
                "grueneisen_0", m.getGrueneisen0(),
                // q_0: Grüneisen パラメータの体積指数
                "q_0", m.getQ0());

        appendSection(sb, nl, "rootSearch",
                // bracketSearchFactor: 挟み込み探索の拡大率
                "bracketSearchFactor", r.getBracketSearchFactor(),
                // initialBracketFraction: 初期探索幅（V0 比）
                "initialBracketFraction", r.getInitialBracketFraction(),
                // maxBracketIterations: 挟み込み探索の最大反復回数
                "maxBracketIterations", r.getMaxBracketIterations(),
                // rootRelativeTolerance: Brent 法の相対許容誤差
                "rootRelativeTolerance", r.getRootRelativeTolerance(),
                // rootAbsoluteTolerance: Brent 法の絶対許容誤差
                "rootAbsoluteTolerance", r.getRootAbsoluteTolerance(),
                // maxRootIterations: Brent 法の最大評価回数
                "maxRootIterations", r.getMaxRootIterations());

        appendSection(sb, nl, "sweep",
                // pressures: 圧力の一覧 [Pa]
                "pressures", s.getPressures(),
                // temperatures: 温度の一覧 [K]
                "temperatures", s.getTemperatures());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * <pre>
     *   section:
     *     key: value
     * </pre>
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    /**
     * 鉱物相の較正パラメータです。
     *
     * <p>
     * 値を省略したパラメータは欠落として扱い、起動時の検証で失敗します（既定値で補いません）。
     * </p>
     */
    @Data
    public static class Mineral {

        /**
         * 相の名前です。
         */
        @NotBlank
        private String name = "mineral";

        private Double v0;

        private Double t0;

        private Double e0;

        private Double s0;

        private Double k0;

        private Double kprime0;

        private Double kdprime0;

        private Double n;

        private Double cv;

        private Double grueneisen0;

        private Double q0;

        /**
         * パラメータ表のキー名で並べた対応を返します（省略値は null のまま含みます）。
         *
         * @return キー名と値の対応です
         */
        public Map<String, Double> toParameterMap() {
            Map<String, Double> m = new LinkedHashMap<>();
            m.put(ParameterKey.V_0.getKey(), v0);
            m.put(ParameterKey.T_0.getKey(), t0);
            m.put(ParameterKey.E_0.getKey(), e0);
            m.put(ParameterKey.S_0.getKey(), s0);
            m.put(ParameterKey.K_0.getKey(), k0);
            m.put(ParameterKey.KPRIME_0.getKey(), kprime0);
            m.put(ParameterKey.KDPRIME_0.getKey(), kdprime0);
            m.put(ParameterKey.N.getKey(), n);
            m.put(ParameterKey.CV.getKey(), cv);
            m.put(ParameterKey.GRUENEISEN_0.getKey(), grueneisen0);
            m.put(ParameterKey.Q_0.getKey(), q0);
            return m;
        }
    }

    /**
     * 体積逆算（挟み込み探索 + Brent 法）の数値設定です。
     */
    @Data
    public static class RootSearch {

        /**
         * 挟み込み探索の拡大率です。
         */
        private double bracketSearchFactor = RootSearchSettings.DEFAULT_BRACKET_SEARCH_FACTOR;

        /**
         * 初期探索幅（V0 比）です。
         */
        private double initialBracketFraction =
                RootSearchSettings.DEFAULT_INITIAL_BRACKET_FRACTION;

        /**
         * 挟み込み探索の最大反復回数です。
         */
        private int maxBracketIterations = RootSearchSettings.DEFAULT_MAX_BRACKET_ITERATIONS;

        /**
         * Brent 法の相対許容誤差です。
         */
        private double rootRelativeTolerance = RootSearchSettings.DEFAULT_ROOT_RELATIVE_TOLERANCE;

        /**
         * Brent 法の絶対許容誤差 [m^3/mol] です。
         */
        private double rootAbsoluteTolerance = RootSearchSettings.DEFAULT_ROOT_ABSOLUTE_TOLERANCE;

        /**
         * Brent 法の最大評価回数です。
         */
        private int maxRootIterations = RootSearchSettings.DEFAULT_MAX_ROOT_ITERATIONS;

        /**
         * 数値設定オブジェクトに変換します。
         *
         * @return 数値設定です
         * @throws IllegalArgumentException 値が不正な場合に発生します
         */
        public RootSearchSettings toSettings() {
            return new RootSearchSettings(bracketSearchFactor, initialBracketFraction,
                    maxBracketIterations, rootRelativeTolerance, rootAbsoluteTolerance,
                    maxRootIterations);
        }
    }

    @Data
    public static class Sweep {

        /**
         * 計算する圧力 [Pa] の一覧です。
         */
        @NotEmpty
        private List<Double> pressures = List.of();

        /**
         * 計算する温度 [K] の一覧です。
         */
        @NotEmpty
        private List<Double> temperatures = List.of();
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";
    }
}
