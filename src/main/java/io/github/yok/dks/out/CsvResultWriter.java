package io.github.yok.dks.out;

import io.github.yok.dks.core.eos.PhaseState;
import io.github.yok.dks.core.eos.SweepPoint;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

/**
 * 計算結果を CSV に出力するクラスです。
 *
 * <p>
 * 出力ファイル名は {@code dks_<相の名前>_T=<温度>.csv}（例: {@code dks_periclase_T=2000.0.csv}）です。 体積が求まらなかった点も
 * status と message 付きで 1 行出力し、数値列は空欄にします。
 * </p>
 */
public final class CsvResultWriter implements ResultWriter {

    /**
     * ファイル名の先頭固定文字列です。
     */
    private static final String FILE_HEAD = "dks";

    /**
     * CSV のヘッダです。
     */
    static final String[] HEADER = {"pressure", "temperature", "status", "volume", "helmholtz",
            "gibbs", "enthalpy", "internalEnergy", "entropy", "grueneisen", "heatCapacityV",
            "message"};

    /**
     * 出力先ディレクトリです。
     */
    private final Path outputDir;

    /**
     * CSV 出力を生成します。
     *
     * @param outputDir 出力先ディレクトリです
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public CsvResultWriter(String outputDir) {
        if (outputDir == null || outputDir.isEmpty()) {
            throw new IllegalArgumentException("output.dir は必須です");
        }
        this.outputDir = Paths.get(outputDir);
    }

    /**
     * 1 つの温度での圧力スイープ結果を出力します。
     *
     * @param mineralName 相の名前です
     * @param temperature 温度 [K] です
     * @param points 点ごとの評価結果です
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     * @throws IllegalStateException 出力に失敗した場合に発生します
     */
    @Override
    public void write(String mineralName, double temperature, List<SweepPoint> points) {
        if (mineralName == null || mineralName.isEmpty()) {
            throw new IllegalArgumentException("相の名前は必須です");
        }
        if (!Double.isFinite(temperature)) {
            throw new IllegalArgumentException("温度は有限値を指定してください: " + temperature);
        }
        if (points == null) {
            throw new IllegalArgumentException("points は null 不可です");
        }

        Path file = outputDir.resolve(buildFileName(mineralName, temperature));
        try {
            Files.createDirectories(outputDir);

            try (Writer w = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
                    CSVPrinter pr = CSVFormat.Builder.create(CSVFormat.DEFAULT).setHeader(HEADER)
                            .build().print(w)) {

                for (SweepPoint pt : points) {
                    Optional<PhaseState> st = pt.getState();
                    if (st.isPresent()) {
                        PhaseState s = st.get();
                        pr.printRecord(pt.getPressure(), pt.getTemperature(),
                                pt.getSolution().getStatus(), s.getVolume(),
                                s.getHelmholtzFreeEnergy(), s.getGibbsFreeEnergy(),
                                s.getEnthalpy(), s.getInternalEnergy(), s.getEntropy(),
                                s.getGrueneisenParameter(), s.getHeatCapacityV(), "");
                    } else {
                        pr.printRecord(pt.getPressure(), pt.getTemperature(),
                                pt.getSolution().getStatus(), "", "", "", "", "", "", "", "",
                                pt.getSolution().getMessage());
                    }
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("CSV 出力に失敗しました: " + file, e);
        }
    }

    /**
     * 命名規約に従ってファイル名を作成します。
     *
     * <p>
     * 例: {@code dks_periclase_T=2000.0.csv}
     * </p>
     *
     * @param mineralName 相の名前です
     * @param temperature 温度です
     * @return ファイル名です
     */
    static String buildFileName(String mineralName, double temperature) {
        return FILE_HEAD + "_" + mineralName + "_T=" + formatT(temperature) + ".csv";
    }

    /**
     * 温度を小数点以下1桁に整形します（ファイル名用）。
     *
     * @param t 温度です
     * @return 整形文字列（例: 2000.0）
     */
    private static String formatT(double t) {
        return String.format(Locale.ROOT, "%.1f", t);
    }
}
