package io.github.yok.dks.app;

import io.github.yok.dks.core.eos.PhaseStateCalculator;
import io.github.yok.dks.core.eos.SweepPoint;
import io.github.yok.dks.out.ResultWriter;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * CLI で dks-eos を実行するクラスです。
 *
 * <p>
 * 温度ごとに圧力をスキャンし、各 (P, T) で体積を逆算して熱力学量を評価します。 適用範囲外の点は飛ばして続行します。
 * </p>
 */
@Component
@RequiredArgsConstructor
public class DksCliRunner implements CommandLineRunner {

    /**
     * dks-eos の設定値（dks.*）です。
     */
    private final DksProperties properties;

    /**
     * 熱力学量の計算器です。
     */
    private final PhaseStateCalculator phaseStateCalculator;

    /**
     * 結果出力ロジックです。
     */
    private final ResultWriter resultWriter;

    /**
     * CLI 実行を開始します。
     *
     * @param args 起動引数です
     */
    @Override
    public void run(String... args) {
        System.out.println("=== dks-eos start: evaluate finite-strain solid EOS ===");
        System.out.print(properties.toMultilineString());

        List<Double> pressureList = properties.getSweep().getPressures();
        List<Double> temperatures = properties.getSweep().getTemperatures();
        if (pressureList == null || pressureList.isEmpty()) {
            throw new IllegalStateException("sweep.pressures は必須です（圧力の一覧を指定してください）");
        }
        if (temperatures == null || temperatures.isEmpty()) {
            throw new IllegalStateException("sweep.temperatures は必須です（温度の一覧を指定してください）");
        }

        double[] pressures = new double[pressureList.size()];
        for (int i = 0; i < pressures.length; i++) {
            Double pObj = pressureList.get(i);
            if (pObj == null) {
                throw new IllegalStateException("sweep.pressures に null が含まれています");
            }
            pressures[i] = pObj.doubleValue();
        }

        String name = phaseStateCalculator.getParameters().getName();

        // 温度ごとに圧力スイープを実行
        for (int i = 0; i < temperatures.size(); i++) {
            Double tObj = temperatures.get(i);
            if (tObj == null) {
                throw new IllegalStateException("sweep.temperatures に null が含まれています");
            }
            double t = tObj.doubleValue();

            System.out.println("=== 温度ごとの計算 ===");
            System.out.println("入力: 相=" + name + ", T=" + fmt(t) + "（点数=" + pressures.length
                    + ", step=" + (i + 1) + "/" + temperatures.size() + "）");

            List<SweepPoint> points = phaseStateCalculator.sweep(pressures, t);
            resultWriter.write(name, t, points);

            long solved = points.stream().filter(pt -> pt.getSolution().isSolved()).count();
            System.out.println("結果: 成功=" + solved + ", 範囲外など=" + (points.size() - solved));
            for (SweepPoint pt : points) {
                if (pt.getSolution().isSolved()) {
                    System.out.println("  P=" + fmt(pt.getPressure()) + " → V="
                            + fmt(pt.getSolution().getVolume()));
                }
            }
        }
    }

    /**
     * 数値を指数表記（有効数字 6 桁）の文字列に整形します。
     *
     * @param v 数値です
     * @return 整形した文字列です
     */
    private static String fmt(double v) {
        return String.format(Locale.ROOT, "%.6e", v);
    }
}
