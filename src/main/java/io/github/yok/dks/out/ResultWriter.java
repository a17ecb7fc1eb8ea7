package io.github.yok.dks.out;

import io.github.yok.dks.core.eos.SweepPoint;
import java.util.List;

/**
 * 計算結果を出力する処理のインタフェースです。
 *
 * <p>
 * 温度ごとの圧力スイープを 1 単位として受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 1 つの温度での圧力スイープ結果を出力します。
     *
     * @param mineralName 相の名前です
     * @param temperature 温度 [K] です
     * @param points 点ごとの評価結果です（失敗点を含みます）
     */
    void write(String mineralName, double temperature, List<SweepPoint> points);
}
