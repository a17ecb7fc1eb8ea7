package io.github.yok.dks.core.solver;

import io.github.yok.dks.core.error.RootNotBracketedException;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * 開始点から「零点へ向かう方向（片側）」へ歩いて、関数値の符号が反転する区間を探します。
 *
 * <p>
 * 手順は次のとおりです。
 * </p>
 * <ol>
 * <li>x0, x0-dx, x0+dx の 3 点が単調でなければ、単調になるまで dx を倍率で縮めます。</li>
 * <li>傾きと f(x0) の符号から歩く方向を決めます。</li>
 * <li>幅を倍率で広げながら歩き、 f の符号が反転した直近 2 点を返します。</li>
 * </ol>
 *
 * <p>
 * 定義域の下限（排他的）を越える点や、非有限の関数値に達した場合はその時点で失敗とします。
 * </p>
 */
@Slf4j
@Getter
public final class BracketSearch {

    /**
     * 1 ステップごとに幅を広げる倍率です。
     */
    private final double ratio;

    /**
     * 縮小・歩行それぞれの最大反復回数です。
     */
    private final int maxIterations;

    /**
     * 挟み込み探索を生成します。
     *
     * @param ratio 幅の倍率です（1 より大きい）
     * @param maxIterations 最大反復回数です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public BracketSearch(double ratio, int maxIterations) {
        if (!(ratio > 1.0)) {
            throw new IllegalArgumentException("ratio は 1 より大きい必要があります: " + ratio);
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations は 1 以上が必要です: " + maxIterations);
        }
        this.ratio = ratio;
        this.maxIterations = maxIterations;
    }

    /**
     * 符号反転区間を探します（定義域の制限なし）。
     *
     * @param fn 対象関数です
     * @param x0 開始点です
     * @param dx 初期幅です（符号は無視します）
     * @return 符号反転区間です
     * @throws RootNotBracketedException 区間が見つからない場合
     */
    public Bracket find(UnivariateFunction fn, double x0, double dx) {
        return find(fn, x0, dx, Double.NEGATIVE_INFINITY);
    }

    /**
     * 符号反転区間を探します。
     *
     * @param fn 対象関数です
     * @param x0 開始点です（domainLowerBound より大きいこと）
     * @param dx 初期幅です（符号は無視します）
     * @param domainLowerBound 定義域の下限（排他的）です
     * @return 符号反転区間です
     * @throws RootNotBracketedException 区間が見つからない場合
     * @throws IllegalArgumentException dx が 0 または非有限の場合
     */
    public Bracket find(UnivariateFunction fn, double x0, double dx, double domainLowerBound) {
        double step = Math.abs(dx);
        if (!(step > 0.0) || !Double.isFinite(step)) {
            throw new IllegalArgumentException("dx は 0 でない有限値が必要です: " + dx);
        }

        double f0 = evaluate(fn, x0, domainLowerBound);
        double xLeft = x0 - step;
        double xRight = x0 + step;
        double fLeft = evaluate(fn, xLeft, domainLowerBound);
        double fRight = evaluate(fn, xRight, domainLowerBound);

        // 3 点が単調でない（零点を跨いで折り返している）なら幅を縮める
        int iter = 0;
        if ((f0 - fLeft) * (fRight - f0) < 0.0) {
            while ((f0 - fLeft) * (fRight - f0) < 0.0 && step > Math.ulp(1.0)
                    && iter < maxIterations) {
                step /= ratio;
                xLeft = x0 - step;
                xRight = x0 + step;
                fLeft = evaluate(fn, xLeft, domainLowerBound);
                fRight = evaluate(fn, xRight, domainLowerBound);
                iter++;
            }
            if (iter == maxIterations) {
                throw new RootNotBracketedException(
                        "開始点の両側で同じ傾きを持つ幅が見つかりませんでした。x0=" + x0);
            }
        }

        // 増加関数で f0>0、または減少関数で f0<=0 なら左へ歩く
        double slope = fRight - f0;
        boolean walkRight = (slope > 0.0 && f0 <= 0.0) || (slope < 0.0 && f0 > 0.0);
        double x1;
        double f1;
        if (walkRight) {
            x1 = xRight;
            f1 = fRight;
        } else {
            step = -step;
            x1 = xLeft;
            f1 = fLeft;
        }

        log.debug("挟み込み探索を開始します。x0={}、f0={}、方向={}", fmtE(x0), fmtE(f0),
                step < 0.0 ? "左" : "右");

        iter = 0;
        double xa = x0;
        double fa = f0;
        while (fa * f1 > 0.0 && iter < maxIterations) {
            step *= ratio;
            double xNew = x1 + step;
            double fNew = evaluate(fn, xNew, domainLowerBound);
            xa = x1;
            fa = f1;
            x1 = xNew;
            f1 = fNew;
            iter++;
            log.debug("挟み込み探索{}：x={}、f={}", iter, fmtE(x1), fmtE(f1));
        }

        if (fa * f1 > 0.0) {
            throw new RootNotBracketedException("符号反転区間が見つかりませんでした。x0=" + x0 + ", 反復回数="
                    + iter + ", 最終点=" + x1 + ", f=" + f1);
        }

        return (xa <= x1) ? new Bracket(xa, x1, fa, f1) : new Bracket(x1, xa, f1, fa);
    }

    /**
     * 定義域を確認したうえで関数値を評価します。
     *
     * @param fn 対象関数です
     * @param x 評価点です
     * @param domainLowerBound 定義域の下限（排他的）です
     * @return 関数値です
     * @throws RootNotBracketedException 定義域外、または関数値が非有限の場合
     */
    private static double evaluate(UnivariateFunction fn, double x, double domainLowerBound) {
        if (!(x > domainLowerBound)) {
            throw new RootNotBracketedException(
                    "探索が定義域の外に出ました。x=" + x + ", 下限=" + domainLowerBound);
        }
        double v = fn.value(x);
        if (!Double.isFinite(v)) {
            throw new RootNotBracketedException("探索中に非有限の関数値が得られました。x=" + x + ", f=" + v);
        }
        return v;
    }

    /**
     * 数値を指数表記に整形します。
     *
     * @param v 数値です
     * @return 整形文字列です
     */
    private static String fmtE(double v) {
        return String.format(Locale.ROOT, "%.6e", v);
    }
}
