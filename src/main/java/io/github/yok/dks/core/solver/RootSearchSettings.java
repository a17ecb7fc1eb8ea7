package io.github.yok.dks.core.solver;

import lombok.Getter;
import lombok.ToString;

/**
 * 体積の逆算（挟み込み探索 + Brent 法）の数値設定を保持するクラスです。
 *
 * <p>
 * 既定値は {@link #defaults()} で得られます。
 * </p>
 */
@Getter
@ToString
public final class RootSearchSettings {

    /** 挟み込み探索の既定の拡大率（黄金比）です。 */
    public static final double DEFAULT_BRACKET_SEARCH_FACTOR = 1.618;

    /** 初期探索幅の既定値（V0 に対する比）です。 */
    public static final double DEFAULT_INITIAL_BRACKET_FRACTION = 1.0e-2;

    /** 挟み込み探索の既定の最大反復回数です。 */
    public static final int DEFAULT_MAX_BRACKET_ITERATIONS = 100;

    /** Brent 法の既定の相対許容誤差です。 */
    public static final double DEFAULT_ROOT_RELATIVE_TOLERANCE = 1.0e-12;

    /** Brent 法の既定の絶対許容誤差 [m^3/mol] です。 */
    public static final double DEFAULT_ROOT_ABSOLUTE_TOLERANCE = 1.0e-20;

    /** Brent 法の既定の最大評価回数です。 */
    public static final int DEFAULT_MAX_ROOT_ITERATIONS = 200;

    /**
     * 挟み込み探索で 1 ステップごとに幅を広げる倍率です（1 より大きい）。
     */
    private final double bracketSearchFactor;

    /**
     * 初期探索幅を V0 に対する比で表した値です（0 より大きく 1 未満）。
     */
    private final double initialBracketFraction;

    /**
     * 挟み込み探索の最大反復回数です。
     */
    private final int maxBracketIterations;

    /**
     * Brent 法の相対許容誤差です。
     */
    private final double rootRelativeTolerance;

    /**
     * Brent 法の絶対許容誤差です。
     */
    private final double rootAbsoluteTolerance;

    /**
     * Brent 法の最大評価回数です。
     */
    private final int maxRootIterations;

    /**
     * 設定を生成します。
     *
     * @param bracketSearchFactor 挟み込み探索の拡大率です（1 より大きい）
     * @param initialBracketFraction 初期探索幅の V0 比です（(0, 1)）
     * @param maxBracketIterations 挟み込み探索の最大反復回数です（1 以上）
     * @param rootRelativeTolerance Brent 法の相対許容誤差です（0 以上）
     * @param rootAbsoluteTolerance Brent 法の絶対許容誤差です（0 より大きい）
     * @param maxRootIterations Brent 法の最大評価回数です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public RootSearchSettings(double bracketSearchFactor, double initialBracketFraction,
            int maxBracketIterations, double rootRelativeTolerance, double rootAbsoluteTolerance,
            int maxRootIterations) {
        if (!(bracketSearchFactor > 1.0)) {
            throw new IllegalArgumentException(
                    "bracketSearchFactor は 1 より大きい必要があります: " + bracketSearchFactor);
        }
        if (!(initialBracketFraction > 0.0 && initialBracketFraction < 1.0)) {
            throw new IllegalArgumentException(
                    "initialBracketFraction は (0, 1) が必要です: " + initialBracketFraction);
        }
        if (maxBracketIterations <= 0) {
            throw new IllegalArgumentException(
                    "maxBracketIterations は 1 以上が必要です: " + maxBracketIterations);
        }
        if (!(rootRelativeTolerance >= 0.0)) {
            throw new IllegalArgumentException(
                    "rootRelativeTolerance は 0 以上が必要です: " + rootRelativeTolerance);
        }
        if (!(rootAbsoluteTolerance > 0.0)) {
            throw new IllegalArgumentException(
                    "rootAbsoluteTolerance は 0 より大きい必要があります: " + rootAbsoluteTolerance);
        }
        if (maxRootIterations <= 0) {
            throw new IllegalArgumentException(
                    "maxRootIterations は 1 以上が必要です: " + maxRootIterations);
        }
        this.bracketSearchFactor = bracketSearchFactor;
        this.initialBracketFraction = initialBracketFraction;
        this.maxBracketIterations = maxBracketIterations;
        this.rootRelativeTolerance = rootRelativeTolerance;
        this.rootAbsoluteTolerance = rootAbsoluteTolerance;
        this.maxRootIterations = maxRootIterations;
    }

    /**
     * 既定値の設定を返します。
     *
     * @return 既定値の設定です
     */
    public static RootSearchSettings defaults() {
        return new RootSearchSettings(DEFAULT_BRACKET_SEARCH_FACTOR,
                DEFAULT_INITIAL_BRACKET_FRACTION, DEFAULT_MAX_BRACKET_ITERATIONS,
                DEFAULT_ROOT_RELATIVE_TOLERANCE, DEFAULT_ROOT_ABSOLUTE_TOLERANCE,
                DEFAULT_MAX_ROOT_ITERATIONS);
    }
}
