package io.github.yok.dks.core.solver;

import io.github.yok.dks.core.error.NonConvergenceException;
import io.github.yok.dks.core.error.RootNotBracketedException;
import lombok.Getter;
import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.NoBracketingException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;

/**
 * 符号反転区間の中で Brent 法により根を精密化します。
 *
 * <p>
 * 端点の関数値がちょうど 0 の場合はその端点を返します。
 * </p>
 */
@Getter
public final class BrentRootRefiner {

    /**
     * 相対許容誤差です。
     */
    private final double relativeTolerance;

    /**
     * 絶対許容誤差です。
     */
    private final double absoluteTolerance;

    /**
     * 最大評価回数です。
     */
    private final int maxEvaluations;

    /**
     * 根の精密化を生成します。
     *
     * @param relativeTolerance 相対許容誤差です（0 以上）
     * @param absoluteTolerance 絶対許容誤差です（0 より大きい）
     * @param maxEvaluations 最大評価回数です（1 以上）
     * @throws IllegalArgumentException 引数が不正な場合に発生します
     */
    public BrentRootRefiner(double relativeTolerance, double absoluteTolerance,
            int maxEvaluations) {
        if (!(relativeTolerance >= 0.0)) {
            throw new IllegalArgumentException(
                    "relativeTolerance は 0 以上が必要です: " + relativeTolerance);
        }
        if (!(absoluteTolerance > 0.0)) {
            throw new IllegalArgumentException(
                    "absoluteTolerance は 0 より大きい必要があります: " + absoluteTolerance);
        }
        if (maxEvaluations <= 0) {
            throw new IllegalArgumentException("maxEvaluations は 1 以上が必要です: " + maxEvaluations);
        }
        this.relativeTolerance = relativeTolerance;
        this.absoluteTolerance = absoluteTolerance;
        this.maxEvaluations = maxEvaluations;
    }

    /**
     * 区間内の根を求めます。
     *
     * @param fn 対象関数です
     * @param bracket 符号反転区間です
     * @return 根です
     * @throws NonConvergenceException 最大評価回数に達した場合
     * @throws RootNotBracketedException 区間の両端で符号が反転していない場合
     */
    public double refine(UnivariateFunction fn, Bracket bracket) {
        if (bracket.getLowerValue() == 0.0) {
            return bracket.getLower();
        }
        if (bracket.getUpperValue() == 0.0) {
            return bracket.getUpper();
        }

        // 関数値の許容誤差は 0（ちょうど 0 の場合のみ早期終了）
        BrentSolver solver = new BrentSolver(relativeTolerance, absoluteTolerance, 0.0);
        try {
            return solver.solve(maxEvaluations, fn, bracket.getLower(), bracket.getUpper());
        } catch (TooManyEvaluationsException e) {
            throw new NonConvergenceException("Brent 法が最大評価回数 " + maxEvaluations
                    + " 回以内に収束しませんでした。区間=[" + bracket.getLower() + ", " + bracket.getUpper()
                    + "]", e);
        } catch (NoBracketingException e) {
            throw new RootNotBracketedException("区間の両端で関数値の符号が反転していません。区間=["
                    + bracket.getLower() + ", " + bracket.getUpper() + "]", e);
        }
    }
}
