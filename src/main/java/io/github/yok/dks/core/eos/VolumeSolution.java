package io.github.yok.dks.core.eos;

import io.github.yok.dks.core.error.EosException;
import io.github.yok.dks.core.error.MissingParameterException;
import io.github.yok.dks.core.error.NonConvergenceException;
import io.github.yok.dks.core.error.RootNotBracketedException;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * 体積の逆算結果を、例外を使わずに表すクラスです。
 *
 * <p>
 * 失敗時の {@link #getVolume()} は NaN です。 呼び出し側は {@link #getStatus()} で分岐します。
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class VolumeSolution {

    /**
     * 逆算の結果区分です。
     */
    public enum Status {
        /** 体積が求まりました。 */
        SOLVED,
        /** 指定圧力で残差の符号反転が見つかりませんでした（EOS の適用範囲外）。 */
        ROOT_NOT_BRACKETED,
        /** Brent 法が反復上限までに収束しませんでした。 */
        NOT_CONVERGED,
        /** 必須パラメータが欠落していました。 */
        MISSING_PARAMETER,
        /** 入力が定義域外でした。 */
        DOMAIN_ERROR
    }

    /**
     * 結果区分です。
     */
    Status status;

    /**
     * 体積 [m^3/mol] です（失敗時は NaN）。
     */
    double volume;

    /**
     * 失敗理由です（成功時は空文字列）。
     */
    String message;

    /**
     * 成功結果を作成します。
     *
     * @param volume 体積です
     * @return 成功結果です
     */
    public static VolumeSolution solved(double volume) {
        return new VolumeSolution(Status.SOLVED, volume, "");
    }

    /**
     * 失敗結果を作成します。
     *
     * @param status 結果区分です（SOLVED 以外）
     * @param message 失敗理由です
     * @return 失敗結果です
     * @throws IllegalArgumentException status が SOLVED の場合
     */
    public static VolumeSolution failed(Status status, String message) {
        if (status == Status.SOLVED) {
            throw new IllegalArgumentException("失敗結果に SOLVED は指定できません");
        }
        return new VolumeSolution(status, Double.NaN, message == null ? "" : message);
    }

    /**
     * 例外の種類に応じた区分で失敗結果を作成します。
     *
     * @param e 評価中に発生した例外です
     * @return 失敗結果です
     */
    public static VolumeSolution failed(EosException e) {
        Status status;
        if (e instanceof RootNotBracketedException) {
            status = Status.ROOT_NOT_BRACKETED;
        } else if (e instanceof NonConvergenceException) {
            status = Status.NOT_CONVERGED;
        } else if (e instanceof MissingParameterException) {
            status = Status.MISSING_PARAMETER;
        } else {
            status = Status.DOMAIN_ERROR;
        }
        return failed(status, e.getMessage());
    }

    /**
     * 体積が求まったかを返します。
     *
     * @return 求まった場合は true です
     */
    public boolean isSolved() {
        return status == Status.SOLVED;
    }
}
