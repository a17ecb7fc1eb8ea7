package io.github.yok.dks.core.error;

/**
 * 状態方程式（EOS）の評価で発生する例外の基底クラスです。
 *
 * <p>
 * いずれも呼び出し側で回復可能な状態点ごとの失敗を表します。 (P, T) のスイープでは 1 点の失敗を捕捉して次の点へ進めます。
 * </p>
 */
public abstract class EosException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    protected EosException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    protected EosException(String message, Throwable cause) {
        super(message, cause);
    }
}
