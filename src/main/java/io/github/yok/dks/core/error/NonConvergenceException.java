package io.github.yok.dks.core.error;

/**
 * 根の精密化が許容誤差に達する前に反復回数の上限に到達した場合の例外です。
 */
public class NonConvergenceException extends EosException {

    private static final long serialVersionUID = 1L;

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public NonConvergenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
