package io.github.yok.dks.core.error;

/**
 * 探索範囲内で残差の符号反転（挟み込み区間）が見つからなかった場合の例外です。
 *
 * <p>
 * 体積の逆算では「指定圧力がこの物質の状態方程式の適用範囲外」であることを意味します。
 * </p>
 */
public class RootNotBracketedException extends EosException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public RootNotBracketedException(String message) {
        super(message);
    }

    /**
     * 原因付きの例外を生成します。
     *
     * @param message メッセージです
     * @param cause 原因です
     */
    public RootNotBracketedException(String message, Throwable cause) {
        super(message, cause);
    }
}
