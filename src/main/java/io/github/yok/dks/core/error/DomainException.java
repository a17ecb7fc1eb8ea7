package io.github.yok.dks.core.error;

/**
 * 入力が数式の定義域外（非正の体積・温度など）にある場合の例外です。
 */
public class DomainException extends EosException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message メッセージです
     */
    public DomainException(String message) {
        super(message);
    }
}
