package io.github.yok.dks.core.error;

import lombok.Getter;

/**
 * 必須の較正パラメータがパラメータセットに存在しない場合の例外です。
 */
@Getter
public class MissingParameterException extends EosException {

    private static final long serialVersionUID = 1L;

    /**
     * 欠落しているパラメータのキー名（例: {@code K_0}）です。
     */
    private final String key;

    /**
     * 例外を生成します。
     *
     * @param key 欠落しているパラメータのキー名です
     */
    public MissingParameterException(String key) {
        super("params object missing parameter : " + key);
        this.key = key;
    }
}
