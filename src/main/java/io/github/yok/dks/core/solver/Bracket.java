package io.github.yok.dks.core.solver;

import lombok.Value;

/**
 * 関数値の符号が反転する区間 [lower, upper] です。
 */
@Value
public class Bracket {

    /**
     * 下端です。
     */
    double lower;

    /**
     * 上端です。
     */
    double upper;

    /**
     * 下端での関数値です。
     */
    double lowerValue;

    /**
     * 上端での関数値です。
     */
    double upperValue;
}
