package io.github.yok.dks.core.eos;

import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

/**
 * スイープ中の 1 点の評価結果です。
 *
 * <p>
 * 体積が求まらなかった点は {@link #getState()} が空になり、理由は {@link #getSolution()} に残ります。
 * </p>
 */
@Value
public class SweepPoint {

    /**
     * 圧力 [Pa] です。
     */
    double pressure;

    /**
     * 温度 [K] です。
     */
    double temperature;

    /**
     * 体積の逆算結果です。
     */
    VolumeSolution solution;

    /**
     * 評価した熱力学量です（失敗時は null）。
     */
    @Getter(AccessLevel.NONE)
    PhaseState phaseState;

    /**
     * 評価した熱力学量を返します。
     *
     * @return 熱力学量、失敗した点では空です
     */
    public Optional<PhaseState> getState() {
        return Optional.ofNullable(phaseState);
    }
}
