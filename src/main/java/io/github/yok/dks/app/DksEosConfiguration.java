package io.github.yok.dks.app;

import io.github.yok.dks.core.eos.DksSolidEquationOfState;
import io.github.yok.dks.core.eos.EquationOfState;
import io.github.yok.dks.core.eos.PhaseStateCalculator;
import io.github.yok.dks.core.param.MineralParameters;
import io.github.yok.dks.out.CsvResultWriter;
import io.github.yok.dks.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 有限歪み固体 EOS とスイープ一式の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class DksEosConfiguration {

    /**
     * dks-eos の設定値（dks.*）です。
     */
    private final DksProperties p;

    /**
     * 鉱物相のパラメータセットを生成します。
     *
     * @return パラメータセットです
     */
    @Bean
    public MineralParameters mineralParameters() {
        DksProperties.Mineral m = p.getMineral();
        return MineralParameters.of(m.getName(), m.toParameterMap());
    }

    /**
     * 状態方程式を生成します。
     *
     * @return 状態方程式です
     */
    @Bean
    public EquationOfState equationOfState() {
        return new DksSolidEquationOfState(p.getRootSearch().toSettings());
    }

    /**
     * 熱力学量の計算器を生成します（ここでパラメータセットを検証します）。
     *
     * @param equationOfState 状態方程式です
     * @param mineralParameters パラメータセットです
     * @return 計算器です
     */
    @Bean
    public PhaseStateCalculator phaseStateCalculator(EquationOfState equationOfState,
            MineralParameters mineralParameters) {
        return new PhaseStateCalculator(equationOfState, mineralParameters);
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
