package io.github.yok.dks.core.eos;

import com.google.common.base.Preconditions;
import io.github.yok.dks.core.error.EosException;
import io.github.yok.dks.core.param.MineralParameters;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 1 つの鉱物相について、(P, T) から体積を求めて熱力学量の一式を評価するクラスです。
 *
 * <p>
 * パラメータセットは生成時に 1 度だけ検証します。 体積は状態点ごとに 1 度だけ逆算し、 Gibbs 自由エネルギーとエンタルピーにもその体積を用います。
 * </p>
 */
@Slf4j
@Getter
public final class PhaseStateCalculator {

    /**
     * 状態方程式です。
     */
    private final EquationOfState equationOfState;

    /**
     * 検証済みのパラメータセットです。
     */
    private final MineralParameters parameters;

    /**
     * 計算器を生成します。
     *
     * @param equationOfState 状態方程式です（null 不可）
     * @param parameters パラメータセットです（null 不可）
     * @throws io.github.yok.dks.core.error.MissingParameterException 必須パラメータが欠落している場合
     */
    public PhaseStateCalculator(EquationOfState equationOfState, MineralParameters parameters) {
        Preconditions.checkNotNull(equationOfState, "状態方程式が null です。");
        Preconditions.checkNotNull(parameters, "パラメータセットが null です。");
        equationOfState.validateParameters(parameters);
        this.equationOfState = equationOfState;
        this.parameters = parameters;
    }

    /**
     * (P, T) で体積を求め、熱力学量を評価します。
     *
     * @param pressure 圧力 [Pa] です
     * @param temperature 温度 [K] です
     * @return 熱力学量です
     * @throws EosException 体積が求まらない、または定義域外の場合
     */
    public PhaseState evaluate(double pressure, double temperature) {
        double volume = equationOfState.volume(pressure, temperature, parameters);
        return evaluateAt(pressure, temperature, volume);
    }

    /**
     * 体積が既知の状態点で熱力学量を評価します。
     *
     * @param pressure 圧力 [Pa] です
     * @param temperature 温度 [K] です
     * @param volume 体積 [m^3/mol] です
     * @return 熱力学量です
     * @throws EosException 定義域外の場合
     */
    public PhaseState evaluateAt(double pressure, double temperature, double volume) {
        EquationOfState eos = equationOfState;
        MineralParameters p = parameters;

        double f = eos.helmholtzFreeEnergy(pressure, temperature, volume, p);
        double s = eos.entropy(pressure, temperature, volume, p);

        return PhaseState.builder().pressure(pressure).temperature(temperature).volume(volume)
                .helmholtzFreeEnergy(f).gibbsFreeEnergy(f + pressure * volume)
                .enthalpy(f + temperature * s + pressure * volume)
                .internalEnergy(f + temperature * s).entropy(s)
                .grueneisenParameter(eos.grueneisenParameter(pressure, temperature, volume, p))
                .heatCapacityV(eos.heatCapacityV(pressure, temperature, volume, p))
                .heatCapacityP(eos.heatCapacityP(pressure, temperature, volume, p))
                .isothermalBulkModulus(eos.isothermalBulkModulus(pressure, temperature, volume, p))
                .adiabaticBulkModulus(eos.adiabaticBulkModulus(pressure, temperature, volume, p))
                .shearModulus(eos.shearModulus(pressure, temperature, volume, p))
                .thermalExpansivity(eos.thermalExpansivity(pressure, temperature, volume, p))
                .build();
    }

    /**
     * 圧力・温度の配列を要素ごとに評価します。
     *
     * <p>
     * 1 点でも失敗した場合はその例外をそのまま投げます。 失敗点を飛ばしたい場合は {@link #sweep(double[], double)} を使います。
     * </p>
     *
     * @param pressures 圧力の配列です
     * @param temperatures 温度の配列です（pressures と同じ長さ）
     * @return 要素ごとの熱力学量です
     * @throws IllegalArgumentException 配列長が一致しない場合
     * @throws EosException いずれかの点で評価に失敗した場合
     */
    public List<PhaseState> evaluateAll(double[] pressures, double[] temperatures) {
        checkSameLength(pressures, temperatures);
        List<PhaseState> out = new ArrayList<>(pressures.length);
        for (int i = 0; i < pressures.length; i++) {
            out.add(evaluate(pressures[i], temperatures[i]));
        }
        return Collections.unmodifiableList(out);
    }

    /**
     * 圧力・温度の配列から体積の配列を要素ごとに求めます。
     *
     * @param pressures 圧力の配列です
     * @param temperatures 温度の配列です（pressures と同じ長さ）
     * @return 体積の配列です
     * @throws IllegalArgumentException 配列長が一致しない場合
     * @throws EosException いずれかの点で体積が求まらない場合
     */
    public double[] volumes(double[] pressures, double[] temperatures) {
        checkSameLength(pressures, temperatures);
        double[] out = new double[pressures.length];
        for (int i = 0; i < pressures.length; i++) {
            out[i] = equationOfState.volume(pressures[i], temperatures[i], parameters);
        }
        return out;
    }

    /**
     * 固定温度で圧力をスイープします。 体積が求まらない点は飛ばして続行します。
     *
     * @param pressures 圧力の配列です
     * @param temperature 温度 [K] です
     * @return 点ごとの評価結果です（入力と同じ順序）
     */
    public List<SweepPoint> sweep(double[] pressures, double temperature) {
        Preconditions.checkNotNull(pressures, "圧力の配列が null です。");
        List<SweepPoint> out = new ArrayList<>(pressures.length);
        int skipped = 0;

        for (double pressure : pressures) {
            VolumeSolution solution =
                    equationOfState.solveVolume(pressure, temperature, parameters);
            if (!solution.isSolved()) {
                skipped++;
                log.warn("体積が求まらないため点を飛ばします。相={}、P={}、T={}、区分={}、理由={}", parameters.getName(),
                        fmtE(pressure), fmtE(temperature), solution.getStatus(),
                        solution.getMessage());
                out.add(new SweepPoint(pressure, temperature, solution, null));
                continue;
            }
            try {
                PhaseState state = evaluateAt(pressure, temperature, solution.getVolume());
                out.add(new SweepPoint(pressure, temperature, solution, state));
            } catch (EosException e) {
                skipped++;
                log.warn("熱力学量を評価できないため点を飛ばします。相={}、P={}、T={}、理由={}", parameters.getName(),
                        fmtE(pressure), fmtE(temperature), e.getMessage());
                out.add(new SweepPoint(pressure, temperature, VolumeSolution.failed(e), null));
            }
        }

        log.info("スイープを終了しました。相={}、T={}、点数={}、飛ばした点={}", parameters.getName(),
                fmtE(temperature), pressures.length, skipped);
        return Collections.unmodifiableList(out);
    }

    /**
     * 2 つの配列の長さが一致することを確認します。
     *
     * @param pressures 圧力の配列です
     * @param temperatures 温度の配列です
     * @throws IllegalArgumentException 長さが一致しない場合
     */
    private static void checkSameLength(double[] pressures, double[] temperatures) {
        Preconditions.checkNotNull(pressures, "圧力の配列が null です。");
        Preconditions.checkNotNull(temperatures, "温度の配列が null です。");
        Preconditions.checkArgument(pressures.length == temperatures.length,
                "圧力と温度の配列長が一致しません。P=%s、T=%s", pressures.length, temperatures.length);
    }

    /**
     * 数値を指数表記に整形します。
     *
     * @param v 数値です
     * @return 整形文字列です
     */
    private static String fmtE(double v) {
        return String.format(Locale.ROOT, "%.6e", v);
    }
}
