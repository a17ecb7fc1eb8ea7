package io.github.yok.dks.core.eos;

import com.google.common.base.Preconditions;
import io.github.yok.dks.core.error.DomainException;
import io.github.yok.dks.core.error.MissingParameterException;
import io.github.yok.dks.core.error.RootNotBracketedException;
import io.github.yok.dks.core.param.MineralParameters;
import io.github.yok.dks.core.param.ParameterKey;
import io.github.yok.dks.core.solver.Bracket;
import io.github.yok.dks.core.solver.BracketSearch;
import io.github.yok.dks.core.solver.BrentRootRefiner;
import io.github.yok.dks.core.solver.RootSearchSettings;
import io.github.yok.dks.core.strain.FiniteStrain;
import io.github.yok.dks.core.thermal.ThermalTerm;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.analysis.UnivariateFunction;

/**
 * de Koker &amp; Stixrude (2013) の有限歪み固体状態方程式です。
 *
 * <p>
 * 自由エネルギーを F = E0 - T0 S0 + F_cmp(V) + F_th(T, V) とし、 圧力はその体積微分を閉じた形で評価します。 体積は P - P(T, V)
 * = 0 を挟み込み探索と Brent 法で解いて求めます。
 * </p>
 *
 * <p>
 * 体積弾性率・剛性率・熱膨張率・定圧熱容量はこのモデルでは扱わず 0 を返します（{@link #isSupported} は false）。
 * </p>
 *
 * <p>
 * 状態を持たないため、スレッド間で共有して構いません。
 * </p>
 */
@Slf4j
public final class DksSolidEquationOfState implements EquationOfState {

    /**
     * 0 を返す（このモデルでは計算しない）量です。
     */
    private static final Set<ThermodynamicProperty> UNSUPPORTED =
            EnumSet.of(ThermodynamicProperty.ISOTHERMAL_BULK_MODULUS,
                    ThermodynamicProperty.ADIABATIC_BULK_MODULUS,
                    ThermodynamicProperty.SHEAR_MODULUS, ThermodynamicProperty.HEAT_CAPACITY_P,
                    ThermodynamicProperty.THERMAL_EXPANSIVITY);

    /**
     * 数値設定です。
     */
    @Getter
    private final RootSearchSettings settings;

    /**
     * 挟み込み探索です。
     */
    private final BracketSearch bracketSearch;

    /**
     * 根の精密化です。
     */
    private final BrentRootRefiner rootRefiner;

    /**
     * 既定の数値設定で状態方程式を生成します。
     */
    public DksSolidEquationOfState() {
        this(RootSearchSettings.defaults());
    }

    /**
     * 状態方程式を生成します。
     *
     * @param settings 数値設定です（null 不可）
     */
    public DksSolidEquationOfState(RootSearchSettings settings) {
        Preconditions.checkNotNull(settings, "数値設定が null です。");
        this.settings = settings;
        this.bracketSearch = new BracketSearch(settings.getBracketSearchFactor(),
                settings.getMaxBracketIterations());
        this.rootRefiner = new BrentRootRefiner(settings.getRootRelativeTolerance(),
                settings.getRootAbsoluteTolerance(), settings.getMaxRootIterations());
    }

    /**
     * 圧力 P(T, V) を返します。
     *
     * <p>
     * P = 3 K0 (1+2f)^(5/2) (f + a3 f^2/2 + a4 f^3/6) + Cv (T-T0) γ(V) / V
     * </p>
     *
     * @throws DomainException V が正でない場合
     */
    @Override
    public double pressure(double temperature, double volume, MineralParameters params) {
        checkVolume(volume);
        return FiniteStrain.compressivePressure(volume, params)
                + ThermalTerm.thermalPressure(temperature, volume, params);
    }

    /**
     * 体積を逆算します。
     *
     * <p>
     * V0 から幅 V0 * initialBracketFraction で挟み込み探索を始め、 得られた区間で Brent 法を実行します。
     * </p>
     *
     * @throws DomainException V0 が正の有限値でない場合
     */
    @Override
    public double volume(double pressure, double temperature, MineralParameters params) {
        final double v0 = params.v0();
        if (!(v0 > 0.0) || !Double.isFinite(v0)) {
            throw new DomainException("探索の開始点 V_0 は正の有限値である必要があります: V_0=" + v0);
        }

        UnivariateFunction residual = v -> pressure - pressure(temperature, v, params);

        Bracket bracket;
        try {
            bracket = bracketSearch.find(residual, v0, settings.getInitialBracketFraction() * v0,
                    0.0);
        } catch (RootNotBracketedException e) {
            throw new RootNotBracketedException(
                    "体積が求まりません。指定圧力が状態方程式の適用範囲外の可能性があります。P=" + fmtE(pressure)
                            + ", T=" + fmtE(temperature) + ", V_0=" + fmtE(v0),
                    e);
        }

        double v = rootRefiner.refine(residual, bracket);
        log.debug("体積を求めました。P={}、T={}、V={}、区間=[{}, {}]", fmtE(pressure), fmtE(temperature),
                fmtE(v), fmtE(bracket.getLower()), fmtE(bracket.getUpper()));
        return v;
    }

    /**
     * Grüneisen パラメータ γ0 (V/V0)^q0 を返します。 P, T は使いません。
     */
    @Override
    public double grueneisenParameter(double pressure, double temperature, double volume,
            MineralParameters params) {
        return ThermalTerm.grueneisenParameter(volume, params);
    }

    /**
     * 定積熱容量 Cv を返します（定数）。
     */
    @Override
    public double heatCapacityV(double pressure, double temperature, double volume,
            MineralParameters params) {
        return params.cv();
    }

    @Override
    public double heatCapacityP(double pressure, double temperature, double volume,
            MineralParameters params) {
        return 0.0;
    }

    /**
     * エントロピー S0 + I(V) + Cv ln(T/T0) を返します。
     *
     * @throws DomainException V, T, T0 のいずれかが正でない場合
     */
    @Override
    public double entropy(double pressure, double temperature, double volume,
            MineralParameters params) {
        checkVolume(volume);
        return params.s0() + ThermalTerm.thermalEntropy(temperature, volume, params);
    }

    /**
     * Helmholtz 自由エネルギー E0 - T0 S0 + F_cmp(V) + F_th(T, V) を返します。
     *
     * @throws DomainException V, T, T0 のいずれかが正でない場合
     */
    @Override
    public double helmholtzFreeEnergy(double pressure, double temperature, double volume,
            MineralParameters params) {
        checkVolume(volume);
        return params.e0() - params.t0() * params.s0()
                + FiniteStrain.compressiveFreeEnergy(volume, params)
                + ThermalTerm.thermalFreeEnergy(temperature, volume, params);
    }

    /**
     * Gibbs 自由エネルギー F + P V を返します。 V は (P, T) から逆算し直します。
     */
    @Override
    public double gibbsFreeEnergy(double pressure, double temperature, double volume,
            MineralParameters params) {
        return helmholtzFreeEnergy(pressure, temperature, volume, params)
                + pressure * volume(pressure, temperature, params);
    }

    /**
     * 内部エネルギー F + T S を返します。
     */
    @Override
    public double internalEnergy(double pressure, double temperature, double volume,
            MineralParameters params) {
        return helmholtzFreeEnergy(pressure, temperature, volume, params)
                + temperature * entropy(pressure, temperature, volume, params);
    }

    /**
     * エンタルピー F + T S + P V を返します。 V は (P, T) から逆算し直します。
     */
    @Override
    public double enthalpy(double pressure, double temperature, double volume,
            MineralParameters params) {
        return helmholtzFreeEnergy(pressure, temperature, volume, params)
                + temperature * entropy(pressure, temperature, volume, params)
                + pressure * volume(pressure, temperature, params);
    }

    @Override
    public double isothermalBulkModulus(double pressure, double temperature, double volume,
            MineralParameters params) {
        return 0.0;
    }

    @Override
    public double adiabaticBulkModulus(double pressure, double temperature, double volume,
            MineralParameters params) {
        return 0.0;
    }

    @Override
    public double shearModulus(double pressure, double temperature, double volume,
            MineralParameters params) {
        return 0.0;
    }

    @Override
    public double thermalExpansivity(double pressure, double temperature, double volume,
            MineralParameters params) {
        return 0.0;
    }

    /**
     * 必須キーの存在を確認します。
     *
     * <p>
     * 値の範囲は検査しません。 物理的に不自然な符号（V_0, T_0, K_0, Cv が正でない）は警告ログだけを出します。
     * </p>
     */
    @Override
    public void validateParameters(MineralParameters params) {
        Preconditions.checkNotNull(params, "パラメータセットが null です。");
        List<ParameterKey> missing = params.missingKeys();
        if (!missing.isEmpty()) {
            throw new MissingParameterException(missing.get(0).getKey());
        }

        for (ParameterKey key : List.of(ParameterKey.V_0, ParameterKey.T_0, ParameterKey.K_0,
                ParameterKey.CV)) {
            double v = params.require(key);
            if (!(v > 0.0)) {
                log.warn("パラメータの値が正ではありません。相={}、{}={}", params.getName(), key.getKey(), v);
            }
        }
    }

    @Override
    public boolean isSupported(ThermodynamicProperty property) {
        return !UNSUPPORTED.contains(property);
    }

    /**
     * 体積が正であることを確認します。
     *
     * @param volume 体積です
     * @throws DomainException 正でない（NaN を含む）場合
     */
    private static void checkVolume(double volume) {
        if (!(volume > 0.0)) {
            throw new DomainException("体積は正である必要があります: V=" + volume);
        }
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
