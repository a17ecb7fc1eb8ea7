package io.github.yok.dks.core.param;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import io.github.yok.dks.core.error.MissingParameterException;
import java.util.Map;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 1 つの鉱物相の較正パラメータセットを保持する不変クラスです。
 *
 * <p>
 * 値の補完は行いません。 必須キーが欠けていても生成はでき、式が値を参照した時点で {@link MissingParameterException} になります。 一括チェックは
 * {@code EquationOfState#validateParameters} で行います。
 * </p>
 *
 * <p>
 * 生成後は読み取り専用のため、複数スレッドから同時に参照して構いません。
 * </p>
 */
@EqualsAndHashCode
public final class MineralParameters {

    /**
     * 相の名前です（ログと出力ファイル名に使います）。
     */
    @Getter
    private final String name;

    /**
     * キー名から値への対応です。 null 値は含みません。
     */
    private final ImmutableMap<String, Double> values;

    private MineralParameters(String name, ImmutableMap<String, Double> values) {
        this.name = name;
        this.values = values;
    }

    /**
     * キー名と値の対応からパラメータセットを生成します。
     *
     * <p>
     * 値が null のエントリは「存在しない」ものとして扱います。 必須キー以外のエントリもそのまま保持します。
     * </p>
     *
     * @param name 相の名前です（null 不可）
     * @param raw キー名と値の対応です（null 不可）
     * @return パラメータセットです
     */
    public static MineralParameters of(String name, Map<String, Double> raw) {
        Preconditions.checkNotNull(name, "name が null です。");
        Preconditions.checkNotNull(raw, "パラメータ表が null です。");
        ImmutableMap.Builder<String, Double> b = ImmutableMap.builder();
        raw.forEach((k, v) -> {
            if (k != null && v != null) {
                b.put(k, v);
            }
        });
        return new MineralParameters(name, b.build());
    }

    /**
     * 指定キーの値を返します。
     *
     * @param key キーです
     * @return 値です
     * @throws MissingParameterException キーが存在しない場合
     */
    public double require(ParameterKey key) {
        Double v = values.get(key.getKey());
        if (v == null) {
            throw new MissingParameterException(key.getKey());
        }
        return v;
    }

    /**
     * 指定キーが存在するかを返します。
     *
     * @param key キーです
     * @return 存在する場合は true です
     */
    public boolean contains(ParameterKey key) {
        return values.containsKey(key.getKey());
    }

    /**
     * 欠落している必須キーを宣言順で返します。
     *
     * @return 欠落キーの一覧です（欠落がなければ空）
     */
    public ImmutableList<ParameterKey> missingKeys() {
        ImmutableList.Builder<ParameterKey> b = ImmutableList.builder();
        for (ParameterKey k : ParameterKey.values()) {
            if (!contains(k)) {
                b.add(k);
            }
        }
        return b.build();
    }

    /**
     * 指定キーだけを取り除いたパラメータセットを返します。
     *
     * @param key 取り除くキーです
     * @return 新しいパラメータセットです
     */
    public MineralParameters without(ParameterKey key) {
        ImmutableMap.Builder<String, Double> b = ImmutableMap.builder();
        values.forEach((k, v) -> {
            if (!k.equals(key.getKey())) {
                b.put(k, v);
            }
        });
        return new MineralParameters(name, b.build());
    }

    /**
     * 指定キーの値だけを差し替えたパラメータセットを返します。
     *
     * @param key 差し替えるキーです
     * @param value 新しい値です
     * @return 新しいパラメータセットです
     */
    public MineralParameters with(ParameterKey key, double value) {
        ImmutableMap.Builder<String, Double> b = ImmutableMap.builder();
        values.forEach((k, v) -> {
            if (!k.equals(key.getKey())) {
                b.put(k, v);
            }
        });
        b.put(key.getKey(), value);
        return new MineralParameters(name, b.build());
    }

    public double v0() {
        return require(ParameterKey.V_0);
    }

    public double t0() {
        return require(ParameterKey.T_0);
    }

    public double e0() {
        return require(ParameterKey.E_0);
    }

    public double s0() {
        return require(ParameterKey.S_0);
    }

    public double k0() {
        return require(ParameterKey.K_0);
    }

    public double kprime0() {
        return require(ParameterKey.KPRIME_0);
    }

    public double kdprime0() {
        return require(ParameterKey.KDPRIME_0);
    }

    public double n() {
        return require(ParameterKey.N);
    }

    public double cv() {
        return require(ParameterKey.CV);
    }

    public double grueneisen0() {
        return require(ParameterKey.GRUENEISEN_0);
    }

    public double q0() {
        return require(ParameterKey.Q_0);
    }

    @Override
    public String toString() {
        return name + values;
    }
}
