package io.github.yok.dks.core.param;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.dks.ReferenceMinerals;
import io.github.yok.dks.core.error.MissingParameterException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MineralParameters Tests")
class MineralParametersTest {

    @Test
    @DisplayName("Should expose every calibration constant through typed accessors")
    void testTypedAccessors() {
        MineralParameters p = ReferenceMinerals.userMineral();

        assertEquals("user_mineral", p.getName());
        assertEquals(1.0e-5, p.v0());
        assertEquals(300.0, p.t0());
        assertEquals(0.0, p.e0());
        assertEquals(0.0, p.s0());
        assertEquals(250.0e9, p.k0());
        assertEquals(4.0, p.kprime0());
        assertEquals(-0.02e-9, p.kdprime0());
        assertEquals(1.0, p.n());
        assertEquals(100.0, p.cv());
        assertEquals(1.5, p.grueneisen0());
        assertEquals(1.0, p.q0());
        assertTrue(p.missingKeys().isEmpty());
    }

    @Test
    @DisplayName("Should treat null values as absent and fail lazily naming the key")
    void testNullValueIsMissing() {
        Map<String, Double> raw = ReferenceMinerals.rawParameters();
        raw.put("K_0", null);
        MineralParameters p = MineralParameters.of("m", raw);

        assertFalse(p.contains(ParameterKey.K_0));
        MissingParameterException e = assertThrows(MissingParameterException.class, p::k0);
        assertEquals("K_0", e.getKey());
        assertTrue(e.getMessage().contains("K_0"));

        // 他のキーは引き続き参照できる
        assertEquals(1.0e-5, p.v0());
    }

    @Test
    @DisplayName("Should list missing keys in declaration order")
    void testMissingKeysOrder() {
        Map<String, Double> raw = ReferenceMinerals.rawParameters();
        raw.remove("q_0");
        raw.remove("T_0");
        raw.remove("Cv");

        MineralParameters p = MineralParameters.of("m", raw);

        assertEquals(List.of(ParameterKey.T_0, ParameterKey.CV, ParameterKey.Q_0),
                p.missingKeys());
    }

    @Test
    @DisplayName("Should keep unknown keys without affecting required ones")
    void testExtraKeysAreKept() {
        Map<String, Double> raw = ReferenceMinerals.rawParameters();
        raw.put("molar_mass", 0.0403);

        MineralParameters p = MineralParameters.of("m", raw);

        assertTrue(p.missingKeys().isEmpty());
        assertEquals(ReferenceMinerals.K0, p.k0());
        assertNotEquals(ReferenceMinerals.userMineral(), p);
    }

    @Test
    @DisplayName("Should derive modified copies without mutating the original")
    void testWithAndWithout() {
        MineralParameters p = ReferenceMinerals.userMineral();

        MineralParameters q = p.with(ParameterKey.S_0, 42.0);
        MineralParameters r = p.without(ParameterKey.K_0);

        assertEquals(0.0, p.s0());
        assertEquals(42.0, q.s0());
        assertTrue(p.contains(ParameterKey.K_0));
        assertEquals(List.of(ParameterKey.K_0), r.missingKeys());
        assertEquals(p, ReferenceMinerals.userMineral());
        assertNotEquals(p, q);
    }

    @Test
    @DisplayName("Should expose the table names of the required keys")
    void testKeyNames() {
        assertEquals("Kdprime_0", ParameterKey.KDPRIME_0.getKey());
        assertEquals("grueneisen_0", ParameterKey.GRUENEISEN_0.getKey());
        assertEquals(11, ParameterKey.values().length);
    }

    @Test
    @DisplayName("Should reject null inputs")
    void testNullInputs() {
        assertThrows(NullPointerException.class, () -> MineralParameters.of(null, Map.of()));
        assertThrows(NullPointerException.class, () -> MineralParameters.of("m", null));
    }
}
