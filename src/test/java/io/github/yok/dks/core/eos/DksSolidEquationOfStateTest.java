package io.github.yok.dks.core.eos;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.dks.ReferenceMinerals;
import io.github.yok.dks.core.error.DomainException;
import io.github.yok.dks.core.error.MissingParameterException;
import io.github.yok.dks.core.error.NonConvergenceException;
import io.github.yok.dks.core.error.RootNotBracketedException;
import io.github.yok.dks.core.param.MineralParameters;
import io.github.yok.dks.core.param.ParameterKey;
import io.github.yok.dks.core.solver.RootSearchSettings;
import java.util.stream.IntStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("DksSolidEquationOfState Tests")
class DksSolidEquationOfStateTest {

    private static final double V0 = ReferenceMinerals.V0;
    private static final double T0 = ReferenceMinerals.T0;

    private DksSolidEquationOfState eos;
    private MineralParameters params;

    @BeforeEach
    void setUp() {
        eos = new DksSolidEquationOfState();
        params = ReferenceMinerals.userMineral();
    }

    @Test
    @DisplayName("Pressure vanishes at the reference state")
    void testPressureAtReferenceState() {
        assertEquals(0.0, eos.pressure(T0, V0, params), 1e-6);
    }

    @Test
    @DisplayName("Zero pressure at T0 recovers V0")
    void testVolumeAtReferenceState() {
        double v = eos.volume(0.0, T0, params);
        assertEquals(V0, v, V0 * 1e-10);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.6, 0.7, 0.85, 0.95, 1.0, 1.05, 1.1})
    @DisplayName("Volume inverts pressure at several temperatures")
    void testRoundTrip(double ratio) {
        double v = ratio * V0;
        for (double t : new double[] {300.0, 1000.0, 2000.0, 3000.0}) {
            double p = eos.pressure(t, v, params);
            double solved = eos.volume(p, t, params);
            assertEquals(v, solved, v * 1e-9, "T=" + t + ", V/V0=" + ratio);
        }
    }

    @Test
    @DisplayName("Volume inverts pressure when q0 = 0")
    void testRoundTripWithZeroExponent() {
        MineralParameters q0 = params.with(ParameterKey.Q_0, 0.0);
        double v = 0.8 * V0;
        double p = eos.pressure(2500.0, v, q0);

        assertEquals(v, eos.volume(p, 2500.0, q0), v * 1e-9);
    }

    @Test
    @DisplayName("Pressure decreases monotonically with volume below V0")
    void testMonotonicity() {
        for (double t : new double[] {300.0, 2000.0}) {
            double previous = Double.POSITIVE_INFINITY;
            for (int i = 0; i <= 50; i++) {
                double v = V0 * (0.5 + 0.01 * i);
                double p = eos.pressure(t, v, params);
                assertTrue(p < previous, "not decreasing at V/V0=" + (v / V0) + ", T=" + t);
                previous = p;
            }
        }
    }

    @Test
    @DisplayName("Thermal pressure is added above T0")
    void testThermalPressure() {
        double thermal = 100.0 * 1700.0 * 1.5 / V0;
        assertEquals(thermal, eos.pressure(2000.0, V0, params), thermal * 1e-12);
    }

    @Test
    @DisplayName("Grueneisen parameter equals gamma0 at V0 and ignores P and T")
    void testGrueneisenParameter() {
        assertEquals(1.5, eos.grueneisenParameter(0.0, T0, V0, params), 0.0);
        assertEquals(eos.grueneisenParameter(0.0, 300.0, 0.8 * V0, params),
                eos.grueneisenParameter(1e11, 4000.0, 0.8 * V0, params), 0.0);
    }

    @Test
    @DisplayName("Entropy equals S0 at the reference point")
    void testEntropyAtReference() {
        MineralParameters p = params.with(ParameterKey.S_0, 42.0);
        assertEquals(42.0, eos.entropy(0.0, T0, V0, p), 0.0);
    }

    @Test
    @DisplayName("Helmholtz free energy equals E0 - T0 S0 at the reference point")
    void testHelmholtzAtReference() {
        MineralParameters p = params.with(ParameterKey.S_0, 42.0).with(ParameterKey.E_0, -1.0e5);
        assertEquals(-1.0e5 - 300.0 * 42.0, eos.helmholtzFreeEnergy(0.0, T0, V0, p), 1e-9);
    }

    @Test
    @DisplayName("Potentials obey the thermodynamic identities")
    void testIdentities() {
        MineralParameters p = params.with(ParameterKey.S_0, 42.0).with(ParameterKey.E_0, -1.0e5);
        double pressure = 30.0e9;
        double t = 1500.0;
        double v = eos.volume(pressure, t, p);

        double f = eos.helmholtzFreeEnergy(pressure, t, v, p);
        double s = eos.entropy(pressure, t, v, p);

        assertEquals(f + t * s, eos.internalEnergy(pressure, t, v, p), 1e-6);
        assertEquals(f + pressure * v, eos.gibbsFreeEnergy(pressure, t, v, p),
                Math.abs(pressure * v) * 1e-9);
        assertEquals(f + t * s + pressure * v, eos.enthalpy(pressure, t, v, p),
                Math.abs(pressure * v) * 1e-9);
    }

    @Test
    @DisplayName("Enthalpy at zero pressure and T0 reduces to E0")
    void testEnthalpyAtReference() {
        MineralParameters p = params.with(ParameterKey.S_0, 42.0).with(ParameterKey.E_0, -1.0e5);
        assertEquals(-1.0e5, eos.enthalpy(0.0, T0, V0, p), 1e-9);
        assertEquals(-1.0e5 - 300.0 * 42.0, eos.gibbsFreeEnergy(0.0, T0, V0, p), 1e-9);
    }

    @Test
    @DisplayName("Heat capacity at constant volume is the constant Cv")
    void testHeatCapacityV() {
        assertEquals(100.0, eos.heatCapacityV(1e10, 2000.0, 0.9 * V0, params), 0.0);
    }

    @ParameterizedTest
    @EnumSource(value = ThermodynamicProperty.class,
            names = {"ISOTHERMAL_BULK_MODULUS", "ADIABATIC_BULK_MODULUS", "SHEAR_MODULUS",
                    "HEAT_CAPACITY_P", "THERMAL_EXPANSIVITY"})
    @DisplayName("Derivative properties outside the model are flagged unsupported")
    void testUnsupportedProperties(ThermodynamicProperty property) {
        assertFalse(eos.isSupported(property));
    }

    @Test
    @DisplayName("Unsupported properties return zero instead of failing")
    void testUnsupportedReturnZero() {
        double p = 1e10;
        double t = 2000.0;
        double v = 0.9 * V0;
        assertEquals(0.0, eos.isothermalBulkModulus(p, t, v, params));
        assertEquals(0.0, eos.adiabaticBulkModulus(p, t, v, params));
        assertEquals(0.0, eos.shearModulus(p, t, v, params));
        assertEquals(0.0, eos.heatCapacityP(p, t, v, params));
        assertEquals(0.0, eos.thermalExpansivity(p, t, v, params));
    }

    @Test
    @DisplayName("Evaluated properties are flagged supported")
    void testSupportedProperties() {
        assertTrue(eos.isSupported(ThermodynamicProperty.PRESSURE));
        assertTrue(eos.isSupported(ThermodynamicProperty.VOLUME));
        assertTrue(eos.isSupported(ThermodynamicProperty.GIBBS_FREE_ENERGY));
        assertTrue(eos.isSupported(ThermodynamicProperty.HEAT_CAPACITY_V));
    }

    @Test
    @DisplayName("Validation names the missing key")
    void testValidateMissingKey() {
        MineralParameters missing = params.without(ParameterKey.K_0);

        MissingParameterException e =
                assertThrows(MissingParameterException.class, () -> eos.validateParameters(missing));
        assertEquals("K_0", e.getKey());
    }

    @Test
    @DisplayName("Validation accepts implausible values without substituting them")
    void testValidateDoesNotCheckRanges() {
        MineralParameters odd = params.with(ParameterKey.K_0, -1.0).with(ParameterKey.CV, 0.0);

        assertDoesNotThrow(() -> eos.validateParameters(odd));
        assertEquals(-1.0, odd.k0());
    }

    @ParameterizedTest
    @ValueSource(doubles = {1.0e15, -1.0e15})
    @DisplayName("Pressures far outside the achievable range are not bracketed")
    void testOutOfRange(double pressure) {
        assertThrows(RootNotBracketedException.class, () -> eos.volume(pressure, T0, params));

        VolumeSolution solution = eos.solveVolume(pressure, T0, params);
        assertFalse(solution.isSolved());
        assertEquals(VolumeSolution.Status.ROOT_NOT_BRACKETED, solution.getStatus());
        assertTrue(Double.isNaN(solution.getVolume()));
    }

    @Test
    @DisplayName("Typed volume result reports success and missing parameters")
    void testSolveVolumeStatuses() {
        VolumeSolution ok = eos.solveVolume(0.0, T0, params);
        assertTrue(ok.isSolved());
        assertEquals(V0, ok.getVolume(), V0 * 1e-10);
        assertEquals("", ok.getMessage());

        VolumeSolution missing = eos.solveVolume(1e10, T0, params.without(ParameterKey.CV));
        assertEquals(VolumeSolution.Status.MISSING_PARAMETER, missing.getStatus());
        assertTrue(missing.getMessage().contains("Cv"));
    }

    @Test
    @DisplayName("Exhausted refinement budget is reported as non-convergence")
    void testNonConvergence() {
        DksSolidEquationOfState tight = new DksSolidEquationOfState(
                new RootSearchSettings(1.618, 1e-2, 100, 1e-12, 1e-20, 3));

        assertThrows(NonConvergenceException.class, () -> tight.volume(50.0e9, T0, params));
        assertEquals(VolumeSolution.Status.NOT_CONVERGED,
                tight.solveVolume(50.0e9, T0, params).getStatus());
    }

    @Test
    @DisplayName("Non-positive volumes and temperatures are domain errors")
    void testDomainErrors() {
        assertThrows(DomainException.class, () -> eos.pressure(T0, 0.0, params));
        assertThrows(DomainException.class, () -> eos.pressure(T0, -V0, params));
        assertThrows(DomainException.class, () -> eos.entropy(0.0, 0.0, V0, params));
        assertThrows(DomainException.class, () -> eos.helmholtzFreeEnergy(0.0, -5.0, V0, params));
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, -1.0e-5, Double.NaN, Double.POSITIVE_INFINITY})
    @DisplayName("Should report an unusable reference volume as a domain error")
    void testInvalidReferenceVolume(double v0) {
        MineralParameters bad = params.with(ParameterKey.V_0, v0);

        assertThrows(DomainException.class, () -> eos.volume(1.0e9, T0, bad));

        VolumeSolution solution = eos.solveVolume(1.0e9, T0, bad);
        assertEquals(VolumeSolution.Status.DOMAIN_ERROR, solution.getStatus());
        assertTrue(Double.isNaN(solution.getVolume()));
    }

    @Test
    @DisplayName("Concurrent evaluations agree with sequential ones")
    void testConcurrentEvaluation() {
        double[] pressures = IntStream.range(0, 64).mapToDouble(i -> i * 2.0e9).toArray();
        double[] sequential = new double[pressures.length];
        for (int i = 0; i < pressures.length; i++) {
            sequential[i] = eos.volume(pressures[i], 2000.0, params);
        }

        double[] parallel = IntStream.range(0, pressures.length).parallel()
                .mapToDouble(i -> eos.volume(pressures[i], 2000.0, params)).toArray();

        assertArrayEquals(sequential, parallel, 0.0);
    }
}
