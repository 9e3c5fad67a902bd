package nl.bytesoflife.deltaspice.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ComponentTest {

    @Test
    void newComponentTakesTypeDefaultValue() {
        Component r = new Component("R1", ComponentType.RESISTOR);
        assertEquals("1k", r.getValue());
        assertEquals(2, r.getTerminalCount());
        assertEquals("R1 [Resistor] = 1k", r.toString());
    }

    @Test
    void blankIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new Component(" ", ComponentType.RESISTOR));
    }

    @Test
    void typeLookupAcceptsDisplayAndClassNames() {
        assertEquals(ComponentType.VOLTAGE_SOURCE, ComponentType.fromName("Voltage Source"));
        assertEquals(ComponentType.VOLTAGE_SOURCE, ComponentType.fromName("VoltageSource"));
        assertEquals(ComponentType.OP_AMP, ComponentType.fromName("op-amp"));
        assertEquals(ComponentType.LED, ComponentType.fromName("LEDComponent"));
        assertThrows(IllegalArgumentException.class, () -> ComponentType.fromName("Memristor"));
    }

    @Test
    void terminalCountsFollowType() {
        assertEquals(1, ComponentType.GROUND.getTerminalCount());
        assertEquals(3, ComponentType.OP_AMP.getTerminalCount());
        assertEquals(3, ComponentType.BJT_NPN.getTerminalCount());
        assertEquals(4, ComponentType.VCVS.getTerminalCount());
        assertEquals(4, ComponentType.TRANSFORMER.getTerminalCount());
    }

    @Test
    void initialConditionOnlyForReactiveComponents() {
        Component c = new Component("C1", ComponentType.CAPACITOR);
        c.setInitialCondition("2.5");
        assertEquals("2.5", c.getInitialCondition());

        Component r = new Component("R1", ComponentType.RESISTOR);
        assertThrows(IllegalStateException.class, () -> r.setInitialCondition("1"));
    }

    @Test
    void waveformSourceRendersSelectedFunction() {
        Component v = new Component("V1", ComponentType.WAVEFORM_SOURCE);
        assertEquals(WaveformType.SIN, v.getWaveformType());
        assertEquals("SIN(0 5 1k 0 0 0)", v.getSpiceValue());

        v.setWaveformType(WaveformType.PULSE);
        v.setWaveformParameter(WaveformType.PULSE, "v2", "3.3");
        assertEquals("PULSE(0 3.3 0 1n 1n 500u 1m)", v.getSpiceValue());

        // parameters of the other shapes are kept
        v.setWaveformType(WaveformType.SIN);
        assertEquals("SIN(0 5 1k 0 0 0)", v.getSpiceValue());
        assertEquals("3.3", v.getWaveformParameters(WaveformType.PULSE).get("v2"));
    }

    @Test
    void waveformParameterNamesAreValidated() {
        Component v = new Component("V1", ComponentType.WAVEFORM_SOURCE);
        assertThrows(IllegalArgumentException.class,
                () -> v.setWaveformParameter(WaveformType.EXP, "amplitude", "1"));
        Component dc = new Component("V2", ComponentType.VOLTAGE_SOURCE);
        assertThrows(IllegalStateException.class, () -> dc.setWaveformType(WaveformType.SIN));
        assertEquals("5V", dc.getSpiceValue());
    }

    @Test
    void subcircuitPinsFixTerminalCount() {
        Component x = new Component("U1", ComponentType.SUBCIRCUIT);
        assertEquals(0, x.getTerminalCount());
        x.setSubcircuit("divider", List.of("in", "out", "gnd"), ".subckt divider in out gnd\n.ends");
        assertEquals(3, x.getTerminalCount());
        assertEquals("divider", x.getSubcircuitName());
        assertThrows(IllegalStateException.class,
                () -> new Component("R1", ComponentType.RESISTOR).setSubcircuit("a", List.of(), ""));
    }

    @Test
    void analysisLookupAcceptsLegacyAlias() {
        assertEquals(AnalysisType.DC_OPERATING_POINT, AnalysisType.fromName("Operational Point"));
        assertEquals(AnalysisType.POLE_ZERO, AnalysisType.fromName("pole-zero"));
        assertTrue(AnalysisType.lookup("Monte Carlo").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> AnalysisType.fromName("Monte Carlo"));
    }

    @Test
    void analysisParamResolvesFirstPresentAlias() {
        AnalysisSpec spec = AnalysisSpec.of(AnalysisType.AC_SWEEP, java.util.Map.of("sweepType", "oct"));
        assertEquals("oct", spec.param("dec", "sweep_type", "sweepType"));
        assertEquals(100, spec.param(100, "points"));
    }
}
