package com.eis.cdc.circuit;

import com.eis.cdc.element.Element;
import com.eis.cdc.element.ElementType;
import com.eis.cdc.element.Parameter;
import com.eis.cdc.io.CdcParser;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class CircuitTest {

    private static Element el(ElementType type) {
        return type.create();
    }

    @Test
    public void testSeriesFlattensNestedSeries() {
        Series inner = Series.of(el(ElementType.RESISTOR), el(ElementType.CAPACITOR));
        Series outer = Series.of(inner, el(ElementType.INDUCTOR));
        assertEquals(3, outer.size());
        assertEquals("[RCL]", outer.toString());
    }

    @Test
    public void testParallelNormalization() {
        // Single-item series collapse, nested parallels splice
        Parallel inner = Parallel.of(el(ElementType.RESISTOR), el(ElementType.CAPACITOR));
        Parallel outer = Parallel.of(inner, Series.of(el(ElementType.INDUCTOR)));
        assertEquals("(RCL)", outer.toString());
    }

    @Test
    public void testParallelNeedsTwoBranches() {
        try {
            Parallel.of(el(ElementType.RESISTOR));
            fail("Should reject a single-branch parallel");
        } catch (IllegalArgumentException e) {
            // expected
        }
        try {
            Parallel.of(el(ElementType.RESISTOR), Series.of());
            fail("Should reject an empty branch");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testElementsInCdcOrder() {
        Circuit c = CdcParser.parse("[R([RW]C)]");
        List<Element> elements = c.getElements();
        assertEquals(4, elements.size());
        assertEquals("R", elements.get(0).getSymbol());
        assertEquals("R", elements.get(1).getSymbol());
        assertEquals("W", elements.get(2).getSymbol());
        assertEquals("C", elements.get(3).getSymbol());
    }

    @Test
    public void testSerializationForms() {
        Circuit c = CdcParser.parse("[R{R=1.00E+02}C]");
        assertEquals("[RC]", c.toString());
        assertEquals("[R{R=1.00E+02}C{C=1.00E-06}]", c.toString(2));
        try {
            c.toString(-1);
            fail("Should reject negative decimals");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testParameterSettings() {
        Circuit c = CdcParser.parse("[R{R=5f}R{:bulk}Q]");
        Map<String, Map<String, Parameter>> settings = c.parameterSettings();
        assertEquals(List.of("R", "R_bulk", "Q"), List.copyOf(settings.keySet()));
        assertTrue(settings.get("R").get("R").isFixed());
        assertEquals(5.0, settings.get("R").get("R").getValue(), 0.0);
        assertEquals(0.95, settings.get("Q").get("n").getValue(), 0.0);

        // Copies: editing them leaves the circuit alone
        settings.get("R").get("R").setValue(9.0);
        assertEquals(5.0, c.getElements().get(0).getParameter("R").getValue(), 0.0);
    }

    @Test
    public void testDuplicateLabelsAreDisambiguated() {
        Map<String, Map<String, Parameter>> settings = CdcParser.parse("[RR]").parameterSettings();
        assertEquals(List.of("R", "R#1"), List.copyOf(settings.keySet()));
    }

    @Test
    public void testEmptyCircuit() {
        Circuit c = CdcParser.parse("");
        assertTrue(c.isEmpty());
        assertEquals("[]", c.toString());
        assertTrue(c.getElements().isEmpty());
    }
}
