package com.gridcalc.app.services;

import com.gridcalc.app.dto.ValidationResponse;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class FormulaServiceTest {

    private final FormulaService formulaService = new EngineFixture().formulaService;

    @Test
    void testValidFormula() {
        ValidationResponse response = formulaService.validateFormula("SUM(A1:B2, 'My Sheet'!C3) + FOO(1)");
        assertTrue(response.isValid());
        assertEquals(Arrays.asList("A1:B2", "'My Sheet'!C3"), response.getReferences());
        assertEquals(Arrays.asList("SUM", "FOO"), response.getFunctions());
        assertEquals(Collections.singletonList("FOO"), response.getUnknownFunctions());
        assertNull(response.getPosition());
    }

    @Test
    void testInvalidFormula() {
        ValidationResponse response = formulaService.validateFormula("=(1+2");
        assertFalse(response.isValid());
        assertEquals(Integer.valueOf(5), response.getPosition());
        assertNotNull(response.getMessage());
    }
}
