package com.csd.pkghealth.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LicenseExpressionTest {

    @Test
    void singleIdentifier() {
        LicenseExpression expression = LicenseExpression.parse(" MIT ");
        assertTrue(expression.isSingle());
        assertEquals("MIT", expression.getExpression());
        assertEquals(List.of("MIT"), expression.getOperands());
    }

    @Test
    void dualLicenseWithParentheses() {
        LicenseExpression expression = LicenseExpression.parse("(MIT OR Apache-2.0)");
        assertTrue(expression.isDual());
        assertFalse(expression.isConjunctive());
        assertEquals("MIT OR Apache-2.0", expression.getExpression());
        assertEquals(List.of("MIT", "Apache-2.0"), expression.getOperands());
    }

    @Test
    void conjunction() {
        LicenseExpression expression = LicenseExpression.parse("MIT AND BSD-3-Clause");
        assertTrue(expression.isConjunctive());
        assertEquals(List.of("MIT", "BSD-3-Clause"), expression.getOperands());
    }

    @Test
    void orBindsLooserThanAnd() {
        LicenseExpression expression = LicenseExpression.parse("MIT OR (GPL-2.0 AND BSD-3-Clause)");
        assertTrue(expression.isDual());
        assertEquals(List.of("MIT", "GPL-2.0 AND BSD-3-Clause"), expression.getOperands());
        assertTrue(LicenseExpression.parse(expression.getOperands().get(1)).isConjunctive());
    }

    @Test
    void parenthesisedGroupIsOneOperand() {
        LicenseExpression expression = LicenseExpression.parse("(MIT OR Apache-2.0) AND GPL-3.0-only");
        assertTrue(expression.isConjunctive());
        assertFalse(expression.isDual());
        assertEquals("(MIT OR Apache-2.0) AND GPL-3.0-only", expression.getExpression());
        assertEquals(List.of("MIT OR Apache-2.0", "GPL-3.0-only"), expression.getOperands());
        assertTrue(LicenseExpression.parse(expression.getOperands().get(0)).isDual());
    }

    @Test
    void andBindsTighterThanOrWithoutParentheses() {
        LicenseExpression expression = LicenseExpression.parse("MIT AND ISC OR GPL-2.0");
        assertTrue(expression.isDual());
        assertEquals(List.of("MIT AND ISC", "GPL-2.0"), expression.getOperands());
    }

    @Test
    void nestedAndUnbalancedParentheses() {
        assertEquals("MIT", LicenseExpression.parse("((MIT))").getExpression());
        assertTrue(LicenseExpression.parse("((MIT))").isSingle());

        LicenseExpression unbalanced = LicenseExpression.parse("MIT AND (ISC");
        assertTrue(unbalanced.isConjunctive());
        assertEquals("ISC", LicenseExpression.parse(unbalanced.getOperands().get(1)).getExpression());
    }

    @Test
    void operatorsAreCaseInsensitive() {
        assertTrue(LicenseExpression.parse("mit or isc").isDual());
        assertTrue(LicenseExpression.parse("mit and isc").isConjunctive());
        // "OR" inside an identifier is not an operator
        assertTrue(LicenseExpression.parse("ORACLE-LICENSE").isSingle());
    }
}
