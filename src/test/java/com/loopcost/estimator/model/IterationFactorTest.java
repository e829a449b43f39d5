package com.loopcost.estimator.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IterationFactorTest {

    @Test
    void tags() {
        assertEquals("c", IterationFactor.constant().getTag());
        assertEquals("len(xs)", IterationFactor.lengthOf("xs").getTag());
        assertEquals("len(other)", IterationFactor.unresolved().getTag());
    }

    @Test
    void lengthFactorsCompareByName() {
        assertEquals(IterationFactor.lengthOf("n"), IterationFactor.lengthOf("n"));
        assertEquals(IterationFactor.lengthOf("n").hashCode(), IterationFactor.lengthOf("n").hashCode());
        assertNotEquals(IterationFactor.lengthOf("n"), IterationFactor.lengthOf("m"));
    }

    @Test
    void identifierNamedOtherIsNotUnresolved() {
        IterationFactor named = IterationFactor.lengthOf("other");
        assertEquals(IterationFactor.unresolved().getTag(), named.getTag());
        assertNotEquals(IterationFactor.unresolved(), named);
        assertEquals("other", named.getName());
        assertNull(IterationFactor.unresolved().getName());
    }

    @Test
    void lengthRequiresName() {
        assertThrows(NullPointerException.class, () -> IterationFactor.lengthOf(null));
    }
}
