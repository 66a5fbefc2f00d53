package com.al.medreportz.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class NumberFormatUtilTest {

    @Test
    public void testNatural() {
        assertEquals("105", NumberFormatUtil.natural(105.0));
        assertEquals("11.2", NumberFormatUtil.natural(11.2));
        assertEquals("31.5", NumberFormatUtil.natural(31.5));
        assertEquals("150", NumberFormatUtil.natural(150));
        assertEquals("0", NumberFormatUtil.natural(0.0));
        assertEquals("7500", NumberFormatUtil.natural(7500));
        assertEquals("0.05", NumberFormatUtil.natural(0.05));
    }
}
