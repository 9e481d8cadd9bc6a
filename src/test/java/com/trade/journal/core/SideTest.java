package com.trade.journal.core;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class SideTest {

    @Test
    void parseAcceptsAbbreviations() {
        assertEquals(Side.BUY, Side.parse("buy"));
        assertEquals(Side.BUY, Side.parse(" B "));
        assertEquals(Side.SELL, Side.parse("Sell"));
        assertEquals(Side.SELL, Side.parse("s"));
    }

    @Test
    void parseRejectsUnknownSide() {
        assertThrows(IllegalArgumentException.class, () -> Side.parse("SHORT"));
    }

    @Test
    void pairingMethodParse() {
        assertEquals(PairingMethod.LIFO, PairingMethod.parse("lifo"));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> PairingMethod.parse("HIFO"));
        assertTrue(e.getMessage().contains("HIFO"));
    }

    /**
     * 土耳其语默认区域下 "i" 大写为 "İ"，解析不能依赖默认区域
     */
    @Test
    void parseIndependentOfDefaultLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(PairingMethod.FIFO, PairingMethod.parse("fifo"));
            assertEquals(PairingMethod.LIFO, PairingMethod.parse("Lifo"));
            assertEquals(Side.BUY, Side.parse("buy"));
            assertTrue(OptionSymbols.isOption("spy251218c00679000"));
        } finally {
            Locale.setDefault(original);
        }
    }
}
