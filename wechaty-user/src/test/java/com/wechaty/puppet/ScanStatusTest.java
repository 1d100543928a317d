package com.wechaty.puppet;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ScanStatusTest {

    @Test
    void fromValue_acceptsNameInAnyCase() {
        assertEquals(ScanStatus.WAITING, ScanStatus.fromValue("waiting"));
        assertEquals(ScanStatus.CONFIRMED, ScanStatus.fromValue("CONFIRMED"));
    }

    @Test
    void fromValue_acceptsNumericCode() {
        assertEquals(ScanStatus.SCANNED, ScanStatus.fromValue("3"));
        assertEquals(ScanStatus.UNKNOWN, ScanStatus.fromValue(" 0 "));
    }

    @Test
    void fromValue_rejectsUnknownValues() {
        assertThrows(IllegalArgumentException.class, () -> ScanStatus.fromValue("9"));
        assertThrows(IllegalArgumentException.class, () -> ScanStatus.fromValue("later"));
        assertThrows(IllegalArgumentException.class, () -> ScanStatus.fromValue(""));
        assertThrows(IllegalArgumentException.class, () -> ScanStatus.fromValue(null));
    }
}
