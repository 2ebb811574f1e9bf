package com.example.techsewa.health;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class OsFamilyTest {

    @Test
    void mapsOsNames() {
        assertEquals(OsFamily.WINDOWS, OsFamily.fromName("Windows 11"));
        assertEquals(OsFamily.LINUX, OsFamily.fromName("Linux"));
        assertEquals(OsFamily.MAC, OsFamily.fromName("Mac OS X"));
        assertEquals(OsFamily.OTHER, OsFamily.fromName("FreeBSD"));
    }
}
