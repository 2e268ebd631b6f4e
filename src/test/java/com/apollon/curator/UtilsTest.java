package com.apollon.curator;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class UtilsTest {

    @Test
    void testSanitizeFilename() {
        assertEquals("My_Playlist_Name_____", Utils.sanitizeFilename("My:Playlist/Name?*<>|"));
        assertEquals("a_b", Utils.sanitizeFilename("a b"));
        assertEquals("", Utils.sanitizeFilename(null));
    }

    @Test
    void envOrPropFallsBackToPropertyThenDefault() {
        String key = "CURATOR_TEST_SETTING_" + System.nanoTime();
        assertEquals("fallback", Utils.envOrProp(key, "fallback"));
        System.setProperty(key, "from-property");
        try {
            assertEquals("from-property", Utils.envOrProp(key, "fallback"));
        } finally {
            System.clearProperty(key);
        }
    }

    @Test
    void libraryPathEndsWithLibraryJson() {
        if (!Utils.envOrProp("CURATOR_LIBRARY_PATH", "").isBlank()) return;
        assertTrue(Utils.libraryPath().endsWith("library.json"));
        assertTrue(Utils.libraryPath().getParent().endsWith(Utils.APP_DIR_NAME));
    }
}
