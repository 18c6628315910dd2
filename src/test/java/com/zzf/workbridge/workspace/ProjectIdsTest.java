package com.zzf.workbridge.workspace;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProjectIdsTest {

    @Test
    void shouldCombineSafeNameWithHashPrefix() {
        String id = ProjectIds.generate("/home/dev/My App!");

        assertTrue(id.matches("My-App-[0-9a-f]{8}"), id);
    }

    @Test
    void shouldBeStableAcrossEquivalentSpellings() {
        assertEquals(ProjectIds.generate("/home/dev/app"), ProjectIds.generate("/home/dev//app/"));
    }

    @Test
    void shouldDifferForSameNameInDifferentLocations() {
        assertNotEquals(ProjectIds.generate("/a/app"), ProjectIds.generate("/b/app"));
    }

    @Test
    void shouldFallBackToRootName() {
        assertTrue(ProjectIds.generate("/").startsWith("root-"));
    }
}
