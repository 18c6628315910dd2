package com.zzf.workbridge.workspace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkspacePathsTest {

    @AfterEach
    void tearDown() {
        WorkspacePaths.resetPlatform();
    }

    @Test
    void shouldCollapseSeparatorsAndDotSegments() {
        assertEquals("/home/user/projects/app", WorkspacePaths.normalize("/home//user/./projects/tmp/../app/"));
        assertEquals("/a/b", WorkspacePaths.normalize("  /a/b///  "));
    }

    @Test
    void shouldKeepRootSlash() {
        assertEquals("/", WorkspacePaths.normalize("/"));
        assertEquals("/", WorkspacePaths.normalize("/../.."));
    }

    @Test
    void shouldCanonicalizeWindowsPaths() {
        WorkspacePaths.setCaseInsensitiveForTesting(false);

        assertEquals("C:/Users/dev/ws", WorkspacePaths.normalize("c:\\Users\\dev\\ws\\"));
        assertEquals("C:/", WorkspacePaths.normalize("C:\\"));
        assertTrue(WorkspacePaths.isAbsolute("d:\\code"));
    }

    @Test
    void shouldLowerCaseWholePathOnCaseInsensitivePlatform() {
        WorkspacePaths.setCaseInsensitiveForTesting(true);

        assertEquals("c:/users/dev/ws/feature", WorkspacePaths.normalize("C:\\Users\\Dev\\ws\\feature"));
        assertEquals(WorkspacePaths.normalize("c:/users/dev/ws/feature/"),
                WorkspacePaths.normalize("C:\\Users\\Dev\\WS\\Feature"));
        assertEquals("c:/", WorkspacePaths.normalize("C:\\"));
    }

    @Test
    void shouldKeepCaseOnCaseSensitivePlatform() {
        WorkspacePaths.setCaseInsensitiveForTesting(false);

        assertEquals("/Repo/WS", WorkspacePaths.normalize("/Repo/WS/"));
    }

    @Test
    void shouldBeIdempotent() {
        String once = WorkspacePaths.normalize("/x/./y/../z//");
        assertEquals(once, WorkspacePaths.normalize(once));
    }

    @Test
    void shouldKeepRelativePathsRelative() {
        assertEquals("a/c", WorkspacePaths.normalize("a/b/../c"));
        assertEquals("../up", WorkspacePaths.normalize("../up"));
        assertEquals(".", WorkspacePaths.normalize("./"));
        assertFalse(WorkspacePaths.isAbsolute("relative/path"));
    }

    @Test
    void shouldRejectBlankPaths() {
        assertThrows(IllegalArgumentException.class, () -> WorkspacePaths.normalize("  "));
        assertNull(WorkspacePaths.tryNormalize(null));
        assertNull(WorkspacePaths.tryNormalize(""));
    }

    @Test
    void shouldReturnLastSegmentAsBasename() {
        assertEquals("feature-x", WorkspacePaths.basename("/repo/.worktrees/feature-x/"));
        assertEquals("", WorkspacePaths.basename("/"));
    }
}
