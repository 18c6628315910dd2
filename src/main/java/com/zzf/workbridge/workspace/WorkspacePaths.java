package com.zzf.workbridge.workspace;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lexical path normalization used as the lookup key for every per-workspace map.
 * <p>
 * Separators are canonicalized to {@code /}, duplicate separators collapsed, {@code .} and
 * {@code ..} segments resolved, and the trailing separator stripped (the root keeps its slash).
 * The file system is never consulted, so paths that no longer exist normalize too.
 * <p>
 * On Windows the whole path is lower-cased, since its file systems ignore case; elsewhere case is
 * kept and only a drive letter is upper-cased.
 */
public final class WorkspacePaths {
    private static final Pattern DRIVE_PREFIX = Pattern.compile("^[A-Za-z]:/.*|^[A-Za-z]:$");

    private static volatile boolean caseInsensitive = runningOnWindows();

    private WorkspacePaths() {}

    private static boolean runningOnWindows() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).startsWith("windows");
    }

    static void setCaseInsensitiveForTesting(boolean value) {
        caseInsensitive = value;
    }

    static void resetPlatform() {
        caseInsensitive = runningOnWindows();
    }

    /**
     * Normalizes a raw path. Relative paths stay relative.
     *
     * @throws IllegalArgumentException if the path is null or blank
     */
    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("workspace path is blank");
        }
        String path = raw.trim().replace('\\', '/');
        if (caseInsensitive) {
            path = path.toLowerCase(Locale.ROOT);
        }
        String prefix = "";
        if (DRIVE_PREFIX.matcher(path).matches()) {
            String drive = path.substring(0, 2);
            prefix = (caseInsensitive ? drive : drive.toUpperCase(Locale.ROOT)) + "/";
            path = path.substring(2);
        } else if (path.startsWith("/")) {
            prefix = "/";
        }
        boolean absolute = !prefix.isEmpty();

        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (!segments.isEmpty() && !"..".equals(segments.peekLast())) {
                    segments.removeLast();
                } else if (!absolute) {
                    segments.addLast(segment);
                }
                continue;
            }
            segments.addLast(segment);
        }

        StringBuilder sb = new StringBuilder(prefix);
        Iterator<String> it = segments.iterator();
        while (it.hasNext()) {
            sb.append(it.next());
            if (it.hasNext()) {
                sb.append('/');
            }
        }
        if (sb.length() == 0) {
            return ".";
        }
        return sb.toString();
    }

    /**
     * Like {@link #normalize(String)} but returns {@code null} instead of throwing.
     */
    public static String tryNormalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return normalize(raw);
    }

    public static boolean isAbsolute(String path) {
        if (path == null || path.isBlank()) {
            return false;
        }
        String p = path.trim().replace('\\', '/');
        return p.startsWith("/") || DRIVE_PREFIX.matcher(p).matches();
    }

    /**
     * Last segment of the normalized path, or an empty string for a root.
     */
    public static String basename(String path) {
        String normalized = normalize(path);
        int idx = normalized.lastIndexOf('/');
        if (idx < 0) {
            return normalized;
        }
        return normalized.substring(idx + 1);
    }
}
