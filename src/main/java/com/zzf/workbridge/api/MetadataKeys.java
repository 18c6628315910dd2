package com.zzf.workbridge.api;

import java.util.regex.Pattern;

/**
 * Metadata keys are stored in git config, hence the restricted alphabet.
 */
public final class MetadataKeys {
    public static final Pattern KEY_PATTERN = Pattern.compile("^[A-Za-z][A-Za-z0-9-]*$");
    public static final int MAX_LENGTH = 64;

    private MetadataKeys() {}

    public static boolean isValid(String key) {
        return key != null
                && !key.isEmpty()
                && key.length() <= MAX_LENGTH
                && KEY_PATTERN.matcher(key).matches()
                && !key.endsWith("-");
    }
}
