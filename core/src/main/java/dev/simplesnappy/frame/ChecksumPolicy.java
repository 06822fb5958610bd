/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.simplesnappy.frame;

import java.util.Locale;

/**
 * What {@link FramedSnappyInputStream} does with the masked CRC32C carried by each data chunk.
 */
public enum ChecksumPolicy {
    /**
     * Verify, and fail with {@link dev.simplesnappy.CorruptFrameException} on a mismatch.
     */
    STRICT,
    /**
     * Verify, log a warning on a mismatch and hand out the data anyway.
     */
    WARN,
    /**
     * Do not verify.
     */
    SKIP;

    /**
     * System property selecting the policy used when none is passed explicitly:
     * {@code strict} (the default), {@code warn} or {@code skip}.
     */
    public static final String PROPERTY = "simplesnappy.checksums";

    private static final System.Logger LOG = System.getLogger(ChecksumPolicy.class.getName());

    /**
     * Resolve the policy configured via {@value #PROPERTY}.
     */
    public static ChecksumPolicy fromSystemProperty() {
        String value = System.getProperty(PROPERTY);
        if (value == null || value.isBlank()) {
            return STRICT;
        }

        try {
            ChecksumPolicy policy = valueOf(value.trim().toUpperCase(Locale.ROOT));
            LOG.log(System.Logger.Level.DEBUG, "Checksum policy {0} set via system property", policy);
            return policy;
        }
        catch (IllegalArgumentException e) {
            LOG.log(System.Logger.Level.WARNING, "Unknown value ''{0}'' for system property {1}, using {2}",
                    value, PROPERTY, STRICT);
            return STRICT;
        }
    }
}
