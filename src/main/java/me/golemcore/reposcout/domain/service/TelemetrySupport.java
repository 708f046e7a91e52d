package me.golemcore.reposcout.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Hashing helpers for fingerprints, cache keys and log-safe identifiers.
 */
public final class TelemetrySupport {

    private static final char[] HEX = "0123456789abcdef".toCharArray();
    private static final int SHORT_HASH_LEN = 16;
    private static final char PART_SEPARATOR = '\u001f';

    private TelemetrySupport() {
    }

    public static String shortHash(String value) {
        if (value == null || value.isBlank()) {
            return "na";
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(value.trim().getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder(hash.length * 2);
            for (byte b : hash) {
                int v = b & 0xFF;
                builder.append(HEX[v >>> 4]).append(HEX[v & 0x0F]);
            }
            return builder.substring(0, SHORT_HASH_LEN);
        } catch (NoSuchAlgorithmException e) {
            return Integer.toHexString(value.hashCode());
        }
    }

    /**
     * Hash of several parts joined with a separator that cannot occur in normal
     * text, so {@code ("ab", "c")} and {@code ("a", "bc")} differ.
     */
    public static String fingerprint(String... parts) {
        StringBuilder joined = new StringBuilder();
        for (String part : parts) {
            joined.append(part == null ? "" : part).append(PART_SEPARATOR);
        }
        return shortHash(joined.toString());
    }
}
