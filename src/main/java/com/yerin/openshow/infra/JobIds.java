package com.yerin.openshow.infra;

import java.security.SecureRandom;
import java.util.HexFormat;

public final class JobIds {
    private static final SecureRandom RANDOM = new SecureRandom();

    private JobIds() {}

    /** {@code job_} followed by 12 hex characters. */
    public static String next() {
        byte[] bytes = new byte[6];
        RANDOM.nextBytes(bytes);
        return "job_" + HexFormat.of().formatHex(bytes);
    }
}
