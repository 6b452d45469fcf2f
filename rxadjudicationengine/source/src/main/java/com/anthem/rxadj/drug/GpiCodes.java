package com.anthem.rxadj.drug;

/**
 * Helpers for hierarchical class code comparisons.
 */
public final class GpiCodes {

    private GpiCodes() {
    }

    /**
     * True when {@code prefix} is non-empty and {@code gpi} begins with it.
     */
    public static boolean isUnder(String gpi, String prefix) {
        return gpi != null && prefix != null && !prefix.isEmpty() && gpi.startsWith(prefix);
    }
}
