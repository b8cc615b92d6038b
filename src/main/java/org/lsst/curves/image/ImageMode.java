package org.lsst.curves.image;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The colour modes an image can be in. Each mode has a short mode string, a
 * band count, and whether it belongs to the single channel (grey) family.
 */
public enum ImageMode {

    MONO("1", 1, true),
    L("L", 1, true),
    I16("I;16", 1, true),
    P("P", 1, false),
    LA("LA", 2, false),
    RGB("RGB", 3, false),
    RGBA("RGBA", 4, false),
    CMYK("CMYK", 4, false);

    private static final Map<String, ImageMode> BY_STRING;

    static {
        Map<String, ImageMode> modes = new LinkedHashMap<>();
        for (ImageMode mode : values()) {
            modes.put(mode.modeString, mode);
        }
        BY_STRING = Collections.unmodifiableMap(modes);
    }

    private final String modeString;
    private final int bands;
    private final boolean singleChannel;

    ImageMode(String modeString, int bands, boolean singleChannel) {
        this.modeString = modeString;
        this.bands = bands;
        this.singleChannel = singleChannel;
    }

    public static ImageMode forString(String modeString) {
        ImageMode mode = BY_STRING.get(modeString);
        if (mode == null) {
            throw new UnknownModeException("Unknown image mode: " + modeString);
        }
        return mode;
    }

    public String getModeString() {
        return modeString;
    }

    public int getBands() {
        return bands;
    }

    /**
     * @return true for the grey modes, which tone curves treat as one channel
     */
    public boolean isSingleChannel() {
        return singleChannel;
    }

    @Override
    public String toString() {
        return modeString;
    }
}
