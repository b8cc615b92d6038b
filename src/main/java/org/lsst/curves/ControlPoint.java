package org.lsst.curves;

/**
 * One (x, y) point a curve passes through. Both coordinates are stored as 16
 * bit signed integers, matching the ACV file layout.
 */
public final class ControlPoint {

    private final short x;
    private final short y;

    public ControlPoint(int x, int y) {
        this.x = checkRange("x", x);
        this.y = checkRange("y", y);
    }

    private static short checkRange(String axis, int value) {
        if (value < Short.MIN_VALUE || value > Short.MAX_VALUE) {
            throw new IllegalArgumentException("Control point " + axis + " out of 16 bit range: " + value);
        }
        return (short) value;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    @Override
    public int hashCode() {
        int hash = 7;
        hash = 53 * hash + this.x;
        hash = 53 * hash + this.y;
        return hash;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final ControlPoint other = (ControlPoint) obj;
        return this.x == other.x && this.y == other.y;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
