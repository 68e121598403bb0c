package visualqa.model;

/**
 * One RGBA8 pixel. Components are in the range 0–255.
 */
public record Pixel(int r, int g, int b, int a) {

    public static final Pixel OPAQUE_BLACK = new Pixel(0, 0, 0, 255);
    public static final Pixel OPAQUE_WHITE = new Pixel(255, 255, 255, 255);

    public Pixel {
        checkComponent("r", r);
        checkComponent("g", g);
        checkComponent("b", b);
        checkComponent("a", a);
    }

    /** Opaque pixel (alpha 255). */
    public static Pixel opaque(int r, int g, int b) {
        return new Pixel(r, g, b, 255);
    }

    /**
     * Largest absolute per-channel difference between this pixel and {@code other},
     * over all four channels.
     */
    public int maxChannelDiff(Pixel other) {
        int dr = Math.abs(r - other.r);
        int dg = Math.abs(g - other.g);
        int db = Math.abs(b - other.b);
        int da = Math.abs(a - other.a);
        return Math.max(Math.max(dr, dg), Math.max(db, da));
    }

    private static void checkComponent(String name, int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Pixel component " + name + " out of range 0-255: " + value);
        }
    }

    @Override
    public String toString() {
        return "(" + r + "," + g + "," + b + "," + a + ")";
    }
}
