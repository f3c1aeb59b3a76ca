package max.pente.engine.utils;

public final class ColorUtils {
    public static final byte EMPTY = 0;
    // White always opens the game
    public static final byte WHITE = 1;
    public static final byte BLACK = 2;

    private ColorUtils() {}

    public static byte switchColor(int color) {
        return (byte) (3 - color);
    }

    public static boolean isWhite(int color) {
        return color == WHITE;
    }

    public static boolean isStone(int color) {
        return color == WHITE || color == BLACK;
    }

    public static int index(int color) {
        return color - 1;
    }

    public static String name(int color) {
        return switch (color) {
            case WHITE -> "WHITE";
            case BLACK -> "BLACK";
            default -> "EMPTY";
        };
    }
}
