package scanline.stereo;

import boofcv.struct.image.GrayF32;
import boofcv.struct.image.GrayU8;

import java.util.Random;

/**
 * Small stereo pairs shared by the tests
 */
final class StereoTestImages {

    /** Textured rows, the right view is the left one shifted by two pixels */
    static final int[][] SHIFTED_LEFT = {
            {20, 200, 40, 180, 60, 160, 80, 140, 100, 120, 30, 210},
            {90, 10, 250, 70, 130, 30, 190, 110, 50, 230, 150, 0},
            {255, 0, 128, 64, 192, 32, 224, 96, 160, 16, 240, 80}};

    static final int[][] SHIFTED_RIGHT = {
            {40, 180, 60, 160, 80, 140, 100, 120, 30, 210, 65, 98},
            {250, 70, 130, 30, 190, 110, 50, 230, 150, 0, 15, 160},
            {128, 64, 192, 32, 224, 96, 160, 16, 240, 80, 170, 170}};

    private StereoTestImages() {
    }

    static GrayU8 gray(int[]... rows) {
        GrayU8 image = new GrayU8(rows[0].length, rows.length);
        for (int y = 0; y < rows.length; y++) {
            for (int x = 0; x < rows[y].length; x++) {
                image.set(x, y, rows[y][x]);
            }
        }
        return image;
    }

    static GrayU8 constant(int width, int height, int value) {
        GrayU8 image = new GrayU8(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.set(x, y, value);
            }
        }
        return image;
    }

    /**
     * Random dot pair, right view shifted left by {@code shift} with fresh dots
     * filling the uncovered border
     */
    static GrayU8[] randomDots(int width, int height, int shift, long seed) {
        Random rand = new Random(seed);
        GrayU8 left = new GrayU8(width, height);
        GrayU8 right = new GrayU8(width, height);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                left.set(x, y, rand.nextInt(256));
            }
            for (int x = 0; x < width; x++) {
                right.set(x, y, x + shift < width ? left.get(x + shift, y) : rand.nextInt(256));
            }
        }
        return new GrayU8[]{left, right};
    }

    static boolean sameImage(GrayU8 a, GrayU8 b) {
        if (a.width != b.width || a.height != b.height)
            return false;
        for (int y = 0; y < a.height; y++) {
            for (int x = 0; x < a.width; x++) {
                if (a.get(x, y) != b.get(x, y))
                    return false;
            }
        }
        return true;
    }

    static boolean sameImage(GrayF32 a, GrayF32 b) {
        if (a.width != b.width || a.height != b.height)
            return false;
        for (int y = 0; y < a.height; y++) {
            for (int x = 0; x < a.width; x++) {
                if (a.get(x, y) != b.get(x, y))
                    return false;
            }
        }
        return true;
    }
}
