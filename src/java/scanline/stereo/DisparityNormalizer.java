package scanline.stereo;

import boofcv.alg.misc.ImageMiscOps;
import boofcv.alg.misc.ImageStatistics;
import boofcv.struct.image.GrayF32;
import boofcv.struct.image.GrayU8;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Linearly rescales a raw disparity map so its maximum becomes 255, then
 * truncates every pixel to an unsigned byte.
 */
public class DisparityNormalizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(DisparityNormalizer.class);

    public static final int MAX_INTENSITY = 255;

    /**
     * Writes the rescaled map into output, which is reshaped to match raw.
     *
     * @return false if raw had no positive value, in which case output is all zero
     */
    public static boolean normalize(GrayF32 raw, GrayU8 output) {
        output.reshape(raw.width, raw.height);

        float max = raw.width == 0 || raw.height == 0 ? 0 : ImageStatistics.max(raw);
        if (!(max > 0)) {
            LOGGER.warn("Disparity map {}x{} has maximum {}, writing an all zero map", raw.width, raw.height, max);
            ImageMiscOps.fill(output, 0);
            return false;
        }

        double scale = MAX_INTENSITY / (double) max;
        for (int y = 0; y < raw.height; y++) {
            for (int x = 0; x < raw.width; x++) {
                int value = (int) (raw.unsafe_get(x, y) * scale);
                if (value < 0)
                    value = 0;
                else if (value > MAX_INTENSITY)
                    value = MAX_INTENSITY;
                output.unsafe_set(x, y, value);
            }
        }
        return true;
    }
}
