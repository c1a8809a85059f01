package scanline.stereo;

import boofcv.struct.image.ImageBase;

/**
 * Left and right images of a stereo pair have different dimensions.
 */
public class ShapeMismatchException extends IllegalArgumentException {

    public ShapeMismatchException(ImageBase<?> left, ImageBase<?> right) {
        super(String.format("Left image is %dx%d but right image is %dx%d",
                left.width, left.height, right.width, right.height));
    }
}
