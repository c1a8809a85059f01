package scanline.stereo.app;

import boofcv.alg.color.ColorRgb;
import boofcv.io.image.ConvertBufferedImage;
import boofcv.io.image.UtilImageIO;
import boofcv.struct.image.GrayU8;
import boofcv.struct.image.Planar;
import org.apache.commons.io.FileUtils;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scanline.stereo.OcclusionSweep;
import scanline.stereo.ScanlineQualityMetrics;
import scanline.stereo.ScanlineStereoConfig;
import scanline.stereo.ScanlineStereoMatcher;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Computes disparity maps of one stereo pair for a range of occlusion costs
 * and saves each pair of maps as PNG images.
 */
public class OcclusionSweepApp {
    private static final Logger LOGGER = LoggerFactory.getLogger(OcclusionSweepApp.class);

    @Option(name = "-l", aliases = {"--Left"}, usage = "Left rectified image", required = true)
    public String pathLeft;

    @Option(name = "-r", aliases = {"--Right"}, usage = "Right rectified image", required = true)
    public String pathRight;

    @Option(name = "-o", aliases = {"--Output"}, usage = "Path to output directory")
    public String pathOutput = "out2";

    @Option(name = "--Start", usage = "First occlusion cost")
    public double start = OcclusionSweep.DEFAULT_START;

    @Option(name = "--Stop", usage = "Occlusion costs stay below this value")
    public double stop = OcclusionSweep.DEFAULT_STOP;

    @Option(name = "--Step", usage = "Increment between occlusion costs")
    public double step = OcclusionSweep.DEFAULT_STEP;

    @Option(name = "--Variance", usage = "Divides the squared intensity difference of a match")
    public double variance = 16.0;

    @Option(name = "--Sequential", usage = "Process rows on a single thread")
    public boolean sequential = false;

    /**
     * @return number of occlusion costs that failed
     */
    public int process() throws IOException {
        for (String path : new String[]{pathLeft, pathRight}) {
            if (!new File(path).isFile())
                throw new FileNotFoundException(path);
        }
        GrayU8 left = loadGray(pathLeft);
        GrayU8 right = loadGray(pathRight);

        File dirOutput = new File(pathOutput);
        FileUtils.forceMkdir(dirOutput);

        OcclusionSweep sweep = new OcclusionSweep(start, stop, step);
        LOGGER.info("{}x{} stereo pair, {}", left.width, left.height, sweep);

        var config = new ScanlineStereoConfig();
        config.variance = variance;
        config.concurrent = !sequential;

        var matcher = new ScanlineStereoMatcher(config);
        var outputLeft = new GrayU8(1, 1);
        var outputRight = new GrayU8(1, 1);

        int failures = 0;
        for (double occlusionCost : sweep.costs()) {
            config.occlusionCost = occlusionCost;
            try {
                matcher.updateConfiguration(config);
                ScanlineQualityMetrics metrics = matcher.computeDisparity(left, right, outputLeft, outputRight);
                LOGGER.debug("\n{}", metrics.getDetailedReport());

                save(outputLeft, new File(dirOutput, OcclusionSweep.leftFileName(occlusionCost)));
                save(outputRight, new File(dirOutput, OcclusionSweep.rightFileName(occlusionCost)));
            } catch (RuntimeException e) {
                LOGGER.error("Occlusion cost {} failed, skipping", occlusionCost, e);
                failures++;
            }
        }
        return failures;
    }

    /**
     * Loads an image as 8-bit luma. Color images are reduced with the ITU-R 601
     * weights 0.299, 0.587 and 0.114, alpha is ignored.
     */
    static GrayU8 loadGray(String path) throws IOException {
        BufferedImage image = UtilImageIO.loadImage(path);
        if (image == null)
            throw new IOException("Failed to load " + path);

        Planar<GrayU8> bands = ConvertBufferedImage.convertFromPlanar(image, null, true, GrayU8.class);
        var gray = new GrayU8(bands.width, bands.height);
        if (bands.getNumBands() >= 3) {
            // bands are ordered RGB with any alpha band last
            ColorRgb.rgbToGray_Weighted(bands.partialSpectrum(0, 1, 2), gray);
        } else {
            gray.setTo(bands.getBand(0));
        }
        return gray;
    }

    private static void save(GrayU8 image, File file) {
        UtilImageIO.saveImage(ConvertBufferedImage.convertTo(image, null), file.getPath());
        LOGGER.info("Saved {}", file.getPath());
    }

    public static void main(String[] args) {
        var app = new OcclusionSweepApp();
        var parser = new CmdLineParser(app);
        try {
            parser.parseArgument(args);
        } catch (CmdLineException e) {
            System.err.println(e.getMessage());
            parser.printUsage(System.err);
            System.exit(1);
        }

        try {
            int failures = app.process();
            if (failures > 0)
                System.exit(3);
        } catch (IOException e) {
            LOGGER.error("Stereo sweep aborted", e);
            System.exit(2);
        }
    }
}
