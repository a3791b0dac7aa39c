package ca.gc.cra.halo.infrastructure.detect;

import ca.gc.cra.halo.application.port.RegionDetector;
import ca.gc.cra.halo.domain.error.DetectionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.bytedeco.javacpp.BytePointer;
import org.bytedeco.opencv.global.opencv_core;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Rect;
import org.bytedeco.opencv.opencv_core.RectVector;
import org.bytedeco.opencv.opencv_core.Size;
import org.bytedeco.opencv.opencv_objdetect.CascadeClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Face detector using an OpenCV Haar cascade ({@code haarcascade_frontalface_default.xml}).
 *
 * <p>Frames are converted to grey and histogram-equalised before detection. Haar cascades do not
 * report confidence, so every region carries confidence 1.
 */
public final class HaarCascadeRegionDetector implements RegionDetector, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(HaarCascadeRegionDetector.class);
  private static final double SCALE_FACTOR = 1.1d;
  private static final int MIN_NEIGHBORS = 5;

  private final CascadeClassifier classifier;
  private final int minFaceSize;

  /**
   * @param cascadeFile cascade XML file
   * @param minFaceSize smallest face side in pixels
   * @throws IllegalArgumentException when the cascade cannot be loaded
   */
  public HaarCascadeRegionDetector(Path cascadeFile, int minFaceSize) {
    Objects.requireNonNull(cascadeFile, "cascadeFile");
    if (!Files.isRegularFile(cascadeFile)) {
      throw new IllegalArgumentException("cascade file not found: " + cascadeFile);
    }
    this.classifier = new CascadeClassifier(cascadeFile.toAbsolutePath().toString());
    if (classifier.empty()) {
      classifier.close();
      throw new IllegalArgumentException("cascade file could not be loaded: " + cascadeFile);
    }
    this.minFaceSize = minFaceSize;
    log.info("Loaded Haar cascade {}", cascadeFile);
  }

  @Override
  public List<DetectedRegion> detect(Frame frame) throws DetectionException {
    int type = frame.channels() == 3 ? opencv_core.CV_8UC3 : opencv_core.CV_8UC1;
    try (BytePointer data = new BytePointer(frame.pixels());
        Mat image = new Mat(frame.height(), frame.width(), type, data);
        Mat grey = new Mat();
        RectVector faces = new RectVector();
        Size minSize = new Size(minFaceSize, minFaceSize);
        Size maxSize = new Size()) {
      if (frame.channels() == 3) {
        opencv_imgproc.cvtColor(image, grey, opencv_imgproc.COLOR_BGR2GRAY);
      } else {
        image.copyTo(grey);
      }
      opencv_imgproc.equalizeHist(grey, grey);
      classifier.detectMultiScale(grey, faces, SCALE_FACTOR, MIN_NEIGHBORS, 0, minSize, maxSize);
      List<DetectedRegion> regions = new ArrayList<>((int) faces.size());
      for (long i = 0; i < faces.size(); i++) {
        Rect rect = faces.get(i);
        regions.add(DetectedRegion.of(rect.x(), rect.y(), rect.width(), rect.height()));
      }
      return regions;
    } catch (RuntimeException ex) {
      throw new DetectionException("Haar detection failed on frame " + frame.sequence(), ex);
    }
  }

  @Override
  public void close() {
    classifier.close();
  }
}
