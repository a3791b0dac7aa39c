package ca.gc.cra.halo.infrastructure.capture;

import static org.bytedeco.opencv.global.opencv_videoio.CAP_PROP_FRAME_HEIGHT;
import static org.bytedeco.opencv.global.opencv_videoio.CAP_PROP_FRAME_WIDTH;

import ca.gc.cra.halo.application.port.CaptureSource;
import ca.gc.cra.halo.application.port.ClockPort;
import ca.gc.cra.halo.domain.error.CaptureException;
import ca.gc.cra.halo.domain.error.DeviceUnavailableException;
import ca.gc.cra.halo.domain.frame.Frame;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_videoio.VideoCapture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link CaptureSource} reading from an OpenCV {@link VideoCapture}.
 *
 * <p>A purely numeric device string opens the camera with that index and requests
 * {@value #REQUESTED_WIDTH}x{@value #REQUESTED_HEIGHT}; anything else is treated as a video file
 * path. Frames are converted to packed BGR; four-channel input is reduced to three channels.
 */
public final class OpenCvCaptureSource implements CaptureSource {
  private static final Logger log = LoggerFactory.getLogger(OpenCvCaptureSource.class);
  static final int REQUESTED_WIDTH = 1280;
  static final int REQUESTED_HEIGHT = 720;

  private final ClockPort clock;
  private VideoCapture capture;
  private Mat mat;
  private String backend = "OpenCV (closed)";
  private long sequence;

  public OpenCvCaptureSource(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public void open(String device) throws DeviceUnavailableException {
    Objects.requireNonNull(device, "device");
    if (capture != null) {
      throw new IllegalStateException("capture source already open");
    }
    VideoCapture candidate;
    try {
      if (device.matches("\\d+")) {
        candidate = new VideoCapture(Integer.parseInt(device));
        if (candidate.isOpened()) {
          candidate.set(CAP_PROP_FRAME_WIDTH, REQUESTED_WIDTH);
          candidate.set(CAP_PROP_FRAME_HEIGHT, REQUESTED_HEIGHT);
        }
        backend = "OpenCV camera " + device;
      } else {
        Path file = Path.of(device);
        if (!Files.isRegularFile(file)) {
          throw new DeviceUnavailableException(device, "Video file not found: " + file.toAbsolutePath());
        }
        candidate = new VideoCapture(file.toAbsolutePath().toString().replace('\\', '/'));
        backend = "OpenCV file " + file.getFileName();
      }
    } catch (UnsatisfiedLinkError | RuntimeException ex) {
      throw new DeviceUnavailableException(device, "OpenCV could not open " + device, ex);
    }
    if (!candidate.isOpened()) {
      candidate.release();
      throw new DeviceUnavailableException(device, "Could not open capture device " + device);
    }
    capture = candidate;
    mat = new Mat();
    sequence = 0;
    log.info("Opened {}", backend);
  }

  @Override
  public Frame readFrame() throws CaptureException {
    if (capture == null) {
      throw new CaptureException("capture source is not open");
    }
    boolean ok;
    try {
      ok = capture.read(mat);
    } catch (RuntimeException ex) {
      throw new CaptureException("Frame read failed on " + backend, ex);
    }
    if (!ok || mat.empty()) {
      throw new CaptureException("No frame from " + backend + " (disconnected or end of stream)");
    }
    return toFrame(mat, ++sequence, clock.nowMillis());
  }

  @Override
  public String backendName() {
    return backend;
  }

  @Override
  public void close() {
    if (mat != null) {
      mat.release();
      mat = null;
    }
    if (capture != null) {
      capture.release();
      capture = null;
      log.debug("Released {}", backend);
    }
  }

  static Frame toFrame(Mat source, long sequence, long capturedAtMillis) {
    Mat packed = source;
    boolean converted = false;
    if (source.channels() == 4) {
      packed = new Mat();
      opencv_imgproc.cvtColor(source, packed, opencv_imgproc.COLOR_BGRA2BGR);
      converted = true;
    } else if (!source.isContinuous()) {
      packed = source.clone();
      converted = true;
    }
    try {
      byte[] pixels = new byte[(int) (packed.total() * packed.channels())];
      packed.data().get(pixels);
      return new Frame(sequence, capturedAtMillis, packed.cols(), packed.rows(), packed.channels(), pixels);
    } finally {
      if (converted) {
        packed.release();
      }
    }
  }
}
