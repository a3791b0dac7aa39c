package ca.gc.cra.halo.infrastructure.detect;

import ca.gc.cra.halo.application.port.RegionDetector;
import ca.gc.cra.halo.domain.error.DetectionException;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;
import java.util.Arrays;
import java.util.List;

/**
 * Body detector that keeps the largest bright silhouette of the frame.
 *
 * <p>Pixels with luma above {@value #FOREGROUND_LUMA} are foreground. The 4-connected foreground
 * component with the most pixels is reported as a single region; components covering less than
 * {@value #MIN_COVERAGE} of the frame are ignored. Confidence is the share of the bounding box the
 * component fills.
 *
 * <p>Stateless apart from a scratch buffer; one instance per analysis thread.
 */
public final class SilhouetteBodyDetector implements RegionDetector {
  static final int FOREGROUND_LUMA = 20;
  static final double MIN_COVERAGE = 0.02d;

  private int[] labels = new int[0];
  private int[] queue = new int[0];

  @Override
  public List<DetectedRegion> detect(Frame frame) throws DetectionException {
    try {
      return largestComponent(frame);
    } catch (RuntimeException ex) {
      throw new DetectionException("Silhouette detection failed on frame " + frame.sequence(), ex);
    }
  }

  private List<DetectedRegion> largestComponent(Frame frame) {
    int width = frame.width();
    int height = frame.height();
    int size = width * height;
    if (labels.length < size) {
      labels = new int[size];
      queue = new int[size];
    }
    Arrays.fill(labels, 0, size, 0);

    int label = 0;
    int bestCount = 0;
    int[] bestBox = null;
    for (int start = 0; start < size; start++) {
      if (labels[start] != 0 || !isForeground(frame, start % width, start / width)) {
        continue;
      }
      label++;
      int[] box = {start % width, start / width, start % width, start / width};
      int count = flood(frame, start, label, box);
      if (count > bestCount) {
        bestCount = count;
        bestBox = box;
      }
    }
    if (bestBox == null || bestCount < MIN_COVERAGE * size) {
      return List.of();
    }
    int boxWidth = bestBox[2] - bestBox[0] + 1;
    int boxHeight = bestBox[3] - bestBox[1] + 1;
    double fill = Math.min(1d, (double) bestCount / ((long) boxWidth * boxHeight));
    return List.of(new DetectedRegion(bestBox[0], bestBox[1], boxWidth, boxHeight, fill));
  }

  /** Breadth-first fill from {@code start}; grows {@code box} as {minX, minY, maxX, maxY}. */
  private int flood(Frame frame, int start, int label, int[] box) {
    int width = frame.width();
    int height = frame.height();
    int head = 0;
    int tail = 0;
    queue[tail++] = start;
    labels[start] = label;
    while (head < tail) {
      int index = queue[head++];
      int x = index % width;
      int y = index / width;
      box[0] = Math.min(box[0], x);
      box[1] = Math.min(box[1], y);
      box[2] = Math.max(box[2], x);
      box[3] = Math.max(box[3], y);
      if (x > 0) {
        tail = visit(frame, index - 1, x - 1, y, label, tail);
      }
      if (x < width - 1) {
        tail = visit(frame, index + 1, x + 1, y, label, tail);
      }
      if (y > 0) {
        tail = visit(frame, index - width, x, y - 1, label, tail);
      }
      if (y < height - 1) {
        tail = visit(frame, index + width, x, y + 1, label, tail);
      }
    }
    return tail;
  }

  private int visit(Frame frame, int index, int x, int y, int label, int tail) {
    if (labels[index] == 0 && isForeground(frame, x, y)) {
      labels[index] = label;
      queue[tail++] = index;
    }
    return tail;
  }

  static boolean isForeground(Frame frame, int x, int y) {
    return frame.luma(x, y) > FOREGROUND_LUMA;
  }
}
