package ca.gc.cra.halo.infrastructure.display;

import ca.gc.cra.halo.application.port.DisplaySurface;
import ca.gc.cra.halo.application.port.Overlay;
import ca.gc.cra.halo.application.port.UserCommand;
import ca.gc.cra.halo.domain.frame.DetectedRegion;
import ca.gc.cra.halo.domain.frame.Frame;
import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Font;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import javax.swing.WindowConstants;
import org.bytedeco.javacv.CanvasFrame;

/**
 * Desktop window backed by JavaCV's {@link CanvasFrame}.
 *
 * <p>Keys: {@code q} quits, space captures, {@code o} toggles the overlay. Key events arrive on the AWT
 * thread and are queued until the render loop polls them.
 *
 * @since 0.1.0
 */
public final class CanvasDisplaySurface implements DisplaySurface {
  private static final Color TEXT = new Color(0, 255, 0);
  private static final Color SHADOW = new Color(0, 0, 0, 170);
  private static final Color BOX = new Color(0, 200, 255);
  private static final int LINE_HEIGHT = 20;

  private final CanvasFrame canvas;
  private final Queue<UserCommand> commands = new ConcurrentLinkedQueue<>();
  private BufferedImage image;

  public CanvasDisplaySurface(String title) {
    this.canvas = new CanvasFrame(title, 1.0d);
    canvas.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
    KeyAdapter keys = new KeyAdapter() {
      @Override
      public void keyPressed(KeyEvent e) {
        toCommand(e.getKeyChar(), e.getKeyCode()).ifPresent(commands::add);
      }
    };
    canvas.addKeyListener(keys);
    canvas.getCanvas().addKeyListener(keys);
  }

  static Optional<UserCommand> toCommand(char keyChar, int keyCode) {
    if (keyCode == KeyEvent.VK_SPACE) {
      return Optional.of(UserCommand.CAPTURE);
    }
    switch (Character.toLowerCase(keyChar)) {
      case 'q':
        return Optional.of(UserCommand.QUIT);
      case 'o':
        return Optional.of(UserCommand.TOGGLE_OVERLAY);
      default:
        return Optional.empty();
    }
  }

  @Override
  public void show(Frame frame, Overlay overlay) {
    BufferedImage target = imageFor(frame);
    byte[] raster = ((DataBufferByte) target.getRaster().getDataBuffer()).getData();
    System.arraycopy(frame.pixels(), 0, raster, 0, raster.length);
    Graphics2D g = target.createGraphics();
    try {
      g.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
      g.setStroke(new BasicStroke(2f));
      g.setColor(BOX);
      for (DetectedRegion box : overlay.boxes()) {
        g.drawRect(box.x(), box.y(), box.width(), box.height());
      }
      g.setFont(new Font(Font.SANS_SERIF, Font.BOLD, 14));
      int y = LINE_HEIGHT;
      for (String line : overlay.lines()) {
        g.setColor(SHADOW);
        g.drawString(line, 11, y + 1);
        g.setColor(TEXT);
        g.drawString(line, 10, y);
        y += LINE_HEIGHT;
      }
    } finally {
      g.dispose();
    }
    canvas.showImage(target);
  }

  private BufferedImage imageFor(Frame frame) {
    int type = frame.channels() == 3 ? BufferedImage.TYPE_3BYTE_BGR : BufferedImage.TYPE_BYTE_GRAY;
    if (image == null
        || image.getWidth() != frame.width()
        || image.getHeight() != frame.height()
        || image.getType() != type) {
      image = new BufferedImage(frame.width(), frame.height(), type);
    }
    return image;
  }

  @Override
  public Optional<UserCommand> pollKey() {
    return Optional.ofNullable(commands.poll());
  }

  @Override
  public boolean isOpen() {
    return canvas.isVisible();
  }

  @Override
  public void close() {
    canvas.dispose();
  }
}
