package ca.gc.cra.halo.infrastructure.display;

import ca.gc.cra.halo.application.port.DisplaySurface;
import ca.gc.cra.halo.application.port.Overlay;
import ca.gc.cra.halo.application.port.UserCommand;
import ca.gc.cra.halo.domain.frame.Frame;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Display for machines without a window system. Frames are discarded, overlay changes are logged and
 * commands are read line by line from an input stream ({@code q}, {@code c} or an empty line,
 * {@code o}).
 *
 * @since 0.1.0
 */
public final class HeadlessDisplaySurface implements DisplaySurface {
  private static final Logger log = LoggerFactory.getLogger(HeadlessDisplaySurface.class);

  private final Queue<UserCommand> commands = new ConcurrentLinkedQueue<>();
  private final AtomicBoolean open = new AtomicBoolean(true);
  private List<String> lastLines = List.of();

  /** Creates a surface with no command input; commands arrive only through {@link #offer}. */
  public HeadlessDisplaySurface() {}

  /**
   * Creates a surface reading commands from {@code input} on a daemon thread.
   *
   * @param input command source, usually {@code System.in}
   */
  public HeadlessDisplaySurface(InputStream input) {
    Objects.requireNonNull(input, "input");
    Thread reader = new Thread(() -> readCommands(input), "halo-console-keys");
    reader.setDaemon(true);
    reader.start();
  }

  /** Queues a command as if it had been typed. */
  public void offer(UserCommand command) {
    commands.add(Objects.requireNonNull(command, "command"));
  }

  static Optional<UserCommand> parse(String line) {
    String trimmed = line.trim().toLowerCase(Locale.ROOT);
    return switch (trimmed) {
      case "q", "quit" -> Optional.of(UserCommand.QUIT);
      case "", "c", "capture" -> Optional.of(UserCommand.CAPTURE);
      case "o", "overlay" -> Optional.of(UserCommand.TOGGLE_OVERLAY);
      default -> Optional.empty();
    };
  }

  private void readCommands(InputStream input) {
    try (BufferedReader reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
      String line;
      while (open.get() && (line = reader.readLine()) != null) {
        Optional<UserCommand> command = parse(line);
        if (command.isPresent()) {
          commands.add(command.get());
        } else {
          log.info("Unknown command '{}'; use q, c or o", line.trim());
        }
      }
    } catch (IOException ex) {
      log.warn("Console command input failed; keyboard commands disabled", ex);
    }
  }

  @Override
  public void show(Frame frame, Overlay overlay) {
    if (!overlay.lines().equals(lastLines)) {
      lastLines = overlay.lines();
      if (log.isDebugEnabled()) {
        log.debug("Frame {} overlay: {}", frame.sequence(), String.join(" | ", lastLines));
      }
    }
  }

  @Override
  public Optional<UserCommand> pollKey() {
    return Optional.ofNullable(commands.poll());
  }

  @Override
  public boolean isOpen() {
    return open.get();
  }

  @Override
  public void close() {
    open.set(false);
  }
}
