package com.consullo.process.command;

import java.io.File;
import java.io.InputStream;
import java.lang.ProcessBuilder.Redirect;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.lang3.SystemUtils;
import org.apache.commons.lang3.Validate;

/**
 * Where a launched process reads its standard input from.
 *
 * <p>Either a native {@link Redirect} handled by the OS, or a caller-supplied {@link InputStream}
 * whose bytes are copied into the child's stdin pipe. The same instance is handed to every
 * process launched from a descriptor, including restarts.
 *
 * @since 1.0
 */
public final class InputSource {

  private static final InputSource INHERIT = new InputSource(Redirect.INHERIT, null);
  private static final InputSource EMPTY = new InputSource(Redirect.from(nullDevice()), null);

  private final Redirect redirect;
  private final InputStream stream;

  private InputSource(final Redirect redirect, final InputStream stream) {
    this.redirect = redirect;
    this.stream = stream;
  }

  /** Shares the launching JVM's stdin. */
  public static InputSource inherit() {
    return INHERIT;
  }

  /** Child reads end-of-file immediately. */
  public static InputSource empty() {
    return EMPTY;
  }

  public static InputSource file(final Path path) {
    Validate.notNull(path, "path must not be null");
    return new InputSource(Redirect.from(path.toFile()), null);
  }

  /**
   * Copies the given stream into the child's stdin, closing the pipe at end of stream.
   *
   * <p>Copying stops when the child exits, so a restarted process does not compete with a stale
   * feeder for the stream. The stream is shared by every launch, and bytes consumed by an
   * earlier launch are not replayed. A read that never returns keeps the feeder thread parked
   * until the stream yields data or end of stream.
   *
   * @param stream source bytes; not closed by the controller
   * @return input source
   */
  public static InputSource from(final InputStream stream) {
    Validate.notNull(stream, "stream must not be null");
    return new InputSource(Redirect.PIPE, stream);
  }

  /** Redirect to install on the {@link ProcessBuilder}. */
  public Redirect redirect() {
    return this.redirect;
  }

  /** Caller stream to feed, present only for {@link #from(InputStream)}. */
  public Optional<InputStream> stream() {
    return Optional.ofNullable(this.stream);
  }

  @Override
  public String toString() {
    return this.stream != null ? "InputSource[stream]" : "InputSource[" + this.redirect + "]";
  }

  private static File nullDevice() {
    return new File(SystemUtils.IS_OS_WINDOWS ? "NUL" : "/dev/null");
  }
}
