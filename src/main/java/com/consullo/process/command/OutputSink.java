package com.consullo.process.command;

import java.io.OutputStream;
import java.lang.ProcessBuilder.Redirect;
import java.nio.file.Path;
import java.util.Optional;
import org.apache.commons.lang3.Validate;

/**
 * Where a launched process writes its standard output or standard error.
 *
 * <p>Either a native {@link Redirect} or a caller-supplied {@link OutputStream}. Streams are
 * shared, not copied: a restarted process appends to the same stream as its predecessor.
 *
 * @since 1.0
 */
public final class OutputSink {

  private static final OutputSink INHERIT = new OutputSink(Redirect.INHERIT, null);
  private static final OutputSink DISCARD = new OutputSink(Redirect.DISCARD, null);

  private final Redirect redirect;
  private final OutputStream stream;

  private OutputSink(final Redirect redirect, final OutputStream stream) {
    this.redirect = redirect;
    this.stream = stream;
  }

  public static OutputSink inherit() {
    return INHERIT;
  }

  public static OutputSink discard() {
    return DISCARD;
  }

  /**
   * Appends to a file, creating it when missing.
   *
   * @param path target file
   * @return output sink
   */
  public static OutputSink appendTo(final Path path) {
    Validate.notNull(path, "path must not be null");
    return new OutputSink(Redirect.appendTo(path.toFile()), null);
  }

  /**
   * Copies the child's output into the given stream. The stream is flushed but never closed.
   *
   * @param stream destination; must tolerate writes from a background thread
   * @return output sink
   */
  public static OutputSink to(final OutputStream stream) {
    Validate.notNull(stream, "stream must not be null");
    return new OutputSink(Redirect.PIPE, stream);
  }

  public Redirect redirect() {
    return this.redirect;
  }

  public Optional<OutputStream> stream() {
    return Optional.ofNullable(this.stream);
  }

  @Override
  public String toString() {
    return this.stream != null ? "OutputSink[stream]" : "OutputSink[" + this.redirect + "]";
  }
}
