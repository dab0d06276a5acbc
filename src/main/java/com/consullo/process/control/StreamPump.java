package com.consullo.process.control;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.function.BooleanSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Daemon threads that copy between a child's pipes and caller-supplied streams.
 *
 * <p>Caller streams are never closed here; the child's pipe ends are.
 */
final class StreamPump {

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamPump.class);

  private static final int BUFFER_SIZE = 8192;

  private StreamPump() {
  }

  /**
   * Copy child output into {@code sink} until the pipe closes.
   *
   * @param pid owning process, used for the thread name
   * @param streamName "stdout" or "stderr"
   * @param pipe child's output pipe
   * @param sink caller destination
   * @return the started thread
   */
  static Thread output(final long pid, final String streamName, final InputStream pipe, final OutputStream sink) {
    final Thread pump = new Thread(() -> {
      final byte[] buffer = new byte[BUFFER_SIZE];
      try (InputStream in = pipe) {
        int n;
        while ((n = in.read(buffer)) >= 0) {
          if (n > 0) {
            sink.write(buffer, 0, n);
            sink.flush();
          }
        }
      } catch (final IOException e) {
        LOGGER.warn("Output pump for pid {} {} stopped: {}", pid, streamName, e.getMessage(), e);
      }
    }, "ProcessPump-" + pid + "-" + streamName);
    pump.setDaemon(true);
    pump.start();
    return pump;
  }

  /**
   * Copy {@code source} into the child's stdin, then close the pipe so the child sees EOF.
   * Feeding stops once the child is gone, so bytes read after its exit are dropped rather than
   * handed on. A read that blocks forever still pins the daemon thread until the source yields.
   *
   * @param pid owning process, used for the thread name
   * @param alive liveness check of the child, consulted between reads
   * @param source caller bytes
   * @param pipe child's stdin pipe
   * @return the started thread
   */
  static Thread input(final long pid, final BooleanSupplier alive, final InputStream source,
      final OutputStream pipe) {
    final Thread feeder = new Thread(() -> {
      try (OutputStream out = pipe) {
        final byte[] buffer = new byte[BUFFER_SIZE];
        int read;
        while (alive.getAsBoolean() && (read = source.read(buffer)) != -1) {
          if (!alive.getAsBoolean()) {
            LOGGER.debug("Input feeder for pid {} dropped {} bytes after exit", pid, read);
            break;
          }
          out.write(buffer, 0, read);
          out.flush();
        }
      } catch (final IOException e) {
        // The child exiting before reading all input closes the pipe; that is not a failure.
        LOGGER.debug("Input feeder for pid {} stopped: {}", pid, e.getMessage());
      }
    }, "ProcessPump-" + pid + "-stdin");
    feeder.setDaemon(true);
    feeder.start();
    return feeder;
  }
}
