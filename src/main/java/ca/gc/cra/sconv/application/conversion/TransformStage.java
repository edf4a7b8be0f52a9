package ca.gc.cra.sconv.application.conversion;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;

/**
 * One step of a conversion pipeline.
 *
 * <p>A stage appends its output to the destination, terminates it for the stage's output
 * encoding, and always produces output; problems are reported in the returned result.</p>
 *
 * @since 0.1.0
 */
public interface TransformStage {

  StageKind kind();

  /**
   * Transforms {@code length} bytes starting at {@code offset} and appends the result.
   *
   * @throws BufferExhaustedException when {@code dst} cannot grow
   */
  ConversionResult apply(byte[] src, int offset, int length, ByteTextBuffer dst)
      throws BufferExhaustedException;
}
