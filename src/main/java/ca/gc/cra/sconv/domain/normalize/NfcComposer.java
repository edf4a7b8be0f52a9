package ca.gc.cra.sconv.domain.normalize;

import ca.gc.cra.sconv.domain.buffer.ByteTextBuffer;
import ca.gc.cra.sconv.domain.conversion.BufferExhaustedException;
import ca.gc.cra.sconv.domain.conversion.ConversionIssue;
import ca.gc.cra.sconv.domain.conversion.ConversionResult;
import ca.gc.cra.sconv.domain.unicode.UnicodeCodec;
import ca.gc.cra.sconv.domain.unicode.UnicodeForm;
import java.util.EnumSet;
import java.util.Objects;

/**
 * <strong>What:</strong> Streaming canonical composition (NFC) over UTF-8 or UTF-16 text.
 * <p><strong>Why:</strong> Archives written on decomposing file systems store names as base letters
 * followed by combining marks; readers expect the precomposed form.</p>
 * <p><strong>Role:</strong> Domain engine behind the normalization stage of a conversion profile.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep one current base and compose following code points into it through
 *   {@link CompositionTable} or the {@link Hangul} formulas.</li>
 *   <li>Collect a bounded run of combining marks whose classes keep increasing, compose the base
 *   with any unblocked member, and emit the rest in their original order.</li>
 *   <li>Replace malformed input with U+FFFD and keep going.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Instances hold only configuration and scratch arrays; use one
 * instance per thread.</p>
 * <p><strong>Performance:</strong> One pass, O(n * runLimit) table lookups in the worst case.</p>
 *
 * @implNote A run that fills the limit while more marks follow is emitted unchanged and the result
 *     is flagged {@link ConversionIssue#NORMALIZATION_INCOMPLETE}; output is still produced.
 * @since 0.1.0
 */
public final class NfcComposer {
  /** Default number of combining marks examined after one base. */
  public static final int DEFAULT_RUN_LIMIT = 10;

  private final int runLimit;
  private final int[] run;
  private final int[] runClass;

  public NfcComposer() {
    this(DEFAULT_RUN_LIMIT);
  }

  /**
   * @param runLimit maximum number of combining marks collected after a base; at least 2
   */
  public NfcComposer(int runLimit) {
    if (runLimit < 2) {
      throw new IllegalArgumentException("runLimit must be at least 2 (was " + runLimit + ")");
    }
    this.runLimit = runLimit;
    this.run = new int[runLimit];
    this.runClass = new int[runLimit];
  }

  public int runLimit() {
    return runLimit;
  }

  /**
   * Composes {@code length} bytes of {@code from}-encoded text and appends the result to
   * {@code dst} in the {@code to} encoding.
   *
   * @return issues encountered; output is produced regardless
   * @throws BufferExhaustedException when {@code dst} cannot grow
   */
  public ConversionResult compose(byte[] src, int offset, int length, UnicodeForm from,
      ByteTextBuffer dst, UnicodeForm to) throws BufferExhaustedException {
    Objects.requireNonNull(src, "src");
    Objects.checkFromIndexSize(offset, length, src.length);
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    Objects.requireNonNull(dst, "dst");

    Cursor in = new Cursor(src, offset, offset + length, from);
    Output out = new Output(dst, to);
    EnumSet<ConversionIssue> issues = EnumSet.noneOf(ConversionIssue.class);

    outer:
    while (true) {
      long first = in.peek();
      int n = UnicodeCodec.consumed(first);
      if (n == 0) {
        break;
      }
      in.advance(n);
      if (n < 0) {
        out.write(UnicodeCodec.REPLACEMENT_CHARACTER);
        issues.add(ConversionIssue.MALFORMED_INPUT);
        continue;
      }
      int base = UnicodeCodec.codePoint(first);

      while (true) {
        long second = in.peek();
        int n2 = UnicodeCodec.consumed(second);
        if (n2 <= 0) {
          // end of input, or a malformed sequence the outer loop replaces
          out.write(base);
          continue outer;
        }
        int next = UnicodeCodec.codePoint(second);

        if (Hangul.isLeading(base) && Hangul.isVowel(next)) {
          in.advance(n2);
          base = Hangul.composeLv(base, next);
          continue;
        }
        if (Hangul.isLvSyllable(base) && Hangul.isTrailing(next)) {
          in.advance(n2);
          base = Hangul.composeLvt(base, next);
          continue;
        }
        int composite = CompositionTable.compose(base, next);
        if (composite >= 0) {
          in.advance(n2);
          base = composite;
          continue;
        }
        int cls = CombiningClasses.of(next);
        if (cls == 0) {
          out.write(base);
          in.advance(n2);
          base = next;
          continue;
        }

        in.advance(n2);
        run[0] = next;
        runClass[0] = cls;
        Collection collected = collect(in, 1, cls);
        if (collected.capped()) {
          issues.add(ConversionIssue.NORMALIZATION_INCOMPLETE);
          out.write(base);
          for (int i = 0; i < collected.size(); i++) {
            out.write(run[i]);
          }
          continue outer;
        }

        int size = collected.size();
        int i = 1;
        while (i < size) {
          int nfc = CompositionTable.compose(base, run[i]);
          if (nfc < 0) {
            i++;
            continue;
          }
          base = nfc;
          System.arraycopy(run, i + 1, run, i, size - i - 1);
          System.arraycopy(runClass, i + 1, runClass, i, size - i - 1);
          size--;
          if (size > 0 && i == size && collected.blockedClass() == collected.lastClass()) {
            // the removed mark was what blocked the rest of the sequence
            collected = collect(in, size, runClass[size - 1]);
            if (collected.capped()) {
              issues.add(ConversionIssue.NORMALIZATION_INCOMPLETE);
            }
            size = collected.size();
          }
          i = 0;
        }

        out.write(base);
        for (int k = 0; k < size; k++) {
          out.write(run[k]);
        }

        if (collected.blockedClass() > 0 && collected.blockedClass() == collected.lastClass()) {
          int cl = collected.lastClass();
          while (true) {
            long mark = in.peek();
            int nx = UnicodeCodec.consumed(mark);
            if (nx <= 0) {
              break;
            }
            int cx = CombiningClasses.of(UnicodeCodec.codePoint(mark));
            if (cl > cx) {
              break;
            }
            in.advance(nx);
            cl = cx;
            out.write(UnicodeCodec.codePoint(mark));
          }
        }
        continue outer;
      }
    }
    out.finish();
    return issues.isEmpty() ? ConversionResult.complete() : new ConversionResult(issues);
  }

  /**
   * Extends the run starting at index {@code start} while each following mark has a higher
   * combining class than the previous one. Class {@value CombiningClasses#SELF_COMMUTATIVE}
   * never blocks, and a starter always ends the run.
   */
  private Collection collect(Cursor in, int start, int lastClass) {
    int cl = lastClass;
    int i = start;
    int blockedClass = -1;
    while (true) {
      long decoded = in.peek();
      int nx = UnicodeCodec.consumed(decoded);
      if (nx <= 0) {
        break;
      }
      int cx = CombiningClasses.of(UnicodeCodec.codePoint(decoded));
      if (cx == 0) {
        break;
      }
      if (cl >= cx && cl != CombiningClasses.SELF_COMMUTATIVE
          && cx != CombiningClasses.SELF_COMMUTATIVE) {
        blockedClass = cx;
        break;
      }
      if (i == runLimit) {
        return new Collection(runLimit, cl, -1, true);
      }
      in.advance(nx);
      run[i] = UnicodeCodec.codePoint(decoded);
      runClass[i] = cx;
      cl = cx;
      i++;
    }
    return new Collection(i, cl, blockedClass, false);
  }

  private record Collection(int size, int lastClass, int blockedClass, boolean capped) {}

  private static final class Cursor {
    private final byte[] src;
    private final int limit;
    private final UnicodeForm form;
    private int position;

    Cursor(byte[] src, int position, int limit, UnicodeForm form) {
      this.src = src;
      this.position = position;
      this.limit = limit;
      this.form = form;
    }

    long peek() {
      return form.decode(src, position, limit);
    }

    void advance(int consumed) {
      position += Math.abs(consumed);
    }
  }

  private static final class Output {
    private final ByteTextBuffer dst;
    private final UnicodeForm form;

    Output(ByteTextBuffer dst, UnicodeForm form) {
      this.dst = dst;
      this.form = form;
    }

    void write(int codePoint) throws BufferExhaustedException {
      long needed = (long) dst.length() + form.maxBytesPerCodePoint() + form.unitWidth();
      if (!form.append(dst, codePoint)) {
        throw new BufferExhaustedException(needed);
      }
    }

    void finish() throws BufferExhaustedException {
      dst.reserve(dst.length() + form.unitWidth());
      dst.terminate(dst.length(), form.unitWidth());
    }
  }
}
