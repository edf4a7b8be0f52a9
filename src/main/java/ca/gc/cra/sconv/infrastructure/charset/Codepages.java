package ca.gc.cra.sconv.infrastructure.charset;

import java.nio.charset.Charset;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.TreeMap;

/**
 * Translates charset names, as archivers write them, into Windows codepage numbers and codepage
 * numbers into JVM charsets.
 *
 * <p>The name table takes precedence over parsing so that {@code CP367} maps to 1252 rather than
 * 367. Names not in the table are parsed as {@code CPnnn}, {@code IBMnnn} or {@code WINDOWS-nnn};
 * the last form only for 874 and 1250 to 1258.</p>
 *
 * @since 0.1.0
 */
public final class Codepages {
  public static final int UTF_8 = 65001;
  public static final int UTF_16LE = 1200;
  public static final int UTF_16BE = 1201;

  private static final int MAX_NAME_LENGTH = 15;
  private static final Map<String, Integer> BY_NAME = buildNameTable();
  private static final Map<Integer, String> CHARSET_NAMES = buildCharsetTable();

  private Codepages() {
    // Utility
  }

  /**
   * Codepage for a charset name, matched ignoring case.
   *
   * @return the codepage, or empty when the name is unknown or longer than 15 characters
   */
  public static OptionalInt codepageOf(String charset) {
    if (charset == null || charset.isEmpty() || charset.length() > MAX_NAME_LENGTH) {
      return OptionalInt.empty();
    }
    String name = charset.toUpperCase(Locale.ROOT);
    Integer listed = BY_NAME.get(name);
    if (listed != null) {
      return OptionalInt.of(listed);
    }
    if (name.startsWith("CP") && name.length() > 2 && isDigit(name.charAt(2))) {
      return parseDigits(name, 2);
    }
    if (name.startsWith("IBM") && name.length() > 3 && isDigit(name.charAt(3))) {
      return parseDigits(name, 3);
    }
    if (name.startsWith("WINDOWS-")) {
      OptionalInt cp = parseDigits(name, 8);
      if (cp.isPresent() && (cp.getAsInt() == 874
          || (cp.getAsInt() >= 1250 && cp.getAsInt() <= 1258))) {
        return cp;
      }
    }
    return OptionalInt.empty();
  }

  /**
   * JVM charset implementing a codepage.
   *
   * @return the charset, or empty when the JVM has none for the codepage
   */
  public static Optional<Charset> charsetOf(int codepage) {
    String listed = CHARSET_NAMES.get(codepage);
    if (listed != null) {
      return JdkCharsetBackend.resolve(listed);
    }
    if (codepage >= 20273 && codepage <= 20924) {
      return JdkCharsetBackend.resolve("IBM" + (codepage - 20000));
    }
    if (codepage >= 28591 && codepage <= 28599) {
      return JdkCharsetBackend.resolve("ISO-8859-" + (codepage - 28590));
    }
    if (codepage >= 1250 && codepage <= 1258) {
      return JdkCharsetBackend.resolve("windows-" + codepage);
    }
    return JdkCharsetBackend.resolve("IBM" + codepage);
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }

  private static OptionalInt parseDigits(String name, int start) {
    if (start >= name.length()) {
      return OptionalInt.empty();
    }
    int cp = 0;
    for (int i = start; i < name.length(); i++) {
      char c = name.charAt(i);
      if (!isDigit(c)) {
        return OptionalInt.empty();
      }
      cp = cp * 10 + (c - '0');
    }
    return OptionalInt.of(cp);
  }

  private static Map<String, Integer> buildNameTable() {
    Map<String, Integer> table = new TreeMap<>();
    table.put("ASCII", 1252);
    table.put("ASMO-708", 708);
    table.put("BIG5", 950);
    table.put("CHINESE", 936);
    table.put("CP367", 1252);
    table.put("CP819", 1252);
    table.put("CP1025", 21025);
    table.put("DOS-720", 720);
    table.put("DOS-862", 862);
    table.put("EUC-CN", 51936);
    table.put("EUC-JP", 51932);
    table.put("EUC-KR", 949);
    table.put("EUCCN", 51936);
    table.put("EUCJP", 51932);
    table.put("EUCKR", 949);
    table.put("GB18030", 54936);
    table.put("GB2312", 936);
    table.put("HEBREW", 1255);
    table.put("HZ-GB-2312", 52936);
    for (int ibm : new int[] {273, 277, 278, 280, 284, 285, 290, 297, 420, 423, 424, 871, 880,
        905, 924}) {
      table.put("IBM" + ibm, 20000 + ibm);
    }
    table.put("IBM367", 1252);
    table.put("IBM819", 1252);
    for (int part = 1; part <= 9; part++) {
      table.put("ISO-8859-" + part, 28590 + part);
      table.put("ISO8859-" + part, 28590 + part);
    }
    table.put("ISO-8859-13", 28603);
    table.put("ISO-8859-15", 28605);
    table.put("ISO8859-13", 28603);
    table.put("ISO8859-15", 28605);
    table.put("JOHAB", 1361);
    table.put("KOI8-R", 20866);
    table.put("KOI8-U", 21866);
    table.put("KS_C_5601-1987", 949);
    table.put("LATIN1", 1252);
    table.put("LATIN2", 28592);
    table.put("MACINTOSH", 10000);
    table.put("SHIFT-JIS", 932);
    table.put("SHIFT_JIS", 932);
    table.put("SJIS", 932);
    table.put("US", 1252);
    table.put("US-ASCII", 1252);
    table.put("UTF-16", UTF_16LE);
    table.put("UTF-16BE", UTF_16BE);
    table.put("UTF-16LE", UTF_16LE);
    table.put("UTF-8", UTF_8);
    table.put("X-EUROPA", 29001);
    table.put("X-MAC-ARABIC", 10004);
    table.put("X-MAC-CE", 10029);
    table.put("X-MAC-CHINESEIMP", 10008);
    table.put("X-MAC-CHINESETRAD", 10002);
    table.put("X-MAC-CROATIAN", 10082);
    table.put("X-MAC-CYRILLIC", 10007);
    table.put("X-MAC-GREEK", 10006);
    table.put("X-MAC-HEBREW", 10005);
    table.put("X-MAC-ICELANDIC", 10079);
    table.put("X-MAC-JAPANESE", 10001);
    table.put("X-MAC-KOREAN", 10003);
    table.put("X-MAC-ROMANIAN", 10010);
    table.put("X-MAC-THAI", 10021);
    table.put("X-MAC-TURKISH", 10081);
    table.put("X-MAC-UKRAINIAN", 10017);
    return Map.copyOf(table);
  }

  private static Map<Integer, String> buildCharsetTable() {
    return Map.ofEntries(
        Map.entry(UTF_8, "UTF-8"),
        Map.entry(UTF_16LE, "UTF-16LE"),
        Map.entry(UTF_16BE, "UTF-16BE"),
        Map.entry(874, "x-windows-874"),
        Map.entry(932, "windows-31j"),
        Map.entry(936, "GBK"),
        Map.entry(949, "x-windows-949"),
        Map.entry(950, "x-windows-950"),
        Map.entry(1361, "x-Johab"),
        Map.entry(10000, "x-MacRoman"),
        Map.entry(10004, "x-MacArabic"),
        Map.entry(10005, "x-MacHebrew"),
        Map.entry(10006, "x-MacGreek"),
        Map.entry(10007, "x-MacCyrillic"),
        Map.entry(10010, "x-MacRomania"),
        Map.entry(10017, "x-MacUkraine"),
        Map.entry(10021, "x-MacThai"),
        Map.entry(10029, "x-MacCentralEurope"),
        Map.entry(10079, "x-MacIceland"),
        Map.entry(10081, "x-MacTurkish"),
        Map.entry(10082, "x-MacCroatian"),
        Map.entry(20866, "KOI8-R"),
        Map.entry(21866, "KOI8-U"),
        Map.entry(21025, "IBM1025"),
        Map.entry(28603, "ISO-8859-13"),
        Map.entry(28605, "ISO-8859-15"),
        Map.entry(51932, "EUC-JP"),
        Map.entry(51936, "GB2312"),
        Map.entry(54936, "GB18030"));
  }
}
