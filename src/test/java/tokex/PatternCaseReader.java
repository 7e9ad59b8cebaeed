package tokex;

import java.io.BufferedReader;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Reads pattern cases from a classpath resource.
 *
 * <p>Cases are three lines each (pattern, source text, expected outcome).
 * Blank lines and lines starting with {@code //} separate them. Only source
 * lines have escapes ({@code \n} and {@code \}{@code uXXXX}) expanded: in
 * patterns the backslash introduces token classes.
 */
final class PatternCaseReader {

  private static final Pattern UNICODE_ESCAPE = Pattern.compile("\\\\u([0-9a-fA-F]{4})");

  private PatternCaseReader() {
  }

  static List<PatternCase> read(String resource) throws IOException {
    final InputStream stream = PatternCaseReader.class.getClassLoader().getResourceAsStream(resource);
    if (stream == null) {
      throw new FileNotFoundException(resource);
    }

    final List<PatternCase> cases = new ArrayList<>();
    final List<String> pending = new ArrayList<>(3);
    int patternLine = 0;
    int lineNumber = 0;
    try (var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isEmpty() || line.startsWith("//")) {
          continue;
        }
        if (pending.isEmpty()) {
          patternLine = lineNumber;
        }
        pending.add(line);
        if (pending.size() == 3) {
          cases.add(new PatternCase(pending.get(0), unescape(pending.get(1)), pending.get(2), resource, patternLine));
          pending.clear();
        }
      }
    }
    if (!pending.isEmpty()) {
      throw new IOException(resource + ":" + patternLine + ": incomplete case " + pending);
    }
    return cases;
  }

  private static String unescape(String line) {
    return UNICODE_ESCAPE
      .matcher(line.replace("\\n", "\n"))
      .replaceAll(escape -> Character.toString((char) Integer.parseInt(escape.group(1), 16)));
  }
}
