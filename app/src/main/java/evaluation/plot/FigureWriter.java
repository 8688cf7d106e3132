package evaluation.plot;

import evaluation.util.JsonSupport;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/** Writes figure documents via a temporary sibling file, so no partial figure is left behind. */
final class FigureWriter {
  private FigureWriter() {}

  static void write(Path target, Map<String, Object> document) throws RenderException {
    Path temp = target.resolveSibling(target.getFileName() + ".tmp");
    try {
      Files.createDirectories(target.getParent());
      try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
        JsonSupport.pretty().toJson(document, writer);
      }
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException | RuntimeException ex) {
      try {
        Files.deleteIfExists(temp);
      } catch (IOException cleanup) {
        ex.addSuppressed(cleanup);
      }
      throw new RenderException("Cannot write " + target + ": " + ex.getMessage(), ex);
    }
  }
}
