package evaluation.plot;

/**
 * Rendering switches.
 *
 * @param overwriteExisting re-render figures whose file already exists
 * @param failFast abort the whole run on the first render failure
 */
public record RenderOptions(boolean overwriteExisting, boolean failFast) {

  public static RenderOptions defaults() {
    return new RenderOptions(false, false);
  }

  public RenderOptions withOverwriteExisting(boolean overwrite) {
    return new RenderOptions(overwrite, failFast);
  }

  public RenderOptions withFailFast(boolean abort) {
    return new RenderOptions(overwriteExisting, abort);
  }
}
