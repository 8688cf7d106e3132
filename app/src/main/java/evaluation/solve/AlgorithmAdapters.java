package evaluation.solve;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry of adapters by algorithm id. Adapters are either registered explicitly or discovered
 * through {@link ServiceLoader} ({@code META-INF/services/evaluation.solve.AlgorithmAdapter}).
 */
public final class AlgorithmAdapters {
  private static final Logger LOG = LoggerFactory.getLogger(AlgorithmAdapters.class);

  private final Map<String, AlgorithmAdapter> byId;

  private AlgorithmAdapters(Map<String, AlgorithmAdapter> byId) {
    this.byId = Map.copyOf(byId);
  }

  public static AlgorithmAdapters of(AlgorithmAdapter... adapters) {
    return of(List.of(adapters));
  }

  public static AlgorithmAdapters of(Collection<? extends AlgorithmAdapter> adapters) {
    Map<String, AlgorithmAdapter> byId = new LinkedHashMap<>();
    for (AlgorithmAdapter adapter : adapters) {
      Objects.requireNonNull(adapter, "adapter");
      AlgorithmAdapter previous = byId.putIfAbsent(adapter.algorithmId(), adapter);
      if (previous != null) {
        throw new IllegalArgumentException(
            "Two adapters claim algorithm "
                + adapter.algorithmId()
                + ": "
                + previous.getClass().getName()
                + ", "
                + adapter.getClass().getName());
      }
    }
    return new AlgorithmAdapters(byId);
  }

  /** Discovers adapters on the class path. */
  public static AlgorithmAdapters discover() {
    return discover(Thread.currentThread().getContextClassLoader());
  }

  public static AlgorithmAdapters discover(ClassLoader classLoader) {
    ServiceLoader<AlgorithmAdapter> loader =
        ServiceLoader.load(AlgorithmAdapter.class, classLoader);
    AlgorithmAdapters adapters = of(loader.stream().map(ServiceLoader.Provider::get).toList());
    LOG.info(
        "Discovered {} algorithm adapter(s): {}", adapters.byId.size(), adapters.byId.keySet());
    return adapters;
  }

  public Optional<AlgorithmAdapter> find(String algorithmId) {
    return Optional.ofNullable(byId.get(algorithmId));
  }

  public Set<String> algorithmIds() {
    return byId.keySet();
  }
}
