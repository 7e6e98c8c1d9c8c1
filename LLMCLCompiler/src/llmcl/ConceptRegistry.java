package llmcl;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * The universal concept space: concept ids mapped to their definitions and relationship edges.
 *
 * <p>Adding a concept back-patches the inverse edge on every referenced concept that exists, so
 * {@code related} stays symmetric and hyponym/hypernym pairs stay consistent. Not thread-safe;
 * callers sharing a registry must serialize {@link #addConcept}.
 */
public final class ConceptRegistry {
  private static final Logger logger = LoggerFactory.getLogger(ConceptRegistry.class);

  private static final String ID_PREFIX = "c";

  private final Map<String, ConceptDef> conceptsById = new LinkedHashMap<>();

  public ConceptRegistry(Map<String, ConceptDef> seed) {
    for (Map.Entry<String, ConceptDef> entry : seed.entrySet()) {
      Preconditions.checkArgument(
          entry.getKey().equals(entry.getValue().id()),
          "seed key %s does not match concept id %s",
          entry.getKey(),
          entry.getValue().id());
      conceptsById.put(entry.getKey(), entry.getValue());
    }
  }

  public static ConceptRegistry withDefaults() {
    return new ConceptRegistry(DefaultConcepts.concepts());
  }

  public static ConceptRegistry empty() {
    return new ConceptRegistry(ImmutableMap.of());
  }

  public boolean contains(String id) {
    return conceptsById.containsKey(id);
  }

  public Optional<ConceptDef> getConcept(String id) {
    return Optional.ofNullable(conceptsById.get(id));
  }

  public Optional<ConceptDef> getConceptByLabel(String label) {
    return conceptsById.values().stream().filter(c -> c.label().equals(label)).findFirst();
  }

  public String conceptIdToLabel(String id) {
    return getConcept(id).map(ConceptDef::label).orElse(id);
  }

  public Collection<ConceptDef> concepts() {
    return Collections.unmodifiableCollection(conceptsById.values());
  }

  public int size() {
    return conceptsById.size();
  }

  public String addConcept(String label, String definition) {
    return addConcept(
        label, definition, ImmutableList.of(), ImmutableList.of(), ImmutableList.of());
  }

  /** Adds a concept and returns its freshly allocated id. */
  public String addConcept(
      String label,
      String definition,
      Iterable<String> related,
      Iterable<String> hyponyms,
      Iterable<String> hypernyms) {
    String id = nextId();
    ConceptDef concept = ConceptDef.create(id, label, definition, related, hyponyms, hypernyms);
    conceptsById.put(id, concept);

    concept.related().forEach(other -> patch(other, c -> c.withRelated(id)));
    concept.hyponyms().forEach(other -> patch(other, c -> c.withHypernym(id)));
    concept.hypernyms().forEach(other -> patch(other, c -> c.withHyponym(id)));

    logger.debug("added concept {} ({})", id, label);
    return id;
  }

  private void patch(String otherId, UnaryOperator<ConceptDef> update) {
    conceptsById.computeIfPresent(otherId, (k, v) -> update.apply(v));
  }

  private String nextId() {
    long max =
        conceptsById
            .keySet()
            .stream()
            .filter(ConceptRegistry::isNumericId)
            .mapToLong(k -> Long.parseLong(k.substring(ID_PREFIX.length())))
            .max()
            .orElse(0);
    return ID_PREFIX + (max + 1);
  }

  private static boolean isNumericId(String id) {
    return id.startsWith(ID_PREFIX)
        && id.length() > ID_PREFIX.length()
        && id.length() < ID_PREFIX.length() + 19
        && CharMatcher.inRange('0', '9').matchesAllOf(id.substring(ID_PREFIX.length()));
  }

  /** The registry in its persisted shape: id to label, definition and edge lists. */
  public ImmutableMap<String, Map<String, Object>> asMap() {
    return conceptsById
        .values()
        .stream()
        .collect(ImmutableMap.toImmutableMap(ConceptDef::id, ConceptDef::toMap));
  }
}
