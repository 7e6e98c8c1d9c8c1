package llmcl;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/** An entry of the concept registry. Edge sets are ordered by insertion. */
@AutoValue
public abstract class ConceptDef {
  public abstract String id();

  public abstract String label();

  public abstract String definition();

  public abstract ImmutableSet<String> related();

  public abstract ImmutableSet<String> hyponyms();

  public abstract ImmutableSet<String> hypernyms();

  public static ConceptDef create(
      String id,
      String label,
      String definition,
      Iterable<String> related,
      Iterable<String> hyponyms,
      Iterable<String> hypernyms) {
    return new AutoValue_ConceptDef(
        id,
        label,
        definition,
        ImmutableSet.copyOf(related),
        ImmutableSet.copyOf(hyponyms),
        ImmutableSet.copyOf(hypernyms));
  }

  public final ConceptDef withRelated(String otherId) {
    if (related().contains(otherId)) return this;
    return create(id(), label(), definition(), append(related(), otherId), hyponyms(), hypernyms());
  }

  public final ConceptDef withHyponym(String otherId) {
    if (hyponyms().contains(otherId)) return this;
    return create(id(), label(), definition(), related(), append(hyponyms(), otherId), hypernyms());
  }

  public final ConceptDef withHypernym(String otherId) {
    if (hypernyms().contains(otherId)) return this;
    return create(id(), label(), definition(), related(), hyponyms(), append(hypernyms(), otherId));
  }

  private static ImmutableSet<String> append(ImmutableSet<String> set, String id) {
    return ImmutableSet.<String>builder().addAll(set).add(id).build();
  }

  /** The persisted shape of a single concept, without its id. */
  public final Map<String, Object> toMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("label", label());
    map.put("definition", definition());
    map.put("related", ImmutableList.copyOf(related()));
    map.put("hyponyms", ImmutableList.copyOf(hyponyms()));
    map.put("hypernyms", ImmutableList.copyOf(hypernyms()));
    return map;
  }
}
