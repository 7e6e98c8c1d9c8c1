package llmcl;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Map;

import org.junit.jupiter.api.Test;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

public class ConceptRegistryTest {

  private static ConceptDef concept(String registryId, ConceptRegistry registry) {
    return registry.getConcept(registryId).get();
  }

  @Test
  public void defaultSeed() {
    ConceptRegistry registry = ConceptRegistry.withDefaults();

    assertThat(registry.size()).isEqualTo(14);
    assertThat(registry.contains("c142")).isTrue();
    assertThat(registry.contains("c999")).isFalse();
    assertThat(concept("c142", registry).label()).isEqualTo("artificial_intelligence");
    assertThat(concept("c142", registry).related()).containsExactly("c143", "c501", "c8901");
  }

  @Test
  public void lookups() {
    ConceptRegistry registry = ConceptRegistry.withDefaults();

    assertThat(registry.getConceptByLabel("machine_learning").get().id()).isEqualTo("c501");
    assertThat(registry.getConceptByLabel("nope").isPresent()).isFalse();
    assertThat(registry.getConcept("c999").isPresent()).isFalse();
    assertThat(registry.conceptIdToLabel("c501")).isEqualTo("machine_learning");
    assertThat(registry.conceptIdToLabel("c999")).isEqualTo("c999");
  }

  @Test
  public void relatedIsBackPatched() {
    ConceptRegistry registry = ConceptRegistry.withDefaults();

    String id =
        registry.addConcept(
            "x", "def", ImmutableList.of("c142"), ImmutableList.of(), ImmutableList.of());

    assertThat(concept(id, registry).related()).containsExactly("c142");
    assertThat(concept("c142", registry).related()).contains(id);
  }

  @Test
  public void hyponymsAndHypernymsAreBackPatched() {
    ConceptRegistry registry = ConceptRegistry.withDefaults();

    String id =
        registry.addConcept(
            "neural_networks",
            "Layered function approximators",
            ImmutableList.of(),
            ImmutableList.of("c502"),
            ImmutableList.of("c501"));

    assertThat(concept("c502", registry).hypernyms()).contains(id);
    assertThat(concept("c501", registry).hyponyms()).contains(id);
    assertThat(concept("c502", registry).hyponyms()).doesNotContain(id);
    assertThat(concept("c501", registry).related()).doesNotContain(id);
  }

  @Test
  public void missingTargetsAreNotCreated() {
    ConceptRegistry registry = ConceptRegistry.withDefaults();
    int before = registry.size();

    String id =
        registry.addConcept(
            "orphan", "def", ImmutableList.of("c77777"), ImmutableList.of(), ImmutableList.of());

    assertThat(registry.size()).isEqualTo(before + 1);
    assertThat(registry.contains("c77777")).isFalse();
    assertThat(concept(id, registry).related()).containsExactly("c77777");
  }

  @Test
  public void idsFollowLargestNumericId() {
    ConceptRegistry registry = ConceptRegistry.withDefaults();

    assertThat(registry.addConcept("a", "first")).isEqualTo("c8702");
    assertThat(registry.addConcept("b", "second")).isEqualTo("c8703");
  }

  @Test
  public void emptyRegistryStartsAtOne() {
    ConceptRegistry registry = ConceptRegistry.empty();

    assertThat(registry.addConcept("a", "first")).isEqualTo("c1");
    assertThat(registry.addConcept("b", "second")).isEqualTo("c2");
  }

  @Test
  public void nonNumericIdsDoNotAffectAllocation() {
    ConceptRegistry registry =
        new ConceptRegistry(
            ImmutableMap.of(
                "c5",
                ConceptDef.create(
                    "c5", "five", "", ImmutableList.of(), ImmutableList.of(), ImmutableList.of()),
                "custom",
                ConceptDef.create(
                    "custom",
                    "custom",
                    "",
                    ImmutableList.of(),
                    ImmutableList.of(),
                    ImmutableList.of())));

    assertThat(registry.addConcept("next", "")).isEqualTo("c6");
  }

  @Test
  public void seedKeysMustMatchIds() {
    ConceptDef c1 =
        ConceptDef.create(
            "c1", "one", "", ImmutableList.of(), ImmutableList.of(), ImmutableList.of());

    assertThrows(
        IllegalArgumentException.class, () -> new ConceptRegistry(ImmutableMap.of("c2", c1)));
  }

  @Test
  public void edgesHaveNoDuplicates() {
    ConceptDef def =
        ConceptDef.create(
            "c1",
            "one",
            "",
            ImmutableList.of("c2", "c2"),
            ImmutableList.of(),
            ImmutableList.of());

    assertThat(def.related()).containsExactly("c2");
    assertThat(def.withRelated("c2")).isSameInstanceAs(def);
    assertThat(def.withRelated("c3").related()).containsExactly("c2", "c3").inOrder();
    assertThat(def.withHyponym("c4").withHyponym("c4").hyponyms()).containsExactly("c4");
    assertThat(def.withHypernym("c5").withHypernym("c5").hypernyms()).containsExactly("c5");
  }

  @Test
  public void repeatedAdditionsKeepInverseEdgesUnique() {
    ConceptRegistry registry = ConceptRegistry.withDefaults();

    String first =
        registry.addConcept(
            "x", "def", ImmutableList.of("c142", "c143"), ImmutableList.of(), ImmutableList.of());
    String second =
        registry.addConcept(
            "y", "def", ImmutableList.of("c142"), ImmutableList.of(), ImmutableList.of());

    assertThat(concept("c142", registry).related())
        .containsExactly("c143", "c501", "c8901", first, second)
        .inOrder();
    assertThat(concept("c143", registry).related()).containsExactly("c142", first).inOrder();
  }

  @Test
  public void persistedShape() {
    ConceptRegistry registry = ConceptRegistry.empty();
    String id =
        registry.addConcept(
            "x", "def", ImmutableList.of("c9"), ImmutableList.of(), ImmutableList.of());

    ImmutableMap<String, Map<String, Object>> map = registry.asMap();

    assertThat(map.keySet()).containsExactly(id);
    assertThat(map.get(id))
        .containsExactly(
            "label", "x",
            "definition", "def",
            "related", ImmutableList.of("c9"),
            "hyponyms", ImmutableList.of(),
            "hypernyms", ImmutableList.of())
        .inOrder();
  }
}
