package llmcl;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/** The built-in seed for a {@link ConceptRegistry}. */
public final class DefaultConcepts {
  private static final ImmutableMap<String, ConceptDef> CONCEPTS;

  static {
    ImmutableMap.Builder<String, ConceptDef> builder = ImmutableMap.builder();
    add(
        builder,
        "c142",
        "artificial_intelligence",
        "The theory and development of computer systems able to perform tasks normally requiring"
            + " human intelligence",
        ImmutableList.of("c143", "c501", "c8901"),
        ImmutableList.of("c501", "c9872"),
        ImmutableList.of("c140"));
    add(
        builder,
        "c143",
        "natural_intelligence",
        "Intelligence demonstrated by humans and animals",
        ImmutableList.of("c142"),
        ImmutableList.of("c144", "c145"),
        ImmutableList.of("c140"));
    add(
        builder,
        "c501",
        "machine_learning",
        "Computer algorithms that improve automatically through experience",
        ImmutableList.of("c142", "c4230"),
        ImmutableList.of("c4230", "c4492"),
        ImmutableList.of("c142"));
    add(
        builder,
        "c502",
        "deep_learning",
        "Machine learning based on artificial neural networks with multiple layers",
        ImmutableList.of("c501", "c4230"),
        ImmutableList.of(),
        ImmutableList.of("c501"));
    add(
        builder,
        "c1425",
        "democracy",
        "A system of government where power resides with the citizens through elected"
            + " representatives",
        ImmutableList.of("c1426", "c1427"),
        ImmutableList.of("c1428", "c1429"),
        ImmutableList.of("c1420"));
    add(
        builder,
        "c2901",
        "economics",
        "The social science that studies the production, distribution, and consumption of goods"
            + " and services",
        ImmutableList.of("c2902", "c2903"),
        ImmutableList.of("c2904", "c2905"),
        ImmutableList.of("c2900"));
    add(
        builder,
        "c4230",
        "neural_networks",
        "Computing systems designed to recognize patterns, inspired by the human brain",
        ImmutableList.of("c501", "c4231"),
        ImmutableList.of("c4232", "c4233"),
        ImmutableList.of("c501"));
    add(
        builder,
        "c4231",
        "deep_learning",
        "Machine learning based on artificial neural networks with representation learning",
        ImmutableList.of("c4230", "c4232"),
        ImmutableList.of(),
        ImmutableList.of("c4230"));
    add(
        builder,
        "c4492",
        "research",
        "Systematic investigation to establish facts and reach new conclusions",
        ImmutableList.of("c4493", "c4494"),
        ImmutableList.of("c4495", "c4496"),
        ImmutableList.of("c4490"));
    add(
        builder,
        "c5501",
        "environment",
        "The surroundings or conditions in which a person, animal, or plant lives or operates",
        ImmutableList.of("c5502", "c5503"),
        ImmutableList.of("c5504", "c5505"),
        ImmutableList.of("c5500"));
    add(
        builder,
        "c6701",
        "knowledge_representation",
        "The field of AI dedicated to representing information about the world in a form that a"
            + " computer system can utilize",
        ImmutableList.of("c6702", "c6703"),
        ImmutableList.of("c6704", "c6705"),
        ImmutableList.of("c6700"));
    add(
        builder,
        "c8701",
        "rules",
        "Prescribed guides for conduct or action",
        ImmutableList.of("c2231", "c8702"),
        ImmutableList.of("c8703", "c8704"),
        ImmutableList.of("c8700"));
    add(
        builder,
        "c2231",
        "logic",
        "The study of principles of valid reasoning and inference",
        ImmutableList.of("c8701", "c2232"),
        ImmutableList.of("c2233", "c2234"),
        ImmutableList.of("c2230"));
    add(
        builder,
        "c117",
        "climate_change",
        "Long-term changes in temperature and weather patterns",
        ImmutableList.of("c5501", "c118"),
        ImmutableList.of("c119", "c120"),
        ImmutableList.of("c115"));
    CONCEPTS = builder.build();
  }

  private static void add(
      ImmutableMap.Builder<String, ConceptDef> builder,
      String id,
      String label,
      String definition,
      ImmutableList<String> related,
      ImmutableList<String> hyponyms,
      ImmutableList<String> hypernyms) {
    builder.put(id, ConceptDef.create(id, label, definition, related, hyponyms, hypernyms));
  }

  public static ImmutableMap<String, ConceptDef> concepts() {
    return CONCEPTS;
  }

  private DefaultConcepts() {}
}
