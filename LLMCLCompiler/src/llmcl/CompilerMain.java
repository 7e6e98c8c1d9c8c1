package llmcl;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.google.common.io.Files;

/**
 * Compiles LLM-CL files in the order given. Files share one reference context, so a later file
 * may refer to an earlier one with {@code ^prev1}.
 */
public class CompilerMain {
  private static final String IR_FLAG = "--ir";

  public static void main(String[] args) throws IOException {
    boolean printIr = false;
    List<File> files = new ArrayList<>();
    for (String arg : args) {
      if (arg.equals(IR_FLAG)) {
        printIr = true;
      } else {
        files.add(new File(arg));
      }
    }

    if (files.isEmpty()) {
      System.err.println("Usage: $COMPILER [--ir] llmcl_file...");
      System.exit(1);
    }

    ConceptRegistry registry = ConceptRegistry.withDefaults();
    ReferenceResolver resolver = new ReferenceResolver();

    boolean success = true;
    for (File f : files) {
      LlmclCompiler compiler =
          new LlmclCompiler(read(f), Optional.of(registry), Optional.of(resolver));
      CompileResult result = compiler.compile();

      result.warnings().forEach(w -> System.out.println(String.format("WARNING: %s %s", f, w)));
      if (!result.ok()) {
        System.out.println(String.format("ERROR: %s %s", f, result.output()));
        success = false;
        continue;
      }

      System.out.println(result.output());
      if (printIr) {
        compiler.canonicalIrAsMap().ifPresent(System.out::println);
      }
    }

    if (!success) {
      System.out.println("Compilation failed.  See errors above.");
      System.exit(1);
    }
    System.out.println("Compilation succeeded!");
  }

  private static String read(File file) throws IOException {
    return Files.asCharSource(file, StandardCharsets.UTF_8).read();
  }
}
