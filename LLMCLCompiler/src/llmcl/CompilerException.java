package llmcl;

public class CompilerException extends Exception {
  private static final long serialVersionUID = 1L;

  private final Scanner.Pos pos;
  private final String errorMsg;

  public CompilerException(Scanner.Pos pos, String errorMsg) {
    super(errorMsg);
    this.pos = pos;
    this.errorMsg = errorMsg;
  }

  public String format() {
    return String.format("Error at line %d, column %d: %s", pos.line(), pos.column(), errorMsg);
  }
}
