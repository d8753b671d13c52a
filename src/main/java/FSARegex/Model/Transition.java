package FSARegex.Model;

public record Transition(String source, String symbol, String target) {

  /**
   * Placeholder for a token that did not split into three parts. The raw token is kept as
   * source so that equal tokens still count as repeated transitions.
   */
  public static Transition unparsed(String token) {
    return new Transition(token, null, null);
  }

  public boolean isComplete() {
    return source != null && symbol != null && target != null;
  }

  @Override
  public String toString() {
    return isComplete() ? source + ">" + symbol + ">" + target : source;
  }
}
