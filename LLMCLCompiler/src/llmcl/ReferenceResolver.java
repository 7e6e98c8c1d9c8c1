package llmcl;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.CharMatcher;
import com.google.common.base.Joiner;
import com.google.common.base.Preconditions;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;

/**
 * Resolves {@code ^scope.path} tokens against a bounded history of earlier messages.
 *
 * <p>Scopes are {@code prevK} (the K-th most recent entry, 1-based), {@code self} (the most
 * recent entry) and {@code shared}, which has no backing store and always yields a marker map.
 * Not thread-safe.
 */
public class ReferenceResolver {
  private static final Logger logger = LoggerFactory.getLogger(ReferenceResolver.class);

  public static final int DEFAULT_MAX_CONTEXT_SIZE = 10;

  private static final String PREV_SCOPE = "prev";
  private static final String TAG_PREFIX = String.valueOf(Scanner.CONCEPT_SIGIL);
  private static final CharMatcher DIGITS = CharMatcher.inRange('0', '9');

  private final int maxContextSize;
  // Oldest first.
  private final Deque<Object> contextBuffer = new ArrayDeque<>();

  public ReferenceResolver() {
    this(DEFAULT_MAX_CONTEXT_SIZE);
  }

  public ReferenceResolver(int maxContextSize) {
    Preconditions.checkArgument(maxContextSize > 0, "maxContextSize must be positive");
    this.maxContextSize = maxContextSize;
  }

  public int maxContextSize() {
    return maxContextSize;
  }

  public int contextSize() {
    return contextBuffer.size();
  }

  public void addToContext(Object message) {
    contextBuffer.addLast(Preconditions.checkNotNull(message));
    if (contextBuffer.size() > maxContextSize) {
      contextBuffer.removeFirst();
      logger.debug("context buffer full, evicted oldest entry");
    }
  }

  public void clear() {
    contextBuffer.clear();
  }

  public Optional<Object> resolve(String token) {
    if (token.isEmpty() || token.charAt(0) != Scanner.REFERENCE_SIGIL) return Optional.empty();

    List<String> parts = Splitter.on('.').splitToList(token.substring(1));
    String scope = parts.get(0);
    List<String> path = parts.subList(1, parts.size());

    if (scope.startsWith(PREV_SCOPE)) {
      return prev(scope.substring(PREV_SCOPE.length())).flatMap(root -> walk(root, path));
    } else if (scope.equals("self")) {
      if (contextBuffer.isEmpty()) return Optional.empty();
      return walk(contextBuffer.peekLast(), path);
    } else if (scope.equals("shared")) {
      return Optional.<Object>of(
          ImmutableMap.of("type", "shared_knowledge", "path", Joiner.on('.').join(path)));
    }
    return Optional.empty();
  }

  private Optional<Object> prev(String index) {
    if (index.isEmpty() || index.length() > 9 || !DIGITS.matchesAllOf(index)) {
      return Optional.empty();
    }

    int k = Integer.parseInt(index);
    if (k <= 0 || k > contextBuffer.size()) return Optional.empty();

    Iterator<Object> newestFirst = contextBuffer.descendingIterator();
    Object entry = newestFirst.next();
    for (int i = 1; i < k; i++) {
      entry = newestFirst.next();
    }
    return Optional.of(entry);
  }

  private static Optional<Object> walk(Object root, List<String> path) {
    Object current = root;
    for (String segment : path) {
      Optional<Object> next = step(current, segment);
      if (!next.isPresent()) return Optional.empty();
      current = next.get();
    }
    return Optional.of(current);
  }

  private static Optional<Object> step(Object current, String segment) {
    if (current instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) current;
      if (segment.startsWith(TAG_PREFIX)) {
        // Tag segments match by prefix, so #item finds a key stored as #item1.
        for (Map.Entry<?, ?> entry : map.entrySet()) {
          if (String.valueOf(entry.getKey()).startsWith(segment)) {
            return Optional.ofNullable(entry.getValue());
          }
        }
        return Optional.empty();
      }
      return Optional.ofNullable(map.get(segment));
    } else if (current instanceof List) {
      List<?> list = (List<?>) current;
      if (!segment.isEmpty() && segment.length() <= 9 && DIGITS.matchesAllOf(segment)) {
        int index = Integer.parseInt(segment);
        return index < list.size() ? Optional.ofNullable(list.get(index)) : Optional.empty();
      } else if (segment.startsWith(TAG_PREFIX)) {
        for (Object item : list) {
          if (item instanceof Map && hasKeyWithPrefix((Map<?, ?>) item, segment)) {
            return Optional.of(item);
          }
        }
      }
      return Optional.empty();
    }
    return Optional.empty();
  }

  private static boolean hasKeyWithPrefix(Map<?, ?> map, String prefix) {
    return map.keySet().stream().anyMatch(k -> String.valueOf(k).startsWith(prefix));
  }
}
