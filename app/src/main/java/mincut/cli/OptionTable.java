package mincut.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * {@code --option value}, {@code --option=value} and flag parsing shared by the commands. Arguments
 * that do not start with {@code --} are returned as positionals.
 */
final class OptionTable<B> {
  private final Map<String, OptionSpec<B>> specs = new LinkedHashMap<>();

  OptionTable<B> withValue(String option, BiConsumer<B, String> consumer) {
    specs.put(option, new OptionSpec<>(true, consumer));
    return this;
  }

  OptionTable<B> flag(String option, Consumer<B> consumer) {
    specs.put(option, new OptionSpec<>(false, (builder, ignored) -> consumer.accept(builder)));
    return this;
  }

  List<String> parse(String[] args, B builder) {
    List<String> positionals = new ArrayList<>();
    for (int i = 0; i < args.length; i++) {
      if (!args[i].startsWith("--")) {
        positionals.add(args[i]);
        continue;
      }
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec<B> spec = specs.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue()) {
        if (value == null || value.isBlank()) {
          if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for " + parsed.option());
          }
          value = args[++i];
        }
      } else if (value != null) {
        throw new IllegalArgumentException(parsed.option() + " does not take a value");
      }
      spec.apply().accept(builder, value);
    }
    return positionals;
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      int equalsIndex = raw.indexOf('=');
      if (equalsIndex > 0) {
        String value = raw.substring(equalsIndex + 1);
        return new ParsedArg(raw.substring(0, equalsIndex), value.isEmpty() ? null : value);
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec<B>(boolean requiresValue, BiConsumer<B, String> apply) {}
}
