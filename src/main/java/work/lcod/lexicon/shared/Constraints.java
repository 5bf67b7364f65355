package work.lcod.lexicon.shared;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import work.lcod.lexicon.error.DataValidationException;
import work.lcod.lexicon.error.InvalidSchemaException;
import work.lcod.lexicon.runtime.ValidationContext;

/**
 * Checks shared by the type variants: field allow-lists, bound consistency and data bounds.
 */
public final class Constraints {
    private Constraints() {}

    public static void checkAllowedFields(ValidationContext ctx, String typeName, Iterator<String> fields, Set<String> allowed) {
        while (fields.hasNext()) {
            String field = fields.next();
            if (!allowed.contains(field)) {
                throw new InvalidSchemaException(ctx.describe("field '" + field + "' is not allowed in a " + typeName + " schema"));
            }
        }
    }

    public static void checkRange(
        ValidationContext ctx,
        String minField,
        Optional<? extends Number> min,
        String maxField,
        Optional<? extends Number> max
    ) {
        if (min.isPresent() && max.isPresent() && min.get().longValue() > max.get().longValue()) {
            throw new InvalidSchemaException(ctx.describe(
                minField + " (" + min.get() + ") cannot be greater than " + maxField + " (" + max.get() + ")"
            ));
        }
    }

    public static void checkConstDefault(ValidationContext ctx, boolean hasConst, boolean hasDefault) {
        if (hasConst && hasDefault) {
            throw new InvalidSchemaException(ctx.describe("const and default are mutually exclusive"));
        }
    }

    public static void checkBounds(
        ValidationContext ctx,
        String subject,
        long actual,
        String minField,
        Optional<? extends Number> min,
        String maxField,
        Optional<? extends Number> max
    ) {
        if (min.isPresent() && actual < min.get().longValue()) {
            throw new DataValidationException(ctx.describe(subject + " " + actual + " is less than " + minField + " " + min.get()));
        }
        if (max.isPresent() && actual > max.get().longValue()) {
            throw new DataValidationException(ctx.describe(subject + " " + actual + " exceeds " + maxField + " " + max.get()));
        }
    }

    public static <T> void checkEnum(ValidationContext ctx, T value, Optional<List<T>> allowed) {
        if (allowed.isPresent() && !allowed.get().contains(value)) {
            throw new DataValidationException(ctx.describe(
                "value " + render(value) + " is not one of the allowed values "
                    + allowed.get().stream().map(Constraints::render).collect(Collectors.joining(", ", "[", "]"))
            ));
        }
    }

    private static String render(Object value) {
        return value instanceof String text ? "'" + text + "'" : String.valueOf(value);
    }
}
