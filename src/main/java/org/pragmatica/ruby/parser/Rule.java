package org.pragmatica.ruby.parser;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A named production. The definition is resolved on first use, which lets a grammar refer to
 * rules that are defined later or to itself. Memoizing rules cache their result per offset
 * in the cursor's session.
 */
public final class Rule<T> implements Parser<T> {

    private final String name;
    private final Supplier<? extends Parser<T>> definition;
    private final boolean memoizing;
    private volatile Parser<T> resolved;

    Rule(String name, Supplier<? extends Parser<T>> definition, boolean memoizing) {
        this.name = name;
        this.definition = definition;
        this.memoizing = memoizing;
    }

    public String name() {
        return name;
    }

    @Override
    public ParseResult<T> parse(Cursor cursor) {
        if (!memoizing) {
            return resolve().parse(cursor);
        }
        var cached = cursor.memoized(this);
        if (cached.isPresent()) {
            return cached.get();
        }
        var result = resolve().parse(cursor);
        cursor.memoize(this, result);
        return result;
    }

    private Parser<T> resolve() {
        var parser = resolved;
        if (parser == null) {
            parser = Objects.requireNonNull(definition.get(), () -> "Rule " + name + " has no definition");
            resolved = parser;
        }
        return parser;
    }

    @Override
    public String toString() {
        return "Rule[" + name + "]";
    }
}
