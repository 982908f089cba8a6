package org.llasm.compiler.frontend.lowering;

import org.llasm.compiler.api.InternalConsistencyException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A bijection between the keywords of one closed vocabulary and the values of an enumeration.
 * <p>
 * Not every constant of the enumeration needs a keyword: values such as {@code NONE} denote
 * "absent" and are never spelled.
 *
 * @param <E> The enumeration type.
 */
public final class KeywordTable<E extends Enum<E>> {

    private final String category;
    private final Map<String, E> bySpelling;
    private final Map<E, String> byValue;

    private KeywordTable(String category, Map<String, E> bySpelling, Map<E, String> byValue) {
        this.category = category;
        this.bySpelling = Collections.unmodifiableMap(bySpelling);
        this.byValue = Collections.unmodifiableMap(byValue);
    }

    /**
     * @param category The vocabulary name used in error messages, e.g. "linkage".
     * @param type The enumeration class.
     * @param <E> The enumeration type.
     * @return A new builder.
     */
    public static <E extends Enum<E>> Builder<E> builder(String category, Class<E> type) {
        return new Builder<>(category, type);
    }

    /**
     * @param spelling The keyword as written.
     * @return The value denoted by the keyword.
     * @throws InternalConsistencyException if the keyword is not part of this vocabulary.
     */
    public E lookup(String spelling) {
        E value = bySpelling.get(spelling);
        if (value == null) {
            throw new InternalConsistencyException(String.format(
                    "invalid %s keyword %s", category, IdentifierDecoder.quoteForMessage(spelling)));
        }
        return value;
    }

    /**
     * @param spelling The keyword as written.
     * @return The value, or empty if the keyword is not part of this vocabulary.
     */
    public Optional<E> find(String spelling) {
        return Optional.ofNullable(bySpelling.get(spelling));
    }

    /**
     * @param value An enumeration value.
     * @return Its keyword, or empty for values that are never spelled.
     */
    public Optional<String> spellingOf(E value) {
        return Optional.ofNullable(byValue.get(value));
    }

    /**
     * @return All keywords of this vocabulary in declaration order.
     */
    public Set<String> spellings() {
        return bySpelling.keySet();
    }

    public String category() {
        return category;
    }

    @Override
    public String toString() {
        return "KeywordTable{" + category + ", " + bySpelling.size() + " keywords}";
    }

    /**
     * Collects keyword/value pairs, rejecting anything that would break the bijection.
     *
     * @param <E> The enumeration type.
     */
    public static final class Builder<E extends Enum<E>> {
        private final String category;
        private final Map<String, E> bySpelling = new LinkedHashMap<>();
        private final Map<E, String> byValue;

        private Builder(String category, Class<E> type) {
            this.category = category;
            this.byValue = new EnumMap<>(type);
        }

        /**
         * @param spelling The keyword.
         * @param value The value it denotes.
         * @return This builder.
         * @throws IllegalStateException if the keyword or the value is already mapped.
         */
        public Builder<E> put(String spelling, E value) {
            if (bySpelling.containsKey(spelling)) {
                throw new IllegalStateException(category + " keyword '" + spelling + "' mapped twice");
            }
            if (byValue.containsKey(value)) {
                throw new IllegalStateException(category + " value " + value + " already spelled '" + byValue.get(value) + "'");
            }
            bySpelling.put(spelling, value);
            byValue.put(value, spelling);
            return this;
        }

        public KeywordTable<E> build() {
            return new KeywordTable<>(category, new LinkedHashMap<>(bySpelling), new EnumMap<>(byValue));
        }
    }
}
