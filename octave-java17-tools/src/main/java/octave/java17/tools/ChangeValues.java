package octave.java17.tools;

import octave.java17.core.OctaveAst.BooleanLiteral;
import octave.java17.core.OctaveAst.InlineMap;
import octave.java17.core.OctaveAst.ListValue;
import octave.java17.core.OctaveAst.NullLiteral;
import octave.java17.core.OctaveAst.NumberLiteral;
import octave.java17.core.OctaveAst.StringLiteral;
import octave.java17.core.OctaveAst.Value;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/// Converts the plain Java values of a change map into AST values.
/// Strings stay strings: `"42"` becomes the string 42, never the number.
final class ChangeValues {

    private ChangeValues() {
    }

    static Value toValue(String key, Object value) {
        if (value == null) {
            return NullLiteral.INSTANCE;
        }
        if (value instanceof Value v) {
            return v;
        }
        if (value instanceof String s) {
            return StringLiteral.of(s);
        }
        if (value instanceof Boolean b) {
            return new BooleanLiteral(b);
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte
            || value instanceof BigInteger) {
            return new NumberLiteral(value.toString());
        }
        if (value instanceof BigDecimal d) {
            return new NumberLiteral(d.toPlainString());
        }
        if (value instanceof Double || value instanceof Float) {
            final double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new InvalidChangeException("'" + key + "' is not a finite number: " + value);
            }
            return new NumberLiteral(BigDecimal.valueOf(d).toPlainString());
        }
        if (value instanceof List<?> list) {
            final var items = new ArrayList<Value>(list.size());
            for (Object item : list) {
                items.add(toValue(key, item));
            }
            return ListValue.of(items);
        }
        if (value instanceof Map<?, ?> map) {
            final var pairs = new LinkedHashMap<String, Value>();
            for (Map.Entry<?, ?> e : map.entrySet()) {
                final Value v = toValue(key, e.getValue());
                if (!v.isAtom()) {
                    throw new InvalidChangeException("'" + key + "' map entry " + e.getKey() + " must be an atom");
                }
                pairs.put(String.valueOf(e.getKey()), v);
            }
            return new InlineMap(pairs);
        }
        throw new InvalidChangeException("'" + key + "' has unsupported value type " + value.getClass().getSimpleName());
    }
}
