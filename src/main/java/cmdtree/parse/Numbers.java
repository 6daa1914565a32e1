package cmdtree.parse;

import java.math.BigInteger;
import java.util.regex.Pattern;

public final class Numbers {
    private static final Pattern HEX = Pattern.compile("^0x[0-9a-f]+$", Pattern.CASE_INSENSITIVE);

    private static final Pattern DECIMAL = Pattern.compile("^[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(e[-+]?\\d+)?$");

    private Numbers() {
        throw new IllegalStateException("Util class");
    }

    public static boolean isNumber(final Object value) {
        if (value instanceof Number) {
            return true;
        }
        if (!(value instanceof String)) {
            return false;
        }
        final var text = (String) value;
        return HEX.matcher(text).matches() || DECIMAL.matcher(text).matches();
    }

    public static Number parse(final String text) {
        if (HEX.matcher(text).matches()) {
            final var hex = new BigInteger(text.substring(2), 16);
            return hex.bitLength() < Long.SIZE ? (Number) hex.longValue() : (Number) hex.doubleValue();
        }
        return normalize(Double.parseDouble(text));
    }

    public static Number normalize(final Number number) {
        if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte) {
            return number.longValue();
        }
        final var d = number.doubleValue();
        if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) < 0x1p63) {
            return (long) d;
        }
        return d;
    }
}
