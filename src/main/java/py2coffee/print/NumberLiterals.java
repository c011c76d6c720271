package py2coffee.print;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Canonical form of Python numeric literals: integers in decimal, floats in
 * their shortest round-trip form laid out like Python's {@code repr}.
 */
final class NumberLiterals {
	private NumberLiterals() {
	}

	static String canonical(String literal) {
		String text = literal.replace("_", "");
		String lower = text.toLowerCase(Locale.ROOT);

		if (lower.endsWith("j")) {
			String imaginary = canonical(text.substring(0, text.length() - 1));
			return (imaginary.endsWith(".0") ? imaginary.substring(0, imaginary.length() - 2) : imaginary) + "j";
		}
		if (lower.startsWith("0x")) {
			return new BigInteger(text.substring(2), 16).toString();
		}
		if (lower.startsWith("0o")) {
			return new BigInteger(text.substring(2), 8).toString();
		}
		if (lower.startsWith("0b")) {
			return new BigInteger(text.substring(2), 2).toString();
		}
		if (lower.contains(".") || lower.contains("e")) {
			return floatRepr(Double.parseDouble(text));
		}
		return new BigInteger(text).toString();
	}

	static String floatRepr(double value) {
		if (Double.isInfinite(value)) {
			return "Infinity";
		}
		if (value == 0.0) {
			return "0.0";
		}
		BigDecimal decimal = shortest(value);
		int exponent = decimal.precision() - decimal.scale() - 1;
		if (exponent >= -4 && exponent < 16) {
			String plain = decimal.toPlainString();
			return plain.contains(".") ? plain : plain + ".0";
		}
		String digits = decimal.unscaledValue().abs().toString();
		String mantissa = digits.length() > 1 ? digits.charAt(0) + "." + digits.substring(1) : digits;
		int magnitude = Math.abs(exponent);
		return mantissa + "e" + (exponent < 0 ? "-" : "+") + (magnitude < 10 ? "0" : "") + magnitude;
	}

	/**
	 * Fewest significant digits that parse back to {@code value}, nearest to
	 * the exact binary value.
	 */
	static BigDecimal shortest(double value) {
		BigDecimal exact = new BigDecimal(value);
		for (int digits = 1; digits < 17; digits++) {
			BigDecimal rounded = exact.round(new MathContext(digits, RoundingMode.HALF_EVEN));
			if (Double.parseDouble(rounded.toString()) == value) {
				return rounded.stripTrailingZeros();
			}
		}
		return exact.round(new MathContext(17, RoundingMode.HALF_EVEN)).stripTrailingZeros();
	}
}
