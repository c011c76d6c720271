package py2coffee.print;

/**
 * @param strictOperators fail on operators without a CoffeeScript spelling
 *                        instead of printing a placeholder tag
 */
public record PrinterOptions(boolean strictOperators) {
	public static final PrinterOptions DEFAULT = new PrinterOptions(false);
}
