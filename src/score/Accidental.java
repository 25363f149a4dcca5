package score;

public enum Accidental {
	
	NATURAL("", 0), SHARP("#", 1), FLAT("b", -1), DOUBLE_SHARP("x", 2), DOUBLE_FLAT("bb", -2);
	
	public final String symbol;
	public final int alter;
	
	private Accidental(String symbol, int alter) {
		this.symbol = symbol;
		this.alter = alter;
	}
	
	public static Accidental fromAlter(int alter) {
		for (Accidental accidental : values()) {
			if (accidental.alter == alter) return accidental;
		}
		throw new IllegalArgumentException("Unsupported alter: "+alter);
	}
	
	/**
	 * Longest symbol that prefixes the given text, NATURAL if none does.
	 */
	public static Accidental longestPrefixOf(String text) {
		if (text.startsWith(DOUBLE_FLAT.symbol)) return DOUBLE_FLAT;
		if (text.startsWith(DOUBLE_SHARP.symbol)) return DOUBLE_SHARP;
		if (text.startsWith(SHARP.symbol)) return SHARP;
		if (text.startsWith(FLAT.symbol)) return FLAT;
		return NATURAL;
	}

}
