package score;

public class Clef {
	
	public static final Clef TREBLE = new Clef("G", 2);
	public static final Clef BASS = new Clef("F", 4);
	
	public final String sign;
	public final int line;
	
	public Clef(String sign, int line) {
		if (sign == null || sign.isEmpty() || !NoteCodec.isSafeToken(sign)) {
			throw new IllegalArgumentException("Illegal clef sign: "+sign);
		}
		this.sign = sign;
		this.line = line;
	}
	
	public boolean equals(Object other) {
		if (other instanceof Clef) {
			Clef that = (Clef) other;
			return this.line == that.line && this.sign.equals(that.sign);
		} else {
			return false;
		}
	}
	
	public int hashCode() {
		return 31 * sign.hashCode() + line;
	}
	
	public String toString() {
		return "(" + sign + "," + line + ")";
	}

}
