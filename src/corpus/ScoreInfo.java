package corpus;

public class ScoreInfo {
	
	public static final int DEFAULT_TEMPO_BPM = 120;
	
	public final int resolution;
	public final int tempo;
	
	public ScoreInfo(int resolution, int tempo) {
		if (resolution <= 0) throw new IllegalArgumentException("Tick resolution must be positive, got "+resolution);
		if (tempo <= 0) throw new IllegalArgumentException("Tempo must be positive, got "+tempo);
		this.resolution = resolution;
		this.tempo = tempo;
	}
	
	public String toString() {
		return "ScoreInfo(" + resolution + " ticks, " + tempo + " bpm)";
	}

}
