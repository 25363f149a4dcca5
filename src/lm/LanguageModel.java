package lm;

import java.util.List;

/**
 * A model over sequences of {@code T}, conditioned on the most recent
 * entries (oldest first).
 */
public interface LanguageModel<T> {

    public int contextLength();

    public T sample(List<T> context);

    public double score(T entry, List<T> context);

}
