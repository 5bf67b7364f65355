package work.lcod.lexicon.shared;

import com.ibm.icu.text.BreakIterator;
import com.ibm.icu.util.ULocale;

/**
 * Counts extended grapheme clusters, the unit of {@code minGraphemes}/{@code maxGraphemes}.
 */
public final class Graphemes {
    private Graphemes() {}

    public static int count(String text) {
        if (text.isEmpty()) {
            return 0;
        }
        // BreakIterator instances are stateful, one per call
        BreakIterator iterator = BreakIterator.getCharacterInstance(ULocale.ROOT);
        iterator.setText(text);
        int count = 0;
        while (iterator.next() != BreakIterator.DONE) {
            count++;
        }
        return count;
    }
}
