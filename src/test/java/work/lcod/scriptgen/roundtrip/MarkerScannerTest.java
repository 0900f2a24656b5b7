package work.lcod.scriptgen.roundtrip;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.List;
import org.junit.jupiter.api.Test;

class MarkerScannerTest {
    @Test
    void splitsActionBlocks() {
        String text = String.join("\n",
            "import mne",
            "# In[1] Notch Filter",
            "raw.notch_filter(freqs=[50.0])",
            "# End[1]",
            "",
            "# In[2]   Bandpass Filter  ",
            "raw.filter(l_freq=1.0, h_freq=40.0)",
            "",
            "",
            "# End[2]",
            "print('outside')");
        assertEquals(List.of(
            new CodeBlock("1", "Notch Filter", "raw.notch_filter(freqs=[50.0])"),
            new CodeBlock("2", "Bandpass Filter", "raw.filter(l_freq=1.0, h_freq=40.0)")
        ), MarkerScanner.extractBlocks(text, MarkerGrammar.ACTION));
    }

    @Test
    void nextBeginOrSentinelEndsAnOpenBlock() {
        String text = String.join("\n",
            "# In[1] First",
            "a = 1",
            "# In[2] Second",
            "b = 2",
            "",
            "# Save result",
            "# raw.save('out.fif')");
        assertEquals(List.of(new CodeBlock("1", "First", "a = 1"), new CodeBlock("2", "Second", "b = 2")),
            MarkerScanner.extractBlocks(text, MarkerGrammar.ACTION));
    }

    @Test
    void onlyTheMatchingEndCloses() {
        String text = "# In[1] First\na = 1\n# End[2]\nb = 2\n# End[01]\nc = 3";
        assertEquals(List.of(new CodeBlock("1", "First", "a = 1\n# End[2]\nb = 2")),
            MarkerScanner.extractBlocks(text, MarkerGrammar.ACTION));
    }

    @Test
    void readsStepBlocks() {
        String text = "# Step[fit] Fit ICA\nica.fit(raw)\n# EndStep[fit]\n\n# Step[inspect] Manual Selection\nraw = ica.apply(raw)";
        var blocks = MarkerScanner.extractBlocks(text, MarkerGrammar.STEP);
        assertEquals(2, blocks.size());
        assertEquals("fit", blocks.get(0).id());
        assertEquals("Manual Selection", blocks.get(1).label());
        assertEquals("raw = ica.apply(raw)", blocks.get(1).code());
    }

    @Test
    void unterminatedActionBlockRunsToTheNextBegin() {
        String text = String.join("\n",
            "# In[1] First",
            "a = 1",
            "# End[1]",
            "# In[2] Second",
            "b = 2",
            "c = 3",
            "# In[3] Third",
            "d = 4",
            "# End[3]");
        assertEquals(List.of(
            new CodeBlock("1", "First", "a = 1"),
            new CodeBlock("2", "Second", "b = 2\nc = 3"),
            new CodeBlock("3", "Third", "d = 4")
        ), MarkerScanner.extractBlocks(text, MarkerGrammar.ACTION));
    }

    @Test
    void unterminatedLastActionBlockRunsToEndOfText() {
        String text = "# In[1] First\na = 1\n# End[1]\n# In[2] Second\nb = 2\nprint(b)\n\n";
        var blocks = MarkerScanner.extractBlocks(text, MarkerGrammar.ACTION);
        assertEquals(2, blocks.size());
        assertEquals(new CodeBlock("2", "Second", "b = 2\nprint(b)"), blocks.get(1));
    }

    @Test
    void emptyTextHasNoBlocks() {
        assertEquals(List.of(), MarkerScanner.extractBlocks("", MarkerGrammar.ACTION));
    }
}
