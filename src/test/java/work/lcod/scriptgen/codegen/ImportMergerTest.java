package work.lcod.scriptgen.codegen;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.lcod.scriptgen.ir.SourceParser;
import work.lcod.scriptgen.ir.Stmt;

class ImportMergerTest {
    @Test
    void extractsTopLevelImportsAndKeepsComments() {
        String code = "# detect bad channels\nimport numpy as np\nfrom mne import (\n    pick_types,\n)\nbad = np.where(x)\nif bad:\n    import os\n";
        var extraction = ImportMerger.extract(code);
        assertEquals(2, extraction.imports().size());
        assertEquals("# detect bad channels\nbad = np.where(x)\nif bad:\n    import os\n", extraction.code());
    }

    @Test
    void leavesUnparsableCodeUntouched() {
        String code = "import mne\nraw.filter(";
        var extraction = ImportMerger.extract(code);
        assertTrue(extraction.imports().isEmpty());
        assertEquals(code, extraction.code());
    }

    @Test
    void mergesAndSortsImports() {
        var imports = new ArrayList<Stmt>();
        imports.addAll(SourceParser.parseStatements("import numpy as np\nimport mne\nfrom mne.preprocessing import ICA"));
        imports.addAll(SourceParser.parseStatements("import mne\nfrom mne.preprocessing import create_eog_epochs, ICA"));
        imports.addAll(SourceParser.parseStatements("from mne import pick_types as pt, pick_types\nimport scipy.signal"));
        assertEquals(String.join("\n",
            "import mne",
            "import numpy as np",
            "import scipy.signal",
            "from mne import pick_types, pick_types as pt",
            "from mne.preprocessing import ICA, create_eog_epochs"), ImportMerger.merge(imports));
    }

    @Test
    void mergesNothingToEmptyText() {
        assertEquals("", ImportMerger.merge(List.of()));
    }
}
