package work.lcod.scriptgen.introspect;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.junit.jupiter.api.Test;

class ApiCatalogTest {
    @Test
    void bundledCatalogueHasTheRecordingRoots() {
        ApiCatalog catalog = ApiCatalog.bundled();

        assertTrue(catalog.rootNames().containsAll(List.of("raw", "ica", "mne")));
        assertEquals("mne.io.Raw", catalog.root("raw").orElseThrow());
        assertTrue(catalog.symbol("mne.io.Raw.notch_filter").orElseThrow().isCallable());
    }

    @Test
    void parsesParameterKindsAndDefaults() throws IOException {
        ApiCatalog catalog = ApiCatalog.parse(stream("""
            roots:
              x: pkg.X
            symbols:
              pkg.X:
                kind: class
                parameters:
                  - name: self
                  - {name: size, default: 3}
                  - {name: rest, kind: var_keyword}
            """));

        ApiSymbol symbol = catalog.symbol("pkg.X").orElseThrow();
        assertEquals(ApiSymbol.Kind.CLASS, symbol.kind());
        assertEquals(3, symbol.parameters().size());
        ApiParameter size = symbol.parameters().get(1);
        assertTrue(size.hasDefault());
        assertEquals(3, size.defaultValue());
        assertFalse(symbol.parameters().get(0).hasDefault());
        assertTrue(symbol.parameters().get(2).isVariadic());
    }

    @Test
    void emptyDocumentGivesEmptyCatalogue() throws IOException {
        ApiCatalog catalog = ApiCatalog.parse(stream(""));

        assertTrue(catalog.rootNames().isEmpty());
    }

    @Test
    void rejectsParametersWithoutName() {
        assertThrows(IOException.class, () -> ApiCatalog.parse(stream("""
            symbols:
              pkg.f:
                parameters:
                  - {default: 1}
            """)));
    }

    private static ByteArrayInputStream stream(String yaml) {
        return new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8));
    }
}
