package org.sfgen.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Tag("unit")
class OutputSpecTest {

    @Test
    void constructor_shouldStripLeadingDotsFromExtensions() {
        OutputSpec spec = new OutputSpec("solver", ".h", ".cxx", OutputMode.STANDALONE,
                OutputSpec.IncludeGuard.MACRO, null, null);

        assertEquals("solver.h", spec.headerFilename());
        assertEquals("solver.cxx", spec.implFilename());
        assertEquals("SOLVER_H", spec.guardMacro());
        assertThat(spec.namespace()).isEmpty();
        assertThat(spec.prelude()).isEmpty();
    }

    @Test
    void constructor_shouldStripNamespace() {
        OutputSpec spec = new OutputSpec("gen", "hpp", "cpp", OutputMode.STANDALONE,
                OutputSpec.IncludeGuard.PRAGMA, " app::solver ", "");

        assertEquals("app::solver", spec.namespace());
    }

    @Test
    @DisplayName("Guard macros do not depend on the default locale")
    void guardMacro_shouldUseRootLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals("INIT_HPP", OutputSpec.of("init").guardMacro());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void constructor_shouldRejectBlankBasename() {
        assertThatThrownBy(() -> OutputSpec.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void codeStyle_shouldIndentNonBlankLines() {
        assertEquals("  a\n\n  b", CodeStyle.DEFAULT.indent("a\n\nb"));
        assertEquals("    a", new CodeStyle(4).indent("a"));
    }
}
