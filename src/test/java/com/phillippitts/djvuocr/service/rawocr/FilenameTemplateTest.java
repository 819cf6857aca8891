package com.phillippitts.djvuocr.service.rawocr;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilenameTemplateTest {

    @Test
    void expandsIdWithoutExtension() {
        assertThat(FilenameTemplate.parse("{id-ext}").expand(3, "chapter1.djvu")).isEqualTo("chapter1");
        assertThat(FilenameTemplate.parse("{id}").expand(3, "chapter1.djvu")).isEqualTo("chapter1.djvu");
    }

    @Test
    void formatsPageNumbers() {
        FilenameTemplate template = FilenameTemplate.parse("scan-{page:04d}");

        assertThat(template.expand(7, "p.djvu")).isEqualTo("scan-0007");
        assertThat(FilenameTemplate.parse("{page:3}").expand(7, "p.djvu")).isEqualTo("  7");
    }

    @Test
    void shiftsPageNumbers() {
        assertThat(FilenameTemplate.parse("{page+10}").expand(7, "p")).isEqualTo("17");
        assertThat(FilenameTemplate.parse("{page-1:03d}").expand(7, "p")).isEqualTo("006");
    }

    @Test
    void doubledBracesAreLiteral() {
        assertThat(FilenameTemplate.parse("{{{page}}}").expand(2, "p")).isEqualTo("{2}");
    }

    @Test
    void extensionOnlyDotIsKept() {
        assertThat(FilenameTemplate.parse("{id-ext}").expand(1, ".hidden")).isEqualTo(".hidden");
    }

    @Test
    void rejectsMalformedTemplates() {
        assertThatThrownBy(() -> FilenameTemplate.parse("{page")).hasMessageContaining("expected '}'");
        assertThatThrownBy(() -> FilenameTemplate.parse("page}")).hasMessageContaining("single '}'");
        assertThatThrownBy(() -> FilenameTemplate.parse("{pages}")).hasMessageContaining("unknown field 'pages'");
        assertThatThrownBy(() -> FilenameTemplate.parse("{id+1}")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> FilenameTemplate.parse("{id:04d}")).hasMessageContaining("numeric format");
        assertThatThrownBy(() -> FilenameTemplate.parse("{page:s}")).isInstanceOf(IllegalArgumentException.class);
    }
}
