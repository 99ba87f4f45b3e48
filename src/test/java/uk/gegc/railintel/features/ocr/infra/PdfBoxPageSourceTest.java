package uk.gegc.railintel.features.ocr.infra;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import uk.gegc.railintel.features.ocr.domain.ExtractionException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PdfBoxPageSource Tests")
class PdfBoxPageSourceTest {

    @TempDir
    Path tempDir;

    private final PdfBoxPageSource source = new PdfBoxPageSource();

    private Path writePdf(String... pageTexts) throws Exception {
        Path file = tempDir.resolve("circular.pdf");
        try (PDDocument document = new PDDocument()) {
            for (String text : pageTexts) {
                PDPage page = new PDPage();
                document.addPage(page);
                if (text.isEmpty()) {
                    continue;
                }
                try (PDPageContentStream content = new PDPageContentStream(document, page)) {
                    content.beginText();
                    content.setFont(PDType1Font.HELVETICA, 12);
                    content.newLineAtOffset(72, 700);
                    content.showText(text);
                    content.endText();
                }
            }
            document.save(file.toFile());
        }
        return file;
    }

    @Test
    @DisplayName("Reads the text layer page by page and drops empty pages")
    void readsTextLayer() throws Exception {
        Path file = writePdf("Track inspection report", "", "Signal maintenance log");

        List<String> pages = source.readPages(file);

        assertThat(pages).containsExactly("Track inspection report", "Signal maintenance log");
    }

    @Test
    @DisplayName("Corrupt file is an extraction failure")
    void corruptFile() throws Exception {
        Path file = tempDir.resolve("broken.pdf");
        Files.writeString(file, "not a pdf");

        assertThatThrownBy(() -> source.readPages(file))
                .isInstanceOf(ExtractionException.class)
                .hasMessageContaining("broken.pdf");
    }

    @Test
    @DisplayName("Supports PDF extension only")
    void supportsPdf() {
        assertThat(source.supports("Circular.PDF")).isTrue();
        assertThat(source.supports("circular.txt")).isFalse();
    }
}
