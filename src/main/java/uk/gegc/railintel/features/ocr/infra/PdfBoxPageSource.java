package uk.gegc.railintel.features.ocr.infra;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.ocr.domain.ExtractionException;
import uk.gegc.railintel.features.ocr.domain.PageSource;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Text layer of PDF files using Apache PDFBox. Scanned PDFs without a text layer yield blank
 * pages, which are dropped.
 */
@Component
@Slf4j
public class PdfBoxPageSource implements PageSource {

    @Override
    public boolean supports(String fileName) {
        if (fileName == null) return false;
        return fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public List<String> readPages(Path file) throws ExtractionException {
        try (PDDocument document = PDDocument.load(file.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);

            List<String> pages = new ArrayList<>();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String text = stripper.getText(document);
                if (!text.isBlank()) {
                    pages.add(text.strip());
                }
            }
            log.debug("Read {} page(s) with text out of {} from PDF {}",
                    pages.size(), document.getNumberOfPages(), file.getFileName());
            return pages;
        } catch (Exception e) {
            throw new ExtractionException("Failed to read PDF " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
