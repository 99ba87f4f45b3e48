package uk.gegc.railintel.features.ocr.infra;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.railintel.features.ocr.domain.ExtractionException;
import uk.gegc.railintel.features.ocr.domain.PageSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * UTF-8 text files, already extracted upstream. A form feed separates pages.
 */
@Component
@Slf4j
public class PlainTextPageSource implements PageSource {

    private static final String PAGE_BREAK = "\f";

    @Override
    public boolean supports(String fileName) {
        if (fileName == null) return false;
        String lower = fileName.toLowerCase(Locale.ROOT);
        return lower.endsWith(".txt") || lower.endsWith(".text");
    }

    @Override
    public List<String> readPages(Path file) throws ExtractionException {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExtractionException("Failed to read text file " + file.getFileName() + ": " + e.getMessage(), e);
        }

        List<String> pages = new ArrayList<>();
        for (String page : content.split(PAGE_BREAK, -1)) {
            if (!page.isBlank()) {
                pages.add(page.strip());
            }
        }
        log.debug("Read {} page(s) from {}", pages.size(), file.getFileName());
        return pages;
    }
}
