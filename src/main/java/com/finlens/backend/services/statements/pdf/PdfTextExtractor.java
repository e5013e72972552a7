package com.finlens.backend.services.statements.pdf;

import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * Text extraction bounded to the first {@code maxPages} pages.
 */
@Service
public class PdfTextExtractor {

    public String extractText(PDDocument document, int maxPages) throws IOException {
        return newStripper(document, maxPages, false).getText(document);
    }

    /**
     * Position-sorted extraction; keeps table rows of statements in reading order more often.
     */
    public String extractTextSorted(PDDocument document, int maxPages) throws IOException {
        return newStripper(document, maxPages, true).getText(document);
    }

    public static int pagesToRead(PDDocument document, int maxPages) {
        int pages = document.getNumberOfPages();
        return maxPages > 0 ? Math.min(pages, maxPages) : pages;
    }

    private static PDFTextStripper newStripper(PDDocument document, int maxPages, boolean sorted) throws IOException {
        PDFTextStripper stripper = new PDFTextStripper();
        stripper.setSortByPosition(sorted);
        stripper.setStartPage(1);
        stripper.setEndPage(pagesToRead(document, maxPages));
        return stripper;
    }
}
