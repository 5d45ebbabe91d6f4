package com.docintegrity.analysis.service.extraction;

import com.docintegrity.analysis.service.ExtractionException;
import java.io.IOException;
import java.util.Locale;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfTextExtractor implements TextExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(PdfTextExtractor.class);

    @Override
    public boolean supports(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    @Override
    public String extract(byte[] bytes, String filename) {
        if (!supports(filename)) {
            throw new ExtractionException("Only PDF files are supported");
        }
        if (bytes == null || bytes.length == 0) {
            throw new ExtractionException("Uploaded file is empty");
        }

        try (PDDocument document = PDDocument.load(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            StringBuilder text = new StringBuilder();
            for (int page = 1; page <= document.getNumberOfPages(); page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                String pageText = stripper.getText(document);
                if (pageText != null && !pageText.isBlank()) {
                    text.append(pageText.strip()).append('\n');
                }
            }
            LOGGER.debug("Extracted {} characters from {} page(s) of {}", text.length(), document.getNumberOfPages(), filename);
            if (text.length() == 0) {
                throw new ExtractionException("PDF contains no extractable text");
            }
            return text.toString().strip();
        } catch (InvalidPasswordException ex) {
            throw new ExtractionException("PDF is password protected", ex);
        } catch (IOException ex) {
            throw new ExtractionException("Error extracting text from PDF: " + ex.getMessage(), ex);
        }
    }
}
