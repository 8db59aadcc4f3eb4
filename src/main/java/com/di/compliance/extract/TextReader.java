package com.di.compliance.extract;

import com.di.compliance.exception.ExtractionException;
import com.di.compliance.source.RawDocument;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Full text of an unstructured document: PDF text layer via PDFBox, otherwise strict UTF-8.
 */
@Slf4j
@Component
public class TextReader {

    private static final byte[] PDF_MAGIC = {'%', 'P', 'D', 'F'};

    public String read(RawDocument document) {
        byte[] bytes;
        try (InputStream in = document.content().openStream()) {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            throw new ExtractionException(ExtractionException.Reason.UNREADABLE, document.filename(),
                    "cannot read bytes: " + e.getMessage(), e);
        }
        return isPdf(bytes) ? pdfText(bytes, document.filename()) : utf8Text(bytes, document.filename());
    }

    private static String pdfText(byte[] bytes, String filename) {
        try (PDDocument pdf = PDDocument.load(bytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            String text = stripper.getText(pdf);
            log.debug("[EXTRACT] pdf file={} pages={} chars={}", filename, pdf.getNumberOfPages(), text.length());
            return text;
        } catch (IOException e) {
            throw new ExtractionException(ExtractionException.Reason.UNREADABLE, filename,
                    "cannot open PDF: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            // PDFBox reports some structural damage unchecked
            throw new ExtractionException(ExtractionException.Reason.UNREADABLE, filename,
                    "damaged PDF: " + e, e);
        }
    }

    private static String utf8Text(byte[] bytes, String filename) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new ExtractionException(ExtractionException.Reason.UNREADABLE, filename,
                    "not a PDF and not valid UTF-8 text", e);
        }
    }

    private static boolean isPdf(byte[] bytes) {
        if (bytes.length < PDF_MAGIC.length) {
            return false;
        }
        for (int i = 0; i < PDF_MAGIC.length; i++) {
            if (bytes[i] != PDF_MAGIC[i]) {
                return false;
            }
        }
        return true;
    }
}
