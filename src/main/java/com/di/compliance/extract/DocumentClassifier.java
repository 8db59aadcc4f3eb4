package com.di.compliance.extract;

import com.di.compliance.exception.ExtractionException;
import com.di.compliance.model.RecordType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Decides which record type an unstructured document describes.
 *
 * <p>Filename prefix first ({@code ncr}, {@code ins}, {@code mnt}); otherwise keyword search in the text.
 * More than one keyword family matching is ambiguous; none matching is unclassifiable.
 */
@Component
public class DocumentClassifier {

    /** An {@code NCR} mention only counts near the top of the document, where the report title sits. */
    static final int NCR_HEADER_WINDOW = 500;

    public RecordType classify(String filename, String text) {
        RecordType byName = byFilenamePrefix(filename);
        if (byName != null) {
            return byName;
        }

        String upper = text == null ? "" : text.toUpperCase(Locale.ROOT);
        List<RecordType> matches = new ArrayList<>();
        if (upper.contains("NON-CONFORMANCE") || upper.contains("NON CONFORMANCE")
                || upper.substring(0, Math.min(NCR_HEADER_WINDOW, upper.length())).contains("NCR")) {
            matches.add(RecordType.NCR);
        }
        if (upper.contains("INSPECTION CERTIFICATE")) {
            matches.add(RecordType.INSPECTION);
        }
        if (upper.contains("WORK ORDER")) {
            matches.add(RecordType.MAINTENANCE);
        }

        if (matches.isEmpty()) {
            throw new ExtractionException(ExtractionException.Reason.UNCLASSIFIABLE, filename,
                    "no filename prefix and no NCR, inspection-certificate or work-order keywords");
        }
        if (matches.size() > 1) {
            throw new ExtractionException(ExtractionException.Reason.LOW_CONFIDENCE, filename,
                    "ambiguous classification " + matches);
        }
        return matches.get(0);
    }

    static RecordType byFilenamePrefix(String filename) {
        if (filename == null) {
            return null;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.startsWith("ncr")) {
            return RecordType.NCR;
        }
        if (lower.startsWith("ins")) {
            return RecordType.INSPECTION;
        }
        if (lower.startsWith("mnt")) {
            return RecordType.MAINTENANCE;
        }
        return null;
    }
}
