package com.dcruver.docguide.reference;

import com.dcruver.docguide.address.AddressParser;
import com.dcruver.docguide.exception.InvalidAddressException;
import com.dcruver.docguide.markdown.Slugger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds {@code @/path.md#section} and {@code @#section} references in document text.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReferenceExtractor {

    private static final Pattern REFERENCE = Pattern.compile(
        "@(?:/[^\\s\\]),;:!?#]+(?:#[^\\s\\]),;:!?]*)?|#[^\\s\\]),;:!?]*)");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.!?]+$");
    private static final Pattern REPEATED_SLASHES = Pattern.compile("/+");

    private final AddressParser addressParser;

    /**
     * Distinct reference tokens in order of first appearance, {@code @} included.
     */
    public List<String> extractReferences(String content) {
        Set<String> refs = new LinkedHashSet<>();
        Matcher matcher = REFERENCE.matcher(content);
        while (matcher.find()) {
            String ref = TRAILING_PUNCTUATION.matcher(matcher.group()).replaceAll("");
            if (ref.length() > 1 && !ref.equals("@#")) {
                refs.add(ref);
            }
        }
        return new ArrayList<>(refs);
    }

    /**
     * Resolve tokens against the document they were found in. {@code @#slug} points into the
     * base document; a path without extension gets {@code .md}. Unusable tokens are dropped.
     */
    public List<NormalizedReference> normalizeReferences(List<String> refs, String baseDocumentPath) {
        List<NormalizedReference> normalized = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (String ref : refs) {
            NormalizedReference reference = normalize(ref, baseDocumentPath);
            if (reference != null && seen.add(reference.getTarget())) {
                normalized.add(reference);
            }
        }
        return normalized;
    }

    private NormalizedReference normalize(String ref, String baseDocumentPath) {
        String body = ref.startsWith("@") ? ref.substring(1) : ref;
        int hash = body.indexOf('#');
        String pathPart = hash >= 0 ? body.substring(0, hash) : body;
        String sectionPart = hash >= 0 ? body.substring(hash + 1) : "";

        String documentPath;
        if (pathPart.isEmpty()) {
            if (baseDocumentPath == null) {
                log.debug("Dropping {}: no base document for a section-only reference", ref);
                return null;
            }
            documentPath = baseDocumentPath;
        } else {
            documentPath = REPEATED_SLASHES.matcher("/" + pathPart).replaceAll("/");
            if (!documentPath.toLowerCase(Locale.ROOT).endsWith(".md")) {
                documentPath = documentPath + ".md";
            }
        }

        try {
            documentPath = addressParser.parseDocumentAddress(documentPath).getPath();
        } catch (InvalidAddressException e) {
            log.debug("Dropping {}: {}", ref, e.getMessage());
            return null;
        }

        String slug = sectionPart.isBlank() ? null : Slugger.normalize(sectionPart);
        return new NormalizedReference(ref, documentPath, slug);
    }
}
