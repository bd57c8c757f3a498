package com.jreinhal.tieredrag.extraction.tier;

import com.jreinhal.tieredrag.extraction.ExtractionEmptyException;
import com.jreinhal.tieredrag.extraction.ExtractionTier;
import com.jreinhal.tieredrag.extraction.ExtractionTierClient;
import com.jreinhal.tieredrag.extraction.PageTextCleaner;
import com.jreinhal.tieredrag.extraction.TierOutput;
import com.jreinhal.tieredrag.extraction.TierSettings;
import com.jreinhal.tieredrag.extraction.TierUnavailableException;
import com.jreinhal.tieredrag.util.LogSanitizer;
import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.parsers.SAXParserFactory;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.tika.Tika;
import org.apache.tika.exception.TikaException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.xml.sax.SAXException;

/**
 * Local, zero-cost text extraction. PDFs are read page by page with PDFBox; every other
 * format goes through Tika and is split into pages on form feeds. Page text is passed through
 * {@link PageTextCleaner} before it is returned for scoring.
 *
 * <p>Scanned PDFs carry no text layer and fail with {@link ExtractionEmptyException}, which
 * sends the document on to the vision tiers.</p>
 */
@Component
public class LocalTextTierClient implements ExtractionTierClient {
    private static final Logger log = LoggerFactory.getLogger(LocalTextTierClient.class);
    private static final String PDF_MIME = "application/pdf";

    private final Tika tika = new Tika();

    @Override
    public boolean supports(ExtractionTier tier) {
        return tier == ExtractionTier.FAST;
    }

    @Override
    public TierOutput extract(byte[] content, String filename, TierSettings settings) {
        long start = System.nanoTime();
        ExtractionTier tier = settings.tier();
        List<String> pages;
        try {
            String mimeType = detectMimeType(content, filename);
            log.debug("Local extraction of {} as {}", LogSanitizer.sanitize(filename), mimeType);
            pages = PDF_MIME.equals(mimeType) ? pdfPages(content, tier) : tikaPages(content, filename);
            pages = PageTextCleaner.cleanPages(pages);
        } catch (IOException | TikaException | SAXException e) {
            throw new ExtractionEmptyException(tier, "unreadable document: " + e.getMessage(), e);
        }
        if (pages.stream().allMatch(String::isBlank)) {
            throw new ExtractionEmptyException(tier, "no text layer found");
        }
        Duration duration = Duration.ofNanos(System.nanoTime() - start);
        return new TierOutput(pages, pages.size() * settings.costPerPage(), duration);
    }

    private String detectMimeType(byte[] bytes, String filename) throws IOException {
        try (InputStream is = new BufferedInputStream(new ByteArrayInputStream(bytes))) {
            return this.tika.detect(is, filename);
        }
    }

    private List<String> pdfPages(byte[] content, ExtractionTier tier) throws IOException {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            int pageCount = document.getNumberOfPages();
            List<String> pages = new ArrayList<>(pageCount);
            for (int page = 1; page <= pageCount; page++) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new TierUnavailableException(tier, "interrupted at page " + page);
                }
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                pages.add(stripper.getText(document).strip());
            }
            return pages;
        }
    }

    private List<String> tikaPages(byte[] content, String filename) throws IOException, TikaException, SAXException {
        AutoDetectParser parser = new AutoDetectParser();
        ParseContext context = new ParseContext();
        context.set(SAXParserFactory.class, hardenedSaxParserFactory());
        Metadata metadata = new Metadata();
        if (filename != null) {
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
        }
        BodyContentHandler handler = new BodyContentHandler(-1);
        parser.parse(new ByteArrayInputStream(content), handler, metadata, context);
        List<String> pages = new ArrayList<>();
        for (String page : handler.toString().split("\f")) {
            pages.add(page.strip());
        }
        return pages;
    }

    private static SAXParserFactory hardenedSaxParserFactory() throws SAXException {
        SAXParserFactory factory = SAXParserFactory.newInstance();
        try {
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            throw new SAXException("Unable to harden XML parser", e);
        }
        return factory;
    }
}
