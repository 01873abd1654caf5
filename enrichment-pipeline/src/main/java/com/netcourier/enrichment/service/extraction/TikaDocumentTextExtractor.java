package com.netcourier.enrichment.service.extraction;

import com.netcourier.enrichment.model.ErrorCode;
import com.netcourier.enrichment.service.PipelineException;
import org.apache.tika.metadata.Metadata;
import org.apache.tika.metadata.TikaCoreProperties;
import org.apache.tika.parser.AutoDetectParser;
import org.apache.tika.parser.ParseContext;
import org.apache.tika.sax.BodyContentHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.InputStream;
import java.util.Optional;

@Component
public class TikaDocumentTextExtractor implements DocumentTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(TikaDocumentTextExtractor.class);

    @Override
    public String extract(String filename, InputStream inputStream) {
        try {
            BodyContentHandler handler = new BodyContentHandler(-1);
            Metadata metadata = new Metadata();
            metadata.set(TikaCoreProperties.RESOURCE_NAME_KEY, filename);
            AutoDetectParser parser = new AutoDetectParser();
            parser.parse(inputStream, handler, metadata, new ParseContext());
            String text = Optional.ofNullable(handler.toString())
                    .map(String::trim)
                    .orElse("");
            log.debug("Extracted {} characters of raw text from {} ({})", text.length(), filename,
                    metadata.get(Metadata.CONTENT_TYPE));
            return text;
        } catch (Exception e) {
            log.error("Failed to extract text from document {}", filename, e);
            throw new PipelineException(ErrorCode.STAGE_REJECTED, "Failed to read document " + filename, e);
        }
    }
}
