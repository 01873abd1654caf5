package com.netcourier.enrichment.service.extraction;

import java.io.InputStream;

public interface DocumentTextExtractor {

    String extract(String filename, InputStream inputStream);
}
