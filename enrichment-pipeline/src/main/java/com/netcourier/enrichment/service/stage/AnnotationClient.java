package com.netcourier.enrichment.service.stage;

import com.netcourier.enrichment.model.Annotation;

public interface AnnotationClient {

    StageResponse<Annotation> annotate(String text, String language, Deadline deadline);
}
