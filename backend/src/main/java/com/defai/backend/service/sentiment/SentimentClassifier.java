package com.defai.backend.service.sentiment;

import com.defai.backend.model.SentimentClass;

/**
 * Turns one text unit into a sentiment class. Implementations may call remote models and
 * are always invoked under a time limit by the pipeline.
 */
public interface SentimentClassifier {

    SentimentClass classify(String text);
}
