package com.defai.backend.model;

public record ClassifiedPost(SocialPost post, SentimentClass sentiment) {
}
