package com.defai.backend.service.source;

import java.util.Optional;

/**
 * Produces the latest observation of one signal kind for a token. An empty result means the
 * source has nothing for the token right now; an exception means the source failed.
 */
@FunctionalInterface
public interface SignalSource<T> {

    Optional<T> fetch(String token) throws Exception;
}
