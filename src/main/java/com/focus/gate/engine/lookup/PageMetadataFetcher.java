package com.focus.gate.engine.lookup;

import com.focus.gate.dto.PageMetadata;

import java.util.Optional;

public interface PageMetadataFetcher {

    Optional<PageMetadata> fetch(String url);
}
